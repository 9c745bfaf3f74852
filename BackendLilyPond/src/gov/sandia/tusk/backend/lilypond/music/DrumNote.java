/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    A named percussion instrument hit, as written in drum mode.
**/
public class DrumNote extends Event
{
    public String name;

    public DrumNote (String name)
    {
        this.name = name;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderTweaks (renderer);
        renderer.append (name);
        renderDuration (renderer);
        renderPostEvents (renderer);
    }
}
