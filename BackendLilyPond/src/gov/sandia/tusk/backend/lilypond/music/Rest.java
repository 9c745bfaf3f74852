/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    An ordinary rest, or a pitched rest (c4\rest) when pitch is not null.
**/
public class Rest extends Event
{
    public Pitch pitch;

    public Rest (Duration duration)
    {
        this.duration = duration;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderTweaks (renderer);
        if (pitch == null)
        {
            renderer.append ('r');
            renderDuration (renderer);
        }
        else
        {
            renderer.append (pitch.toString ());
            renderDuration (renderer);
            renderer.append ("\\rest");
        }
        renderPostEvents (renderer);
    }
}
