/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

public class Note extends Event
{
    public Pitch pitch;

    public Note (Pitch pitch)
    {
        this.pitch = pitch;
    }

    public Note (Pitch pitch, Duration duration)
    {
        this.pitch    = pitch;
        this.duration = duration;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderTweaks (renderer);
        renderer.append (pitch.toString ());
        renderDuration (renderer);
        renderPostEvents (renderer);
    }
}
