/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    \partial: an upbeat of the given length before the first full measure.
**/
public class Partial extends Music
{
    public Duration duration;

    public Partial (Duration duration)
    {
        this.duration = duration;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\partial ").append (duration.toString ());
    }
}
