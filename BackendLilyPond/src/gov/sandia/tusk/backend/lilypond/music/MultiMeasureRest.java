/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    R with a duration, usually one measure scaled by a measure count as in R1*4.
**/
public class MultiMeasureRest extends Event
{
    public MultiMeasureRest (Duration duration)
    {
        this.duration = duration;
    }

    /**
        @return The number of measures written as the final integer multiplier, or 1 if there is none.
    **/
    public int measures ()
    {
        if (duration == null  ||  duration.multipliers.isEmpty ()) return 1;
        Rational last = duration.multipliers.get (duration.multipliers.size () - 1);
        if (last.denominator != 1) return 1;
        return (int) last.numerator;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderTweaks (renderer);
        renderer.append ('R');
        renderDuration (renderer);
        renderPostEvents (renderer);
    }
}
