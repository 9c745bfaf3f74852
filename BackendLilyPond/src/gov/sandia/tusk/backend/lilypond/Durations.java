/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import org.apache.log4j.Logger;

import gov.sandia.tusk.backend.lilypond.music.Duration;
import gov.sandia.tusk.backend.lilypond.music.Rational;
import gov.sandia.tusk.db.MNode;
import gov.sandia.tusk.mei.Element;
import gov.sandia.tusk.mei.MEI;

/**
    Moves durations between the written form (base, dots, multipliers) and the document form.
    The document keeps the written base and dots in dur and dots, and the sounding length in
    pulses in dur.ppq. Multipliers are never stored directly. They are recovered from the
    ratio between sounding and written length.
**/
public class Durations
{
    public int    ppq;             // pulses per quarter note
    public double tolerance;       // in whole notes
    public int    maxDenominator;  // largest denominator tried when recovering a multiplier

    private static Logger logger = Logger.getLogger (Durations.class);

    public Durations (MNode settings)
    {
        ppq            = settings.getOrDefault (960,   "ppq");
        tolerance      = settings.getOrDefault (0.001, "tolerance");
        maxDenominator = settings.getOrDefault (8,     "maxDenominator");
    }

    public long pulses (Rational wholeNotes)
    {
        return Math.round (wholeNotes.doubleValue () * 4 * ppq);
    }

    public double wholeNotes (long pulses)
    {
        return pulses / (4.0 * ppq);
    }

    /**
        Writes the given duration into the element.
        @param factor Time scaling applied by enclosing tuplets. It affects only the sounding length.
    **/
    public void lower (Duration d, Rational factor, Element e)
    {
        e.set (MEI.DUR, d.base);
        if (d.dots > 0) e.set (MEI.DOTS, d.dots);
        e.set (MEI.DUR_PPQ, pulses (d.length ().multiply (factor)));
    }

    /**
        Recovers the written duration of an element.
        @param factor Time scaling applied by enclosing tuplets, divided out before matching.
        @return The duration, or null if the element carries no duration at all.
    **/
    public Duration unlower (Element e, Rational factor)
    {
        int base = e.get (MEI.DUR, 0);
        int dots = e.get (MEI.DOTS, 0);
        boolean written = Duration.isBase (base);
        if (! e.has (MEI.DUR_PPQ))
        {
            if (written) return new Duration (base, dots);
            return null;
        }

        double target = wholeNotes (e.get (MEI.DUR_PPQ, 0)) / factor.doubleValue ();
        if (written)
        {
            Duration result = new Duration (base, dots);
            double length = result.writtenLength ().doubleValue ();
            if (Math.abs (length - target) <= tolerance) return result;

            Rational m = ratio (target / length, length);
            if (m != null) return result.multiply (m);
            logger.warn ("Sounding length of " + e.id () + " does not fit its written duration " + result + "; approximating");
        }
        return unlower (target);
    }

    /**
        Finds a written duration for a length given in whole notes.
        Tries plain and dotted bases first, then a multiplier on a whole note,
        and finally rounds to a whole number of quarter notes.
    **/
    public Duration unlower (double target)
    {
        for (int base = 1; base <= Duration.MAX_BASE; base *= 2)
        {
            for (int dots = 0; dots <= 2; dots++)
            {
                Duration d = new Duration (base, dots);
                if (Math.abs (d.writtenLength ().doubleValue () - target) <= tolerance) return d;
            }
        }

        Rational m = ratio (target, 1);
        if (m != null) return new Duration (1).multiply (m);

        long beats = Math.max (1, Math.round (target * 4));
        logger.warn ("Length " + target + " has no exact written form; using " + beats + " quarter notes");
        Duration result = new Duration (4);
        if (beats > 1) result.multiply (new Rational (beats));
        return result;
    }

    /**
        Scans denominators for a fraction close to the given ratio.
        @param scale Converts error in the ratio to error in whole notes.
        @return The fraction, or null if none lands within tolerance.
    **/
    public Rational ratio (double value, double scale)
    {
        for (int d = 1; d <= maxDenominator; d++)
        {
            long n = Math.round (value * d);
            if (n <= 0) continue;
            if (Math.abs ((double) n / d - value) * scale <= tolerance) return new Rational (n, d);
        }
        return null;
    }
}
