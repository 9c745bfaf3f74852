/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import org.junit.Test;

import gov.sandia.tusk.backend.lilypond.music.Duration;
import gov.sandia.tusk.backend.lilypond.music.Rational;
import gov.sandia.tusk.db.AppData;
import gov.sandia.tusk.db.MVolatile;
import gov.sandia.tusk.mei.Element;
import gov.sandia.tusk.mei.MEI;

public class DurationsTest
{
    protected Durations durations = new Durations (AppData.settings ());

    @Test
    public void testDefaults ()
    {
        assertEquals (960,   durations.ppq);
        assertEquals (0.001, durations.tolerance, 0);
        assertEquals (8,     durations.maxDenominator);

        MVolatile settings = new MVolatile ();
        settings.set ("0.01", "tolerance");
        assertEquals (0.01, new Durations (settings).tolerance, 0);
    }

    @Test
    public void testPlainValues ()
    {
        for (int base = 1; base <= 32; base *= 2)
        {
            for (int dots = 0; dots <= 2; dots++)
            {
                Duration d = new Duration (base, dots);
                Element e = new Element (MEI.NOTE);
                durations.lower (d, Rational.ONE, e);
                assertEquals (base, e.get (MEI.DUR, 0));
                assertEquals (d, durations.unlower (e, Rational.ONE));
            }
        }
    }

    @Test
    public void testTupletFactor ()
    {
        Element e = new Element (MEI.NOTE);
        durations.lower (new Duration (8), new Rational (2, 3), e);
        assertEquals (320, e.get (MEI.DUR_PPQ, 0));
        assertEquals (new Duration (8), durations.unlower (e, new Rational (2, 3)));
    }

    @Test
    public void testMultiplierRecovery ()
    {
        Element e = new Element (MEI.NOTE);
        durations.lower (new Duration (4).multiply (new Rational (2, 3)), Rational.ONE, e);
        assertEquals (640, e.get (MEI.DUR_PPQ, 0));
        Duration d = durations.unlower (e, Rational.ONE);
        assertEquals ("4*2/3", d.toString ());
    }

    @Test
    public void testApproximation ()
    {
        assertEquals (new Duration (4, 1), durations.unlower (0.375));
        assertEquals (new Duration (1).multiply (new Rational (5, 4)), durations.unlower (1.25));

        // No base, dot count or small fraction lands within tolerance, so the nearest quarter count is used.
        assertEquals (new Duration (4), durations.unlower (0.3141));
        assertEquals (new Duration (4).multiply (new Rational (3)), durations.unlower (0.7403));
    }

    @Test
    public void testMissingDuration ()
    {
        assertNull (durations.unlower (new Element (MEI.NOTE), Rational.ONE));
    }
}
