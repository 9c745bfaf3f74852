/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import gov.sandia.tusk.backend.lilypond.music.ChordModeEntry;
import gov.sandia.tusk.backend.lilypond.music.Pitch;
import gov.sandia.tusk.mei.Element;
import gov.sandia.tusk.mei.MEI;

public class SymbolsTest
{
    @Test
    public void testClefs ()
    {
        Element e = new Element (MEI.CLEF);
        assertTrue (Symbols.lowerClef ("bass", e));
        assertEquals ("F", e.get (MEI.SHAPE));
        assertEquals ("4", e.get (MEI.LINE));
        assertEquals ("bass", Symbols.raiseClef (e));

        e = new Element (MEI.CLEF);
        assertTrue (Symbols.lowerClef ("treble_8", e));
        assertEquals ("8", e.get (MEI.DIS));
        assertEquals ("below", e.get (MEI.DIS_PLACE));
        assertEquals ("treble_8", Symbols.raiseClef (e));

        // Names outside the table are left for the caller to preserve.
        assertFalse (Symbols.lowerClef ("GG", new Element (MEI.CLEF)));
        assertFalse (Symbols.lowerClef ("treble_(8)", new Element (MEI.CLEF)));

        e = new Element (MEI.CLEF);
        e.set (MEI.SHAPE, "G");
        e.set (MEI.LINE,  "3");
        assertNull (Symbols.raiseClef (e));
    }

    @Test
    public void testBars ()
    {
        assertEquals ("end",  Symbols.barForm ("|."));
        assertEquals (":|.",  Symbols.barStyle ("rptend"));
        assertNull (Symbols.barForm ("|.|"));
    }

    @Test
    public void testAccidentals ()
    {
        assertEquals ("s",   Symbols.accidental (1));
        assertEquals ("ff",  Symbols.accidental (-2));
        assertEquals ("1qs", Symbols.accidental (0.5));
        assertNull (Symbols.accidental (3));
        assertEquals (-1.5, Symbols.alteration ("3qf"), 0);
        assertEquals (0,    Symbols.alteration ("bogus"), 0);
    }

    @Test
    public void testChordSymbols ()
    {
        ChordModeEntry entry = new ChordModeEntry (new Pitch ('b', -1, 0));
        entry.modifiers = "7";
        assertEquals ("Bb7", Symbols.chordSymbol (entry));

        entry = new ChordModeEntry (new Pitch ('c', 0, 0));
        entry.modifiers = "m7";
        entry.inversion = new Pitch ('e', 0, 0);
        assertEquals ("Cm7/E", Symbols.chordSymbol (entry));

        assertEquals ("bes:7",  Symbols.chordModeText ("Bb7"));
        assertEquals ("c:m7/e", Symbols.chordModeText ("Cm7/E"));
        assertEquals ("fis",    Symbols.chordModeText ("F#"));
        assertNull (Symbols.chordModeText ("N.C."));
    }
}
