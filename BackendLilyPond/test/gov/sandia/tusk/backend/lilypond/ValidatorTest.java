/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import gov.sandia.tusk.backend.lilypond.music.Grace;
import gov.sandia.tusk.backend.lilypond.music.LilyPondFile;
import gov.sandia.tusk.backend.lilypond.music.Sequential;
import gov.sandia.tusk.backend.lilypond.music.ToplevelMusic;
import gov.sandia.tusk.db.AppData;
import gov.sandia.tusk.language.ConversionException;

public class ValidatorTest
{
    protected static List<String> errors (String source) throws Exception
    {
        Validator v = new Validator ();
        v.items (Parser.parse (source).items);
        return v.errors;
    }

    /**
        Runs the full import and returns the exception it raised.
    **/
    protected static ConversionException rejected (String source) throws Exception
    {
        try
        {
            new ImportJob (AppData.settings ()).process (source);
        }
        catch (ConversionException e)
        {
            return e;
        }
        fail ("Expected rejection of " + source);
        return null;
    }

    @Test
    public void testValid () throws Exception
    {
        String source = "\\version \"2.24.0\"\n"
                      + "melody = { c'8( d'8 }\n"
                      + "\\score { { \\time 3/4 \\tempo 4 = 60 \\repeat volta 2 { c'8[ d'8] e'4( } \\alternative { { f'2) } { g'2) } } \\bar \"|.\" } }\n"
                      + "{ \\tuplet 3/2 { c8 d8 e8 } \\afterGrace 3/4 c4 { d16 } c4:16 }\n";
        assertTrue (errors (source).isEmpty ());
        Validator.validate (Parser.parse (source));
    }

    @Test
    public void testTimeSignature () throws Exception
    {
        ConversionException e = rejected ("<< \\new ChordNames \\chordmode { c2 g2 } \\new Staff { \\time 3/0 c'1 } >>");
        assertTrue (e.structural);
        assertTrue (e.getMessage ().contains ("denominator"));

        List<String> found = errors ("{ \\time 0/4 c'1 }");
        assertEquals (1, found.size ());
        assertTrue (found.get (0).contains ("numerator"));
    }

    @Test
    public void testRepeatCount () throws Exception
    {
        ConversionException e = rejected ("{ \\repeat volta 0 { c'4 d'4 } }");
        assertTrue (e.structural);
        assertTrue (e.getMessage ().contains ("Repeat count"));
    }

    @Test
    public void testAfterGrace () throws Exception
    {
        ConversionException e = rejected ("{ \\afterGrace 0/1 c'4 { d'16 } }");
        assertTrue (e.getMessage ().contains ("afterGrace"));

        // The grammar never builds a bodiless grace, so assemble one directly.
        LilyPondFile file = new LilyPondFile ();
        Sequential s = new Sequential ();
        s.items.add (new Grace ("grace", new Sequential ()));
        file.items.add (new ToplevelMusic (s));
        Validator v = new Validator ();
        v.items (file.items);
        assertEquals (1, v.errors.size ());
        assertTrue (v.errors.get (0).contains ("no notes"));
    }

    @Test
    public void testSpans () throws Exception
    {
        List<String> found = errors ("{ c'4( d'4 }");
        assertEquals (1, found.size ());
        assertEquals ("1 unterminated slur", found.get (0));

        found = errors ("{ c'8[ d'8 e'8] f'8] }");
        assertEquals (1, found.size ());
        assertEquals ("1 beam end without a start", found.get (0));

        found = errors ("{ c'4\\( d'4 }");
        assertEquals ("1 unterminated phrasing slur", found.get (0));

        // Each toplevel expression balances on its own.
        found = errors ("{ c'4( }\n{ d'4) }");
        assertEquals (2, found.size ());

        // A variable may hold half a span.
        assertTrue (errors ("half = { c'4( }").isEmpty ());
    }

    @Test
    public void testEverythingReported () throws Exception
    {
        ConversionException e = rejected ("{ \\time 0/4 \\repeat unfold 0 { c'4( } \\tuplet 3/2 { c8 d8 e8 } }");
        String message = e.getMessage ();
        assertTrue (message.contains ("numerator"));
        assertTrue (message.contains ("Repeat count"));
        assertTrue (message.contains ("slur"));
        assertFalse (message.contains ("Tuplet"));
    }

    @Test
    public void testTremolo ()
    {
        assertTrue  (Validator.validTremolo (""));
        assertTrue  (Validator.validTremolo ("0"));
        assertTrue  (Validator.validTremolo ("8"));
        assertTrue  (Validator.validTremolo ("32"));
        assertFalse (Validator.validTremolo ("4"));
        assertFalse (Validator.validTremolo ("12"));
    }
}
