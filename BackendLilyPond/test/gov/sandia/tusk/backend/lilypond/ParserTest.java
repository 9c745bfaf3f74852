/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import gov.sandia.tusk.backend.lilypond.music.Duration;
import gov.sandia.tusk.backend.lilypond.music.LilyPondFile;
import gov.sandia.tusk.backend.lilypond.music.Music;
import gov.sandia.tusk.backend.lilypond.music.Note;
import gov.sandia.tusk.backend.lilypond.music.Pitch;
import gov.sandia.tusk.backend.lilypond.music.PropertyOp;
import gov.sandia.tusk.backend.lilypond.music.PropertyValue;
import gov.sandia.tusk.backend.lilypond.music.Rational;
import gov.sandia.tusk.backend.lilypond.music.Repeat;
import gov.sandia.tusk.backend.lilypond.music.Sequential;
import gov.sandia.tusk.backend.lilypond.music.ToplevelMusic;
import gov.sandia.tusk.backend.lilypond.music.Tuplet;
import gov.sandia.tusk.language.ParseException;

public class ParserTest
{
    protected static Music single (String source) throws ParseException
    {
        List<Music> items = Parser.parseMusicList (source);
        assertEquals (1, items.size ());
        return items.get (0);
    }

    @Test
    public void testSequential () throws ParseException
    {
        Sequential s = (Sequential) single ("{ c'4 d'4 e'4 f'4 }");
        assertEquals (4, s.items.size ());
        String steps = "";
        for (Music m : s.items)
        {
            Note n = (Note) m;
            steps += n.pitch.step;
            assertEquals (1, n.pitch.octave);
            assertEquals (new Duration (4), n.duration);
        }
        assertEquals ("cdef", steps);
        assertEquals ("{ c'4 d'4 e'4 f'4 }", s.render ());
    }

    @Test
    public void testDurations () throws ParseException
    {
        assertEquals (new Duration (4, 1), Parser.parseDuration ("4."));
        assertEquals (new Duration (2, 2), Parser.parseDuration ("2.."));

        Duration d = Parser.parseDuration ("1*3/4");
        assertEquals (1, d.base);
        assertEquals (new Rational (3, 4), d.factor ());
        assertEquals (new Rational (3, 4), d.length ());
        assertEquals ("1*3/4", d.toString ());

        try
        {
            Parser.parseDuration ("3");
            fail ("A base that is not a power of two should be rejected");
        }
        catch (ParseException e)
        {
            assertEquals (0, e.offset);
        }
    }

    @Test
    public void testPitch () throws ParseException
    {
        Pitch p = Parser.parsePitch ("fis''");
        assertEquals ('f', p.step);
        assertEquals (1.0, p.alteration, 0);
        assertEquals (2, p.octave);

        p = Parser.parsePitch ("bes,");
        assertEquals ('b', p.step);
        assertEquals (-1.0, p.alteration, 0);
        assertEquals (-1, p.octave);
    }

    @Test
    public void testTupletConventions () throws ParseException
    {
        Tuplet modern = (Tuplet) single ("\\tuplet 3/2 { c8 d8 e8 }");
        Tuplet legacy = (Tuplet) single ("\\times 2/3 { c8 d8 e8 }");
        assertEquals (3, legacy.numerator);
        assertEquals (2, legacy.denominator);
        assertEquals (modern, legacy);
        assertEquals (new Rational (2, 3), modern.factor ());
        assertEquals ("\\tuplet 3/2 { c8 d8 e8 }", legacy.render ());
    }

    @Test
    public void testTupletRatio ()
    {
        try
        {
            single ("\\tuplet 3/0 { c8 d8 e8 }");
            fail ("Zero denominator should be rejected");
        }
        catch (ParseException e)
        {
            assertEquals (8, e.offset);
        }

        try
        {
            single ("\\times 0/3 { c8 d8 e8 }");
            fail ("Zero numerator should be rejected");
        }
        catch (ParseException e)
        {
            assertEquals (7, e.offset);
        }

        try
        {
            single ("\\afterGrace 1/0 c4 { d16 }");
            fail ("Zero denominator should be rejected");
        }
        catch (ParseException e)
        {
            assertEquals (14, e.offset);
        }
    }

    @Test
    public void testRepeat () throws ParseException
    {
        Repeat r = (Repeat) single ("\\repeat volta 2 { c4 d4 } \\alternative { { e2 } { f2 } }");
        assertEquals ("volta", r.type);
        assertEquals (2, r.count);
        assertEquals (2, r.alternatives.size ());
        assertEquals (2, ((Sequential) r.body).items.size ());

        // Rendering reads back to the same tree.
        assertEquals (r, single (r.render ()));
    }

    @Test
    public void testPropertyOps () throws ParseException
    {
        PropertyOp o = (PropertyOp) single ("\\override Staff.TimeSignature.color = #red");
        assertEquals (PropertyOp.Type.OVERRIDE, o.type);
        assertEquals (3, o.path.segments.size ());
        assertEquals ("color", o.path.last ());
        assertEquals (PropertyValue.Kind.SCHEME, o.value.kind);

        o = (PropertyOp) single ("\\set Staff.instrumentName = \"Flute\"");
        assertEquals (PropertyOp.Type.SET, o.type);
        assertEquals (PropertyValue.Kind.STRING, o.value.kind);
        assertEquals ("Flute", o.value.text);

        o = (PropertyOp) single ("\\revert Staff.TimeSignature.color");
        assertEquals (PropertyOp.Type.REVERT, o.type);
        assertNull (o.value);
    }

    @Test
    public void testFile () throws ParseException
    {
        LilyPondFile file = Parser.parse ("\\version \"2.24.0\"\n{ c4 d4 }\n");
        assertEquals ("2.24.0", file.version);
        assertEquals (1, file.items.size ());
        assertTrue (file.items.get (0) instanceof ToplevelMusic);
    }

    @Test
    public void testFirstErrorStops ()
    {
        String source = "{ c4 }\n\\repeat bogus 2 { c4 }";
        try
        {
            Parser.parse (source);
            fail ("Unknown repeat type should be rejected");
        }
        catch (ParseException e)
        {
            assertEquals (15, e.offset);
            assertEquals (2, e.lineNumber (source));
            assertEquals (8, e.column);
            assertEquals ("\\repeat bogus 2 { c4 }", e.line);
        }
    }
}
