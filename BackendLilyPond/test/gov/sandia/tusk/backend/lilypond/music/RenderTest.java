/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import gov.sandia.tusk.backend.lilypond.Parser;
import gov.sandia.tusk.language.ParseException;

public class RenderTest
{
    protected static final String[] samples =
    {
        "{ c'4 d'8. e'16 f'2 }",
        "{ c4( d) e\\( f\\) g[ a] }",
        "{ c4\\< d e\\! f\\ff }",
        "{ c4-. d-> e^\\fermata f_\"dolce\" g-3 }",
        "{ <c e g>4 q8 <c-1 e-3>2 }",
        "{ r4 s4 R1*2 c\\rest }",
        "<< { c'4 d'4 } \\\\ { e4 f4 } >>",
        "\\relative c'' { a4 b c=''' d }",
        "\\transpose c ees { c4 d }",
        "\\tuplet 3/2 4 { c8 d e f g a }",
        "\\repeat volta 2 { c4 d } \\alternative { { e2 } { f2 } }",
        "\\grace { c16 d } e4",
        "\\afterGrace f1 { g16 a }",
        "\\new Staff \\with { instrumentName = \"Flute\" } { c4 }",
        "\\new Voice = \"melody\" { c4 }",
        "\\override Staff.TimeSignature.color = #red",
        "\\once \\override NoteHead.color = #(rgb-color 1 0 0)",
        "\\set Staff.instrumentName = \"Violin\"",
        "\\clef \"treble_8\"",
        "\\key d \\major",
        "\\time 2+3/8",
        "\\bar \"|.\"",
        "\\tempo \"Allegro\" 4 = 120",
        "\\mark \\default",
        "\\partial 8",
        "\\chordmode { c1:m7 g:7/b }",
        "\\drummode { bd4 sn <bd hh> }",
        "\\lyricmode { hel -- lo world __ _ }",
        "\\tweak color #blue c4",
        "c4^\\markup { \\bold loud }"
    };

    @Test
    public void testIdempotent () throws ParseException
    {
        for (String sample : samples)
        {
            List<Music> first = Parser.parseMusicList (sample);
            String text = render (first);
            List<Music> second = Parser.parseMusicList (text);
            assertEquals (sample, first, second);
            assertEquals (sample, text, render (second));
        }
    }

    protected static String render (List<Music> items)
    {
        Renderer r = new Renderer ();
        r.render (items);
        return r.toString ();
    }

    @Test
    public void testBlockLayout () throws ParseException
    {
        Music m = Parser.parseMusicList ("{ \\new Staff { c4 } \\new Staff { d4 } }").get (0);
        String text = m.render ();
        assertTrue (text.contains ("\n"));
        assertEquals (m, Parser.parseMusicList (text).get (0));
    }

    @Test
    public void testRendererOverride () throws ParseException
    {
        Music m = Parser.parseMusicList ("{ c4 d4 }").get (0);
        Renderer r = new Renderer ()
        {
            public boolean render (Music n)
            {
                if (! (n instanceof Note)) return false;
                append ("x");
                return true;
            }
        };
        m.render (r);
        assertEquals ("{ x x }", r.toString ());
    }

    @Test
    public void testVisitor () throws ParseException
    {
        Music m = Parser.parseMusicList ("{ c4 \\tuplet 3/2 { d8 e f } << g4 a4 >> }").get (0);
        final int[] notes = new int[1];
        m.visit (new Visitor ()
        {
            public boolean visit (Music n)
            {
                if (n instanceof Note) notes[0]++;
                return ! (n instanceof Simultaneous);
            }
        });
        assertEquals (4, notes[0]);
    }

    @Test
    public void testQuoting ()
    {
        assertEquals ("\"a \\\"b\\\"\"", Renderer.quote ("a \"b\""));
        assertTrue  (Renderer.isWord ("Flute"));
        assertTrue  (Renderer.isWord ("treble-ish"));
        assertFalse (Renderer.isWord ("treble_8"));
        assertFalse (Renderer.isWord ("a--b"));
        assertEquals ("\"treble_8\"", Renderer.word ("treble_8"));
    }
}
