/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

import gov.sandia.tusk.backend.lilypond.music.Duration;
import gov.sandia.tusk.backend.lilypond.music.LilyPondFile;
import gov.sandia.tusk.backend.lilypond.music.Sequential;
import gov.sandia.tusk.backend.lilypond.music.Simultaneous;
import gov.sandia.tusk.backend.lilypond.music.ToplevelMusic;
import gov.sandia.tusk.db.AppData;
import gov.sandia.tusk.db.MNode;
import gov.sandia.tusk.extension.Concepts;
import gov.sandia.tusk.extension.Markers;
import gov.sandia.tusk.mei.Element;
import gov.sandia.tusk.mei.MEI;
import gov.sandia.tusk.mei.MEIDocument;

public class ExportJobTest
{
    public static String save (MEIDocument document) throws Exception
    {
        return new ExportJob (AppData.settings ()).process (document);
    }

    public static String roundTrip (String source) throws Exception
    {
        return save (ImportJobTest.load (source));
    }

    /**
        Summarizes the notes of a document as pname, octave and duration.
    **/
    public static String pitches (MEIDocument document)
    {
        StringBuilder result = new StringBuilder ();
        for (Element n : ImportJobTest.notes (document))
        {
            result.append (n.get (MEI.PNAME)).append (n.get (MEI.OCT));
            result.append (n.get (MEI.ACCID_GES));
            result.append ('/').append (n.get (MEI.DUR)).append (' ');
        }
        return result.toString ();
    }

    protected static void assertSameNotes (String source) throws Exception
    {
        MEIDocument before = ImportJobTest.load (source);
        MEIDocument after  = ImportJobTest.load (save (before));
        assertEquals (pitches (before), pitches (after));
    }

    protected static int count (String text, String pattern)
    {
        int result = 0;
        int i = text.indexOf (pattern);
        while (i >= 0)
        {
            result++;
            i = text.indexOf (pattern, i + pattern.length ());
        }
        return result;
    }

    @Test
    public void testSimpleMelody () throws Exception
    {
        String text = roundTrip ("{ c'4 d'4 e'4 f'4 }");
        assertTrue (text.startsWith ("\\version \"2.24.0\""));
        assertTrue (text.contains ("{ c'4 d'4 e'4 f'4 }"));
        assertSameNotes ("{ c'4 d'4 e'4 f'4 }");
    }

    @Test
    public void testDurations () throws Exception
    {
        String text = roundTrip ("{ c4 d8 e16 f2 }");
        assertTrue (text.contains ("c4"));
        assertTrue (text.contains ("d8"));
        assertTrue (text.contains ("e16"));
        assertTrue (text.contains ("f2"));
        assertSameNotes ("{ c4. d8 e2.. f8*2/3 }");
    }

    @Test
    public void testVersionKept () throws Exception
    {
        assertTrue (roundTrip ("\\version \"2.22.1\"\n{ c4 }").startsWith ("\\version \"2.22.1\""));
    }

    @Test
    public void testCustomIDs () throws Exception
    {
        String text = roundTrip ("{ \\tweak id \"first\" c'4 d'4 }");
        assertEquals (1, count (text, "\\tweak id"));
        assertTrue (text.contains ("\\tweak id \"first\" c'4"));

        MEIDocument again = ImportJobTest.load (text);
        assertNotNull (again.find ("first"));

        // Generated identifiers never show up in the output.
        assertFalse (roundTrip ("{ c'4 d'4 }").contains ("\\tweak"));
    }

    @Test
    public void testCustomIDWithGeneratedPrefix () throws Exception
    {
        MEIDocument document = ImportJobTest.load ("{ \\tweak id \"ly-intro\" c'4 d'4 }");
        assertTrue (document.store.get (Concepts.MARKERS, "ly-intro").has (Markers.CUSTOM_ID));

        String text = save (document);
        assertTrue (text.contains ("\\tweak id \"ly-intro\" c'4"));
        assertNotNull (ImportJobTest.load (text).find ("ly-intro"));
    }

    @Test
    public void testLyricsInsideStaff () throws Exception
    {
        String text = roundTrip ("\\new Staff << \\new Voice = \"a\" { c''4 d''4 } \\new Lyrics \\lyricsto \"a\" { hi high } >>");
        assertTrue (text.contains ("\\lyricsto \"a\""));
        MEIDocument again = ImportJobTest.load (text);
        List<Element> syls = again.root.descendants (MEI.SYL);
        assertEquals (2, syls.size ());
        assertEquals ("hi",   syls.get (0).getText ());
        assertEquals ("high", syls.get (1).getText ());
    }

    @Test
    public void testLyricsWithoutVoice () throws Exception
    {
        String text = roundTrip ("\\new Lyrics \\lyricmode { la4 la }");
        assertTrue (text.contains ("\\new Lyrics"));
        assertTrue (text.contains ("la4"));
        assertEquals (text, roundTrip (text));
    }

    @Test
    public void testSimultaneousVoices () throws Exception
    {
        MEIDocument document = ImportJobTest.load ("<< { c'4 d'4 } { e'4 f'4 } >>");
        LilyPondFile file = new ExportJob (AppData.settings ()).raise (document);
        assertEquals (1, file.items.size ());
        Simultaneous s = (Simultaneous) ((ToplevelMusic) file.items.get (0)).music;
        assertEquals (2, s.items.size ());
        assertEquals ("{ c'4 d'4 }", ((Sequential) s.items.get (0)).render ());
        assertEquals ("{ e'4 f'4 }", ((Sequential) s.items.get (1)).render ());
    }

    @Test
    public void testStaves () throws Exception
    {
        String source = "<< \\new Staff { c'4 } \\new Staff { d4 } >>";
        String text = roundTrip (source);
        assertEquals (2, count (text, "\\new Staff"));
        assertSameNotes (source);
    }

    @Test
    public void testRelative () throws Exception
    {
        String source = "\\relative c' { c4 g' c, b }";
        String text = roundTrip (source);
        assertTrue (text.contains ("\\relative c' { c4 g'4 c,4 b4 }"));
        assertSameNotes (source);
    }

    @Test
    public void testTransposeAndFixed () throws Exception
    {
        assertSameNotes ("\\transpose c d { c'4 e'4 bes4 }");
        assertSameNotes ("\\fixed c'' { c4 e g, }");
    }

    @Test
    public void testTuplet () throws Exception
    {
        String text = roundTrip ("{ \\times 2/3 { c8 d8 e8 } f4 }");
        assertTrue (text.contains ("\\tuplet 3/2 { c8 d8 e8 } f4"));
    }

    @Test
    public void testPlaceholders () throws Exception
    {
        String text = roundTrip ("{ c4 \\override NoteHead.color = #red d4 \\bar \"|.\" }");
        assertTrue (text.contains ("c4 \\override NoteHead.color = #red d4"));
        assertTrue (text.contains ("\\bar \"|.\""));
    }

    @Test
    public void testLyrics () throws Exception
    {
        String source = "{ c4 d4 e4 } \\addlyrics { hel -- lo world }";
        String text = roundTrip (source);
        assertTrue (text.contains ("\\addlyrics"));
        assertTrue (text.contains (ExportJob.MELISMA));

        MEIDocument again = ImportJobTest.load (text);
        List<Element> syls = again.root.descendants (MEI.SYL);
        assertEquals (3, syls.size ());
        assertEquals ("hel", syls.get (0).getText ());
        assertEquals ("d",   syls.get (0).get (MEI.CON));
        assertEquals ("t",   syls.get (1).get (MEI.WORDPOS));
        // The melisma directive is regenerated rather than stored.
        assertTrue (again.root.descendants (MEI.DIR).isEmpty ());

        MNode settings = AppData.settings ();
        settings.set ("0", "melisma");
        assertFalse (new ExportJob (settings).process (ImportJobTest.load (source)).contains ("melismaBusyProperties"));
    }

    @Test
    public void testHarmony () throws Exception
    {
        String source = "<< \\new ChordNames \\chordmode { c1 g:7 } \\new Staff { c'1 b1 } >>";
        String text = roundTrip (source);
        assertTrue (text.contains ("\\chordmode"));
        assertTrue (text.contains ("g:7"));

        List<Element> harms = ImportJobTest.load (text).root.descendants (MEI.HARM);
        assertEquals (2, harms.size ());
        assertEquals ("G7", harms.get (1).getText ());
    }

    @Test
    public void testForeignHarmony () throws Exception
    {
        MEIDocument document = ImportJobTest.load ("{ c'1 d'1 }");
        document.store.clear ();
        Element measure = document.root.descendants (MEI.MEASURE).get (0);
        Element c = measure.add (new Element (MEI.HARM, "h1"));
        c.set (MEI.TSTAMP, "1").set (MEI.STAFF, "1");
        c.text = "C";
        Element g = measure.add (new Element (MEI.HARM, "h2"));
        g.set (MEI.TSTAMP, "5").set (MEI.STAFF, "1");
        g.text = "G7";

        String text = save (document);
        assertTrue (text.contains ("\\new ChordNames"));
        assertTrue (text.contains ("\\new Staff"));
        assertTrue (text.contains ("g1:7"));

        List<Element> harms = ImportJobTest.load (text).root.descendants (MEI.HARM);
        assertEquals (2, harms.size ());
        assertEquals ("C",  harms.get (0).getText ());
        assertEquals ("G7", harms.get (1).getText ());
    }

    @Test
    public void testChordDurationPlacement ()
    {
        assertEquals ("g4:7",  ExportJob.withDuration ("g:7", new Duration (4, 0)));
        assertEquals ("c2/e",  ExportJob.withDuration ("c/e", new Duration (2, 0)));
        assertEquals ("r1",    ExportJob.withDuration ("r",   new Duration (1, 0)));
    }

    @Test
    public void testStable () throws Exception
    {
        String[] sources =
        {
            "{ c'4( d'8) e'8-. f'2\\f }",
            "\\score { \\new Staff \\relative c'' { \\clef treble \\time 3/4 a4 b c } \\layout { } }",
            "melody = { g4 a b c }\n\\score { \\new Staff \\melody }",
            "\\repeat volta 2 { c4 d4 } \\alternative { { e2 } { f2 } }"
        };
        for (String source : sources)
        {
            String once  = roundTrip (source);
            String twice = roundTrip (once);
            assertEquals (once, twice);
        }
    }

    @Test
    public void testForeignDocument () throws Exception
    {
        MEIDocument document = new MEIDocument ();
        Element mdiv  = document.root.add (MEI.MUSIC).add (MEI.BODY).add (MEI.MDIV);
        Element score = mdiv.add (MEI.SCORE);
        Element scoreDef = score.add (MEI.SCORE_DEF);
        scoreDef.set (MEI.METER_COUNT, "3");
        scoreDef.set (MEI.METER_UNIT,  "4");
        Element staffDef = scoreDef.add (MEI.STAFF_GRP).add (MEI.STAFF_DEF);
        staffDef.set (MEI.N, "1");
        staffDef.set (MEI.CLEF_SHAPE, "G");
        staffDef.set (MEI.CLEF_LINE,  "2");

        Element measure = score.add (MEI.SECTION).add (MEI.MEASURE);
        Element layer = measure.add (MEI.STAFF_EL).set (MEI.N, "1").add (MEI.LAYER);
        layer.set (MEI.N, "1");
        layer.add (new Element (MEI.NOTE, "n1")).set (MEI.PNAME, "c").set (MEI.OCT, "4").set (MEI.DUR, "4");
        layer.add (new Element (MEI.NOTE, "n2")).set (MEI.PNAME, "e").set (MEI.OCT, "4").set (MEI.DUR, "2");
        Element dynam = measure.add (new Element (MEI.DYNAM, "d1"));
        dynam.set (MEI.STARTID, "#n1");
        dynam.text = "f";

        String text = save (document);
        assertTrue (text.contains ("\\clef treble"));
        assertTrue (text.contains ("\\time 3/4"));
        assertTrue (text.contains ("c'4\\f e'2"));
        // Foreign identifiers are not LilyPond's to keep.
        assertFalse (text.contains ("\\tweak"));
    }
}
