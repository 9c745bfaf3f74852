/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.util.List;

import org.junit.Test;

import gov.sandia.tusk.db.AppData;
import gov.sandia.tusk.extension.Concepts;
import gov.sandia.tusk.extension.LyricsInfo;
import gov.sandia.tusk.extension.Markers;
import gov.sandia.tusk.extension.ExtensionStore;
import gov.sandia.tusk.language.ConversionException;
import gov.sandia.tusk.language.ParseException;
import gov.sandia.tusk.mei.Element;
import gov.sandia.tusk.mei.MEI;
import gov.sandia.tusk.mei.MEIDocument;

public class ImportJobTest
{
    public static MEIDocument load (String source) throws ParseException, ConversionException
    {
        return new ImportJob (AppData.settings ()).process (source);
    }

    public static List<Element> notes (MEIDocument document)
    {
        return document.root.descendants (MEI.NOTE);
    }

    @Test
    public void testSimpleMelody () throws Exception
    {
        MEIDocument document = load ("{ c'4 d'4 e'4 f'4 }");
        assertEquals (1, document.mdivs ().size ());
        assertEquals (1, document.root.descendants (MEI.STAFF_EL).size ());
        assertEquals (1, document.root.descendants (MEI.LAYER).size ());

        List<Element> notes = notes (document);
        assertEquals (4, notes.size ());
        String steps = "";
        for (Element n : notes)
        {
            steps += n.get (MEI.PNAME);
            assertEquals ("4", n.get (MEI.OCT));
            assertEquals ("4", n.get (MEI.DUR));
            assertEquals (960, n.get (MEI.DUR_PPQ, 0));
            assertTrue (n.id ().startsWith (ImportJob.AUTO_PREFIX));
        }
        assertEquals ("cdef", steps);

        assertTrue (document.store.contains (Concepts.FORMAT_ORIGIN, document.root.id ()));
        Markers m = document.store.get (Concepts.MARKERS, document.mdivs ().get (0).id ());
        assertTrue (m.has (Markers.IMPLICIT_SCORE));
    }

    @Test
    public void testDurationCarriesForward () throws Exception
    {
        List<Element> notes = notes (load ("{ c8 d e4. f }"));
        assertEquals ("8", notes.get (1).get (MEI.DUR));
        assertEquals ("4", notes.get (3).get (MEI.DUR));
        assertEquals ("1", notes.get (3).get (MEI.DOTS));
    }

    @Test
    public void testRelative () throws Exception
    {
        List<Element> notes = notes (load ("\\relative c' { c4 g' c, b }"));
        String result = "";
        for (Element n : notes) result += n.get (MEI.PNAME) + n.get (MEI.OCT) + " ";
        assertEquals ("c4 g4 c4 b3 ", result);
    }

    @Test
    public void testCustomID () throws Exception
    {
        MEIDocument document = load ("{ \\tweak id \"first\" c'4( d'4) }");
        Element first = document.find ("first");
        assertNotNull (first);
        assertEquals (MEI.NOTE, first.name);
        assertFalse (document.store.contains (Concepts.TWEAKS, "first"));

        // Controls anchor to the renamed element.
        Element slur = document.root.descendants (MEI.SLUR).get (0);
        assertEquals ("#first", slur.get (MEI.STARTID));
        assertEquals ("#" + notes (document).get (1).id (), slur.get (MEI.ENDID));
    }

    @Test
    public void testOtherTweaksKept () throws Exception
    {
        MEIDocument document = load ("{ \\tweak color #red c'4 }");
        Element note = notes (document).get (0);
        assertEquals (1, document.store.get (Concepts.TWEAKS, note.id ()).items.size ());
    }

    @Test
    public void testLyrics () throws Exception
    {
        MEIDocument document = load ("{ c4 d4 e4 f4 } \\addlyrics { one two three four }");
        List<Element> notes = notes (document);
        String[] words = {"one", "two", "three", "four"};
        for (int i = 0; i < 4; i++)
        {
            Element syl = notes.get (i).child (MEI.VERSE).child (MEI.SYL);
            assertEquals (words[i], syl.getText ());
            assertEquals ("1", syl.parent.get (MEI.N));
        }

        Element layer = document.root.descendants (MEI.LAYER).get (0);
        LyricsInfo info = document.store.get (Concepts.LYRICS_INFO, layer.id ());
        assertEquals (LyricsInfo.ADDLYRICS, info.style);
        assertEquals (1, info.count);
    }

    @Test
    public void testHyphens () throws Exception
    {
        MEIDocument document = load ("{ c4 d4 e4 } \\addlyrics { hel -- lo world }");
        List<Element> syls = document.root.descendants (MEI.SYL);
        assertEquals (3, syls.size ());
        assertEquals ("d", syls.get (0).get (MEI.CON));
        assertEquals ("i", syls.get (0).get (MEI.WORDPOS));
        assertEquals ("t", syls.get (1).get (MEI.WORDPOS));
        assertEquals ("",  syls.get (2).get (MEI.WORDPOS));
    }

    @Test
    public void testLyricsInsideStaff () throws Exception
    {
        MEIDocument document = load ("\\new Staff << \\new Voice = \"a\" { c''4 d''4 } \\new Lyrics \\lyricsto \"a\" { hi high } >>");
        assertEquals (1, document.root.descendants (MEI.LAYER).size ());
        assertTrue (document.root.descendants (MEI.DIR).isEmpty ());
        List<Element> notes = notes (document);
        assertEquals ("hi",   notes.get (0).child (MEI.VERSE).child (MEI.SYL).getText ());
        assertEquals ("high", notes.get (1).child (MEI.VERSE).child (MEI.SYL).getText ());

        // Same without an enclosing staff.
        document = load ("<< \\new Voice = \"v\" { c'4 d'4 } \\new Lyrics \\lyricsto \"v\" { la lo } >>");
        assertEquals (1, document.root.descendants (MEI.LAYER).size ());
        assertEquals (2, document.root.descendants (MEI.SYL).size ());
    }

    @Test
    public void testLyricsWithoutVoice () throws Exception
    {
        MEIDocument document = load ("\\new Lyrics \\lyricmode { la4 la }");
        assertTrue (document.root.descendants (MEI.SYL).isEmpty ());
        List<Element> dirs = document.root.descendants (MEI.DIR);
        assertEquals (1, dirs.size ());
        String label = dirs.get (0).get (MEI.LABEL);
        assertEquals (Labels.MUSIC, Labels.placeholder (label));
        assertTrue (Labels.decode (label).startsWith ("\\new Lyrics"));
    }

    @Test
    public void testPlaceholder () throws Exception
    {
        MEIDocument document = load ("{ c4 \\override NoteHead.color = #red d4 \\revert NoteHead.color }");
        List<Element> notes = notes (document);
        List<Element> dirs  = document.root.descendants (MEI.DIR);
        assertEquals (2, dirs.size ());

        Element before = dirs.get (0);
        String label = before.get (MEI.LABEL);
        assertEquals (Labels.PROP, Labels.placeholder (label));
        assertTrue (Labels.decode (label).startsWith ("\\override NoteHead.color"));
        assertEquals ("#" + notes.get (1).id (), before.get (MEI.STARTID));
        assertTrue (document.store.contains (Concepts.PROPERTY_OPS, before.id ()));

        // Nothing follows the last one, so it anchors to its layer.
        Element layer = document.root.descendants (MEI.LAYER).get (0);
        assertEquals ("#" + layer.id (), dirs.get (1).get (MEI.STARTID));
        assertEquals ("1", dirs.get (1).get (MEI.STAFF));
    }

    @Test
    public void testMelismaDirectiveDropped () throws Exception
    {
        MEIDocument document = load ("{ \\set melismaBusyProperties = #'() c4 }");
        assertTrue (document.root.descendants (MEI.DIR).isEmpty ());
    }

    @Test
    public void testTuplet () throws Exception
    {
        MEIDocument document = load ("{ \\tuplet 3/2 { c8 d8 e8 } f4 }");
        List<Element> notes = notes (document);
        Element span = document.root.descendants (MEI.TUPLET_SPAN).get (0);
        assertEquals ("3", span.get (MEI.NUM));
        assertEquals ("2", span.get (MEI.NUMBASE));
        assertEquals ("#" + notes.get (0).id (), span.get (MEI.STARTID));
        assertEquals ("#" + notes.get (2).id (), span.get (MEI.ENDID));
        assertEquals (320, notes.get (0).get (MEI.DUR_PPQ, 0));
        assertEquals ("8", notes.get (0).get (MEI.DUR));
        assertEquals (960, notes.get (3).get (MEI.DUR_PPQ, 0));
    }

    @Test
    public void testVoices () throws Exception
    {
        MEIDocument document = load ("<< { c'4 d'4 } { e'4 f'4 } >>");
        assertEquals (1, document.root.descendants (MEI.STAFF_EL).size ());
        List<Element> layers = document.root.descendants (MEI.LAYER);
        assertEquals (2, layers.size ());
        assertEquals ("e", layers.get (1).children (MEI.NOTE).get (0).get (MEI.PNAME));
    }

    @Test
    public void testStaves () throws Exception
    {
        MEIDocument document = load ("<< \\new Staff { c4 } \\new Staff { d4 } >>");
        Element group = document.root.descendants (MEI.STAFF_GRP).get (0);
        assertEquals (2, group.children (MEI.STAFF_DEF).size ());
        assertTrue (document.store.get (Concepts.MARKERS, group.id ()).has (Markers.SIMULTANEOUS));
        assertEquals (2, document.root.descendants (MEI.STAFF_EL).size ());
    }

    @Test
    public void testNoOrphanRecords () throws Exception
    {
        MEIDocument document = load
        (
            "melody = \\relative c' { \\tweak id \"n1\" c4( d) \\tuplet 3/2 { e8 f g } \\grace b16 c2 }\n" +
            "\\score { \\new Staff \\melody \\layout { } }\n"
        );
        ExtensionStore store = document.store;
        assertFalse (store.isEmpty ());
        for (String id : store.ids ()) assertNotNull ("Record for missing element " + id, document.find (id));
        assertNotNull (document.find ("n1"));
    }

    @Test
    public void testParseErrorLocated () throws ConversionException
    {
        String source = "{ c4 }\n\\repeat bogus 2 { c4 }";
        try
        {
            load (source);
            fail ("Bad input should stop the import");
        }
        catch (ParseException e)
        {
            assertEquals (8, e.column);
            assertEquals (2, e.lineNumber (source));
        }
    }

    @Test
    public void testHarmony () throws Exception
    {
        MEIDocument document = load ("<< \\new ChordNames \\chordmode { c1 g:7 } \\new Staff { c'1 b1 } >>");
        List<Element> harms = document.root.descendants (MEI.HARM);
        assertEquals (2, harms.size ());
        assertEquals ("C",  harms.get (0).getText ());
        assertEquals ("G7", harms.get (1).getText ());
        assertEquals ("1",  harms.get (0).get (MEI.TSTAMP));
        assertEquals ("5",  harms.get (1).get (MEI.TSTAMP));
        assertEquals ("g:7", document.store.get (Concepts.CHORD_MODE_INFO, harms.get (1).id ()));
    }

    @Test
    public void testLabelRoundTrip () throws IOException
    {
        String label = Labels.encode (Labels.MUSIC, "\\mark \\default");
        assertEquals (Labels.MUSIC, Labels.placeholder (label));
        assertEquals ("\\mark \\default", Labels.decode (label));
        assertNull (Labels.placeholder ("something else"));
    }
}
