/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.mei;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.Test;

import gov.sandia.tusk.extension.Concepts;
import gov.sandia.tusk.extension.Markers;

public class MEIDocumentTest
{
    public static MEIDocument sample ()
    {
        MEIDocument result = new MEIDocument ();
        Element mdiv  = result.root.add (MEI.MUSIC).add (MEI.BODY).add (new Element (MEI.MDIV, "m1"));
        Element score = mdiv.add (MEI.SCORE);
        Element measure = score.add (MEI.SECTION).add (MEI.MEASURE);
        Element layer = measure.add (MEI.STAFF_EL).set (MEI.N, "1").add (new Element (MEI.LAYER, "l1"));
        layer.add (new Element (MEI.NOTE, "n1")).set (MEI.PNAME, "c").set (MEI.OCT, "4").set (MEI.DUR, "4");
        layer.add (new Element (MEI.NOTE, "n2")).set (MEI.PNAME, "g").set (MEI.OCT, "4").set (MEI.DUR, "2");
        Element dynam = measure.add (new Element (MEI.DYNAM, "d1"));
        dynam.set (MEI.STARTID, "#n2");
        dynam.text = "mf";

        result.store.insert (Concepts.MARKERS, "n1", new Markers (Markers.CHORD_REPETITION));
        result.store.insert (Concepts.CHORD_MODE_INFO, "d1", "c:m");
        return result;
    }

    @Test
    public void testLookup ()
    {
        MEIDocument document = sample ();
        assertEquals (1, document.mdivs ().size ());
        assertNull (document.head ());

        Element n2 = document.find ("n2");
        assertNotNull (n2);
        assertSame (n2, document.resolve ("#n2"));
        assertSame (n2, document.resolve (document.find ("d1").get (MEI.STARTID)));
        assertNull (document.find ("nothing"));
        assertNull (document.find (""));
        assertEquals (MEI.LAYER, n2.parent.name);
        assertEquals (MEI.MEASURE, n2.ancestor (MEI.MEASURE).name);

        // Index follows edits made after a lookup.
        n2.setID ("renamed");
        assertNull (document.find ("n2"));
        assertSame (n2, document.find ("renamed"));
        assertTrue (document.ids ().contains ("renamed"));
    }

    @Test
    public void testRoundTrip () throws IOException
    {
        MEIDocument before = sample ();
        String xml = new MEIWriter ().toString (before);
        assertTrue (xml.contains ("<mei"));
        assertTrue (xml.contains ("tusk:ext,"));

        MEIDocument after = new MEIReader ().read (xml);
        assertEquals (before.store, after.store);
        assertEquals (before.body (), after.body ());
        assertEquals ("mf", after.find ("d1").getText ());
        assertEquals (MEI.VERSION, after.root.get ("meiversion"));

        // The label was consumed, and the original document was left alone.
        assertFalse (after.head ().has (MEI.LABEL));
        assertNull (before.head ());
    }

    @Test
    public void testNoEmbed () throws IOException
    {
        MEIWriter writer = new MEIWriter ();
        writer.embedStore = false;
        String xml = writer.toString (sample ());
        assertFalse (xml.contains ("tusk:ext,"));
        assertTrue (new MEIReader ().read (xml).store.isEmpty ());
    }

    @Test
    public void testRootLabel () throws IOException
    {
        MEIDocument before = sample ();
        before.root.set (MEI.LABEL, before.store.toLabel ());
        MEIWriter writer = new MEIWriter ();
        writer.embedStore = false;
        MEIDocument after = new MEIReader ().read (writer.toString (before));
        assertEquals (before.store, after.store);
        assertFalse (after.root.has (MEI.LABEL));
    }

    @Test(expected = IOException.class)
    public void testWrongRoot () throws IOException
    {
        new MEIReader ().read ("<score><note/></score>");
    }

    @Test(expected = IOException.class)
    public void testMalformed () throws IOException
    {
        new MEIReader ().read ("<mei><music></mei>");
    }

    @Test
    public void testDescendants ()
    {
        MEIDocument document = sample ();
        List<Element> notes = document.root.descendants (MEI.NOTE);
        assertEquals (2, notes.size ());
        assertEquals ("n1", notes.get (0).id ());
        assertEquals (960, notes.get (0).get (MEI.DUR_PPQ, 960));
        assertEquals ("", notes.get (0).get (MEI.ACCID));

        Element copy = document.root.copy ();
        assertEquals (document.root, copy);
        assertNull (copy.parent);
        copy.descendants (MEI.NOTE).get (0).set (MEI.OCT, "5");
        assertFalse (document.root.equals (copy));
    }
}
