/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import gov.sandia.tusk.db.MNode;
import gov.sandia.tusk.db.MVolatile;

public class ExtensionStoreTest
{
    protected static ExtensionStore sample ()
    {
        ExtensionStore result = new ExtensionStore ();

        StaffContext staff = new StaffContext ("Staff");
        staff.name = "upper";
        staff.with = "instrumentName = \"Flute\"";
        result.insert (Concepts.STAFF_CONTEXT, "s1", staff);

        TupletInfo tuplet = new TupletInfo (3, 2);
        tuplet.span = "4";
        result.insert (Concepts.TUPLET_INFO, "t1", tuplet);

        result.insert (Concepts.MARKERS,         "n1", new Markers (Markers.CHORD_REPETITION, Markers.BEAM_MANUAL));
        result.insert (Concepts.TWEAKS,          "n1", new TextList (Arrays.asList ("\\tweak color #red", "\\tweak font-size #2")));
        result.insert (Concepts.CHORD_MODE_INFO, "h1", "g:7/b");
        return result;
    }

    @Test
    public void testIsolation ()
    {
        ExtensionStore store = new ExtensionStore ();
        store.insert (Concepts.CHORD_MODE_INFO, "x", "c:m");
        store.insert (Concepts.FIGURE_INFO,     "x", "<6 4>");
        assertEquals ("c:m",   store.get (Concepts.CHORD_MODE_INFO, "x"));
        assertEquals ("<6 4>", store.get (Concepts.FIGURE_INFO,     "x"));

        store.remove (Concepts.FIGURE_INFO, "x");
        assertFalse (store.contains (Concepts.FIGURE_INFO, "x"));
        assertTrue  (store.contains (Concepts.CHORD_MODE_INFO, "x"));
        assertNull  (store.get (Concepts.DRUM_EVENT, "x"));
        assertEquals (1, store.size ());
    }

    @Test
    public void testRemoveAll ()
    {
        ExtensionStore store = sample ();
        Bag bag = store.remove ("n1");
        assertEquals (2, bag.size ());
        assertTrue (bag.has (Concepts.MARKERS));
        assertTrue (bag.get (Concepts.MARKERS).has (Markers.BEAM_MANUAL));
        assertEquals (2, bag.get (Concepts.TWEAKS).items.size ());
        assertFalse (store.ids ().contains ("n1"));
        assertTrue  (store.remove ("n1").isEmpty ());

        // The bag is detached; putting it back restores the records.
        store.insert ("n2", bag);
        assertEquals (bag, store.get ("n2"));
    }

    @Test
    public void testRename ()
    {
        ExtensionStore store = sample ();
        store.insert (Concepts.PITCHED_REST, "n9", "c'");
        store.rename ("n1", "n9");
        assertFalse (store.contains (Concepts.PITCHED_REST, "n9"));  // target replaced
        assertTrue  (store.contains (Concepts.MARKERS,      "n9"));
        assertTrue  (store.get ("n1").isEmpty ());

        int size = store.size ();
        store.rename ("s1", "s1");
        assertEquals (size, store.size ());
        assertNotNull (store.get (Concepts.STAFF_CONTEXT, "s1"));
    }

    @Test
    public void testEntry ()
    {
        ExtensionStore store = new ExtensionStore ();
        ExtensionStore.Entry e = store.entry ("m1");
        Markers first = e.getOrInsert (Concepts.MARKERS, new Markers ());
        first.flags.add (Markers.BARE);
        assertSame (first, e.getOrInsert (Concepts.MARKERS, new Markers ()));
        assertTrue (store.get (Concepts.MARKERS, "m1").has (Markers.BARE));

        e.set (Concepts.MARKERS, null);
        assertFalse (e.has (Concepts.MARKERS));
        assertTrue (store.isEmpty ());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyID ()
    {
        new ExtensionStore ().insert (Concepts.DRUM_EVENT, "", "bd");
    }

    @Test
    public void testRetain ()
    {
        ExtensionStore store = sample ();
        List<String> dropped = store.retain (Arrays.asList ("n1", "s1"));
        assertEquals (Arrays.asList ("t1", "h1"), dropped);
        assertEquals (2, store.size ());
    }

    @Test
    public void testSerialization () throws IOException
    {
        ExtensionStore before = sample ();

        assertEquals (before, ExtensionStore.fromNode (before.toNode ()));
        assertEquals (before, ExtensionStore.fromJSON (before.toJSON ()));

        String label = before.toLabel ();
        assertTrue (ExtensionStore.isLabel (label));
        assertTrue (label.startsWith (ExtensionStore.LABEL_PREFIX));
        ExtensionStore after = ExtensionStore.fromLabel (label);
        assertEquals (before, after);
        StaffContext staff = after.get (Concepts.STAFF_CONTEXT, "s1");
        assertEquals ("upper", staff.name);
        assertEquals ("instrumentName = \"Flute\"", staff.with);
        assertEquals ("4", after.get (Concepts.TUPLET_INFO, "t1").span);

        StringWriter writer = new StringWriter ();
        before.write (writer);
        assertTrue (writer.toString ().startsWith ("Tusk.schema=1,extensions"));
        assertEquals (before, ExtensionStore.read (writer.toString ()));
    }

    @Test(expected = IOException.class)
    public void testWrongFileType () throws IOException
    {
        ExtensionStore.read ("Tusk.schema=1,settings\nppq:960\n");
    }

    @Test(expected = IOException.class)
    public void testNotALabel () throws IOException
    {
        ExtensionStore.fromLabel ("something else");
    }

    @Test
    public void testUnknownConcept ()
    {
        MNode node = new MVolatile ();
        node.set ("c:7", "h1", "chordModeInfo");
        node.set ("red", "h1", "futureThing", "color");
        ExtensionStore store = ExtensionStore.fromNode (node);
        assertEquals ("c:7", store.get (Concepts.CHORD_MODE_INFO, "h1"));
        MNode kept = store.get (Concepts.RECORDS, "h1");
        assertNotNull (kept);
        assertEquals ("red", kept.get ("futureThing", "color"));
    }
}
