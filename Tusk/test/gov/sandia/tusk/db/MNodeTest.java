/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.db;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.StringReader;
import java.io.StringWriter;

import org.junit.Test;

public class MNodeTest
{
    protected static MNode sample ()
    {
        MNode result = new MVolatile ();
        result.set ("value",       "a");
        result.set ("1",           "a", "flag");
        result.set ("0",           "a", "off");
        result.set ("42",          "b", "answer");
        result.set ("first\nsecond", "text");
        result.set ("colon",       "key:with:colons");
        result.set ("",            "empty");
        return result;
    }

    @Test
    public void testAccess ()
    {
        MNode n = sample ();
        assertEquals ("value", n.get ("a"));
        assertEquals ("",      n.get ("missing"));
        assertEquals ("dflt",  n.getOrDefault ("dflt", "missing"));
        assertEquals (42,      n.getOrDefault (0, "b", "answer"));
        assertEquals (42.0,    n.getOrDefault (0.0, "b", "answer"), 0);
        assertEquals (7,       n.getOrDefault (7, "a"));  // not a number
        assertTrue  (n.getFlag ("a", "flag"));
        assertFalse (n.getFlag ("a", "off"));
        assertFalse (n.getFlag ("a", "absent"));
        assertTrue  (n.getFlag ("empty"));  // exists, so set
        assertNull  (n.child ("b", "nothing"));
        assertEquals (2, n.child ("a").size ());
    }

    @Test
    public void testMerge ()
    {
        MNode base = new MVolatile ();
        base.set ("1", "x");
        base.set ("2", "y", "z");

        MNode over = new MVolatile ();
        over.set ("10", "x");
        over.set ("3",  "w");

        MNode a = new MVolatile ();
        a.merge (base);
        a.merge (over);
        assertEquals ("10", a.get ("x"));
        assertEquals ("2",  a.get ("y", "z"));
        assertEquals ("3",  a.get ("w"));

        MNode b = new MVolatile ();
        b.merge (base);
        b.mergeUnder (over);
        assertEquals ("1", b.get ("x"));
        assertEquals ("3", b.get ("w"));
    }

    @Test
    public void testEquals ()
    {
        MNode a = sample ();
        MNode b = sample ();
        assertEquals (a, b);
        assertEquals (a.hashCode (), b.hashCode ());
        b.set ("changed", "b", "answer");
        assertFalse (a.equals (b));
    }

    @Test
    public void testSchema () throws Exception
    {
        MNode before = sample ();
        StringWriter writer = new StringWriter ();
        Schema.latest ("settings").writeAll (before, writer);
        String text = writer.toString ();
        assertTrue (text.startsWith (Schema.HEADER + "=1,settings"));
        assertTrue (text.contains ("\"key:with:colons\":colon"));

        MNode after = new MVolatile ();
        Schema schema = Schema.readAll (after, new StringReader (text));
        assertEquals ("settings", schema.type);
        assertEquals (1,          schema.version);
        assertEquals ("first\nsecond", after.get ("text"));
        assertEquals ("colon",         after.get ("key:with:colons"));
        assertEquals (before, after);
    }

    @Test(expected = java.io.IOException.class)
    public void testSchemaMissingHeader () throws Exception
    {
        Schema.readAll (new MVolatile (), new StringReader ("a:1\n"));
    }

    @Test
    public void testJSON () throws Exception
    {
        MNode before = sample ();
        String text = JSON.toCompactString (before);
        assertFalse (text.contains ("\n"));
        MNode after = JSON.parse (text);
        assertEquals (before, after);

        MNode parsed = JSON.parse ("{\"list\":[\"x\",\"y\"],\"n\":3,\"s\":\"q\\\"uote\"}");
        assertEquals ("x",       parsed.get ("list", "0"));
        assertEquals ("y",       parsed.get ("list", "1"));
        assertEquals (3,         parsed.getInt ("n"));
        assertEquals ("q\"uote", parsed.get ("s"));
    }

    @Test
    public void testSettings ()
    {
        MNode settings = AppData.settings ();
        assertEquals (960, settings.getInt ("ppq"));
        settings.set ("480", "ppq");
        // A job's private copy never leaks back.
        assertEquals (960, AppData.settings ().getInt ("ppq"));
    }
}
