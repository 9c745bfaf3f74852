/*
Copyright 2016-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.db;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;

/**
    A hierarchical key-value record. Every conversion-side record that needs to survive
    serialization (extension concepts, settings, free-form records from other formats)
    is expressed as a tree of these nodes.

    A node can be "undefined". For the most part, this behaves as having a value of "".
    Lists are stored as children with consecutive integer keys 0, 1, 2, ... The collation
    order in compare() keeps such keys in numeric order, so iteration visits list items
    in sequence.
**/
public class MNode implements Iterable<MNode>
{
    public String key ()
    {
        return "";
    }

    public MNode parent ()
    {
        return null;
    }

    /**
        Returns the child indicated by the given key, or null if it doesn't exist.
        This function is separate from child(String...) for ease of implementing subclasses.
    **/
    protected MNode getChild (String key)
    {
        return null;
    }

    /**
        Returns a child node from arbitrary depth, or null if any part of the path doesn't exist.
    **/
    public synchronized MNode child (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) return null;
            result = c;
        }
        return result;  // If no keys are specified, we return this node.
    }

    /**
        Retrieves a child node from arbitrary depth, or creates it if nonexistent.
    **/
    public synchronized MNode childOrCreate (String... keys)
    {
        MNode result = this;
        for (String key : keys)
        {
            MNode c = result.getChild (key);
            if (c == null) c = result.set (null, key);
            result = c;
        }
        return result;
    }

    /**
        Convenience method for iterating over an arbitrary sub-node.
        If the node doesn't exist, returns a temporary value with no children.
    **/
    public MNode childOrEmpty (String... keys)
    {
        MNode result = child (keys);
        if (result == null) return new MNode ();
        return result;
    }

    /**
        Removes all children.
    **/
    public synchronized void clear ()
    {
        for (MNode n : this) clearChild (n.key ());
    }

    protected void clearChild (String key)
    {
    }

    /**
        Removes child with arbitrary depth.
        If no key is specified, then removes all children of this node.
    **/
    public synchronized void clear (String... keys)
    {
        if (keys.length == 0)
        {
            clear ();
            return;
        }

        MNode c = this;
        int last = keys.length - 1;
        for (int i = 0; i < last; i++)
        {
            c = c.getChild (keys[i]);
            if (c == null) return;  // Nothing to clear
        }
        c.clearChild (keys[last]);
    }

    /**
        @return The number of children we have.
    **/
    public int size ()
    {
        return 0;
    }

    public boolean isEmpty ()
    {
        return size () == 0;
    }

    /**
        Indicates whether this node is defined. Since get() returns "" for undefined nodes,
        this is the only way to tell a node defined as "" from an undefined one.
    **/
    public boolean data ()
    {
        return false;
    }

    /**
        @return This node's value, with "" as default
    **/
    public String get ()
    {
        return getOrDefault ("");
    }

    /**
        Digs down tree as far as possible to retrieve value; returns "" if node does not exist.
    **/
    public String get (String... keys)
    {
        MNode c = child (keys);
        if (c == null) return "";
        return c.get ();
    }

    /**
        Returns this node's value, or the given default if node is undefined or set to "".
        This is the only get*() function that needs to be overridden by subclasses.
    **/
    public String getOrDefault (String defaultValue)
    {
        return defaultValue;
    }

    public String getOrDefault (String defaultValue, String... keys)
    {
        String value = get (keys);
        if (value.isEmpty ()) return defaultValue;
        return value;
    }

    public boolean getOrDefault (boolean defaultValue, String... keys)
    {
        String value = get (keys);
        if (value.isEmpty ()) return defaultValue;
        if (value.trim ().equals ("1")) return true;
        return Boolean.parseBoolean (value);
    }

    public int getOrDefault (int defaultValue, String... keys)
    {
        String value = get (keys);
        if (value.isEmpty ()) return defaultValue;
        Double d = parseNumber (value);
        if (d == null) return defaultValue;
        return (int) Math.round (d);
    }

    public double getOrDefault (double defaultValue, String... keys)
    {
        String value = get (keys);
        if (value.isEmpty ()) return defaultValue;
        Double d = parseNumber (value);
        if (d == null) return defaultValue;
        return d;
    }

    /**
        true <-- "1" or "true"; false <-- everything else, including empty and undefined.
    **/
    public boolean getBoolean (String... keys)
    {
        return getOrDefault (false, keys);
    }

    /**
        Interprets value as flag: false <-- "0" or non-existent; true <-- everything else.
        A flag can indicate something by merely existing, without a value.
    **/
    public boolean getFlag (String... keys)
    {
        MNode c = child (keys);
        if (c == null  ||  c.get ().equals ("0")) return false;
        return true;
    }

    public int getInt (String... keys)
    {
        return getOrDefault (0, keys);
    }

    /**
        Sets this node's own value. Passing null makes the node undefined.
        Should be overridden by a subclass.
    **/
    public void set (String value)
    {
    }

    /**
        Sets value of child node specified by key. Creates child node if it doesn't already exist.
        Should be overridden by a subclass.
        @return The child node on which the value was set.
    **/
    public MNode set (String value, String key)
    {
        return new MNode ();
    }

    /**
        Creates all children necessary to set value
    **/
    public synchronized MNode set (String value, String... keys)
    {
        MNode result = childOrCreate (keys);
        result.set (value);
        return result;
    }

    public synchronized MNode set (Object value, String... keys)
    {
        MNode result = childOrCreate (keys);
        if (value instanceof MNode)
        {
            result.clear ();
            result.set (null);
            result.merge ((MNode) value);
        }
        else
        {
            String stringValue = null;
            if (value instanceof Boolean) stringValue = (Boolean) value ? "1" : "0";
            else if (value != null)       stringValue = value.toString ();
            result.set (stringValue);
        }
        return result;
    }

    /**
        Adds a new list item after the highest integer key currently present.
        @return The new child.
    **/
    public synchronized MNode append (Object value)
    {
        int index = 0;
        for (MNode c : this)
        {
            Double d = parseNumber (c.key ());
            if (d != null) index = Math.max (index, d.intValue () + 1);
        }
        return set (value, String.valueOf (index));
    }

    /**
        Deep copies the source node into this node, while leaving any non-overlapping values in
        this node unchanged. The value of this node is only replaced if the source value is defined.
    **/
    public synchronized void merge (MNode that)
    {
        if (that.data ()) set (that.get ());
        for (MNode thatChild : that)
        {
            String key = thatChild.key ();
            MNode c = getChild (key);
            if (c == null) c = set (null, key);
            c.merge (thatChild);
        }
    }

    /**
        Deep copies the source node into this node, while leaving all values in this node unchanged.
    **/
    public synchronized void mergeUnder (MNode that)
    {
        if (! data ()  &&  that.data ()) set (that.get ());
        for (MNode thatChild : that)
        {
            String key = thatChild.key ();
            MNode c = getChild (key);
            if (c == null) set (thatChild, key);
            else           c.mergeUnder (thatChild);
        }
    }

    public class IteratorWrapper implements Iterator<MNode>
    {
        List<String>     keys;
        Iterator<String> iterator;
        String           key;  // of the most recent node returned by next()

        public IteratorWrapper (List<String> keys)
        {
            this.keys = keys;
            iterator = keys.iterator ();
        }

        public boolean hasNext ()
        {
            return iterator.hasNext ();
        }

        /**
            The caller is free to modify the tree while iterating. A child deleted during
            iteration comes back as null. A child added during iteration is not visited.
        **/
        public MNode next ()
        {
            key = iterator.next ();
            return getChild (key);
        }

        public void remove ()
        {
            clearChild (key);
            iterator.remove ();
        }
    }

    public Iterator<MNode> iterator ()
    {
        return new MNode.IteratorWrapper (new ArrayList<String> ());
    }

    protected static Double parseNumber (String value)
    {
        try
        {
            return Double.valueOf (value);
        }
        catch (NumberFormatException e)
        {
            return null;
        }
    }

    /**
        M collation: numbers sort before strings, and numbers sort by value.
    **/
    public static int compare (String A, String B)
    {
        if (A.equals (B)) return 0;
        Double Avalue = parseNumber (A);
        Double Bvalue = parseNumber (B);
        if (Avalue == null)  // A is a string
        {
            if (Bvalue == null) return A.compareTo (B);
            return 1;  // string > number
        }
        if (Bvalue == null) return -1;  // number < string
        int result = Double.compare (Avalue, Bvalue);
        if (result == 0) return A.compareTo (B);  // "1" vs "1.0"
        return result;
    }

    public static class MOrder implements Comparator<String>
    {
        public int compare (String A, String B)
        {
            return MNode.compare (A, B);
        }
    }
    public static MOrder comparator = new MOrder ();

    /**
        Deep comparison of two nodes. All structure, keys and values must match exactly.
    **/
    @Override
    public boolean equals (Object o)
    {
        if (this == o) return true;
        if (! (o instanceof MNode)) return false;
        MNode that = (MNode) o;
        if (! key ().equals (that.key ())) return false;
        return equalsRecursive (that);
    }

    public boolean equalsRecursive (MNode that)
    {
        if (data () != that.data ()) return false;
        if (! get ().equals (that.get ())) return false;
        if (size () != that.size ()) return false;
        for (MNode a : this)
        {
            MNode b = that.getChild (a.key ());
            if (b == null) return false;
            if (! a.equalsRecursive (b)) return false;
        }
        return true;
    }

    @Override
    public int hashCode ()
    {
        int result = key ().hashCode ();
        result = 31 * result + get ().hashCode ();
        for (MNode c : this) result = 31 * result + c.hashCode ();
        return result;
    }

    public String toString ()
    {
        StringWriter writer = new StringWriter ();
        Schema.latest ().write (this, writer);
        return writer.toString ();
    }
}
