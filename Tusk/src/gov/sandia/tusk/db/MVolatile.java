/*
Copyright 2016-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.db;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.TreeMap;

/**
    In-memory MNode, the only kind Tusk needs. Settings, store records and placeholder
    payloads all live in these for the length of one conversion.
    Children are kept in M collation order, so list items come back in sequence.
**/
public class MVolatile extends MNode
{
    protected String                 name;
    protected String                 value;  // null means undefined
    protected MNode                  parent;
    protected TreeMap<String,MNode>  children;

    public MVolatile ()
    {
    }

    public MVolatile (String value, String name, MNode parent)
    {
        this.name   = name;
        this.value  = value;
        this.parent = parent;
    }

    /**
        Detached deep copy of the source, with key "".
    **/
    public MVolatile (MNode source)
    {
        merge (source);
    }

    public String key ()
    {
        if (name == null) return "";
        return name;
    }

    public MNode parent ()
    {
        return parent;
    }

    protected synchronized MNode getChild (String key)
    {
        if (children == null) return null;
        return children.get (key);
    }

    public synchronized void clear ()
    {
        if (children != null) children.clear ();
    }

    protected synchronized void clearChild (String key)
    {
        if (children != null) children.remove (key);
    }

    public synchronized int size ()
    {
        if (children == null) return 0;
        return children.size ();
    }

    public boolean data ()
    {
        return value != null;
    }

    public synchronized String getOrDefault (String defaultValue)
    {
        if (value == null  ||  value.isEmpty ()) return defaultValue;
        return value;
    }

    public synchronized void set (String value)
    {
        this.value = value;
    }

    public synchronized MNode set (String value, String key)
    {
        if (children == null) children = new TreeMap<String,MNode> (comparator);
        MNode result = children.get (key);
        if (result == null)
        {
            result = new MVolatile (value, key, this);
            children.put (key, result);
        }
        else
        {
            result.set (value);
        }
        return result;
    }

    public synchronized Iterator<MNode> iterator ()
    {
        if (children == null) return super.iterator ();
        return new IteratorWrapper (new ArrayList<String> (children.keySet ()));  // snapshot of keys, so callers may edit while iterating
    }
}
