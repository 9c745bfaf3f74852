/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

/**
    An \override, \revert, \set or unset, with path and value kept as source text.
**/
public class PropertyOp implements Record
{
    public String  type;        // override, revert, set, unset
    public String  path;
    public String  value = "";  // Empty for revert and unset.
    public boolean once;

    public PropertyOp (String type, String path)
    {
        this.type = type;
        this.path = path;
    }

    public void write (MNode node)
    {
        node.set (type, "type");
        node.set (path, "path");
        if (! value.isEmpty ()) node.set (value, "value");
        if (once) node.set (true, "once");
    }

    public static PropertyOp read (MNode node)
    {
        PropertyOp result = new PropertyOp (node.get ("type"), node.get ("path"));
        result.value = node.get ("value");
        result.once  = node.getBoolean ("once");
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof PropertyOp)) return false;
        PropertyOp that = (PropertyOp) o;
        return type.equals (that.type)  &&  path.equals (that.path)  &&  value.equals (that.value)  &&  once == that.once;
    }

    @Override
    public int hashCode ()
    {
        return type.hashCode () * 31 + path.hashCode ();
    }
}
