/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import gov.sandia.tusk.db.MNode;

/**
    One \header, \paper, \layout or \midi block. Assignment values and context
    blocks are held as source text in their original order.
**/
public class OutputDef implements Record
{
    public String             kind;  // header, paper, layout, midi
    public Map<String,String> assignments   = new LinkedHashMap<String,String> ();
    public List<String>       contextBlocks = new ArrayList<String> ();

    public OutputDef (String kind)
    {
        this.kind = kind;
    }

    public void write (MNode node)
    {
        node.set (kind, "kind");
        MNode a = node.childOrCreate ("assignments");
        for (Entry<String,String> e : assignments.entrySet ())
        {
            MNode item = a.append (null);
            item.set (e.getKey (),   "name");
            item.set (e.getValue (), "value");
        }
        for (String c : contextBlocks) node.childOrCreate ("contexts").append (c);
    }

    public static OutputDef read (MNode node)
    {
        OutputDef result = new OutputDef (node.get ("kind"));
        for (MNode a : node.childOrEmpty ("assignments")) result.assignments.put (a.get ("name"), a.get ("value"));
        for (MNode c : node.childOrEmpty ("contexts")) result.contextBlocks.add (c.get ());
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof OutputDef)) return false;
        OutputDef that = (OutputDef) o;
        return kind.equals (that.kind)  &&  assignments.equals (that.assignments)  &&  contextBlocks.equals (that.contextBlocks);
    }

    @Override
    public int hashCode ()
    {
        return kind.hashCode () * 31 + assignments.hashCode ();
    }
}
