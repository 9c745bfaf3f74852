/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Map.Entry;

import gov.sandia.tusk.db.MNode;

/**
    Top-level assignments in source order. Values are source text.
**/
public class Variables implements Record
{
    public Map<String,String> assignments = new LinkedHashMap<String,String> ();

    public void write (MNode node)
    {
        for (Entry<String,String> e : assignments.entrySet ())
        {
            MNode item = node.append (null);
            item.set (e.getKey (),   "name");
            item.set (e.getValue (), "value");
        }
    }

    public static Variables read (MNode node)
    {
        Variables result = new Variables ();
        for (MNode item : node) result.assignments.put (item.get ("name"), item.get ("value"));
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        return o instanceof Variables  &&  assignments.equals (((Variables) o).assignments);
    }

    @Override
    public int hashCode ()
    {
        return assignments.hashCode ();
    }
}
