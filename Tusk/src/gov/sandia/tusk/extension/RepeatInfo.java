/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

public class RepeatInfo implements Record
{
    public String type;             // volta, unfold, percent, tremolo, segno
    public int    count;
    public int    alternatives;     // Number of \alternative endings.
    public int    ending = -1;      // For an ending marker, its index. -1 on the repeat itself.

    public RepeatInfo (String type, int count)
    {
        this.type  = type;
        this.count = count;
    }

    public void write (MNode node)
    {
        node.set (type,  "type");
        node.set (count, "count");
        if (alternatives > 0) node.set (alternatives, "alternatives");
        if (ending >= 0)      node.set (ending,       "ending");
    }

    public static RepeatInfo read (MNode node)
    {
        RepeatInfo result = new RepeatInfo (node.get ("type"), node.getInt ("count"));
        result.alternatives = node.getInt ("alternatives");
        result.ending       = node.getOrDefault (-1, "ending");
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof RepeatInfo)) return false;
        RepeatInfo that = (RepeatInfo) o;
        return type.equals (that.type)  &&  count == that.count  &&  alternatives == that.alternatives  &&  ending == that.ending;
    }

    @Override
    public int hashCode ()
    {
        return type.hashCode () * 31 + count;
    }
}
