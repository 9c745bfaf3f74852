/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

public class GraceInfo implements Record
{
    public String kind;           // grace, acciaccatura, appoggiatura, afterGrace
    public int    group;          // Consecutive grace notes of one construct share a group number.
    public String fraction = "";  // afterGrace only, as "n/d". Empty for the default.

    public GraceInfo (String kind, int group)
    {
        this.kind  = kind;
        this.group = group;
    }

    public void write (MNode node)
    {
        node.set (kind,  "kind");
        node.set (group, "group");
        if (! fraction.isEmpty ()) node.set (fraction, "fraction");
    }

    public static GraceInfo read (MNode node)
    {
        GraceInfo result = new GraceInfo (node.get ("kind"), node.getInt ("group"));
        result.fraction = node.get ("fraction");
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof GraceInfo)) return false;
        GraceInfo that = (GraceInfo) o;
        return kind.equals (that.kind)  &&  group == that.group  &&  fraction.equals (that.fraction);
    }

    @Override
    public int hashCode ()
    {
        return kind.hashCode () * 31 + group;
    }
}
