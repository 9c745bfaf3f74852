/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.tusk.db.MNode;

public class PropertyOps implements Record
{
    public List<PropertyOp> ops = new ArrayList<PropertyOp> ();

    public void write (MNode node)
    {
        for (PropertyOp p : ops) p.write (node.append (null));
    }

    public static PropertyOps read (MNode node)
    {
        PropertyOps result = new PropertyOps ();
        for (MNode p : node) result.ops.add (PropertyOp.read (p));
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        return o instanceof PropertyOps  &&  ops.equals (((PropertyOps) o).ops);
    }

    @Override
    public int hashCode ()
    {
        return ops.hashCode ();
    }
}
