/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.tusk.db.MNode;

public class OutputDefs implements Record
{
    public List<OutputDef> defs = new ArrayList<OutputDef> ();

    public OutputDef find (String kind)
    {
        for (OutputDef d : defs) if (d.kind.equals (kind)) return d;
        return null;
    }

    public void write (MNode node)
    {
        for (OutputDef d : defs) d.write (node.append (null));
    }

    public static OutputDefs read (MNode node)
    {
        OutputDefs result = new OutputDefs ();
        for (MNode d : node) result.defs.add (OutputDef.read (d));
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        return o instanceof OutputDefs  &&  defs.equals (((OutputDefs) o).defs);
    }

    @Override
    public int hashCode ()
    {
        return defs.hashCode ();
    }
}
