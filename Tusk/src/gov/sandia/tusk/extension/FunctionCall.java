/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.tusk.db.MNode;

/**
    A call to a music function or identifier that the canonical document cannot express.
    Arguments are source text, one entry per argument.
**/
public class FunctionCall implements Record
{
    public String       name;
    public List<String> args = new ArrayList<String> ();
    public boolean      partial;  // Ended with \etc

    public FunctionCall (String name)
    {
        this.name = name;
    }

    public void write (MNode node)
    {
        node.set (name, "name");
        for (String a : args) node.childOrCreate ("args").append (a);
        if (partial) node.set (true, "partial");
    }

    public static FunctionCall read (MNode node)
    {
        FunctionCall result = new FunctionCall (node.get ("name"));
        for (MNode a : node.childOrEmpty ("args")) result.args.add (a.get ());
        result.partial = node.getBoolean ("partial");
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof FunctionCall)) return false;
        FunctionCall that = (FunctionCall) o;
        return name.equals (that.name)  &&  args.equals (that.args)  &&  partial == that.partial;
    }

    @Override
    public int hashCode ()
    {
        return name.hashCode () * 31 + args.hashCode ();
    }
}
