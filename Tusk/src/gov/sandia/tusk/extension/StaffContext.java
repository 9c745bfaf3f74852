/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

public class StaffContext implements Record
{
    public String contextType;
    public String name    = "";
    public String with    = "";     // Source text of the \with block contents.
    public String keyword = "new";  // new or context

    public StaffContext (String contextType)
    {
        this.contextType = contextType;
    }

    public void write (MNode node)
    {
        node.set (contextType, "type");
        if (! name.isEmpty ()) node.set (name, "name");
        if (! with.isEmpty ()) node.set (with, "with");
        node.set (keyword, "keyword");
    }

    public static StaffContext read (MNode node)
    {
        StaffContext result = new StaffContext (node.get ("type"));
        result.name    = node.get ("name");
        result.with    = node.get ("with");
        result.keyword = node.getOrDefault ("new", "keyword");
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof StaffContext)) return false;
        StaffContext that = (StaffContext) o;
        return contextType.equals (that.contextType)  &&  name.equals (that.name)  &&  with.equals (that.with)  &&  keyword.equals (that.keyword);
    }

    @Override
    public int hashCode ()
    {
        return contextType.hashCode () * 31 + name.hashCode ();
    }
}
