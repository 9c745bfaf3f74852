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
    Ordered list of source-text fragments, for example the tweaks on one event.
**/
public class TextList implements Record
{
    public List<String> items = new ArrayList<String> ();

    public TextList ()
    {
    }

    public TextList (List<String> items)
    {
        this.items.addAll (items);
    }

    public void write (MNode node)
    {
        for (String s : items) node.append (s);
    }

    public static TextList read (MNode node)
    {
        TextList result = new TextList ();
        for (MNode s : node) result.items.add (s.get ());
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        return o instanceof TextList  &&  items.equals (((TextList) o).items);
    }

    @Override
    public int hashCode ()
    {
        return items.hashCode ();
    }
}
