/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

/**
    A non-note item that appeared in a voice (clef, key, time, bar check, tempo and so on),
    with the number of timed events that preceded it in the same voice.
**/
public class ControlEvent implements Record
{
    public int    position;
    public String kind;
    public String text;  // Source text of the item.

    public ControlEvent (int position, String kind, String text)
    {
        this.position = position;
        this.kind     = kind;
        this.text     = text;
    }

    public void write (MNode node)
    {
        node.set (position, "position");
        node.set (kind,     "kind");
        node.set (text,     "text");
    }

    public static ControlEvent read (MNode node)
    {
        return new ControlEvent (node.getInt ("position"), node.get ("kind"), node.get ("text"));
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof ControlEvent)) return false;
        ControlEvent that = (ControlEvent) o;
        return position == that.position  &&  kind.equals (that.kind)  &&  text.equals (that.text);
    }

    @Override
    public int hashCode ()
    {
        return (position * 31 + kind.hashCode ()) * 31 + text.hashCode ();
    }

    public String toString ()
    {
        return position + ":" + kind + ":" + text;
    }
}
