/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.tusk.db.MNode;

public class EventSequence implements Record
{
    public List<ControlEvent> events = new ArrayList<ControlEvent> ();

    public void add (int position, String kind, String text)
    {
        events.add (new ControlEvent (position, kind, text));
    }

    /**
        @return All events recorded at the given position, in source order.
    **/
    public List<ControlEvent> at (int position)
    {
        List<ControlEvent> result = new ArrayList<ControlEvent> ();
        for (ControlEvent e : events) if (e.position == position) result.add (e);
        return result;
    }

    public void write (MNode node)
    {
        for (ControlEvent e : events) e.write (node.append (null));
    }

    public static EventSequence read (MNode node)
    {
        EventSequence result = new EventSequence ();
        for (MNode e : node) result.events.add (ControlEvent.read (e));
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        return o instanceof EventSequence  &&  events.equals (((EventSequence) o).events);
    }

    @Override
    public int hashCode ()
    {
        return events.hashCode ();
    }
}
