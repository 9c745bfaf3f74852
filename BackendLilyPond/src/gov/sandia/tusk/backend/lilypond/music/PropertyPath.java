/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    Names a grob or context property, such as Staff.TimeSignature.stencil.
    A segment is either a plain name or a Scheme expression. Scheme segments keep their
    leading #, so the older form Staff.TimeSignature #'stencil round-trips unchanged.
    A path always has at least one segment.
**/
public class PropertyPath
{
    public List<String> segments = new ArrayList<String> ();

    public PropertyPath (String... segments)
    {
        for (String s : segments) add (s);
    }

    public PropertyPath (List<String> segments)
    {
        for (String s : segments) add (s);
        if (this.segments.isEmpty ()) throw new IllegalArgumentException ("Property path needs at least one segment");
    }

    public PropertyPath add (String segment)
    {
        if (segment == null  ||  segment.isEmpty ()) throw new IllegalArgumentException ("Empty property path segment");
        segments.add (segment);
        return this;
    }

    public static boolean isScheme (String segment)
    {
        return segment.startsWith ("#");
    }

    /**
        @return The final segment with any Scheme quoting removed, for example "stencil".
    **/
    public String last ()
    {
        String result = segments.get (segments.size () - 1);
        if (result.startsWith ("#'")) return result.substring (2);
        if (result.startsWith ("#"))  return result.substring (1);
        return result;
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        for (int i = 0; i < segments.size (); i++)
        {
            String s = segments.get (i);
            if (i > 0) result.append (isScheme (s) ? " " : ".");
            result.append (s);
        }
        return result.toString ();
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof PropertyPath)) return false;
        return segments.equals (((PropertyPath) o).segments);
    }

    @Override
    public int hashCode ()
    {
        return segments.hashCode ();
    }
}
