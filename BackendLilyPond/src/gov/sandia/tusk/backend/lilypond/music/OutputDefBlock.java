/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    \header, \paper, \layout or \midi.
**/
public class OutputDefBlock extends Toplevel
{
    public static final String[] KINDS = {"header", "paper", "layout", "midi"};

    public String         kind;
    public List<Toplevel> items = new ArrayList<Toplevel> ();

    public OutputDefBlock (String kind)
    {
        this.kind = kind;
    }

    public static boolean isKind (String word)
    {
        for (String k : KINDS) if (k.equals (word)) return true;
        return false;
    }

    /**
        @return The value assigned to the given field, or null if there is no such assignment.
    **/
    public PropertyValue get (String name)
    {
        for (Toplevel t : items)
        {
            if (t instanceof Assignment  &&  ((Assignment) t).name.equals (name)) return ((Assignment) t).value;
        }
        return null;
    }

    public void render (Renderer renderer)
    {
        renderItems (renderer, kind, items);
    }
}
