/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.List;

/**
    An item that can stand at the outer level of a file, or inside a \score, \book or output definition block.
**/
public abstract class Toplevel
{
    public abstract void render (Renderer renderer);

    /**
        Writes the items of a braced block one per line. An empty block renders as "{ }".
    **/
    public static void renderItems (Renderer renderer, String keyword, List<? extends Toplevel> items)
    {
        renderer.append ('\\').append (keyword).append (' ');
        if (items.isEmpty ())
        {
            renderer.append ("{ }");
            return;
        }
        renderer.append ('{');
        renderer.indent ();
        for (Toplevel t : items)
        {
            renderer.newline ();
            t.render (renderer);
        }
        renderer.outdent ();
        renderer.newline ();
        renderer.append ('}');
    }

    public String toString ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }
}
