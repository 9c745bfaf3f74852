/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    &lt;&lt; ... &gt;&gt;: music played at the same time.
    When separated is set, the items are voices written with \\ between them.
**/
public class Simultaneous extends Music
{
    public List<Music> items = new ArrayList<Music> ();
    public boolean     separated;

    public List<Music> children ()
    {
        return items;
    }

    public boolean isBlock ()
    {
        for (Music m : items) if (m.isBlock ()  ||  m instanceof ContextedMusic  ||  m instanceof Simultaneous) return true;
        return false;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        if (items.isEmpty ())
        {
            renderer.append ("<< >>");
            return;
        }
        String separator = separated ? "\\\\" : null;
        if (isBlock ())
        {
            renderer.append ("<<");
            renderer.indent ();
            boolean first = true;
            for (Music m : items)
            {
                if (! first  &&  separator != null)
                {
                    renderer.newline ();
                    renderer.append (separator);
                }
                first = false;
                renderer.newline ();
                m.render (renderer);
            }
            renderer.outdent ();
            renderer.newline ();
            renderer.append (">>");
        }
        else
        {
            renderer.append ("<< ");
            boolean first = true;
            for (Music m : items)
            {
                if (! first) renderer.append (separator == null ? " " : " " + separator + " ");
                first = false;
                m.render (renderer);
            }
            renderer.append (" >>");
        }
    }
}
