/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    Root of a parsed source file.
**/
public class LilyPondFile
{
    public String         version;  // From \version, or null.
    public List<Toplevel> items = new ArrayList<Toplevel> ();

    public void render (Renderer renderer)
    {
        boolean first = true;
        if (version != null)
        {
            renderer.append ("\\version ").append (Renderer.quote (version));
            first = false;
        }
        for (Toplevel t : items)
        {
            if (! first) renderer.append ("\n\n");
            first = false;
            t.render (renderer);
        }
        renderer.append ('\n');
    }

    public String render ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    public String toString ()
    {
        return render ();
    }
}
