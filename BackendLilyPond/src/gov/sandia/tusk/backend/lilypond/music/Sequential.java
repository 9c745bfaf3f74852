/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    { ... }: music played one item after another.
**/
public class Sequential extends Music
{
    public List<Music> items = new ArrayList<Music> ();

    public Sequential ()
    {
    }

    public Sequential (List<Music> items)
    {
        this.items.addAll (items);
    }

    public List<Music> children ()
    {
        return items;
    }

    public boolean isBlock ()
    {
        for (Music m : items) if (m.isBlock ()) return true;
        return false;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        if (items.isEmpty ())
        {
            renderer.append ("{ }");
        }
        else if (isBlock ())
        {
            renderer.renderBlock ("{", items, "}");
        }
        else
        {
            renderer.append ("{ ");
            renderer.render (items);
            renderer.append (" }");
        }
    }
}
