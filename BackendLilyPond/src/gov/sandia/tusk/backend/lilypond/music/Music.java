/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Collections;
import java.util.List;

/**
    Base class of the music expression tree. The set of subclasses is closed: the importer
    and exporter handle each one explicitly, and anything they don't recognize is an error.
    Nodes own their children exclusively. Nothing is shared between trees.
**/
public abstract class Music
{
    public abstract void render (Renderer renderer);

    /**
        @return Music nested directly inside this node, in source order. Empty for leaves.
    **/
    public List<Music> children ()
    {
        return Collections.emptyList ();
    }

    /**
        @return true if this music should be laid out on its own lines, with nested content indented.
    **/
    public boolean isBlock ()
    {
        return false;
    }

    /**
        Depth-first, pre-order traversal.
    **/
    public void visit (Visitor visitor)
    {
        if (! visitor.visit (this)) return;
        for (Music m : children ()) m.visit (visitor);
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

    /**
        Structural comparison. Rendering is canonical (every field shows up in the text, and
        the parser reads the text back into the same fields), so two trees of the same class
        are equal exactly when they render the same.
    **/
    @Override
    public boolean equals (Object o)
    {
        if (o == this) return true;
        if (o == null  ||  o.getClass () != getClass ()) return false;
        return render ().equals (((Music) o).render ());
    }

    @Override
    public int hashCode ()
    {
        return render ().hashCode ();
    }
}
