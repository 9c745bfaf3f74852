/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    \markup or \markuplist standing where music is expected.
**/
public class MarkupMusic extends Music
{
    public Markup  markup;
    public boolean list;

    public MarkupMusic (Markup markup, boolean list)
    {
        this.markup = markup;
        this.list   = list;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append (list ? "\\markuplist " : "\\markup ");
        markup.render (renderer);
    }
}
