/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

public class ToplevelMarkup extends Toplevel
{
    public Markup  markup;
    public boolean list;

    public ToplevelMarkup (Markup markup, boolean list)
    {
        this.markup = markup;
        this.list   = list;
    }

    public void render (Renderer renderer)
    {
        renderer.append (list ? "\\markuplist " : "\\markup ");
        markup.render (renderer);
    }
}
