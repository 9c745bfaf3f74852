/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    A rehearsal mark (\mark) or text mark (\textMark).
**/
public class Mark extends Music
{
    public boolean textMark;
    public boolean isDefault;  // \mark \default
    public Integer number;
    public Markup  label;

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append (textMark ? "\\textMark " : "\\mark ");
        if      (isDefault)                        renderer.append ("\\default");
        else if (number != null)                   renderer.append (String.valueOf (number));
        else if (label.kind == Markup.Kind.STRING  ||  label.kind == Markup.Kind.SCHEME) label.render (renderer);
        else                                                                          label.renderTop (renderer);
    }
}
