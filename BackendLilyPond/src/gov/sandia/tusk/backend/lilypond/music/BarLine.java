/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

public class BarLine extends Music
{
    public String style;  // For example "|." or ":|."

    public BarLine (String style)
    {
        this.style = style;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\bar ").append (Renderer.quote (style));
    }
}
