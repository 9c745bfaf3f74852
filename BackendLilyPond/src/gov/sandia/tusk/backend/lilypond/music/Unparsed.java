/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    Source text kept as-is because no other node can represent it.
    Rendered verbatim, so it survives a round trip unchanged.
**/
public class Unparsed extends Music
{
    public String text;

    public Unparsed (String text)
    {
        this.text = text;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append (text);
    }
}
