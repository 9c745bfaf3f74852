/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    Scheme code in a music position, such as #(set-accidental-style 'modern).
**/
public class SchemeMusic extends Music
{
    public SchemeExpr scheme;

    public SchemeMusic (SchemeExpr scheme)
    {
        this.scheme = scheme;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append (scheme.toString ());
    }
}
