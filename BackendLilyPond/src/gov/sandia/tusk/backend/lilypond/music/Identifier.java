/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    A reference to a variable or a call without arguments, such as \melody or \break.
**/
public class Identifier extends Music
{
    public String name;

    public Identifier (String name)
    {
        this.name = name;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ('\\').append (name);
    }
}
