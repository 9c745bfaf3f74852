/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    \change Staff = name: moves the current voice to another staff.
**/
public class ContextChange extends Music
{
    public String type;
    public String name;

    public ContextChange (String type, String name)
    {
        this.type = type;
        this.name = name;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\change ").append (type).append (" = ").append (Renderer.word (name));
    }
}
