/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    name = value, at the outer level or inside an output definition block.
**/
public class Assignment extends Toplevel
{
    public String        name;  // May be dotted, such as "melody.upper".
    public PropertyValue value;

    public Assignment (String name, PropertyValue value)
    {
        this.name  = name;
        this.value = value;
    }

    public static String renderName (String name)
    {
        for (String part : name.split ("\\.", -1)) if (! Renderer.isWord (part)) return Renderer.quote (name);
        return name;
    }

    public void render (Renderer renderer)
    {
        renderer.append (renderName (name)).append (" = ");
        value.render (renderer);
    }
}
