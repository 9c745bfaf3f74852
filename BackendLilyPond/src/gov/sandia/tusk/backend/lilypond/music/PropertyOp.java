/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    Overrides, reverts, sets or unsets a property, optionally just once.
**/
public class PropertyOp extends Music
{
    public enum Type
    {
        OVERRIDE ("override"), REVERT ("revert"), SET ("set"), UNSET ("unset");

        public final String keyword;

        Type (String keyword)
        {
            this.keyword = keyword;
        }

        public static Type fromKeyword (String word)
        {
            for (Type t : values ()) if (t.keyword.equals (word)) return t;
            return null;
        }
    }

    public Type          type;
    public boolean       once;
    public PropertyPath  path;
    public PropertyValue value;  // Null for REVERT and UNSET.

    public PropertyOp (Type type, PropertyPath path, PropertyValue value)
    {
        this.type  = type;
        this.path  = path;
        this.value = value;
    }

    public boolean hasValue ()
    {
        return type == Type.OVERRIDE  ||  type == Type.SET;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        if (once) renderer.append ("\\once ");
        renderer.append ('\\').append (type.keyword).append (' ').append (path.toString ());
        if (value != null)
        {
            renderer.append (" = ");
            value.render (renderer);
        }
    }
}
