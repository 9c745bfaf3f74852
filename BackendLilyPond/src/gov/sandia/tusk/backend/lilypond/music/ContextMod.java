/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    One entry of a \with block or \context definition.
**/
public class ContextMod
{
    public enum Kind {CONSISTS, REMOVE, ACCEPTS, DENIES, ALIAS, DEFAULTCHILD, DESCRIPTION, NAME, TYPE, CONTEXT_REF, OP, ASSIGNMENT}

    public Kind          kind;
    public String        argument;  // Engraver or context name, or the referenced context for CONTEXT_REF
    public boolean       quoted;
    public PropertyOp    op;
    public PropertyPath  path;      // ASSIGNMENT target
    public PropertyValue value;     // ASSIGNMENT value

    public ContextMod (Kind kind, String argument, boolean quoted)
    {
        this.kind     = kind;
        this.argument = argument;
        this.quoted   = quoted;
    }

    public ContextMod (PropertyOp op)
    {
        kind    = Kind.OP;
        this.op = op;
    }

    public ContextMod (PropertyPath path, PropertyValue value)
    {
        kind       = Kind.ASSIGNMENT;
        this.path  = path;
        this.value = value;
    }

    /**
        @return The keyword for kinds that take a name argument.
    **/
    public static String keyword (Kind kind)
    {
        switch (kind)
        {
            case CONSISTS:     return "consists";
            case REMOVE:       return "remove";
            case ACCEPTS:      return "accepts";
            case DENIES:       return "denies";
            case ALIAS:        return "alias";
            case DEFAULTCHILD: return "defaultchild";
            case DESCRIPTION:  return "description";
            case NAME:         return "name";
            case TYPE:         return "type";
            default:           return null;
        }
    }

    public static Kind fromKeyword (String word)
    {
        for (Kind k : Kind.values ()) if (word.equals (keyword (k))) return k;
        return null;
    }

    public void render (Renderer renderer)
    {
        switch (kind)
        {
            case CONTEXT_REF:
                renderer.append ('\\').append (argument);
                break;
            case OP:
                op.render (renderer);
                break;
            case ASSIGNMENT:
                renderer.append (path.toString ()).append (" = ");
                value.render (renderer);
                break;
            default:
                renderer.append ('\\').append (keyword (kind)).append (' ');
                renderer.append (quoted ? Renderer.quote (argument) : argument);
        }
    }
}
