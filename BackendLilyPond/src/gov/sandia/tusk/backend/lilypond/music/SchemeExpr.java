/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    An embedded Scheme datum, kept as source text. The leading # is not part of the text,
    so ##f has text "#f" and #'(a . b) has text "'(a . b)".
**/
public class SchemeExpr
{
    public String text;

    public SchemeExpr (String text)
    {
        this.text = text;
    }

    /**
        @return true for a quoted bare symbol such as 'stencil, which may serve as a property path segment.
    **/
    public boolean isQuotedSymbol ()
    {
        if (text.length () < 2  ||  text.charAt (0) != '\'') return false;
        for (int i = 1; i < text.length (); i++)
        {
            char c = text.charAt (i);
            if (Character.isWhitespace (c)  ||  c == '('  ||  c == ')'  ||  c == '"') return false;
        }
        return true;
    }

    public boolean isString ()
    {
        return text.length () >= 2  &&  text.startsWith ("\"")  &&  text.endsWith ("\"");
    }

    /**
        @return Contents of a string literal, with escapes removed. Null if this is not a string.
    **/
    public String stringValue ()
    {
        if (! isString ()) return null;
        StringBuilder result = new StringBuilder ();
        for (int i = 1; i < text.length () - 1; i++)
        {
            char c = text.charAt (i);
            if (c == '\\'  &&  i + 1 < text.length () - 1)
            {
                c = text.charAt (++i);
                if      (c == 'n') c = '\n';
                else if (c == 't') c = '\t';
            }
            result.append (c);
        }
        return result.toString ();
    }

    public String toString ()
    {
        return "#" + text;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof SchemeExpr)) return false;
        return text.equals (((SchemeExpr) o).text);
    }

    @Override
    public int hashCode ()
    {
        return text.hashCode ();
    }
}
