/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

public class Token
{
    public final TokenType type;
    public final String    text;   // Semantic text: string contents, word without backslash, Scheme without #
    public final int       start;  // Offset of first character in source.
    public final int       end;    // Offset just past last character.

    public Token (TokenType type, String text, int start, int end)
    {
        this.type  = type;
        this.text  = text;
        this.start = start;
        this.end   = end;
    }

    /**
        @return true if the next token starts exactly where this one ends.
    **/
    public boolean touches (Token next)
    {
        return next.start == end;
    }

    /**
        Describes the token for error messages.
    **/
    public String describe ()
    {
        switch (type)
        {
            case EOF:              return "end of input";
            case STRING:           return "string \"" + text + "\"";
            case SCHEME:           return "Scheme expression #" + text;
            case ESCAPED_WORD:
            case ESCAPED_UNSIGNED: return "\\" + text;
            default:
                if (type.isKeyword ()) return "\\" + text;
                return "'" + text + "'";
        }
    }

    public String toString ()
    {
        return type + "(" + text + ")@" + start;
    }
}
