/*
Copyright 2017-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.language;

import java.io.PrintStream;

/**
    Raised by any text front end when input does not fit the grammar.
    Parsing stops at the first such error.
**/
@SuppressWarnings("serial")
public class ParseException extends Exception
{
    public String found    = "";  // Text of the offending token, or a description such as "end of input".
    public String expected = "";  // What the rule would have accepted at this point. May be empty.
    public int    offset   = -1;  // Character offset from start of source.
    public String line     = "";  // Full text of the source line containing offset.
    public int    column   = -1;

    public ParseException ()
    {
    }

    public ParseException (String message)
    {
        super (message);
    }

    public ParseException (String message, int offset)
    {
        super (message);
        this.offset = offset;
    }

    public ParseException (String found, String expected, int offset)
    {
        super ("Found " + found + (expected.isEmpty () ? "" : ", expected " + expected));
        this.found    = found;
        this.expected = expected;
        this.offset   = offset;
    }

    /**
        Fills in line and column from the original source text, so print() can show a caret.
        @return this, for use in a throw statement.
    **/
    public ParseException locate (String source)
    {
        if (offset < 0  ||  source == null) return this;
        int o = Math.min (offset, source.length ());
        int start = source.lastIndexOf ('\n', o - 1) + 1;
        int end   = source.indexOf ('\n', o);
        if (end < 0) end = source.length ();
        line   = source.substring (start, end);
        column = o - start;
        return this;
    }

    /**
        @return 1-based line number of offset in the given source.
    **/
    public int lineNumber (String source)
    {
        int result = 1;
        int o = Math.min (offset, source.length ());
        for (int i = 0; i < o; i++) if (source.charAt (i) == '\n') result++;
        return result;
    }

    public void print (PrintStream ps)
    {
        ps.println (this.getMessage ());
        ps.println (line);
        for (int i = 0; i < column; i++) ps.print (" ");
        ps.println ("^");
    }
}
