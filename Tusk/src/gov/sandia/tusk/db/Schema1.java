/*
Copyright 2018-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
    Indented key:value format. One node per line. Children are indented one space
    deeper than their parent. A value that starts with "|" opens a block string whose
    lines are indented below the key. Keys that contain a colon, start with a quote,
    or are empty get wrapped in quotes, with a doubled quote as the escape.
**/
public class Schema1 extends Schema
{
    public Schema1 (int version, String type)
    {
        super (version, type);
    }

    public void read (MNode node, Reader reader) throws IOException
    {
        read (node, new LineReader (reader), 0);
    }

    /**
        Reads sibling lines at the given indent into node, recursing for deeper lines.
        Returns once the indent drops below the given level or the input ends.
    **/
    public void read (MNode node, LineReader reader, int indent) throws IOException
    {
        while (reader.line != null  &&  reader.whitespaces >= indent)
        {
            String[] pair = split (reader.line.trim ());
            String key   = pair[0];
            String value = pair[1];

            reader.getNextLine ();
            if (value != null  &&  value.startsWith ("|")) value = block (reader, indent);

            MNode child = node.set (value, key);
            if (reader.whitespaces > indent) read (child, reader, reader.whitespaces);
        }
    }

    /**
        Collects the lines of a block string. They must be indented deeper than the key.
        On return, the reader sits on the first line after the block.
    **/
    protected String block (LineReader reader, int indent) throws IOException
    {
        if (reader.whitespaces <= indent) return "";
        int blockIndent = reader.whitespaces;
        StringBuilder result = new StringBuilder (reader.line.substring (blockIndent));
        reader.getNextLine ();
        while (reader.whitespaces >= blockIndent)
        {
            result.append ("\n").append (reader.line.substring (blockIndent));
            reader.getNextLine ();
        }
        return result.toString ();
    }

    /**
        Separates a trimmed line into key and value.
        @return Two strings. The value is null when the line has no colon outside the quoted key.
    **/
    protected static String[] split (String line)
    {
        StringBuilder key = new StringBuilder ();
        boolean quoted = line.startsWith ("\"");
        int last = line.length () - 1;
        for (int i = quoted ? 1 : 0; i <= last; i++)
        {
            char c = line.charAt (i);
            if (quoted)
            {
                if (c == '"')
                {
                    if (i == last  ||  line.charAt (i + 1) != '"')
                    {
                        quoted = false;
                        continue;
                    }
                    i++;  // doubled quote
                }
            }
            else if (c == ':')
            {
                return new String[] {key.toString ().trim (), line.substring (i + 1).trim ()};
            }
            key.append (c);
        }
        return new String[] {key.toString ().trim (), null};
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        String key = node.key ();
        if (key.isEmpty ()  ||  key.startsWith ("\"")  ||  key.contains (":")) key = "\"" + key.replace ("\"", "\"\"") + "\"";

        writer.write (indent + key);
        if (node.data ())
        {
            String value = node.get ();
            writer.write (":");
            if (value.contains ("\n")  ||  value.startsWith ("|"))
            {
                writer.write ("|\n");
                for (String line : value.split ("\n", -1)) writer.write (indent + " " + line + "\n");
            }
            else
            {
                writer.write (value + "\n");
            }
        }
        else
        {
            writer.write ("\n");
        }

        for (MNode c : node) write (c, writer, indent + " ");
    }

    /**
        Steps through non-blank lines, tracking the indent of each.
        At end of input, line is null and whitespaces is -1.
    **/
    public static class LineReader
    {
        public BufferedReader reader;
        public String         line;
        public int            whitespaces;

        public LineReader (Reader reader) throws IOException
        {
            if (reader instanceof BufferedReader) this.reader = (BufferedReader) reader;
            else                                  this.reader = new BufferedReader (reader);
            getNextLine ();
        }

        public void getNextLine () throws IOException
        {
            do
            {
                line = reader.readLine ();
            }
            while (line != null  &&  line.trim ().isEmpty ());

            whitespaces = -1;
            if (line == null) return;
            whitespaces = 0;
            while (whitespaces < line.length ()  &&  line.charAt (whitespaces) == ' ') whitespaces++;
        }
    }
}
