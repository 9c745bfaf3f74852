/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
    Simple JSON input/output for MNodes.
    JSON nodes can have a value or children, but not both. To work around this, we treat
    a child key of "" (empty string) as holding the value of the node (but only when it has
    both a value and children). This means that "" can never be a proper child.

    With compact set, output is a single line with no insignificant white space.
    That form is what gets embedded in label attributes of the canonical document.
**/
public class JSON
{
    public String  tab = "  ";
    public boolean compact;

    public JSON ()
    {
    }

    public JSON (boolean compact)
    {
        this.compact = compact;
    }

    /**
        Parses the given text into a fresh node.
    **/
    public static MNode parse (String text) throws IOException
    {
        MNode result = new MVolatile ();
        new JSON ().read (result, new BufferedReader (new StringReader (text)));
        return result;
    }

    /**
        Formats the node as a single line.
    **/
    public static String toCompactString (MNode node)
    {
        StringWriter writer = new StringWriter ();
        try
        {
            new JSON (true).write (node, writer);
        }
        catch (IOException e)
        {
            throw new UncheckedIOException (e);
        }
        return writer.toString ();
    }

    public void read (MNode node, Reader reader) throws IOException
    {
        BufferedReader br;
        boolean alreadyBuffered = reader instanceof BufferedReader;
        if (alreadyBuffered) br =    (BufferedReader) reader;
        else                 br = new BufferedReader (reader);
        read (node, br);
        if (! alreadyBuffered) br.close ();
    }

    /**
        Obtain either the value or children of the current node.
        This is the start point for reading a JSON file.
    **/
    public void read (MNode node, BufferedReader reader) throws IOException
    {
        StringBuilder number = null;
        while (true)
        {
            reader.mark (1);
            int i = reader.read ();
            if (i < 0)
            {
                if (number != null) node.set (number.toString ());
                break;
            }
            char c = (char) i;

            if (number != null)
            {
                // We don't check if these characters actually satisfy the grammar for number.
                if (c >= '0'  &&  c <= '9'  ||  c == '-'  ||  c == '+'  ||  c == '.'  ||  c == 'E'  ||  c == 'e')
                {
                    number.append (c);
                    continue;
                }
                reader.reset ();
                node.set (number.toString ());
                break;
            }

            if (c == ' '  ||  c == '\t'  ||  c == '\r'  ||  c == '\n') continue;
            if (c == '{')
            {
                readChildren (node, reader);
            }
            else if (c == '[')
            {
                readArray (node, reader);
            }
            else if (c == '"')
            {
                node.set (extractString (reader));
            }
            else if (c == 't')
            {
                expect (reader, "rue");
                node.set ("1");
            }
            else if (c == 'f')
            {
                expect (reader, "alse");
                node.set ("0");
            }
            else if (c == 'n')
            {
                expect (reader, "ull");
                node.set ((String) null);
            }
            else if (c >= '0'  &&  c <= '9'  ||  c == '-')
            {
                number = new StringBuilder ();
                number.append (c);
                continue;
            }
            else
            {
                throw new IOException ("Unexpected character '" + c + "'");
            }
            break;
        }
    }

    protected void expect (BufferedReader reader, String rest) throws IOException
    {
        char[] buffer = new char[rest.length ()];
        int count = reader.read (buffer);
        if (count < buffer.length  ||  ! rest.equals (new String (buffer))) throw new IOException ("Incomplete token");
    }

    /**
        Starting with reader just after the curly brace, consume the key-values in this JSON object.
        Ends with the reader just after the closing curly brace.
    **/
    public void readChildren (MNode node, BufferedReader reader) throws IOException
    {
        int state = 0;  // looking for: 0=key, 1=colon, 2=comma
        String key = "";
        while (true)
        {
            int i = reader.read ();
            if (i < 0) throw new IOException ("Unterminated object");
            char c = (char) i;
            if (c == ' '  ||  c == '\t'  ||  c == '\r'  ||  c == '\n') continue;
            if (c == '}') break;

            switch (state)
            {
                case 0:
                    if (c != '"') throw new IOException ("Expected string");
                    key = extractString (reader);
                    state = 1;
                    break;
                case 1:
                    if (c != ':') throw new IOException ("Expected colon");
                    MNode child = node.childOrCreate (key);
                    read (child, reader);
                    state = 2;
                    break;
                case 2:
                    if (c != ',') throw new IOException ("Expected comma or closing brace");
                    key = "";
                    state = 0;
                    break;
            }
        }

        // If there is a child with key "", convert it into node value.
        MNode child = node.child ("");
        if (child != null)
        {
            node.set (child.get ());
            node.clear ("");
        }
    }

    /**
        Starting with reader just after the square brace, consume array values.
        Keys will be created automatically as integers 0, 1, 2, ...
    **/
    public void readArray (MNode node, BufferedReader reader) throws IOException
    {
        int key = 0;
        while (true)
        {
            reader.mark (1);
            int i = reader.read ();
            if (i < 0) throw new IOException ("Unterminated array");
            char c = (char) i;
            if (c == ' '  ||  c == '\t'  ||  c == '\r'  ||  c == '\n') continue;
            if (c == ']') break;

            if (c == ',')
            {
                key++;
                continue;
            }

            reader.reset ();
            MNode child = node.childOrCreate (String.valueOf (key));
            read (child, reader);
        }
    }

    /**
        This is the start point for writing a JSON file.
        It can write either the value or children of node, depending on what is present.
    **/
    public void write (MNode node, Writer writer) throws IOException
    {
        writeValue (node, writer, "");
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        if (compact) writer.append (escape (node.key ()) + ":");
        else         writer.append (indent + escape (node.key ()) + ": ");
        writeValue (node, writer, indent);
    }

    /**
        Picking up just after key and colon, this writes the value for a node.
        @param indent Leading space in front of the key for which we are writing the value.
    **/
    public void writeValue (MNode node, Writer writer, String indent) throws IOException
    {
        if (node.isEmpty ())
        {
            if (node.data ()) writer.append (convertValue (node));
            else              writer.append ("null");
            return;
        }

        // An array has keys 0, 1, 2, ... with no breaks in the sequence and no other kind of key.
        boolean isArray = ! node.data ();
        if (isArray)
        {
            int i = 0;
            for (MNode c : node)
            {
                if (c.key ().equals (String.valueOf (i++))) continue;
                isArray = false;
                break;
            }
        }

        String indent2 = indent + tab;
        String newLine = compact ? "" : "\n";
        if (isArray)
        {
            writer.append ("[" + newLine);
            boolean first = true;
            for (MNode c : node)
            {
                if (! first) writer.append ("," + newLine);
                if (! compact) writer.append (indent2);
                writeValue (c, writer, indent2);
                first = false;
            }
            writer.append (newLine + (compact ? "" : indent) + "]");
        }
        else
        {
            writer.append ("{" + newLine);
            if (node.data ())
            {
                if (compact) writer.append ("\"\":" + convertValue (node) + ",");
                else         writer.append (indent2 + "\"\": " + convertValue (node) + ",\n");
            }
            boolean first = true;
            for (MNode c : node)
            {
                if (! first) writer.append ("," + newLine);
                write (c, writer, indent2);
                first = false;
            }
            writer.append (newLine + (compact ? "" : indent) + "}");
        }
    }

    public String convertValue (MNode node)
    {
        return escape (node.get ());
    }

    /**
        Given an arbitrary string, convert to a JSON string, complete with opening and closing quote marks.
    **/
    public static String escape (String value)
    {
        StringBuilder result = new StringBuilder ();
        result.append ('"');
        int count = value.length ();
        for (int i = 0; i < count; i++)
        {
            char c = value.charAt (i);
            switch (c)
            {
                case '\\': result.append ("\\\\"); break;
                case '"':  result.append ("\\\""); break;
                case '\b': result.append ("\\b");  break;
                case '\f': result.append ("\\f");  break;
                case '\n': result.append ("\\n");  break;
                case '\r': result.append ("\\r");  break;
                case '\t': result.append ("\\t");  break;
                default:
                    if (c < 0x20) result.append (String.format ("\\u%04x", (int) c));
                    else          result.append (c);
            }
        }
        result.append ('"');
        return result.toString ();
    }

    /**
        Starting just after a quote mark has been extracted from reader, consumes
        characters until the quote closes. Returns the extracted string with escapes
        converted back into regular characters.
    **/
    public static String extractString (Reader reader) throws IOException
    {
        StringBuilder result = new StringBuilder ();
        boolean inEscape = false;
        while (true)
        {
            int i = reader.read ();
            if (i < 0) throw new IOException ("Unterminated string");
            char c = (char) i;
            if (inEscape)
            {
                switch (c)
                {
                    case 'b': result.append ("\b"); break;
                    case 'f': result.append ("\f"); break;
                    case 'n': result.append ("\n"); break;
                    case 'r': result.append ("\r"); break;
                    case 't': result.append ("\t"); break;
                    case 'u':
                        char[] buffer = new char[4];
                        int count = reader.read (buffer);
                        if (count < 4) throw new IOException ("Short read on hex string");
                        try
                        {
                            result.append ((char) Integer.parseInt (new String (buffer), 16));
                        }
                        catch (NumberFormatException e)
                        {
                            throw new IOException ("Malformed hex escape", e);
                        }
                        break;
                    default:  result.append (c);  // Quote mark and both slashes.
                }
                inEscape = false;
            }
            else if (c == '\\')
            {
                inEscape = true;
            }
            else if (c == '"')
            {
                break;
            }
            else
            {
                result.append (c);
            }
        }
        return result.toString ();
    }
}
