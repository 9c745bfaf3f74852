/*
Copyright 2017-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.db;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
    Encapsulates the serialization method used for a particular file.
    The first line of the file names the schema version and the type of content,
    for example "Tusk.schema=1,extensions". Everything after that line is expressed
    in the format of the selected subclass.
**/
public class Schema
{
    public static final String HEADER = "Tusk.schema";

    public int    version;  // of schema. Version 0 means unknown. Otherwise, version is always positive and increments by 1 with each significant change.
    public String type;

    public Schema (int version, String type)
    {
        this.version = version;
        this.type    = type;
    }

    public static Schema latest ()
    {
        return new Schema1 (1, "");
    }

    public static Schema latest (String type)
    {
        return new Schema1 (1, type);
    }

    /**
        Convenience method which reads the header and loads all the objects as children of the given node.
    **/
    public static Schema readAll (MNode node, Reader reader) throws IOException
    {
        BufferedReader br;
        boolean alreadyBuffered = reader instanceof BufferedReader;
        if (alreadyBuffered) br =    (BufferedReader) reader;
        else                 br = new BufferedReader (reader);
        Schema result = read (br);
        result.read (node, br);
        if (! alreadyBuffered) br.close ();
        return result;
    }

    public static Schema read (BufferedReader reader) throws IOException
    {
        String line = reader.readLine ();
        if (line == null) throw new IOException ("File is empty.");
        line = line.trim ();
        if (! line.startsWith (HEADER)) throw new IOException ("Schema line not found.");
        int length = HEADER.length ();
        if (line.length () < length + 2) throw new IOException ("Malformed schema line.");
        if (line.charAt (length) != '=') throw new IOException ("Malformed schema line.");
        String[] pieces = line.substring (length + 1).split (",", 2);
        int version;
        try
        {
            version = Integer.parseInt (pieces[0].trim ());
        }
        catch (NumberFormatException e)
        {
            throw new IOException ("Malformed schema version: " + pieces[0], e);
        }
        String type = "";
        if (pieces.length >= 2) type = pieces[1].trim ();

        if (version > 1) throw new IOException ("Unsupported schema version " + version);
        return new Schema1 (version, type);
    }

    public void read (MNode node, Reader reader) throws IOException
    {
        throw new UnsupportedOperationException ("Must use specific schema to read file.");
    }

    /**
        Convenience method which writes the header and all the children of the given node.
        The node itself (that is, its key and value) are not written out. The node simply acts
        as a container for the nodes that get written.
    **/
    public void writeAll (MNode node, Writer writer) throws IOException
    {
        write (writer);
        for (MNode c : node) write (c, writer, "");
    }

    public void write (Writer writer) throws IOException
    {
        writer.write (HEADER + "=" + version);
        if (! type.isEmpty ()) writer.write ("," + type);
        writer.write (String.format ("%n"));
    }

    /**
        Convenience function for calling write(MNode,Writer,String) with no initial indent.
        Intended for in-memory writers, so I/O failures are rethrown unchecked.
    **/
    public void write (MNode node, Writer writer)
    {
        try
        {
            write (node, writer, "");
        }
        catch (IOException e)
        {
            throw new UncheckedIOException (e);
        }
    }

    public void write (MNode node, Writer writer, String indent) throws IOException
    {
        throw new UnsupportedOperationException ("Must use specific schema to write file.");
    }
}
