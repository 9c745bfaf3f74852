/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.tusk.db.MNode;

/**
    Where the document came from: the source format and the preamble that the
    canonical document has no place for.
**/
public class FormatOrigin implements Record
{
    public String       format   = "";
    public String       version  = "";  // Empty if the source declared none.
    public String       language = "";  // Pitch-name language, if declared.
    public List<String> includes = new ArrayList<String> ();

    public FormatOrigin ()
    {
    }

    public FormatOrigin (String format)
    {
        this.format = format;
    }

    public void write (MNode node)
    {
        node.set (format, "format");
        if (! version .isEmpty ()) node.set (version,  "version");
        if (! language.isEmpty ()) node.set (language, "language");
        for (String i : includes) node.childOrCreate ("includes").append (i);
    }

    public static FormatOrigin read (MNode node)
    {
        FormatOrigin result = new FormatOrigin (node.get ("format"));
        result.version  = node.get ("version");
        result.language = node.get ("language");
        for (MNode i : node.childOrEmpty ("includes")) result.includes.add (i.get ());
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof FormatOrigin)) return false;
        FormatOrigin that = (FormatOrigin) o;
        return format.equals (that.format)  &&  version.equals (that.version)  &&  language.equals (that.language)  &&  includes.equals (that.includes);
    }

    @Override
    public int hashCode ()
    {
        return format.hashCode () ^ version.hashCode ();
    }
}
