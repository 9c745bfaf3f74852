/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

/**
    How the pitches below an element were written in the source. Pitches are kept
    as source text, since only the text front end knows how to read them.
**/
public class PitchContext implements Record
{
    public static final String RELATIVE  = "relative";
    public static final String FIXED     = "fixed";
    public static final String TRANSPOSE = "transpose";

    public String kind;
    public String reference = "";  // relative (optional) or fixed
    public String from      = "";  // transpose
    public String to        = "";  // transpose

    public PitchContext (String kind)
    {
        this.kind = kind;
    }

    public static PitchContext relative (String reference)
    {
        PitchContext result = new PitchContext (RELATIVE);
        if (reference != null) result.reference = reference;
        return result;
    }

    public static PitchContext fixed (String reference)
    {
        PitchContext result = new PitchContext (FIXED);
        result.reference = reference;
        return result;
    }

    public static PitchContext transpose (String from, String to)
    {
        PitchContext result = new PitchContext (TRANSPOSE);
        result.from = from;
        result.to   = to;
        return result;
    }

    public void write (MNode node)
    {
        node.set (kind, "kind");
        if (! reference.isEmpty ()) node.set (reference, "reference");
        if (! from     .isEmpty ()) node.set (from,      "from");
        if (! to       .isEmpty ()) node.set (to,        "to");
    }

    public static PitchContext read (MNode node)
    {
        PitchContext result = new PitchContext (node.get ("kind"));
        result.reference = node.get ("reference");
        result.from      = node.get ("from");
        result.to        = node.get ("to");
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof PitchContext)) return false;
        PitchContext that = (PitchContext) o;
        return kind.equals (that.kind)  &&  reference.equals (that.reference)  &&  from.equals (that.from)  &&  to.equals (that.to);
    }

    @Override
    public int hashCode ()
    {
        return kind.hashCode () * 31 + reference.hashCode ();
    }
}
