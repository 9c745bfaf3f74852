/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

public class TupletInfo implements Record
{
    public int    numerator;
    public int    denominator;
    public String span = "";  // Optional tuplet-span duration, as source text.

    public TupletInfo (int numerator, int denominator)
    {
        this.numerator   = numerator;
        this.denominator = denominator;
    }

    public void write (MNode node)
    {
        node.set (numerator,   "numerator");
        node.set (denominator, "denominator");
        if (! span.isEmpty ()) node.set (span, "span");
    }

    public static TupletInfo read (MNode node)
    {
        TupletInfo result = new TupletInfo (node.getInt ("numerator"), node.getInt ("denominator"));
        result.span = node.get ("span");
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof TupletInfo)) return false;
        TupletInfo that = (TupletInfo) o;
        return numerator == that.numerator  &&  denominator == that.denominator  &&  span.equals (that.span);
    }

    @Override
    public int hashCode ()
    {
        return numerator * 31 + denominator;
    }
}
