/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.language;

/**
    Failure while translating between the music tree and the canonical document.
    A structural error means the result would be wrong, so the conversion stops.
    A cosmetic error only loses presentation detail; callers log it and continue
    with a fallback.
**/
@SuppressWarnings("serial")
public class ConversionException extends Exception
{
    public boolean structural = true;
    public String  elementID  = "";  // Canonical element involved, if known.

    public ConversionException (String message)
    {
        super (message);
    }

    public ConversionException (String message, Throwable cause)
    {
        super (message, cause);
    }

    public ConversionException (String message, boolean structural)
    {
        super (message);
        this.structural = structural;
    }

    public static ConversionException cosmetic (String message)
    {
        return new ConversionException (message, false);
    }

    public ConversionException at (String elementID)
    {
        this.elementID = elementID;
        return this;
    }

    public String getMessage ()
    {
        String result = super.getMessage ();
        if (! elementID.isEmpty ()) result += " (element " + elementID + ")";
        return result;
    }
}
