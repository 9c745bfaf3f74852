/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.language;

/**
    Tokenizer failure: an invalid character, or a string, comment or embedded
    expression that runs to the end of input.
**/
@SuppressWarnings("serial")
public class LexException extends ParseException
{
    public LexException (String message, int offset)
    {
        super (message, offset);
    }
}
