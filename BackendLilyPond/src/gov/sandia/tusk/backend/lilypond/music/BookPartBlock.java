/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

public class BookPartBlock extends BookBlock
{
    public BookPartBlock ()
    {
        super ("bookpart");
    }
}
