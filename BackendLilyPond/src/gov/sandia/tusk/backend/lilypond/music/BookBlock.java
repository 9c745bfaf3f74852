/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    \book or \bookpart, holding scores and output definitions.
**/
public class BookBlock extends Toplevel
{
    public String         kind;  // book or bookpart
    public List<Toplevel> items = new ArrayList<Toplevel> ();

    public BookBlock (String kind)
    {
        this.kind = kind;
    }

    public void render (Renderer renderer)
    {
        renderItems (renderer, kind, items);
    }
}
