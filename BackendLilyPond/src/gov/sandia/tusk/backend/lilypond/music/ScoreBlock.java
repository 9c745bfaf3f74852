/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    \score { music \header {...} \layout {...} \midi {...} }
**/
public class ScoreBlock extends Toplevel
{
    public List<Toplevel> items = new ArrayList<Toplevel> ();

    /**
        @return The first music item of the score, or null if it has none.
    **/
    public Music music ()
    {
        for (Toplevel t : items) if (t instanceof ToplevelMusic) return ((ToplevelMusic) t).music;
        return null;
    }

    public void render (Renderer renderer)
    {
        renderItems (renderer, "score", items);
    }
}
