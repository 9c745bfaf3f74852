/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

public class DrumChord extends Event
{
    public List<DrumNote> notes = new ArrayList<DrumNote> ();

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderTweaks (renderer);
        renderer.append ('<');
        renderer.render (notes);
        renderer.append ('>');
        renderDuration (renderer);
        renderPostEvents (renderer);
    }
}
