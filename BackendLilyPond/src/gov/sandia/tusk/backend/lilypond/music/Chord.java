/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    Simultaneous notes sharing one duration. Members carry no duration of their own,
    but may have their own tweaks and post-events.
**/
public class Chord extends Event
{
    public List<Note> notes = new ArrayList<Note> ();

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
