/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    A figured-bass group such as <6 4+>. Each item keeps its written form, including alterations and brackets.
**/
public class Figure extends Event
{
    public List<String> figures = new ArrayList<String> ();

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderTweaks (renderer);
        renderer.append ('<').append (String.join (" ", figures)).append ('>');
        renderDuration (renderer);
        renderPostEvents (renderer);
    }
}
