/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    \context { ... } inside \layout or \midi, modifying or defining a context type.
**/
public class ContextBlock extends Toplevel
{
    public List<ContextMod> mods = new ArrayList<ContextMod> ();

    /**
        @return The name of the first context referenced in the block, such as "Staff", or null.
    **/
    public String contextName ()
    {
        for (ContextMod m : mods) if (m.kind == ContextMod.Kind.CONTEXT_REF) return m.argument;
        return null;
    }

    public void render (Renderer renderer)
    {
        renderer.append ("\\context ");
        ContextedMusic.renderMods (renderer, mods);
    }
}
