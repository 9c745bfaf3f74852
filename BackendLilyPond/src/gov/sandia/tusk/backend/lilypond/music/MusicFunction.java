/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    A call to a music function that has no dedicated node, such as \tweak applied to music,
    \parenthesize or a user-defined function. Arguments are kept in source order.
**/
public class MusicFunction extends Music
{
    public String            name;
    public List<FunctionArg> args = new ArrayList<FunctionArg> ();
    public boolean           partial;  // Ends with \etc

    public MusicFunction (String name)
    {
        this.name = name;
    }

    public List<Music> children ()
    {
        List<Music> result = new ArrayList<Music> ();
        for (FunctionArg a : args) if (a.music != null) result.add (a.music);
        return result;
    }

    public boolean isBlock ()
    {
        for (FunctionArg a : args) if (a.music != null  &&  a.music.isBlock ()) return true;
        return false;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ('\\').append (name);
        for (FunctionArg a : args)
        {
            renderer.append (' ');
            a.render (renderer);
        }
        if (partial) renderer.append (" \\etc");
    }
}
