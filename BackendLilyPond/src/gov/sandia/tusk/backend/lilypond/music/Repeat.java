/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    \repeat type count body, with optional \alternative endings.
**/
public class Repeat extends Music
{
    public static final String[] TYPES = {"volta", "unfold", "percent", "tremolo", "segno"};

    public String      type;
    public int         count;
    public Music       body;
    public List<Music> alternatives = new ArrayList<Music> ();

    public Repeat (String type, int count, Music body)
    {
        this.type  = type;
        this.count = count;
        this.body  = body;
    }

    public static boolean isType (String word)
    {
        for (String t : TYPES) if (t.equals (word)) return true;
        return false;
    }

    public List<Music> children ()
    {
        List<Music> result = new ArrayList<Music> ();
        result.add (body);
        result.addAll (alternatives);
        return result;
    }

    public boolean isBlock ()
    {
        if (body.isBlock ()) return true;
        for (Music m : alternatives) if (m.isBlock ()) return true;
        return false;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\repeat ").append (type).append (' ').append (String.valueOf (count)).append (' ');
        body.render (renderer);
        if (alternatives.isEmpty ()) return;
        renderer.append (" \\alternative { ");
        renderer.render (alternatives);
        renderer.append (" }");
    }
}
