/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    Grace notes: \grace, \acciaccatura, \appoggiatura, \slashedGrace, or \afterGrace.
    Only \afterGrace has main music, which the grace notes follow.
**/
public class Grace extends Music
{
    public static final String[] KINDS = {"grace", "acciaccatura", "appoggiatura", "slashedGrace", "afterGrace"};

    public String   kind;
    public Rational fraction;  // \afterGrace only. Null when not written.
    public Music    main;
    public Music    music;

    public Grace (String kind, Music music)
    {
        this.kind  = kind;
        this.music = music;
    }

    public static boolean isKind (String word)
    {
        for (String k : KINDS) if (k.equals (word)) return true;
        return false;
    }

    public List<Music> children ()
    {
        List<Music> result = new ArrayList<Music> ();
        if (main != null) result.add (main);
        result.add (music);
        return result;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ('\\').append (kind).append (' ');
        if (fraction != null) renderer.append (fraction.numerator + "/" + fraction.denominator).append (' ');
        if (main != null)
        {
            main.render (renderer);
            renderer.append (' ');
        }
        music.render (renderer);
    }
}
