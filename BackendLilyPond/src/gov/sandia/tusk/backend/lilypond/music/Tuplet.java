/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Collections;
import java.util.List;

/**
    \tuplet n/d: plays n written notes in the time of d.
    The older \times d/n is read into the same form.
**/
public class Tuplet extends Music
{
    public int      numerator;
    public int      denominator;
    public Duration span;  // Grouping length for brackets. Null if not written.
    public Music    music;

    public Tuplet (int numerator, int denominator, Music music)
    {
        if (numerator <= 0  ||  denominator <= 0) throw new IllegalArgumentException ("Tuplet ratio must be positive: " + numerator + "/" + denominator);
        this.numerator   = numerator;
        this.denominator = denominator;
        this.music       = music;
    }

    /**
        @return The factor applied to each written duration inside, that is d/n.
    **/
    public Rational factor ()
    {
        return new Rational (denominator, numerator);
    }

    public List<Music> children ()
    {
        return Collections.singletonList (music);
    }

    public boolean isBlock ()
    {
        return music.isBlock ();
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\tuplet ").append (numerator + "/" + denominator).append (' ');
        if (span != null) renderer.append (span.toString ()).append (' ');
        music.render (renderer);
    }
}
