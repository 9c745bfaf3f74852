/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    \time n/d, where the numerator may be a sum such as 2+3.
**/
public class TimeSignature extends Music
{
    public List<Integer> numerators = new ArrayList<Integer> ();
    public int           denominator;

    public TimeSignature (int numerator, int denominator)
    {
        numerators.add (numerator);
        this.denominator = denominator;
    }

    public TimeSignature (List<Integer> numerators, int denominator)
    {
        this.numerators.addAll (numerators);
        this.denominator = denominator;
    }

    public int count ()
    {
        int result = 0;
        for (int n : numerators) result += n;
        return result;
    }

    public String numeratorText ()
    {
        StringBuilder result = new StringBuilder ();
        for (int n : numerators)
        {
            if (result.length () > 0) result.append ('+');
            result.append (n);
        }
        return result.toString ();
    }

    /**
        @return Length of one measure, in whole notes.
    **/
    public Rational measureLength ()
    {
        return new Rational (count (), denominator);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\time ").append (numeratorText ()).append ('/').append (String.valueOf (denominator));
    }
}
