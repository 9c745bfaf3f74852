/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    Written duration: a power-of-two base, augmentation dots, and a chain of scaling factors.
    For example "4.*2/3" has base 4, one dot, and a single multiplier 2/3.
**/
public class Duration
{
    public static final int MAX_BASE = 2048;

    public int            base;
    public int            dots;
    public List<Rational> multipliers = new ArrayList<Rational> ();

    public Duration (int base)
    {
        this (base, 0);
    }

    public Duration (int base, int dots)
    {
        if (! isBase (base)) throw new IllegalArgumentException ("Duration base must be a power of two up to " + MAX_BASE + ": " + base);
        if (dots < 0)        throw new IllegalArgumentException ("Negative dot count");
        this.base = base;
        this.dots = dots;
    }

    public static boolean isBase (long value)
    {
        return value >= 1  &&  value <= MAX_BASE  &&  (value & (value - 1)) == 0;
    }

    public Duration multiply (Rational factor)
    {
        if (! factor.isPositive ()) throw new IllegalArgumentException ("Duration multiplier must be positive: " + factor);
        multipliers.add (factor);
        return this;
    }

    /**
        @return Length of the undotted, unscaled base, in whole notes.
    **/
    public Rational baseLength ()
    {
        return new Rational (1, base);
    }

    /**
        @return Length including dots but not multipliers, in whole notes.
    **/
    public Rational writtenLength ()
    {
        // base * (2 - 1/2^dots)
        long pow = 1L << dots;
        return new Rational (2 * pow - 1, base * pow);
    }

    /**
        @return Full length in whole notes.
    **/
    public Rational length ()
    {
        Rational result = writtenLength ();
        for (Rational m : multipliers) result = result.multiply (m);
        return result;
    }

    /**
        @return Product of all multipliers, or 1 if there are none.
    **/
    public Rational factor ()
    {
        Rational result = Rational.ONE;
        for (Rational m : multipliers) result = result.multiply (m);
        return result;
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        result.append (base);
        for (int i = 0; i < dots; i++) result.append ('.');
        for (Rational m : multipliers) result.append ('*').append (m.toString ());
        return result.toString ();
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof Duration)) return false;
        Duration that = (Duration) o;
        return base == that.base  &&  dots == that.dots  &&  multipliers.equals (that.multipliers);
    }

    @Override
    public int hashCode ()
    {
        return (base * 31 + dots) * 31 + multipliers.hashCode ();
    }
}
