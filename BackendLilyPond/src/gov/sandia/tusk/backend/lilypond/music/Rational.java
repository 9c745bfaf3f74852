/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    Exact fraction, always kept in lowest terms with a positive denominator.
**/
public class Rational implements Comparable<Rational>
{
    public final long numerator;
    public final long denominator;

    public static final Rational ZERO = new Rational (0);
    public static final Rational ONE  = new Rational (1);

    public Rational (long value)
    {
        numerator   = value;
        denominator = 1;
    }

    public Rational (long numerator, long denominator)
    {
        if (denominator == 0) throw new ArithmeticException ("Zero denominator");
        if (denominator < 0)
        {
            numerator   = -numerator;
            denominator = -denominator;
        }
        long g = gcd (Math.abs (numerator), denominator);
        if (g > 1)
        {
            numerator   /= g;
            denominator /= g;
        }
        this.numerator   = numerator;
        this.denominator = denominator;
    }

    public static long gcd (long a, long b)
    {
        while (b != 0)
        {
            long t = a % b;
            a = b;
            b = t;
        }
        return a == 0 ? 1 : a;
    }

    /**
        Accepts "n" or "n/d".
    **/
    public static Rational parse (String text)
    {
        int slash = text.indexOf ('/');
        if (slash < 0) return new Rational (Long.parseLong (text.trim ()));
        return new Rational (Long.parseLong (text.substring (0, slash).trim ()), Long.parseLong (text.substring (slash + 1).trim ()));
    }

    public Rational add (Rational that)
    {
        return new Rational (numerator * that.denominator + that.numerator * denominator, denominator * that.denominator);
    }

    public Rational subtract (Rational that)
    {
        return new Rational (numerator * that.denominator - that.numerator * denominator, denominator * that.denominator);
    }

    public Rational multiply (Rational that)
    {
        return new Rational (numerator * that.numerator, denominator * that.denominator);
    }

    public Rational multiply (long factor)
    {
        return new Rational (numerator * factor, denominator);
    }

    public Rational divide (Rational that)
    {
        return new Rational (numerator * that.denominator, denominator * that.numerator);
    }

    public boolean isPositive ()
    {
        return numerator > 0;
    }

    public boolean isOne ()
    {
        return numerator == 1  &&  denominator == 1;
    }

    public double doubleValue ()
    {
        return (double) numerator / denominator;
    }

    public int compareTo (Rational that)
    {
        return Long.compare (numerator * that.denominator, that.numerator * denominator);
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof Rational)) return false;
        Rational that = (Rational) o;
        return numerator == that.numerator  &&  denominator == that.denominator;
    }

    @Override
    public int hashCode ()
    {
        return Long.hashCode (numerator) * 31 + Long.hashCode (denominator);
    }

    public String toString ()
    {
        if (denominator == 1) return String.valueOf (numerator);
        return numerator + "/" + denominator;
    }
}
