/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    A written pitch. Octave counts marks: c (no marks) is the octave below middle C,
    c' is middle C, c, is one octave lower.
    Only the Dutch (default) note names are interpreted.
**/
public class Pitch
{
    public static final String STEPS     = "cdefgab";
    public static final int[]  SEMITONES = {0, 2, 4, 5, 7, 9, 11};

    /**
        Reference that makes the first note of a \relative block without explicit start behave as absolute.
    **/
    public static final Pitch DEFAULT_RELATIVE = new Pitch ('f', 0, 0);

    public char    step;        // a through g
    public double  alteration;  // In semitones. 0.5 steps for quarter tones.
    public int     octave;      // Number of ' marks, or negative for , marks.
    public boolean force;       // !
    public boolean cautionary;  // ?
    public Integer octaveCheck; // Marks after =, or null if no check is present.

    public Pitch (char step, double alteration, int octave)
    {
        if (STEPS.indexOf (step) < 0) throw new IllegalArgumentException ("Not a pitch step: " + step);
        this.step       = step;
        this.alteration = alteration;
        this.octave     = octave;
    }

    public Pitch (Pitch that)
    {
        step        = that.step;
        alteration  = that.alteration;
        octave      = that.octave;
        force       = that.force;
        cautionary  = that.cautionary;
        octaveCheck = that.octaveCheck;
    }

    /**
        The reusable predicate that decides whether a bare word is a note name.
    **/
    public static boolean isNoteName (String word)
    {
        return alterationOf (word) != null;
    }

    /**
        @return The alteration named by the suffix of the word, or null if the word is not a note name.
    **/
    public static Double alterationOf (String word)
    {
        if (word == null  ||  word.isEmpty ()) return null;
        char step = word.charAt (0);
        if (STEPS.indexOf (step) < 0) return null;
        String suffix = word.substring (1);
        switch (suffix)
        {
            case "":     return 0.0;
            case "is":   return 1.0;
            case "isis": return 2.0;
            case "es":   return -1.0;
            case "eses": return -2.0;
            case "ih":   return 0.5;
            case "isih": return 1.5;
            case "eh":   return -0.5;
            case "eseh": return -1.5;
            case "s":
                if (step == 'a'  ||  step == 'e') return -1.0;
                return null;
            case "ses":
                if (step == 'a'  ||  step == 'e') return -2.0;
                return null;
        }
        return null;
    }

    /**
        @return A pitch with no octave marks, or null if the word is not a note name.
    **/
    public static Pitch fromName (String word)
    {
        Double alteration = alterationOf (word);
        if (alteration == null) return null;
        return new Pitch (word.charAt (0), alteration, 0);
    }

    /**
        @return The note name, without octave marks. a and e use the short flat forms.
    **/
    public String name ()
    {
        return step + suffix (step, alteration);
    }

    public static String suffix (char step, double alteration)
    {
        int halves = (int) Math.round (alteration * 2);
        boolean ae = step == 'a'  ||  step == 'e';
        switch (halves)
        {
            case  0: return "";
            case  1: return "ih";
            case  2: return "is";
            case  3: return "isih";
            case  4: return "isis";
            case -1: return "eh";
            case -2: return ae ? "s"   : "es";
            case -3: return "eseh";
            case -4: return ae ? "ses" : "eses";
        }
        throw new IllegalArgumentException ("No note name for alteration " + alteration);
    }

    public static String marks (int octave)
    {
        StringBuilder result = new StringBuilder ();
        for (int i = 0; i <  octave; i++) result.append ('\'');
        for (int i = 0; i > octave; i--) result.append (',');
        return result.toString ();
    }

    public int stepIndex ()
    {
        return STEPS.indexOf (step);
    }

    /**
        @return Octave number in scientific notation, where middle C is in octave 4.
    **/
    public int absoluteOctave ()
    {
        return octave + 3;
    }

    /**
        Diatonic step count from the c with no marks.
    **/
    public int diatonic ()
    {
        return octave * 7 + stepIndex ();
    }

    /**
        Chromatic distance, in semitones, from the c with no marks.
    **/
    public double semitones ()
    {
        return octave * 12 + SEMITONES[stepIndex ()] + alteration;
    }

    /**
        Interprets this pitch as written in relative mode.
        The result lies within a fourth of the reference, before this pitch's own marks shift it.
        @return A new absolute pitch. Force and cautionary flags are carried over.
    **/
    public Pitch resolveRelative (Pitch reference)
    {
        int nearest = reference.diatonic () + nearestStep (reference);
        Pitch result = new Pitch (this);
        result.octave = Math.floorDiv (nearest + octave * 7, 7);
        return result;
    }

    /**
        Inverse of resolveRelative().
        @return A new pitch whose marks, read relative to the reference, give this absolute pitch.
    **/
    public Pitch toRelative (Pitch reference)
    {
        int nearest = reference.diatonic () + nearestStep (reference);
        Pitch result = new Pitch (this);
        result.octave = (diatonic () - nearest) / 7;
        return result;
    }

    /**
        Signed diatonic distance from the reference's step to this pitch's step, in the range -3..3.
    **/
    protected int nearestStep (Pitch reference)
    {
        int diff = stepIndex () - reference.stepIndex ();
        while (diff >  3) diff -= 7;
        while (diff < -3) diff += 7;
        return diff;
    }

    /**
        Applies the interval from one pitch to another, preserving spelling.
    **/
    public Pitch transpose (Pitch from, Pitch to)
    {
        int    steps     = to.diatonic () - from.diatonic ();
        double semitones = to.semitones () - from.semitones ();
        int d = diatonic () + steps;
        Pitch result = new Pitch (this);
        result.octave     = Math.floorDiv (d, 7);
        result.step       = STEPS.charAt (Math.floorMod (d, 7));
        result.alteration = semitones () + semitones - (result.octave * 12 + SEMITONES[result.stepIndex ()]);
        return result;
    }

    public Pitch untranspose (Pitch from, Pitch to)
    {
        return transpose (to, from);
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        result.append (name ());
        result.append (marks (octave));
        if (force)      result.append ('!');
        if (cautionary) result.append ('?');
        if (octaveCheck != null) result.append ('=').append (marks (octaveCheck));
        return result.toString ();
    }

    /**
        Compares pitch identity only, ignoring the accidental display flags and octave check.
    **/
    public boolean samePitch (Pitch that)
    {
        return step == that.step  &&  alteration == that.alteration  &&  octave == that.octave;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof Pitch)) return false;
        Pitch that = (Pitch) o;
        if (! samePitch (that)) return false;
        if (force != that.force  ||  cautionary != that.cautionary) return false;
        if (octaveCheck == null) return that.octaveCheck == null;
        return octaveCheck.equals (that.octaveCheck);
    }

    @Override
    public int hashCode ()
    {
        return (step * 31 + Double.hashCode (alteration)) * 31 + octave;
    }
}
