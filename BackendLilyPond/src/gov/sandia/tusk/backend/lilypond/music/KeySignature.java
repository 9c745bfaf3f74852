/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    \key tonic \mode
**/
public class KeySignature extends Music
{
    public static final String[] MODES = {"major", "minor", "ionian", "dorian", "phrygian", "lydian", "mixolydian", "aeolian", "locrian"};

    /**
        Position of each mode's tonic on the circle of fifths, relative to the major key on the same note.
    **/
    public static final int[] MODE_OFFSET = {0, -3, 0, -2, -4, 1, -1, -3, -5};

    public Pitch  tonic;
    public String mode;

    public KeySignature (Pitch tonic, String mode)
    {
        this.tonic = tonic;
        this.mode  = mode;
    }

    public static boolean isMode (String word)
    {
        for (String m : MODES) if (m.equals (word)) return true;
        return false;
    }

    /**
        @return Number of sharps (positive) or flats (negative) in the signature.
    **/
    public int fifths ()
    {
        // Fifths for each natural step in major: c=0 d=2 e=4 f=-1 g=1 a=3 b=5
        int[] natural = {0, 2, 4, -1, 1, 3, 5};
        int result = natural[tonic.stepIndex ()] + (int) Math.round (tonic.alteration) * 7;
        for (int i = 0; i < MODES.length; i++) if (MODES[i].equals (mode)) result += MODE_OFFSET[i];
        return result;
    }

    /**
        @return The signature in the form used by the key.sig attribute, such as "2s", "3f" or "0".
    **/
    public String keySig ()
    {
        int f = fifths ();
        if (f > 0) return f + "s";
        if (f < 0) return -f + "f";
        return "0";
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\key ").append (tonic.toString ()).append (" \\").append (mode);
    }
}
