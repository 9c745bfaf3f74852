/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import gov.sandia.tusk.backend.lilypond.music.ChordModeEntry;
import gov.sandia.tusk.backend.lilypond.music.Pitch;
import gov.sandia.tusk.mei.Element;
import gov.sandia.tusk.mei.MEI;

/**
    Correspondence tables between LilyPond names and document attribute values.
**/
public class Symbols
{
    /**
        Canonical clef names with their shape and line. Other names survive through a label.
    **/
    public static final String[][] clefs =
    {
        {"treble",       "G",    "2"},
        {"french",       "G",    "1"},
        {"bass",         "F",    "4"},
        {"varbaritone",  "F",    "3"},
        {"subbass",      "F",    "5"},
        {"alto",         "C",    "3"},
        {"tenor",        "C",    "4"},
        {"soprano",      "C",    "1"},
        {"mezzosoprano", "C",    "2"},
        {"baritone",     "C",    "5"},
        {"percussion",   "perc", null},
        {"tab",          "TAB",  null}
    };

    public static final String[][] bars =
    {
        {"|",    "single"},
        {"||",   "dbl"},
        {"|.",   "end"},
        {".|:",  "rptstart"},
        {":|.",  "rptend"},
        {":..:", "rptboth"},
        {"!",    "dashed"},
        {";",    "dotted"}
    };

    /**
        Fills in clef attributes.
        @return true if the name is fully described by the attributes.
    **/
    public static boolean lowerClef (String name, Element e)
    {
        String base   = name;
        String suffix = "";
        int cut = -1;
        for (int i = 0; i < name.length (); i++)
        {
            char c = name.charAt (i);
            if (c == '_'  ||  c == '^')
            {
                cut = i;
                break;
            }
        }
        if (cut >= 0)
        {
            base   = name.substring (0, cut);
            suffix = name.substring (cut);
        }

        String[] entry = null;
        for (String[] c : clefs) if (c[0].equals (base)) entry = c;
        if (entry == null) return false;

        e.set (MEI.SHAPE, entry[1]);
        if (entry[2] != null) e.set (MEI.LINE, entry[2]);
        if (suffix.isEmpty ()) return true;
        if (! suffix.equals ("_8")  &&  ! suffix.equals ("^8")  &&  ! suffix.equals ("_15")  &&  ! suffix.equals ("^15")) return false;
        e.set (MEI.DIS, suffix.substring (1));
        e.set (MEI.DIS_PLACE, suffix.charAt (0) == '_' ? "below" : "above");
        return true;
    }

    /**
        @return The clef name described by the attributes, or null if no canonical name matches.
    **/
    public static String raiseClef (Element e)
    {
        String shape = e.get (MEI.SHAPE, "");
        String line  = e.get (MEI.LINE,  "");
        for (String[] c : clefs)
        {
            if (! c[1].equals (shape)) continue;
            if (c[2] != null  &&  ! c[2].equals (line)) continue;
            String result = c[0];
            if (e.has (MEI.DIS)) result += (e.get (MEI.DIS_PLACE, "below").equals ("above") ? "^" : "_") + e.get (MEI.DIS);
            return result;
        }
        return null;
    }

    public static String barForm (String style)
    {
        for (String[] b : bars) if (b[0].equals (style)) return b[1];
        return null;
    }

    public static String barStyle (String form)
    {
        for (String[] b : bars) if (b[1].equals (form)) return b[0];
        return null;
    }

    /**
        @return The accid value for an alteration in semitones, or null if it has none.
    **/
    public static String accidental (double alteration)
    {
        int index = (int) Math.round (alteration * 2) + 4;
        if (index < 0  ||  index >= MEI.accidentals.length) return null;
        return MEI.accidentals[index];
    }

    /**
        @return The alteration in semitones for an accid value, or 0 if it is not recognized.
    **/
    public static double alteration (String accid)
    {
        if (accid == null) return 0;
        for (int i = 0; i < MEI.accidentals.length; i++) if (MEI.accidentals[i].equals (accid)) return (i - 4) / 2.0;
        return 0;
    }

    /**
        Builds a conventional chord symbol such as "Bb7" or "Cm7/E".
    **/
    public static String chordSymbol (ChordModeEntry entry)
    {
        StringBuilder result = new StringBuilder ();
        result.append (letter (entry.root));
        if (entry.modifiers != null  &&  ! entry.modifiers.equals ("5")) result.append (entry.modifiers);
        Pitch under = entry.inversion != null ? entry.inversion : entry.bass;
        if (under != null) result.append ('/').append (letter (under));
        return result.toString ();
    }

    public static String letter (Pitch p)
    {
        StringBuilder result = new StringBuilder ();
        result.append (Character.toUpperCase (p.step));
        int semitones = (int) Math.round (p.alteration);
        for (int i = 0; i <  semitones; i++) result.append ('#');
        for (int i = 0; i > semitones; i--) result.append ('b');
        return result.toString ();
    }

    /**
        Converts a chord symbol back to chord-mode source text, such as "bes:7" or "c:m7/e".
        @return The text, or null if the symbol does not start with a note letter.
    **/
    public static String chordModeText (String symbol)
    {
        symbol = symbol.trim ();
        if (symbol.isEmpty ()) return null;
        String bass = null;
        int slash = symbol.indexOf ('/');
        if (slash > 0)
        {
            bass   = symbol.substring (slash + 1);
            symbol = symbol.substring (0, slash);
        }

        int[] end = new int[1];
        String root = noteName (symbol, end);
        if (root == null) return null;
        String result = root;
        String rest = symbol.substring (end[0]);
        if (! rest.isEmpty ()) result += ":" + rest;
        if (bass != null)
        {
            String b = noteName (bass, end);
            if (b == null  ||  end[0] != bass.length ()) return null;
            result += "/" + b;
        }
        return result;
    }

    protected static String noteName (String symbol, int[] end)
    {
        if (symbol.isEmpty ()) return null;
        char step = Character.toLowerCase (symbol.charAt (0));
        if (Pitch.STEPS.indexOf (step) < 0) return null;
        int i = 1;
        double alteration = 0;
        while (i < symbol.length ())
        {
            char c = symbol.charAt (i);
            if      (c == '#') alteration += 1;
            else if (c == 'b') alteration -= 1;
            else break;
            i++;
        }
        end[0] = i;
        return new Pitch (step, alteration, 0).name ();
    }
}
