/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.Set;
import java.util.TreeSet;

import gov.sandia.tusk.db.MNode;

/**
    Flags that need no payload, such as "this chord was written as q".
**/
public class Markers implements Record
{
    public static final String CHORD_REPETITION = "chordRepetition";
    public static final String PHRASING_SLUR    = "phrasingSlur";
    public static final String LYRIC_EXTENDER   = "lyricExtender";
    public static final String PITCHED_REST     = "pitchedRest";
    public static final String BEAM_MANUAL      = "beamManual";
    public static final String SHORTHAND        = "shorthand";   // \chords, \drums, \lyrics, \figures
    public static final String BARE             = "bare";        // Music written without enclosing braces
    public static final String SEPARATED        = "separated";   // Voices divided by a double backslash
    public static final String IMPLICIT_SCORE   = "implicitScore";
    public static final String SIMULTANEOUS     = "simultaneous";  // Staves enclosed in << >>
    public static final String CUSTOM_ID        = "customID";      // Id chosen by the author with \tweak id

    public Set<String> flags = new TreeSet<String> ();

    public Markers ()
    {
    }

    public Markers (String... flags)
    {
        for (String f : flags) this.flags.add (f);
    }

    public boolean has (String flag)
    {
        return flags.contains (flag);
    }

    public void write (MNode node)
    {
        for (String f : flags) node.set (true, f);
    }

    public static Markers read (MNode node)
    {
        Markers result = new Markers ();
        for (MNode f : node) if (f.getFlag ()) result.flags.add (f.key ());
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        return o instanceof Markers  &&  flags.equals (((Markers) o).flags);
    }

    @Override
    public int hashCode ()
    {
        return flags.hashCode ();
    }
}
