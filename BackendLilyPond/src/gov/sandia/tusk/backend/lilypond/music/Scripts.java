/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
    Tables of the named post-events the parser recognizes after a note.
    An escaped word not listed here is left for the next item, where it reads as a function call or identifier.
**/
public class Scripts
{
    public static final Set<String> dynamics = new HashSet<String> (Arrays.asList
    (
        "ppppp", "pppp", "ppp", "pp", "p", "mp", "mf", "f", "ff", "fff", "ffff", "fffff",
        "fp", "sf", "sff", "sp", "spp", "sfz", "rfz", "fz", "n"
    ));

    /**
        Articulation names, mapped to the value of the artic attribute.
    **/
    public static final Map<String,String> articulations = new HashMap<String,String> ();
    static
    {
        articulations.put ("accent",        "acc");
        articulations.put ("staccato",      "stacc");
        articulations.put ("tenuto",        "ten");
        articulations.put ("staccatissimo", "stacciss");
        articulations.put ("marcato",       "marc");
        articulations.put ("portato",       "ten-stacc");
        articulations.put ("espressivo",    "espr");
        articulations.put ("upbow",         "upbow");
        articulations.put ("downbow",       "dnbow");
        articulations.put ("stopped",       "stop");
        articulations.put ("open",          "open");
        articulations.put ("flageolet",     "harm");
        articulations.put ("snappizzicato", "snap");
        articulations.put ("lheel",         "heel");
        articulations.put ("rheel",         "heel");
        articulations.put ("ltoe",          "toe");
        articulations.put ("rtoe",          "toe");
    }

    /**
        Shorthand articulations, written after a direction indicator.
    **/
    public static final Map<String,String> abbreviations = new HashMap<String,String> ();
    static
    {
        abbreviations.put (".", "staccato");
        abbreviations.put ("-", "tenuto");
        abbreviations.put (">", "accent");
        abbreviations.put ("^", "marcato");
        abbreviations.put ("+", "stopped");
        abbreviations.put ("!", "staccatissimo");
        abbreviations.put ("_", "portato");
    }

    public static final Set<String> fermatas = new HashSet<String> (Arrays.asList
    (
        "fermata", "shortfermata", "longfermata", "verylongfermata", "veryshortfermata",
        "henzeshortfermata", "henzelongfermata"
    ));

    public static final Set<String> ornaments = new HashSet<String> (Arrays.asList
    (
        "trill", "turn", "reverseturn", "prall", "prallup", "pralldown", "upprall", "downprall",
        "prallprall", "lineprall", "prallmordent", "mordent", "upmordent", "downmordent", "haydnturn",
        "slashturn"
    ));

    /**
        Everything else that attaches to a note: spanner starts and stops, pedal marks and miscellaneous signs.
    **/
    public static final Set<String> others = new HashSet<String> (Arrays.asList
    (
        "arpeggio", "glissando", "laissezVibrer", "repeatTie", "harmonic", "thumb", "halfopen",
        "startTrillSpan", "stopTrillSpan", "startTextSpan", "stopTextSpan", "startGroup", "stopGroup",
        "sustainOn", "sustainOff", "sostenutoOn", "sostenutoOff", "unaCorda", "treCorde",
        "cresc", "decresc", "dim", "segno", "coda", "varcoda", "signumcongruentiae",
        "accentus", "circulus", "ictus", "semicirculus", "espressivo"
    ));

    public static boolean isDynamic (String name)
    {
        return dynamics.contains (name);
    }

    public static boolean isScript (String name)
    {
        return articulations.containsKey (name)  ||  fermatas.contains (name)  ||  ornaments.contains (name)  ||  others.contains (name);
    }
}
