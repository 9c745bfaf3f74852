/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.HashMap;
import java.util.Map;

/**
    Drum-mode instrument names, both long and abbreviated, mapped to General MIDI percussion keys.
**/
public class DrumPitch
{
    public static final Map<String,Integer> names = new HashMap<String,Integer> ();
    static
    {
        add (35, "acousticbassdrum", "bda");
        add (36, "bassdrum",         "bd");
        add (37, "sidestick",        "ss");
        add (37, "hisidestick",      "ssh");
        add (37, "losidestick",      "ssl");
        add (38, "acousticsnare",    "sna");
        add (38, "snare",            "sn");
        add (39, "handclap",         "hc");
        add (40, "electricsnare",    "sne");
        add (41, "lowfloortom",      "tomfl");
        add (42, "closedhihat",      "hhc");
        add (42, "hihat",            "hh");
        add (43, "highfloortom",     "tomfh");
        add (44, "pedalhihat",       "hhp");
        add (45, "lowtom",           "toml");
        add (46, "openhihat",        "hho");
        add (46, "halfopenhihat",    "hhho");
        add (47, "lowmidtom",        "tomml");
        add (48, "highmidtom",       "tommh");
        add (49, "crashcymbala",     "cymca");
        add (49, "crashcymbal",      "cymc");
        add (50, "hightom",          "tomh");
        add (51, "ridecymbala",      "cymra");
        add (51, "ridecymbal",       "cymr");
        add (52, "chinesecymbal",    "cymch");
        add (53, "ridebell",         "rb");
        add (54, "tambourine",       "tamb");
        add (55, "splashcymbal",     "cyms");
        add (56, "cowbell",          "cb");
        add (57, "crashcymbalb",     "cymcb");
        add (58, "vibraslap",        "vibs");
        add (59, "ridecymbalb",      "cymrb");
        add (60, "hibongo",          "boh");
        add (61, "lobongo",          "bol");
        add (62, "mutehiconga",      "cghm");
        add (63, "openhiconga",      "cgho");
        add (63, "hiconga",          "cgh");
        add (64, "loconga",          "cgl");
        add (64, "openloconga",      "cglo");
        add (64, "muteloconga",      "cglm");
        add (65, "hitimbale",        "timh");
        add (66, "lotimbale",        "timl");
        add (67, "hiagogo",          "agh");
        add (68, "loagogo",          "agl");
        add (69, "cabasa",           "cab");
        add (70, "maracas",          "mar");
        add (71, "shortwhistle",     "whs");
        add (72, "longwhistle",      "whl");
        add (73, "shortguiro",       "guis");
        add (74, "longguiro",        "guil");
        add (74, "guiro",            "gui");
        add (75, "claves",           "cl");
        add (76, "hiwoodblock",      "wbh");
        add (77, "lowoodblock",      "wbl");
        add (78, "mutecuica",        "cuim");
        add (79, "opencuica",        "cuio");
        add (80, "mutetriangle",     "trim");
        add (81, "triangle",         "tri");
        add (81, "opentriangle",     "trio");
        add (60, "mutehibongo",      "bohm");
        add (60, "openhibongo",      "boho");
        add (61, "mutelobongo",      "bolm");
        add (61, "openlobongo",      "bolo");
        add (52, "tamtam",           "tt");
    }

    protected static void add (int key, String name, String abbreviation)
    {
        names.put (name,         key);
        names.put (abbreviation, key);
    }

    public static boolean isDrumPitch (String word)
    {
        return names.containsKey (word);
    }

    /**
        @return The General MIDI key number, or -1 if the name is not a drum.
    **/
    public static int midi (String word)
    {
        Integer result = names.get (word);
        if (result == null) return -1;
        return result;
    }
}
