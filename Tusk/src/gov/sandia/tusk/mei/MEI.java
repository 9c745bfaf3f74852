/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.mei;

/**
    Element and attribute names of the canonical document, along with the few
    value tables that more than one format needs.
**/
public class MEI
{
    public static final String NAMESPACE = "http://www.music-encoding.org/ns/mei";
    public static final String VERSION   = "5.0";

    // Attributes
    public static final String ID        = "xml:id";
    public static final String LABEL     = "label";
    public static final String N         = "n";
    public static final String STARTID   = "startid";
    public static final String ENDID     = "endid";
    public static final String DUR       = "dur";
    public static final String DOTS      = "dots";
    public static final String DUR_PPQ   = "dur.ppq";
    public static final String PPQ       = "ppq";
    public static final String PNAME     = "pname";
    public static final String OCT       = "oct";
    public static final String ACCID     = "accid";
    public static final String ACCID_GES = "accid.ges";
    public static final String FUNC      = "func";
    public static final String TIE       = "tie";
    public static final String GRACE     = "grace";
    public static final String TSTAMP    = "tstamp";
    public static final String STAFF     = "staff";
    public static final String PLACE     = "place";
    public static final String ARTIC     = "artic";
    public static final String FORM      = "form";
    public static final String NUM       = "num";
    public static final String NUMBASE   = "numbase";
    public static final String CON       = "con";
    public static final String WORDPOS   = "wordpos";
    public static final String LINES     = "lines";
    public static final String METER_COUNT = "meter.count";
    public static final String METER_UNIT  = "meter.unit";
    public static final String KEY_SIG     = "keysig";
    public static final String CLEF_SHAPE  = "clef.shape";
    public static final String CLEF_LINE   = "clef.line";
    public static final String TYPE      = "type";
    public static final String PNUM      = "pnum";
    public static final String SHAPE     = "shape";
    public static final String LINE      = "line";
    public static final String DIS       = "dis";
    public static final String DIS_PLACE = "dis.place";
    public static final String COUNT     = "count";
    public static final String UNIT      = "unit";
    public static final String SIG       = "sig";
    public static final String MODE      = "mode";
    public static final String MM        = "mm";
    public static final String MM_UNIT   = "mm.unit";
    public static final String MM_DOTS   = "mm.dots";
    public static final String RIGHT     = "right";
    public static final String LABEL_ABBR = "label.abbr";

    // Structure
    public static final String MEI_ROOT  = "mei";
    public static final String HEAD      = "meiHead";
    public static final String FILE_DESC = "fileDesc";
    public static final String TITLE_STMT = "titleStmt";
    public static final String TITLE     = "title";
    public static final String COMPOSER  = "composer";
    public static final String MUSIC     = "music";
    public static final String BODY      = "body";
    public static final String MDIV      = "mdiv";
    public static final String SCORE     = "score";
    public static final String SCORE_DEF = "scoreDef";
    public static final String STAFF_GRP = "staffGrp";
    public static final String STAFF_DEF = "staffDef";
    public static final String SECTION   = "section";
    public static final String MEASURE   = "measure";
    public static final String STAFF_EL  = "staff";
    public static final String LAYER     = "layer";

    // Events
    public static final String NOTE      = "note";
    public static final String REST      = "rest";
    public static final String MREST     = "mRest";
    public static final String SPACE     = "space";
    public static final String CHORD     = "chord";
    public static final String VERSE     = "verse";
    public static final String SYL       = "syl";
    public static final String ARTIC_EL  = "artic";
    public static final String CLEF      = "clef";
    public static final String KEY_SIG_EL = "keySig";
    public static final String METER_SIG = "meterSig";
    public static final String BAR_LINE  = "barLine";

    // Control events
    public static final String SLUR      = "slur";
    public static final String BEAM_SPAN = "beamSpan";
    public static final String DYNAM     = "dynam";
    public static final String HAIRPIN   = "hairpin";
    public static final String TUPLET_SPAN = "tupletSpan";
    public static final String DIR       = "dir";
    public static final String HARM      = "harm";
    public static final String FB        = "fb";
    public static final String F         = "f";
    public static final String FERMATA   = "fermata";
    public static final String TRILL     = "trill";
    public static final String FING      = "fing";
    public static final String ORNAM     = "ornam";
    public static final String TEMPO     = "tempo";
    public static final String REH       = "reh";
    public static final String ANNOT     = "annot";

    /**
        Accidental names used by accid and accid.ges, indexed by alteration in quarter tones + 4.
    **/
    public static final String[] accidentals = {"ff", "3qf", "f", "1qf", "n", "1qs", "s", "3qs", "ss"};

    /**
        @param alteration In semitones, possibly fractional (steps of 0.5).
        @return Accidental name, or null if the alteration has no standard name.
    **/
    public static String accidental (double alteration)
    {
        double quarters = alteration * 2 + 4;
        int index = (int) Math.round (quarters);
        if (Math.abs (quarters - index) > 1e-9  ||  index < 0  ||  index >= accidentals.length) return null;
        return accidentals[index];
    }

    /**
        @return Alteration in semitones for the given accidental name, or 0 if unknown.
    **/
    public static double alteration (String accidental)
    {
        for (int i = 0; i < accidentals.length; i++)
        {
            if (accidentals[i].equals (accidental)) return (i - 4) / 2.0;
        }
        return 0;
    }
}
