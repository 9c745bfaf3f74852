/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import gov.sandia.tusk.backend.lilypond.music.Assignment;
import gov.sandia.tusk.backend.lilypond.music.BarLine;
import gov.sandia.tusk.backend.lilypond.music.BookBlock;
import gov.sandia.tusk.backend.lilypond.music.Chord;
import gov.sandia.tusk.backend.lilypond.music.Event;
import gov.sandia.tusk.backend.lilypond.music.Grace;
import gov.sandia.tusk.backend.lilypond.music.LilyPondFile;
import gov.sandia.tusk.backend.lilypond.music.Music;
import gov.sandia.tusk.backend.lilypond.music.PostEvent;
import gov.sandia.tusk.backend.lilypond.music.PropertyValue;
import gov.sandia.tusk.backend.lilypond.music.Repeat;
import gov.sandia.tusk.backend.lilypond.music.ScoreBlock;
import gov.sandia.tusk.backend.lilypond.music.Sequential;
import gov.sandia.tusk.backend.lilypond.music.Tempo;
import gov.sandia.tusk.backend.lilypond.music.TimeSignature;
import gov.sandia.tusk.backend.lilypond.music.Toplevel;
import gov.sandia.tusk.backend.lilypond.music.ToplevelMusic;
import gov.sandia.tusk.backend.lilypond.music.Tuplet;
import gov.sandia.tusk.backend.lilypond.music.Visitor;
import gov.sandia.tusk.language.ConversionException;

/**
    Structural checks on a parsed file, made before any of it is converted.
    The grammar admits some values that have no musical meaning, such as a meter
    with zero beats or a repeat played zero times. All problems in the file are
    collected and reported together in one exception.

    Spans (slurs, phrasing slurs, beams) must balance within each music expression
    at the top level or in a score. Music bound to a variable is checked for values
    but not for balance, since a variable may hold one end of a span.
**/
public class Validator extends Visitor
{
    public List<String> errors = new ArrayList<String> ();

    protected int slurs;
    protected int phrasingSlurs;
    protected int beams;

    private static Logger logger = Logger.getLogger (Validator.class);

    /**
        @throws ConversionException (structural) listing every problem found.
    **/
    public static void validate (LilyPondFile file) throws ConversionException
    {
        Validator v = new Validator ();
        v.items (file.items);
        if (v.errors.isEmpty ()) return;
        logger.debug ("Rejected file with " + v.errors.size () + " structural errors");
        throw new ConversionException ("Invalid input: " + String.join ("; ", v.errors));
    }

    public void items (List<Toplevel> items)
    {
        for (Toplevel t : items)
        {
            if      (t instanceof ToplevelMusic) expression (((ToplevelMusic) t).music, true);
            else if (t instanceof ScoreBlock)    items (((ScoreBlock) t).items);
            else if (t instanceof BookBlock)     items (((BookBlock) t).items);  // includes bookpart
            else if (t instanceof Assignment)
            {
                PropertyValue value = ((Assignment) t).value;
                if (value != null  &&  value.kind == PropertyValue.Kind.MUSIC  &&  value.music != null) expression (value.music, false);
            }
        }
    }

    public void expression (Music m, boolean balance)
    {
        slurs         = 0;
        phrasingSlurs = 0;
        beams         = 0;
        m.visit (this);
        if (! balance) return;
        if (slurs         != 0) errors.add (unmatched ("slur",          slurs));
        if (phrasingSlurs != 0) errors.add (unmatched ("phrasing slur", phrasingSlurs));
        if (beams         != 0) errors.add (unmatched ("beam",          beams));
    }

    protected static String unmatched (String span, int count)
    {
        if (count > 0) return count + " unterminated " + span + (count > 1 ? "s" : "");
        return -count + " " + span + " end" + (count < -1 ? "s" : "") + " without a start";
    }

    public boolean visit (Music m)
    {
        if (m instanceof Event)
        {
            event ((Event) m);
        }
        else if (m instanceof TimeSignature)
        {
            TimeSignature t = (TimeSignature) m;
            if (t.numerators.isEmpty ()) errors.add ("Time signature has no beats");
            for (int n : t.numerators) if (n <= 0) errors.add ("Time signature numerator must be positive: " + t.numeratorText ());
            if (t.denominator <= 0) errors.add ("Time signature denominator must be positive: " + t.denominator);
        }
        else if (m instanceof Tuplet)
        {
            Tuplet t = (Tuplet) m;
            if (t.numerator <= 0  ||  t.denominator <= 0) errors.add ("Tuplet fraction must be positive: " + t.numerator + "/" + t.denominator);
        }
        else if (m instanceof Repeat)
        {
            Repeat r = (Repeat) m;
            if (r.count <= 0) errors.add ("Repeat count must be positive: \\repeat " + r.type + " " + r.count);
            if (! r.alternatives.isEmpty ())
            {
                // Each alternative continues from the end of the body, so a span opened
                // in the body may close once in every alternative.
                r.body.visit (this);
                int s = slurs;
                int p = phrasingSlurs;
                int b = beams;
                for (Music a : r.alternatives)
                {
                    slurs         = s;
                    phrasingSlurs = p;
                    beams         = b;
                    a.visit (this);
                }
                return false;
            }
        }
        else if (m instanceof Grace)
        {
            Grace g = (Grace) m;
            if (g.fraction != null  &&  g.fraction.numerator <= 0) errors.add ("\\afterGrace fraction must be positive: " + g.fraction);
            if (g.music == null  ||  g.music instanceof Sequential  &&  ((Sequential) g.music).items.isEmpty ()) errors.add ("\\" + g.kind + " has no notes");
        }
        else if (m instanceof Tempo)
        {
            Tempo t = (Tempo) m;
            if (t.bpm != null  &&  t.bpm <= 0) errors.add ("Tempo must be positive: " + t.bpm);
            if (t.bpm != null  &&  t.bpmHigh != null  &&  t.bpmHigh <= t.bpm) errors.add ("Tempo range must increase: " + t.bpm + "-" + t.bpmHigh);
        }
        else if (m instanceof BarLine)
        {
            String style = ((BarLine) m).style;
            if (style == null  ||  style.isEmpty ()) errors.add ("Bar line has no type");
        }
        return true;
    }

    public void event (Event e)
    {
        // <> with post-events is the usual way to attach them without a note.
        if (e instanceof Chord  &&  ((Chord) e).notes.isEmpty ()  &&  e.postEvents.isEmpty ()) errors.add ("Chord has no notes");

        for (PostEvent p : e.postEvents)
        {
            switch (p.kind)
            {
                case SLUR_START:          slurs++;         break;
                case SLUR_END:            slurs--;         break;
                case PHRASING_SLUR_START: phrasingSlurs++; break;
                case PHRASING_SLUR_END:   phrasingSlurs--; break;
                case BEAM_START:          beams++;         break;
                case BEAM_END:            beams--;         break;
                case TREMOLO:
                    if (! validTremolo (p.text)) errors.add ("Tremolo subdivision must be 8 or a larger power of two: " + p.text);
                    break;
                default:                                   break;
            }
        }
    }

    /**
        Empty and 0 mean the default subdivision.
    **/
    public static boolean validTremolo (String text)
    {
        if (text == null  ||  text.isEmpty ()) return true;
        int n;
        try
        {
            n = Integer.parseInt (text);
        }
        catch (NumberFormatException e)
        {
            return false;
        }
        if (n == 0) return true;
        return n >= 8  &&  (n & (n - 1)) == 0;
    }
}
