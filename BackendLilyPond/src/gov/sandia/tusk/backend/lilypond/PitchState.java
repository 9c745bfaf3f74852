/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.tusk.backend.lilypond.music.Note;
import gov.sandia.tusk.backend.lilypond.music.Pitch;

/**
    Tracks how written pitches relate to sounding pitches at one point in a voice:
    the entry mode (absolute, relative or fixed) and any enclosing transpositions.
    The importer reads written pitches through it, and the exporter writes them back.
**/
public class PitchState
{
    public enum Mode {ABSOLUTE, RELATIVE, FIXED}

    public Mode          mode = Mode.ABSOLUTE;
    public Pitch         reference;                             // Previous pitch in relative mode, or the fixed octave pitch
    public List<Pitch[]> transpositions = new ArrayList<Pitch[]> ();  // {from, to}, outermost first

    public PitchState copy ()
    {
        PitchState result = new PitchState ();
        result.mode      = mode;
        result.reference = reference;
        result.transpositions.addAll (transpositions);
        return result;
    }

    /**
        Interprets a written pitch in the current mode, before transposition.
        In relative mode the result becomes the new reference, and an octave check forces the octave.
    **/
    public Pitch locate (Pitch written)
    {
        Pitch result;
        switch (mode)
        {
            case RELATIVE:
                result = written.resolveRelative (reference);
                if (written.octaveCheck != null) result.octave = written.octaveCheck;
                reference = result;
                break;
            case FIXED:
                result = new Pitch (written);
                result.octave += reference.octave;
                break;
            default:
                result = new Pitch (written);
        }
        result.octaveCheck = null;
        return result;
    }

    /**
        Within a chord, each note is relative to the one before it.
        Afterward the first note becomes the reference for what follows the chord.
    **/
    public List<Pitch> locateChord (List<Note> notes)
    {
        List<Pitch> result = new ArrayList<Pitch> ();
        for (Note n : notes) result.add (locate (n.pitch));
        if (mode == Mode.RELATIVE  &&  ! result.isEmpty ()) reference = result.get (0);
        return result;
    }

    /**
        Applies transpositions, innermost first.
    **/
    public Pitch sound (Pitch located)
    {
        Pitch result = located;
        for (int i = transpositions.size () - 1; i >= 0; i--)
        {
            Pitch[] t = transpositions.get (i);
            result = result.transpose (t[0], t[1]);
        }
        return result;
    }

    /**
        Undoes transpositions, outermost first.
    **/
    public Pitch unsound (Pitch sounding)
    {
        Pitch result = sounding;
        for (Pitch[] t : transpositions) result = result.untranspose (t[0], t[1]);
        return result;
    }

    /**
        Inverse of locate(). Produces the pitch as it should be written in the current mode.
    **/
    public Pitch write (Pitch located)
    {
        Pitch result;
        switch (mode)
        {
            case RELATIVE:
                result = located.toRelative (reference);
                reference = located;
                break;
            case FIXED:
                result = new Pitch (located);
                result.octave -= reference.octave;
                break;
            default:
                result = new Pitch (located);
        }
        result.octaveCheck = null;
        return result;
    }

    /**
        Writes the notes of a chord in place, mirroring locateChord().
        @param located Pitches before transposition, one per note.
    **/
    public void writeChord (List<Note> notes, List<Pitch> located)
    {
        for (int i = 0; i < notes.size (); i++) notes.get (i).pitch = write (located.get (i));
        if (mode == Mode.RELATIVE  &&  ! located.isEmpty ()) reference = located.get (0);
    }
}
