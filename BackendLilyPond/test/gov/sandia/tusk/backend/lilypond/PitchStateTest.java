/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import gov.sandia.tusk.backend.lilypond.music.Note;
import gov.sandia.tusk.backend.lilypond.music.Pitch;
import gov.sandia.tusk.language.ParseException;

public class PitchStateTest
{
    protected static Pitch p (String text) throws ParseException
    {
        return Parser.parsePitch (text);
    }

    protected static PitchState relative (String reference) throws ParseException
    {
        PitchState result = new PitchState ();
        result.mode      = PitchState.Mode.RELATIVE;
        result.reference = p (reference);
        return result;
    }

    @Test
    public void testRelative () throws ParseException
    {
        PitchState in = relative ("c'");
        assertEquals (p ("d'"),  in.locate (p ("d")));
        assertEquals (p ("b"),   in.locate (p ("b")));
        assertEquals (p ("g'"),  in.locate (p ("g'")));
        assertEquals (p ("c''"), in.locate (p ("c=''")));

        PitchState out = relative ("c'");
        assertEquals (p ("d"),  out.write (p ("d'")));
        assertEquals (p ("b"),  out.write (p ("b")));
        assertEquals (p ("g'"), out.write (p ("g'")));
        assertEquals (p ("c"),  out.write (p ("c''")));
    }

    @Test
    public void testChord () throws ParseException
    {
        List<Note> notes = new ArrayList<Note> ();
        notes.add (new Note (p ("c")));
        notes.add (new Note (p ("e")));
        notes.add (new Note (p ("g")));

        PitchState in = relative ("c'");
        List<Pitch> located = in.locateChord (notes);
        assertEquals (p ("c'"), located.get (0));
        assertEquals (p ("e'"), located.get (1));
        assertEquals (p ("g'"), located.get (2));
        // The next note is read from the bottom of the chord.
        assertEquals (p ("f'"), in.locate (p ("f")));

        PitchState out = relative ("c'");
        out.writeChord (notes, located);
        assertEquals (p ("c"), notes.get (0).pitch);
        assertEquals (p ("e"), notes.get (1).pitch);
        assertEquals (p ("g"), notes.get (2).pitch);
    }

    @Test
    public void testTranspose () throws ParseException
    {
        PitchState state = new PitchState ();
        state.transpositions.add (new Pitch[] {p ("c"), p ("d")});
        assertEquals (p ("fis"), state.sound (p ("e")));
        assertEquals (p ("c'"),  state.sound (p ("bes")));
        assertEquals (p ("e"),   state.unsound (p ("fis")));

        // Nested transpositions compose.
        state.transpositions.add (new Pitch[] {p ("c"), p ("g,")});
        assertEquals (p ("cis"), state.sound (p ("e")));
        assertEquals (p ("e"),   state.unsound (p ("cis")));
    }

    @Test
    public void testFixed () throws ParseException
    {
        PitchState state = new PitchState ();
        state.mode      = PitchState.Mode.FIXED;
        state.reference = p ("c''");
        assertEquals (p ("e''"), state.locate (p ("e")));
        assertEquals (p ("g'"),  state.locate (p ("g,")));
        assertEquals (p ("g,"),  state.write (p ("g'")));
    }
}
