/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    q: repeats the pitches of the most recent chord.
**/
public class ChordRepetition extends Event
{
    public ChordRepetition (Duration duration)
    {
        this.duration = duration;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderTweaks (renderer);
        renderer.append ('q');
        renderDuration (renderer);
        renderPostEvents (renderer);
    }
}
