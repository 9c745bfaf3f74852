/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    \tempo with text, a metronome mark, or both. For example \tempo "Allegro" 4 = 120-132.
**/
public class Tempo extends Music
{
    public Markup   text;      // STRING and SCHEME markup render without the markup keyword.
    public Duration unit;
    public Integer  bpm;
    public Integer  bpmHigh;   // Upper end of a range, or null.

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\tempo");
        if (text != null)
        {
            renderer.append (' ');
            if (text.kind == Markup.Kind.STRING  ||  text.kind == Markup.Kind.SCHEME) text.render (renderer);
            else                                                                    text.renderTop (renderer);
        }
        if (unit != null)
        {
            renderer.append (' ').append (unit.toString ()).append (" = ").append (String.valueOf (bpm));
            if (bpmHigh != null) renderer.append ('-').append (String.valueOf (bpmHigh));
        }
    }
}
