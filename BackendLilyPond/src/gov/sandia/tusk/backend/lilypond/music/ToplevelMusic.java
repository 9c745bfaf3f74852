/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    Music standing alone, either at the outer level of a file (an implicit score) or inside \score.
**/
public class ToplevelMusic extends Toplevel
{
    public Music music;

    public ToplevelMusic (Music music)
    {
        this.music = music;
    }

    public void render (Renderer renderer)
    {
        music.render (renderer);
    }
}
