/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Collections;
import java.util.List;

public class Transpose extends Music
{
    public Pitch from;
    public Pitch to;
    public Music music;

    public Transpose (Pitch from, Pitch to, Music music)
    {
        this.from  = from;
        this.to    = to;
        this.music = music;
    }

    public List<Music> children ()
    {
        return Collections.singletonList (music);
    }

    public boolean isBlock ()
    {
        return music.isBlock ();
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\transpose ").append (from.toString ()).append (' ').append (to.toString ()).append (' ');
        music.render (renderer);
    }
}
