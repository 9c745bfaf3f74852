/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Collections;
import java.util.List;

/**
    \fixed: octave marks inside count from the reference pitch instead of from c.
**/
public class Fixed extends Music
{
    public Pitch reference;
    public Music music;

    public Fixed (Pitch reference, Music music)
    {
        this.reference = reference;
        this.music     = music;
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
        renderer.append ("\\fixed ").append (reference.toString ()).append (' ');
        music.render (renderer);
    }
}
