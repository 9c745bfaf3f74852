/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Collections;
import java.util.List;

/**
    \relative: pitches inside are written relative to the previous one.
    A missing reference behaves as f, which makes the first note read as absolute.
**/
public class Relative extends Music
{
    public Pitch reference;
    public Music music;

    public Relative (Pitch reference, Music music)
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
        renderer.append ("\\relative ");
        if (reference != null) renderer.append (reference.toString ()).append (' ');
        music.render (renderer);
    }
}
