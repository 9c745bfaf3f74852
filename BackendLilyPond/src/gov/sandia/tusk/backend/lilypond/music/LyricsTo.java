/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Collections;
import java.util.List;

/**
    \lyricsto "voice" { ... }: aligns syllables to the notes of the named voice.
**/
public class LyricsTo extends Music
{
    public String voice;
    public Music  lyrics;

    public LyricsTo (String voice, Music lyrics)
    {
        this.voice  = voice;
        this.lyrics = lyrics;
    }

    public List<Music> children ()
    {
        return Collections.singletonList (lyrics);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\lyricsto ").append (Renderer.quote (voice)).append (' ');
        lyrics.render (renderer);
    }
}
