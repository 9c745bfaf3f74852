/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    Music followed by one or more \addlyrics blocks, each a verse aligned to that music.
**/
public class AddLyrics extends Music
{
    public Music       music;
    public List<Music> lyrics = new ArrayList<Music> ();

    public AddLyrics (Music music)
    {
        this.music = music;
    }

    public List<Music> children ()
    {
        List<Music> result = new ArrayList<Music> ();
        result.add (music);
        result.addAll (lyrics);
        return result;
    }

    public boolean isBlock ()
    {
        return true;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        music.render (renderer);
        for (Music m : lyrics)
        {
            renderer.newline ();
            renderer.append ("\\addlyrics ");
            m.render (renderer);
        }
    }
}
