/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Collections;
import java.util.List;

/**
    \chordmode, \drummode, \figuremode, \lyricmode or \notemode applied to music.
**/
public class ModeBlock extends Music
{
    public static final String[] MODES = {"chordmode", "drummode", "figuremode", "lyricmode", "notemode"};

    public String mode;
    public Music  music;

    public ModeBlock (String mode, Music music)
    {
        this.mode  = mode;
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
        renderer.append ('\\').append (mode).append (' ');
        music.render (renderer);
    }
}
