/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Collections;
import java.util.List;

/**
    \new or \context, or one of the shorthands \chords, \drums, \lyrics and \figures,
    which create a context of the matching type around music in the matching mode.
**/
public class ContextedMusic extends Music
{
    public String           keyword;  // new, context, chords, drums, lyrics or figures
    public String           type;     // Null for the shorthands.
    public String           name;
    public List<ContextMod> with;     // Null when no \with block was written.
    public Music            music;

    public static final String[] SHORTHANDS = {"chords", "drums", "lyrics", "figures"};

    public ContextedMusic (String keyword, String type, Music music)
    {
        this.keyword = keyword;
        this.type    = type;
        this.music   = music;
    }

    public static boolean isShorthand (String keyword)
    {
        for (String s : SHORTHANDS) if (s.equals (keyword)) return true;
        return false;
    }

    /**
        @return The context type created by this expression, including the one implied by a shorthand.
    **/
    public String contextType ()
    {
        if (type != null) return type;
        switch (keyword)
        {
            case "chords":  return "ChordNames";
            case "drums":   return "DrumStaff";
            case "lyrics":  return "Lyrics";
            case "figures": return "FiguredBass";
        }
        return "Bottom";
    }

    public List<Music> children ()
    {
        return Collections.singletonList (music);
    }

    public boolean isBlock ()
    {
        return true;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ('\\').append (keyword);
        if (type != null) renderer.append (' ').append (type);
        if (name != null) renderer.append (" = ").append (Renderer.word (name));
        if (with != null)
        {
            renderer.append (" \\with ");
            renderMods (renderer, with);
        }
        renderer.append (' ');
        music.render (renderer);
    }

    /**
        Writes a braced list of context modifications, one per line.
    **/
    public static void renderMods (Renderer renderer, List<ContextMod> mods)
    {
        if (mods.isEmpty ())
        {
            renderer.append ("{ }");
            return;
        }
        renderer.append ('{');
        renderer.indent ();
        for (ContextMod m : mods)
        {
            renderer.newline ();
            m.render (renderer);
        }
        renderer.outdent ();
        renderer.newline ();
        renderer.append ('}');
    }
}
