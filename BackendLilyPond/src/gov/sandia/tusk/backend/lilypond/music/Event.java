/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    Music that occupies a rhythmic position: notes, rests, chords, lyric syllables and the like.
    Duration is null when the written event omits it and inherits the previous one.
**/
public abstract class Event extends Music
{
    public Duration        duration;
    public List<PostEvent> postEvents = new ArrayList<PostEvent> ();
    public List<Tweak>     tweaks     = new ArrayList<Tweak> ();

    public boolean hasPostEvent (PostEvent.Kind kind)
    {
        for (PostEvent p : postEvents) if (p.kind == kind) return true;
        return false;
    }

    protected void renderTweaks (Renderer renderer)
    {
        for (Tweak t : tweaks)
        {
            t.render (renderer);
            renderer.append (' ');
        }
    }

    protected void renderDuration (Renderer renderer)
    {
        if (duration != null) renderer.append (duration.toString ());
    }

    /**
        Post-events follow directly, except after markup, where a following word would be read as part of the markup.
    **/
    protected void renderPostEvents (Renderer renderer)
    {
        boolean afterMarkup = false;
        for (PostEvent p : postEvents)
        {
            if (afterMarkup) renderer.append (' ');
            p.render (renderer);
            afterMarkup = p.kind == PostEvent.Kind.MARKUP;
        }
    }
}
