/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    A lyric syllable. Hyphens and extenders attach as post-events.
**/
public class Lyric extends Event
{
    public String  text;
    public boolean quoted;

    public Lyric (String text)
    {
        this.text   = text;
        this.quoted = ! isWord (text);
    }

    /**
        @return true if the syllable can be written without quotes in lyric mode.
    **/
    public static boolean isWord (String text)
    {
        if (text.isEmpty ()) return false;
        switch (text)
        {
            case "--":
            case "__":
            case "|":
            case "=":
            case "<<":
            case ">>":
                return false;
        }
        for (int i = 0; i < text.length (); i++)
        {
            char c = text.charAt (i);
            if (Character.isWhitespace (c)  ||  Character.isDigit (c)) return false;
            if ("{}\"\\#%".indexOf (c) >= 0) return false;
        }
        return true;
    }

    /**
        @return true if this is the placeholder that skips one note without printing a syllable.
    **/
    public boolean isSkip ()
    {
        return ! quoted  &&  text.equals ("_");
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderTweaks (renderer);
        renderer.append (quoted ? Renderer.quote (text) : text);
        renderDuration (renderer);
        for (PostEvent p : postEvents)
        {
            renderer.append (' ');
            p.render (renderer);
        }
    }
}
