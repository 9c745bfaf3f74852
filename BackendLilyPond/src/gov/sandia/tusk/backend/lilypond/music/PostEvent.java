/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.List;

/**
    Something attached after an event: tie, slur, beam, dynamic, articulation, fingering, text and so on.
**/
public class PostEvent
{
    public enum Kind
    {
        TIE, SLUR_START, SLUR_END, PHRASING_SLUR_START, PHRASING_SLUR_END, BEAM_START, BEAM_END,
        CRESCENDO, DECRESCENDO, HAIRPIN_END,
        DYNAMIC,        // text is the dynamic name, such as "mf"
        SCRIPT,         // text is the script name, such as "staccato"
        ABBREVIATION,   // text is the shorthand character, such as "." for staccato
        FINGERING,      // text is the digits
        STRING_NUMBER,  // text is the digits
        TEXT,           // text is the quoted string contents
        MARKUP,
        TREMOLO,        // text is the subdivision, or empty
        LYRIC_HYPHEN, LYRIC_EXTENDER
    }

    public Kind        kind;
    public char        direction;  // '^', '_', '-', or 0 when none was written
    public String      text;
    public Markup      markup;
    public List<Tweak> tweaks = new ArrayList<Tweak> ();

    public PostEvent (Kind kind)
    {
        this.kind = kind;
    }

    public PostEvent (Kind kind, String text)
    {
        this.kind = kind;
        this.text = text;
    }

    public PostEvent (Kind kind, char direction, String text)
    {
        this.kind      = kind;
        this.direction = direction;
        this.text      = text;
    }

    /**
        @return true if this kind can only be written after a direction indicator.
    **/
    public boolean needsDirection ()
    {
        return kind == Kind.ABBREVIATION  ||  kind == Kind.FINGERING  ||  kind == Kind.TEXT  ||  kind == Kind.MARKUP;
    }

    /**
        @return Name of the articulation this post-event stands for, or null if it isn't one.
        Shorthand forms are translated to their full names.
    **/
    public String articulation ()
    {
        if (kind == Kind.SCRIPT) return text;
        if (kind != Kind.ABBREVIATION) return null;
        return Scripts.abbreviations.get (text);
    }

    public void render (Renderer renderer)
    {
        if (! tweaks.isEmpty ())
        {
            renderer.append (direction == 0 ? '-' : direction);
            for (Tweak t : tweaks)
            {
                t.render (renderer);
                renderer.append (' ');
            }
        }
        else if (direction != 0)
        {
            renderer.append (direction);
        }
        else if (needsDirection ())
        {
            renderer.append ('-');
        }

        switch (kind)
        {
            case TIE:                 renderer.append ('~');    break;
            case SLUR_START:          renderer.append ('(');    break;
            case SLUR_END:            renderer.append (')');    break;
            case PHRASING_SLUR_START: renderer.append ("\\(");  break;
            case PHRASING_SLUR_END:   renderer.append ("\\)");  break;
            case BEAM_START:          renderer.append ('[');    break;
            case BEAM_END:            renderer.append (']');    break;
            case CRESCENDO:           renderer.append ("\\<");  break;
            case DECRESCENDO:         renderer.append ("\\>");  break;
            case HAIRPIN_END:         renderer.append ("\\!");  break;
            case DYNAMIC:
            case SCRIPT:
            case STRING_NUMBER:       renderer.append ('\\').append (text);  break;
            case ABBREVIATION:
            case FINGERING:           renderer.append (text);  break;
            case TEXT:                renderer.append (Renderer.quote (text));  break;
            case MARKUP:              markup.renderTop (renderer);  break;
            case TREMOLO:             renderer.append (':').append (text == null ? "" : text);  break;
            case LYRIC_HYPHEN:        renderer.append ("--");  break;
            case LYRIC_EXTENDER:      renderer.append ("__");  break;
        }
    }

    public String toString ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }
}
