/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
    A markup expression: words, strings, braced lists, and \commands applied to arguments.
**/
public class Markup
{
    public enum Kind {WORD, STRING, SCHEME, COMMAND, LIST, IDENTIFIER}

    public Kind         kind;
    public String       text;  // WORD and STRING contents, COMMAND and IDENTIFIER name
    public SchemeExpr   scheme;
    public List<Markup> args = new ArrayList<Markup> ();  // COMMAND arguments, or LIST members

    /**
        Number of markup arguments each known command takes after its Scheme arguments.
        Commands not listed here are treated as identifiers with no arguments.
    **/
    public static final Map<String,Integer> arity = new HashMap<String,Integer> ();
    static
    {
        String[] one =
        {
            "bold", "italic", "caps", "dynamic", "fontCaps", "huge", "large", "larger", "medium",
            "normal-text", "normalsize", "number", "roman", "sans", "serif", "small", "smallCaps",
            "smaller", "sub", "super", "teeny", "text", "tiny", "typewriter", "underline", "upright",
            "box", "bracket", "center-align", "circle", "left-align", "normalcolor", "oval",
            "parenthesize", "right-align", "rounded-box", "transparent", "vcenter", "whiteout",
            "hcenter-in", "fontsize", "abs-fontsize", "with-color", "raise", "lower", "translate",
            "translate-scaled", "override", "pad-markup", "pad-around", "pad-x", "magnify", "rotate",
            "scale", "halign", "general-align", "with-url", "note",
            // Commands that take a markup list
            "center-column", "column", "concat", "dir-column", "fill-line", "justify", "left-column",
            "line", "overlay", "right-column", "wordwrap", "column-lines", "wordwrap-lines",
            "justified-lines", "override-lines", "table"
        };
        String[] two = {"combine", "fraction", "put-adjacent"};
        String[] none =
        {
            "hspace", "vspace", "musicglyph", "draw-line", "draw-circle", "draw-hline", "fret-diagram",
            "fret-diagram-terse", "char", "fromproperty", "null", "strut", "epsfile", "note-by-number",
            "rest-by-number", "doubleflat", "flat", "natural", "sharp", "doublesharp", "semiflat",
            "semisharp", "sesquiflat", "sesquisharp", "arrow-head", "simple", "lookup", "verbatim-file",
            "page-ref", "string-lines"
        };
        for (String name : one)  arity.put (name, 1);
        for (String name : two)  arity.put (name, 2);
        for (String name : none) arity.put (name, 0);
    }

    public Markup (Kind kind)
    {
        this.kind = kind;
    }

    public static Markup word (String text)
    {
        Markup result = new Markup (Kind.WORD);
        result.text = text;
        return result;
    }

    public static Markup string (String text)
    {
        Markup result = new Markup (Kind.STRING);
        result.text = text;
        return result;
    }

    public static Markup scheme (SchemeExpr scheme)
    {
        Markup result = new Markup (Kind.SCHEME);
        result.scheme = scheme;
        return result;
    }

    public static Markup command (String name)
    {
        Markup result = new Markup (Kind.COMMAND);
        result.text = name;
        return result;
    }

    public static Markup list ()
    {
        return new Markup (Kind.LIST);
    }

    public static Markup identifier (String name)
    {
        Markup result = new Markup (Kind.IDENTIFIER);
        result.text = name;
        return result;
    }

    public static boolean isCommand (String name)
    {
        return arity.containsKey (name);
    }

    /**
        @return The words of this markup run together with single spaces, dropping all formatting.
        Used where a plain string is needed, such as a title or tempo text.
    **/
    public String plainText ()
    {
        switch (kind)
        {
            case WORD:
            case STRING:
                return text;
            case SCHEME:
                String s = scheme.stringValue ();
                return s == null ? "" : s;
            case IDENTIFIER:
                return "";
            default:
                StringBuilder result = new StringBuilder ();
                for (Markup m : args)
                {
                    String t = m.plainText ();
                    if (t.isEmpty ()) continue;
                    if (result.length () > 0) result.append (' ');
                    result.append (t);
                }
                return result.toString ();
        }
    }

    /**
        Renders with the introducing \markup keyword.
    **/
    public void renderTop (Renderer renderer)
    {
        renderer.append ("\\markup ");
        render (renderer);
    }

    public void render (Renderer renderer)
    {
        switch (kind)
        {
            case WORD:
                renderer.append (text);
                break;
            case STRING:
                renderer.append (Renderer.quote (text));
                break;
            case SCHEME:
                renderer.append (scheme.toString ());
                break;
            case IDENTIFIER:
                renderer.append ("\\").append (text);
                break;
            case COMMAND:
                renderer.append ("\\").append (text);
                for (Markup m : args)
                {
                    renderer.append (' ');
                    m.render (renderer);
                }
                break;
            case LIST:
                renderer.append ('{');
                for (Markup m : args)
                {
                    renderer.append (' ');
                    m.render (renderer);
                }
                renderer.append (" }");
                break;
        }
    }

    public String toString ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof Markup)) return false;
        Markup that = (Markup) o;
        return kind == that.kind
            && Objects.equals (text,   that.text)
            && Objects.equals (scheme, that.scheme)
            && args.equals (that.args);
    }

    @Override
    public int hashCode ()
    {
        return Objects.hash (kind, text, scheme, args);
    }
}
