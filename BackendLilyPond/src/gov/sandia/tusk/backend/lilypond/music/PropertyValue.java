/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.Objects;

/**
    Right-hand side of a property setting, tweak or assignment.
**/
public class PropertyValue
{
    public enum Kind {SCHEME, STRING, NUMBER, MARKUP, IDENTIFIER, MUSIC}

    public Kind       kind;
    public String     text;    // STRING contents, NUMBER source such as "-2" or "20\mm", IDENTIFIER name
    public SchemeExpr scheme;
    public Markup     markup;
    public Music      music;

    protected PropertyValue (Kind kind)
    {
        this.kind = kind;
    }

    public static PropertyValue scheme (SchemeExpr scheme)
    {
        PropertyValue result = new PropertyValue (Kind.SCHEME);
        result.scheme = scheme;
        return result;
    }

    public static PropertyValue string (String text)
    {
        PropertyValue result = new PropertyValue (Kind.STRING);
        result.text = text;
        return result;
    }

    public static PropertyValue number (String text)
    {
        PropertyValue result = new PropertyValue (Kind.NUMBER);
        result.text = text;
        return result;
    }

    public static PropertyValue markup (Markup markup)
    {
        PropertyValue result = new PropertyValue (Kind.MARKUP);
        result.markup = markup;
        return result;
    }

    public static PropertyValue identifier (String name)
    {
        PropertyValue result = new PropertyValue (Kind.IDENTIFIER);
        result.text = name;
        return result;
    }

    public static PropertyValue music (Music music)
    {
        PropertyValue result = new PropertyValue (Kind.MUSIC);
        result.music = music;
        return result;
    }

    /**
        @return The plain text of a string value, or of a Scheme string literal. Null otherwise.
    **/
    public String stringValue ()
    {
        if (kind == Kind.STRING) return text;
        if (kind == Kind.SCHEME) return scheme.stringValue ();
        return null;
    }

    public void render (Renderer renderer)
    {
        switch (kind)
        {
            case SCHEME:     renderer.append (scheme.toString ());         break;
            case STRING:     renderer.append (Renderer.quote (text));      break;
            case NUMBER:     renderer.append (text);                       break;
            case MARKUP:     markup.renderTop (renderer);                  break;
            case IDENTIFIER: renderer.append ("\\").append (text);     break;
            case MUSIC:      music.render (renderer);                      break;
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
        if (! (o instanceof PropertyValue)) return false;
        PropertyValue that = (PropertyValue) o;
        return kind == that.kind
            && Objects.equals (text,   that.text)
            && Objects.equals (scheme, that.scheme)
            && Objects.equals (markup, that.markup)
            && Objects.equals (music,  that.music);
    }

    @Override
    public int hashCode ()
    {
        return Objects.hash (kind, text, scheme, markup, music);
    }
}
