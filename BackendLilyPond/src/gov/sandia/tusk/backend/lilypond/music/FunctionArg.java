/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    One argument of a music function call.
**/
public class FunctionArg
{
    public enum Kind {MUSIC, STRING, NUMBER, SCHEME, DURATION, IDENTIFIER, DEFAULT, SYMBOL_LIST, MARKUP}

    public Kind       kind;
    public String     text;  // STRING contents, NUMBER or SYMBOL_LIST source, IDENTIFIER name
    public Music      music;
    public SchemeExpr scheme;
    public Duration   duration;
    public Markup     markup;

    public FunctionArg (Kind kind)
    {
        this.kind = kind;
    }

    public FunctionArg (Kind kind, String text)
    {
        this.kind = kind;
        this.text = text;
    }

    public FunctionArg (Music music)
    {
        kind       = Kind.MUSIC;
        this.music = music;
    }

    public FunctionArg (SchemeExpr scheme)
    {
        kind        = Kind.SCHEME;
        this.scheme = scheme;
    }

    public FunctionArg (Duration duration)
    {
        kind          = Kind.DURATION;
        this.duration = duration;
    }

    public FunctionArg (Markup markup)
    {
        kind        = Kind.MARKUP;
        this.markup = markup;
    }

    public void render (Renderer renderer)
    {
        switch (kind)
        {
            case MUSIC:       music.render (renderer);                         break;
            case STRING:      renderer.append (Renderer.quote (text));          break;
            case NUMBER:
            case SYMBOL_LIST: renderer.append (text);                           break;
            case SCHEME:      renderer.append (scheme.toString ());             break;
            case DURATION:    renderer.append (duration.toString ());           break;
            case IDENTIFIER:  renderer.append ('\\').append (text);             break;
            case DEFAULT:     renderer.append ("\\default");                    break;
            case MARKUP:      markup.renderTop (renderer);                      break;
        }
    }
}
