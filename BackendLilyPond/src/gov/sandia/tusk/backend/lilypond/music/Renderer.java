/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

import java.util.List;

/**
    Collects LilyPond source text from the music tree. Each node renders itself by default.
    Subclass this and override render(Music) to change how particular nodes come out.
    Reading the result back through the parser gives a tree equal to the one rendered.
**/
public class Renderer
{
    public StringBuilder result;
    public int           indent = 2;  // Spaces per nesting level.
    protected int        level;

    public Renderer ()
    {
        result = new StringBuilder ();
    }

    public Renderer (StringBuilder result)
    {
        this.result = result;
    }

    /**
        @return true if this function rendered the node. false if the node should render itself (using its default method).
    **/
    public boolean render (Music m)
    {
        return false;
    }

    public Renderer append (String text)
    {
        result.append (text);
        return this;
    }

    public Renderer append (char c)
    {
        result.append (c);
        return this;
    }

    /**
        Adds a single space, unless the output is empty or already ends in white space.
    **/
    public Renderer space ()
    {
        int length = result.length ();
        if (length == 0) return this;
        char last = result.charAt (length - 1);
        if (last != ' '  &&  last != '\n') result.append (' ');
        return this;
    }

    /**
        Starts a new line at the current nesting level.
    **/
    public Renderer newline ()
    {
        // Drop trailing spaces left by the previous item.
        int length = result.length ();
        while (length > 0  &&  result.charAt (length - 1) == ' ') length--;
        result.setLength (length);
        result.append ('\n');
        for (int i = level * indent; i > 0; i--) result.append (' ');
        return this;
    }

    public void indent ()
    {
        level++;
    }

    public void outdent ()
    {
        if (level > 0) level--;
    }

    /**
        Renders items separated by single spaces.
    **/
    public void render (List<? extends Music> items)
    {
        boolean first = true;
        for (Music m : items)
        {
            if (! first) space ();
            first = false;
            m.render (this);
        }
    }

    /**
        Renders a braced block, one item per line.
    **/
    public void renderBlock (String open, List<? extends Music> items, String close)
    {
        append (open);
        indent ();
        for (Music m : items)
        {
            newline ();
            m.render (this);
        }
        outdent ();
        newline ();
        append (close);
    }

    /**
        Quotes a string with the escapes the lexer understands.
    **/
    public static String quote (String text)
    {
        StringBuilder result = new StringBuilder ("\"");
        for (int i = 0; i < text.length (); i++)
        {
            char c = text.charAt (i);
            switch (c)
            {
                case '"':  result.append ("\\\""); break;
                case '\\': result.append ("\\\\"); break;
                case '\n': result.append ("\\n");  break;
                case '\t': result.append ("\\t");  break;
                default:   result.append (c);
            }
        }
        result.append ('"');
        return result.toString ();
    }

    /**
        @return true if the word can be written bare in note mode, that is, it consists
        of letters joined by single hyphens or underscores.
    **/
    public static boolean isWord (String text)
    {
        if (text.isEmpty ()) return false;
        boolean needLetter = true;
        for (int i = 0; i < text.length (); i++)
        {
            char c = text.charAt (i);
            if (Character.isLetter (c))
            {
                needLetter = false;
            }
            else if (c == '-'  ||  c == '_')
            {
                if (needLetter) return false;
                needLetter = true;
            }
            else
            {
                return false;
            }
        }
        return ! needLetter;
    }

    /**
        Writes the word bare if possible, otherwise quoted.
    **/
    public static String word (String text)
    {
        if (isWord (text)) return text;
        return quote (text);
    }

    public String toString ()
    {
        return result.toString ();
    }
}
