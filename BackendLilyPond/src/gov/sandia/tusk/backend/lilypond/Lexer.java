/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.tusk.backend.lilypond.music.Pitch;
import gov.sandia.tusk.language.LexException;

/**
    Breaks LilyPond source into tokens. The meaning of a bare word depends on the current mode,
    so the parser switches modes as it enters \chordmode, \lyricmode and the like, then
    restarts the lexer at the first token that should be read differently.
**/
public class Lexer
{
    public enum Mode {NOTES, DRUMS, CHORDS, LYRICS, FIGURES, MARKUP}

    public    String source;
    public    Mode   mode;
    protected int    position;
    protected Token  previous;

    public Lexer (String source)
    {
        this (source, Mode.NOTES);
    }

    public Lexer (String source, Mode mode)
    {
        this.source = source;
        this.mode   = mode;
    }

    /**
        Restarts tokenizing at the given offset in the given mode.
    **/
    public void reset (int offset, Mode mode)
    {
        position  = offset;
        this.mode = mode;
        previous  = null;
    }

    /**
        Convenience for tests and tools: the whole token sequence, ending with EOF.
    **/
    public List<Token> tokenize () throws LexException
    {
        List<Token> result = new ArrayList<Token> ();
        while (true)
        {
            Token t = next ();
            result.add (t);
            if (t.type == TokenType.EOF) return result;
        }
    }

    public Token next () throws LexException
    {
        previous = scan ();
        return previous;
    }

    protected Token scan () throws LexException
    {
        skipSpace ();
        int length = source.length ();
        int start  = position;
        if (start >= length) return new Token (TokenType.EOF, "", start, start);

        char c = source.charAt (start);
        if (c == '"') return scanString ();
        if (c == '#')
        {
            int end = scanScheme (start + 1);
            position = end;
            return new Token (TokenType.SCHEME, source.substring (start + 1, end), start, end);
        }
        if (c == '\\') return scanEscaped ();
        if (c == '{') return single (TokenType.BRACE_OPEN);
        if (c == '}') return single (TokenType.BRACE_CLOSE);
        if (source.startsWith ("<<", start)) return punctuation (TokenType.DOUBLE_ANGLE_OPEN,  2);
        if (source.startsWith (">>", start)) return punctuation (TokenType.DOUBLE_ANGLE_CLOSE, 2);

        switch (mode)
        {
            case MARKUP: return scanMarkupWord ();
            case LYRICS: return scanLyric ();
            default:
        }

        if (Character.isDigit (c))  return scanNumber ();
        if (Character.isLetter (c)) return scanWord ();
        return scanPunctuation ();
    }

    /**
        Skips white space, line comments (%) and block comments (%{ ... %}).
    **/
    protected void skipSpace () throws LexException
    {
        int length = source.length ();
        while (position < length)
        {
            char c = source.charAt (position);
            if (Character.isWhitespace (c))
            {
                position++;
            }
            else if (c == '%')
            {
                if (position + 1 < length  &&  source.charAt (position + 1) == '{')
                {
                    int end = source.indexOf ("%}", position + 2);
                    if (end < 0) throw new LexException ("Unterminated block comment", position);
                    position = end + 2;
                }
                else
                {
                    int end = source.indexOf ('\n', position);
                    position = end < 0 ? length : end + 1;
                }
            }
            else
            {
                break;
            }
        }
    }

    protected Token single (TokenType type)
    {
        return punctuation (type, 1);
    }

    protected Token punctuation (TokenType type, int width)
    {
        int start = position;
        position += width;
        return new Token (type, source.substring (start, position), start, position);
    }

    protected Token scanString () throws LexException
    {
        int start  = position;
        int length = source.length ();
        StringBuilder text = new StringBuilder ();
        int i = start + 1;
        while (true)
        {
            if (i >= length) throw new LexException ("Unterminated string", start);
            char c = source.charAt (i++);
            if (c == '"') break;
            if (c == '\\')
            {
                if (i >= length) throw new LexException ("Unterminated string", start);
                c = source.charAt (i++);
                switch (c)
                {
                    case 'n': text.append ('\n'); break;
                    case 't': text.append ('\t'); break;
                    case '"':
                    case '\\': text.append (c); break;
                    default:  text.append ('\\').append (c);
                }
                continue;
            }
            text.append (c);
        }
        position = i;
        return new Token (TokenType.STRING, text.toString (), start, i);
    }

    /**
        Finds the end of the Scheme datum that starts at the given offset, which is just past a #.
        Handles quote prefixes, balanced lists with strings, comments and character literals,
        strings, #t and other # forms, embedded LilyPond #{ ... #}, and plain atoms.
        @return Offset just past the datum.
    **/
    public int scanScheme (int start) throws LexException
    {
        int length = source.length ();
        if (start >= length  ||  Character.isWhitespace (source.charAt (start))) throw new LexException ("Scheme expression expected after #", start - 1);
        char c = source.charAt (start);
        switch (c)
        {
            case '\'':
            case '`':
                return scanScheme (start + 1);
            case ',':
                if (start + 1 < length  &&  source.charAt (start + 1) == '@') return scanScheme (start + 2);
                return scanScheme (start + 1);
            case '(':
                return scanList (start);
            case '"':
                return scanSchemeString (start);
            case '{':
                return scanEmbedded (start + 1);
            case '#':
                if (start + 1 >= length) throw new LexException ("Incomplete Scheme expression", start);
                char d = source.charAt (start + 1);
                if (d == '{')  return scanEmbedded (start + 2);
                if (d == '(')  return scanList (start + 1);
                if (d == '\\') return scanAtom (Math.min (start + 3, length));  // Character literal, such as #\a or #\space
                return scanAtom (start + 1);
            default:
                return scanAtom (start);
        }
    }

    protected int scanAtom (int i)
    {
        int length = source.length ();
        while (i < length)
        {
            char c = source.charAt (i);
            if (Character.isWhitespace (c)  ||  "()\";{}".indexOf (c) >= 0) break;
            i++;
        }
        return i;
    }

    protected int scanSchemeString (int start) throws LexException
    {
        int length = source.length ();
        int i = start + 1;
        while (i < length)
        {
            char c = source.charAt (i++);
            if (c == '\\') i++;
            else if (c == '"') return i;
        }
        throw new LexException ("Unterminated string in Scheme expression", start);
    }

    protected int scanList (int start) throws LexException
    {
        int length = source.length ();
        int depth  = 0;
        int i = start;
        while (i < length)
        {
            char c = source.charAt (i);
            if (c == '(')
            {
                depth++;
                i++;
            }
            else if (c == ')')
            {
                depth--;
                i++;
                if (depth == 0) return i;
            }
            else if (c == '"')
            {
                i = scanSchemeString (i);
            }
            else if (c == ';')
            {
                int end = source.indexOf ('\n', i);
                i = end < 0 ? length : end + 1;
            }
            else if (c == '#'  &&  i + 1 < length  &&  source.charAt (i + 1) == '\\')
            {
                i += 3;  // Skip the quoted character itself, which may be a paren.
            }
            else if (c == '#'  &&  i + 1 < length  &&  source.charAt (i + 1) == '{')
            {
                i = scanEmbedded (i + 2);
            }
            else
            {
                i++;
            }
        }
        throw new LexException ("Unbalanced parentheses in Scheme expression", start);
    }

    /**
        Scans embedded LilyPond code up to the matching #}.
        @param start Offset just past the opening #{
    **/
    protected int scanEmbedded (int start) throws LexException
    {
        int depth = 1;
        int i = start;
        int length = source.length ();
        while (i < length - 1)
        {
            if (source.startsWith ("#{", i))
            {
                depth++;
                i += 2;
            }
            else if (source.startsWith ("#}", i))
            {
                depth--;
                i += 2;
                if (depth == 0) return i;
            }
            else
            {
                i++;
            }
        }
        throw new LexException ("Unterminated #{ block", start - 2);
    }

    protected Token scanEscaped () throws LexException
    {
        int start  = position;
        int length = source.length ();
        if (start + 1 >= length) throw new LexException ("Lone backslash", start);
        char c = source.charAt (start + 1);
        switch (c)
        {
            case '\\': return punctuation (TokenType.DOUBLE_BACKSLASH,    2);
            case '(':  return punctuation (TokenType.ESCAPED_PAREN_OPEN,  2);
            case ')':  return punctuation (TokenType.ESCAPED_PAREN_CLOSE, 2);
            case '!':  return punctuation (TokenType.ESCAPED_BANG,        2);
            case '+':  return punctuation (TokenType.ESCAPED_PLUS,        2);
            case '<':  return punctuation (TokenType.ESCAPED_ANGLE_OPEN,  2);
            case '>':  return punctuation (TokenType.ESCAPED_ANGLE_CLOSE, 2);
        }
        if (Character.isDigit (c))
        {
            int i = start + 1;
            while (i < length  &&  Character.isDigit (source.charAt (i))) i++;
            position = i;
            return new Token (TokenType.ESCAPED_UNSIGNED, source.substring (start + 1, i), start, i);
        }
        if (! Character.isLetter (c)) throw new LexException ("Invalid escape \\" + c, start);
        int end = wordEnd (start + 1);
        position = end;
        String word = source.substring (start + 1, end);
        TokenType keyword = TokenType.keyword (word);
        if (keyword != null) return new Token (keyword, word, start, end);
        return new Token (TokenType.ESCAPED_WORD, word, start, end);
    }

    /**
        A word is letters, with single hyphens or underscores allowed between letters.
        @return Offset just past the word that starts at the given offset.
    **/
    protected int wordEnd (int i)
    {
        int length = source.length ();
        while (i < length)
        {
            char c = source.charAt (i);
            if (Character.isLetter (c))
            {
                i++;
            }
            else if ((c == '-'  ||  c == '_')  &&  i + 1 < length  &&  Character.isLetter (source.charAt (i + 1)))
            {
                i += 2;
            }
            else
            {
                break;
            }
        }
        return i;
    }

    protected Token scanWord ()
    {
        int start = position;
        int end   = wordEnd (start);
        position  = end;
        String word = source.substring (start, end);
        if ((mode == Mode.NOTES  ||  mode == Mode.CHORDS)  &&  Pitch.isNoteName (word)) return new Token (TokenType.NOTE_NAME, word, start, end);
        return new Token (TokenType.SYMBOL, word, start, end);
    }

    /**
        Digits, optionally followed by a fraction part. Chord and figure modes read "7.9" as two numbers.
    **/
    protected Token scanNumber ()
    {
        int start  = position;
        int length = source.length ();
        int i = start;
        while (i < length  &&  Character.isDigit (source.charAt (i))) i++;
        boolean real =  mode != Mode.CHORDS  &&  mode != Mode.FIGURES
                     && i + 1 < length  &&  source.charAt (i) == '.'  &&  Character.isDigit (source.charAt (i + 1));
        if (real)
        {
            i++;
            while (i < length  &&  Character.isDigit (source.charAt (i))) i++;
        }
        position = i;
        return new Token (real ? TokenType.REAL : TokenType.UNSIGNED, source.substring (start, i), start, i);
    }

    protected Token scanPunctuation () throws LexException
    {
        char c = source.charAt (position);
        switch (c)
        {
            case '<':  return single (TokenType.ANGLE_OPEN);
            case '>':  return single (TokenType.ANGLE_CLOSE);
            case '[':  return single (TokenType.BRACKET_OPEN);
            case ']':  return single (TokenType.BRACKET_CLOSE);
            case '(':  return single (TokenType.PAREN_OPEN);
            case ')':  return single (TokenType.PAREN_CLOSE);
            case '~':  return single (TokenType.TILDE);
            case '|':  return single (TokenType.PIPE);
            case '=':  return single (TokenType.EQUAL);
            case '.':  return single (TokenType.DOT);
            case '\'': return single (TokenType.QUOTE);
            case ',':  return single (TokenType.COMMA);
            case '!':  return single (TokenType.BANG);
            case '?':  return single (TokenType.QUESTION);
            case '-':  return single (TokenType.MINUS);
            case '^':  return single (TokenType.CARET);
            case '_':  return single (TokenType.UNDERSCORE);
            case '+':  return single (TokenType.PLUS);
            case '*':  return single (TokenType.STAR);
            case '/':  return single (TokenType.SLASH);
            case ':':  return single (TokenType.COLON);
        }
        throw new LexException ("Invalid character '" + c + "'", position);
    }

    /**
        In markup mode, any run of characters other than white space, braces, quotes, backslash and # is one word.
    **/
    protected Token scanMarkupWord ()
    {
        int start  = position;
        int length = source.length ();
        int i = start;
        while (i < length)
        {
            char c = source.charAt (i);
            if (Character.isWhitespace (c)  ||  "{}\"\\#".indexOf (c) >= 0) break;
            i++;
        }
        position = i;
        return new Token (TokenType.SYMBOL, source.substring (start, i), start, i);
    }

    /**
        In lyric mode a syllable is any run of characters that does not start with a digit or
        structural character. Digits end a syllable, so "la4" is a syllable and a duration.
    **/
    protected Token scanLyric () throws LexException
    {
        int start = position;
        char c = source.charAt (start);
        if (Character.isDigit (c)) return scanNumber ();

        // Duration operators directly after a number
        if (previous != null  &&  previous.end == start  &&  ".*/".indexOf (c) >= 0)
        {
            switch (previous.type)
            {
                case UNSIGNED:
                case DOT:
                case STAR:
                case SLASH:
                    return scanPunctuation ();
                default:
            }
        }

        int length = source.length ();
        int i = start;
        while (i < length)
        {
            char d = source.charAt (i);
            if (Character.isWhitespace (d)  ||  Character.isDigit (d)  ||  "{}\"\\".indexOf (d) >= 0) break;
            i++;
        }
        position = i;
        String text = source.substring (start, i);
        switch (text)
        {
            case "--": return new Token (TokenType.LYRIC_HYPHEN,   text, start, i);
            case "__": return new Token (TokenType.LYRIC_EXTENDER, text, start, i);
            case "_":  return new Token (TokenType.UNDERSCORE,     text, start, i);
            case "=":  return new Token (TokenType.EQUAL,          text, start, i);
            case "|":  return new Token (TokenType.PIPE,           text, start, i);
            case "~":  return new Token (TokenType.TILDE,          text, start, i);
        }
        return new Token (TokenType.SYMBOL, text, start, i);
    }
}
