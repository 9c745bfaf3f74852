/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import gov.sandia.tusk.language.LexException;

public class LexerTest
{
    protected static List<TokenType> types (String source, Lexer.Mode mode) throws LexException
    {
        List<TokenType> result = new ArrayList<TokenType> ();
        for (Token t : new Lexer (source, mode).tokenize ()) result.add (t.type);
        return result;
    }

    @Test
    public void testNotes () throws LexException
    {
        List<TokenType> expected = Arrays.asList
        (
            TokenType.BRACE_OPEN,
            TokenType.NOTE_NAME, TokenType.QUOTE, TokenType.UNSIGNED, TokenType.DOT,
            TokenType.NOTE_NAME, TokenType.COMMA, TokenType.UNSIGNED, TokenType.PAREN_OPEN,
            TokenType.BRACE_CLOSE,
            TokenType.EOF
        );
        assertEquals (expected, types ("{ c'4. fis,8( }", Lexer.Mode.NOTES));
    }

    @Test
    public void testKeywordsAndWords () throws LexException
    {
        List<Token> tokens = new Lexer ("\\relative \\stemUp \\3 \\\\ \\!").tokenize ();
        assertEquals (TokenType.RELATIVE,         tokens.get (0).type);
        assertEquals (TokenType.ESCAPED_WORD,     tokens.get (1).type);
        assertEquals ("stemUp",                   tokens.get (1).text);
        assertEquals (TokenType.ESCAPED_UNSIGNED, tokens.get (2).type);
        assertEquals (TokenType.DOUBLE_BACKSLASH, tokens.get (3).type);
        assertEquals (TokenType.ESCAPED_BANG,     tokens.get (4).type);
    }

    @Test
    public void testCommentsSkipped () throws LexException
    {
        assertEquals (Arrays.asList (TokenType.NOTE_NAME, TokenType.NOTE_NAME, TokenType.EOF), types ("c % line\n%{ block %} d", Lexer.Mode.NOTES));
    }

    @Test
    public void testStringEscapes () throws LexException
    {
        Token t = new Lexer ("\"say \\\"hi\\\"\"").next ();
        assertEquals (TokenType.STRING, t.type);
        assertEquals ("say \"hi\"", t.text);
    }

    @Test
    public void testScheme () throws LexException
    {
        List<Token> tokens = new Lexer ("#'(a \"b)\" c) d").tokenize ();
        assertEquals (TokenType.SCHEME, tokens.get (0).type);
        assertEquals ("'(a \"b)\" c)",  tokens.get (0).text);
        assertEquals (TokenType.NOTE_NAME, tokens.get (1).type);
    }

    @Test
    public void testLyrics () throws LexException
    {
        List<Token> tokens = new Lexer ("la4 -- di __ _", Lexer.Mode.LYRICS).tokenize ();
        assertEquals (TokenType.SYMBOL,         tokens.get (0).type);
        assertEquals ("la",                     tokens.get (0).text);
        assertEquals (TokenType.UNSIGNED,       tokens.get (1).type);
        assertEquals (TokenType.LYRIC_HYPHEN,   tokens.get (2).type);
        assertEquals (TokenType.SYMBOL,         tokens.get (3).type);
        assertEquals (TokenType.LYRIC_EXTENDER, tokens.get (4).type);
        assertEquals (TokenType.UNDERSCORE,     tokens.get (5).type);
    }

    @Test
    public void testOffsetsOnFailure ()
    {
        try
        {
            new Lexer ("c d $").tokenize ();
            fail ("Invalid character was accepted");
        }
        catch (LexException e)
        {
            assertEquals (4, e.offset);
        }

        try
        {
            new Lexer ("c \"open").tokenize ();
            fail ("Unterminated string was accepted");
        }
        catch (LexException e)
        {
            assertEquals (2, e.offset);
        }
    }
}
