/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.util.HashMap;
import java.util.Map;

public enum TokenType
{
    STRING,
    UNSIGNED,
    REAL,
    NOTE_NAME,
    SYMBOL,            // A bare word, or a syllable in lyric mode, or a word in markup mode.
    ESCAPED_WORD,      // \word that is not a keyword. Text excludes the backslash.
    ESCAPED_UNSIGNED,  // \3
    SCHEME,            // Text excludes the introducing #.

    // Keywords. Text excludes the backslash.
    ACCEPTS       ("accepts"),
    ADDLYRICS     ("addlyrics"),
    ALIAS         ("alias"),
    ALTERNATIVE   ("alternative"),
    BOOK          ("book"),
    BOOKPART      ("bookpart"),
    CHANGE        ("change"),
    CHORDMODE     ("chordmode"),
    CHORDS        ("chords"),
    CONSISTS      ("consists"),
    CONTEXT       ("context"),
    DEFAULT       ("default"),
    DEFAULTCHILD  ("defaultchild"),
    DENIES        ("denies"),
    DESCRIPTION   ("description"),
    DRUMMODE      ("drummode"),
    DRUMS         ("drums"),
    ETC           ("etc"),
    FIGUREMODE    ("figuremode"),
    FIGURES       ("figures"),
    FIXED         ("fixed"),
    HEADER        ("header"),
    INCLUDE       ("include"),
    LANGUAGE      ("language"),
    LAYOUT        ("layout"),
    LYRICMODE     ("lyricmode"),
    LYRICS        ("lyrics"),
    LYRICSTO      ("lyricsto"),
    MARKUP        ("markup"),
    MARKUPLIST    ("markuplist"),
    MIDI          ("midi"),
    NAME          ("name"),
    NEW           ("new"),
    NOTEMODE      ("notemode"),
    ONCE          ("once"),
    OVERRIDE      ("override"),
    PAPER         ("paper"),
    PARTIAL       ("partial"),
    RELATIVE      ("relative"),
    REMOVE        ("remove"),
    REPEAT        ("repeat"),
    REST          ("rest"),
    REVERT        ("revert"),
    SCORE         ("score"),
    SEQUENTIAL    ("sequential"),
    SET           ("set"),
    SIMULTANEOUS  ("simultaneous"),
    TEMPO         ("tempo"),
    TIME          ("time"),
    TIMES         ("times"),
    TRANSPOSE     ("transpose"),
    TUPLET        ("tuplet"),
    TWEAK         ("tweak"),
    TYPE          ("type"),
    UNSET         ("unset"),
    VERSION       ("version"),
    WITH          ("with"),

    // Punctuation
    BRACE_OPEN, BRACE_CLOSE,
    ANGLE_OPEN, ANGLE_CLOSE,
    DOUBLE_ANGLE_OPEN, DOUBLE_ANGLE_CLOSE,
    BRACKET_OPEN, BRACKET_CLOSE,
    PAREN_OPEN, PAREN_CLOSE,
    TILDE, PIPE, EQUAL, DOT, QUOTE, COMMA, BANG, QUESTION,
    MINUS, CARET, UNDERSCORE, PLUS, STAR, SLASH, COLON,
    DOUBLE_BACKSLASH,
    ESCAPED_PAREN_OPEN, ESCAPED_PAREN_CLOSE,
    ESCAPED_BANG, ESCAPED_PLUS,
    ESCAPED_ANGLE_OPEN, ESCAPED_ANGLE_CLOSE,
    LYRIC_HYPHEN,
    LYRIC_EXTENDER,
    EOF;

    public final String keyword;

    protected static Map<String,TokenType> keywords;

    TokenType ()
    {
        keyword = null;
    }

    TokenType (String keyword)
    {
        this.keyword = keyword;
    }

    public boolean isKeyword ()
    {
        return keyword != null;
    }

    /**
        @return The keyword type for the given escaped word (without backslash), or null if it is not a keyword.
    **/
    public static synchronized TokenType keyword (String word)
    {
        if (keywords == null)
        {
            keywords = new HashMap<String,TokenType> ();
            for (TokenType t : values ()) if (t.keyword != null) keywords.put (t.keyword, t);
        }
        return keywords.get (word);
    }
}
