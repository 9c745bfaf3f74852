/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import gov.sandia.tusk.backend.lilypond.Lexer.Mode;
import gov.sandia.tusk.backend.lilypond.music.AddLyrics;
import gov.sandia.tusk.backend.lilypond.music.Assignment;
import gov.sandia.tusk.backend.lilypond.music.BarCheck;
import gov.sandia.tusk.backend.lilypond.music.BarLine;
import gov.sandia.tusk.backend.lilypond.music.BookBlock;
import gov.sandia.tusk.backend.lilypond.music.BookPartBlock;
import gov.sandia.tusk.backend.lilypond.music.Chord;
import gov.sandia.tusk.backend.lilypond.music.ChordModeEntry;
import gov.sandia.tusk.backend.lilypond.music.ChordRepetition;
import gov.sandia.tusk.backend.lilypond.music.Clef;
import gov.sandia.tusk.backend.lilypond.music.ContextBlock;
import gov.sandia.tusk.backend.lilypond.music.ContextChange;
import gov.sandia.tusk.backend.lilypond.music.ContextMod;
import gov.sandia.tusk.backend.lilypond.music.ContextedMusic;
import gov.sandia.tusk.backend.lilypond.music.DrumChord;
import gov.sandia.tusk.backend.lilypond.music.DrumNote;
import gov.sandia.tusk.backend.lilypond.music.DrumPitch;
import gov.sandia.tusk.backend.lilypond.music.Duration;
import gov.sandia.tusk.backend.lilypond.music.Event;
import gov.sandia.tusk.backend.lilypond.music.Figure;
import gov.sandia.tusk.backend.lilypond.music.Fixed;
import gov.sandia.tusk.backend.lilypond.music.FunctionArg;
import gov.sandia.tusk.backend.lilypond.music.Grace;
import gov.sandia.tusk.backend.lilypond.music.Identifier;
import gov.sandia.tusk.backend.lilypond.music.Include;
import gov.sandia.tusk.backend.lilypond.music.KeySignature;
import gov.sandia.tusk.backend.lilypond.music.LanguageDecl;
import gov.sandia.tusk.backend.lilypond.music.LilyPondFile;
import gov.sandia.tusk.backend.lilypond.music.Lyric;
import gov.sandia.tusk.backend.lilypond.music.LyricsTo;
import gov.sandia.tusk.backend.lilypond.music.Mark;
import gov.sandia.tusk.backend.lilypond.music.Markup;
import gov.sandia.tusk.backend.lilypond.music.MarkupMusic;
import gov.sandia.tusk.backend.lilypond.music.ModeBlock;
import gov.sandia.tusk.backend.lilypond.music.MultiMeasureRest;
import gov.sandia.tusk.backend.lilypond.music.Music;
import gov.sandia.tusk.backend.lilypond.music.MusicFunction;
import gov.sandia.tusk.backend.lilypond.music.Note;
import gov.sandia.tusk.backend.lilypond.music.OutputDefBlock;
import gov.sandia.tusk.backend.lilypond.music.Partial;
import gov.sandia.tusk.backend.lilypond.music.Pitch;
import gov.sandia.tusk.backend.lilypond.music.PostEvent;
import gov.sandia.tusk.backend.lilypond.music.PropertyOp;
import gov.sandia.tusk.backend.lilypond.music.PropertyPath;
import gov.sandia.tusk.backend.lilypond.music.PropertyValue;
import gov.sandia.tusk.backend.lilypond.music.Rational;
import gov.sandia.tusk.backend.lilypond.music.Relative;
import gov.sandia.tusk.backend.lilypond.music.Repeat;
import gov.sandia.tusk.backend.lilypond.music.Rest;
import gov.sandia.tusk.backend.lilypond.music.SchemeExpr;
import gov.sandia.tusk.backend.lilypond.music.SchemeMusic;
import gov.sandia.tusk.backend.lilypond.music.ScoreBlock;
import gov.sandia.tusk.backend.lilypond.music.Scripts;
import gov.sandia.tusk.backend.lilypond.music.Sequential;
import gov.sandia.tusk.backend.lilypond.music.Simultaneous;
import gov.sandia.tusk.backend.lilypond.music.Skip;
import gov.sandia.tusk.backend.lilypond.music.Tempo;
import gov.sandia.tusk.backend.lilypond.music.TimeSignature;
import gov.sandia.tusk.backend.lilypond.music.Toplevel;
import gov.sandia.tusk.backend.lilypond.music.ToplevelMarkup;
import gov.sandia.tusk.backend.lilypond.music.ToplevelMusic;
import gov.sandia.tusk.backend.lilypond.music.ToplevelScheme;
import gov.sandia.tusk.backend.lilypond.music.Transpose;
import gov.sandia.tusk.backend.lilypond.music.Tuplet;
import gov.sandia.tusk.backend.lilypond.music.Tweak;
import gov.sandia.tusk.language.ParseException;

/**
    Recursive-descent parser for LilyPond source.
    Each rule consumes exactly the tokens it covers and leaves the next one in "current".
    The first error stops the parse with a ParseException that points at the offending token.
**/
public class Parser
{
    protected String source;
    protected Lexer  lexer;
    protected Token  current;
    protected Token  peeked;  // Second token of lookahead, filled on demand by peek2().
    protected Token  last;    // Most recently consumed token.

    /**
        Names assigned at the outer level. A reference to one of these never takes arguments.
    **/
    protected Set<String> variables = new HashSet<String> ();

    /**
        Commands that never take arguments. Without this list they would greedily take
        a following braced block as an argument.
    **/
    public static final Set<String> noArguments = new HashSet<String> (Arrays.asList
    (
        "break", "noBreak", "pageBreak", "noPageBreak", "pageTurn", "allowPageTurn",
        "voiceOne", "voiceTwo", "voiceThree", "voiceFour", "oneVoice",
        "stemUp", "stemDown", "stemNeutral", "slurUp", "slurDown", "slurNeutral", "slurDashed", "slurDotted", "slurSolid",
        "tieUp", "tieDown", "tieNeutral", "tieDashed", "tieDotted", "tieSolid",
        "phrasingSlurUp", "phrasingSlurDown", "phrasingSlurNeutral",
        "dynamicUp", "dynamicDown", "dynamicNeutral", "tupletUp", "tupletDown", "tupletNeutral",
        "autoBeamOn", "autoBeamOff", "cadenzaOn", "cadenzaOff", "breathe",
        "hideNotes", "unHideNotes", "xNotesOn", "xNotesOff", "harmonicsOn", "harmonicsOff",
        "improvisationOn", "improvisationOff", "easyHeadsOn", "easyHeadsOff",
        "numericTimeSignature", "defaultTimeSignature", "melisma", "melismaEnd",
        "showStaffSwitch", "hideStaffSwitch", "compressEmptyMeasures", "expandEmptyMeasures",
        "startStaff", "stopStaff", "bassFigureExtendersOn", "bassFigureExtendersOff",
        "germanChords", "semiGermanChords", "italianChords", "frenchChords",
        "powerChords", "textLengthOn", "textLengthOff", "markLengthOn", "markLengthOff",
        "sustainOn", "sustainOff", "fine", "section", "segnoMark", "codaMark"
    ));

    /**
        Functions whose final argument is music that may be a bare event, such as \parenthesize c4.
    **/
    public static final Set<String> musicLast = new HashSet<String> (Arrays.asList
    (
        "parenthesize", "transposition", "tag", "keepWithTag", "removeWithTag", "footnote",
        "xNote", "magnifyMusic", "offset", "hide", "omit", "undo", "slashedGrace", "invertChords"
    ));

    public Parser (String source)
    {
        this.source = source;
        lexer = new Lexer (source);
    }

    /**
        Parses a whole file.
        @throws ParseException with line and column filled in.
    **/
    public static LilyPondFile parse (String source) throws ParseException
    {
        Parser parser = new Parser (source);
        try
        {
            return parser.parseFile ();
        }
        catch (ParseException e)
        {
            throw e.locate (source);
        }
    }

    /**
        Parses a fragment that contains only music, such as the source stored in a label.
        @return The music items in order.
    **/
    public static List<Music> parseMusicList (String source) throws ParseException
    {
        Parser parser = new Parser (source);
        try
        {
            parser.start ();
            List<Music> result = new ArrayList<Music> ();
            while (parser.current.type != TokenType.EOF) result.add (parser.parseMusic ());
            return result;
        }
        catch (ParseException e)
        {
            throw e.locate (source);
        }
    }

    /**
        Reads a single pitch, such as "fis''" or "bes,".
    **/
    public static Pitch parsePitch (String text) throws ParseException
    {
        Parser parser = new Parser (text);
        parser.start ();
        Pitch result = parser.parsePitchRequired ();
        parser.expect (TokenType.EOF, "end of pitch");
        return result;
    }

    /**
        Reads a single duration, such as "4." or "1*3/4".
    **/
    public static Duration parseDuration (String text) throws ParseException
    {
        Parser parser = new Parser (text);
        parser.start ();
        Duration result = parser.parseDuration ();
        parser.expect (TokenType.EOF, "end of duration");
        return result;
    }

    // Token handling --------------------------------------------------------

    protected void start () throws ParseException
    {
        current = lexer.next ();
    }

    protected Token advance () throws ParseException
    {
        last = current;
        if (peeked != null)
        {
            current = peeked;
            peeked  = null;
        }
        else
        {
            current = lexer.next ();
        }
        return last;
    }

    protected Token peek2 () throws ParseException
    {
        if (peeked == null) peeked = lexer.next ();
        return peeked;
    }

    protected boolean is (TokenType type)
    {
        return current.type == type;
    }

    protected boolean accept (TokenType type) throws ParseException
    {
        if (current.type != type) return false;
        advance ();
        return true;
    }

    protected Token expect (TokenType type, String expected) throws ParseException
    {
        if (current.type != type) throw error (expected);
        return advance ();
    }

    protected ParseException error (String expected)
    {
        return new ParseException (current.describe (), expected, current.start);
    }

    /**
        @return true if the current token begins right where the previous one ended.
    **/
    protected boolean touching ()
    {
        return last != null  &&  last.end == current.start;
    }

    /**
        Switches lexer mode, re-reading the current token under the new rules.
        @return The previous mode, for restoring later.
    **/
    protected Mode mode (Mode m) throws ParseException
    {
        Mode result = lexer.mode;
        if (result == m) return result;
        lexer.reset (current.start, m);
        current = lexer.next ();
        peeked  = null;
        return result;
    }

    protected int parseUnsigned (String expected) throws ParseException
    {
        Token t = expect (TokenType.UNSIGNED, expected);
        try
        {
            return Integer.parseInt (t.text);
        }
        catch (NumberFormatException e)
        {
            throw new ParseException ("Number too large: " + t.text, t.start);
        }
    }

    /**
        Reads n/d where both parts must be nonzero.
        @return {n, d}
    **/
    protected int[] parseRatio (String expected) throws ParseException
    {
        Token first = current;
        int n = parseUnsigned (expected);
        expect (TokenType.SLASH, "/");
        int d = parseUnsigned (expected);
        if (n == 0  ||  d == 0) throw new ParseException ("Fraction must be positive: " + n + "/" + d, first.start);
        return new int[] {n, d};
    }

    // Toplevel --------------------------------------------------------------

    public LilyPondFile parseFile () throws ParseException
    {
        start ();
        LilyPondFile result = new LilyPondFile ();
        while (! is (TokenType.EOF))
        {
            if (accept (TokenType.VERSION))
            {
                result.version = expect (TokenType.STRING, "version string").text;
                continue;
            }
            result.items.add (parseToplevel ());
        }
        return result;
    }

    protected Toplevel parseToplevel () throws ParseException
    {
        switch (current.type)
        {
            case INCLUDE:
                advance ();
                return new Include (expect (TokenType.STRING, "file name").text);
            case LANGUAGE:
                advance ();
                return new LanguageDecl (expect (TokenType.STRING, "language name").text);
            case HEADER:
            case PAPER:
            case LAYOUT:
            case MIDI:
                return parseOutputDef ();
            case SCORE:
                return parseScore ();
            case BOOK:
            case BOOKPART:
                return parseBook ();
            case MARKUP:
            case MARKUPLIST:
                boolean list = is (TokenType.MARKUPLIST);
                return new ToplevelMarkup (parseMarkupTop (), list);
            case SCHEME:
                return new ToplevelScheme (new SchemeExpr (advance ().text));
            case SYMBOL:
            case STRING:
                if (isAssignment ()) return parseAssignment ();
                break;
            default:
        }
        return new ToplevelMusic (parseMusic ());
    }

    protected boolean isAssignment () throws ParseException
    {
        if (current.type != TokenType.SYMBOL  &&  current.type != TokenType.STRING) return false;
        TokenType next = peek2 ().type;
        return next == TokenType.EQUAL  ||  next == TokenType.DOT;
    }

    protected Assignment parseAssignment () throws ParseException
    {
        StringBuilder name = new StringBuilder (advance ().text);
        while (accept (TokenType.DOT))
        {
            name.append ('.').append (expect (TokenType.SYMBOL, "name").text);
        }
        expect (TokenType.EQUAL, "=");
        Assignment result = new Assignment (name.toString (), parseAssignmentValue ());
        variables.add (result.name);
        return result;
    }

    protected PropertyValue parseAssignmentValue () throws ParseException
    {
        switch (current.type)
        {
            case STRING:
                return PropertyValue.string (advance ().text);
            case SCHEME:
                return PropertyValue.scheme (new SchemeExpr (advance ().text));
            case UNSIGNED:
            case REAL:
            case MINUS:
                return PropertyValue.number (parseNumberText ());
            case MARKUP:
                return PropertyValue.markup (parseMarkupTop ());
            default:
                Music m = parseMusic ();
                if (m instanceof Identifier) return PropertyValue.identifier (((Identifier) m).name);
                return PropertyValue.music (m);
        }
    }

    /**
        A possibly negative number, possibly followed directly by a unit such as \mm.
        @return The source text.
    **/
    protected String parseNumberText () throws ParseException
    {
        int start = current.start;
        if (accept (TokenType.MINUS))
        {
            if (! touching ()  ||  (! is (TokenType.UNSIGNED)  &&  ! is (TokenType.REAL))) throw error ("number");
        }
        if (! is (TokenType.UNSIGNED)  &&  ! is (TokenType.REAL)) throw error ("number");
        advance ();
        if (is (TokenType.ESCAPED_WORD)  &&  touching ()) advance ();
        return source.substring (start, last.end);
    }

    protected OutputDefBlock parseOutputDef () throws ParseException
    {
        OutputDefBlock result = new OutputDefBlock (advance ().text);
        expect (TokenType.BRACE_OPEN, "{");
        while (! accept (TokenType.BRACE_CLOSE))
        {
            if (is (TokenType.EOF)) throw error ("}");
            if (isAssignment ())
            {
                result.items.add (parseAssignment ());
            }
            else if (is (TokenType.SCHEME))
            {
                result.items.add (new ToplevelScheme (new SchemeExpr (advance ().text)));
            }
            else if (is (TokenType.CONTEXT))
            {
                advance ();
                ContextBlock block = new ContextBlock ();
                block.mods = parseContextMods ();
                result.items.add (block);
            }
            else
            {
                result.items.add (new ToplevelMusic (parseMusic ()));
            }
        }
        return result;
    }

    protected ScoreBlock parseScore () throws ParseException
    {
        advance ();
        ScoreBlock result = new ScoreBlock ();
        expect (TokenType.BRACE_OPEN, "{");
        while (! accept (TokenType.BRACE_CLOSE))
        {
            switch (current.type)
            {
                case EOF:
                    throw error ("}");
                case HEADER:
                case LAYOUT:
                case MIDI:
                case PAPER:
                    result.items.add (parseOutputDef ());
                    break;
                case SCHEME:
                    result.items.add (new ToplevelScheme (new SchemeExpr (advance ().text)));
                    break;
                default:
                    result.items.add (new ToplevelMusic (parseMusic ()));
            }
        }
        return result;
    }

    protected BookBlock parseBook () throws ParseException
    {
        BookBlock result = advance ().type == TokenType.BOOKPART ? new BookPartBlock () : new BookBlock ("book");
        expect (TokenType.BRACE_OPEN, "{");
        while (! accept (TokenType.BRACE_CLOSE))
        {
            if (is (TokenType.EOF)) throw error ("}");
            result.items.add (parseToplevel ());
        }
        return result;
    }

    // Context modifications -------------------------------------------------

    protected List<ContextMod> parseContextMods () throws ParseException
    {
        List<ContextMod> result = new ArrayList<ContextMod> ();
        expect (TokenType.BRACE_OPEN, "{");
        while (! accept (TokenType.BRACE_CLOSE))
        {
            switch (current.type)
            {
                case EOF:
                    throw error ("}");
                case CONSISTS:
                case REMOVE:
                case ACCEPTS:
                case DENIES:
                case ALIAS:
                case DEFAULTCHILD:
                case DESCRIPTION:
                case NAME:
                case TYPE:
                    ContextMod.Kind kind = ContextMod.fromKeyword (advance ().text);
                    if      (is (TokenType.STRING)) result.add (new ContextMod (kind, advance ().text, true));
                    else if (is (TokenType.SYMBOL)) result.add (new ContextMod (kind, advance ().text, false));
                    else throw error ("name");
                    break;
                case ESCAPED_WORD:
                    result.add (new ContextMod (ContextMod.Kind.CONTEXT_REF, advance ().text, false));
                    break;
                case OVERRIDE:
                case REVERT:
                case SET:
                case UNSET:
                case ONCE:
                    Music m = parseMusicPrimary ();
                    if (! (m instanceof PropertyOp)) throw new ParseException ("Expected property operation", last.start);
                    result.add (new ContextMod ((PropertyOp) m));
                    break;
                case SYMBOL:
                case NOTE_NAME:
                    PropertyPath path = parsePropertyPath (PathStop.EQUAL);
                    expect (TokenType.EQUAL, "=");
                    result.add (new ContextMod (path, parsePropertyValue ()));
                    break;
                default:
                    throw error ("context modification");
            }
        }
        return result;
    }

    // Properties ------------------------------------------------------------

    /**
        Tells the property path rule when to stop taking #'symbol segments,
        which otherwise can't be told apart from a quoted-symbol value.
    **/
    protected enum PathStop {EQUAL, NONE, VALUE}

    protected PropertyPath parsePropertyPath (PathStop stop) throws ParseException
    {
        List<String> segments = new ArrayList<String> ();
        if (is (TokenType.SYMBOL)  ||  is (TokenType.NOTE_NAME))
        {
            segments.add (advance ().text);
            while (is (TokenType.DOT)  &&  (peek2 ().type == TokenType.SYMBOL  ||  peek2 ().type == TokenType.NOTE_NAME))
            {
                advance ();
                segments.add (advance ().text);
            }
        }
        else if (is (TokenType.SCHEME)  &&  new SchemeExpr (current.text).isQuotedSymbol ())
        {
            segments.add ("#" + advance ().text);
        }
        else
        {
            throw error ("property name");
        }

        while (is (TokenType.SCHEME)  &&  new SchemeExpr (current.text).isQuotedSymbol ())
        {
            boolean take;
            TokenType next = peek2 ().type;
            switch (stop)
            {
                case EQUAL: take = next == TokenType.EQUAL  ||  next == TokenType.SCHEME;  break;
                case VALUE: take = isValueStart (next);                                      break;
                default:    take = true;
            }
            if (! take) break;
            segments.add ("#" + advance ().text);
        }
        return new PropertyPath (segments);
    }

    protected static boolean isValueStart (TokenType type)
    {
        switch (type)
        {
            case SCHEME:
            case STRING:
            case UNSIGNED:
            case REAL:
            case MINUS:
            case MARKUP:
                return true;
            default:
                return false;
        }
    }

    protected PropertyValue parsePropertyValue () throws ParseException
    {
        switch (current.type)
        {
            case SCHEME:
                return PropertyValue.scheme (new SchemeExpr (advance ().text));
            case STRING:
                return PropertyValue.string (advance ().text);
            case UNSIGNED:
            case REAL:
            case MINUS:
                return PropertyValue.number (parseNumberText ());
            case MARKUP:
                return PropertyValue.markup (parseMarkupTop ());
            case ESCAPED_WORD:
                return PropertyValue.identifier (advance ().text);
            case BRACE_OPEN:
            case DOUBLE_ANGLE_OPEN:
                return PropertyValue.music (parseMusicPrimary ());
            default:
                throw error ("property value");
        }
    }

    protected PropertyOp parsePropertyOp () throws ParseException
    {
        PropertyOp.Type type = PropertyOp.Type.fromKeyword (advance ().text);
        PropertyOp result;
        switch (type)
        {
            case OVERRIDE:
            case SET:
                PropertyPath path = parsePropertyPath (PathStop.EQUAL);
                expect (TokenType.EQUAL, "=");
                result = new PropertyOp (type, path, parsePropertyValue ());
                break;
            default:
                result = new PropertyOp (type, parsePropertyPath (PathStop.NONE), null);
        }
        return result;
    }

    protected Tweak parseTweak () throws ParseException
    {
        expect (TokenType.TWEAK, "\\tweak");
        PropertyPath path = parsePropertyPath (PathStop.VALUE);
        return new Tweak (path, parsePropertyValue ());
    }

    // Music -----------------------------------------------------------------

    /**
        One music expression, including any \addlyrics that follow it.
    **/
    public Music parseMusic () throws ParseException
    {
        Music result = parseMusicPrimary ();
        if (! is (TokenType.ADDLYRICS)) return result;
        AddLyrics a = new AddLyrics (result);
        while (accept (TokenType.ADDLYRICS)) a.lyrics.add (parseInMode (Mode.LYRICS));
        return a;
    }

    protected Music parseInMode (Mode m) throws ParseException
    {
        Mode outer = mode (m);
        Music result = parseMusicPrimary ();
        mode (outer);
        return result;
    }

    protected Music parseMusicPrimary () throws ParseException
    {
        switch (current.type)
        {
            case BRACE_OPEN:
                return parseSequential ();
            case SEQUENTIAL:
                advance ();
                return parseSequential ();
            case DOUBLE_ANGLE_OPEN:
                return parseSimultaneous ();
            case SIMULTANEOUS:
            {
                advance ();
                Simultaneous result = new Simultaneous ();
                result.items.addAll (parseSequential ().items);
                return result;
            }
            case NEW:
            case CONTEXT:
                return parseContexted ();
            case CHANGE:
            {
                advance ();
                String type = expect (TokenType.SYMBOL, "context type").text;
                expect (TokenType.EQUAL, "=");
                return new ContextChange (type, parseName ());
            }
            case CHORDS:
            case DRUMS:
            case LYRICS:
            case FIGURES:
            {
                String keyword = advance ().text;
                return new ContextedMusic (keyword, null, parseInMode (shorthandMode (keyword)));
            }
            case CHORDMODE:
            case DRUMMODE:
            case FIGUREMODE:
            case LYRICMODE:
            case NOTEMODE:
            {
                String keyword = advance ().text;
                return new ModeBlock (keyword, parseInMode (modeFor (keyword)));
            }
            case LYRICSTO:
            {
                advance ();
                String voice = parseName ();
                return new LyricsTo (voice, parseInMode (Mode.LYRICS));
            }
            case RELATIVE:
            {
                advance ();
                Pitch reference = null;
                if (is (TokenType.NOTE_NAME)) reference = parsePitch ();
                return new Relative (reference, parseMusic ());
            }
            case FIXED:
            {
                advance ();
                Pitch reference = parsePitchRequired ();
                return new Fixed (reference, parseMusic ());
            }
            case TRANSPOSE:
            {
                advance ();
                Pitch from = parsePitchRequired ();
                Pitch to   = parsePitchRequired ();
                return new Transpose (from, to, parseMusic ());
            }
            case TUPLET:
            {
                advance ();
                int[] ratio = parseRatio ("tuplet fraction");
                Duration span = null;
                if (is (TokenType.UNSIGNED)) span = parseDuration ();
                Tuplet result = new Tuplet (ratio[0], ratio[1], parseMusic ());
                result.span = span;
                return result;
            }
            case TIMES:
            {
                advance ();
                int[] ratio = parseRatio ("fraction");
                return new Tuplet (ratio[1], ratio[0], parseMusic ());
            }
            case REPEAT:
                return parseRepeat ();
            case PARTIAL:
                advance ();
                return new Partial (parseDuration ());
            case TIME:
                return parseTime ();
            case TEMPO:
                return parseTempo ();
            case OVERRIDE:
            case REVERT:
            case SET:
            case UNSET:
                return parsePropertyOp ();
            case ONCE:
            {
                advance ();
                Music m = parseMusicPrimary ();
                if (m instanceof PropertyOp)
                {
                    ((PropertyOp) m).once = true;
                    return m;
                }
                MusicFunction f = new MusicFunction ("once");
                f.args.add (new FunctionArg (m));
                return f;
            }
            case TWEAK:
            {
                Tweak t = parseTweak ();
                Music m = parseMusicPrimary ();
                if (m instanceof Event)
                {
                    ((Event) m).tweaks.add (0, t);
                    return m;
                }
                MusicFunction f = new MusicFunction ("tweak");
                f.args.add (new FunctionArg (FunctionArg.Kind.SYMBOL_LIST, t.path.toString ()));
                f.args.add (argument (t.value));
                f.args.add (new FunctionArg (m));
                return f;
            }
            case MARKUP:
                return new MarkupMusic (parseMarkupTop (), false);
            case MARKUPLIST:
                return new MarkupMusic (parseMarkupTop (), true);
            case SCHEME:
                return new SchemeMusic (new SchemeExpr (advance ().text));
            case PIPE:
                advance ();
                return new BarCheck ();
            case ESCAPED_WORD:
                return parseCommand ();
            default:
                return parseEvent ();
        }
    }

    protected static Mode shorthandMode (String keyword)
    {
        switch (keyword)
        {
            case "chords":  return Mode.CHORDS;
            case "drums":   return Mode.DRUMS;
            case "lyrics":  return Mode.LYRICS;
            default:        return Mode.FIGURES;
        }
    }

    protected static Mode modeFor (String keyword)
    {
        switch (keyword)
        {
            case "chordmode":  return Mode.CHORDS;
            case "drummode":   return Mode.DRUMS;
            case "lyricmode":  return Mode.LYRICS;
            case "figuremode": return Mode.FIGURES;
            default:           return Mode.NOTES;
        }
    }

    /**
        A context or voice name: a string, a word or a number.
    **/
    protected String parseName () throws ParseException
    {
        switch (current.type)
        {
            case STRING:
            case SYMBOL:
            case NOTE_NAME:
            case UNSIGNED:
                return advance ().text;
            default:
                throw error ("name");
        }
    }

    protected Sequential parseSequential () throws ParseException
    {
        expect (TokenType.BRACE_OPEN, "{");
        Sequential result = new Sequential ();
        while (! accept (TokenType.BRACE_CLOSE))
        {
            if (is (TokenType.EOF)) throw error ("}");
            result.items.add (parseMusic ());
        }
        return result;
    }

    protected Simultaneous parseSimultaneous () throws ParseException
    {
        expect (TokenType.DOUBLE_ANGLE_OPEN, "<<");
        Simultaneous result = new Simultaneous ();
        int sectionStart = 0;
        while (! accept (TokenType.DOUBLE_ANGLE_CLOSE))
        {
            if (is (TokenType.EOF)) throw error (">>");
            if (is (TokenType.DOUBLE_BACKSLASH))
            {
                if (result.items.size () - sectionStart != 1) throw error ("one voice before \\\\");
                advance ();
                result.separated = true;
                sectionStart = result.items.size ();
                continue;
            }
            result.items.add (parseMusic ());
        }
        if (result.separated  &&  result.items.size () - sectionStart != 1) throw new ParseException ("Expected one voice after \\\\", last.start);
        return result;
    }

    protected ContextedMusic parseContexted () throws ParseException
    {
        String keyword = advance ().text;
        String type = expect (TokenType.SYMBOL, "context type").text;
        String name = null;
        if (accept (TokenType.EQUAL)) name = parseName ();
        List<ContextMod> with = null;
        if (accept (TokenType.WITH)) with = parseContextMods ();
        ContextedMusic result = new ContextedMusic (keyword, type, parseMusicPrimary ());
        result.name = name;
        result.with = with;
        return result;
    }

    protected Repeat parseRepeat () throws ParseException
    {
        advance ();
        Token t = expect (TokenType.SYMBOL, "repeat type");
        if (! Repeat.isType (t.text)) throw new ParseException (t.describe (), "repeat type", t.start);
        int count = parseUnsigned ("repeat count");
        Repeat result = new Repeat (t.text, count, parseMusic ());
        if (accept (TokenType.ALTERNATIVE))
        {
            expect (TokenType.BRACE_OPEN, "{");
            while (! accept (TokenType.BRACE_CLOSE))
            {
                if (is (TokenType.EOF)) throw error ("}");
                result.alternatives.add (parseMusic ());
            }
        }
        return result;
    }

    protected TimeSignature parseTime () throws ParseException
    {
        advance ();
        List<Integer> numerators = new ArrayList<Integer> ();
        numerators.add (parseUnsigned ("time signature"));
        while (accept (TokenType.PLUS)) numerators.add (parseUnsigned ("time signature"));
        expect (TokenType.SLASH, "/");
        return new TimeSignature (numerators, parseUnsigned ("time signature denominator"));
    }

    protected Tempo parseTempo () throws ParseException
    {
        advance ();
        Tempo result = new Tempo ();
        if      (is (TokenType.STRING)) result.text = Markup.string (advance ().text);
        else if (is (TokenType.SCHEME)) result.text = Markup.scheme (new SchemeExpr (advance ().text));
        else if (is (TokenType.MARKUP)) result.text = parseMarkupTop ();
        if (is (TokenType.UNSIGNED))
        {
            result.unit = parseDuration ();
            expect (TokenType.EQUAL, "=");
            result.bpm = parseUnsigned ("beats per minute");
            if (accept (TokenType.MINUS)) result.bpmHigh = parseUnsigned ("beats per minute");
        }
        if (result.text == null  &&  result.unit == null) throw error ("tempo text or metronome mark");
        return result;
    }

    /**
        Built-in commands that lex as plain escaped words, and calls to music functions.
    **/
    protected Music parseCommand () throws ParseException
    {
        String name = current.text;
        switch (name)
        {
            case "clef":
            {
                advance ();
                if (is (TokenType.STRING)) return new Clef (advance ().text);
                if (! is (TokenType.SYMBOL)  &&  ! is (TokenType.NOTE_NAME)) throw error ("clef name");
                int start = advance ().start;
                // Octave suffix such as _8 or ^15
                while (touching ()  &&  (is (TokenType.UNDERSCORE)  ||  is (TokenType.CARET)  ||  is (TokenType.UNSIGNED))) advance ();
                return new Clef (source.substring (start, last.end));
            }
            case "key":
            {
                advance ();
                Pitch tonic = parsePitchRequired ();
                Token mode = expect (TokenType.ESCAPED_WORD, "mode");
                if (! KeySignature.isMode (mode.text)) throw new ParseException (mode.describe (), "mode such as \\major", mode.start);
                return new KeySignature (tonic, mode.text);
            }
            case "bar":
                advance ();
                return new BarLine (expect (TokenType.STRING, "bar line style").text);
            case "mark":
            case "textMark":
            {
                advance ();
                Mark result = new Mark ();
                result.textMark = name.equals ("textMark");
                if      (! result.textMark  &&  accept (TokenType.DEFAULT)) result.isDefault = true;
                else if (! result.textMark  &&  is (TokenType.UNSIGNED))    result.number = parseUnsigned ("mark");
                else if (is (TokenType.STRING))                             result.label = Markup.string (advance ().text);
                else if (is (TokenType.SCHEME))                             result.label = Markup.scheme (new SchemeExpr (advance ().text));
                else if (is (TokenType.MARKUP))                             result.label = parseMarkupTop ();
                else throw error ("mark label");
                return result;
            }
            case "afterGrace":
            {
                advance ();
                Grace result = new Grace (name, null);
                if (is (TokenType.UNSIGNED))
                {
                    long n = parseUnsigned ("fraction");
                    expect (TokenType.SLASH, "/");
                    Token t = current;
                    long d = parseUnsigned ("fraction");
                    if (d == 0) throw new ParseException ("Fraction has zero denominator", t.start);
                    result.fraction = new Rational (n, d);
                }
                result.main  = parseMusicPrimary ();
                result.music = parseMusicPrimary ();
                return result;
            }
            case "grace":
            case "acciaccatura":
            case "appoggiatura":
            case "slashedGrace":
                advance ();
                return new Grace (name, parseMusicPrimary ());
        }
        return parseFunction ();
    }

    protected Music parseFunction () throws ParseException
    {
        String name = advance ().text;
        if (noArguments.contains (name)  ||  variables.contains (name)) return new Identifier (name);

        MusicFunction result = new MusicFunction (name);
        while (true)
        {
            FunctionArg arg = parseArgument ();
            if (arg == null) break;
            result.args.add (arg);
        }
        if (accept (TokenType.ETC)) result.partial = true;
        else if (musicLast.contains (name)  &&  startsMusic ()) result.args.add (new FunctionArg (parseMusicPrimary ()));

        if (result.args.isEmpty ()  &&  ! result.partial) return new Identifier (name);
        return result;
    }

    /**
        @return The next function argument, or null if the current token can't start one.
    **/
    protected FunctionArg parseArgument () throws ParseException
    {
        switch (current.type)
        {
            case STRING:
                return new FunctionArg (FunctionArg.Kind.STRING, advance ().text);
            case SCHEME:
                return new FunctionArg (new SchemeExpr (advance ().text));
            case DEFAULT:
                advance ();
                return new FunctionArg (FunctionArg.Kind.DEFAULT);
            case MARKUP:
                return new FunctionArg (parseMarkupTop ());
            case BRACE_OPEN:
            case DOUBLE_ANGLE_OPEN:
                return new FunctionArg (parseMusicPrimary ());
            case MINUS:
                if (peek2 ().type != TokenType.UNSIGNED  &&  peek2 ().type != TokenType.REAL) return null;
                if (peek2 ().start != current.end) return null;
                return new FunctionArg (FunctionArg.Kind.NUMBER, parseNumberText ());
            case REAL:
                return new FunctionArg (FunctionArg.Kind.NUMBER, parseNumberText ());
            case UNSIGNED:
            {
                TokenType next = peek2 ().type;
                if (next == TokenType.DOT  ||  next == TokenType.STAR) return new FunctionArg (parseDuration ());
                if (next == TokenType.SLASH)
                {
                    int start = advance ().start;
                    advance ();
                    expect (TokenType.UNSIGNED, "denominator");
                    return new FunctionArg (FunctionArg.Kind.NUMBER, source.substring (start, last.end));
                }
                return new FunctionArg (FunctionArg.Kind.NUMBER, advance ().text);
            }
            case SYMBOL:
            {
                if (lexer.mode == Mode.LYRICS) return null;
                if (lexer.mode == Mode.DRUMS  &&  DrumPitch.isDrumPitch (current.text)) return null;
                if (isEventWord (current.text)) return null;
                if (peek2 ().type == TokenType.EQUAL) return null;
                int start = advance ().start;
                while ((is (TokenType.DOT)  ||  is (TokenType.COMMA))  &&  touching ()  &&  peek2 ().type == TokenType.SYMBOL  &&  peek2 ().start == current.end)
                {
                    advance ();
                    advance ();
                }
                return new FunctionArg (FunctionArg.Kind.SYMBOL_LIST, source.substring (start, last.end));
            }
            default:
                return null;
        }
    }

    protected static boolean isEventWord (String word)
    {
        return word.equals ("r")  ||  word.equals ("s")  ||  word.equals ("R")  ||  word.equals ("q");
    }

    protected boolean startsMusic ()
    {
        switch (current.type)
        {
            case EOF:
            case BRACE_CLOSE:
            case DOUBLE_ANGLE_CLOSE:
            case DOUBLE_BACKSLASH:
                return false;
            default:
                return true;
        }
    }

    protected static FunctionArg argument (PropertyValue value)
    {
        switch (value.kind)
        {
            case SCHEME:     return new FunctionArg (value.scheme);
            case STRING:     return new FunctionArg (FunctionArg.Kind.STRING, value.text);
            case NUMBER:     return new FunctionArg (FunctionArg.Kind.NUMBER, value.text);
            case MARKUP:     return new FunctionArg (value.markup);
            case IDENTIFIER: return new FunctionArg (FunctionArg.Kind.IDENTIFIER, value.text);
            default:         return new FunctionArg (value.music);
        }
    }

    // Events ----------------------------------------------------------------

    protected Music parseEvent () throws ParseException
    {
        Mode m = lexer.mode;
        Event result;
        switch (current.type)
        {
            case NOTE_NAME:
                if (m == Mode.CHORDS) return parseChordModeEntry ();
                result = parseNote ();
                break;
            case ANGLE_OPEN:
                if      (m == Mode.DRUMS)   result = parseDrumChord ();
                else if (m == Mode.FIGURES) result = parseFigure ();
                else                        result = parseChord ();
                break;
            case SYMBOL:
                if (m == Mode.LYRICS)
                {
                    result = new Lyric (advance ().text);
                    ((Lyric) result).quoted = false;
                    break;
                }
                String word = current.text;
                if (isEventWord (word))
                {
                    advance ();
                    result = simpleEvent (word);
                    break;
                }
                if (m == Mode.DRUMS  &&  DrumPitch.isDrumPitch (word))
                {
                    advance ();
                    result = new DrumNote (word);
                    break;
                }
                throw error ("music");
            case STRING:
                if (m != Mode.LYRICS) throw error ("music");
                result = new Lyric (advance ().text);
                ((Lyric) result).quoted = true;
                break;
            case UNDERSCORE:
                if (m != Mode.LYRICS) throw error ("music");
                advance ();
                result = new Lyric ("_");
                break;
            default:
                throw error ("music");
        }
        if (result.duration == null  &&  is (TokenType.UNSIGNED)) result.duration = parseDuration ();
        if (result instanceof Note  &&  is (TokenType.REST))
        {
            advance ();
            Rest rest = new Rest (result.duration);
            rest.pitch = ((Note) result).pitch;
            rest.tweaks.addAll (result.tweaks);
            result = rest;
        }
        parsePostEvents (result);
        return result;
    }

    protected static Event simpleEvent (String word)
    {
        switch (word)
        {
            case "r": return new Rest (null);
            case "s": return new Skip (null);
            case "R": return new MultiMeasureRest (null);
            default:  return new ChordRepetition (null);
        }
    }

    protected Note parseNote () throws ParseException
    {
        return new Note (parsePitch ());
    }

    protected Pitch parsePitchRequired () throws ParseException
    {
        if (! is (TokenType.NOTE_NAME)) throw error ("pitch");
        return parsePitch ();
    }

    /**
        Note name, octave marks, then the optional !, ? and =octave check.
    **/
    protected Pitch parsePitch () throws ParseException
    {
        Token t = expect (TokenType.NOTE_NAME, "pitch");
        Pitch result = Pitch.fromName (t.text);
        result.octave = parseMarks ();
        if (accept (TokenType.BANG))     result.force      = true;
        if (accept (TokenType.QUESTION)) result.cautionary = true;
        if (is (TokenType.EQUAL)  &&  touching ())
        {
            advance ();
            result.octaveCheck = parseMarks ();
        }
        return result;
    }

    protected int parseMarks () throws ParseException
    {
        int result = 0;
        while (true)
        {
            if      (accept (TokenType.QUOTE)) result++;
            else if (accept (TokenType.COMMA)) result--;
            else break;
        }
        return result;
    }

    public Duration parseDuration () throws ParseException
    {
        Token t = expect (TokenType.UNSIGNED, "duration");
        long base;
        try
        {
            base = Long.parseLong (t.text);
        }
        catch (NumberFormatException e)
        {
            base = -1;
        }
        if (! Duration.isBase (base)) throw new ParseException ("Duration must be a power of two no larger than " + Duration.MAX_BASE + ": " + t.text, t.start);
        int dots = 0;
        while (accept (TokenType.DOT)) dots++;
        Duration result = new Duration ((int) base, dots);
        while (accept (TokenType.STAR))
        {
            long n = parseUnsigned ("multiplier");
            long d = 1;
            if (accept (TokenType.SLASH)) d = parseUnsigned ("multiplier denominator");
            if (n == 0  ||  d == 0) throw new ParseException ("Duration multiplier must be positive", last.start);
            result.multiply (new Rational (n, d));
        }
        return result;
    }

    protected Chord parseChord () throws ParseException
    {
        expect (TokenType.ANGLE_OPEN, "<");
        Chord result = new Chord ();
        while (! accept (TokenType.ANGLE_CLOSE))
        {
            List<Tweak> tweaks = new ArrayList<Tweak> ();
            while (is (TokenType.TWEAK)) tweaks.add (parseTweak ());
            if (! is (TokenType.NOTE_NAME)) throw error ("pitch or >");
            Note n = parseNote ();
            n.tweaks.addAll (tweaks);
            parsePostEvents (n);
            result.notes.add (n);
        }
        return result;
    }

    protected DrumChord parseDrumChord () throws ParseException
    {
        expect (TokenType.ANGLE_OPEN, "<");
        DrumChord result = new DrumChord ();
        while (! accept (TokenType.ANGLE_CLOSE))
        {
            List<Tweak> tweaks = new ArrayList<Tweak> ();
            while (is (TokenType.TWEAK)) tweaks.add (parseTweak ());
            Token t = expect (TokenType.SYMBOL, "drum name or >");
            if (! DrumPitch.isDrumPitch (t.text)) throw new ParseException (t.describe (), "drum name", t.start);
            DrumNote n = new DrumNote (t.text);
            n.tweaks.addAll (tweaks);
            parsePostEvents (n);
            result.notes.add (n);
        }
        return result;
    }

    /**
        Figures are runs of touching tokens, separated by white space.
    **/
    protected Figure parseFigure () throws ParseException
    {
        expect (TokenType.ANGLE_OPEN, "<");
        Figure result = new Figure ();
        int start = -1;
        while (! is (TokenType.ANGLE_CLOSE))
        {
            if (is (TokenType.EOF)) throw error (">");
            if (start >= 0  &&  ! touching ())
            {
                result.figures.add (source.substring (start, last.end));
                start = -1;
            }
            if (start < 0) start = current.start;
            advance ();
        }
        if (start >= 0) result.figures.add (source.substring (start, last.end));
        advance ();
        return result;
    }

    protected ChordModeEntry parseChordModeEntry () throws ParseException
    {
        ChordModeEntry result = new ChordModeEntry (parsePitch ());
        if (is (TokenType.UNSIGNED)) result.duration = parseDuration ();
        if (accept (TokenType.COLON))
        {
            int start = current.start;
            int end   = start;
            while (touching ())
            {
                switch (current.type)
                {
                    case SYMBOL:
                    case NOTE_NAME:
                    case UNSIGNED:
                    case DOT:
                    case CARET:
                    case MINUS:
                    case PLUS:
                        end = advance ().end;
                        continue;
                    default:
                }
                break;
            }
            result.modifiers = source.substring (start, end);
        }
        if (accept (TokenType.SLASH))
        {
            if (accept (TokenType.PLUS)) result.bass      = parsePitchRequired ();
            else                         result.inversion = parsePitchRequired ();
        }
        parsePostEvents (result);
        return result;
    }

    // Post-events -----------------------------------------------------------

    protected void parsePostEvents (Event e) throws ParseException
    {
        boolean lyric = e instanceof Lyric;
        while (true)
        {
            PostEvent p = parsePostEvent (lyric);
            if (p == null) return;
            e.postEvents.add (p);
        }
    }

    /**
        @return The next post-event, or null if the current token doesn't start one.
    **/
    protected PostEvent parsePostEvent (boolean lyric) throws ParseException
    {
        PostEvent result = parseSimplePostEvent ();
        if (result != null) return result;
        switch (current.type)
        {
            case LYRIC_HYPHEN:
                if (! lyric) return null;
                advance ();
                return new PostEvent (PostEvent.Kind.LYRIC_HYPHEN);
            case LYRIC_EXTENDER:
                if (! lyric) return null;
                advance ();
                return new PostEvent (PostEvent.Kind.LYRIC_EXTENDER);
            case COLON:
                if (lyric) return null;
                advance ();
                String text = "";
                if (is (TokenType.UNSIGNED)  &&  touching ()) text = advance ().text;
                return new PostEvent (PostEvent.Kind.TREMOLO, text);
            case MINUS:
            case CARET:
                return parseDirected ();
            case UNDERSCORE:
                if (lyric) return null;
                return parseDirected ();
            default:
                return null;
        }
    }

    /**
        Post-events that may appear with or without a direction indicator.
    **/
    protected PostEvent parseSimplePostEvent () throws ParseException
    {
        PostEvent.Kind kind;
        switch (current.type)
        {
            case TILDE:               kind = PostEvent.Kind.TIE;                 break;
            case PAREN_OPEN:          kind = PostEvent.Kind.SLUR_START;          break;
            case PAREN_CLOSE:         kind = PostEvent.Kind.SLUR_END;            break;
            case ESCAPED_PAREN_OPEN:  kind = PostEvent.Kind.PHRASING_SLUR_START; break;
            case ESCAPED_PAREN_CLOSE: kind = PostEvent.Kind.PHRASING_SLUR_END;   break;
            case BRACKET_OPEN:        kind = PostEvent.Kind.BEAM_START;          break;
            case BRACKET_CLOSE:       kind = PostEvent.Kind.BEAM_END;            break;
            case ESCAPED_ANGLE_OPEN:  kind = PostEvent.Kind.CRESCENDO;           break;
            case ESCAPED_ANGLE_CLOSE: kind = PostEvent.Kind.DECRESCENDO;         break;
            case ESCAPED_BANG:        kind = PostEvent.Kind.HAIRPIN_END;         break;
            case ESCAPED_UNSIGNED:
                return new PostEvent (PostEvent.Kind.STRING_NUMBER, advance ().text);
            case ESCAPED_WORD:
                String name = current.text;
                if (Scripts.isDynamic (name))
                {
                    advance ();
                    return new PostEvent (PostEvent.Kind.DYNAMIC, name);
                }
                if (Scripts.isScript (name))
                {
                    advance ();
                    return new PostEvent (PostEvent.Kind.SCRIPT, name);
                }
                return null;
            default:
                return null;
        }
        advance ();
        return new PostEvent (kind);
    }

    /**
        A direction indicator (- ^ _) and what follows it.
    **/
    protected PostEvent parseDirected () throws ParseException
    {
        char direction = advance ().text.charAt (0);
        List<Tweak> tweaks = new ArrayList<Tweak> ();
        while (is (TokenType.TWEAK)) tweaks.add (parseTweak ());

        PostEvent result = parseSimplePostEvent ();
        if (result == null)
        {
            switch (current.type)
            {
                case DOT:
                case MINUS:
                case ANGLE_CLOSE:
                case CARET:
                case PLUS:
                case BANG:
                case UNDERSCORE:
                    result = new PostEvent (PostEvent.Kind.ABBREVIATION, advance ().text);
                    break;
                case UNSIGNED:
                    result = new PostEvent (PostEvent.Kind.FINGERING, advance ().text);
                    break;
                case STRING:
                    result = new PostEvent (PostEvent.Kind.TEXT, advance ().text);
                    break;
                case MARKUP:
                    result = new PostEvent (PostEvent.Kind.MARKUP);
                    result.markup = parseMarkupTop ();
                    break;
                case ESCAPED_WORD:
                    result = new PostEvent (PostEvent.Kind.SCRIPT, advance ().text);
                    break;
                default:
                    throw error ("articulation after direction");
            }
        }
        result.direction = direction;
        result.tweaks.addAll (tweaks);
        return result;
    }

    // Markup ----------------------------------------------------------------

    /**
        Parses \markup or \markuplist and its argument, switching to markup mode and back.
    **/
    protected Markup parseMarkupTop () throws ParseException
    {
        Mode outer = mode (Mode.MARKUP);
        advance ();  // \markup or \markuplist
        Markup result = parseMarkupItem ();
        mode (outer);
        return result;
    }

    protected Markup parseMarkupItem () throws ParseException
    {
        switch (current.type)
        {
            case BRACE_OPEN:
            {
                advance ();
                Markup result = Markup.list ();
                while (! accept (TokenType.BRACE_CLOSE))
                {
                    if (is (TokenType.EOF)) throw error ("}");
                    result.args.add (parseMarkupItem ());
                }
                return result;
            }
            case STRING:
                return Markup.string (advance ().text);
            case SYMBOL:
                return Markup.word (advance ().text);
            case SCHEME:
                return Markup.scheme (new SchemeExpr (advance ().text));
            case ESCAPED_WORD:
                break;
            default:
                if (! current.type.isKeyword ()) throw error ("markup");
        }

        String name = advance ().text;
        if (! Markup.isCommand (name)) return Markup.identifier (name);
        Markup result = Markup.command (name);
        while (is (TokenType.SCHEME)) result.args.add (Markup.scheme (new SchemeExpr (advance ().text)));
        int count = Markup.arity.get (name);
        for (int i = 0; i < count; i++)
        {
            if (is (TokenType.BRACE_CLOSE)  ||  is (TokenType.EOF)) break;
            result.args.add (parseMarkupItem ());
        }
        return result;
    }
}
