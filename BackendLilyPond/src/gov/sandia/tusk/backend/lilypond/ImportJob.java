/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.tusk.backend.lilypond.music.AddLyrics;
import gov.sandia.tusk.backend.lilypond.music.Assignment;
import gov.sandia.tusk.backend.lilypond.music.BarLine;
import gov.sandia.tusk.backend.lilypond.music.BookBlock;
import gov.sandia.tusk.backend.lilypond.music.BookPartBlock;
import gov.sandia.tusk.backend.lilypond.music.Chord;
import gov.sandia.tusk.backend.lilypond.music.ChordModeEntry;
import gov.sandia.tusk.backend.lilypond.music.ChordRepetition;
import gov.sandia.tusk.backend.lilypond.music.Clef;
import gov.sandia.tusk.backend.lilypond.music.ContextedMusic;
import gov.sandia.tusk.backend.lilypond.music.DrumChord;
import gov.sandia.tusk.backend.lilypond.music.DrumNote;
import gov.sandia.tusk.backend.lilypond.music.DrumPitch;
import gov.sandia.tusk.backend.lilypond.music.Duration;
import gov.sandia.tusk.backend.lilypond.music.Event;
import gov.sandia.tusk.backend.lilypond.music.Figure;
import gov.sandia.tusk.backend.lilypond.music.FunctionArg;
import gov.sandia.tusk.backend.lilypond.music.Fixed;
import gov.sandia.tusk.backend.lilypond.music.Grace;
import gov.sandia.tusk.backend.lilypond.music.Identifier;
import gov.sandia.tusk.backend.lilypond.music.Include;
import gov.sandia.tusk.backend.lilypond.music.KeySignature;
import gov.sandia.tusk.backend.lilypond.music.LanguageDecl;
import gov.sandia.tusk.backend.lilypond.music.LilyPondFile;
import gov.sandia.tusk.backend.lilypond.music.Lyric;
import gov.sandia.tusk.backend.lilypond.music.LyricsTo;
import gov.sandia.tusk.backend.lilypond.music.Mark;
import gov.sandia.tusk.backend.lilypond.music.ModeBlock;
import gov.sandia.tusk.backend.lilypond.music.MultiMeasureRest;
import gov.sandia.tusk.backend.lilypond.music.Music;
import gov.sandia.tusk.backend.lilypond.music.MusicFunction;
import gov.sandia.tusk.backend.lilypond.music.Note;
import gov.sandia.tusk.backend.lilypond.music.OutputDefBlock;
import gov.sandia.tusk.backend.lilypond.music.Pitch;
import gov.sandia.tusk.backend.lilypond.music.PostEvent;
import gov.sandia.tusk.backend.lilypond.music.PropertyOp;
import gov.sandia.tusk.backend.lilypond.music.PropertyValue;
import gov.sandia.tusk.backend.lilypond.music.Rational;
import gov.sandia.tusk.backend.lilypond.music.Relative;
import gov.sandia.tusk.backend.lilypond.music.Renderer;
import gov.sandia.tusk.backend.lilypond.music.Repeat;
import gov.sandia.tusk.backend.lilypond.music.Rest;
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
import gov.sandia.tusk.backend.lilypond.music.Visitor;
import gov.sandia.tusk.db.MNode;
import gov.sandia.tusk.extension.BookStructure;
import gov.sandia.tusk.extension.Concepts;
import gov.sandia.tusk.extension.EventSequence;
import gov.sandia.tusk.extension.ExtensionStore;
import gov.sandia.tusk.extension.FormatOrigin;
import gov.sandia.tusk.extension.FunctionCall;
import gov.sandia.tusk.extension.GraceInfo;
import gov.sandia.tusk.extension.LyricsInfo;
import gov.sandia.tusk.extension.Markers;
import gov.sandia.tusk.extension.OutputDef;
import gov.sandia.tusk.extension.OutputDefs;
import gov.sandia.tusk.extension.PitchContext;
import gov.sandia.tusk.extension.PropertyOps;
import gov.sandia.tusk.extension.RepeatInfo;
import gov.sandia.tusk.extension.StaffContext;
import gov.sandia.tusk.extension.TextList;
import gov.sandia.tusk.extension.TupletInfo;
import gov.sandia.tusk.extension.Variables;
import gov.sandia.tusk.language.ConversionException;
import gov.sandia.tusk.language.ParseException;
import gov.sandia.tusk.mei.Element;
import gov.sandia.tusk.mei.MEI;
import gov.sandia.tusk.mei.MEIDocument;

/**
    Lowers a parsed LilyPond file into a canonical document plus extension records.
    One job converts one file. Not thread-safe.
**/
public class ImportJob
{
    public static final String AUTO_PREFIX = "ly-";

    public static final Set<String> staffTypes = new HashSet<String> (Arrays.asList
    (
        "Staff", "DrumStaff", "RhythmicStaff", "TabStaff", "GregorianTranscriptionStaff", "MensuralStaff", "VaticanaStaff", "PetrucciStaff", "KievanStaff"
    ));
    public static final Set<String> groupTypes = new HashSet<String> (Arrays.asList
    (
        "StaffGroup", "PianoStaff", "GrandStaff", "ChoirStaff", "ChordGrid"
    ));
    public static final Set<String> harmonyTypes = new HashSet<String> (Arrays.asList
    (
        "ChordNames", "FiguredBass"
    ));

    public MNode          settings;
    public Durations      durations;
    public MEIDocument    document;
    public ExtensionStore store;

    protected Map<String,Integer>       counters  = new HashMap<String,Integer> ();
    protected Set<String>               usedIDs   = new HashSet<String> ();
    protected Map<String,PropertyValue> variables = new HashMap<String,PropertyValue> ();
    protected Set<String>               expanding = new HashSet<String> ();
    protected EventSequence             toplevel  = new EventSequence ();
    protected OutputDefs                outputDefs = new OutputDefs ();
    protected Variables                 assignments = new Variables ();
    protected FormatOrigin              origin;
    protected Element                   body;
    protected Element                   titleStmt;
    protected int                       bookCount;
    protected int                       bookPartCount;
    protected int                       graceGroup;

    // Current score
    protected Element                  mdiv;
    protected Element                  scoreDef;
    protected Element                  measure;
    protected int                      staffCount;
    protected int                      meterUnit;
    protected boolean                  meterSet;
    protected Layer                    lastLayer;  // First layer of the most recent staff
    protected Map<String,Layer>        voices         = new HashMap<String,Layer> ();
    protected List<LyricsAttachment>   pendingLyrics  = new ArrayList<LyricsAttachment> ();
    protected List<HarmonyContext>     pendingHarmony = new ArrayList<HarmonyContext> ();

    private static Logger logger = Logger.getLogger (ImportJob.class);

    public ImportJob (MNode settings)
    {
        this.settings = settings;
        durations     = new Durations (settings);
    }

    public MEIDocument process (String text) throws ParseException, ConversionException
    {
        return process (Parser.parse (text));
    }

    public MEIDocument process (LilyPondFile file) throws ConversionException
    {
        Validator.validate (file);

        document = new MEIDocument ();
        store    = document.store;
        document.root.setID (newID ("mei"));

        Element head = document.root.add (new Element (MEI.HEAD, newID ("head")));
        titleStmt    = head.add (MEI.FILE_DESC).add (MEI.TITLE_STMT);
        titleStmt.add (MEI.TITLE);
        body = document.root.add (MEI.MUSIC).add (new Element (MEI.BODY, newID ("body")));

        origin = new FormatOrigin ("lilypond");
        if (file.version != null) origin.version = file.version;

        int position = 0;
        for (Toplevel t : file.items) toplevel (t, position++);

        String rootID = document.root.id ();
        store.insert (Concepts.FORMAT_ORIGIN,  rootID, origin);
        store.insert (Concepts.EVENT_SEQUENCE, rootID, toplevel);
        if (! outputDefs.defs.isEmpty ())            store.insert (Concepts.OUTPUT_DEFS, rootID, outputDefs);
        if (! assignments.assignments.isEmpty ())    store.insert (Concepts.VARIABLES,   rootID, assignments);

        logger.debug ("Imported " + document.mdivs ().size () + " scores, " + store.size () + " extension entries");
        return document;
    }

    public String newID (String kind)
    {
        while (true)
        {
            Integer count = counters.get (kind);
            count = count == null ? 1 : count + 1;
            counters.put (kind, count);
            String result = AUTO_PREFIX + kind + "-" + count;
            if (usedIDs.add (result)) return result;
        }
    }

    /**
        Adds a flag to the markers of the id, keeping any flags already there.
    **/
    public void mark (String id, String flag)
    {
        store.entry (id).getOrInsert (Concepts.MARKERS, new Markers ()).flags.add (flag);
    }

    // Toplevel ----------------------------------------------------------------

    public void toplevel (Toplevel t, int position) throws ConversionException
    {
        if (t instanceof Include)
        {
            String path = ((Include) t).path;
            origin.includes.add (path);
            toplevel.add (position, "include", path);
        }
        else if (t instanceof LanguageDecl)
        {
            origin.language = ((LanguageDecl) t).language;
            toplevel.add (position, "language", origin.language);
        }
        else if (t instanceof Assignment)
        {
            Assignment a = (Assignment) t;
            variables.put (a.name, a.value);
            assignments.assignments.put (a.name, a.value.toString ());
            toplevel.add (position, "assignment", a.name);
        }
        else if (t instanceof OutputDefBlock)
        {
            OutputDefBlock o = (OutputDefBlock) t;
            toplevel.add (position, "outputDef", String.valueOf (outputDefs.defs.size ()));
            outputDefs.defs.add (outputDef (o));
            if (o.kind.equals ("header")) header (o);
        }
        else if (t instanceof ScoreBlock)
        {
            Element m = score ((ScoreBlock) t, null);
            toplevel.add (position, "score", m.id ());
        }
        else if (t instanceof BookBlock)
        {
            BookBlock b = (BookBlock) t;
            int index;
            if (b instanceof BookPartBlock) index = bookPart ((BookPartBlock) b, -1, bookPartCount++);
            else                            index = book (b);
            toplevel.add (position, b.kind, String.valueOf (index));
        }
        else if (t instanceof ToplevelMusic)
        {
            Element m = implicitScore ((ToplevelMusic) t, null);
            toplevel.add (position, "music", m.id ());
        }
        else if (t instanceof ToplevelMarkup)
        {
            toplevel.add (position, "markup", t.toString ());
        }
        else if (t instanceof ToplevelScheme)
        {
            toplevel.add (position, "scheme", t.toString ());
        }
        else
        {
            toplevel.add (position, "toplevel", t.toString ());
        }
    }

    public static OutputDef outputDef (OutputDefBlock block)
    {
        OutputDef result = new OutputDef (block.kind);
        for (Toplevel t : block.items)
        {
            if (t instanceof Assignment)
            {
                Assignment a = (Assignment) t;
                result.assignments.put (a.name, a.value.toString ());
            }
            else
            {
                result.contextBlocks.add (t.toString ());
            }
        }
        return result;
    }

    /**
        Copies title and composer into the document header. The first header wins.
    **/
    public void header (OutputDefBlock block)
    {
        Element title = titleStmt.child (MEI.TITLE);
        if (title.text == null)
        {
            String text = plainText (block.get ("title"));
            if (text != null) title.text = text;
        }
        if (titleStmt.child (MEI.COMPOSER) == null)
        {
            String text = plainText (block.get ("composer"));
            if (text != null) titleStmt.add (MEI.COMPOSER).text = text;
        }
    }

    public static String plainText (PropertyValue value)
    {
        if (value == null) return null;
        if (value.kind == PropertyValue.Kind.MARKUP) return value.markup.plainText ();
        return value.stringValue ();
    }

    public int book (BookBlock b) throws ConversionException
    {
        int index = bookCount++;
        BookStructure structure = new BookStructure ();
        structure.book = index;
        for (Toplevel t : b.items) if (t instanceof OutputDefBlock) structure.bookDefs.add (outputDef ((OutputDefBlock) t));

        int part = 0;
        for (Toplevel t : b.items)
        {
            if (t instanceof OutputDefBlock) continue;
            if (t instanceof BookPartBlock)
            {
                bookPart ((BookPartBlock) t, index, part++);
            }
            else if (t instanceof BookBlock)
            {
                throw new ConversionException ("A book may not contain another book");
            }
            else if (t instanceof ScoreBlock)
            {
                score ((ScoreBlock) t, copy (structure));
            }
            else if (t instanceof ToplevelMusic)
            {
                implicitScore ((ToplevelMusic) t, copy (structure));
            }
            else
            {
                logger.warn ("Dropped item inside book: " + t);
            }
        }
        return index;
    }

    public int bookPart (BookPartBlock b, int book, int part) throws ConversionException
    {
        BookStructure structure = new BookStructure ();
        structure.book     = book;
        structure.bookPart = part;
        for (Toplevel t : b.items) if (t instanceof OutputDefBlock) structure.partDefs.add (outputDef ((OutputDefBlock) t));

        for (Toplevel t : b.items)
        {
            if (t instanceof OutputDefBlock) continue;
            if (t instanceof BookBlock)
            {
                throw new ConversionException ("A book part may not contain a book or another book part");
            }
            else if (t instanceof ScoreBlock)
            {
                score ((ScoreBlock) t, copy (structure));
            }
            else if (t instanceof ToplevelMusic)
            {
                implicitScore ((ToplevelMusic) t, copy (structure));
            }
            else
            {
                logger.warn ("Dropped item inside book part: " + t);
            }
        }
        return part;
    }

    /**
        Book-level output definitions are repeated on every score in the book, since the exporter
        needs only the first score of each book to rebuild them.
    **/
    protected BookStructure copy (BookStructure structure)
    {
        BookStructure result = new BookStructure ();
        result.book     = structure.book;
        result.bookPart = structure.bookPart;
        result.score    = document.mdivs ().size ();
        result.bookDefs.addAll (structure.bookDefs);
        result.partDefs.addAll (structure.partDefs);
        return result;
    }

    public Element implicitScore (ToplevelMusic music, BookStructure structure) throws ConversionException
    {
        ScoreBlock s = new ScoreBlock ();
        s.items.add (music);
        Element result = score (s, structure);
        mark (result.id (), Markers.IMPLICIT_SCORE);
        return result;
    }

    // Score -------------------------------------------------------------------

    public Element score (ScoreBlock block, BookStructure structure) throws ConversionException
    {
        beginScore ();
        EventSequence items = new EventSequence ();
        OutputDefs    defs  = new OutputDefs ();
        boolean hasMusic = false;
        int position = 0;
        for (Toplevel t : block.items)
        {
            if (t instanceof ToplevelMusic  &&  ! hasMusic)
            {
                hasMusic = true;
                staves (((ToplevelMusic) t).music, scoreDef.child (MEI.STAFF_GRP));
                items.add (position, "music", "");
            }
            else if (t instanceof OutputDefBlock)
            {
                items.add (position, "outputDef", String.valueOf (defs.defs.size ()));
                defs.defs.add (outputDef ((OutputDefBlock) t));
            }
            else
            {
                items.add (position, "toplevel", t.toString ());
            }
            position++;
        }
        finishScore ();

        String id = mdiv.id ();
        store.insert (Concepts.EVENT_SEQUENCE, id, items);
        if (! defs.defs.isEmpty ()) store.insert (Concepts.OUTPUT_DEFS,    id, defs);
        if (structure != null)      store.insert (Concepts.BOOK_STRUCTURE, id, structure);
        return mdiv;
    }

    protected void beginScore ()
    {
        mdiv = body.add (new Element (MEI.MDIV, newID ("mdiv")));
        mdiv.set (MEI.N, body.children (MEI.MDIV).size ());
        Element score = mdiv.add (new Element (MEI.SCORE, newID ("score")));
        scoreDef = score.add (new Element (MEI.SCORE_DEF, newID ("scoreDef")));
        scoreDef.add (new Element (MEI.STAFF_GRP, newID ("staffGrp")));
        Element section = score.add (new Element (MEI.SECTION, newID ("section")));
        measure = section.add (new Element (MEI.MEASURE, newID ("measure")));
        measure.set (MEI.N, 1);

        staffCount = 0;
        meterUnit  = 4;
        meterSet   = false;
        lastLayer  = null;
        voices.clear ();
        pendingLyrics.clear ();
        pendingHarmony.clear ();
        scoreDef.set (MEI.METER_COUNT, 4);
        scoreDef.set (MEI.METER_UNIT,  4);
    }

    protected void finishScore () throws ConversionException
    {
        for (HarmonyContext h : pendingHarmony) harmony (h);
        for (LyricsAttachment a : pendingLyrics)
        {
            Layer target = a.target;
            if (a.voiceID != null)
            {
                target = voices.get (a.voiceID);
                if (target == null) logger.warn ("Lyrics refer to unknown voice \"" + a.voiceID + "\"; kept as source text");
            }
            else if (target == null)
            {
                logger.warn ("Lyrics have no voice to attach to; kept as source text");
            }
            if (target == null) unattached (a);
            else                lyrics (target, a);
        }
    }

    /**
        Gives lyrics that align to nothing a staff of their own, holding the source as a placeholder.
    **/
    protected void unattached (LyricsAttachment a) throws ConversionException
    {
        Music source = a.origin == null ? a.lyrics : a.origin;
        Element group = scoreDef.children (MEI.STAFF_GRP).get (0);
        Element staffDef = group.add (new Element (MEI.STAFF_DEF, newID ("staffDef")));
        staffDef.set (MEI.N, ++staffCount);
        Element staff = measure.add (new Element (MEI.STAFF_EL, newID ("staff")));
        staff.set (MEI.N, staffCount);
        Layer l = layer (staff, staffCount, null);
        mark (l.layer.id (), Markers.BARE);
        placeholder (l, MEI.DIR, Labels.MUSIC, source.toString ());
        finishLayer (l);
    }

    // Staff analysis ----------------------------------------------------------

    /**
        Follows an identifier to the music it names. Returns the argument unchanged if it is not
        an identifier for music.
    **/
    public Music resolve (Music m)
    {
        int depth = 0;
        while (m instanceof Identifier  &&  depth++ < 100)
        {
            Music value = musicVariable (((Identifier) m).name);
            if (value == null) break;
            m = value;
        }
        return m;
    }

    public Music musicVariable (String name)
    {
        PropertyValue value = variables.get (name);
        int depth = 0;
        while (value != null  &&  value.kind == PropertyValue.Kind.IDENTIFIER  &&  depth++ < 100) value = variables.get (value.text);
        if (value == null  ||  value.kind != PropertyValue.Kind.MUSIC) return null;
        return value.music;
    }

    public boolean isStaffLevel (Music m)
    {
        m = resolve (m);
        if (m instanceof AddLyrics) return isStaffLevel (((AddLyrics) m).music)  &&  resolve (((AddLyrics) m).music) instanceof ContextedMusic;
        if (m instanceof ContextedMusic)
        {
            String type = ((ContextedMusic) m).contextType ();
            return staffTypes.contains (type)  ||  groupTypes.contains (type)  ||  harmonyTypes.contains (type)  ||  type.equals ("Lyrics");
        }
        if (m instanceof Simultaneous)
        {
            Simultaneous s = (Simultaneous) m;
            if (s.items.isEmpty ()) return false;
            for (Music item : s.items) if (! isStaffLevel (item)) return false;
            return true;
        }
        return false;
    }

    public void staves (Music m, Element group) throws ConversionException
    {
        m = resolve (m);
        if (! isStaffLevel (m))
        {
            staff (null, m, group);
            return;
        }
        if (m instanceof Simultaneous)
        {
            store.entry (group.id ()).set (Concepts.MARKERS, new Markers (Markers.SIMULTANEOUS));
            for (Music item : ((Simultaneous) m).items) staffItem (item, group);
        }
        else
        {
            staffItem (m, group);
        }
    }

    public void staffItem (Music item, Element group) throws ConversionException
    {
        item = resolve (item);
        if (item instanceof AddLyrics)
        {
            AddLyrics a = (AddLyrics) item;
            staffItem (a.music, group);
            for (Music l : a.lyrics) pendingLyrics.add (new LyricsAttachment (LyricsInfo.ADDLYRICS, lastLayer, null, l));
            return;
        }
        if (! (item instanceof ContextedMusic))
        {
            staff (null, item, group);
            return;
        }

        ContextedMusic c = (ContextedMusic) item;
        String type = c.contextType ();
        if (staffTypes.contains (type))
        {
            staff (c, c.music, group);
        }
        else if (groupTypes.contains (type))
        {
            Element inner = group.add (new Element (MEI.STAFF_GRP, newID ("staffGrp")));
            store.insert (Concepts.STAFF_CONTEXT, inner.id (), staffContext (c));
            staves (c.music, inner);
        }
        else if (type.equals ("Lyrics"))
        {
            lyricsContext (c);
        }
        else if (harmonyTypes.contains (type))
        {
            Element staffDef = group.add (new Element (MEI.STAFF_DEF, newID ("staffDef")));
            staffDef.set (MEI.N, ++staffCount);
            store.insert (Concepts.STAFF_CONTEXT, staffDef.id (), staffContext (c));
            pendingHarmony.add (new HarmonyContext (staffDef, c));
        }
        else
        {
            staff (null, c, group);
        }
    }

    /**
        Queues a Lyrics context for alignment once every voice of the score is known.
        Without \lyricsto, the syllables go to the most recent layer.
    **/
    public void lyricsContext (ContextedMusic c)
    {
        Music content = resolve (c.music);
        LyricsAttachment a;
        if (content instanceof LyricsTo)
        {
            LyricsTo lt = (LyricsTo) content;
            a = new LyricsAttachment (LyricsInfo.LYRICSTO, null, lt.voice, lt.lyrics);
        }
        else
        {
            a = new LyricsAttachment (LyricsInfo.LYRICMODE, lastLayer, null, content);
        }
        a.origin = c;
        pendingLyrics.add (a);
    }

    public static boolean isLyrics (Music m)
    {
        return m instanceof ContextedMusic  &&  ((ContextedMusic) m).contextType ().equals ("Lyrics");
    }

    public static StaffContext staffContext (ContextedMusic c)
    {
        StaffContext result = new StaffContext (c.contextType ());
        result.keyword = c.keyword;
        if (c.name != null) result.name = c.name;
        if (c.with != null)
        {
            Renderer r = new Renderer ();
            ContextedMusic.renderMods (r, c.with);
            result.with = r.toString ();
        }
        return result;
    }

    public boolean hasEvents (Music m)
    {
        final boolean[] found = new boolean[1];
        final Set<String> seen = new HashSet<String> ();
        m.visit (new Visitor ()
        {
            public boolean visit (Music n)
            {
                if (found[0]) return false;
                if (n instanceof Event)
                {
                    found[0] = true;
                    return false;
                }
                if (n instanceof Identifier)
                {
                    String name = ((Identifier) n).name;
                    Music value = musicVariable (name);
                    if (value != null  &&  seen.add (name)) value.visit (this);
                }
                return true;
            }
        });
        return found[0];
    }

    public void staff (ContextedMusic context, Music music, Element group) throws ConversionException
    {
        int n = ++staffCount;
        Element staffDef = group.add (new Element (MEI.STAFF_DEF, newID ("staffDef")));
        staffDef.set (MEI.N, n);
        staffDef.set (MEI.LINES, 5);
        if (context != null) store.insert (Concepts.STAFF_CONTEXT, staffDef.id (), staffContext (context));

        Element staff = measure.add (new Element (MEI.STAFF_EL, newID ("staff")));
        staff.set (MEI.N, n);

        Music top = music;
        if (top instanceof Simultaneous)
        {
            Simultaneous s = (Simultaneous) top;

            // Sibling Lyrics contexts align to voices rather than forming layers of their own.
            List<Music>          items  = new ArrayList<Music> ();
            List<ContextedMusic> lyrics = new ArrayList<ContextedMusic> ();
            for (Music item : s.items)
            {
                Music r = resolve (item);
                if (isLyrics (r)) lyrics.add ((ContextedMusic) r);
                else              items.add (item);
            }

            int nonEmpty = 0;
            for (Music item : items) if (hasEvents (item)) nonEmpty++;
            if (nonEmpty > 1)
            {
                if (s.separated) mark (staff.id (), Markers.SEPARATED);
                boolean first = true;
                for (Music item : items)
                {
                    Layer l = layer (staff, n, item);
                    if (first) lastLayer = l;
                    first = false;
                }
            }
            else
            {
                // Only one voice carries notes, so everything shares one layer.
                Layer l = layer (staff, n, null);
                lastLayer = l;
                for (Music item : items) lower (l, item);
                finishLayer (l);
            }
            for (ContextedMusic c : lyrics) lyricsContext (c);
            return;
        }
        lastLayer = layer (staff, n, top);
    }

    /**
        Creates a layer and lowers one voice into it.
        @param music The voice, or null to leave the layer empty for the caller to fill and finish.
    **/
    public Layer layer (Element staff, int staffN, Music music) throws ConversionException
    {
        Element e = staff.add (new Element (MEI.LAYER, newID ("layer")));
        int n = staff.children (MEI.LAYER).size ();
        e.set (MEI.N, n);
        Layer result = new Layer (e, staffN, n);
        if (music == null) return result;

        List<Music> lyrics = new ArrayList<Music> ();
        while (true)
        {
            if (music instanceof AddLyrics)
            {
                AddLyrics a = (AddLyrics) music;
                lyrics.addAll (a.lyrics);
                music = a.music;
                continue;
            }
            if (music instanceof ContextedMusic  &&  ((ContextedMusic) music).contextType ().equals ("Voice")  &&  ! store.contains (Concepts.STAFF_CONTEXT, e.id ()))
            {
                ContextedMusic c = (ContextedMusic) music;
                store.insert (Concepts.STAFF_CONTEXT, e.id (), staffContext (c));
                if (c.name != null) voices.put (c.name, result);
                music = c.music;
                continue;
            }
            break;
        }
        for (Music l : lyrics) pendingLyrics.add (new LyricsAttachment (LyricsInfo.ADDLYRICS, result, null, l));

        if (music instanceof Sequential)
        {
            for (Music item : ((Sequential) music).items) lower (result, item);
        }
        else
        {
            mark (e.id (), Markers.BARE);
            lower (result, music);
        }
        finishLayer (result);
        return result;
    }

    protected void finishLayer (Layer l)
    {
        for (Element p : l.pending) p.set (MEI.STARTID, "#" + l.layer.id ());
        l.pending.clear ();
        if (! l.slurs.isEmpty ()  ||  ! l.phrasing.isEmpty ()) logger.warn ("Unterminated slur in " + l.layer.id ());
        if (l.beam    != null) logger.warn ("Unterminated beam in " + l.layer.id ());
        if (l.hairpin != null) logger.warn ("Unterminated hairpin in " + l.layer.id ());
    }

    // Layer contents ----------------------------------------------------------

    public void lower (Layer l, Music m) throws ConversionException
    {
        if (m instanceof Event)
        {
            event (l, (Event) m);
        }
        else if (m instanceof Sequential)
        {
            Span s = openSpan (l, MEI.ANNOT, Labels.BLOCK);
            for (Music item : ((Sequential) m).items) lower (l, item);
            closeSpan (l, s, m);
        }
        else if (m instanceof Relative)
        {
            Relative r = (Relative) m;
            PitchState outer = l.pitch;
            l.pitch = outer.copy ();
            l.pitch.mode      = PitchState.Mode.RELATIVE;
            l.pitch.reference = r.reference == null ? Pitch.DEFAULT_RELATIVE : r.reference;
            Span s = openSpan (l, MEI.ANNOT, Labels.PITCH);
            store.insert (Concepts.PITCH_CONTEXT, s.annot.id (), PitchContext.relative (r.reference == null ? "" : r.reference.toString ()));
            lower (l, r.music);
            l.pitch = outer;
            closeSpan (l, s, m);
        }
        else if (m instanceof Fixed)
        {
            Fixed f = (Fixed) m;
            PitchState outer = l.pitch;
            l.pitch = outer.copy ();
            l.pitch.mode      = PitchState.Mode.FIXED;
            l.pitch.reference = f.reference;
            Span s = openSpan (l, MEI.ANNOT, Labels.PITCH);
            store.insert (Concepts.PITCH_CONTEXT, s.annot.id (), PitchContext.fixed (f.reference.toString ()));
            lower (l, f.music);
            l.pitch = outer;
            closeSpan (l, s, m);
        }
        else if (m instanceof Transpose)
        {
            Transpose t = (Transpose) m;
            PitchState outer = l.pitch;
            l.pitch = outer.copy ();
            l.pitch.mode = PitchState.Mode.ABSOLUTE;
            l.pitch.transpositions.add (new Pitch[] {t.from, t.to});
            Span s = openSpan (l, MEI.ANNOT, Labels.PITCH);
            store.insert (Concepts.PITCH_CONTEXT, s.annot.id (), PitchContext.transpose (t.from.toString (), t.to.toString ()));
            lower (l, t.music);
            l.pitch = outer;
            closeSpan (l, s, m);
        }
        else if (m instanceof Tuplet)
        {
            Tuplet t = (Tuplet) m;
            Span s = openSpan (l, MEI.TUPLET_SPAN, null);
            s.annot.set (MEI.NUM,     t.numerator);
            s.annot.set (MEI.NUMBASE, t.denominator);
            TupletInfo info = new TupletInfo (t.numerator, t.denominator);
            if (t.span != null) info.span = t.span.toString ();
            store.insert (Concepts.TUPLET_INFO, s.annot.id (), info);
            Rational outer = l.factor;
            l.factor = outer.multiply (t.factor ());
            lower (l, t.music);
            l.factor = outer;
            closeSpan (l, s, m);
        }
        else if (m instanceof Repeat)
        {
            Repeat r = (Repeat) m;
            Span s = openSpan (l, MEI.ANNOT, Labels.REPEAT);
            RepeatInfo info = new RepeatInfo (r.type, r.count);
            info.alternatives = r.alternatives.size ();
            store.insert (Concepts.REPEAT_INFO, s.annot.id (), info);
            lower (l, r.body);
            for (int i = 0; i < r.alternatives.size (); i++)
            {
                Music a = r.alternatives.get (i);
                Span e = openSpan (l, MEI.ANNOT, Labels.ENDING);
                RepeatInfo ending = new RepeatInfo (r.type, r.count);
                ending.ending = i;
                store.insert (Concepts.REPEAT_INFO, e.annot.id (), ending);
                lower (l, a);
                closeSpan (l, e, a);
            }
            closeSpan (l, s, m);
        }
        else if (m instanceof Grace)
        {
            Grace g = (Grace) m;
            Span s = openSpan (l, MEI.ANNOT, Labels.GRACE);
            GraceInfo info = new GraceInfo (g.kind, ++graceGroup);
            if (g.fraction != null) info.fraction = g.fraction.toString ();
            store.insert (Concepts.GRACE_INFO, s.annot.id (), info);
            if (g.main != null) lower (l, g.main);
            GraceInfo outer = l.grace;
            l.grace = info;
            lower (l, g.music);
            l.grace = outer;
            closeSpan (l, s, m);
        }
        else if (m instanceof ContextedMusic)
        {
            ContextedMusic c = (ContextedMusic) m;
            String type = c.contextType ();
            if (type.equals ("Lyrics")  ||  harmonyTypes.contains (type))
            {
                placeholder (l, MEI.DIR, Labels.MUSIC, m.toString ());
                return;
            }
            Span s = openSpan (l, MEI.ANNOT, Labels.CONTEXT);
            store.insert (Concepts.STAFF_CONTEXT, s.annot.id (), staffContext (c));
            if (type.equals ("Voice")  &&  c.name != null  &&  ! voices.containsKey (c.name)) voices.put (c.name, l);
            lower (l, c.music);
            closeSpan (l, s, m);
        }
        else if (m instanceof ModeBlock)
        {
            ModeBlock b = (ModeBlock) m;
            if (! b.mode.equals ("drummode")  &&  ! b.mode.equals ("notemode"))
            {
                placeholder (l, MEI.DIR, Labels.MUSIC, m.toString ());
                return;
            }
            Span s = openSpan (l, MEI.ANNOT, Labels.MODE);
            s.annot.text = b.mode;
            lower (l, b.music);
            closeSpan (l, s, m);
        }
        else if (m instanceof AddLyrics)
        {
            AddLyrics a = (AddLyrics) m;
            lower (l, a.music);
            for (Music lyric : a.lyrics) pendingLyrics.add (new LyricsAttachment (LyricsInfo.ADDLYRICS, l, null, lyric));
        }
        else if (m instanceof Identifier)
        {
            Identifier id = (Identifier) m;
            Music value = musicVariable (id.name);
            if (value == null  ||  expanding.contains (id.name))
            {
                if (value != null) logger.warn ("Variable \\" + id.name + " refers to itself; left unexpanded");
                function (l, new MusicFunction (id.name));
                return;
            }
            expanding.add (id.name);
            Span s = openSpan (l, MEI.ANNOT, Labels.VARIABLE);
            s.annot.text = id.name;
            lower (l, value);
            expanding.remove (id.name);
            closeSpan (l, s, m);
        }
        else if (m instanceof MusicFunction)
        {
            function (l, (MusicFunction) m);
        }
        else if (m instanceof PropertyOp)
        {
            PropertyOp op = (PropertyOp) m;
            if (isMelismaDirective (op)) return;
            Element p = placeholder (l, MEI.DIR, Labels.PROP, op.toString ());
            gov.sandia.tusk.extension.PropertyOp record = new gov.sandia.tusk.extension.PropertyOp (op.type.keyword, op.path.toString ());
            if (op.value != null) record.value = op.value.toString ();
            record.once = op.once;
            PropertyOps ops = new PropertyOps ();
            ops.ops.add (record);
            store.insert (Concepts.PROPERTY_OPS, p.id (), ops);
        }
        else if (m instanceof SchemeMusic)
        {
            placeholder (l, MEI.DIR, Labels.SCHEME_MUSIC, m.toString ());
        }
        else if (m instanceof Clef)
        {
            String name = ((Clef) m).name;
            Element e = new Element (MEI.CLEF, newID ("clef"));
            if (! Symbols.lowerClef (name, e)) e.set (MEI.LABEL, Labels.CLEF + name);
            slot (l, e);
        }
        else if (m instanceof KeySignature)
        {
            KeySignature k = (KeySignature) m;
            Element e = new Element (MEI.KEY_SIG_EL, newID ("keySig"));
            e.set (MEI.PNAME, String.valueOf (k.tonic.step));
            String accid = Symbols.accidental (k.tonic.alteration);
            if (k.tonic.alteration != 0  &&  accid != null) e.set (MEI.ACCID, accid);
            e.set (MEI.MODE, k.mode);
            e.set (MEI.SIG,  k.keySig ());
            slot (l, e);
        }
        else if (m instanceof TimeSignature)
        {
            TimeSignature t = (TimeSignature) m;
            Element e = new Element (MEI.METER_SIG, newID ("meterSig"));
            e.set (MEI.COUNT, t.numeratorText ());
            e.set (MEI.UNIT,  t.denominator);
            slot (l, e);
            if (! meterSet)
            {
                meterSet  = true;
                meterUnit = t.denominator;
                scoreDef.set (MEI.METER_COUNT, t.numeratorText ());
                scoreDef.set (MEI.METER_UNIT,  t.denominator);
            }
        }
        else if (m instanceof BarLine)
        {
            String style = ((BarLine) m).style;
            Element e = new Element (MEI.BAR_LINE, newID ("barLine"));
            String form = Symbols.barForm (style);
            if (form == null) e.set (MEI.LABEL, Labels.BAR + style);
            else              e.set (MEI.FORM,  form);
            slot (l, e);
        }
        else if (m instanceof Tempo)
        {
            Tempo t = (Tempo) m;
            Element e = placeholder (l, MEI.TEMPO, Labels.MUSIC, m.toString ());
            if (t.bpm != null)
            {
                e.set (MEI.MM, t.bpm);
                e.set (MEI.MM_UNIT, t.unit.base);
                if (t.unit.dots > 0) e.set (MEI.MM_DOTS, t.unit.dots);
            }
            if (t.text != null) e.text = t.text.plainText ();
        }
        else if (m instanceof Mark)
        {
            Mark mark = (Mark) m;
            Element e = placeholder (l, mark.textMark ? MEI.DIR : MEI.REH, Labels.MUSIC, m.toString ());
            if (mark.label  != null) e.text = mark.label.plainText ();
            if (mark.number != null) e.text = String.valueOf (mark.number);
        }
        else
        {
            if (m instanceof Simultaneous) logger.warn ("Simultaneous music inside a voice is kept as source text");
            placeholder (l, MEI.DIR, Labels.MUSIC, m.toString ());
        }
    }

    public static boolean isMelismaDirective (PropertyOp op)
    {
        return op.type == PropertyOp.Type.SET  &&  op.path.last ().equals ("melismaBusyProperties");
    }

    public void function (Layer l, MusicFunction f)
    {
        Element p = placeholder (l, MEI.DIR, Labels.FUNC, f.toString ());
        FunctionCall call = new FunctionCall (f.name);
        call.partial = f.partial;
        for (FunctionArg a : f.args)
        {
            Renderer r = new Renderer ();
            a.render (r);
            call.args.add (r.toString ());
        }
        store.insert (Concepts.FUNCTION_CALL, p.id (), call);
    }

    // Slots, placeholders and spans -------------------------------------------

    /**
        Appends an element to the layer and anchors any waiting placeholders to it.
    **/
    public void slot (Layer l, Element e)
    {
        l.layer.add (e);
        for (Element p : l.pending) p.set (MEI.STARTID, "#" + e.id ());
        l.pending.clear ();
        l.slots.add (e.id ());
    }

    public Element placeholder (Layer l, String name, String prefix, String text)
    {
        Element result = new Element (name, newID (name));
        result.set (MEI.LABEL, Labels.encode (prefix, text));
        result.set (MEI.STAFF, l.staffN);
        result.set (MEI.LAYER, l.n);
        measure.add (result);
        l.slots.add (result.id ());
        l.pending.add (result);
        return result;
    }

    public Span openSpan (Layer l, String name, String type)
    {
        Element annot = new Element (name, newID (type == null ? name : type));
        if (type != null) annot.set (MEI.TYPE, Labels.SPAN + type);
        annot.set (MEI.STAFF, l.staffN);
        annot.set (MEI.LAYER, l.n);
        measure.add (annot);
        return new Span (annot, l.slots.size ());
    }

    /**
        Attaches the span to the first and last slot lowered since it opened.
        If nothing was lowered, the span is discarded and the music is kept as a placeholder instead.
    **/
    public void closeSpan (Layer l, Span s, Music m)
    {
        if (l.slots.size () == s.start)
        {
            measure.remove (s.annot);
            store.remove (s.annot.id ());
            placeholder (l, MEI.DIR, Labels.MUSIC, m.toString ());
            return;
        }
        s.annot.set (MEI.STARTID, "#" + l.slots.get (s.start));
        s.annot.set (MEI.ENDID,   "#" + l.slots.get (l.slots.size () - 1));
    }

    // Events ------------------------------------------------------------------

    public void event (Layer l, Event e) throws ConversionException
    {
        if (e instanceof Lyric  ||  e instanceof Figure  ||  e instanceof ChordModeEntry)
        {
            placeholder (l, MEI.DIR, Labels.MUSIC, e.toString ());
            return;
        }
        if (e instanceof ChordRepetition  &&  l.lastChord == null)
        {
            logger.warn ("Chord repetition with no previous chord; kept as source text");
            placeholder (l, MEI.DIR, Labels.MUSIC, e.toString ());
            return;
        }

        Duration d = e.duration;
        if (d == null) d = l.last;
        else           l.last = d;

        Element result;
        boolean sounding = true;
        if (e instanceof Note)
        {
            result = new Element (MEI.NOTE, newID ("note"));
            pitch (result, l.pitch.sound (l.pitch.locate (((Note) e).pitch)), ((Note) e).pitch);
        }
        else if (e instanceof Chord)
        {
            Chord c = (Chord) e;
            result = new Element (MEI.CHORD, newID ("chord"));
            List<Pitch> located = l.pitch.locateChord (c.notes);
            for (int i = 0; i < c.notes.size (); i++)
            {
                Note n = c.notes.get (i);
                Element child = result.add (new Element (MEI.NOTE, newID ("note")));
                pitch (child, l.pitch.sound (located.get (i)), n.pitch);
                tweaks (child, n);
            }
            l.lastChord = result;
        }
        else if (e instanceof ChordRepetition)
        {
            result = new Element (MEI.CHORD, newID ("chord"));
            for (Element n : l.lastChord.children (MEI.NOTE))
            {
                Element child = result.add (new Element (MEI.NOTE, newID ("note")));
                for (String a : new String[] {MEI.PNAME, MEI.OCT, MEI.ACCID_GES, MEI.ACCID, MEI.FUNC})
                {
                    if (n.has (a)) child.set (a, n.get (a));
                }
            }
            mark (result.id (), Markers.CHORD_REPETITION);
        }
        else if (e instanceof DrumNote)
        {
            result = new Element (MEI.NOTE, newID ("note"));
            drum (result, ((DrumNote) e).name);
        }
        else if (e instanceof DrumChord)
        {
            result = new Element (MEI.CHORD, newID ("chord"));
            for (DrumNote n : ((DrumChord) e).notes)
            {
                Element child = result.add (new Element (MEI.NOTE, newID ("note")));
                drum (child, n.name);
                tweaks (child, n);
            }
        }
        else if (e instanceof MultiMeasureRest)
        {
            sounding = false;
            result = new Element (MEI.MREST, newID ("mRest"));
            store.insert (Concepts.MREST_INFO, result.id (), d.toString ());
        }
        else if (e instanceof Rest)
        {
            sounding = false;
            Rest r = (Rest) e;
            result = new Element (MEI.REST, newID ("rest"));
            if (r.pitch != null)
            {
                Pitch p = l.pitch.sound (l.pitch.locate (r.pitch));
                store.insert (Concepts.PITCHED_REST, result.id (), p.toString ());
            }
        }
        else if (e instanceof Skip)
        {
            sounding = false;
            result = new Element (MEI.SPACE, newID ("space"));
        }
        else
        {
            logger.warn ("Unsupported event " + e + "; kept as source text");
            placeholder (l, MEI.DIR, Labels.MUSIC, e.toString ());
            return;
        }

        tweaks (result, e);
        durations.lower (d, l.factor, result);
        if (l.grace != null)
        {
            String kind = l.grace.kind;
            result.set (MEI.GRACE, kind.equals ("acciaccatura")  ||  kind.equals ("slashedGrace") ? "acc" : "unacc");
        }
        slot (l, result);

        // Ties
        boolean tiedFrom = l.tied;
        boolean tiedTo   = e.hasPostEvent (PostEvent.Kind.TIE);
        String tie = null;
        if      (tiedFrom  &&  tiedTo) tie = "m";
        else if (tiedTo)               tie = "i";
        else if (tiedFrom)             tie = "t";
        if (tie != null  &&  sounding)
        {
            result.set (MEI.TIE, tie);
            for (Element n : result.children (MEI.NOTE)) n.set (MEI.TIE, tie);
        }
        l.tied = tiedTo  &&  sounding;

        postEvents (l, result, e);

        if (sounding  &&  l.grace == null  &&  ! tiedFrom) l.eligible.add (result);
        if (l.grace == null) l.offset = l.offset.add (d.length ().multiply (l.factor));
    }

    public void pitch (Element e, Pitch p, Pitch written)
    {
        e.set (MEI.PNAME, String.valueOf (p.step));
        e.set (MEI.OCT,   p.absoluteOctave ());
        String accid = Symbols.accidental (p.alteration);
        if (p.alteration != 0  &&  accid != null) e.set (MEI.ACCID_GES, accid);
        if (written.force  ||  written.cautionary)
        {
            e.set (MEI.ACCID, accid == null ? "n" : accid);
            if (written.cautionary) e.set (MEI.FUNC, "caution");
        }
    }

    public void drum (Element e, String name)
    {
        store.insert (Concepts.DRUM_EVENT, e.id (), name);
        if (DrumPitch.isDrumPitch (name)) e.set (MEI.PNUM, DrumPitch.midi (name));
    }

    /**
        A tweak of the id property names the element. Other tweaks are kept as source text.
    **/
    public void tweaks (Element e, Event source)
    {
        TextList others = new TextList ();
        for (Tweak t : source.tweaks)
        {
            if (t.path.segments.size () == 1  &&  t.path.last ().equals ("id"))
            {
                String id = t.value.stringValue ();
                if (id != null  &&  ! id.isEmpty ())
                {
                    if (usedIDs.add (id))
                    {
                        usedIDs.remove (e.id ());
                        store.rename (e.id (), id);
                        e.setID (id);
                        mark (id, Markers.CUSTOM_ID);
                        continue;
                    }
                    logger.warn ("Duplicate id \"" + id + "\"; kept as a tweak");
                }
            }
            others.items.add (t.toString ());
        }
        if (! others.items.isEmpty ()) store.insert (Concepts.TWEAKS, e.id (), others);
    }

    // Post-events -------------------------------------------------------------

    public void postEvents (Layer l, Element e, Event source)
    {
        String id = e.id ();
        for (PostEvent p : source.postEvents)
        {
            if (p.kind == PostEvent.Kind.TIE) continue;
            if (! p.tweaks.isEmpty ())
            {
                control (l, MEI.DIR, e, p).set (MEI.LABEL, Labels.POST + p.toString ());
                continue;
            }

            switch (p.kind)
            {
                case SLUR_START:
                case PHRASING_SLUR_START:
                {
                    Element s = control (l, MEI.SLUR, e, p);
                    if (p.direction == '^') s.set ("curvedir", "above");
                    if (p.direction == '_') s.set ("curvedir", "below");
                    s.remove (MEI.PLACE);
                    if (p.kind == PostEvent.Kind.SLUR_START)
                    {
                        l.slurs.push (s);
                    }
                    else
                    {
                        mark (s.id (), Markers.PHRASING_SLUR);
                        l.phrasing.push (s);
                    }
                    break;
                }
                case SLUR_END:
                case PHRASING_SLUR_END:
                {
                    Deque<Element> stack = p.kind == PostEvent.Kind.SLUR_END ? l.slurs : l.phrasing;
                    if (stack.isEmpty ())
                    {
                        logger.warn ("Unmatched slur end at " + id);
                        control (l, MEI.DIR, e, p).set (MEI.LABEL, Labels.POST + p.toString ());
                    }
                    else
                    {
                        stack.pop ().set (MEI.ENDID, "#" + id);
                    }
                    break;
                }
                case BEAM_START:
                    if (l.beam != null) logger.warn ("Nested beam at " + id);
                    l.beam = control (l, MEI.BEAM_SPAN, e, p);
                    break;
                case BEAM_END:
                    if (l.beam == null)
                    {
                        logger.warn ("Unmatched beam end at " + id);
                        control (l, MEI.DIR, e, p).set (MEI.LABEL, Labels.POST + p.toString ());
                    }
                    else
                    {
                        l.beam.set (MEI.ENDID, "#" + id);
                        l.beam = null;
                    }
                    break;
                case CRESCENDO:
                case DECRESCENDO:
                    endHairpin (l, e, false);
                    l.hairpin = control (l, MEI.HAIRPIN, e, p);
                    l.hairpin.set (MEI.FORM, p.kind == PostEvent.Kind.CRESCENDO ? "cres" : "dim");
                    break;
                case HAIRPIN_END:
                    if (l.hairpin == null) control (l, MEI.DIR, e, p).set (MEI.LABEL, Labels.POST + p.toString ());
                    else                   endHairpin (l, e, true);
                    break;
                case DYNAMIC:
                    endHairpin (l, e, false);
                    control (l, MEI.DYNAM, e, p).text = p.text;
                    break;
                case SCRIPT:
                    script (l, e, p);
                    break;
                case ABBREVIATION:
                {
                    String name = p.articulation ();
                    String artic = name == null ? null : Scripts.articulations.get (name);
                    if (artic == null)
                    {
                        control (l, MEI.DIR, e, p).set (MEI.LABEL, Labels.POST + p.toString ());
                        break;
                    }
                    Element a = e.add (new Element (MEI.ARTIC_EL, newID ("artic")));
                    a.set (MEI.ARTIC, artic);
                    a.set (MEI.LABEL, Labels.ABBR + p.text);
                    place (a, p);
                    break;
                }
                case FINGERING:
                    control (l, MEI.FING, e, p).text = p.text;
                    break;
                case TEXT:
                    control (l, MEI.DIR, e, p).text = p.text;
                    break;
                default:
                    control (l, MEI.DIR, e, p).set (MEI.LABEL, Labels.POST + p.toString ());
            }
        }
    }

    protected void script (Layer l, Element e, PostEvent p)
    {
        String name = p.text;
        String artic = Scripts.articulations.get (name);
        if (artic != null)
        {
            Element a = e.add (new Element (MEI.ARTIC_EL, newID ("artic")));
            a.set (MEI.ARTIC, artic);
            a.set (MEI.LABEL, Labels.SCRIPT + name);
            place (a, p);
            return;
        }
        String element;
        if      (Scripts.fermatas.contains (name))  element = MEI.FERMATA;
        else if (name.equals ("trill"))             element = MEI.TRILL;
        else if (Scripts.ornaments.contains (name)) element = MEI.ORNAM;
        else                                        element = MEI.DIR;
        control (l, element, e, p).set (MEI.LABEL, Labels.SCRIPT + name);
    }

    /**
        @param explicit true if the hairpin is terminated by \! rather than by a following dynamic.
    **/
    protected void endHairpin (Layer l, Element e, boolean explicit)
    {
        if (l.hairpin == null) return;
        if (! explicit  &&  l.hairpin.get (MEI.STARTID).equals ("#" + e.id ())) return;
        l.hairpin.set (MEI.ENDID, "#" + e.id ());
        l.hairpin = null;
    }

    public Element control (Layer l, String name, Element anchor, PostEvent p)
    {
        Element result = measure.add (new Element (name, newID (name)));
        result.set (MEI.STAFF, l.staffN);
        result.set (MEI.LAYER, l.n);
        result.set (MEI.STARTID, "#" + anchor.id ());
        place (result, p);
        return result;
    }

    protected static void place (Element e, PostEvent p)
    {
        if      (p.direction == '^') e.set (MEI.PLACE, "above");
        else if (p.direction == '_') e.set (MEI.PLACE, "below");
    }

    // Lyrics ------------------------------------------------------------------

    public void lyrics (Layer target, LyricsAttachment a)
    {
        int verse = ++target.verses;
        LyricsInfo info = store.get (Concepts.LYRICS_INFO, target.layer.id ());
        if (info == null)
        {
            info = new LyricsInfo (a.style);
            if (a.voiceID != null) info.voiceID = a.voiceID;
            store.insert (Concepts.LYRICS_INFO, target.layer.id (), info);
        }
        info.count = verse;

        final List<Lyric> syllables = new ArrayList<Lyric> ();
        resolve (a.lyrics).visit (new Visitor ()
        {
            public boolean visit (Music m)
            {
                if (m instanceof Lyric)
                {
                    syllables.add ((Lyric) m);
                    return false;
                }
                if (m instanceof Identifier)
                {
                    Music value = musicVariable (((Identifier) m).name);
                    if (value != null) value.visit (this);
                    return false;
                }
                if (m instanceof Event  ||  m.children ().isEmpty ())
                {
                    logger.debug ("Dropped non-lyric item in lyrics: " + m);
                    return false;
                }
                return true;
            }
        });

        List<Element> syls    = new ArrayList<Element> ();
        List<Boolean> hyphens = new ArrayList<Boolean> ();
        int slot = 0;
        for (Lyric s : syllables)
        {
            if (slot >= target.eligible.size ())
            {
                logger.warn ("More syllables than notes in " + target.layer.id () + "; extra syllables dropped");
                break;
            }
            Element note = target.eligible.get (slot++);
            if (s.isSkip ())
            {
                syls.add (null);
                hyphens.add (false);
                continue;
            }
            Element v = note.add (new Element (MEI.VERSE, newID ("verse")));
            v.set (MEI.N, verse);
            Element syl = v.add (new Element (MEI.SYL, newID ("syl")));
            syl.text = s.text;
            boolean hyphen = s.hasPostEvent (PostEvent.Kind.LYRIC_HYPHEN);
            if      (hyphen)                                          syl.set (MEI.CON, "d");
            else if (s.hasPostEvent (PostEvent.Kind.LYRIC_EXTENDER))  syl.set (MEI.CON, "u");
            syls.add (syl);
            hyphens.add (hyphen);
        }

        // Word positions follow from hyphens on either side.
        for (int i = 0; i < syls.size (); i++)
        {
            Element syl = syls.get (i);
            if (syl == null) continue;
            boolean before = i > 0  &&  hyphens.get (i - 1);
            boolean after  = hyphens.get (i);
            if      (before  &&  after) syl.set (MEI.WORDPOS, "m");
            else if (after)             syl.set (MEI.WORDPOS, "i");
            else if (before)            syl.set (MEI.WORDPOS, "t");
        }
    }

    // Harmony -----------------------------------------------------------------

    public void harmony (HarmonyContext h)
    {
        final String staffDefID = h.staffDef.id ();
        final int    n          = h.staffDef.get (MEI.N, 0);
        final EventSequence extras = new EventSequence ();
        final int[]  position   = new int[1];
        final Duration[] last   = {new Duration (4)};
        final Rational[] offset = {Rational.ZERO};

        resolve (h.context.music).visit (new Visitor ()
        {
            public boolean visit (Music m)
            {
                if (m instanceof Identifier)
                {
                    Music value = musicVariable (((Identifier) m).name);
                    if (value == null)
                    {
                        extras.add (position[0]++, "music", m.toString ());
                        return false;
                    }
                    value.visit (this);
                    return false;
                }
                if (! (m instanceof Event))
                {
                    if (m instanceof Sequential  ||  m instanceof ModeBlock  ||  m instanceof ContextedMusic) return true;
                    extras.add (position[0]++, "music", m.toString ());
                    return false;
                }

                Event e = (Event) m;
                Duration d = e.duration == null ? last[0] : e.duration;
                last[0] = d;
                double tstamp = 1 + offset[0].doubleValue () * meterUnit;

                Element result;
                if (e instanceof Figure)
                {
                    result = new Element (MEI.FB, newID ("fb"));
                    for (String f : ((Figure) e).figures) result.add (MEI.F).text = f;
                    store.insert (Concepts.FIGURE_INFO, result.id (), e.toString ());
                }
                else if (e instanceof ChordModeEntry  ||  e instanceof Rest  ||  e instanceof Skip)
                {
                    result = new Element (MEI.HARM, newID ("harm"));
                    if      (e instanceof ChordModeEntry) result.text = Symbols.chordSymbol ((ChordModeEntry) e);
                    else if (e instanceof Rest)           result.text = "N.C.";
                    store.insert (Concepts.CHORD_MODE_INFO, result.id (), e.toString ());
                }
                else
                {
                    extras.add (position[0]++, "music", m.toString ());
                    return false;
                }
                result.set (MEI.STAFF, n);
                result.set (MEI.TSTAMP, format (tstamp));
                durations.lower (d, Rational.ONE, result);
                measure.add (result);
                offset[0] = offset[0].add (d.length ());
                position[0]++;
                return false;
            }
        });

        if (! extras.events.isEmpty ()) store.insert (Concepts.EVENT_SEQUENCE, staffDefID, extras);
    }

    public static String format (double value)
    {
        if (value == Math.rint (value)) return String.valueOf ((long) value);
        return String.valueOf (Math.round (value * 1e6) / 1e6);
    }

    // Helper classes ----------------------------------------------------------

    public static class Layer
    {
        public Element        layer;
        public int            staffN;
        public int            n;
        public List<String>   slots    = new ArrayList<String> ();   // Ids of lowered items, in source order
        public List<Element>  pending  = new ArrayList<Element> ();  // Placeholders waiting for the next element
        public List<Element>  eligible = new ArrayList<Element> ();  // Notes that can carry a syllable
        public Rational       offset   = Rational.ZERO;              // In whole notes
        public Duration       last     = new Duration (4);
        public PitchState     pitch    = new PitchState ();
        public Rational       factor   = Rational.ONE;
        public GraceInfo      grace;
        public boolean        tied;
        public Deque<Element> slurs    = new ArrayDeque<Element> ();
        public Deque<Element> phrasing = new ArrayDeque<Element> ();
        public Element        beam;
        public Element        hairpin;
        public Element        lastChord;
        public int            verses;

        public Layer (Element layer, int staffN, int n)
        {
            this.layer  = layer;
            this.staffN = staffN;
            this.n      = n;
        }
    }

    public static class Span
    {
        public Element annot;
        public int     start;  // Index of first slot

        public Span (Element annot, int start)
        {
            this.annot = annot;
            this.start = start;
        }
    }

    public static class LyricsAttachment
    {
        public String style;
        public Layer  target;   // Null when voiceID names the target
        public String voiceID;
        public Music  lyrics;
        public Music  origin;   // The whole Lyrics context as written, if there was one

        public LyricsAttachment (String style, Layer target, String voiceID, Music lyrics)
        {
            this.style   = style;
            this.target  = target;
            this.voiceID = voiceID;
            this.lyrics  = lyrics;
        }
    }

    public static class HarmonyContext
    {
        public Element        staffDef;
        public ContextedMusic context;

        public HarmonyContext (Element staffDef, ContextedMusic context)
        {
            this.staffDef = staffDef;
            this.context  = context;
        }
    }
}
