/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.tusk.backend.lilypond.music.AddLyrics;
import gov.sandia.tusk.backend.lilypond.music.Assignment;
import gov.sandia.tusk.backend.lilypond.music.BarCheck;
import gov.sandia.tusk.backend.lilypond.music.BarLine;
import gov.sandia.tusk.backend.lilypond.music.BookBlock;
import gov.sandia.tusk.backend.lilypond.music.BookPartBlock;
import gov.sandia.tusk.backend.lilypond.music.Chord;
import gov.sandia.tusk.backend.lilypond.music.ChordRepetition;
import gov.sandia.tusk.backend.lilypond.music.Clef;
import gov.sandia.tusk.backend.lilypond.music.ContextedMusic;
import gov.sandia.tusk.backend.lilypond.music.DrumChord;
import gov.sandia.tusk.backend.lilypond.music.DrumNote;
import gov.sandia.tusk.backend.lilypond.music.Duration;
import gov.sandia.tusk.backend.lilypond.music.Event;
import gov.sandia.tusk.backend.lilypond.music.Fixed;
import gov.sandia.tusk.backend.lilypond.music.Grace;
import gov.sandia.tusk.backend.lilypond.music.Identifier;
import gov.sandia.tusk.backend.lilypond.music.Include;
import gov.sandia.tusk.backend.lilypond.music.KeySignature;
import gov.sandia.tusk.backend.lilypond.music.LanguageDecl;
import gov.sandia.tusk.backend.lilypond.music.LilyPondFile;
import gov.sandia.tusk.backend.lilypond.music.Lyric;
import gov.sandia.tusk.backend.lilypond.music.LyricsTo;
import gov.sandia.tusk.backend.lilypond.music.ModeBlock;
import gov.sandia.tusk.backend.lilypond.music.MultiMeasureRest;
import gov.sandia.tusk.backend.lilypond.music.Music;
import gov.sandia.tusk.backend.lilypond.music.Note;
import gov.sandia.tusk.backend.lilypond.music.OutputDefBlock;
import gov.sandia.tusk.backend.lilypond.music.Pitch;
import gov.sandia.tusk.backend.lilypond.music.PostEvent;
import gov.sandia.tusk.backend.lilypond.music.PropertyPath;
import gov.sandia.tusk.backend.lilypond.music.PropertyValue;
import gov.sandia.tusk.backend.lilypond.music.Rational;
import gov.sandia.tusk.backend.lilypond.music.Relative;
import gov.sandia.tusk.backend.lilypond.music.Renderer;
import gov.sandia.tusk.backend.lilypond.music.Repeat;
import gov.sandia.tusk.backend.lilypond.music.Rest;
import gov.sandia.tusk.backend.lilypond.music.ScoreBlock;
import gov.sandia.tusk.backend.lilypond.music.Scripts;
import gov.sandia.tusk.backend.lilypond.music.Sequential;
import gov.sandia.tusk.backend.lilypond.music.Simultaneous;
import gov.sandia.tusk.backend.lilypond.music.Skip;
import gov.sandia.tusk.backend.lilypond.music.TimeSignature;
import gov.sandia.tusk.backend.lilypond.music.Toplevel;
import gov.sandia.tusk.backend.lilypond.music.ToplevelMusic;
import gov.sandia.tusk.backend.lilypond.music.Transpose;
import gov.sandia.tusk.backend.lilypond.music.Tuplet;
import gov.sandia.tusk.backend.lilypond.music.Tweak;
import gov.sandia.tusk.backend.lilypond.music.Unparsed;
import gov.sandia.tusk.db.MNode;
import gov.sandia.tusk.extension.BookStructure;
import gov.sandia.tusk.extension.Concepts;
import gov.sandia.tusk.extension.ControlEvent;
import gov.sandia.tusk.extension.EventSequence;
import gov.sandia.tusk.extension.ExtensionStore;
import gov.sandia.tusk.extension.FormatOrigin;
import gov.sandia.tusk.extension.GraceInfo;
import gov.sandia.tusk.extension.LyricsInfo;
import gov.sandia.tusk.extension.Markers;
import gov.sandia.tusk.extension.OutputDef;
import gov.sandia.tusk.extension.OutputDefs;
import gov.sandia.tusk.extension.PitchContext;
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
    Raises a canonical document plus extension records back into a LilyPond syntax tree.
    Documents that did not come from LilyPond carry no records, in which case the tree is
    built from the document alone.
**/
public class ExportJob
{
    public static final String MELISMA = "\\set melismaBusyProperties = #'(melismaBusy tieMelismaBusy)";

    public MNode          settings;
    public Durations      durations;
    public MEIDocument    document;
    public ExtensionStore store;
    public boolean        melisma;

    protected boolean                  foreign;    // No LilyPond origin recorded
    protected Map<String,List<Element>> starting = new HashMap<String,List<Element>> ();
    protected Map<String,List<Element>> ending   = new HashMap<String,List<Element>> ();
    protected Set<Music>               verbatim = Collections.newSetFromMap (new IdentityHashMap<Music,Boolean> ());
    protected List<Element>            emitted  = new ArrayList<Element> ();

    private static Logger logger = Logger.getLogger (ExportJob.class);

    public ExportJob (MNode settings)
    {
        this.settings = settings;
        durations     = new Durations (settings);
        melisma       = settings.getOrDefault (1, "melisma") != 0;
    }

    public String process (MEIDocument document) throws ConversionException
    {
        LilyPondFile file = raise (document);
        Renderer renderer = new Renderer ();
        renderer.indent = settings.getOrDefault (2, "indent");
        file.render (renderer);
        return renderer.toString ();
    }

    public LilyPondFile raise (MEIDocument document) throws ConversionException
    {
        this.document = document;
        store = document.store;
        if (document.body () == null) throw new ConversionException ("Document has no music body");

        LilyPondFile result = new LilyPondFile ();
        String rootID = document.root.id ();
        FormatOrigin  origin   = store.get (Concepts.FORMAT_ORIGIN,  rootID);
        EventSequence sequence = store.get (Concepts.EVENT_SEQUENCE, rootID);
        foreign = origin == null;

        result.version = settings.getOrDefault ("2.24.0", "version");
        if (origin != null  &&  ! origin.version.isEmpty ()) result.version = origin.version;

        List<Element> mdivs = document.mdivs ();
        if (sequence == null)
        {
            OutputDefBlock header = header ();
            if (header != null) result.items.add (header);
        }
        else
        {
            OutputDefs defs = store.get (Concepts.OUTPUT_DEFS, rootID);
            Variables  vars = store.get (Concepts.VARIABLES,   rootID);
            for (ControlEvent e : sequence.events)
            {
                switch (e.kind)
                {
                    case "include":
                        result.items.add (new Include (e.text));
                        break;
                    case "language":
                        result.items.add (new LanguageDecl (e.text));
                        break;
                    case "assignment":
                        if (vars == null  ||  ! vars.assignments.containsKey (e.text))
                        {
                            logger.warn ("No value recorded for variable " + e.text);
                            break;
                        }
                        result.items.addAll (parseToplevel (Assignment.renderName (e.text) + " = " + vars.assignments.get (e.text)));
                        break;
                    case "outputDef":
                        OutputDef def = outputDef (defs, e.text);
                        if (def != null) result.items.addAll (outputDefBlock (def));
                        break;
                    case "score":
                    case "music":
                    {
                        Element mdiv = document.find (e.text);
                        if (mdiv == null)
                        {
                            logger.warn ("Score " + e.text + " is missing from the document");
                            break;
                        }
                        result.items.add (scoreItem (mdiv));
                        break;
                    }
                    case "book":
                        result.items.add (book (mdivs, Integer.parseInt (e.text)));
                        break;
                    case "bookpart":
                        result.items.add (bookPart (mdivs, -1, Integer.parseInt (e.text)));
                        break;
                    default:  // markup, scheme and anything else kept as source text
                        result.items.addAll (parseToplevel (e.text));
                }
            }
        }

        // Scores not reached through the recorded sequence, such as those added by another tool
        for (Element mdiv : mdivs)
        {
            if (emitted.contains (mdiv)) continue;
            result.items.add (scoreItem (mdiv));
        }
        return result;
    }

    protected OutputDefBlock header ()
    {
        Element head = document.head ();
        if (head == null) return null;
        OutputDefBlock result = new OutputDefBlock ("header");
        List<Element> titles = head.descendants (MEI.TITLE);
        if (! titles.isEmpty ()  &&  titles.get (0).getText () != null  &&  ! titles.get (0).getText ().isEmpty ())
        {
            result.items.add (new Assignment ("title", PropertyValue.string (titles.get (0).getText ())));
        }
        List<Element> composers = head.descendants (MEI.COMPOSER);
        if (! composers.isEmpty ()  &&  composers.get (0).getText () != null  &&  ! composers.get (0).getText ().isEmpty ())
        {
            result.items.add (new Assignment ("composer", PropertyValue.string (composers.get (0).getText ())));
        }
        if (result.items.isEmpty ()) return null;
        return result;
    }

    protected OutputDef outputDef (OutputDefs defs, String index)
    {
        try
        {
            return defs.defs.get (Integer.parseInt (index));
        }
        catch (NumberFormatException | IndexOutOfBoundsException | NullPointerException e)
        {
            logger.warn ("Missing output definition " + index, e);
            return null;
        }
    }

    public List<Toplevel> outputDefBlock (OutputDef def)
    {
        StringBuilder text = new StringBuilder ();
        text.append ('\\').append (def.kind).append (" {\n");
        for (Map.Entry<String,String> a : def.assignments.entrySet ())
        {
            text.append (Assignment.renderName (a.getKey ())).append (" = ").append (a.getValue ()).append ('\n');
        }
        for (String b : def.contextBlocks) text.append (b).append ('\n');
        text.append ("}\n");
        return parseToplevel (text.toString ());
    }

    protected List<Toplevel> parseToplevel (String text)
    {
        try
        {
            return Parser.parse (text).items;
        }
        catch (ParseException e)
        {
            logger.warn ("Recorded source text no longer parses: " + text, e);
            return new ArrayList<Toplevel> ();
        }
    }

    // Books -------------------------------------------------------------------

    public BookBlock book (List<Element> mdivs, int index) throws ConversionException
    {
        BookBlock result = new BookBlock ("book");
        boolean first = true;
        Map<Integer,BookBlock> parts = new HashMap<Integer,BookBlock> ();
        for (Element mdiv : mdivs)
        {
            BookStructure s = store.get (Concepts.BOOK_STRUCTURE, mdiv.id ());
            if (s == null  ||  s.book != index) continue;
            if (first)
            {
                for (OutputDef d : s.bookDefs) result.items.addAll (outputDefBlock (d));
                first = false;
            }
            if (s.bookPart < 0)
            {
                result.items.add (scoreItem (mdiv));
                continue;
            }
            BookBlock part = parts.get (s.bookPart);
            if (part == null)
            {
                part = new BookPartBlock ();
                for (OutputDef d : s.partDefs) part.items.addAll (outputDefBlock (d));
                parts.put (s.bookPart, part);
                result.items.add (part);
            }
            part.items.add (scoreItem (mdiv));
        }
        return result;
    }

    public BookBlock bookPart (List<Element> mdivs, int book, int index) throws ConversionException
    {
        BookBlock result = new BookPartBlock ();
        boolean first = true;
        for (Element mdiv : mdivs)
        {
            BookStructure s = store.get (Concepts.BOOK_STRUCTURE, mdiv.id ());
            if (s == null  ||  s.book != book  ||  s.bookPart != index) continue;
            if (first)
            {
                for (OutputDef d : s.partDefs) result.items.addAll (outputDefBlock (d));
                first = false;
            }
            result.items.add (scoreItem (mdiv));
        }
        return result;
    }

    // Scores ------------------------------------------------------------------

    public Toplevel scoreItem (Element mdiv) throws ConversionException
    {
        emitted.add (mdiv);
        String id = mdiv.id ();
        Music music = scoreMusic (mdiv);
        Markers markers = store.get (Concepts.MARKERS, id);
        if (markers != null  &&  markers.has (Markers.IMPLICIT_SCORE)  &&  music != null) return new ToplevelMusic (music);

        ScoreBlock result = new ScoreBlock ();
        EventSequence items = store.get (Concepts.EVENT_SEQUENCE, id);
        if (items == null)
        {
            if (music != null) result.items.add (new ToplevelMusic (music));
            return result;
        }
        OutputDefs defs = store.get (Concepts.OUTPUT_DEFS, id);
        for (ControlEvent e : items.events)
        {
            switch (e.kind)
            {
                case "music":
                    if (music != null) result.items.add (new ToplevelMusic (music));
                    break;
                case "outputDef":
                    OutputDef def = outputDef (defs, e.text);
                    if (def != null) result.items.addAll (outputDefBlock (def));
                    break;
                default:
                    result.items.addAll (parseToplevel (e.text));
            }
        }
        return result;
    }

    public Music scoreMusic (Element mdiv) throws ConversionException
    {
        Element score = mdiv.child (MEI.SCORE);
        if (score == null) return null;
        List<Element> measures = score.descendants (MEI.MEASURE);
        indexControls (measures);

        Element scoreDef = score.child (MEI.SCORE_DEF);
        Element group    = scoreDef == null ? null : scoreDef.child (MEI.STAFF_GRP);
        if (group == null)
        {
            // Infer one staff per distinct staff number.
            group = new Element (MEI.STAFF_GRP);
            List<Integer> seen = new ArrayList<Integer> ();
            for (Element m : measures)
            {
                for (Element s : m.children (MEI.STAFF_EL))
                {
                    int n = s.get (MEI.N, 1);
                    if (seen.contains (n)) continue;
                    seen.add (n);
                    group.add (new Element (MEI.STAFF_DEF)).set (MEI.N, n);
                }
            }
        }
        return group (group, scoreDef, measures);
    }

    protected void indexControls (List<Element> measures)
    {
        starting.clear ();
        ending  .clear ();
        for (Element m : measures)
        {
            for (Element c : m.children)
            {
                if (c.is (MEI.STAFF_EL)) continue;
                index (starting, c.get (MEI.STARTID), c);
                index (ending,   c.get (MEI.ENDID),   c);
            }
        }
    }

    protected static void index (Map<String,List<Element>> map, String reference, Element e)
    {
        if (reference == null  ||  reference.isEmpty ()) return;
        if (reference.startsWith ("#")) reference = reference.substring (1);
        List<Element> list = map.get (reference);
        if (list == null)
        {
            list = new ArrayList<Element> ();
            map.put (reference, list);
        }
        list.add (e);
    }

    protected List<Element> controls (Map<String,List<Element>> map, String id)
    {
        List<Element> result = map.get (id);
        if (result == null) return Collections.emptyList ();
        return result;
    }

    public Music group (Element group, Element scoreDef, List<Element> measures) throws ConversionException
    {
        List<Music> entries = new ArrayList<Music> ();
        for (Element c : group.children)
        {
            if (c.is (MEI.STAFF_DEF))
            {
                staff (c, scoreDef, measures, entries);
            }
            else if (c.is (MEI.STAFF_GRP))
            {
                Music inner = group (c, scoreDef, measures);
                if (inner == null) continue;
                StaffContext context = store.get (Concepts.STAFF_CONTEXT, c.id ());
                entries.add (context == null ? inner : contexted (context, inner));
            }
        }
        if (entries.isEmpty ()) return null;

        Markers markers = store.get (Concepts.MARKERS, group.id ());
        if (entries.size () == 1  &&  (markers == null  ||  ! markers.has (Markers.SIMULTANEOUS))) return entries.get (0);
        Simultaneous result = new Simultaneous ();
        result.items.addAll (entries);
        return result;
    }

    public Music contexted (StaffContext context, Music music)
    {
        if (ContextedMusic.isShorthand (context.keyword)) return new ContextedMusic (context.keyword, null, music);

        ContextedMusic result = new ContextedMusic (context.keyword, context.contextType, music);
        if (! context.name.isEmpty ()) result.name = context.name;
        if (! context.with.isEmpty ())
        {
            try
            {
                List<Music> parsed = Parser.parseMusicList ("\\new " + context.contextType + " \\with " + context.with + " { }");
                result.with = ((ContextedMusic) parsed.get (0)).with;
            }
            catch (ParseException | ClassCastException | IndexOutOfBoundsException e)
            {
                logger.warn ("Context modifications for " + context.contextType + " no longer parse; dropped", e);
            }
        }
        return result;
    }

    // Staves ------------------------------------------------------------------

    public void staff (Element staffDef, Element scoreDef, List<Element> measures, List<Music> entries) throws ConversionException
    {
        int n = staffDef.get (MEI.N, 1);
        StaffContext context = store.get (Concepts.STAFF_CONTEXT, staffDef.id ());
        if (context != null  &&  ImportJob.harmonyTypes.contains (context.contextType))
        {
            entries.add (harmony (staffDef, context, scoreDef, measures));
            return;
        }

        // Gather layers across measures, keyed by layer number.
        Map<Integer,List<Element>> layers = new LinkedHashMap<Integer,List<Element>> ();
        List<Element> staves = new ArrayList<Element> ();
        for (Element m : measures)
        {
            for (Element s : m.children (MEI.STAFF_EL))
            {
                if (s.get (MEI.N, 1) != n) continue;
                staves.add (s);
                for (Element l : s.children (MEI.LAYER))
                {
                    int ln = l.get (MEI.N, 1);
                    List<Element> list = layers.get (ln);
                    if (list == null)
                    {
                        list = new ArrayList<Element> ();
                        layers.put (ln, list);
                    }
                    list.add (l);
                }
            }
        }

        List<Music> voices   = new ArrayList<Music> ();
        List<Music> siblings = new ArrayList<Music> ();
        List<Music> addLyrics = null;
        boolean single = layers.size () == 1;
        boolean first  = true;
        for (List<Element> l : layers.values ())
        {
            Voice v = new Voice (l);
            Music voice = voice (v, first ? prefix (staffDef, scoreDef) : null);
            first = false;
            LyricsInfo info = store.get (Concepts.LYRICS_INFO, l.get (0).id ());
            List<Music> lyrics = lyrics (v);
            if (! lyrics.isEmpty ())
            {
                String style = info == null ? LyricsInfo.ADDLYRICS : info.style;
                switch (style)
                {
                    case LyricsInfo.LYRICSTO:
                        for (Music verse : lyrics) siblings.add (new ContextedMusic ("new", "Lyrics", new LyricsTo (info.voiceID, verse)));
                        break;
                    case LyricsInfo.LYRICMODE:
                        for (Music verse : lyrics) siblings.add (new ContextedMusic ("new", "Lyrics", new ModeBlock ("lyricmode", verse)));
                        break;
                    default:
                        if (single)
                        {
                            addLyrics = lyrics;
                        }
                        else
                        {
                            AddLyrics a = new AddLyrics (voice);
                            a.lyrics.addAll (lyrics);
                            voice = a;
                        }
                }
            }
            voices.add (voice);
        }
        if (voices.isEmpty ()) voices.add (new Sequential ());

        Music music;
        if (voices.size () == 1)
        {
            music = voices.get (0);
        }
        else
        {
            Simultaneous s = new Simultaneous ();
            s.items.addAll (voices);
            Markers markers = staves.isEmpty () ? null : store.get (Concepts.MARKERS, staves.get (0).id ());
            s.separated = markers != null  &&  markers.has (Markers.SEPARATED);
            music = s;
        }
        if (context != null) music = contexted (context, music);
        if (addLyrics != null)
        {
            AddLyrics a = new AddLyrics (music);
            a.lyrics.addAll (addLyrics);
            music = a;
        }
        int at = entries.size ();
        entries.add (music);
        entries.addAll (siblings);
        if (attachedHarmony (staffDef, scoreDef, measures, entries)  &&  ! (music instanceof ContextedMusic))
        {
            // Bare music beside a ChordNames context would read back as a second voice.
            entries.set (at, new ContextedMusic ("new", "Staff", music));
        }
    }

    /**
        Chord symbols and figures that other encoders attach directly to a note staff come back
        as a ChordNames or FiguredBass context beside it, timed from their stamps.
        @return true if any context was added.
    **/
    protected boolean attachedHarmony (Element staffDef, Element scoreDef, List<Element> measures, List<Music> entries) throws ConversionException
    {
        int n = staffDef.get (MEI.N, 1);
        boolean harm = false;
        boolean fb   = false;
        for (Element m : measures)
        {
            for (Element c : m.children)
            {
                if (c.get (MEI.STAFF, 1) != n) continue;
                if (c.is (MEI.HARM)) harm = true;
                if (c.is (MEI.FB))   fb   = true;
            }
        }
        if (harm) entries.add (harmony (staffDef, new StaffContext ("ChordNames"),  scoreDef, measures));
        if (fb)   entries.add (harmony (staffDef, new StaffContext ("FiguredBass"), scoreDef, measures));
        return harm  ||  fb;
    }

    /**
        A document without LilyPond records keeps its initial clef, key and meter in the definitions.
        @return Items to place at the start of the first voice.
    **/
    protected List<Music> prefix (Element staffDef, Element scoreDef)
    {
        List<Music> result = new ArrayList<Music> ();
        if (! foreign) return result;
        if (staffDef.has (MEI.CLEF_SHAPE))
        {
            Element c = new Element (MEI.CLEF);
            c.set (MEI.SHAPE, staffDef.get (MEI.CLEF_SHAPE));
            if (staffDef.has (MEI.CLEF_LINE)) c.set (MEI.LINE, staffDef.get (MEI.CLEF_LINE));
            String name = Symbols.raiseClef (c);
            if (name != null) result.add (new Clef (name));
        }
        String sig = staffDef.get (MEI.KEY_SIG);
        if (sig.isEmpty ()  &&  scoreDef != null) sig = scoreDef.get (MEI.KEY_SIG);
        if (! sig.isEmpty ()) result.add (keyFromSignature (sig));
        if (scoreDef != null  &&  scoreDef.has (MEI.METER_COUNT))
        {
            result.add (timeSignature (scoreDef.get (MEI.METER_COUNT), scoreDef.get (MEI.METER_UNIT, 4)));
        }
        return result;
    }

    public static KeySignature keyFromSignature (String sig)
    {
        String[] sharps = {"c", "g", "d", "a", "e", "b", "fis", "cis"};
        String[] flats  = {"c", "f", "bes", "ees", "aes", "des", "ges", "ces"};
        int count = 0;
        try
        {
            if (sig.length () > 1) count = Integer.parseInt (sig.substring (0, sig.length () - 1));
        }
        catch (NumberFormatException e)
        {
            logger.warn ("Key signature \"" + sig + "\" not understood; using C major", e);
        }
        count = Math.max (0, Math.min (count, 7));
        String tonic = sig.endsWith ("f") ? flats[count] : sharps[count];
        return new KeySignature (Pitch.fromName (tonic), "major");
    }

    public static TimeSignature timeSignature (String count, int unit)
    {
        List<Integer> numerators = new ArrayList<Integer> ();
        for (String part : count.split ("\\+")) numerators.add (Integer.parseInt (part.trim ()));
        return new TimeSignature (numerators, unit);
    }

    // Voices ------------------------------------------------------------------

    /**
        Working state for one voice, which may span several measures.
    **/
    protected class Voice
    {
        public List<Element>        layers;
        public List<Element>        slots     = new ArrayList<Element> ();
        public Map<String,Integer>  index     = new HashMap<String,Integer> ();
        public List<Span>           spans     = new ArrayList<Span> ();
        public List<List<Music>>    items     = new ArrayList<List<Music>> ();
        public List<Element>        eligible  = new ArrayList<Element> ();
        public Duration             last      = new Duration (4);

        public Voice (List<Element> layers)
        {
            this.layers = layers;
        }
    }

    protected static class Span
    {
        public Element annot;
        public int     start;
        public int     end;
        public int     order;  // Document order, so enclosing spans with equal range come first

        public Span (Element annot, int start, int end, int order)
        {
            this.annot = annot;
            this.start = start;
            this.end   = end;
            this.order = order;
        }

        public boolean isTuplet ()
        {
            return annot.is (MEI.TUPLET_SPAN)  ||  annot.is ("tuplet");
        }

        public String type ()
        {
            return Labels.helper (annot.get (MEI.TYPE), Labels.SPAN);
        }
    }

    public Music voice (Voice v, List<Music> prefix) throws ConversionException
    {
        collectSlots (v);
        collectSpans (v);

        // Tuplet scaling and grace coverage per slot
        int count = v.slots.size ();
        Rational[] factors = new Rational[count];
        boolean[]  graced  = new boolean[count];
        for (int i = 0; i < count; i++) factors[i] = Rational.ONE;
        for (Span s : v.spans)
        {
            if (s.isTuplet ())
            {
                int num     = s.annot.get (MEI.NUM,     1);
                int numbase = s.annot.get (MEI.NUMBASE, 1);
                if (num <= 0  ||  numbase <= 0) continue;
                Rational f = new Rational (numbase, num);
                for (int i = s.start; i <= s.end; i++) factors[i] = factors[i].multiply (f);
            }
            else if (Labels.GRACE.equals (s.type ()))
            {
                for (int i = s.start; i <= s.end; i++) graced[i] = true;
            }
        }

        for (int i = 0; i < count; i++) v.items.add (slotMusic (v, v.slots.get (i), factors[i], graced[i]));

        List<Music> content = build (v, 0, count - 1, new ArrayList<Span> (v.spans));
        pitches (content, new PitchState ());
        if (prefix != null) content.addAll (0, prefix);

        Element first = v.layers.get (0);
        boolean hasLyrics = ! v.eligible.isEmpty ()  &&  hasVerses (v);
        if (hasLyrics  &&  melisma)
        {
            try
            {
                content.add (0, Parser.parseMusicList (MELISMA).get (0));
            }
            catch (ParseException e)
            {
                throw new ConversionException ("Melisma directive failed to parse", e);
            }
        }

        Markers markers = store.get (Concepts.MARKERS, first.id ());
        Music result;
        if (markers != null  &&  markers.has (Markers.BARE)  &&  content.size () == 1) result = content.get (0);
        else                                                                             result = new Sequential (content);

        StaffContext context = store.get (Concepts.STAFF_CONTEXT, first.id ());
        if (context != null) result = contexted (context, result);
        return result;
    }

    /**
        Lists the items of the voice in order: layer elements, with placeholders spliced in
        before the element they are anchored to, and bar checks between measures.
    **/
    protected void collectSlots (Voice v)
    {
        for (int m = 0; m < v.layers.size (); m++)
        {
            Element layer = v.layers.get (m);
            if (m > 0) v.slots.add (new Element ("barCheck"));

            List<Element> content = new ArrayList<Element> ();
            List<Span>    containers = new ArrayList<Span> ();
            flatten (layer, content, containers, v.slots.size ());

            Map<String,List<Element>> anchored = new HashMap<String,List<Element>> ();
            List<Element> trailing = new ArrayList<Element> ();
            Element measure = layer.ancestor (MEI.MEASURE);
            if (measure != null)
            {
                Map<String,Boolean> ids = new HashMap<String,Boolean> ();
                for (Element e : content) ids.put (e.id (), true);
                for (Element c : measure.children)
                {
                    if (! isPlaceholder (c)) continue;
                    String anchor = c.get (MEI.STARTID, "");
                    if (anchor.startsWith ("#")) anchor = anchor.substring (1);
                    if (anchor.equals (layer.id ()))
                    {
                        trailing.add (c);
                    }
                    else if (ids.containsKey (anchor))
                    {
                        List<Element> list = anchored.get (anchor);
                        if (list == null)
                        {
                            list = new ArrayList<Element> ();
                            anchored.put (anchor, list);
                        }
                        list.add (c);
                    }
                }
            }

            // One pass in reverse, so insertions never disturb the positions still to visit.
            List<Element> spliced = new ArrayList<Element> (content);
            spliced.addAll (trailing);
            for (int i = content.size () - 1; i >= 0; i--)
            {
                List<Element> before = anchored.get (content.get (i).id ());
                if (before != null) spliced.addAll (i, before);
            }

            // Container spans were recorded against unspliced positions, so remap them by element.
            int base = v.slots.size ();
            v.slots.addAll (spliced);
            for (int i = base; i < v.slots.size (); i++)
            {
                String id = v.slots.get (i).id ();
                if (id != null  &&  ! id.isEmpty ()) v.index.put (id, i);
            }
            for (Span s : containers)
            {
                Integer start = v.index.get (content.get (s.start - base).id ());
                Integer end   = v.index.get (content.get (s.end   - base).id ());
                if (start == null  ||  end == null) continue;
                s.start = start;
                s.end   = end;
                v.spans.add (s);
            }
        }
    }

    protected boolean isPlaceholder (Element e)
    {
        if (Labels.placeholder (e.label ()) != null) return true;
        return (e.is (MEI.TEMPO)  ||  e.is (MEI.REH))  &&  e.has (MEI.STARTID);
    }

    protected static final Set<String> leaves = new HashSet<String> (Arrays.asList
    (
        MEI.NOTE, MEI.REST, MEI.MREST, MEI.SPACE, MEI.CHORD, MEI.CLEF, MEI.KEY_SIG_EL, MEI.METER_SIG, MEI.BAR_LINE
    ));

    /**
        Collects leaf events, descending into containers such as beams and tuplets.
        A foreign tuplet container becomes a span.
    **/
    protected void flatten (Element parent, List<Element> content, List<Span> containers, int base)
    {
        for (Element c : parent.children)
        {
            if (leaves.contains (c.name)  ||  c.children.isEmpty ())
            {
                content.add (c);
                continue;
            }
            int start = content.size ();
            flatten (c, content, containers, base);
            if (c.is ("tuplet")  &&  content.size () > start)
            {
                containers.add (new Span (c, base + start, base + content.size () - 1, -1));
            }
        }
    }

    protected void collectSpans (Voice v)
    {
        int order = 0;
        for (Element layer : v.layers)
        {
            Element measure = layer.ancestor (MEI.MEASURE);
            if (measure == null) continue;
            for (Element c : measure.children)
            {
                order++;
                boolean isSpan = c.is (MEI.TUPLET_SPAN)  ||  (c.is (MEI.ANNOT)  &&  Labels.helper (c.get (MEI.TYPE), Labels.SPAN) != null);
                if (! isSpan) continue;
                Integer start = v.index.get (strip (c.get (MEI.STARTID)));
                Integer end   = v.index.get (strip (c.get (MEI.ENDID)));
                if (start == null  ||  end == null) continue;
                if (end < start)
                {
                    logger.warn ("Span " + c.id () + " ends before it starts; ignored");
                    continue;
                }
                v.spans.add (new Span (c, start, end, order));
            }
        }
        Collections.sort (v.spans, new Comparator<Span> ()
        {
            public int compare (Span a, Span b)
            {
                if (a.start != b.start) return a.start - b.start;
                if (a.end   != b.end)   return b.end - a.end;
                return a.order - b.order;
            }
        });
    }

    protected static String strip (String reference)
    {
        if (reference == null) return "";
        if (reference.startsWith ("#")) return reference.substring (1);
        return reference;
    }

    /**
        Assembles slots from..to into music, wrapping spans that start within the range.
        @param available Spans not yet consumed, in sorted order.
    **/
    protected List<Music> build (Voice v, int from, int to, List<Span> available) throws ConversionException
    {
        List<Music> result = new ArrayList<Music> ();
        int i = from;
        while (i <= to)
        {
            Span span = null;
            for (Span s : available)
            {
                if (s.start != i) continue;
                if (s.end > to)
                {
                    logger.warn ("Span " + s.annot.id () + " overlaps its enclosing span; ignored");
                    continue;
                }
                span = s;
                break;
            }
            if (span == null)
            {
                result.addAll (v.items.get (i));
                i++;
                continue;
            }

            available.remove (span);
            List<Span> inner = new ArrayList<Span> ();
            for (Span s : available) if (s.start >= span.start  &&  s.end <= span.end) inner.add (s);
            available.removeAll (inner);
            Music wrapped = wrap (span, build (v, span.start, span.end, inner));
            if (wrapped != null) result.add (wrapped);
            i = span.end + 1;
        }
        // Spans whose range was not reached, such as those starting inside an ignored overlap
        for (Span s : available) if (s.start >= from  &&  s.end <= to) logger.debug ("Unused span " + s.annot.id ());
        return result;
    }

    protected static Music single (List<Music> content)
    {
        if (content.size () == 1) return content.get (0);
        return new Sequential (content);
    }

    protected Music wrap (Span s, List<Music> content) throws ConversionException
    {
        String id = s.annot.id ();
        if (s.isTuplet ())
        {
            Tuplet result = new Tuplet (s.annot.get (MEI.NUM, 1), s.annot.get (MEI.NUMBASE, 1), single (content));
            TupletInfo info = store.get (Concepts.TUPLET_INFO, id);
            if (info != null  &&  ! info.span.isEmpty ()) result.span = duration (info.span);
            return result;
        }

        String type = s.type ();
        switch (type)
        {
            case Labels.BLOCK:
                return new Sequential (content);
            case Labels.PITCH:
            {
                PitchContext c = store.get (Concepts.PITCH_CONTEXT, id);
                if (c == null) return new Sequential (content);
                switch (c.kind)
                {
                    case PitchContext.RELATIVE:
                        return new Relative (c.reference.isEmpty () ? null : pitch (c.reference), single (content));
                    case PitchContext.FIXED:
                        return new Fixed (pitch (c.reference), single (content));
                    default:
                        return new Transpose (pitch (c.from), pitch (c.to), single (content));
                }
            }
            case Labels.REPEAT:
            {
                RepeatInfo info = store.get (Concepts.REPEAT_INFO, id);
                if (info == null) return new Sequential (content);
                int bodyCount = content.size () - info.alternatives;
                if (info.alternatives == 0  ||  bodyCount < 1) return new Repeat (info.type, info.count, single (content));
                Repeat result = new Repeat (info.type, info.count, single (content.subList (0, bodyCount)));
                result.alternatives.addAll (content.subList (bodyCount, content.size ()));
                return result;
            }
            case Labels.ENDING:
                return single (content);
            case Labels.GRACE:
            {
                GraceInfo info = store.get (Concepts.GRACE_INFO, id);
                String kind = info == null ? "grace" : info.kind;
                if (kind.equals ("afterGrace")  &&  content.size () > 1)
                {
                    Grace result = new Grace (kind, single (content.subList (1, content.size ())));
                    result.main = content.get (0);
                    if (! info.fraction.isEmpty ()) result.fraction = Rational.parse (info.fraction);
                    return result;
                }
                return new Grace (kind, single (content));
            }
            case Labels.CONTEXT:
            {
                StaffContext c = store.get (Concepts.STAFF_CONTEXT, id);
                if (c == null) return single (content);
                return contexted (c, single (content));
            }
            case Labels.MODE:
                return new ModeBlock (s.annot.getText (), single (content));
            case Labels.VARIABLE:
            {
                Expansion result = new Expansion (s.annot.getText ());
                result.content = content;
                return result;
            }
        }
        logger.warn ("Unknown span type " + type + "; contents kept in place");
        return single (content);
    }

    protected Pitch pitch (String text) throws ConversionException
    {
        try
        {
            return Parser.parsePitch (text);
        }
        catch (ParseException e)
        {
            throw new ConversionException ("Recorded pitch \"" + text + "\" does not parse", e);
        }
    }

    protected Duration duration (String text) throws ConversionException
    {
        try
        {
            return Parser.parseDuration (text);
        }
        catch (ParseException e)
        {
            throw new ConversionException ("Recorded duration \"" + text + "\" does not parse", e);
        }
    }

    /**
        A variable reference that still holds the music it stood for, so pitch resolution can pass through it.
        Renders as the plain reference.
    **/
    protected static class Expansion extends Identifier
    {
        public List<Music> content;

        public Expansion (String name)
        {
            super (name);
        }
    }

    // Pitches -----------------------------------------------------------------

    protected void pitches (List<Music> items, PitchState state)
    {
        for (Music m : items) pitches (m, state);
    }

    /**
        Rewrites sounding pitches in place as they should be written under the enclosing pitch contexts.
    **/
    protected void pitches (Music m, PitchState state)
    {
        if (verbatim.contains (m)) return;
        if (m instanceof Relative)
        {
            Relative r = (Relative) m;
            PitchState inner = state.copy ();
            inner.mode      = PitchState.Mode.RELATIVE;
            inner.reference = r.reference == null ? Pitch.DEFAULT_RELATIVE : r.reference;
            pitches (r.music, inner);
        }
        else if (m instanceof Fixed)
        {
            Fixed f = (Fixed) m;
            PitchState inner = state.copy ();
            inner.mode      = PitchState.Mode.FIXED;
            inner.reference = f.reference;
            pitches (f.music, inner);
        }
        else if (m instanceof Transpose)
        {
            Transpose t = (Transpose) m;
            PitchState inner = state.copy ();
            inner.mode = PitchState.Mode.ABSOLUTE;
            inner.transpositions.add (new Pitch[] {t.from, t.to});
            pitches (t.music, inner);
        }
        else if (m instanceof Expansion)
        {
            pitches (((Expansion) m).content, state);
        }
        else if (m instanceof Note)
        {
            Note n = (Note) m;
            n.pitch = state.write (state.unsound (n.pitch));
        }
        else if (m instanceof Rest)
        {
            Rest r = (Rest) m;
            if (r.pitch != null) r.pitch = state.write (state.unsound (r.pitch));
        }
        else if (m instanceof Chord)
        {
            Chord c = (Chord) m;
            List<Pitch> located = new ArrayList<Pitch> ();
            for (Note n : c.notes) located.add (state.unsound (n.pitch));
            state.writeChord (c.notes, located);
        }
        else
        {
            for (Music c : m.children ()) pitches (c, state);
        }
    }

    // Slots -------------------------------------------------------------------

    protected List<Music> slotMusic (Voice v, Element e, Rational factor, boolean graced) throws ConversionException
    {
        List<Music> result = new ArrayList<Music> ();
        if (e.is ("barCheck"))
        {
            result.add (new BarCheck ());
            return result;
        }
        if (isPlaceholder (e))
        {
            String text = placeholderText (e);
            if (text == null) return result;
            try
            {
                List<Music> parsed = Parser.parseMusicList (text);
                verbatim.addAll (parsed);
                result.addAll (parsed);
            }
            catch (ParseException x)
            {
                logger.warn ("Placeholder " + e.id () + " does not parse; left out", x);
            }
            return result;
        }

        Music m = element (v, e, factor);
        if (m == null) return result;
        if (e.has (MEI.GRACE)  &&  ! graced)
        {
            m = new Grace (e.get (MEI.GRACE).equals ("acc") ? "acciaccatura" : "grace", m);
        }
        result.add (m);
        return result;
    }

    protected String placeholderText (Element e)
    {
        String label = e.label ();
        if (Labels.placeholder (label) != null)
        {
            try
            {
                return Labels.decode (label);
            }
            catch (IOException x)
            {
                logger.warn ("Malformed placeholder label on " + e.id () + "; left alone", x);
                return null;
            }
        }

        // Tempo or rehearsal mark from another source
        if (e.is (MEI.REH)) return "\\mark \\default";
        StringBuilder result = new StringBuilder ("\\tempo");
        String text = e.getText ();
        if (text != null  &&  ! text.trim ().isEmpty ()) result.append (' ').append (Renderer.quote (text.trim ()));
        if (e.has (MEI.MM))
        {
            Duration unit = new Duration (e.get (MEI.MM_UNIT, 4), e.get (MEI.MM_DOTS, 0));
            result.append (' ').append (unit).append (" = ").append ((int) Math.round (e.get (MEI.MM, 60.0)));
        }
        if (result.length () == "\\tempo".length ()) return null;
        return result.toString ();
    }

    protected Duration eventDuration (Voice v, Element e, Rational factor)
    {
        Duration result = durations.unlower (e, factor);
        if (result == null) result = v.last;
        v.last = result;
        return result;
    }

    public Music element (Voice v, Element e, Rational factor) throws ConversionException
    {
        String id = e.id ();
        switch (e.name)
        {
            case MEI.NOTE:
            {
                Event result;
                String drum = store.get (Concepts.DRUM_EVENT, id);
                if (drum != null) result = new DrumNote (drum);
                else              result = new Note (notePitch (e));
                result.duration = eventDuration (v, e, factor);
                event (v, e, result);
                return result;
            }
            case MEI.CHORD:
            {
                Markers markers = store.get (Concepts.MARKERS, id);
                Event result;
                if (markers != null  &&  markers.has (Markers.CHORD_REPETITION))
                {
                    result = new ChordRepetition (null);
                }
                else if (! e.children (MEI.NOTE).isEmpty ()  &&  store.get (Concepts.DRUM_EVENT, e.children (MEI.NOTE).get (0).id ()) != null)
                {
                    DrumChord c = new DrumChord ();
                    for (Element n : e.children (MEI.NOTE))
                    {
                        String drum = store.get (Concepts.DRUM_EVENT, n.id ());
                        DrumNote d = new DrumNote (drum == null ? "sn" : drum);
                        tweaks (n, d);
                        c.notes.add (d);
                    }
                    result = c;
                }
                else
                {
                    Chord c = new Chord ();
                    for (Element n : e.children (MEI.NOTE))
                    {
                        Note note = new Note (notePitch (n));
                        tweaks (n, note);
                        c.notes.add (note);
                    }
                    result = c;
                }
                result.duration = eventDuration (v, e, factor);
                event (v, e, result);
                return result;
            }
            case MEI.REST:
            {
                Rest result = new Rest (eventDuration (v, e, factor));
                String p = store.get (Concepts.PITCHED_REST, id);
                if (p != null) result.pitch = pitch (p);
                event (v, e, result);
                return result;
            }
            case MEI.MREST:
            {
                String text = store.get (Concepts.MREST_INFO, id);
                Duration d;
                if (text != null) d = duration (text);
                else              d = durations.unlower (e, factor);
                if (d == null) d = new Duration (1);
                MultiMeasureRest result = new MultiMeasureRest (d);
                event (v, e, result);
                return result;
            }
            case MEI.SPACE:
            {
                Skip result = new Skip (eventDuration (v, e, factor));
                event (v, e, result);
                return result;
            }
            case MEI.CLEF:
            {
                String name = Labels.helper (e.label (), Labels.CLEF);
                if (name == null) name = Symbols.raiseClef (e);
                if (name == null)
                {
                    logger.warn ("Clef " + id + " has no LilyPond equivalent; using treble");
                    name = "treble";
                }
                return new Clef (name);
            }
            case MEI.KEY_SIG_EL:
            {
                if (! e.has (MEI.PNAME)) return keyFromSignature (e.get (MEI.SIG, "0"));
                Pitch tonic = new Pitch (e.get (MEI.PNAME).charAt (0), Symbols.alteration (e.get (MEI.ACCID)), 0);
                String mode = e.get (MEI.MODE, "major");
                if (! KeySignature.isMode (mode)) mode = "major";
                return new KeySignature (tonic, mode);
            }
            case MEI.METER_SIG:
                return timeSignature (e.get (MEI.COUNT, "4"), e.get (MEI.UNIT, 4));
            case MEI.BAR_LINE:
            {
                String style = Labels.helper (e.label (), Labels.BAR);
                if (style == null) style = Symbols.barStyle (e.get (MEI.FORM, "single"));
                if (style == null) style = "|";
                return new BarLine (style);
            }
        }
        logger.warn ("Element " + e.name + (id.isEmpty () ? "" : " " + id) + " has no LilyPond equivalent");
        return new Unparsed ("%{ " + e.name + " %}");
    }

    public static Pitch notePitch (Element e)
    {
        String pname = e.get (MEI.PNAME, "c");
        String accid = e.get (MEI.ACCID_GES, e.get (MEI.ACCID));
        Pitch result = new Pitch (pname.charAt (0), Symbols.alteration (accid), e.get (MEI.OCT, 4) - 3);
        if (e.has (MEI.ACCID))
        {
            if (e.get (MEI.FUNC, "").equals ("caution")) result.cautionary = true;
            else                                         result.force      = true;
        }
        return result;
    }

    // Event decorations -------------------------------------------------------

    protected void event (Voice v, Element e, Event result) throws ConversionException
    {
        tweaks (e, result);
        postEvents (e, result);
        if (isEligible (e)) v.eligible.add (e);
    }

    protected static boolean isEligible (Element e)
    {
        if (! e.is (MEI.NOTE)  &&  ! e.is (MEI.CHORD)) return false;
        if (e.has (MEI.GRACE)) return false;
        String tie = e.get (MEI.TIE, "");
        return ! tie.equals ("m")  &&  ! tie.equals ("t");
    }

    protected void tweaks (Element e, Event result)
    {
        String id = e.id ();
        Markers markers = store.get (Concepts.MARKERS, id);
        if (! foreign  &&  markers != null  &&  markers.has (Markers.CUSTOM_ID))
        {
            result.tweaks.add (new Tweak (new PropertyPath ("id"), PropertyValue.string (id)));
        }
        TextList others = store.get (Concepts.TWEAKS, id);
        if (others == null) return;
        for (String t : others.items)
        {
            try
            {
                Event parsed = (Event) Parser.parseMusicList (t + " c").get (0);
                result.tweaks.addAll (parsed.tweaks);
            }
            catch (ParseException | ClassCastException | IndexOutOfBoundsException x)
            {
                logger.warn ("Tweak on " + id + " does not parse; dropped: " + t, x);
            }
        }
    }

    protected void postEvents (Element e, Event result)
    {
        String id = e.id ();
        List<PostEvent> list = result.postEvents;

        String tie = e.get (MEI.TIE, "");
        if (tie.equals ("i")  ||  tie.equals ("m")) list.add (new PostEvent (PostEvent.Kind.TIE));

        boolean startsDynamic = false;
        for (Element c : controls (starting, id)) if (c.is (MEI.DYNAM)  ||  c.is (MEI.HAIRPIN)) startsDynamic = true;

        for (Element c : controls (ending, id))
        {
            if (c.is (MEI.SLUR))
            {
                list.add (new PostEvent (isPhrasing (c) ? PostEvent.Kind.PHRASING_SLUR_END : PostEvent.Kind.SLUR_END));
            }
            else if (c.is (MEI.BEAM_SPAN))
            {
                list.add (new PostEvent (PostEvent.Kind.BEAM_END));
            }
            else if (c.is (MEI.HAIRPIN)  &&  ! startsDynamic)
            {
                list.add (new PostEvent (PostEvent.Kind.HAIRPIN_END));
            }
        }

        for (Element c : controls (starting, id))
        {
            PostEvent p = control (c);
            if (p == null) continue;
            if (Labels.helper (c.label (), Labels.POST) == null) p.direction = direction (c);  // Recorded source text carries its own direction.
            list.add (p);
        }

        for (Element a : e.children (MEI.ARTIC_EL))
        {
            PostEvent p = null;
            String abbr   = Labels.helper (a.label (), Labels.ABBR);
            String script = Labels.helper (a.label (), Labels.SCRIPT);
            if      (abbr   != null) p = new PostEvent (PostEvent.Kind.ABBREVIATION, abbr);
            else if (script != null) p = new PostEvent (PostEvent.Kind.SCRIPT, script);
            else
            {
                String name = scriptFor (a.get (MEI.ARTIC, ""));
                if (name != null) p = new PostEvent (PostEvent.Kind.SCRIPT, name);
            }
            if (p == null)
            {
                logger.warn ("Articulation " + a.get (MEI.ARTIC) + " has no LilyPond equivalent");
                continue;
            }
            p.direction = direction (a);
            list.add (p);
        }
    }

    protected boolean isPhrasing (Element slur)
    {
        Markers markers = store.get (Concepts.MARKERS, slur.id ());
        return markers != null  &&  markers.has (Markers.PHRASING_SLUR);
    }

    protected static char direction (Element e)
    {
        String place = e.get (MEI.PLACE, e.get ("curvedir", ""));
        if (place.equals ("above")) return '^';
        if (place.equals ("below")) return '_';
        return 0;
    }

    public static String scriptFor (String artic)
    {
        for (Map.Entry<String,String> s : Scripts.articulations.entrySet ())
        {
            if (s.getValue ().equals (artic)) return s.getKey ();
        }
        return null;
    }

    /**
        Converts a control event that starts at an event into a post-event.
        @return The post-event, or null if the control has no post-event form.
    **/
    protected PostEvent control (Element c)
    {
        String label = c.label ();
        String script = Labels.helper (label, Labels.SCRIPT);
        String post   = Labels.helper (label, Labels.POST);
        if (post != null)
        {
            try
            {
                List<Music> parsed = Parser.parseMusicList ("c" + post);
                Event event = (Event) parsed.get (0);
                if (event.postEvents.size () == 1) return event.postEvents.get (0);
                logger.warn ("Post-event label on " + c.id () + " holds " + event.postEvents.size () + " post-events");
            }
            catch (ParseException | ClassCastException | IndexOutOfBoundsException x)
            {
                logger.warn ("Post-event label on " + c.id () + " does not parse; left alone", x);
            }
            return null;
        }
        if (script != null) return new PostEvent (PostEvent.Kind.SCRIPT, script);

        switch (c.name)
        {
            case MEI.SLUR:
                return new PostEvent (isPhrasing (c) ? PostEvent.Kind.PHRASING_SLUR_START : PostEvent.Kind.SLUR_START);
            case MEI.BEAM_SPAN:
                return new PostEvent (PostEvent.Kind.BEAM_START);
            case MEI.HAIRPIN:
                return new PostEvent (c.get (MEI.FORM, "cres").equals ("dim") ? PostEvent.Kind.DECRESCENDO : PostEvent.Kind.CRESCENDO);
            case MEI.DYNAM:
            {
                String text = c.getText () == null ? "" : c.getText ().trim ();
                if (text.isEmpty ()) return null;
                if (Scripts.isDynamic (text)  ||  ! foreign) return new PostEvent (PostEvent.Kind.DYNAMIC, text);
                return new PostEvent (PostEvent.Kind.TEXT, text);
            }
            case MEI.FERMATA:
                return new PostEvent (PostEvent.Kind.SCRIPT, "fermata");
            case MEI.TRILL:
                return new PostEvent (PostEvent.Kind.SCRIPT, "trill");
            case MEI.ORNAM:
                return new PostEvent (PostEvent.Kind.SCRIPT, "turn");
            case MEI.FING:
                return new PostEvent (PostEvent.Kind.FINGERING, c.getText () == null ? "" : c.getText ().trim ());
            case MEI.DIR:
            {
                if (Labels.placeholder (label) != null) return null;
                String text = c.getText ();
                if (text == null  ||  text.trim ().isEmpty ()) return null;
                return new PostEvent (PostEvent.Kind.TEXT, text.trim ());
            }
        }
        return null;
    }

    // Lyrics ------------------------------------------------------------------

    protected boolean hasVerses (Voice v)
    {
        for (Element e : v.eligible) if (! e.descendants (MEI.SYL).isEmpty ()) return true;
        return false;
    }

    /**
        Builds one lyric block per verse number, with a syllable or skip for each eligible note.
    **/
    public List<Music> lyrics (Voice v)
    {
        List<Integer> numbers = new ArrayList<Integer> ();
        for (Element e : v.eligible)
        {
            for (Element verse : e.children (MEI.VERSE))
            {
                int n = verse.get (MEI.N, 1);
                if (! numbers.contains (n)) numbers.add (n);
            }
        }
        Collections.sort (numbers);

        List<Music> result = new ArrayList<Music> ();
        for (int n : numbers)
        {
            List<Music> syllables = new ArrayList<Music> ();
            for (Element e : v.eligible)
            {
                Element syl = null;
                for (Element verse : e.children (MEI.VERSE))
                {
                    if (verse.get (MEI.N, 1) == n) syl = verse.child (MEI.SYL);
                }
                if (syl == null  ||  syl.getText ().isEmpty ())
                {
                    syllables.add (new Lyric ("_"));
                    continue;
                }
                String text = syl.getText ();
                Lyric lyric = new Lyric (text);
                lyric.quoted = ! Lyric.isWord (text)  ||  text.equals ("_");
                String con     = syl.get (MEI.CON,     "");
                String wordpos = syl.get (MEI.WORDPOS, "");
                if      (con.equals ("d")  ||  (con.isEmpty ()  &&  (wordpos.equals ("i")  ||  wordpos.equals ("m")))) lyric.postEvents.add (new PostEvent (PostEvent.Kind.LYRIC_HYPHEN));
                else if (con.equals ("u")) lyric.postEvents.add (new PostEvent (PostEvent.Kind.LYRIC_EXTENDER));
                syllables.add (lyric);
            }
            while (! syllables.isEmpty ()  &&  ((Lyric) syllables.get (syllables.size () - 1)).isSkip ()) syllables.remove (syllables.size () - 1);
            result.add (new Sequential (syllables));
        }
        return result;
    }

    // Harmony -----------------------------------------------------------------

    /**
        Rebuilds a chord-name or figured-bass context. Recorded source text is re-parsed verbatim.
        Harmonies without it are converted from their symbols, with durations taken from gaps
        between time stamps.
    **/
    public Music harmony (Element staffDef, StaffContext context, Element scoreDef, List<Element> measures) throws ConversionException
    {
        boolean figures = context.contextType.equals ("FiguredBass");
        int n = staffDef.get (MEI.N, 1);
        int meterCount = 4;
        int meterUnit  = 4;
        if (scoreDef != null)
        {
            meterUnit = scoreDef.get (MEI.METER_UNIT, 4);
            try
            {
                meterCount = 0;
                for (String part : scoreDef.get (MEI.METER_COUNT, "4").split ("\\+")) meterCount += Integer.parseInt (part.trim ());
            }
            catch (NumberFormatException e)
            {
                logger.warn ("Unreadable meter count; assuming 4", e);
                meterCount = 4;
            }
        }

        List<Element> harms = new ArrayList<Element> ();
        List<Double>  starts = new ArrayList<Double> ();
        double measureStart = 0;
        for (Element m : measures)
        {
            for (Element c : m.children)
            {
                if (! c.is (figures ? MEI.FB : MEI.HARM)) continue;
                if (c.get (MEI.STAFF, 1) != n) continue;
                harms.add (c);
                starts.add (measureStart + c.get (MEI.TSTAMP, 1.0) - 1);
            }
            measureStart += meterCount;
        }

        List<String> texts = new ArrayList<String> ();
        for (int i = 0; i < harms.size (); i++)
        {
            Element h = harms.get (i);
            String text = store.get (figures ? Concepts.FIGURE_INFO : Concepts.CHORD_MODE_INFO, h.id ());
            if (text == null)
            {
                Duration d = durations.unlower (h, Rational.ONE);
                if (d == null)
                {
                    double end = i + 1 < starts.size () ? starts.get (i + 1) : Math.ceil ((starts.get (i) + 0.001) / meterCount) * meterCount;
                    d = durations.unlower (Math.max (end - starts.get (i), 0.25) / meterUnit);
                }
                if (figures) text = figureText (h) + d;
                else         text = withDuration (chordText (h), d);
            }
            texts.add (text);
        }

        EventSequence extras = store.get (Concepts.EVENT_SEQUENCE, staffDef.id ());
        if (extras != null)
        {
            for (ControlEvent e : extras.events)
            {
                int at = Math.min (e.position, texts.size ());
                texts.add (at, e.text);
            }
        }

        StringBuilder source = new StringBuilder (figures ? "\\figuremode {" : "\\chordmode {");
        for (String t : texts) source.append (' ').append (t);
        source.append (" }");

        Music music;
        try
        {
            music = Parser.parseMusicList (source.toString ()).get (0);
        }
        catch (ParseException e)
        {
            logger.warn ("Harmony text does not parse; kept as source", e);
            music = new Unparsed (source.toString ());
        }
        if (ContextedMusic.isShorthand (context.keyword)  &&  music instanceof ModeBlock) music = ((ModeBlock) music).music;
        return contexted (context, music);
    }

    protected static String chordText (Element harm)
    {
        String symbol = harm.getText () == null ? "" : harm.getText ().trim ();
        if (symbol.equals ("N.C.")  ||  symbol.isEmpty ()) return "r";
        String result = Symbols.chordModeText (symbol);
        if (result == null)
        {
            logger.warn ("Chord symbol \"" + symbol + "\" not understood; written as a skip");
            return "s";
        }
        return result;
    }

    /**
        Places the duration right after the root, where chord mode expects it, so g:7 becomes g4:7.
    **/
    protected static String withDuration (String chord, Duration d)
    {
        int at = chord.indexOf (':');
        if (at < 0) at = chord.indexOf ('/');
        if (at < 0) at = chord.length ();
        return chord.substring (0, at) + d + chord.substring (at);
    }

    protected static String figureText (Element fb)
    {
        StringBuilder result = new StringBuilder ("<");
        boolean first = true;
        for (Element f : fb.children (MEI.F))
        {
            String text = f.getText ();
            if (text == null  ||  text.trim ().isEmpty ()) continue;
            if (! first) result.append (' ');
            result.append (text.trim ());
            first = false;
        }
        return result.append ('>').toString ();
    }
}
