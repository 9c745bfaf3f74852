/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import gov.sandia.tusk.db.MNode;
import gov.sandia.tusk.db.MVolatile;

/**
    Registry of every concept the store knows. Names are part of the serialized form,
    so never rename one.
**/
public class Concepts
{
    protected static Map<String,Concept<?>> byName = new LinkedHashMap<String,Concept<?>> ();

    public static final Concept<FormatOrigin>  FORMAT_ORIGIN   = add (new RecordConcept<FormatOrigin>  ("formatOrigin",  FormatOrigin .class, FormatOrigin ::read));
    public static final Concept<PitchContext>  PITCH_CONTEXT   = add (new RecordConcept<PitchContext>  ("pitchContext",  PitchContext .class, PitchContext ::read));
    public static final Concept<OutputDefs>    OUTPUT_DEFS     = add (new RecordConcept<OutputDefs>    ("outputDefs",    OutputDefs   .class, OutputDefs   ::read));
    public static final Concept<BookStructure> BOOK_STRUCTURE  = add (new RecordConcept<BookStructure> ("bookStructure", BookStructure.class, BookStructure::read));
    public static final Concept<GraceInfo>     GRACE_INFO      = add (new RecordConcept<GraceInfo>     ("graceInfo",     GraceInfo    .class, GraceInfo    ::read));
    public static final Concept<PropertyOps>   PROPERTY_OPS    = add (new RecordConcept<PropertyOps>   ("propertyOps",   PropertyOps  .class, PropertyOps  ::read));
    public static final Concept<FunctionCall>  FUNCTION_CALL   = add (new RecordConcept<FunctionCall>  ("functionCall",  FunctionCall .class, FunctionCall ::read));
    public static final Concept<EventSequence> EVENT_SEQUENCE  = add (new RecordConcept<EventSequence> ("eventSequence", EventSequence.class, EventSequence::read));
    public static final Concept<Variables>     VARIABLES       = add (new RecordConcept<Variables>     ("variables",     Variables    .class, Variables    ::read));
    public static final Concept<StaffContext>  STAFF_CONTEXT   = add (new RecordConcept<StaffContext>  ("staffContext",  StaffContext .class, StaffContext ::read));
    public static final Concept<RepeatInfo>    REPEAT_INFO     = add (new RecordConcept<RepeatInfo>    ("repeatInfo",    RepeatInfo   .class, RepeatInfo   ::read));
    public static final Concept<LyricsInfo>    LYRICS_INFO     = add (new RecordConcept<LyricsInfo>    ("lyricsInfo",    LyricsInfo   .class, LyricsInfo   ::read));
    public static final Concept<TupletInfo>    TUPLET_INFO     = add (new RecordConcept<TupletInfo>    ("tupletInfo",    TupletInfo   .class, TupletInfo   ::read));
    public static final Concept<TextList>      TWEAKS          = add (new RecordConcept<TextList>      ("tweaks",        TextList     .class, TextList     ::read));
    public static final Concept<Markers>       MARKERS         = add (new RecordConcept<Markers>       ("markers",       Markers      .class, Markers      ::read));
    public static final Concept<String>        CHORD_MODE_INFO = add (new TextConcept ("chordModeInfo"));
    public static final Concept<String>        FIGURE_INFO     = add (new TextConcept ("figureInfo"));
    public static final Concept<String>        DRUM_EVENT      = add (new TextConcept ("drumEvent"));
    public static final Concept<String>        MREST_INFO      = add (new TextConcept ("mrestInfo"));
    public static final Concept<String>        PITCHED_REST    = add (new TextConcept ("pitchedRest"));
    public static final Concept<MNode>         RECORDS         = add (new NodeConcept ("records"));

    protected static <T> Concept<T> add (Concept<T> concept)
    {
        byName.put (concept.name, concept);
        return concept;
    }

    /**
        @return The concept with the given stable name, or null if unknown.
    **/
    public static Concept<?> get (String name)
    {
        return byName.get (name);
    }

    public static List<Concept<?>> all ()
    {
        return Collections.unmodifiableList (new ArrayList<Concept<?>> (byName.values ()));
    }

    public static class RecordConcept<T extends Record> extends Concept<T>
    {
        protected Function<MNode,T> reader;

        public RecordConcept (String name, Class<T> type, Function<MNode,T> reader)
        {
            super (name, type);
            this.reader = reader;
        }

        public void write (T value, MNode node)
        {
            value.write (node);
        }

        public T read (MNode node)
        {
            return reader.apply (node);
        }
    }

    /**
        A single string, typically a fragment of serialized source.
    **/
    public static class TextConcept extends Concept<String>
    {
        public TextConcept (String name)
        {
            super (name, String.class);
        }

        public void write (String value, MNode node)
        {
            node.set (value);
        }

        public String read (MNode node)
        {
            return node.get ();
        }
    }

    /**
        An opaque tree, held as-is. Used for records that come from other formats.
    **/
    public static class NodeConcept extends Concept<MNode>
    {
        public NodeConcept (String name)
        {
            super (name, MNode.class);
        }

        public void write (MNode value, MNode node)
        {
            node.merge (value);
        }

        public MNode read (MNode node)
        {
            return new MVolatile (node);
        }
    }
}
