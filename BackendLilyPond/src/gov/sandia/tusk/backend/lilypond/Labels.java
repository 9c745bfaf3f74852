/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.io.IOException;

import gov.sandia.tusk.db.JSON;
import gov.sandia.tusk.db.MNode;
import gov.sandia.tusk.db.MVolatile;

/**
    Label formats used to carry LilyPond source through the canonical document.
    Placeholder control events hold a prefix followed by a JSON object whose "ly" member is the source text.
    Helper labels on ordinary elements hold a prefix followed by plain text.
**/
public class Labels
{
    // Placeholders, spliced back into the music on export
    public static final String PROP         = "tusk:prop,";
    public static final String FUNC         = "tusk:func,";
    public static final String SCHEME_MUSIC = "tusk:scheme-music,";
    public static final String MUSIC        = "tusk:music,";

    // Helpers
    public static final String SCRIPT = "lilypond:script,";
    public static final String ABBR   = "lilypond:abbr,";
    public static final String POST   = "lilypond:post,";
    public static final String CLEF   = "lilypond:clef,";
    public static final String BAR    = "lilypond:bar,";

    // Span types, held in the type attribute of annot
    public static final String SPAN      = "lilypond:";
    public static final String BLOCK     = "block";
    public static final String PITCH     = "pitch";
    public static final String REPEAT    = "repeat";
    public static final String ENDING    = "ending";
    public static final String GRACE     = "grace";
    public static final String CONTEXT   = "context";
    public static final String MODE      = "mode";
    public static final String VARIABLE  = "variable";

    public static final String[] placeholders = {PROP, FUNC, SCHEME_MUSIC, MUSIC};

    public static String encode (String prefix, String text)
    {
        MNode node = new MVolatile ();
        node.set (text, "ly");
        return prefix + JSON.toCompactString (node);
    }

    /**
        @return The prefix of a placeholder label, or null if the label is not a placeholder.
    **/
    public static String placeholder (String label)
    {
        if (label == null) return null;
        for (String p : placeholders) if (label.startsWith (p)) return p;
        return null;
    }

    /**
        Extracts the source text from a placeholder label.
        @throws IOException if the payload is not well-formed.
    **/
    public static String decode (String label) throws IOException
    {
        String prefix = placeholder (label);
        if (prefix == null) throw new IOException ("Not a placeholder label");
        MNode node = JSON.parse (label.substring (prefix.length ()));
        String result = node.get ("ly");
        if (result.isEmpty ()) throw new IOException ("Placeholder has no source text");
        return result;
    }

    /**
        @return The text after the given helper prefix, or null if the label doesn't start with it.
    **/
    public static String helper (String label, String prefix)
    {
        if (label == null  ||  ! label.startsWith (prefix)) return null;
        return label.substring (prefix.length ());
    }
}
