/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

/**
    How lyrics were attached to a voice.
**/
public class LyricsInfo implements Record
{
    public static final String ADDLYRICS = "addlyrics";
    public static final String LYRICSTO  = "lyricsto";
    public static final String LYRICMODE = "lyricmode";

    public String style;
    public String voiceID = "";  // Context name targeted by \lyricsto.
    public int    count   = 1;   // Number of stanzas.

    public LyricsInfo (String style)
    {
        this.style = style;
    }

    public void write (MNode node)
    {
        node.set (style, "style");
        if (! voiceID.isEmpty ()) node.set (voiceID, "voice");
        node.set (count, "count");
    }

    public static LyricsInfo read (MNode node)
    {
        LyricsInfo result = new LyricsInfo (node.get ("style"));
        result.voiceID = node.get ("voice");
        result.count   = node.getOrDefault (1, "count");
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof LyricsInfo)) return false;
        LyricsInfo that = (LyricsInfo) o;
        return style.equals (that.style)  &&  voiceID.equals (that.voiceID)  &&  count == that.count;
    }

    @Override
    public int hashCode ()
    {
        return style.hashCode () * 31 + count;
    }
}
