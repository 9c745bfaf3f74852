/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    A chord symbol written in chord mode, such as c4:m7/e or g:7/+b.
**/
public class ChordModeEntry extends Event
{
    public Pitch  root;
    public String modifiers;  // Text after the colon, such as "m7" or "9^7". Null if no colon was written.
    public Pitch  inversion;  // After /
    public Pitch  bass;       // After /+

    public ChordModeEntry (Pitch root)
    {
        this.root = root;
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderTweaks (renderer);
        renderer.append (root.toString ());
        renderDuration (renderer);
        if (modifiers != null) renderer.append (':').append (modifiers);
        if (inversion != null) renderer.append ('/' ).append (inversion.toString ());
        if (bass      != null) renderer.append ("/+").append (bass.toString ());
        renderPostEvents (renderer);
    }
}
