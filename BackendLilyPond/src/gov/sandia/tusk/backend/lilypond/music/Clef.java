/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

public class Clef extends Music
{
    public String name;  // For example "treble", "bass" or "treble_8"

    public Clef (String name)
    {
        this.name = name;
    }

    /**
        @return The clef name with any octave transposition suffix removed.
    **/
    public String base ()
    {
        int cut = name.indexOf ('_');
        int up  = name.indexOf ('^');
        if (cut < 0  ||  (up >= 0  &&  up < cut)) cut = up;
        if (cut < 0) return name;
        return name.substring (0, cut);
    }

    public void render (Renderer renderer)
    {
        if (renderer.render (this)) return;
        renderer.append ("\\clef ").append (Renderer.word (name));
    }
}
