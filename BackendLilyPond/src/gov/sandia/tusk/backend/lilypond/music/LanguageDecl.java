/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    \language "name": selects the note-name language for the rest of the file.
**/
public class LanguageDecl extends Toplevel
{
    public String language;

    public LanguageDecl (String language)
    {
        this.language = language;
    }

    public void render (Renderer renderer)
    {
        renderer.append ("\\language ").append (Renderer.quote (language));
    }
}
