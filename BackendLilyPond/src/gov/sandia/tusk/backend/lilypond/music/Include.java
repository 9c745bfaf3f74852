/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

public class Include extends Toplevel
{
    public String path;

    public Include (String path)
    {
        this.path = path;
    }

    public void render (Renderer renderer)
    {
        renderer.append ("\\include ").append (Renderer.quote (path));
    }
}
