/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    \tweak applied directly to one event, chord member or post-event.
**/
public class Tweak
{
    public PropertyPath  path;
    public PropertyValue value;

    public Tweak (PropertyPath path, PropertyValue value)
    {
        this.path  = path;
        this.value = value;
    }

    public void render (Renderer renderer)
    {
        renderer.append ("\\tweak ").append (path.toString ()).append (' ');
        value.render (renderer);
    }

    public String toString ()
    {
        Renderer renderer = new Renderer ();
        render (renderer);
        return renderer.result.toString ();
    }
}
