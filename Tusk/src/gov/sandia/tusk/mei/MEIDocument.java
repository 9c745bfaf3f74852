/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.mei;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import gov.sandia.tusk.extension.ExtensionStore;

/**
    A canonical document together with the extension store that travels with it.
    The id index is rebuilt on demand, so callers may edit the tree freely between lookups.
**/
public class MEIDocument
{
    public Element        root;
    public ExtensionStore store = new ExtensionStore ();

    protected Map<String,Element> index;

    public MEIDocument ()
    {
        root = new Element (MEI.MEI_ROOT);
        root.set ("xmlns", MEI.NAMESPACE);
        root.set ("meiversion", MEI.VERSION);
    }

    public MEIDocument (Element root)
    {
        this.root = root;
    }

    /**
        @return The element with the given xml:id, or null.
    **/
    public Element find (String id)
    {
        if (id == null  ||  id.isEmpty ()) return null;
        if (index == null  ||  ! index.containsKey (id)) reindex ();
        Element result = index.get (id);
        if (result != null  &&  ! id.equals (result.id ()))  // stale
        {
            reindex ();
            result = index.get (id);
        }
        return result;
    }

    public void reindex ()
    {
        index = new HashMap<String,Element> ();
        root.visit (new Element.Visitor ()
        {
            public boolean visit (Element e)
            {
                String id = e.id ();
                if (! id.isEmpty ()) index.put (id, e);
                return true;
            }
        });
    }

    /**
        Resolves a reference attribute such as startid, which may carry a leading "#".
    **/
    public Element resolve (String reference)
    {
        if (reference == null) return null;
        if (reference.startsWith ("#")) reference = reference.substring (1);
        return find (reference);
    }

    public Element head ()
    {
        return root.child (MEI.HEAD);
    }

    public Element body ()
    {
        Element music = root.child (MEI.MUSIC);
        if (music == null) return null;
        return music.child (MEI.BODY);
    }

    public List<Element> mdivs ()
    {
        Element body = body ();
        if (body == null) return new ArrayList<Element> ();
        return body.children (MEI.MDIV);
    }

    public List<String> ids ()
    {
        reindex ();
        return new ArrayList<String> (index.keySet ());
    }
}
