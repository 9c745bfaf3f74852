/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
    All records that belong to one element, keyed by concept.
    A bag is a detached snapshot; changing it does not change the store.
**/
public class Bag
{
    protected Map<Concept<?>,Object> records = new LinkedHashMap<Concept<?>,Object> ();

    public <T> T get (Concept<T> concept)
    {
        return concept.cast (records.get (concept));
    }

    public <T> Bag put (Concept<T> concept, T value)
    {
        if (value == null) records.remove (concept);
        else               records.put (concept, value);
        return this;
    }

    public boolean has (Concept<?> concept)
    {
        return records.containsKey (concept);
    }

    public Set<Concept<?>> concepts ()
    {
        return records.keySet ();
    }

    public boolean isEmpty ()
    {
        return records.isEmpty ();
    }

    public int size ()
    {
        return records.size ();
    }

    @Override
    public boolean equals (Object o)
    {
        return o instanceof Bag  &&  records.equals (((Bag) o).records);
    }

    @Override
    public int hashCode ()
    {
        return records.hashCode ();
    }
}
