/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

/**
    Descriptor for one kind of record the store keeps per element. The name is stable
    across releases because it keys the serialized form. The codec methods translate
    a record to and from an MNode tree.
**/
public abstract class Concept<T>
{
    public final String   name;
    public final Class<T> type;

    protected Concept (String name, Class<T> type)
    {
        this.name = name;
        this.type = type;
    }

    public abstract void write (T value, MNode node);
    public abstract T    read  (MNode node);

    /**
        Checked cast, so a bag from one id can be moved under another without unchecked warnings.
    **/
    public T cast (Object value)
    {
        return type.cast (value);
    }

    public String toString ()
    {
        return name;
    }
}
