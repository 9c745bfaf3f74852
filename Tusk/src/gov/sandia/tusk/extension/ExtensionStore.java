/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.log4j.Logger;

import gov.sandia.tusk.db.JSON;
import gov.sandia.tusk.db.MNode;
import gov.sandia.tusk.db.MVolatile;
import gov.sandia.tusk.db.Schema;

/**
    Side channel that keeps everything the canonical document cannot express, keyed by
    element id. Each concept has its own map, so records of different concepts never
    overwrite one another. Removing an id removes all of its records at once.

    One store is created per import, read during export, and discarded with the conversion.
    Not thread-safe; a store belongs to one conversion at a time.
**/
public class ExtensionStore
{
    public static final String LABEL_PREFIX = "tusk:ext,";
    public static final String SCHEMA_TYPE  = "extensions";

    protected Map<Concept<?>,Map<String,Object>> maps = new LinkedHashMap<Concept<?>,Map<String,Object>> ();

    private static Logger logger = Logger.getLogger (ExtensionStore.class);

    public ExtensionStore ()
    {
        for (Concept<?> c : Concepts.all ()) maps.put (c, new LinkedHashMap<String,Object> ());
    }

    protected Map<String,Object> map (Concept<?> concept)
    {
        Map<String,Object> result = maps.get (concept);
        if (result == null)  // A concept created outside the registry.
        {
            result = new LinkedHashMap<String,Object> ();
            maps.put (concept, result);
        }
        return result;
    }

    public <T> void insert (Concept<T> concept, String id, T value)
    {
        if (id == null  ||  id.isEmpty ()) throw new IllegalArgumentException ("Extension record needs an element id");
        if (value == null) throw new IllegalArgumentException ("Null record for " + concept + " on " + id);
        map (concept).put (id, value);
    }

    public <T> T get (Concept<T> concept, String id)
    {
        return concept.cast (map (concept).get (id));
    }

    public boolean contains (Concept<?> concept, String id)
    {
        return map (concept).containsKey (id);
    }

    public <T> T remove (Concept<T> concept, String id)
    {
        return concept.cast (map (concept).remove (id));
    }

    /**
        @return Snapshot of all records for the id. Empty if the id is unknown.
    **/
    public Bag get (String id)
    {
        Bag result = new Bag ();
        for (Map.Entry<Concept<?>,Map<String,Object>> e : maps.entrySet ())
        {
            Object value = e.getValue ().get (id);
            if (value != null) result.records.put (e.getKey (), value);
        }
        return result;
    }

    /**
        Adds every record in the bag under the id. Concepts absent from the bag are left alone.
    **/
    public void insert (String id, Bag bag)
    {
        if (id == null  ||  id.isEmpty ()) throw new IllegalArgumentException ("Extension record needs an element id");
        for (Map.Entry<Concept<?>,Object> e : bag.records.entrySet ()) map (e.getKey ()).put (id, e.getValue ());
    }

    /**
        Removes every record of the id.
        @return The removed records.
    **/
    public Bag remove (String id)
    {
        Bag result = new Bag ();
        for (Map.Entry<Concept<?>,Map<String,Object>> e : maps.entrySet ())
        {
            Object value = e.getValue ().remove (id);
            if (value != null) result.records.put (e.getKey (), value);
        }
        return result;
    }

    /**
        Moves all records from one id to another, replacing whatever the target held.
    **/
    public void rename (String from, String to)
    {
        if (from.equals (to)) return;
        Bag moved = remove (from);
        remove (to);
        if (! moved.isEmpty ()) insert (to, moved);
    }

    /**
        @return Handle for reading and writing the records of one id.
    **/
    public Entry entry (String id)
    {
        return new Entry (id);
    }

    public class Entry
    {
        public final String id;

        protected Entry (String id)
        {
            this.id = id;
        }

        public <T> T get (Concept<T> concept)
        {
            return ExtensionStore.this.get (concept, id);
        }

        public <T> Entry set (Concept<T> concept, T value)
        {
            if (value == null) ExtensionStore.this.remove (concept, id);
            else               ExtensionStore.this.insert (concept, id, value);
            return this;
        }

        /**
            Returns the existing record, or stores and returns the given one.
        **/
        public <T> T getOrInsert (Concept<T> concept, T value)
        {
            T result = get (concept);
            if (result != null) return result;
            set (concept, value);
            return value;
        }

        public boolean has (Concept<?> concept)
        {
            return contains (concept, id);
        }
    }

    /**
        @return Every id that has at least one record, in first-insertion order per concept.
    **/
    public Set<String> ids ()
    {
        Set<String> result = new LinkedHashSet<String> ();
        for (Map<String,Object> m : maps.values ()) result.addAll (m.keySet ());
        return result;
    }

    /**
        @return Ids that carry the given concept.
    **/
    public Set<String> ids (Concept<?> concept)
    {
        return new LinkedHashSet<String> (map (concept).keySet ());
    }

    /**
        Number of distinct ids.
    **/
    public int size ()
    {
        return ids ().size ();
    }

    public boolean isEmpty ()
    {
        for (Map<String,Object> m : maps.values ()) if (! m.isEmpty ()) return false;
        return true;
    }

    /**
        Drops records whose id is not in the given collection.
        @return The ids that were dropped.
    **/
    public List<String> retain (Collection<String> valid)
    {
        List<String> result = new ArrayList<String> ();
        for (String id : ids ())
        {
            if (valid.contains (id)) continue;
            remove (id);
            result.add (id);
        }
        if (! result.isEmpty ()) logger.warn ("Dropped extension records for missing elements: " + result);
        return result;
    }

    public void clear ()
    {
        for (Map<String,Object> m : maps.values ()) m.clear ();
    }

    // Serialization -----------------------------------------------------

    /**
        Tree form: one child per id, and under it one child per concept name.
    **/
    public MNode toNode ()
    {
        MNode result = new MVolatile ();
        for (Map.Entry<Concept<?>,Map<String,Object>> e : maps.entrySet ())
        {
            Concept<?> concept = e.getKey ();
            for (Map.Entry<String,Object> r : e.getValue ().entrySet ())
            {
                write (concept, r.getValue (), result.childOrCreate (r.getKey (), concept.name));
            }
        }
        return result;
    }

    protected static <T> void write (Concept<T> concept, Object value, MNode node)
    {
        concept.write (concept.cast (value), node);
    }

    public static ExtensionStore fromNode (MNode node)
    {
        ExtensionStore result = new ExtensionStore ();
        for (MNode idNode : node)
        {
            String id = idNode.key ();
            for (MNode c : idNode)
            {
                Concept<?> concept = Concepts.get (c.key ());
                if (concept == null)
                {
                    logger.warn ("Unknown extension concept \"" + c.key () + "\" on " + id + "; kept as free-form record");
                    MNode records = result.get (Concepts.RECORDS, id);
                    if (records == null)
                    {
                        records = new MVolatile ();
                        result.insert (Concepts.RECORDS, id, records);
                    }
                    records.set (c, c.key ());
                    continue;
                }
                result.map (concept).put (id, concept.read (c));
            }
        }
        return result;
    }

    public String toJSON ()
    {
        return JSON.toCompactString (toNode ());
    }

    public static ExtensionStore fromJSON (String text) throws IOException
    {
        return fromNode (JSON.parse (text));
    }

    /**
        @return The whole store as a label value, ready to put on the document head.
    **/
    public String toLabel ()
    {
        return LABEL_PREFIX + toJSON ();
    }

    public static boolean isLabel (String label)
    {
        return label != null  &&  label.startsWith (LABEL_PREFIX);
    }

    public static ExtensionStore fromLabel (String label) throws IOException
    {
        if (! isLabel (label)) throw new IOException ("Not an extension label");
        return fromJSON (label.substring (LABEL_PREFIX.length ()));
    }

    /**
        Writes the side-car form, with schema header.
    **/
    public void write (Writer writer) throws IOException
    {
        Schema.latest (SCHEMA_TYPE).writeAll (toNode (), writer);
    }

    public static ExtensionStore read (Reader reader) throws IOException
    {
        MNode node = new MVolatile ();
        Schema schema = Schema.readAll (node, new BufferedReader (reader));
        if (! schema.type.isEmpty ()  &&  ! schema.type.equals (SCHEMA_TYPE)) throw new IOException ("Not an extension file: " + schema.type);
        return fromNode (node);
    }

    public static ExtensionStore read (String text) throws IOException
    {
        return read (new StringReader (text));
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof ExtensionStore)) return false;
        return toNode ().equals (((ExtensionStore) o).toNode ());
    }

    @Override
    public int hashCode ()
    {
        return toNode ().hashCode ();
    }
}
