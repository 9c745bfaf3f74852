/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.mei;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

/**
    One node of the canonical document. The schema defines hundreds of element types;
    they all share this single class, distinguished by name. Attributes keep their
    insertion order so the written XML is stable.
**/
public class Element
{
    public String              name;
    public Map<String,String>  attributes = new LinkedHashMap<String,String> ();
    public List<Element>       children   = new ArrayList<Element> ();
    public String              text;      // Character content. Null if none.
    public Element             parent;

    public Element (String name)
    {
        this.name = name;
    }

    public Element (String name, String id)
    {
        this.name = name;
        setID (id);
    }

    public String id ()
    {
        return get (MEI.ID);
    }

    public void setID (String id)
    {
        set (MEI.ID, id);
    }

    public String label ()
    {
        return get (MEI.LABEL);
    }

    public boolean is (String name)
    {
        return this.name.equals (name);
    }

    public boolean has (String attribute)
    {
        return attributes.containsKey (attribute);
    }

    /**
        @return The attribute value, or "" if absent.
    **/
    public String get (String attribute)
    {
        return get (attribute, "");
    }

    public String get (String attribute, String defaultValue)
    {
        String result = attributes.get (attribute);
        if (result == null) return defaultValue;
        return result;
    }

    public int get (String attribute, int defaultValue)
    {
        String value = attributes.get (attribute);
        if (value == null) return defaultValue;
        try
        {
            return Integer.parseInt (value.trim ());
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    public double get (String attribute, double defaultValue)
    {
        String value = attributes.get (attribute);
        if (value == null) return defaultValue;
        try
        {
            return Double.parseDouble (value.trim ());
        }
        catch (NumberFormatException e)
        {
            return defaultValue;
        }
    }

    /**
        Sets the attribute. A null value removes it.
        @return this, so several attributes can be chained.
    **/
    public Element set (String attribute, Object value)
    {
        if (value == null) attributes.remove (attribute);
        else               attributes.put (attribute, value.toString ());
        return this;
    }

    public void remove (String attribute)
    {
        attributes.remove (attribute);
    }

    public Element add (Element child)
    {
        child.parent = this;
        children.add (child);
        return child;
    }

    public Element add (int index, Element child)
    {
        child.parent = this;
        children.add (index, child);
        return child;
    }

    /**
        Convenience for building a new child with the given name.
    **/
    public Element add (String name)
    {
        return add (new Element (name));
    }

    public boolean remove (Element child)
    {
        if (! children.remove (child)) return false;
        child.parent = null;
        return true;
    }

    /**
        @return First direct child with the given name, or null.
    **/
    public Element child (String name)
    {
        for (Element c : children) if (c.name.equals (name)) return c;
        return null;
    }

    public Element childOrCreate (String name)
    {
        Element result = child (name);
        if (result == null) result = add (name);
        return result;
    }

    public List<Element> children (String name)
    {
        List<Element> result = new ArrayList<Element> ();
        for (Element c : children) if (c.name.equals (name)) result.add (c);
        return result;
    }

    /**
        @return All descendants with the given name, in document order.
    **/
    public List<Element> descendants (String name)
    {
        List<Element> result = new ArrayList<Element> ();
        visit (new Visitor ()
        {
            public boolean visit (Element e)
            {
                if (e != Element.this  &&  e.name.equals (name)) result.add (e);
                return true;
            }
        });
        return result;
    }

    /**
        @return Nearest ancestor with the given name, or null.
    **/
    public Element ancestor (String name)
    {
        Element p = parent;
        while (p != null  &&  ! p.name.equals (name)) p = p.parent;
        return p;
    }

    public String getText ()
    {
        if (text == null) return "";
        return text;
    }

    public interface Visitor
    {
        /**
            @return true to recurse into the children of e.
        **/
        public boolean visit (Element e);
    }

    /**
        Depth-first, pre-order traversal.
    **/
    public void visit (Visitor v)
    {
        if (! v.visit (this)) return;
        for (Element c : new ArrayList<Element> (children)) c.visit (v);
    }

    /**
        Deep copy, detached from any parent.
    **/
    public Element copy ()
    {
        Element result = new Element (name);
        result.attributes.putAll (attributes);
        result.text = text;
        for (Element c : children) result.add (c.copy ());
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (this == o) return true;
        if (! (o instanceof Element)) return false;
        Element that = (Element) o;
        if (! name.equals (that.name)) return false;
        if (! attributes.equals (that.attributes)) return false;
        if (! getText ().equals (that.getText ())) return false;
        return children.equals (that.children);
    }

    @Override
    public int hashCode ()
    {
        return (name.hashCode () * 31 + attributes.hashCode ()) * 31 + children.hashCode ();
    }

    public String toString ()
    {
        StringBuilder result = new StringBuilder ();
        result.append ("<" + name);
        for (Entry<String,String> a : attributes.entrySet ()) result.append (" " + a.getKey () + "=\"" + a.getValue () + "\"");
        if (children.isEmpty ()  &&  text == null) return result.append ("/>").toString ();
        result.append (">");
        if (text != null) result.append (text);
        for (Element c : children) result.append (c.toString ());
        result.append ("</" + name + ">");
        return result.toString ();
    }
}
