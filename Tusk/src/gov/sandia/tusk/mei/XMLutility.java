/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.mei;

import java.util.ArrayList;
import java.util.List;

import org.w3c.dom.Node;

/**
    DOM helpers for reading canonical documents.
**/
public class XMLutility
{
    /**
        Concatenates the text and CDATA children of the node.
        Text that sits between child elements is included as well, so only call this on leaves.
    **/
    public static String getText (Node node)
    {
        StringBuilder result = new StringBuilder ();
        for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            short type = child.getNodeType ();
            if (type == Node.TEXT_NODE  ||  type == Node.CDATA_SECTION_NODE) result.append (child.getNodeValue ());
        }
        return result.toString ();
    }

    /**
        @return Child elements in document order. Whitespace and comments are skipped.
    **/
    public static List<Node> elements (Node node)
    {
        List<Node> result = new ArrayList<Node> ();
        for (Node child = node.getFirstChild (); child != null; child = child.getNextSibling ())
        {
            if (child.getNodeType () == Node.ELEMENT_NODE) result.add (child);
        }
        return result;
    }
}
