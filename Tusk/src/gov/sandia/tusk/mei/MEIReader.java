/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.mei;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.apache.log4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import gov.sandia.tusk.extension.ExtensionStore;

/**
    Loads a canonical document from XML. If the head carries an embedded extension store,
    it is unpacked into the document's store and the label is removed from the tree.
**/
public class MEIReader
{
    private static Logger logger = Logger.getLogger (MEIReader.class);

    public MEIDocument read (Path source) throws IOException
    {
        try (InputStream stream = Files.newInputStream (source))
        {
            return read (new InputSource (stream));
        }
    }

    public MEIDocument read (String xml) throws IOException
    {
        return read (new InputSource (new StringReader (xml)));
    }

    public MEIDocument read (InputSource source) throws IOException
    {
        Document doc;
        try
        {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance ();
            factory.setCoalescing (true);
            factory.setIgnoringComments (true);
            factory.setIgnoringElementContentWhitespace (true);
            DocumentBuilder builder = factory.newDocumentBuilder ();
            doc = builder.parse (source);
        }
        catch (ParserConfigurationException e)
        {
            throw new IOException ("XML parser unavailable", e);
        }
        catch (SAXException e)
        {
            throw new IOException ("Malformed XML: " + e.getMessage (), e);
        }

        Element root = convert (doc.getDocumentElement ());
        if (! root.is (MEI.MEI_ROOT)) throw new IOException ("Root element is <" + root.name + ">, not <mei>");
        MEIDocument result = new MEIDocument (root);
        extractStore (result);
        return result;
    }

    public Element convert (Node node)
    {
        Element result = new Element (node.getNodeName ());
        NamedNodeMap attributes = node.getAttributes ();
        for (int i = 0; i < attributes.getLength (); i++)
        {
            Node a = attributes.item (i);
            result.set (a.getNodeName (), a.getNodeValue ());
        }
        List<Node> elements = XMLutility.elements (node);
        if (elements.isEmpty ())
        {
            String text = XMLutility.getText (node);
            if (! text.isEmpty ()) result.text = text;
        }
        for (Node child : elements) result.add (convert (child));
        return result;
    }

    /**
        Looks for the store label first on the head, then on the root.
    **/
    public void extractStore (MEIDocument document)
    {
        Element[] candidates = {document.head (), document.root};
        for (Element e : candidates)
        {
            if (e == null) continue;
            String label = e.label ();
            if (! ExtensionStore.isLabel (label)) continue;
            try
            {
                document.store = ExtensionStore.fromLabel (label);
                e.remove (MEI.LABEL);
            }
            catch (IOException error)
            {
                logger.warn ("Ignoring malformed extension label on <" + e.name + ">: " + error.getMessage ());
            }
            return;
        }
    }
}
