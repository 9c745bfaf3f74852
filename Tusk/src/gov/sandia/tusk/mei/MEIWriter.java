/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.mei;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map.Entry;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.w3c.dom.Node;

/**
    Writes a canonical document as indented XML. When embedStore is set and the store
    is not empty, the whole store goes into the label of the head element.
**/
public class MEIWriter
{
    public boolean embedStore  = true;
    public int     indent      = 4;

    public void write (MEIDocument document, Path destination) throws IOException
    {
        try (OutputStream stream = Files.newOutputStream (destination))
        {
            Writer writer = new OutputStreamWriter (stream, StandardCharsets.UTF_8);
            write (document, writer);
            writer.flush ();
        }
    }

    public String toString (MEIDocument document)
    {
        StringWriter writer = new StringWriter ();
        try
        {
            write (document, writer);
        }
        catch (IOException e)
        {
            throw new IllegalStateException (e);
        }
        return writer.toString ();
    }

    public void write (MEIDocument document, Writer writer) throws IOException
    {
        try
        {
            DocumentBuilderFactory factoryBuilder = DocumentBuilderFactory.newInstance ();
            DocumentBuilder builder = factoryBuilder.newDocumentBuilder ();
            Document doc = builder.newDocument ();

            Element root = document.root;
            if (embedStore  &&  ! document.store.isEmpty ())
            {
                root = root.copy ();
                Element head = root.child (MEI.HEAD);
                if (head == null) head = root.add (0, new Element (MEI.HEAD));
                head.set (MEI.LABEL, document.store.toLabel ());
            }
            doc.appendChild (convert (doc, root));

            DOMSource dom = new DOMSource (doc);
            StreamResult stream = new StreamResult (writer);
            TransformerFactory factoryXform = TransformerFactory.newInstance ();
            factoryXform.setAttribute ("indent-number", indent);
            Transformer xform = factoryXform.newTransformer ();
            xform.setOutputProperty (OutputKeys.INDENT, "yes");
            xform.setOutputProperty (OutputKeys.ENCODING, "UTF-8");
            xform.transform (dom, stream);
        }
        catch (ParserConfigurationException | TransformerException e)
        {
            throw new IOException ("Failed to write canonical document", e);
        }
    }

    public Node convert (Document doc, Element element)
    {
        org.w3c.dom.Element result = doc.createElement (element.name);
        for (Entry<String,String> a : element.attributes.entrySet ()) result.setAttribute (a.getKey (), a.getValue ());
        if (element.text != null) result.appendChild (doc.createTextNode (element.text));
        for (Element c : element.children) result.appendChild (convert (doc, c));
        return result;
    }
}
