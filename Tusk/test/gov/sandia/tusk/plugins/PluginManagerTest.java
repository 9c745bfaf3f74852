/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.plugins;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import gov.sandia.tusk.TuskPlugin;
import gov.sandia.tusk.mei.MEIDocument;
import gov.sandia.tusk.mei.MEIDocumentTest;
import gov.sandia.tusk.plugins.extpoints.Export;
import gov.sandia.tusk.plugins.extpoints.Import;
import gov.sandia.tusk.transfer.ExportMEI;
import gov.sandia.tusk.transfer.ImportMEI;

public class PluginManagerTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder ();

    @BeforeClass
    public static void setup ()
    {
        PluginManager.initialize (TuskPlugin.getInstance (), null);
    }

    @Test
    public void testRegistry ()
    {
        assertSame (TuskPlugin.getInstance (), PluginManager.getPluginById (TuskPlugin.class.getName ()));
        assertSame (Import.class, PluginManager.getExtensionPointById (Import.class.getName ()));
        assertTrue (PluginManager.getExtensionById (ImportMEI.class.getName ()) instanceof ImportMEI);

        // A second initialize does not load anything twice.
        int count = PluginManager.getExtensionsForPoint (Import.class).size ();
        PluginManager.initialize (TuskPlugin.getInstance (), null);
        assertEquals (count, PluginManager.getExtensionsForPoint (Import.class).size ());
    }

    @Test
    public void testDispatch () throws Exception
    {
        Path mei = folder.getRoot ().toPath ().resolve ("tune.mei");
        Files.write (mei, "<?xml version=\"1.0\"?>\n<mei meiversion=\"5.0\">\n</mei>\n".getBytes (StandardCharsets.UTF_8));
        assertTrue (PluginManager.findImporter (mei) instanceof ImportMEI);

        // Suffix alone is not enough.
        Path other = folder.getRoot ().toPath ().resolve ("other.xml");
        Files.write (other, "<score/>\n".getBytes (StandardCharsets.UTF_8));
        assertNull (PluginManager.findImporter (other));

        assertTrue (PluginManager.findExporter (folder.getRoot ().toPath ().resolve ("out.mei")) instanceof ExportMEI);
        assertNull (PluginManager.findExporter (folder.getRoot ().toPath ().resolve ("out.pdf")));
    }

    @Test
    public void testFileRoundTrip () throws Exception
    {
        MEIDocument before = MEIDocumentTest.sample ();
        Path destination = folder.getRoot ().toPath ().resolve ("saved.mei");
        Export e = PluginManager.findExporter (destination);
        e.process (before, destination);

        Import i = PluginManager.findImporter (destination);
        MEIDocument after = i.process (destination);
        assertEquals (before.store, after.store);
        assertEquals (before.body (), after.body ());
    }
}
