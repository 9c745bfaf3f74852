/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import gov.sandia.tusk.TuskPlugin;
import gov.sandia.tusk.language.ConversionException;
import gov.sandia.tusk.language.ParseException;
import gov.sandia.tusk.mei.MEIDocument;
import gov.sandia.tusk.plugins.PluginManager;
import gov.sandia.tusk.plugins.extpoints.Export;
import gov.sandia.tusk.plugins.extpoints.Import;

public class PluginLilyPondTest
{
    @Rule
    public TemporaryFolder folder = new TemporaryFolder ();

    @BeforeClass
    public static void setup ()
    {
        PluginManager.initialize (TuskPlugin.getInstance (), null);
    }

    protected Path write (String name, String text) throws Exception
    {
        Path result = folder.getRoot ().toPath ().resolve (name);
        Files.write (result, text.getBytes (StandardCharsets.UTF_8));
        return result;
    }

    @Test
    public void testDiscovery () throws Exception
    {
        assertTrue (PluginManager.getPluginById (PluginLilyPond.class.getName ()) instanceof PluginLilyPond);

        Import i = PluginManager.findImporter (write ("tune.ly", "{ c4 }"));
        assertTrue (i instanceof ImportLilyPond);
        assertTrue (PluginManager.findImporter (write ("part.ily", "{ c4 }")) instanceof ImportLilyPond);
        assertNull (PluginManager.findImporter (write ("notes.txt", "{ c4 }")));

        Export e = PluginManager.findExporter (folder.getRoot ().toPath ().resolve ("out.ly"));
        assertTrue (e instanceof ExportLilyPond);
    }

    @Test
    public void testMatches () throws Exception
    {
        ImportLilyPond i = new ImportLilyPond ();
        assertEquals (1,    i.matches (write ("a.ly", "% title\n\\version \"2.24.0\"\n{ c4 }")), 0);
        assertEquals (0.5f, i.matches (write ("b.ly", "{ c4 }")), 0);
        assertFalse (i.accept (folder.getRoot ().toPath ().resolve ("c.mei")));
    }

    @Test
    public void testFiles () throws Exception
    {
        Path source = write ("in.ly", "\\version \"2.24.0\"\n{ c'4 d'4 e'4 f'4 }\n");
        MEIDocument document = new ImportLilyPond ().process (source);
        assertEquals (4, ImportJobTest.notes (document).size ());

        Path destination = folder.getRoot ().toPath ().resolve ("out.ly");
        new ExportLilyPond ().process (document, destination);
        String text = new String (Files.readAllBytes (destination), StandardCharsets.UTF_8);
        assertTrue (text.contains ("{ c'4 d'4 e'4 f'4 }"));
    }

    @Test
    public void testBadFile () throws Exception
    {
        Path source = write ("bad.ly", "{ c4\n  d4 \\repeat bogus 2 c4 }");
        try
        {
            new ImportLilyPond ().process (source);
            fail ("Parse error should propagate");
        }
        catch (ParseException e)
        {
            assertEquals ("  d4 \\repeat bogus 2 c4 }", e.line);
            assertEquals (13, e.column);
        }
    }

    @Test
    public void testBatch () throws Exception
    {
        Path good1 = write ("one.ly", "{ c4 d4 }");
        Path bad   = write ("two.ly", "{ c4 \\repeat bogus 2 c4 }");
        Path good2 = write ("three.ly", "{ e4 }");
        Path none  = folder.getRoot ().toPath ().resolve ("missing.ly");

        Map<Path,Exception> failures = new HashMap<Path,Exception> ();
        Map<Path,MEIDocument> documents = new ImportLilyPond ().process (Arrays.asList (good1, bad, good2, none), failures);
        assertEquals (2, documents.size ());
        assertEquals (1, ImportJobTest.notes (documents.get (good2)).size ());
        assertEquals (2, failures.size ());
        assertTrue (failures.get (bad) instanceof ParseException);
        assertTrue (failures.containsKey (none));
    }

    @Test
    public void testBatchBadRatio () throws Exception
    {
        Path tuplet = write ("tuplet.ly", "{ \\tuplet 3/0 { c4 d4 e4 } }");
        Path times  = write ("times.ly",  "{ \\times 0/3 { c4 d4 e4 } }");
        Path meter  = write ("meter.ly",  "{ \\time 3/0 c'1 }");
        Path good   = write ("good.ly",   "{ f4 g4 }");

        Map<Path,Exception> failures = new HashMap<Path,Exception> ();
        Map<Path,MEIDocument> documents = new ImportLilyPond ().process (Arrays.asList (tuplet, times, meter, good), failures);
        assertEquals (1, documents.size ());
        assertEquals (2, ImportJobTest.notes (documents.get (good)).size ());
        assertTrue (failures.get (tuplet) instanceof ParseException);
        assertTrue (failures.get (times)  instanceof ParseException);
        assertTrue (failures.get (meter)  instanceof ConversionException);
    }
}
