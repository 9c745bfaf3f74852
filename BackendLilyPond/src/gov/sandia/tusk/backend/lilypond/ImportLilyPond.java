/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import gov.sandia.tusk.db.AppData;
import gov.sandia.tusk.language.ConversionException;
import gov.sandia.tusk.language.ParseException;
import gov.sandia.tusk.mei.MEIDocument;
import gov.sandia.tusk.plugins.extpoints.Import;

public class ImportLilyPond implements Import
{
    private static Logger logger = Logger.getLogger (ImportLilyPond.class);

    @Override
    public String getName ()
    {
        return "LilyPond";
    }

    @Override
    public MEIDocument process (Path source) throws IOException, ParseException, ConversionException
    {
        String text = new String (Files.readAllBytes (source), StandardCharsets.UTF_8);
        MEIDocument result;
        try
        {
            result = new ImportJob (AppData.settings ()).process (text);
        }
        catch (ParseException e)
        {
            e.locate (text);
            logger.error ("Failed to parse " + source + " at line " + e.lineNumber (text) + ": " + e.getMessage ());
            throw e;
        }
        logger.info ("Read " + source + " with " + result.store.size () + " extension entries");
        return result;
    }

    /**
        Converts each file on its own. A failure in one file is logged and recorded,
        and the remaining files still convert.
        @param failures Receives one exception per file that could not be converted. May be null.
        @return Documents for the files that converted, in input order.
    **/
    public Map<Path,MEIDocument> process (List<Path> sources, Map<Path,Exception> failures)
    {
        Map<Path,MEIDocument> result = new LinkedHashMap<Path,MEIDocument> ();
        for (Path source : sources)
        {
            try
            {
                result.put (source, process (source));
            }
            catch (IOException | ParseException | ConversionException e)
            {
                if (! (e instanceof ParseException)) logger.error ("Failed to convert " + source + ": " + e.getMessage ());
                if (failures != null) failures.put (source, e);
            }
            catch (RuntimeException e)
            {
                // A defect in conversion still only costs this one file.
                logger.error ("Internal error converting " + source, e);
                if (failures != null) failures.put (source, e);
            }
        }
        return result;
    }

    /**
        Looks for a version statement near the top of the file.
    **/
    @Override
    public float matches (Path source)
    {
        try (BufferedReader reader = Files.newBufferedReader (source, StandardCharsets.UTF_8))
        {
            for (int i = 0; i < 20; i++)
            {
                String line = reader.readLine ();
                if (line == null) break;
                if (line.trim ().startsWith ("\\version")) return 1;
            }
        }
        catch (IOException e)
        {
            logger.debug ("Can't read " + source, e);
        }
        return 0.5f;  // The suffix alone is a strong hint, since include files often lack a version.
    }

    @Override
    public boolean accept (Path source)
    {
        String name = source.getFileName ().toString ();
        int lastDot = name.lastIndexOf ('.');
        if (lastDot < 0) return false;
        String suffix = name.substring (lastDot);
        return suffix.equalsIgnoreCase (".ly")  ||  suffix.equalsIgnoreCase (".ily");
    }
}
