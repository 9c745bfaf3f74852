/*
Copyright 2016-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.db;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.log4j.Logger;

/**
    Holds the conversion settings shared by all jobs.
    Defaults come from the classpath resource defaults.schema next to this package.
    A user file can be layered on top with load(Path). Each job receives a copy via
    settings(), so per-job overrides never leak back into the shared tree.
**/
public class AppData
{
    public static final String DEFAULTS = "/gov/sandia/tusk/defaults.schema";

    public static MNode properties;

    private static Logger logger = Logger.getLogger (AppData.class);

    static
    {
        properties = new MVolatile ();
        try (InputStream stream = AppData.class.getResourceAsStream (DEFAULTS))
        {
            if (stream == null)
            {
                logger.warn ("Missing resource " + DEFAULTS + "; using built-in values");
            }
            else
            {
                Schema.readAll (properties, new InputStreamReader (stream, StandardCharsets.UTF_8));
            }
        }
        catch (IOException e)
        {
            logger.error ("Failed to read " + DEFAULTS, e);
        }
        properties.mergeUnder (builtIn ());
    }

    /**
        Values used when the defaults resource is absent or incomplete.
    **/
    public static MNode builtIn ()
    {
        MNode result = new MVolatile ();
        result.set ("960",    "ppq");
        result.set ("0.001",  "tolerance");
        result.set ("8",      "maxDenominator");
        result.set ("2",      "indent");
        result.set ("2.24.0", "version");
        result.set ("1",      "melisma");
        result.set ("1",      "embedStore");
        return result;
    }

    /**
        Overlays the settings in the given file on top of the current properties.
    **/
    public static synchronized void load (Path file) throws IOException
    {
        try (Reader reader = Files.newBufferedReader (file, StandardCharsets.UTF_8))
        {
            MNode loaded = new MVolatile ();
            Schema.readAll (loaded, reader);
            properties.merge (loaded);
            logger.info ("Loaded settings from " + file);
        }
    }

    /**
        @return A private copy of the current settings, suitable for per-job overrides.
    **/
    public static synchronized MNode settings ()
    {
        return new MVolatile (properties);
    }
}
