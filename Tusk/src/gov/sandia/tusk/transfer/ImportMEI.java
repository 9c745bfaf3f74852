/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.transfer;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.log4j.Logger;

import gov.sandia.tusk.mei.MEIDocument;
import gov.sandia.tusk.mei.MEIReader;
import gov.sandia.tusk.plugins.extpoints.Import;

public class ImportMEI implements Import
{
    private static Logger logger = Logger.getLogger (ImportMEI.class);

    @Override
    public String getName ()
    {
        return "MEI";
    }

    @Override
    public MEIDocument process (Path source) throws IOException
    {
        MEIDocument result = new MEIReader ().read (source);
        logger.info ("Read " + source + " with " + result.store.size () + " extension entries");
        return result;
    }

    /**
        Looks at the first few lines for the root element.
    **/
    @Override
    public float matches (Path source)
    {
        try (BufferedReader reader = Files.newBufferedReader (source, StandardCharsets.UTF_8))
        {
            for (int i = 0; i < 5; i++)
            {
                String line = reader.readLine ();
                if (line == null) break;
                if (line.contains ("<mei")) return 1;
            }
        }
        catch (IOException e)
        {
            logger.debug ("Can't read " + source, e);
        }
        return 0;
    }

    @Override
    public boolean accept (Path source)
    {
        String name = source.getFileName ().toString ();
        int lastDot = name.lastIndexOf ('.');
        if (lastDot < 0) return false;
        String suffix = name.substring (lastDot);
        return suffix.equalsIgnoreCase (".mei")  ||  suffix.equalsIgnoreCase (".xml");
    }
}
