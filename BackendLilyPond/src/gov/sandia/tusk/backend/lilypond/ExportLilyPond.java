/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.log4j.Logger;

import gov.sandia.tusk.db.AppData;
import gov.sandia.tusk.language.ConversionException;
import gov.sandia.tusk.mei.MEIDocument;
import gov.sandia.tusk.plugins.extpoints.Export;

public class ExportLilyPond implements Export
{
    private static Logger logger = Logger.getLogger (ExportLilyPond.class);

    @Override
    public String getName ()
    {
        return "LilyPond";
    }

    @Override
    public void process (MEIDocument document, Path destination) throws IOException, ConversionException
    {
        String text = new ExportJob (AppData.settings ()).process (document);
        Files.write (destination, text.getBytes (StandardCharsets.UTF_8));
        logger.info ("Wrote " + destination);
    }

    @Override
    public boolean accept (Path destination)
    {
        String name = destination.getFileName ().toString ();
        int lastDot = name.lastIndexOf ('.');
        if (lastDot < 0) return false;
        return name.substring (lastDot).equalsIgnoreCase (".ly");
    }
}
