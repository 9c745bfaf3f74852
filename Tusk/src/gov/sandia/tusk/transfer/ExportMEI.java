/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.transfer;

import java.io.IOException;
import java.nio.file.Path;

import gov.sandia.tusk.db.AppData;
import gov.sandia.tusk.mei.MEIDocument;
import gov.sandia.tusk.mei.MEIWriter;
import gov.sandia.tusk.plugins.extpoints.Export;

public class ExportMEI implements Export
{
    @Override
    public String getName ()
    {
        return "MEI";
    }

    @Override
    public void process (MEIDocument document, Path destination) throws IOException
    {
        MEIWriter writer = new MEIWriter ();
        writer.embedStore = AppData.properties.getFlag ("embedStore");
        writer.write (document, destination);
    }

    @Override
    public boolean accept (Path destination)
    {
        String name = destination.getFileName ().toString ();
        int lastDot = name.lastIndexOf ('.');
        if (lastDot < 0) return false;
        String suffix = name.substring (lastDot);
        return suffix.equalsIgnoreCase (".mei")  ||  suffix.equalsIgnoreCase (".xml");
    }
}
