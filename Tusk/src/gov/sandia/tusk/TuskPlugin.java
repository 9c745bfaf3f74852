/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk;

import gov.sandia.tusk.plugins.ExtensionPoint;
import gov.sandia.tusk.plugins.Plugin;
import gov.sandia.tusk.plugins.extpoints.Export;
import gov.sandia.tusk.plugins.extpoints.Import;
import gov.sandia.tusk.transfer.ExportMEI;
import gov.sandia.tusk.transfer.ImportMEI;

/**
    Platform plug-in. Publishes the import and export contracts, and handles the
    canonical XML form itself.
**/
public class TuskPlugin extends Plugin
{
    private static TuskPlugin plugin;
    public static synchronized TuskPlugin getInstance ()
    {
        if (plugin == null) plugin = new TuskPlugin ();
        return plugin;
    }

    public TuskPlugin ()
    {
        plugin = this;
    }

    @Override
    public String getName ()
    {
        return "Tusk Notation Converter";
    }

    @Override
    public String getVersion ()
    {
        return "1.0";
    }

    @Override
    public String getProvider ()
    {
        return "Sandia National Laboratories";
    }

    @Override
    public ExtensionPoint[] getExtensions ()
    {
        return new ExtensionPoint[]
        {
            new ImportMEI (),
            new ExportMEI ()
        };
    }

    @Override
    @SuppressWarnings("unchecked")
    public Class<? extends ExtensionPoint>[] getExtensionPoints ()
    {
        return new Class[]
        {
            Export.class,
            Import.class
        };
    }
}
