/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import gov.sandia.tusk.plugins.ExtensionPoint;
import gov.sandia.tusk.plugins.Plugin;

public class PluginLilyPond extends Plugin
{
    @Override
    public String getName ()
    {
        return "LilyPond Backend";
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
    public String getDescription ()
    {
        return "Imports and exports LilyPond source files, keeping what the canonical form can't hold in extension records.";
    }

    @Override
    public ExtensionPoint[] getExtensions ()
    {
        return new ExtensionPoint[]
        {
            new ImportLilyPond (),
            new ExportLilyPond ()
        };
    }
}
