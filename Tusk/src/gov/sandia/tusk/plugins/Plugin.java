/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.plugins;

/**
    A plug-in's ID is its fully-qualified class name.
**/
public abstract class Plugin
{
    /**
        Display name. This name can change as desired.
    **/
    public abstract String getName ();

    /**
        Version in the form major.minor.service. The major segment should be incremented
        when the plug-in's API changes.
    **/
    public String getVersion ()
    {
        return "0.0.1";
    }

    public String getProvider ()
    {
        return null;
    }

    public String getDescription ()
    {
        return null;
    }

    /**
        @return Extension point interfaces published by this plugin, or null if none.
    **/
    public Class<? extends ExtensionPoint>[] getExtensionPoints ()
    {
        return null;
    }

    /**
        @return Extensions provided by this plugin, or null if none.
    **/
    public ExtensionPoint[] getExtensions ()
    {
        return null;
    }

    /**
        Called after all the plug-ins have been loaded.
    **/
    public void start ()
    {
    }
}
