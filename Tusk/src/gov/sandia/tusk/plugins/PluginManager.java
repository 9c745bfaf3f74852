/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.plugins;

import java.lang.reflect.Constructor;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

import org.apache.log4j.Logger;

import gov.sandia.tusk.plugins.extpoints.Export;
import gov.sandia.tusk.plugins.extpoints.Import;

/**
    A small plug-in framework. A plug-in is any subclass of Plugin. It declares the
    extension points it publishes (interfaces that directly extend ExtensionPoint) and
    the extensions it provides (objects implementing exactly one such interface).
    Plug-ins are found through ServiceLoader, or named explicitly by class.
**/
public class PluginManager
{
    protected static Map<String, Plugin>                          globalPlugins   = new LinkedHashMap<String, Plugin> ();                           // maps plugin name to instance
    protected static Map<String, Class<? extends ExtensionPoint>> globalExtPoints = new LinkedHashMap<String, Class<? extends ExtensionPoint>> ();  // maps full class name to class
    protected static Map<String, ExtensionPoint>                  globalExts      = new LinkedHashMap<String, ExtensionPoint> ();                   // maps full class name to instance
    protected static Map<String, List<ExtensionPoint>>            ownedExtPointExts = new LinkedHashMap<String, List<ExtensionPoint>> ();

    private static Logger logger = Logger.getLogger (PluginManager.class);

    public static Plugin getPluginById (String pluginId)
    {
        return globalPlugins.get (pluginId);
    }

    public static Class<? extends ExtensionPoint> getExtensionPointById (String extPointId)
    {
        return globalExtPoints.get (extPointId);
    }

    public static ExtensionPoint getExtensionById (String extId)
    {
        return globalExts.get (extId);
    }

    public static String getExtensionPointId (Class<? extends ExtensionPoint> extPoint)
    {
        return extPoint.getName ();
    }

    public static List<ExtensionPoint> getExtensionsForPoint (Class<? extends ExtensionPoint> extPoint)
    {
        List<ExtensionPoint> exts = ownedExtPointExts.get (getExtensionPointId (extPoint));
        if (exts == null) return new ArrayList<ExtensionPoint> ();
        return new ArrayList<ExtensionPoint> (exts);
    }

    /**
        Loads the platform plug-in, then anything registered through ServiceLoader,
        then the explicitly named classes. Failures are logged and skipped, so one broken
        plug-in does not prevent the others from loading.
    **/
    public static synchronized void initialize (Plugin platformPlugin, List<String> loadFromMemByName)
    {
        if (platformPlugin != null  &&  getPluginById (platformPlugin.getClass ().getName ()) == null)
        {
            try
            {
                load (platformPlugin);
            }
            catch (Exception e)
            {
                logger.error ("Error loading platform", e);
            }
        }

        ServiceLoader<Plugin> loader = ServiceLoader.load (Plugin.class);
        Iterator<Plugin> pit = loader.iterator ();
        while (pit.hasNext ())
        {
            Plugin p = pit.next ();
            if (getPluginById (p.getClass ().getName ()) != null) continue;
            try
            {
                load (p);
            }
            catch (Exception e)
            {
                logger.error ("Error loading SPI-provided plugin: " + p.getClass ().getName (), e);
            }
        }

        if (loadFromMemByName != null)
        {
            for (String className : loadFromMemByName)
            {
                if (getPluginById (className) != null) continue;
                try
                {
                    loadFromMemoryByName (className);
                }
                catch (Exception e)
                {
                    logger.error ("Error loading named plugin: " + className, e);
                }
            }
        }

        try
        {
            validateExtPoints ();
        }
        catch (Exception e)
        {
            logger.error ("Error validating extension points", e);
        }

        for (Plugin plugin : globalPlugins.values ()) plugin.start ();
    }

    public static void loadFromMemoryByName (String pluginClassName) throws Exception
    {
        Plugin plugin;
        try
        {
            Class<?> pluginClass = Class.forName (pluginClassName);
            Constructor<?> ctor = pluginClass.getConstructor (new Class<?>[0]);
            plugin = (Plugin) ctor.newInstance (new Object[0]);
        }
        catch (ClassNotFoundException e)
        {
            throw new Exception ("Could not find plug-in class '" + pluginClassName + "'.", e);
        }
        catch (NoSuchMethodException e)
        {
            throw new Exception ("Plug-in class '" + pluginClassName + "' does not have a default constructor.", e);
        }
        catch (ClassCastException e)
        {
            throw new Exception ("Plug-in class '" + pluginClassName + "' does not implement '" + Plugin.class.getName () + "'.", e);
        }
        load (plugin);
    }

    public static synchronized void load (Plugin plugin) throws Exception
    {
        String pluginId = plugin.getClass ().getName ();
        if (getPluginById (pluginId) != null)
        {
            throw new Exception ("A plug-in with the ID '" + pluginId + "' has already been loaded.");
        }
        if (plugin.getName ().isEmpty ()  ||  plugin.getVersion ().isEmpty ())
        {
            throw new Exception ("Plug-in '" + pluginId + "' contains invalid values for name or version.");
        }

        List<Class<? extends ExtensionPoint>> myExtPoints = new ArrayList<Class<? extends ExtensionPoint>> ();
        Class<? extends ExtensionPoint>[] eps = plugin.getExtensionPoints ();
        if (eps != null)
        {
            for (Class<? extends ExtensionPoint> ep : eps)
            {
                Class<? extends ExtensionPoint> found = findOneExtPointClass (ep, true);
                if (getExtensionPointById (getExtensionPointId (found)) != null)
                {
                    throw new Exception ("An extension point with the ID '" + getExtensionPointId (found) + "' has already been loaded.");
                }
                myExtPoints.add (found);
            }
        }

        List<ExtensionPoint> myExts = new ArrayList<ExtensionPoint> ();
        ExtensionPoint[] es = plugin.getExtensions ();
        if (es != null)
        {
            for (ExtensionPoint e : es)
            {
                findOneExtPointClass (e.getClass (), false);
                String extId = e.getClass ().getName ();
                if (getExtensionById (extId) != null)
                {
                    throw new Exception ("An extension with the ID '" + extId + "' has already been loaded.");
                }
                myExts.add (e);
            }
        }

        globalPlugins.put (pluginId, plugin);
        for (Class<? extends ExtensionPoint> extPoint : myExtPoints)
        {
            globalExtPoints.put (getExtensionPointId (extPoint), extPoint);
            getOwnedExtPointExts (extPoint);
        }
        for (ExtensionPoint ext : myExts)
        {
            globalExts.put (ext.getClass ().getName (), ext);
            getOwnedExtPointExts (findOneExtPointClass (ext.getClass (), false)).add (ext);
        }
        logger.info ("Loaded plugin " + plugin.getName () + " " + plugin.getVersion ());
    }

    protected static List<ExtensionPoint> getOwnedExtPointExts (Class<? extends ExtensionPoint> extPoint)
    {
        String extPointId = getExtensionPointId (extPoint);
        List<ExtensionPoint> result = ownedExtPointExts.get (extPointId);
        if (result == null)
        {
            result = new ArrayList<ExtensionPoint> ();
            ownedExtPointExts.put (extPointId, result);
        }
        return result;
    }

    public static void validateExtPoints () throws Exception
    {
        for (String extPointId : ownedExtPointExts.keySet ())
        {
            if (globalExtPoints.containsKey (extPointId)) continue;
            List<String> names = new ArrayList<String> ();
            for (ExtensionPoint ext : ownedExtPointExts.get (extPointId)) names.add (ext.getClass ().getName ());
            throw new Exception ("The extension point '" + extPointId + "' has not been declared by any plug-in, but it is used by extension classes: " + String.join (", ", names));
        }
    }

    /**
        Determines which extension point the given class belongs to.
        This is defined as an immediate descendant of ExtensionPoint.
    **/
    protected static Class<? extends ExtensionPoint> findOneExtPointClass (Class<? extends ExtensionPoint> clazz, boolean isExtPoint) throws Exception
    {
        String objName    = isExtPoint ? "extension point" : "extension";
        String actionName = isExtPoint ? "extend"          : "implement";

        List<Class<? extends ExtensionPoint>> found = new ArrayList<Class<? extends ExtensionPoint>> ();
        findExtPoints (clazz, found);
        if (found.size () == 0)
        {
            throw new Exception ("The " + objName + " class '" + clazz.getName () + "' does not " + actionName + " any extension point interface.");
        }
        if (found.size () > 1)
        {
            throw new Exception ("The " + objName + " class '" + clazz.getName () + "' " + actionName + "s more than one extension point interface " + found + ".");
        }
        return found.get (0);
    }

    @SuppressWarnings("unchecked")
    protected static void findExtPoints (Class<?> clazz, List<Class<? extends ExtensionPoint>> result)
    {
        Class<?> clazzParent = clazz.getSuperclass ();
        if (clazzParent != null)
        {
            if (clazzParent.equals (ExtensionPoint.class)) result.add ((Class<? extends ExtensionPoint>) clazz);
            else                                            findExtPoints (clazzParent, result);
        }

        for (Class<?> impl : clazz.getInterfaces ())
        {
            if (impl.equals (ExtensionPoint.class))
            {
                if (! result.contains (clazz)) result.add ((Class<? extends ExtensionPoint>) clazz);
            }
            else
            {
                findExtPoints (impl, result);
            }
        }
    }

    // Format dispatch ----------------------------------------------------

    /**
        Picks the importer that claims the file with the highest probability.
        @return null if no importer claims it.
    **/
    public static Import findImporter (Path source)
    {
        Import best = null;
        float bestScore = 0;
        for (ExtensionPoint ext : getExtensionsForPoint (Import.class))
        {
            Import i = (Import) ext;
            if (! i.accept (source)) continue;
            float score = i.matches (source);
            if (score > bestScore)
            {
                best      = i;
                bestScore = score;
            }
        }
        return best;
    }

    /**
        @return The first exporter that accepts the destination, or null.
    **/
    public static Export findExporter (Path destination)
    {
        for (ExtensionPoint ext : getExtensionsForPoint (Export.class))
        {
            Export e = (Export) ext;
            if (e.accept (destination)) return e;
        }
        return null;
    }
}
