/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.plugins;

/**
    Marker for contracts that plugins may fulfill. An extension point is an interface
    that directly extends this one. An extension is an object implementing exactly one
    such interface.
**/
public interface ExtensionPoint
{
}
