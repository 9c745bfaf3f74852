/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.plugins.extpoints;

import java.nio.file.Path;

import gov.sandia.tusk.mei.MEIDocument;
import gov.sandia.tusk.plugins.ExtensionPoint;

public interface Export extends ExtensionPoint
{
    public String  getName ();
    public void    process (MEIDocument document, Path destination) throws Exception;
    public boolean accept  (Path destination);  // Lightweight test, for example examining only the suffix.
}
