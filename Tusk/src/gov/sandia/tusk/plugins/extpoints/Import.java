/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.plugins.extpoints;

import java.nio.file.Path;

import gov.sandia.tusk.mei.MEIDocument;
import gov.sandia.tusk.plugins.ExtensionPoint;

public interface Import extends ExtensionPoint
{
    public String      getName ();
    public MEIDocument process (Path source) throws Exception;  // The document carries its own extension store.
    public float       matches (Path source);  // @return The probability that the file contains this format.
    public boolean     accept  (Path source);  // Lightweight test, for example examining only the suffix.
}
