/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import gov.sandia.tusk.db.MNode;

/**
    A store record that knows how to write itself. Each implementation also supplies
    a static read(MNode) method, which its Concept calls.
**/
public interface Record
{
    public void write (MNode node);
}
