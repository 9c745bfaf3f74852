/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond.music;

/**
    A generic visitor for Music.
**/
public class Visitor
{
    /**
        @return true to recurse below current node. false if further recursion below this node is not needed.
    **/
    public boolean visit (Music m)
    {
        return true;
    }
}
