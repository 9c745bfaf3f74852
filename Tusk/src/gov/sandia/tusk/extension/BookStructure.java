/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.extension;

import java.util.ArrayList;
import java.util.List;

import gov.sandia.tusk.db.MNode;

/**
    Position of a score inside \book and \bookpart blocks, and the output definitions
    that belong to those enclosing blocks.
**/
public class BookStructure implements Record
{
    public int             book     = -1;  // -1 means the score was not inside a \book
    public int             bookPart = -1;
    public int             score;
    public List<OutputDef> bookDefs = new ArrayList<OutputDef> ();
    public List<OutputDef> partDefs = new ArrayList<OutputDef> ();

    public void write (MNode node)
    {
        node.set (book,     "book");
        node.set (bookPart, "bookPart");
        node.set (score,    "score");
        for (OutputDef d : bookDefs) d.write (node.childOrCreate ("bookDefs").append (null));
        for (OutputDef d : partDefs) d.write (node.childOrCreate ("partDefs").append (null));
    }

    public static BookStructure read (MNode node)
    {
        BookStructure result = new BookStructure ();
        result.book     = node.getOrDefault (-1, "book");
        result.bookPart = node.getOrDefault (-1, "bookPart");
        result.score    = node.getInt ("score");
        for (MNode d : node.childOrEmpty ("bookDefs")) result.bookDefs.add (OutputDef.read (d));
        for (MNode d : node.childOrEmpty ("partDefs")) result.partDefs.add (OutputDef.read (d));
        return result;
    }

    @Override
    public boolean equals (Object o)
    {
        if (! (o instanceof BookStructure)) return false;
        BookStructure that = (BookStructure) o;
        return book == that.book  &&  bookPart == that.bookPart  &&  score == that.score  &&  bookDefs.equals (that.bookDefs)  &&  partDefs.equals (that.partDefs);
    }

    @Override
    public int hashCode ()
    {
        return (book * 31 + bookPart) * 31 + score;
    }
}
