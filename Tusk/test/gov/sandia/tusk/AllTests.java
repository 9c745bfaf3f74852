/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.junit.runners.Suite.SuiteClasses;

@RunWith(Suite.class)
@SuiteClasses({
    gov.sandia.tusk.db.AllTests.class,
    gov.sandia.tusk.extension.AllTests.class,
    gov.sandia.tusk.mei.AllTests.class,
    gov.sandia.tusk.plugins.AllTests.class
})

public class AllTests {}
