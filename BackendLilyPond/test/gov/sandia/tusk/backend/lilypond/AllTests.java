/*
Copyright 2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.tusk.backend.lilypond;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.junit.runners.Suite.SuiteClasses;

@RunWith(Suite.class)
@SuiteClasses({
    LexerTest.class,
    ParserTest.class,
    DurationsTest.class,
    PitchStateTest.class,
    SymbolsTest.class,
    ImportJobTest.class,
    ExportJobTest.class,
    PluginLilyPondTest.class,
    ValidatorTest.class,
    gov.sandia.tusk.backend.lilypond.music.AllTests.class
})

public class AllTests {}
