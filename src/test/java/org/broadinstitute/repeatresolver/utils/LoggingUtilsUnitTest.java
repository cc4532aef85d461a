package org.broadinstitute.repeatresolver.utils;

import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.testng.Assert;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

public class LoggingUtilsUnitTest {

    @DataProvider(name = "levels")
    public Object[][] levels() {
        return new Object[][] {
                { Log.LogLevel.ERROR, Level.ERROR },
                { Log.LogLevel.WARNING, Level.WARN },
                { Log.LogLevel.INFO, Level.INFO },
                { Log.LogLevel.DEBUG, Level.DEBUG },
        };
    }

    @Test(dataProvider = "levels")
    public void testLevelMapping( final Log.LogLevel htsjdkLevel, final Level log4jLevel ) {
        Assert.assertEquals(LoggingUtils.levelToLog4jLevel(htsjdkLevel), log4jLevel);
        Assert.assertEquals(LoggingUtils.levelFromLog4jLevel(log4jLevel), htsjdkLevel);
    }

    @Test(dataProvider = "levels")
    public void testSetLoggingLevel( final Log.LogLevel htsjdkLevel, final Level log4jLevel ) {
        LoggingUtils.setLoggingLevel(htsjdkLevel);
        Assert.assertEquals(LogManager.getRootLogger().getLevel(), log4jLevel);
        Assert.assertTrue(Log.isEnabled(htsjdkLevel));
    }

    @AfterMethod
    public void restoreTestVerbosity() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }
}
