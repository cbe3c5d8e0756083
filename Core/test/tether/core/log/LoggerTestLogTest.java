package tether.core.log;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;
import tether.core.helper.AssertHelper;
import tether.core.util.Logger;

public class LoggerTestLogTest {

    @After
    public void teardown() {
        Logger.globalEnable();
    }

    @Test
    public void testMessagesAreAcceptedWhileLoggingIsDisabled() {
        Logger.globalDisable();
        Assert.assertFalse(Logger.isGlobalEnabled());

        TestLog testLog = LoggerTestLog.forClass(LoggerTestLogTest.class);
        testLog.sendErrorMessage("error");
        testLog.sendErrorMessage("error with cause", new IllegalStateException("cause"));
        testLog.sendWarningMessage("warning");
        testLog.sendDebugMessage("debug");
    }

    @Test
    public void testErrorCauseMustBeNonNull() {
        TestLog testLog = LoggerTestLog.forClass(LoggerTestLogTest.class);
        AssertHelper.assertThrows(NullPointerException.class, () -> testLog.sendErrorMessage("error", null));
    }
}
