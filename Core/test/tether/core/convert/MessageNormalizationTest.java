package tether.core.convert;

import org.junit.Assert;
import org.junit.Test;
import tether.core.model.ResultState;

public class MessageNormalizationTest {
    private static final String EXPECTED = "  Expected string length 5 but was 6. Strings differ at index 5.";
    private static final String DIFF = "  Expected: \"hello\"\n  But was:  \"hello!\"";

    @Test
    public void testCaretLineIsRemovedForInteractiveFailure() {
        String message = EXPECTED + "\n" + DIFF + "\n  ----------------^\n";
        Assert.assertEquals(EXPECTED + "\n" + DIFF + "\n", OutcomeTranslator.normalizeMessage(message, ResultState.FAILURE, true));
    }

    @Test
    public void testCaretLineIsRemovedUnderEveryLineEnding() {
        for (String ending : new String[]{ "\n", "\r\n", "\r" }) {
            String message = "Values differ" + ending + "  -----^" + ending;
            Assert.assertEquals("Values differ" + ending, OutcomeTranslator.normalizeMessage(message, ResultState.FAILURE, true));
        }
    }

    @Test
    public void testCaretLineIsRemovedForInteractiveInconclusive() {
        String message = "Inconclusive\n^\n";
        Assert.assertEquals("Inconclusive\n", OutcomeTranslator.normalizeMessage(message, ResultState.INCONCLUSIVE, true));
    }

    @Test
    public void testMessageIsUnchangedForNonInteractiveHost() {
        String message = EXPECTED + "\n  -----^\n";
        Assert.assertEquals(message, OutcomeTranslator.normalizeMessage(message, ResultState.FAILURE, false));
    }

    @Test
    public void testMessageIsUnchangedForOtherStates() {
        String message = EXPECTED + "\n  -----^\n";
        for (ResultState state : ResultState.values()) {
            if (state == ResultState.FAILURE || state == ResultState.INCONCLUSIVE) {
                continue;
            }
            Assert.assertEquals(message, OutcomeTranslator.normalizeMessage(message, state, true));
        }
    }

    @Test
    public void testMessageWithoutCaretIsUnchanged() {
        Assert.assertEquals(EXPECTED, OutcomeTranslator.normalizeMessage(EXPECTED, ResultState.FAILURE, true));
    }

    @Test
    public void testNullMessage() {
        Assert.assertNull(OutcomeTranslator.normalizeMessage(null, ResultState.FAILURE, true));
    }
}
