package tether.core.sink;

import com.google.gson.JsonObject;
import tether.core.model.TestCaseDescriptor;
import tether.core.model.TestOutcome;
import tether.core.model.TestRunResult;
import tether.core.util.ObjectChecker;

import java.io.PrintWriter;
import java.io.Writer;

/**
 * Reports discovered tests and run progress as JSON, one object per line.
 *
 * Every object carries an "event" attribute naming what it reports: "test_case", "start", "end", "result" or
 * "message".
 */
public final class JsonLinesReporter implements DiscoverySink, FrameworkHandle {
    private static final String EVENT_KEY = "event";
    private final PrintWriter writer;

    private JsonLinesReporter(Writer writer) {
        ObjectChecker.assertNonNull(writer);
        this.writer = (writer instanceof PrintWriter) ? (PrintWriter) writer : new PrintWriter(writer);
    }

    public static JsonLinesReporter writingTo(Writer writer) {
        return new JsonLinesReporter(writer);
    }

    @Override
    public synchronized void sendTestCase(TestCaseDescriptor testCase) {
        ObjectChecker.assertNonNull(testCase);
        JsonObject json = testCase.toJson();
        json.addProperty(EVENT_KEY, "test_case");
        writeLine(json);
    }

    @Override
    public synchronized void recordStart(TestCaseDescriptor testCase) {
        ObjectChecker.assertNonNull(testCase);
        JsonObject json = new JsonObject();
        json.addProperty(EVENT_KEY, "start");
        json.addProperty("id", testCase.id.toString());
        json.addProperty("fully_qualified_name", testCase.fullyQualifiedName);
        writeLine(json);
    }

    @Override
    public synchronized void recordEnd(TestCaseDescriptor testCase, TestOutcome outcome) {
        ObjectChecker.assertNonNull(testCase, outcome);
        JsonObject json = new JsonObject();
        json.addProperty(EVENT_KEY, "end");
        json.addProperty("id", testCase.id.toString());
        json.addProperty("fully_qualified_name", testCase.fullyQualifiedName);
        json.addProperty("outcome", outcome.name());
        writeLine(json);
    }

    @Override
    public synchronized void recordResult(TestRunResult result) {
        ObjectChecker.assertNonNull(result);
        JsonObject json = result.toJson();
        json.addProperty(EVENT_KEY, "result");
        writeLine(json);
    }

    @Override
    public synchronized void sendMessage(MessageLevel level, String message) {
        ObjectChecker.assertNonNull(level, message);
        JsonObject json = new JsonObject();
        json.addProperty(EVENT_KEY, "message");
        json.addProperty("level", level.name());
        json.addProperty("text", message);
        writeLine(json);
    }

    private void writeLine(JsonObject json) {
        this.writer.println(json.toString());
        this.writer.flush();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName();
    }
}
