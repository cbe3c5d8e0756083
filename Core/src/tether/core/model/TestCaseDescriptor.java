package tether.core.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import tether.core.util.ObjectChecker;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * The externally-visible description of a single test case.
 *
 * A descriptor is created once per test case and never changes afterwards. Its {@link TestCaseDescriptor#id} is
 * derived from the executor, the source and the fully qualified name, so the same test receives the same id on
 * every run.
 *
 * {@link TestCaseDescriptor#codeFilePath} is null and {@link TestCaseDescriptor#lineNumber} is zero when the test
 * has no known source location.
 */
public final class TestCaseDescriptor {
    public final UUID id;
    public final String displayName;
    public final String fullyQualifiedName;
    public final String source;
    public final String executorUri;
    public final String codeFilePath;
    public final int lineNumber;
    public final List<Trait> traits;

    private TestCaseDescriptor(String displayName, String fullyQualifiedName, String source, String executorUri, String codeFilePath, int lineNumber, List<Trait> traits) {
        this.id = UUID.nameUUIDFromBytes((executorUri + "|" + source + "|" + fullyQualifiedName).getBytes(StandardCharsets.UTF_8));
        this.displayName = displayName;
        this.fullyQualifiedName = fullyQualifiedName;
        this.source = source;
        this.executorUri = executorUri;
        this.codeFilePath = codeFilePath;
        this.lineNumber = lineNumber;
        this.traits = Collections.unmodifiableList(new ArrayList<>(traits));
    }

    /**
     * Returns true iff this descriptor carries a source location.
     *
     * @return whether a code file path is present.
     */
    public boolean hasLocation() {
        return this.codeFilePath != null;
    }

    /**
     * Converts the descriptor to a JSON object.
     *
     * @return the JSON object.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("id", this.id.toString());
        json.addProperty("display_name", this.displayName);
        json.addProperty("fully_qualified_name", this.fullyQualifiedName);
        json.addProperty("source", this.source);
        json.addProperty("executor_uri", this.executorUri);
        if (this.codeFilePath != null) {
            json.addProperty("code_file_path", this.codeFilePath);
            json.addProperty("line_number", this.lineNumber);
        }
        JsonArray traitsJson = new JsonArray();
        for (Trait trait : this.traits) {
            traitsJson.add(trait.toJson());
        }
        json.add("traits", traitsJson);
        return json;
    }

    /**
     * Converts the descriptor to a JSON-encoded string.
     *
     * @return the JSON string.
     */
    public String toJsonString() {
        return toJson().toString();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { name: " + this.fullyQualifiedName + (this.hasLocation() ? ", at: " + this.codeFilePath + ":" + this.lineNumber : ", [no location]") + " }";
    }

    public static final class Builder {
        private String displayName;
        private String fullyQualifiedName;
        private String source;
        private String executorUri;
        private NavigationData navigationData = NavigationData.INVALID;
        private List<Trait> traits = Collections.emptyList();

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder fullyQualifiedName(String fullyQualifiedName) {
            this.fullyQualifiedName = fullyQualifiedName;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder executorUri(String executorUri) {
            this.executorUri = executorUri;
            return this;
        }

        public Builder location(NavigationData navigationData) {
            ObjectChecker.assertNonNull(navigationData);
            this.navigationData = navigationData;
            return this;
        }

        public Builder traits(List<Trait> traits) {
            ObjectChecker.assertNonNull(traits);
            this.traits = traits;
            return this;
        }

        public TestCaseDescriptor build() {
            ObjectChecker.assertNonNull(this.displayName, this.fullyQualifiedName, this.source, this.executorUri);
            return this.navigationData.isValid
                    ? new TestCaseDescriptor(this.displayName, this.fullyQualifiedName, this.source, this.executorUri, this.navigationData.filePath, this.navigationData.lineNumber, this.traits)
                    : new TestCaseDescriptor(this.displayName, this.fullyQualifiedName, this.source, this.executorUri, null, 0, this.traits);
        }
    }
}
