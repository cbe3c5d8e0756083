package tether.core.config;

import java.io.File;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The settings a discovery or execution session runs with.
 *
 * {@link AdapterConfig#executorUri}: the URI identifying this executor to the external runner.
 * {@link AdapterConfig#testClassMatcher}: the pattern a class file name must match to be treated as a test class.
 * {@link AdapterConfig#sourceRoots}: the directories searched for source documents, in order.
 * {@link AdapterConfig#interactiveHost}: whether results are reported to an interactive host, such as an IDE.
 * {@link AdapterConfig#enableLogger}: whether internal logging is enabled.
 */
public final class AdapterConfig {
    public static final String DEFAULT_EXECUTOR_URI = "executor://tether/junit4";
    public static final String DEFAULT_MATCHER = ".*Test\\.class";
    static final String EXECUTOR_URI_PROPERTY = "executor_uri";
    static final String MATCHER_PROPERTY = "matcher";
    static final String SOURCE_ROOTS_PROPERTY = "source_roots";
    static final String INTERACTIVE_HOST_PROPERTY = "interactive_host";
    static final String ENABLE_LOGGER_PROPERTY = "enable_logger";
    public final String executorUri;
    public final Pattern testClassMatcher;
    public final List<Path> sourceRoots;
    public final boolean interactiveHost;
    public final boolean enableLogger;

    private AdapterConfig(String executorUri, Pattern testClassMatcher, List<Path> sourceRoots, boolean interactiveHost, boolean enableLogger) {
        this.executorUri = executorUri;
        this.testClassMatcher = testClassMatcher;
        this.sourceRoots = Collections.unmodifiableList(new ArrayList<>(sourceRoots));
        this.interactiveHost = interactiveHost;
        this.enableLogger = enableLogger;
    }

    /**
     * Returns the configuration given by the system properties. See {@link AdapterConfig#fromProperties(Properties)}.
     *
     * @return the configuration.
     */
    public static AdapterConfig fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /**
     * Returns the configuration given by the following properties, each of which is optional:
     *
     * executor_uri = the executor URI (default {@value #DEFAULT_EXECUTOR_URI})
     * matcher = a regular expression over class file names (default {@value #DEFAULT_MATCHER})
     * source_roots = source directories separated by the platform path separator (default none)
     * interactive_host = true or false (default false)
     * enable_logger = true or false (default true)
     *
     * @param properties The properties.
     * @return the configuration.
     * @throws IllegalArgumentException If the matcher is not a valid regular expression.
     */
    public static AdapterConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new NullPointerException("properties must be non-null.");
        }

        Builder builder = Builder.newBuilder()
                .setExecutorUri(properties.getProperty(EXECUTOR_URI_PROPERTY, DEFAULT_EXECUTOR_URI))
                .setTestClassMatcher(properties.getProperty(MATCHER_PROPERTY, DEFAULT_MATCHER))
                .setWhetherHostIsInteractive(Boolean.parseBoolean(properties.getProperty(INTERACTIVE_HOST_PROPERTY, "false")))
                .setWhetherToEnableLogger(Boolean.parseBoolean(properties.getProperty(ENABLE_LOGGER_PROPERTY, "true")));

        String sourceRoots = properties.getProperty(SOURCE_ROOTS_PROPERTY);
        List<Path> roots = new ArrayList<>();
        if (sourceRoots != null) {
            for (String root : sourceRoots.split(Pattern.quote(File.pathSeparator))) {
                if (!root.trim().isEmpty()) {
                    roots.add(Paths.get(root.trim()));
                }
            }
        }
        return builder.setSourceRoots(roots).build();
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { executor: " + this.executorUri
                + ", matcher: " + this.testClassMatcher.pattern()
                + ", source roots: " + this.sourceRoots
                + ", " + (this.interactiveHost ? "[interactive]" : "[non-interactive]")
                + ", " + (this.enableLogger ? "[logging]" : "[no logging]") + " }";
    }

    public static class Builder {
        private String executorUri;
        private Pattern testClassMatcher;
        private List<Path> sourceRoots;
        private Boolean interactiveHost;
        private Boolean enableLogger;

        public static Builder newBuilder() {
            return new Builder();
        }

        public Builder setExecutorUri(String executorUri) {
            if (this.executorUri != null) {
                throw new IllegalStateException("executor uri is already set.");
            }
            this.executorUri = executorUri;
            return this;
        }

        public Builder setTestClassMatcher(String regex) {
            if (this.testClassMatcher != null) {
                throw new IllegalStateException("test class matcher is already set.");
            }
            if (regex == null) {
                throw new NullPointerException("regex must be non-null.");
            }
            try {
                this.testClassMatcher = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid test class matcher: " + regex, e);
            }
            return this;
        }

        public Builder setSourceRoots(List<Path> sourceRoots) {
            if (this.sourceRoots != null) {
                throw new IllegalStateException("source roots are already set.");
            }
            this.sourceRoots = sourceRoots;
            return this;
        }

        public Builder setWhetherHostIsInteractive(boolean interactiveHost) {
            if (this.interactiveHost != null) {
                throw new IllegalStateException("interactive host decision is already set.");
            }
            this.interactiveHost = interactiveHost;
            return this;
        }

        public Builder setWhetherToEnableLogger(boolean enableLogger) {
            if (this.enableLogger != null) {
                throw new IllegalStateException("enable logger decision is already set.");
            }
            this.enableLogger = enableLogger;
            return this;
        }

        /**
         * Builds the configuration. Settings that were never set take their defaults.
         *
         * @return the configuration.
         */
        public AdapterConfig build() {
            return new AdapterConfig(
                    this.executorUri == null ? DEFAULT_EXECUTOR_URI : this.executorUri,
                    this.testClassMatcher == null ? Pattern.compile(DEFAULT_MATCHER) : this.testClassMatcher,
                    this.sourceRoots == null ? Collections.emptyList() : this.sourceRoots,
                    this.interactiveHost != null && this.interactiveHost,
                    this.enableLogger == null || this.enableLogger);
        }
    }
}
