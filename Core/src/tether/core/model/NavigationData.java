package tether.core.model;

import java.util.Objects;

/**
 * The source location of a test method, or {@link NavigationData#INVALID} when no location could be found.
 */
public final class NavigationData {
    public static final NavigationData INVALID = new NavigationData(false, null, 0);
    public final boolean isValid;
    public final String filePath;
    public final int lineNumber;

    private NavigationData(boolean isValid, String filePath, int lineNumber) {
        this.isValid = isValid;
        this.filePath = filePath;
        this.lineNumber = lineNumber;
    }

    public static NavigationData at(String filePath, int lineNumber) {
        if (filePath == null) {
            throw new NullPointerException("filePath must be non-null.");
        }
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be strictly positive but was: " + lineNumber);
        }
        return new NavigationData(true, filePath, lineNumber);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof NavigationData)) {
            return false;
        }
        NavigationData that = (NavigationData) other;
        return this.isValid == that.isValid && this.lineNumber == that.lineNumber && Objects.equals(this.filePath, that.filePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.isValid, this.filePath, this.lineNumber);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + (this.isValid ? " { " + this.filePath + ":" + this.lineNumber + " }" : " { [invalid] }");
    }
}
