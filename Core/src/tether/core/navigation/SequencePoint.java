package tether.core.navigation;

/**
 * A debug-symbol record mapping a run of compiled instructions to a line of a source document.
 */
public final class SequencePoint {
    /**
     * The start line that marks a sequence point as hidden, meaning it must not be shown as source-mapped.
     */
    public static final int HIDDEN_LINE = 0xFEEFEE;
    public final String documentPath;
    public final int startLine;

    public SequencePoint(String documentPath, int startLine) {
        if (documentPath == null) {
            throw new NullPointerException("documentPath must be non-null.");
        }
        this.documentPath = documentPath;
        this.startLine = startLine;
    }

    public boolean isHidden() {
        return this.startLine == HIDDEN_LINE;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { " + this.documentPath + ":" + (isHidden() ? "[hidden]" : this.startLine) + " }";
    }
}
