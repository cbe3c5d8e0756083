package tether.core.sink;

public enum MessageLevel {
    INFORMATIONAL,
    WARNING,
    ERROR
}
