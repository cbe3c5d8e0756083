package tether.core.exception;

/**
 * Thrown when a compiled assembly (a class directory or a jar) or the debug metadata of its classes cannot be read.
 */
public final class AssemblyLoadException extends Exception {

    public AssemblyLoadException(String message) {
        super(message);
    }

    public AssemblyLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
