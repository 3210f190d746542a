package io.vtascan.loader;

/**
 * Thrown when a program description cannot be read or does not describe a valid program.
 */
public class ProgramLoadException extends Exception {

    public ProgramLoadException(String message) {
        super(message);
    }

    public ProgramLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
