package io.lintsignal.fix;

/**
 * Thrown when applying fixes does not converge, typically because two fixes undo each other.
 */
public class FixLoopException extends Exception {

    private final int iterations;

    public FixLoopException(String message, int iterations) {
        super(message);
        this.iterations = iterations;
    }

    public int iterations() {
        return iterations;
    }
}
