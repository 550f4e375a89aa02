package io.sessioncast.exec;

/**
 * Outcome of one child process. {@code exitCode} is {@code -1} when the process timed out.
 */
public record CommandOutput(int exitCode, String stdout, String stderr, boolean timedOut) {
    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }
}
