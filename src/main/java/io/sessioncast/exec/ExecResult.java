package io.sessioncast.exec;

/**
 * Result returned to remote callers. {@code duration} is wall time in milliseconds.
 */
public record ExecResult(int exitCode, String stdout, String stderr, long duration) {
    public static ExecResult failure(String stderr, long duration) {
        return new ExecResult(-1, "", stderr, duration);
    }
}
