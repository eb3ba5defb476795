package io.lapse4j.core;

/**
 * Immutable point-in-time view of a task, as exposed to pollers and progress streams.
 *
 * <p>{@code elapsed} and {@code eta} are seconds, {@code rate} is items per second. Numbers that are
 * not known yet are 0; {@code error} is only set for {@link TaskStatus#FAILED}.
 */
public record TaskSnapshot(
        String id,
        JobKind kind,
        String name,
        String subject,
        TaskStatus status,
        double progress,
        long current,
        long total,
        String message,
        double rate,
        double elapsed,
        double eta,
        String error
) {

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
