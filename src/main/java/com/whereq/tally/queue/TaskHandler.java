package com.whereq.tally.queue;

/**
 * Processes one delivered task. Returning completes the task, throwing fails it.
 * Throw {@link com.whereq.tally.exception.UnrecoverableTaskException} to skip the
 * remaining attempts.
 */
@FunctionalInterface
public interface TaskHandler {

    Object handle(QueueTask task) throws Exception;
}
