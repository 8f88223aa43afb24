package com.warden.security.store;

/**
 * Result of an increment that refuses to pass a limit.
 *
 * @param count    counter value after the call; unchanged when not accepted
 * @param accepted whether the increment was applied
 */
public record BoundedIncrement(long count, boolean accepted) {
}
