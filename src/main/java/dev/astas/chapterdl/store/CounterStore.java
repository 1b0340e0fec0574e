package dev.astas.chapterdl.store;

import java.time.Duration;
import java.util.Set;

/**
 * Narrow view of the shared key-value store that carries all state crossing worker process
 * boundaries. Every operation is a single atomic store command; no multi-key transactions are
 * offered, so invariants spanning several keys are best-effort only.
 */
public interface CounterStore extends AutoCloseable {

	/**
	 * Atomically increment an integer value, treating a missing key as 0.
	 *
	 * @param key The key to increment
	 * @return The value after the increment
	 */
	long increment(String key);

	/**
	 * Atomically decrement an integer value, treating a missing key as 0.
	 *
	 * @param key The key to decrement
	 * @return The value after the decrement
	 */
	long decrement(String key);

	/**
	 * Read a value.
	 *
	 * @param key The key to read
	 * @return The stored value, or null if the key does not exist
	 */
	String get(String key);

	/**
	 * Unconditionally overwrite a value.
	 *
	 * @param key The key to write
	 * @param value The new value
	 */
	void set(String key, String value);

	/**
	 * Pop the head of a list, waiting up to {@code timeout} for an element to arrive.
	 *
	 * @param queue The list key
	 * @param timeout Maximum time to wait
	 * @return The popped element, or null if the wait timed out
	 * @throws InterruptedException if interrupted while waiting
	 */
	String blockingPop(String queue, Duration timeout) throws InterruptedException;

	/**
	 * Append an element to the tail of a list.
	 *
	 * @param queue The list key
	 * @param value The element to append
	 */
	void push(String queue, String value);

	/**
	 * Find keys matching a glob-style pattern where {@code *} matches any run of characters.
	 *
	 * @param pattern The pattern to match
	 * @return The matching keys, in no particular order
	 */
	Set<String> keys(String pattern);

	/** Read an integer value, falling back to {@code defaultValue} when the key is absent */
	default long getLong(String key, long defaultValue) {
		String value = get(key);
		return value != null ? Long.parseLong(value) : defaultValue;
	}

	@Override
	void close();
}
