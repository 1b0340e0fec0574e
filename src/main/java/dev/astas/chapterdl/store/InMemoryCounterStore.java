package dev.astas.chapterdl.store;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * {@link CounterStore} kept in process memory. Only coordinates threads within a single JVM, so it
 * is meant for tests and single-worker setups.
 */
public class InMemoryCounterStore implements CounterStore {
	private final ConcurrentHashMap<String, String> values = new ConcurrentHashMap<>();
	private final ConcurrentHashMap<String, BlockingDeque<String>> queues = new ConcurrentHashMap<>();

	@Override
	public long increment(String key) {
		return add(key, 1);
	}

	@Override
	public long decrement(String key) {
		return add(key, -1);
	}

	private long add(String key, long delta) {
		String result = values.merge(
				key, Long.toString(delta), (old, d) -> Long.toString(Long.parseLong(old) + Long.parseLong(d)));
		return Long.parseLong(result);
	}

	@Override
	public String get(String key) {
		return values.get(key);
	}

	@Override
	public void set(String key, String value) {
		values.put(key, value);
	}

	@Override
	public String blockingPop(String queue, Duration timeout) throws InterruptedException {
		return queue(queue).pollFirst(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	@Override
	public void push(String queue, String value) {
		queue(queue).offerLast(value);
	}

	@Override
	public Set<String> keys(String pattern) {
		Pattern regex = globToRegex(pattern);
		return values.keySet().stream()
				.filter(key -> regex.matcher(key).matches())
				.collect(Collectors.toSet());
	}

	/** Snapshot of the elements currently held in a list, head first */
	public List<String> list(String queue) {
		return List.copyOf(queue(queue));
	}

	@Override
	public void close() {
		values.clear();
		queues.clear();
	}

	private BlockingDeque<String> queue(String name) {
		return queues.computeIfAbsent(name, k -> new LinkedBlockingDeque<>());
	}

	private static Pattern globToRegex(String glob) {
		String regex = Arrays.stream(glob.split("\\*", -1))
				.map(Pattern::quote)
				.collect(Collectors.joining(".*"));
		return Pattern.compile(regex);
	}
}
