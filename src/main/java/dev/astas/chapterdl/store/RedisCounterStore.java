package dev.astas.chapterdl.store;

import java.net.URI;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

/** {@link CounterStore} backed by Redis, shared by every worker pointing at the same server */
public class RedisCounterStore implements CounterStore {
	private static final Logger logger = LoggerFactory.getLogger(RedisCounterStore.class);

	private static final int SCAN_BATCH = 500;

	private final JedisPooled jedis;

	/**
	 * Connect to a Redis server.
	 *
	 * @param redisUrl URL such as {@code redis://host:6379/0}
	 */
	public RedisCounterStore(String redisUrl) {
		this(new JedisPooled(URI.create(redisUrl)));
		logger.info("Using Redis counter store at {}", URI.create(redisUrl).getHost());
	}

	RedisCounterStore(JedisPooled jedis) {
		this.jedis = jedis;
	}

	@Override
	public long increment(String key) {
		return jedis.incr(key);
	}

	@Override
	public long decrement(String key) {
		return jedis.decr(key);
	}

	@Override
	public String get(String key) {
		return jedis.get(key);
	}

	@Override
	public void set(String key, String value) {
		jedis.set(key, value);
	}

	@Override
	public String blockingPop(String queue, Duration timeout) throws InterruptedException {
		List<String> result = jedis.blpop(popTimeoutSeconds(timeout), queue);
		if (Thread.interrupted()) {
			throw new InterruptedException("Interrupted while waiting on " + queue);
		}
		return poppedValue(result);
	}

	/** BLPOP takes whole seconds and treats 0 as "forever", so round up to at least one */
	static int popTimeoutSeconds(Duration timeout) {
		long millis = Math.max(0, timeout.toMillis());
		long seconds = (millis + 999) / 1000;
		return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
	}

	/** BLPOP answers [key, value], or nothing on timeout */
	static String poppedValue(List<String> result) {
		return result != null && result.size() == 2 ? result.get(1) : null;
	}

	@Override
	public void push(String queue, String value) {
		jedis.rpush(queue, value);
	}

	/** Uses SCAN rather than KEYS so large keyspaces do not block the server */
	@Override
	public Set<String> keys(String pattern) {
		return scanAll(jedis::scan, pattern);
	}

	static Set<String> scanAll(BiFunction<String, ScanParams, ScanResult<String>> scanner, String pattern) {
		ScanParams params = new ScanParams().match(pattern).count(SCAN_BATCH);
		Set<String> keys = new HashSet<>();
		String cursor = ScanParams.SCAN_POINTER_START;
		do {
			ScanResult<String> page = scanner.apply(cursor, params);
			keys.addAll(page.getResult());
			cursor = page.getCursor();
		} while (!ScanParams.SCAN_POINTER_START.equals(cursor));
		return keys;
	}

	@Override
	public void close() {
		jedis.close();
	}
}
