package dev.astas.chapterdl.admission;

import dev.astas.chapterdl.store.CounterStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adaptive per-source concurrency control shared across worker processes. All state lives in the
 * {@link CounterStore} under four keys per source:
 *
 * <ul>
 *   <li>{@code dl_stats:<source>:success} and {@code dl_stats:<source>:error} - rolling outcome
 *       counters, halved now and then once they grow past {@value #DECAY_THRESHOLD}
 *   <li>{@code dl_limit:<source>} - the current ceiling, always within [{@value #MIN_LIMIT},
 *       {@value #MAX_LIMIT}] when written by this class
 *   <li>{@code dl_active:<source>} - slots currently checked out
 * </ul>
 *
 * <p>Each read and write is a separate store command. Two workers may both observe a free slot and
 * both take it, and concurrent limit adjustments are last-writer-wins. {@code active <= limit} is
 * therefore a target rather than a guarantee; it can also be exceeded right after the limit drops,
 * since holders are never pre-empted. The feedback loop corrects itself as slots drain.
 */
public class AdmissionController {
	private static final Logger logger = LoggerFactory.getLogger(AdmissionController.class);

	public static final int MIN_LIMIT = 1;
	public static final int MAX_LIMIT = 10;
	public static final int DEFAULT_LIMIT = 3;
	public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

	static final int MIN_SIGNAL = 10;
	static final int DECAY_THRESHOLD = 200;
	static final double DECAY_PROBABILITY = 0.1;
	static final double BACKOFF_ERROR_RATE = 0.30;
	static final double RAMP_UP_ERROR_RATE = 0.05;

	private static final String STATS_PREFIX = "dl_stats:";
	private static final String LIMIT_PREFIX = "dl_limit:";
	private static final String ACTIVE_PREFIX = "dl_active:";

	private final CounterStore store;
	private final int defaultLimit;
	private final Duration pollInterval;
	private final DoubleSupplier random;

	public AdmissionController(CounterStore store, int defaultLimit) {
		this(store, defaultLimit, DEFAULT_POLL_INTERVAL, () -> ThreadLocalRandom.current().nextDouble());
	}

	/**
	 * Create a new AdmissionController.
	 *
	 * @param store The shared store holding limits, counters and active slots
	 * @param defaultLimit Limit assumed for sources that have no stored limit yet
	 * @param pollInterval How long {@link #acquire} sleeps between polls for a free slot
	 * @param random Source of values in [0, 1) deciding when counter decay runs
	 */
	public AdmissionController(CounterStore store, int defaultLimit, Duration pollInterval, DoubleSupplier random) {
		if (defaultLimit < MIN_LIMIT || defaultLimit > MAX_LIMIT) {
			throw new IllegalArgumentException(
					"Default limit must be between " + MIN_LIMIT + " and " + MAX_LIMIT + ": " + defaultLimit);
		}
		this.store = store;
		this.defaultLimit = defaultLimit;
		this.pollInterval = pollInterval;
		this.random = random;
	}

	/**
	 * Block until a slot for {@code source} is free and take it. Waits indefinitely.
	 *
	 * @param source The source identifier
	 * @return The slot, to be closed exactly once when the work it admits is done
	 * @throws InterruptedException if interrupted while waiting
	 */
	public AdmissionSlot acquire(String source) throws InterruptedException {
		return acquire(source, null);
	}

	/**
	 * Block until a slot for {@code source} is free and take it. Polling gives no fairness: whichever
	 * waiter polls first after a release wins.
	 *
	 * @param source The source identifier
	 * @param maxWait Upper bound on the wait, or null to wait indefinitely
	 * @return The slot, to be closed exactly once when the work it admits is done
	 * @throws AdmissionTimeoutException if {@code maxWait} elapsed without a free slot
	 * @throws InterruptedException if interrupted while waiting
	 */
	public AdmissionSlot acquire(String source, Duration maxWait) throws InterruptedException {
		String key = normalize(source);
		long deadline = maxWait != null ? System.nanoTime() + maxWait.toNanos() : Long.MAX_VALUE;
		boolean logged = false;
		while (true) {
			long limit = limit(key);
			long active = activeSlots(key);
			if (active < limit) {
				store.increment(ACTIVE_PREFIX + key);
				logger.debug("Acquired slot for {} ({} active, limit {})", key, active + 1, limit);
				return new AdmissionSlot(this, key);
			}
			if (!logged) {
				logger.info("Waiting for a free slot for {} ({} active, limit {})", key, active, limit);
				logged = true;
			}
			if (maxWait != null && System.nanoTime() >= deadline) {
				throw new AdmissionTimeoutException(key, maxWait);
			}
			Thread.sleep(pollInterval.toMillis());
		}
	}

	/**
	 * Give back a slot. Prefer closing the {@link AdmissionSlot} returned by {@link #acquire}, which
	 * guarantees a single release.
	 *
	 * @param source The source identifier
	 */
	public void release(String source) {
		String key = normalize(source);
		long active = store.decrement(ACTIVE_PREFIX + key);
		logger.debug("Released slot for {} ({} active)", key, active);
	}

	/**
	 * Count the outcome of one asset download and let the limit react to it.
	 *
	 * @param source The source identifier
	 * @param success Whether the download succeeded
	 */
	public void recordOutcome(String source, boolean success) {
		String key = normalize(source);
		store.increment(STATS_PREFIX + key + (success ? ":success" : ":error"));

		if (random.getAsDouble() < DECAY_PROBABILITY) {
			decay(key);
		}
		adjustLimit(key);
	}

	private void decay(String key) {
		long success = successCount(key);
		long error = errorCount(key);
		if (success + error > DECAY_THRESHOLD) {
			store.set(STATS_PREFIX + key + ":success", Long.toString(success / 2));
			store.set(STATS_PREFIX + key + ":error", Long.toString(error / 2));
			logger.debug("Decayed counters for {} to {}/{}", key, success / 2, error / 2);
		}
	}

	/**
	 * Re-evaluate the limit of {@code source} from its counters. Additive increase below a 5% error
	 * rate, additive decrease above 30%, nothing in between or with fewer than 10 outcomes on record.
	 *
	 * @param source The source identifier
	 */
	public void adjustLimit(String source) {
		String key = normalize(source);
		long success = successCount(key);
		long error = errorCount(key);
		long total = success + error;
		if (total < MIN_SIGNAL) {
			return;
		}

		long current = limit(key);
		double rate = (double) error / total;
		if (rate > BACKOFF_ERROR_RATE && current > MIN_LIMIT) {
			long updated = current - 1;
			store.set(LIMIT_PREFIX + key, Long.toString(updated));
			logger.warn(
					"Backing off {}: error rate {}%, limit {} -> {}",
					key,
					Math.round(rate * 100),
					current,
					updated);
		} else if (rate < RAMP_UP_ERROR_RATE && current < MAX_LIMIT) {
			long updated = current + 1;
			store.set(LIMIT_PREFIX + key, Long.toString(updated));
			logger.info("Raising {} limit {} -> {}", key, current, updated);
		}
	}

	/** Current limit of a source, or the default limit if none has been stored yet */
	public long limit(String source) {
		return store.getLong(LIMIT_PREFIX + normalize(source), defaultLimit);
	}

	/** Number of slots currently checked out for a source */
	public long activeSlots(String source) {
		return store.getLong(ACTIVE_PREFIX + normalize(source), 0);
	}

	public long successCount(String source) {
		return store.getLong(STATS_PREFIX + normalize(source) + ":success", 0);
	}

	public long errorCount(String source) {
		return store.getLong(STATS_PREFIX + normalize(source) + ":error", 0);
	}

	/**
	 * Snapshot of a single source. Read without coordinating with in-flight jobs, so the fields may
	 * be mutually inconsistent by a few updates.
	 */
	public SourceStats stats(String source) {
		String key = normalize(source);
		return SourceStats.of(key, limit(key), successCount(key), errorCount(key));
	}

	/** Snapshot of every source with at least one recorded outcome, sorted by name */
	public List<SourceStats> allStats() {
		Set<String> sources = new TreeSet<>();
		for (String statsKey : store.keys(STATS_PREFIX + "*")) {
			int end = statsKey.lastIndexOf(':');
			if (end > STATS_PREFIX.length()) {
				sources.add(statsKey.substring(STATS_PREFIX.length(), end));
			}
		}
		List<SourceStats> result = new ArrayList<>();
		for (String source : sources) {
			result.add(stats(source));
		}
		return result;
	}

	static String normalize(String source) {
		return source.toLowerCase(Locale.ROOT);
	}
}
