package dev.astas.chapterdl.download;

import dev.astas.chapterdl.admission.AdmissionController;
import dev.astas.chapterdl.util.HttpUtils;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of a download worker.
 *
 * @param outputDir Directory relative job destinations are resolved against
 * @param defaultLimit Per-source concurrency limit assumed before the controller has adjusted it
 * @param fanoutLimit Concurrent fetches per job when the job does not specify its own
 * @param requestTimeout Connect and response-header timeout of a single HTTP request
 * @param retryCount Extra attempts per asset after a failed one
 * @param retryDelay Backoff before the first retry, doubled for every further one
 * @param acquireTimeout Longest wait for an admission slot, or null to wait indefinitely
 * @param userAgent User-Agent header sent to upstream sources
 */
public record DownloaderConfig(
		Path outputDir,
		int defaultLimit,
		int fanoutLimit,
		Duration requestTimeout,
		int retryCount,
		Duration retryDelay,
		Duration acquireTimeout,
		String userAgent) {

	public static final int DEFAULT_FANOUT_LIMIT = 8;

	public DownloaderConfig {
		if (outputDir == null) {
			throw new IllegalArgumentException("Output directory is required");
		}
		defaultLimit = Math.max(AdmissionController.MIN_LIMIT, Math.min(AdmissionController.MAX_LIMIT, defaultLimit));
		if (fanoutLimit < 1) {
			throw new IllegalArgumentException("Fan-out limit must be at least 1: " + fanoutLimit);
		}
		if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
			throw new IllegalArgumentException("Request timeout must be positive: " + requestTimeout);
		}
		if (retryCount < 0) {
			throw new IllegalArgumentException("Retry count cannot be negative: " + retryCount);
		}
		if (acquireTimeout != null && (acquireTimeout.isNegative() || acquireTimeout.isZero())) {
			acquireTimeout = null;
		}
	}

	/** Configuration with every value at its default, writing below {@code outputDir} */
	public static DownloaderConfig defaults(Path outputDir) {
		return new DownloaderConfig(
				outputDir,
				AdmissionController.DEFAULT_LIMIT,
				DEFAULT_FANOUT_LIMIT,
				Duration.ofSeconds(30),
				0,
				Duration.ofSeconds(2),
				null,
				HttpUtils.DEFAULT_USER_AGENT);
	}
}
