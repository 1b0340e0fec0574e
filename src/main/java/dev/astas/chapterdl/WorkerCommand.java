package dev.astas.chapterdl;

import dev.astas.chapterdl.admission.AdmissionController;
import dev.astas.chapterdl.download.ChapterDownloader;
import dev.astas.chapterdl.download.DownloaderConfig;
import dev.astas.chapterdl.download.HttpAssetFetcher;
import dev.astas.chapterdl.queue.JobCodec;
import dev.astas.chapterdl.queue.JobQueueConsumer;
import dev.astas.chapterdl.source.SourceResolver;
import dev.astas.chapterdl.store.CounterStore;
import dev.astas.chapterdl.store.RedisCounterStore;
import dev.astas.chapterdl.util.HttpUtils;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Worker command consuming chapter jobs until the process is terminated */
@Command(
		name = "worker",
		description = "Consume chapter jobs from the shared queue and download their images",
		mixinStandardHelpOptions = true)
public class WorkerCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");
	private static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(2);

	@Option(
			names = {"--redis-url"},
			description = "Redis server holding the queue and counters (env REDIS_URL, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:REDIS_URL:-redis://localhost:6379/0}")
	private String redisUrl;

	@Option(
			names = {"-q", "--queue"},
			description = "Name of the job queue (env DL_QUEUE, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:DL_QUEUE:-download_jobs}")
	private String queue;

	@Option(
			names = {"-o", "--output-dir"},
			description = "Directory relative job destinations are placed in (env DOWNLOAD_DIR, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:DOWNLOAD_DIR:-./downloads}")
	private Path outputDir;

	@Option(
			names = {"--default-limit"},
			description = "Concurrent jobs per source before any adjustment, 1-10 (env DL_GLOBAL_LIMIT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:DL_GLOBAL_LIMIT:-3}")
	private int defaultLimit;

	@Option(
			names = {"--fanout"},
			description = "Concurrent image downloads per job (env DL_FANOUT_LIMIT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:DL_FANOUT_LIMIT:-8}")
	private int fanout;

	@Option(
			names = {"--request-timeout"},
			description = "Timeout of a single request in seconds (env DL_REQUEST_TIMEOUT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:DL_REQUEST_TIMEOUT:-30}")
	private int requestTimeoutSeconds;

	@Option(
			names = {"--retry-count"},
			description = "Extra attempts for a failed image download (env RETRY_COUNT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:RETRY_COUNT:-0}")
	private int retryCount;

	@Option(
			names = {"--retry-delay"},
			description = "Seconds before the first retry, doubled for each further one (env RETRY_DELAY, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:RETRY_DELAY:-2}")
	private double retryDelaySeconds;

	@Option(
			names = {"--acquire-timeout"},
			description = "Seconds to wait for a source slot before requeueing a job, 0 waits forever (env DL_ACQUIRE_TIMEOUT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:DL_ACQUIRE_TIMEOUT:-0}")
	private int acquireTimeoutSeconds;

	@Option(
			names = {"--user-agent"},
			description = "User-Agent header sent to sources (env DL_USER_AGENT)",
			defaultValue = "${env:DL_USER_AGENT:-" + HttpUtils.DEFAULT_USER_AGENT + "}")
	private String userAgent;

	@Override
	public Integer call() throws Exception {
		DownloaderConfig config = new DownloaderConfig(
				outputDir,
				defaultLimit,
				fanout,
				Duration.ofSeconds(requestTimeoutSeconds),
				retryCount,
				Duration.ofMillis(Math.round(retryDelaySeconds * 1000)),
				acquireTimeoutSeconds > 0 ? Duration.ofSeconds(acquireTimeoutSeconds) : null,
				userAgent);

		logger.info("Chapter Downloader - Worker");
		logger.info("===========================");
		logger.info("Queue: {}", queue);
		logger.info("Output directory: {}", config.outputDir().toAbsolutePath());
		logger.info("Default source limit: {}, fan-out per job: {}", config.defaultLimit(), config.fanoutLimit());
		logger.info("");

		try (CounterStore store = new RedisCounterStore(redisUrl)) {
			AdmissionController admission = new AdmissionController(store, config.defaultLimit());
			HttpUtils httpUtils = new HttpUtils(
					config.requestTimeout(), config.retryCount(), config.retryDelay(), config.userAgent());
			SourceResolver sourceResolver = SourceResolver.discover();
			logger.info("Known sources: {}", String.join(", ", sourceResolver.knownSources()));

			ChapterDownloader downloader = new ChapterDownloader(
					config, admission, new HttpAssetFetcher(httpUtils, admission), sourceResolver);
			JobQueueConsumer consumer = new JobQueueConsumer(store, downloader, new JobCodec(), queue);

			Runtime.getRuntime()
					.addShutdownHook(new Thread(
							() -> {
								logger.info("Shutdown requested, finishing current job");
								try {
									if (!consumer.shutdown(SHUTDOWN_GRACE)) {
										logger.warn("Consumer did not stop in time");
									}
								} catch (InterruptedException e) {
									Thread.currentThread().interrupt();
								}
							},
							"worker-shutdown"));

			consumer.run();
		}
		return 0;
	}
}
