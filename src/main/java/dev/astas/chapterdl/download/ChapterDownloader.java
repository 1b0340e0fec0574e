package dev.astas.chapterdl.download;

import dev.astas.chapterdl.admission.AdmissionController;
import dev.astas.chapterdl.admission.AdmissionSlot;
import dev.astas.chapterdl.model.ChapterJob;
import dev.astas.chapterdl.source.SourceResolver;
import dev.astas.chapterdl.util.FileUtils;
import dev.astas.chapterdl.util.NamedThreadFactory;
import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads all assets of a chapter job. Two independent limits apply: the job holds one admission
 * slot of its source for its whole run, which bounds how many jobs of that source run at once
 * across all workers, and its fetches run on a pool no larger than the job's fan-out limit, which
 * bounds connections opened by the job itself.
 */
public class ChapterDownloader {
	private static final Logger logger = LoggerFactory.getLogger(ChapterDownloader.class);

	static final String DEFAULT_EXTENSION = ".jpg";

	private final DownloaderConfig config;
	private final AdmissionController admission;
	private final AssetFetcher fetcher;
	private final SourceResolver sourceResolver;

	public ChapterDownloader(
			DownloaderConfig config, AdmissionController admission, AssetFetcher fetcher, SourceResolver sourceResolver) {
		this.config = config;
		this.admission = admission;
		this.fetcher = fetcher;
		this.sourceResolver = sourceResolver;
	}

	/**
	 * Run a job to completion. Individual asset failures are counted in the summary, never thrown.
	 *
	 * @param job The job to run
	 * @return How many of the job's assets ended up on disk
	 * @throws dev.astas.chapterdl.admission.AdmissionTimeoutException if an acquire timeout is
	 *     configured and no slot became free in time
	 * @throws InterruptedException if interrupted while waiting for a slot or for the fetches
	 */
	public JobSummary download(ChapterJob job) throws InterruptedException {
		String source = sourceResolver.resolve(job.origin());
		Path folder = directoryFor(job);
		int total = job.total();

		try (AdmissionSlot slot = admission.acquire(source, config.acquireTimeout())) {
			try {
				FileUtils.ensureDirectory(folder);
			} catch (IOException e) {
				// Every asset would fail the same way, count them all
				logger.error("Cannot create {}: {}", folder, e.getMessage());
				for (int i = 0; i < total; i++) {
					admission.recordOutcome(source, false);
				}
				return new JobSummary(source, folder.toString(), 0, total, job.assetUrls());
			}

			List<String> failed = fetchAll(job, source, folder);
			JobSummary summary = new JobSummary(source, folder.toString(), total - failed.size(), total, failed);
			logger.info("{} {}: {}/{}", source, job.jobLabel(), summary.done(), total);
			return summary;
		}
	}

	private List<String> fetchAll(ChapterJob job, String source, Path folder) throws InterruptedException {
		List<String> urls = job.assetUrls();
		if (urls.isEmpty()) {
			return List.of();
		}

		int fanout = job.fanoutLimit() != null ? job.fanoutLimit() : config.fanoutLimit();
		ExecutorService executor = Executors.newFixedThreadPool(
				Math.min(fanout, urls.size()), new NamedThreadFactory("fetch-" + job.jobLabel()));
		try {
			// null marks an asset that never reached the fetcher
			List<Future<FetchOutcome>> futures = new ArrayList<>();
			for (int i = 0; i < urls.size(); i++) {
				String url = urls.get(i);
				Path destination;
				try {
					destination = folder.resolve(fileNameFor(i + 1, url));
				} catch (InvalidPathException e) {
					logger.warn("No valid file name for {}: {}", url, e.getMessage());
					admission.recordOutcome(source, false);
					futures.add(null);
					continue;
				}
				futures.add(executor.submit(() -> fetcher.fetch(url, destination, source)));
			}

			List<String> failed = new ArrayList<>();
			for (int i = 0; i < futures.size(); i++) {
				Future<FetchOutcome> future = futures.get(i);
				if (future == null) {
					failed.add(urls.get(i));
					continue;
				}
				try {
					if (!future.get().isSuccess()) {
						failed.add(urls.get(i));
					}
				} catch (ExecutionException e) {
					// The fetcher gave up without reporting, so the outcome is counted here
					logger.error("Unexpected failure fetching {}", urls.get(i), e.getCause());
					admission.recordOutcome(source, false);
					failed.add(urls.get(i));
				}
			}
			return failed;
		} finally {
			executor.shutdownNow();
		}
	}

	/** Directory a job writes into; relative roots are placed under the output directory */
	Path directoryFor(ChapterJob job) {
		return config.outputDir().resolve(job.destinationRoot()).resolve(job.jobLabel());
	}

	/**
	 * File name of the asset at a 1-based position: the index zero-padded to three digits plus the
	 * extension of the URL, {@value #DEFAULT_EXTENSION} if it has none.
	 */
	public static String fileNameFor(int index, String url) {
		return "%03d%s".formatted(index, FileUtils.extensionOf(url, DEFAULT_EXTENSION));
	}
}
