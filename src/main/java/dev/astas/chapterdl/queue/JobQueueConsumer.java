package dev.astas.chapterdl.queue;

import dev.astas.chapterdl.admission.AdmissionTimeoutException;
import dev.astas.chapterdl.download.ChapterDownloader;
import dev.astas.chapterdl.download.JobSummary;
import dev.astas.chapterdl.model.ChapterJob;
import dev.astas.chapterdl.store.CounterStore;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-lived worker loop taking chapter jobs off the shared queue one at a time. Throughput comes
 * from running several consumers, each competing for admission slots through the store.
 *
 * <p>Besides the job queue itself two lists are written: {@code <queue>:dead} receives payloads
 * that could not be decoded, and {@code <queue>:incomplete} receives the summary of every job that
 * finished with missing assets.
 */
public class JobQueueConsumer implements Runnable {
	private static final Logger logger = LoggerFactory.getLogger(JobQueueConsumer.class);

	public static final String DEFAULT_QUEUE = "download_jobs";
	public static final Duration POP_TIMEOUT = Duration.ofSeconds(5);
	public static final Duration IDLE_SLEEP = Duration.ofSeconds(1);
	public static final Duration INTERRUPT_GRACE = Duration.ofSeconds(10);

	private final CounterStore store;
	private final ChapterDownloader downloader;
	private final JobCodec codec;
	private final String queue;
	private final Duration popTimeout;
	private final Duration idleSleep;
	private final CountDownLatch finished = new CountDownLatch(1);
	private volatile boolean stopRequested;
	private volatile Thread runner;

	public JobQueueConsumer(CounterStore store, ChapterDownloader downloader, JobCodec codec, String queue) {
		this(store, downloader, codec, queue, POP_TIMEOUT, IDLE_SLEEP);
	}

	public JobQueueConsumer(
			CounterStore store,
			ChapterDownloader downloader,
			JobCodec codec,
			String queue,
			Duration popTimeout,
			Duration idleSleep) {
		this.store = store;
		this.downloader = downloader;
		this.codec = codec;
		this.queue = queue;
		this.popTimeout = popTimeout;
		this.idleSleep = idleSleep;
	}

	public static String deadLetterQueue(String queue) {
		return queue + ":dead";
	}

	public static String incompleteQueue(String queue) {
		return queue + ":incomplete";
	}

	/** Process jobs until {@link #stop()} is called or the thread is interrupted. Runs once. */
	@Override
	public void run() {
		runner = Thread.currentThread();
		try {
			consume();
		} finally {
			runner = null;
			finished.countDown();
		}
	}

	private void consume() {
		logger.info("Consuming jobs from {}", queue);
		while (!stopRequested) {
			try {
				if (!pollOnce()) {
					Thread.sleep(idleSleep.toMillis());
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				logger.info("Consumer interrupted");
				break;
			} catch (RuntimeException e) {
				logger.error("Error while consuming from {}", queue, e);
				try {
					Thread.sleep(idleSleep.toMillis());
				} catch (InterruptedException ie) {
					Thread.currentThread().interrupt();
					break;
				}
			}
		}
		logger.info("Consumer for {} stopped", queue);
	}

	/**
	 * Wait up to the pop timeout for one payload and handle it.
	 *
	 * @return false if the wait timed out without a payload
	 * @throws InterruptedException if interrupted while waiting or downloading
	 */
	public boolean pollOnce() throws InterruptedException {
		String payload = store.blockingPop(queue, popTimeout);
		if (payload == null) {
			return false;
		}

		ChapterJob job;
		try {
			job = codec.decode(payload);
		} catch (JobDecodeException e) {
			logger.warn("Dead-lettering job payload: {}", e.getMessage());
			store.push(
					deadLetterQueue(queue),
					codec.write(new DeadLetter(payload, e.getMessage(), Instant.now().toString())));
			return true;
		}

		try {
			JobSummary summary = downloader.download(job);
			if (!summary.complete()) {
				logger.warn("Incomplete job {}", summary);
				store.push(incompleteQueue(queue), codec.write(summary));
			}
		} catch (AdmissionTimeoutException e) {
			logger.warn("{}, requeueing job {}", e.getMessage(), job.jobLabel());
			store.push(queue, payload);
		} catch (InterruptedException e) {
			// Files already on disk are skipped when the job runs again
			logger.warn("Interrupted, requeueing job {}", job.jobLabel());
			store.push(queue, payload);
			throw e;
		}
		return true;
	}

	/** Ask {@link #run()} to return once the current job is done */
	public void stop() {
		stopRequested = true;
	}

	/**
	 * Stop the consumer and wait for {@link #run()} to return. A job still running after
	 * {@code grace} is interrupted, which releases its admission slot and puts it back on the queue.
	 *
	 * @param grace How long the current job may keep running
	 * @return true if {@link #run()} returned in time
	 * @throws InterruptedException if interrupted while waiting
	 */
	public boolean shutdown(Duration grace) throws InterruptedException {
		stop();
		if (finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
			return true;
		}
		Thread thread = runner;
		if (thread == null) {
			return false;
		}
		logger.warn("Job still running after {}s, interrupting", grace.toSeconds());
		thread.interrupt();
		return finished.await(INTERRUPT_GRACE.toMillis(), TimeUnit.MILLISECONDS);
	}
}
