package dev.astas.chapterdl.queue;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import dev.astas.chapterdl.admission.AdmissionController;
import dev.astas.chapterdl.admission.AdmissionSlot;
import dev.astas.chapterdl.download.AssetFetcher;
import dev.astas.chapterdl.download.ChapterDownloader;
import dev.astas.chapterdl.download.DownloaderConfig;
import dev.astas.chapterdl.download.FetchOutcome;
import dev.astas.chapterdl.model.ChapterJob;
import dev.astas.chapterdl.source.MangapillSource;
import dev.astas.chapterdl.source.SourceResolver;
import dev.astas.chapterdl.store.InMemoryCounterStore;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobQueueConsumerTest {

	private static final String QUEUE = "test_jobs";

	@TempDir
	Path tempDir;

	private InMemoryCounterStore store;
	private AdmissionController admission;
	private final JobCodec codec = new JobCodec();
	private final AtomicInteger fetches = new AtomicInteger();
	private final CountDownLatch fetched = new CountDownLatch(1);
	private JobQueueConsumer consumer;

	@BeforeEach
	void setUp() {
		store = new InMemoryCounterStore();
		admission = new AdmissionController(store, 3, Duration.ofMillis(10), () -> 1.0);
		consumer = consumerWith((url, destination, source) -> {
			fetches.incrementAndGet();
			fetched.countDown();
			return url.contains("missing") ? FetchOutcome.FAILED : FetchOutcome.DOWNLOADED;
		});
	}

	@AfterEach
	void tearDown() {
		store.close();
	}

	@Test
	void testPollTimesOutOnEmptyQueue() throws Exception {
		assertThat(consumer.pollOnce()).isFalse();
	}

	@Test
	void testCompleteJobLeavesNoTrace() throws Exception {
		// Given
		store.push(QUEUE, codec.encode(job("ch1", "https://h/1.jpg", "https://h/2.jpg")));

		// When
		boolean handled = consumer.pollOnce();

		// Then
		assertThat(handled).isTrue();
		assertThat(fetches.get()).isEqualTo(2);
		assertThat(store.list(QUEUE)).isEmpty();
		assertThat(store.list(JobQueueConsumer.deadLetterQueue(QUEUE))).isEmpty();
		assertThat(store.list(JobQueueConsumer.incompleteQueue(QUEUE))).isEmpty();
		assertThat(admission.activeSlots("mangapill")).isZero();
	}

	@Test
	void testMalformedPayloadIsDeadLettered() throws Exception {
		// Given
		store.push(QUEUE, "{\"job_label\": 7");

		// When
		boolean handled = consumer.pollOnce();

		// Then
		assertThat(handled).isTrue();
		assertThat(fetches.get()).isZero();
		List<String> dead = store.list(JobQueueConsumer.deadLetterQueue(QUEUE));
		assertThat(dead).hasSize(1);
		JsonNode letter = codec.objectMapper().readTree(dead.get(0));
		assertThat(letter.get("payload").asText()).isEqualTo("{\"job_label\": 7");
		assertThat(letter.get("reason").asText()).startsWith("Malformed job");
		assertThat(letter.get("failed_at").asText()).isNotBlank();
	}

	@Test
	void testIncompleteJobIsPublished() throws Exception {
		// Given
		store.push(QUEUE, codec.encode(job("ch2", "https://h/1.jpg", "https://h/missing.jpg")));

		// When
		consumer.pollOnce();

		// Then
		List<String> incomplete = store.list(JobQueueConsumer.incompleteQueue(QUEUE));
		assertThat(incomplete).hasSize(1);
		JsonNode summary = codec.objectMapper().readTree(incomplete.get(0));
		assertThat(summary.get("source").asText()).isEqualTo("mangapill");
		assertThat(summary.get("done").asInt()).isEqualTo(1);
		assertThat(summary.get("total").asInt()).isEqualTo(2);
		assertThat(summary.get("failed_urls").get(0).asText()).isEqualTo("https://h/missing.jpg");
	}

	@Test
	void testJobIsRequeuedWhenNoSlotFrees() throws Exception {
		// Given
		store.set("dl_limit:mangapill", "1");
		String payload = codec.encode(job("ch3", "https://h/1.jpg"));
		store.push(QUEUE, payload);

		try (AdmissionSlot held = admission.acquire("mangapill")) {
			// When
			boolean handled = consumer.pollOnce();

			// Then
			assertThat(handled).isTrue();
			assertThat(fetches.get()).isZero();
			assertThat(store.list(QUEUE)).containsExactly(payload);
			assertThat(admission.activeSlots("mangapill")).isEqualTo(1);
		}
	}

	@Test
	void testRunUntilStopped() throws Exception {
		// Given
		Thread worker = new Thread(consumer, "consumer-test");
		worker.start();

		// When
		store.push(QUEUE, codec.encode(job("ch4", "https://h/1.jpg")));

		// Then
		assertThat(fetched.await(5, TimeUnit.SECONDS)).isTrue();
		consumer.stop();
		worker.join(TimeUnit.SECONDS.toMillis(5));
		assertThat(worker.isAlive()).isFalse();
	}

	@Test
	void testShutdownInterruptsRunningJobAndReleasesSlot() throws Exception {
		// Given - a fetch that only ends when interrupted
		CountDownLatch started = new CountDownLatch(1);
		JobQueueConsumer stuck = consumerWith((url, destination, source) -> {
			started.countDown();
			try {
				Thread.sleep(Long.MAX_VALUE);
				return FetchOutcome.DOWNLOADED;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return FetchOutcome.FAILED;
			}
		});
		String payload = codec.encode(job("ch5", "https://h/1.jpg"));
		store.push(QUEUE, payload);
		Thread worker = new Thread(stuck, "consumer-test");
		worker.start();
		assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
		assertThat(admission.activeSlots("mangapill")).isEqualTo(1);

		// When
		boolean stopped = stuck.shutdown(Duration.ofMillis(100));

		// Then
		assertThat(stopped).isTrue();
		worker.join(TimeUnit.SECONDS.toMillis(5));
		assertThat(worker.isAlive()).isFalse();
		assertThat(admission.activeSlots("mangapill")).isZero();
		assertThat(store.list(QUEUE)).containsExactly(payload);
	}

	@Test
	void testShutdownOfIdleConsumerDoesNotInterrupt() throws Exception {
		// Given
		Thread worker = new Thread(consumer, "consumer-test");
		worker.start();

		// When
		boolean stopped = consumer.shutdown(Duration.ofSeconds(5));

		// Then
		assertThat(stopped).isTrue();
		worker.join(TimeUnit.SECONDS.toMillis(5));
		assertThat(worker.isAlive()).isFalse();
	}

	private JobQueueConsumer consumerWith(AssetFetcher fetcher) {
		DownloaderConfig config = new DownloaderConfig(
				tempDir, 3, 4, Duration.ofSeconds(5), 0, Duration.ofSeconds(1), Duration.ofMillis(50), "test");
		ChapterDownloader downloader = new ChapterDownloader(
				config, admission, fetcher, new SourceResolver(List.of(new MangapillSource())));
		return new JobQueueConsumer(store, downloader, codec, QUEUE, Duration.ofMillis(50), Duration.ofMillis(10));
	}

	private static ChapterJob job(String label, String... urls) {
		return new ChapterJob("series", label, List.of(urls), "https://mangapill.com/chapters/1", null);
	}
}
