package dev.astas.chapterdl;

import dev.astas.chapterdl.model.ChapterJob;
import dev.astas.chapterdl.queue.JobCodec;
import dev.astas.chapterdl.queue.JobDecodeException;
import dev.astas.chapterdl.store.CounterStore;
import dev.astas.chapterdl.store.RedisCounterStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/** Enqueue command pushing a chapter job for the workers */
@Command(
		name = "enqueue",
		description = "Push a chapter job onto the shared queue",
		mixinStandardHelpOptions = true)
public class EnqueueCommand implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger("command");

	@Option(
			names = {"--redis-url"},
			description = "Redis server holding the queue (env REDIS_URL, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:REDIS_URL:-redis://localhost:6379/0}")
	private String redisUrl;

	@Option(
			names = {"-q", "--queue"},
			description = "Name of the job queue (env DL_QUEUE, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:DL_QUEUE:-download_jobs}")
	private String queue;

	@Option(
			names = {"-f", "--file"},
			description = "Read the job as JSON from this file instead of from the options below")
	private Path jobFile;

	@Option(
			names = {"-d", "--destination"},
			description = "Destination root of the chapter, e.g. the series title")
	private String destination;

	@Option(
			names = {"-l", "--label"},
			description = "Chapter directory name")
	private String label;

	@Option(
			names = {"-s", "--origin"},
			description = "Chapter URL or source tag the downloads are admitted under")
	private String origin;

	@Option(
			names = {"--fanout"},
			description = "Concurrent image downloads for this job (default: the worker's setting)")
	private Integer fanout;

	@Parameters(description = "Image URLs in page order")
	private List<String> urls;

	@Override
	public Integer call() throws Exception {
		JobCodec codec = new JobCodec();
		String payload = jobFile != null
				? Files.readString(jobFile)
				: codec.encode(new ChapterJob(destination, label, urls != null ? urls : List.of(), origin, fanout));

		ChapterJob job;
		try {
			job = codec.decode(payload);
		} catch (JobDecodeException e) {
			logger.error("Invalid job: {}", e.getMessage());
			return 1;
		}

		try (CounterStore store = new RedisCounterStore(redisUrl)) {
			store.push(queue, codec.encode(job));
		}
		logger.info("Queued {}/{} with {} images on {}", job.destinationRoot(), job.jobLabel(), job.total(), queue);
		return 0;
	}
}
