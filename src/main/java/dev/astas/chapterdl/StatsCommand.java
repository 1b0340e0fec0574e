package dev.astas.chapterdl;

import dev.astas.chapterdl.admission.AdmissionController;
import dev.astas.chapterdl.admission.SourceStats;
import dev.astas.chapterdl.queue.JobCodec;
import dev.astas.chapterdl.store.CounterStore;
import dev.astas.chapterdl.store.RedisCounterStore;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Stats command printing the per-source admission statistics as JSON */
@Command(
		name = "stats",
		description = "Print per-source limits and download statistics as JSON",
		mixinStandardHelpOptions = true)
public class StatsCommand implements Callable<Integer> {

	@Option(
			names = {"--redis-url"},
			description = "Redis server holding the counters (env REDIS_URL, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:REDIS_URL:-redis://localhost:6379/0}")
	private String redisUrl;

	@Option(
			names = {"--default-limit"},
			description = "Limit reported for sources without a stored limit (env DL_GLOBAL_LIMIT, default: ${DEFAULT-VALUE})",
			defaultValue = "${env:DL_GLOBAL_LIMIT:-3}")
	private int defaultLimit;

	@Option(
			names = {"-s", "--source"},
			description = "Only show this source")
	private String source;

	@Override
	public Integer call() throws Exception {
		int limit = Math.max(AdmissionController.MIN_LIMIT, Math.min(AdmissionController.MAX_LIMIT, defaultLimit));
		try (CounterStore store = new RedisCounterStore(redisUrl)) {
			AdmissionController admission = new AdmissionController(store, limit);
			List<SourceStats> stats = source != null ? List.of(admission.stats(source)) : admission.allStats();
			System.out.println(new JobCodec()
					.objectMapper()
					.writerWithDefaultPrettyPrinter()
					.writeValueAsString(stats));
		}
		return 0;
	}
}
