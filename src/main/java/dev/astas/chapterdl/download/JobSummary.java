package dev.astas.chapterdl.download;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/** Outcome of one chapter job */
@JsonPropertyOrder({"source", "directory", "done", "total", "failed_urls"})
public record JobSummary(
		@JsonProperty("source") String source,
		@JsonProperty("directory") String directory,
		@JsonProperty("done") int done,
		@JsonProperty("total") int total,
		@JsonProperty("failed_urls") List<String> failedUrls) {

	public JobSummary {
		failedUrls = failedUrls != null ? List.copyOf(failedUrls) : List.of();
	}

	/** Whether every asset of the job is on disk */
	public boolean complete() {
		return done == total;
	}

	@Override
	public String toString() {
		return "%s %s: %d/%d".formatted(source, directory, done, total);
	}
}
