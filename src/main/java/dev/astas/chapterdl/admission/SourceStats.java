package dev.astas.chapterdl.admission;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Locale;

/** Published statistics of one source */
@JsonPropertyOrder({"source", "limit", "success_count", "error_count", "error_rate_percent"})
public record SourceStats(
		@JsonProperty("source") String source,
		@JsonProperty("limit") long limit,
		@JsonProperty("success_count") long successCount,
		@JsonProperty("error_count") long errorCount,
		@JsonProperty("error_rate_percent") double errorRatePercent) {

	/** Build a snapshot, deriving the error rate rounded to one decimal (0 without any outcomes) */
	public static SourceStats of(String source, long limit, long successCount, long errorCount) {
		long total = successCount + errorCount;
		double rate = total > 0 ? Math.round(errorCount * 1000.0 / total) / 10.0 : 0.0;
		return new SourceStats(source, limit, successCount, errorCount, rate);
	}

	@Override
	public String toString() {
		return String.format(
				Locale.ROOT,
				"%s: limit %d, %d ok, %d failed (%.1f%% errors)",
				source,
				limit,
				successCount,
				errorCount,
				errorRatePercent);
	}
}
