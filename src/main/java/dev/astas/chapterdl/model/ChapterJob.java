package dev.astas.chapterdl.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * One unit of work taken from the job queue: an ordered list of asset URLs to store under
 * {@code destinationRoot/jobLabel}. Field names on the wire are fixed by the producers.
 *
 * @param destinationRoot Root directory of the chapter, relative paths resolve under the output dir
 * @param jobLabel Name of the chapter directory
 * @param assetUrls Asset URLs in page order
 * @param origin URL the chapter was scraped from, or a bare source tag
 * @param fanoutLimit Maximum concurrent fetches for this job, or null for the configured default
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
	"destination_root",
	"job_label",
	"ordered_asset_urls",
	"origin_url_or_source_tag",
	"fanout_limit"
})
public record ChapterJob(
		@JsonProperty("destination_root") String destinationRoot,
		@JsonProperty("job_label") String jobLabel,
		@JsonProperty("ordered_asset_urls") List<String> assetUrls,
		@JsonProperty("origin_url_or_source_tag") String origin,
		@JsonProperty("fanout_limit") Integer fanoutLimit) {

	public ChapterJob {
		if (assetUrls != null) {
			assetUrls = List.copyOf(assetUrls);
		}
	}

	public int total() {
		return assetUrls.size();
	}
}
