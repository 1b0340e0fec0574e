package dev.astas.chapterdl.queue;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.astas.chapterdl.model.ChapterJob;

/** Converts chapter jobs and the records published next to them to and from their JSON form */
public class JobCodec {
	private final ObjectMapper objectMapper;

	public JobCodec() {
		this.objectMapper = new ObjectMapper()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.configure(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES, true);
	}

	/**
	 * Decode and validate a job payload.
	 *
	 * @param payload JSON text popped from the queue
	 * @return The job
	 * @throws JobDecodeException if the payload is not JSON, does not have the job shape, or holds
	 *     values no job can be run with
	 */
	public ChapterJob decode(String payload) throws JobDecodeException {
		if (payload == null || payload.isBlank()) {
			throw new JobDecodeException("Empty payload");
		}
		ChapterJob job;
		try {
			job = objectMapper.readValue(payload, ChapterJob.class);
		} catch (JsonProcessingException e) {
			throw new JobDecodeException("Malformed job: " + e.getOriginalMessage(), e);
		}
		if (job == null) {
			throw new JobDecodeException("Malformed job: null");
		}
		validate(job);
		return job;
	}

	private static void validate(ChapterJob job) throws JobDecodeException {
		if (job.destinationRoot() == null || job.destinationRoot().isBlank()) {
			throw new JobDecodeException("Missing destination_root");
		}
		String label = job.jobLabel();
		if (label == null || label.isBlank()) {
			throw new JobDecodeException("Missing job_label");
		}
		if (label.contains("/") || label.contains("\\") || label.equals(".") || label.equals("..")) {
			throw new JobDecodeException("job_label must be a single path segment: " + label);
		}
		if (job.assetUrls() == null) {
			throw new JobDecodeException("Missing ordered_asset_urls");
		}
		if (job.fanoutLimit() != null && job.fanoutLimit() < 1) {
			throw new JobDecodeException("fanout_limit must be at least 1: " + job.fanoutLimit());
		}
	}

	public String encode(ChapterJob job) {
		return write(job);
	}

	/** Serialize any of the records published to the store */
	public String write(Object value) {
		try {
			return objectMapper.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Cannot serialize " + value.getClass().getSimpleName(), e);
		}
	}

	public ObjectMapper objectMapper() {
		return objectMapper;
	}
}
