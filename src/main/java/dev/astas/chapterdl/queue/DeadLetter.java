package dev.astas.chapterdl.queue;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A rejected queue payload, kept verbatim together with the reason it was rejected.
 *
 * @param payload The raw payload as popped from the queue
 * @param reason Why decoding failed
 * @param failedAt ISO-8601 instant of the rejection
 */
@JsonPropertyOrder({"payload", "reason", "failed_at"})
public record DeadLetter(
		@JsonProperty("payload") String payload,
		@JsonProperty("reason") String reason,
		@JsonProperty("failed_at") String failedAt) {}
