package dev.astas.chapterdl.store;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

class RedisCounterStoreTest {

	@Test
	void testPopTimeoutRoundsUpToWholeSeconds() {
		assertThat(RedisCounterStore.popTimeoutSeconds(Duration.ofSeconds(5))).isEqualTo(5);
		assertThat(RedisCounterStore.popTimeoutSeconds(Duration.ofMillis(1500))).isEqualTo(2);
		assertThat(RedisCounterStore.popTimeoutSeconds(Duration.ofMillis(50))).isEqualTo(1);
	}

	@Test
	void testPopTimeoutNeverMeansForever() {
		assertThat(RedisCounterStore.popTimeoutSeconds(Duration.ZERO)).isEqualTo(1);
		assertThat(RedisCounterStore.popTimeoutSeconds(Duration.ofSeconds(-3))).isEqualTo(1);
	}

	@Test
	void testPoppedValue() {
		assertThat(RedisCounterStore.poppedValue(List.of("download_jobs", "{\"job_label\":\"ch1\"}")))
				.isEqualTo("{\"job_label\":\"ch1\"}");
		assertThat(RedisCounterStore.poppedValue(null)).isNull();
		assertThat(RedisCounterStore.poppedValue(List.of())).isNull();
	}

	@Test
	void testScanFollowsCursorUntilExhausted() {
		// Given - three pages, with a key repeated across pages as SCAN may do
		Map<String, ScanResult<String>> pages = Map.of(
				"0", new ScanResult<>("17", List.of("dl_stats:a:success")),
				"17", new ScanResult<>("42", List.of()),
				"42", new ScanResult<>("0", List.of("dl_stats:a:success", "dl_stats:b:error")));
		List<String> cursors = new ArrayList<>();

		// When
		Set<String> keys = RedisCounterStore.scanAll(
				(cursor, params) -> {
					cursors.add(cursor);
					return pages.get(cursor);
				},
				"dl_stats:*");

		// Then
		assertThat(keys).containsExactlyInAnyOrder("dl_stats:a:success", "dl_stats:b:error");
		assertThat(cursors).containsExactly(ScanParams.SCAN_POINTER_START, "17", "42");
	}
}
