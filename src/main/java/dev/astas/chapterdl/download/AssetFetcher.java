package dev.astas.chapterdl.download;

import java.nio.file.Path;

/**
 * Fetches one asset to disk on behalf of a source. Implementations record exactly one outcome per
 * call with the admission controller and never throw for failed fetches; if one throws anyway, the
 * caller records the failure instead.
 */
public interface AssetFetcher {

	/**
	 * Fetch {@code url} into {@code destination}, reporting the outcome for {@code source}.
	 *
	 * @param url The asset URL
	 * @param destination The file to write
	 * @param source The source the asset is admitted under
	 * @return What happened
	 */
	FetchOutcome fetch(String url, Path destination, String source);
}
