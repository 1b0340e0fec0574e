package dev.astas.chapterdl.download;

/** Result of fetching a single asset */
public enum FetchOutcome {
	/** Body downloaded and written */
	DOWNLOADED,
	/** A non-empty file was already present, nothing fetched */
	SKIPPED,
	FAILED;

	public boolean isSuccess() {
		return this != FAILED;
	}
}
