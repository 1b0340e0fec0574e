package dev.astas.chapterdl.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for HTTP operations */
public class HttpUtils {
	private static final Logger logger = LoggerFactory.getLogger(HttpUtils.class);

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	public static final String DEFAULT_USER_AGENT =
			"Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0 Safari/537.36";

	private final HttpClient httpClient;
	private final Duration requestTimeout;
	private final int maxAttempts;
	private final Duration initialBackoff;
	private final String userAgent;

	public HttpUtils() {
		this(Duration.ofSeconds(30), 0, Duration.ofSeconds(2), DEFAULT_USER_AGENT);
	}

	/**
	 * Create a new HttpUtils.
	 *
	 * @param requestTimeout Connect timeout, and time allowed until the response headers of each request arrive
	 * @param retryCount Extra attempts after the first failed one (0 disables retrying)
	 * @param initialBackoff Delay before the first retry, doubled for each further retry
	 * @param userAgent Value of the User-Agent header sent with every request
	 */
	public HttpUtils(Duration requestTimeout, int retryCount, Duration initialBackoff, String userAgent) {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(requestTimeout)
				.build();
		this.requestTimeout = requestTimeout;
		this.maxAttempts = Math.max(1, retryCount + 1);
		this.initialBackoff = initialBackoff;
		this.userAgent = userAgent;
	}

	/**
	 * Stream a URL to a local path. The body is copied straight into {@code destination}, so a
	 * failure half-way leaves a partial file behind.
	 */
	public Path downloadFile(String url, Path destination) throws IOException, InterruptedException {
		return retry(url, () -> {
			HttpRequest request = request(url).build();
			HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
			try (InputStream inputStream = response.body()) {
				if (response.statusCode() < 200 || response.statusCode() >= 300) {
					throw new IOException("Failed to download file: " + url + " - HTTP status: " + response.statusCode());
				}
				Files.copy(inputStream, destination, StandardCopyOption.REPLACE_EXISTING);
			}

			// Preserve original file timestamp from Last-Modified header if available
			response.headers().firstValue("Last-Modified").ifPresent(lastModified -> {
				try {
					Instant instant = Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(lastModified));
					Files.setLastModifiedTime(destination, FileTime.from(instant));
				} catch (DateTimeParseException | IOException e) {
					logger.debug("Could not apply Last-Modified '{}' to {}", lastModified, destination);
				}
			});
			return destination;
		});
	}

	private HttpRequest.Builder request(String url) {
		return HttpRequest.newBuilder()
				.uri(URI.create(url))
				.timeout(requestTimeout)
				.header("User-Agent", userAgent)
				.GET();
	}

	/**
	 * Retry an operation with exponential backoff
	 *
	 * @param url The URL being fetched, for logging
	 * @param operation The operation to retry
	 * @return The result of the operation
	 * @throws IOException If all retry attempts fail
	 * @throws InterruptedException If the thread is interrupted during backoff
	 */
	private <T> T retry(String url, IOSupplier<T> operation) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt < maxAttempts; attempt++) {
			try {
				return operation.get();
			} catch (IOException e) {
				lastException = e;
				if (attempt < maxAttempts - 1) {
					// Exponential backoff: 2s, 4s, 8s, ...
					long backoffMillis = initialBackoff.toMillis() * (1L << attempt);
					logger.debug("Attempt {} for {} failed, retrying in {}ms", attempt + 1, url, backoffMillis);
					Thread.sleep(backoffMillis);
				}
			}
		}
		throw lastException;
	}
}
