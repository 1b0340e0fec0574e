package dev.astas.chapterdl.util;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/** Utility class for file operations */
public class FileUtils {
	private static final Pattern SAFE_EXTENSION = Pattern.compile("[A-Za-z0-9]{1,10}");

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Whether a regular file exists at the path and holds at least one byte */
	public static boolean hasContent(Path file) {
		try {
			return Files.isRegularFile(file) && Files.size(file) > 0;
		} catch (IOException e) {
			return false;
		}
	}

	/**
	 * Extension of the last path segment of a URL, including the dot and lower-cased. Query strings
	 * and fragments are not considered, and the path is read undecoded. Extensions holding anything
	 * but ASCII letters and digits are replaced by the fallback.
	 *
	 * @param url The URL
	 * @param fallback Extension returned when the URL has none or cannot be parsed
	 */
	public static String extensionOf(String url, String fallback) {
		String path;
		try {
			path = URI.create(url.trim()).getRawPath();
		} catch (IllegalArgumentException e) {
			return fallback;
		}
		if (path == null || path.isEmpty()) {
			return fallback;
		}
		String name = path.substring(path.lastIndexOf('/') + 1);
		int dot = name.lastIndexOf('.');
		if (dot <= 0 || dot == name.length() - 1) {
			return fallback;
		}
		String extension = name.substring(dot + 1);
		if (!SAFE_EXTENSION.matcher(extension).matches()) {
			return fallback;
		}
		return "." + extension.toLowerCase(Locale.ROOT);
	}
}
