package dev.astas.chapterdl.source;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Maps the origin of a job to the source identifier its downloads are admitted under */
public class SourceResolver {
	private static final Logger logger = LoggerFactory.getLogger(SourceResolver.class);

	/** Bucket shared by every origin no registered source claims */
	public static final String GLOBAL = "global";

	private final List<SourceDefinition> definitions;

	public SourceResolver(List<SourceDefinition> definitions) {
		this.definitions = List.copyOf(definitions);
	}

	/** Create a resolver for all source definitions found using ServiceLoader */
	public static SourceResolver discover() {
		List<SourceDefinition> definitions = new ArrayList<>();
		for (SourceDefinition definition : ServiceLoader.load(SourceDefinition.class)) {
			definitions.add(definition);
		}
		logger.debug("Discovered {} source definitions", definitions.size());
		return new SourceResolver(definitions);
	}

	/**
	 * Resolve a source identifier.
	 *
	 * @param origin An http(s) URL, whose host is matched against the registered sources, or a bare
	 *     source tag, which is used as-is
	 * @return The lower-cased source identifier, or {@link #GLOBAL} if nothing matches
	 */
	public String resolve(String origin) {
		if (origin == null || origin.isBlank()) {
			return GLOBAL;
		}
		String value = origin.trim();
		if (!value.contains("://")) {
			return value.toLowerCase(Locale.ROOT);
		}

		String host;
		try {
			host = URI.create(value).getHost();
		} catch (IllegalArgumentException e) {
			logger.debug("Cannot parse origin {}: {}", value, e.getMessage());
			return GLOBAL;
		}
		if (host == null) {
			return GLOBAL;
		}
		String lowerHost = host.toLowerCase(Locale.ROOT);
		for (SourceDefinition definition : definitions) {
			if (definition.matches(lowerHost)) {
				return definition.name().toLowerCase(Locale.ROOT);
			}
		}
		return GLOBAL;
	}

	public List<String> knownSources() {
		return definitions.stream().map(SourceDefinition::name).sorted().toList();
	}
}
