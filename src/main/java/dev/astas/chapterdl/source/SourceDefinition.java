package dev.astas.chapterdl.source;

/**
 * An upstream site known to the downloader. Implementations are discovered with {@link
 * java.util.ServiceLoader} and registered in {@code META-INF/services}.
 */
public interface SourceDefinition {

	/** Short tag identifying the source, used as the unit of admission control */
	String name();

	/**
	 * Whether assets or chapters served from {@code host} belong to this source.
	 *
	 * @param host Lower-cased host name of a URL
	 */
	boolean matches(String host);
}
