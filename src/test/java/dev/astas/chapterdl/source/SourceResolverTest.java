package dev.astas.chapterdl.source;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class SourceResolverTest {

	private final SourceResolver resolver = new SourceResolver(List.of(new MangapillSource()));

	@Test
	void testResolveRegisteredHost() {
		assertThat(resolver.resolve("https://mangapill.com/chapters/1-10001000/one-piece-chapter-1"))
				.isEqualTo("mangapill");
		assertThat(resolver.resolve("https://cdn.MangaPill.com/x/1.jpg")).isEqualTo("mangapill");
	}

	@Test
	void testLookalikeHostIsNotMatched() {
		assertThat(resolver.resolve("https://notmangapill.com/chapters/1")).isEqualTo(SourceResolver.GLOBAL);
	}

	@Test
	void testUnknownOriginFallsBackToGlobal() {
		assertThat(resolver.resolve("https://example.org/chapter/1")).isEqualTo(SourceResolver.GLOBAL);
		assertThat(resolver.resolve("https://exa mple.org/")).isEqualTo(SourceResolver.GLOBAL);
		assertThat(resolver.resolve("file:///tmp/x")).isEqualTo(SourceResolver.GLOBAL);
		assertThat(resolver.resolve(null)).isEqualTo(SourceResolver.GLOBAL);
		assertThat(resolver.resolve("   ")).isEqualTo(SourceResolver.GLOBAL);
	}

	@Test
	void testBareTagIsUsedLowerCased() {
		assertThat(resolver.resolve("MangaDex")).isEqualTo("mangadex");
		assertThat(resolver.resolve(" mangapill ")).isEqualTo("mangapill");
	}

	@Test
	void testDiscoverFindsRegisteredSources() {
		SourceResolver discovered = SourceResolver.discover();

		assertThat(discovered.knownSources()).contains("mangapill");
		assertThat(discovered.resolve("https://mangapill.com/")).isEqualTo("mangapill");
	}
}
