package dev.astas.chapterdl.source;

/** mangapill.com and its CDN subdomains */
public class MangapillSource implements SourceDefinition {

	@Override
	public String name() {
		return "mangapill";
	}

	@Override
	public boolean matches(String host) {
		return host.equals("mangapill.com") || host.endsWith(".mangapill.com");
	}
}
