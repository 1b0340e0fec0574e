package dev.astas.chapterdl.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Creates daemon threads named {@code <prefix>-<n>} */
public class NamedThreadFactory implements ThreadFactory {
	private final String prefix;
	private final AtomicInteger counter = new AtomicInteger();

	public NamedThreadFactory(String prefix) {
		this.prefix = prefix;
	}

	@Override
	public Thread newThread(Runnable r) {
		Thread thread = new Thread(r, prefix + "-" + counter.incrementAndGet());
		thread.setDaemon(true);
		return thread;
	}
}
