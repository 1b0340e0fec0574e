package dev.astas.chapterdl.admission;

import java.util.concurrent.atomic.AtomicBoolean;

/** A checked-out admission slot. Closing it releases the slot; further closes do nothing. */
public final class AdmissionSlot implements AutoCloseable {
	private final AdmissionController controller;
	private final String source;
	private final AtomicBoolean released = new AtomicBoolean(false);

	AdmissionSlot(AdmissionController controller, String source) {
		this.controller = controller;
		this.source = source;
	}

	public String source() {
		return source;
	}

	@Override
	public void close() {
		if (released.compareAndSet(false, true)) {
			controller.release(source);
		}
	}
}
