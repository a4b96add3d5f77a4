package com.silverwzw.pathFS.buffer;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import com.silverwzw.pathFS.store.NodeStore;

/**
 * two buffers: while one is uploaded in background the writer fills the other.
 * At most one upload is in flight, so patches reach the store in write order.
 */
final class AsyncBuffer extends WriteBuffer {

	private final ExecutorService executor;
	private byte[] front, back;
	private int pos;
	private Future<Void> inflight;

	AsyncBuffer(NodeStore store, String nodeId, int size, boolean append, boolean truncate, ExecutorService executor) {
		super(store, nodeId, append, truncate);
		this.executor = executor;
		front = new byte[size];
		back = new byte[size];
		pos = 0;
		inflight = null;
	}

	public final WriteBufferType type() {
		return WriteBufferType.ASYNC;
	}

	public final void write(byte[] b, int off, int len) throws IOException {
		checkRange(b, off, len);
		ensureOpen();
		if (inflight != null && inflight.isDone()) {
			waitInflight();
		}
		while (len > 0) {
			int n;
			n = Math.min(len, front.length - pos);
			System.arraycopy(b, off, front, pos, n);
			pos += n;
			off += n;
			len -= n;
			if (pos == front.length) {
				handoff();
			}
		}
	}

	private final void handoff() throws IOException {
		final byte[] data;
		final int length;
		final boolean replace;

		waitInflight();
		ensureRunning(executor);
		data = front;
		length = pos;
		replace = nextReplace();
		inflight = submit(executor, new Callable<Void>() {
			public Void call() throws IOException {
				store.writeContent(nodeId, data, 0, length, replace);
				return null;
			}
		});
		front = back;
		back = data;
		pos = 0;
	}

	private final void waitInflight() throws IOException {
		if (inflight == null) {
			return;
		}
		try {
			await(inflight);
		} finally {
			inflight = null;
		}
	}

	public final void flush() throws IOException {
		waitInflight();
		if (pos > 0) {
			upload(front, 0, pos);
			pos = 0;
		}
	}
}
