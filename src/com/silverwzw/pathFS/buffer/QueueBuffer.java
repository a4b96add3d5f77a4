package com.silverwzw.pathFS.buffer;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.silverwzw.pathFS.store.NodeStore;

/**
 * writes are cut into chunks and queued, a single uploader drains the queue into one streamed upload.
 * A full queue blocks the writer. {@link #flush()} ends the current stream, the next write opens a new one that appends.
 */
final class QueueBuffer extends WriteBuffer {

	private final static byte[] EOS;
	private final static long POLL_MS;

	static {
		EOS = new byte[0];
		POLL_MS = 100;
	}

	private final ExecutorService executor;
	private final int chunkSize, depth;
	private BlockingQueue<byte[]> queue;
	private Future<Long> uploader;

	QueueBuffer(NodeStore store, String nodeId, int chunkSize, int depth, boolean append, boolean truncate, ExecutorService executor) {
		super(store, nodeId, append, truncate);
		if (depth < 1) {
			throw new IllegalArgumentException("queue depth must be positive : " + depth);
		}
		this.executor = executor;
		this.chunkSize = chunkSize;
		this.depth = depth;
		queue = null;
		uploader = null;
	}

	public final WriteBufferType type() {
		return WriteBufferType.QUEUE;
	}

	public final void write(byte[] b, int off, int len) throws IOException {
		checkRange(b, off, len);
		ensureOpen();
		if (len == 0) {
			return;
		}
		if (uploader == null) {
			start();
		}
		while (len > 0) {
			byte[] chunk;
			int n;
			n = Math.min(len, chunkSize);
			chunk = new byte[n];
			System.arraycopy(b, off, chunk, 0, n);
			put(chunk);
			off += n;
			len -= n;
		}
	}

	public final void flush() throws IOException {
		if (uploader == null) {
			return;
		}
		try {
			put(EOS);
			await(uploader);
		} finally {
			uploader = null;
			queue = null;
		}
	}

	private final void start() throws IOException {
		final BlockingQueue<byte[]> q;
		final boolean replace;

		ensureRunning(executor);
		q = new ArrayBlockingQueue<byte[]>(depth);
		replace = nextReplace();
		uploader = submit(executor, new Callable<Long>() {
			public Long call() throws IOException {
				return upload(new QueueInputStream(q), replace);
			}
		});
		queue = q;
	}

	/**
	 * blocking put that gives up once the uploader has terminated
	 */
	private final void put(byte[] chunk) throws IOException {
		try {
			while (!queue.offer(chunk, POLL_MS, TimeUnit.MILLISECONDS)) {
				if (uploader.isDone()) {
					Future<Long> dead;
					dead = uploader;
					uploader = null;
					queue = null;
					await(dead);
					throw new IOException("uploader of " + nodeId + " stopped before end of stream");
				}
			}
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			uploader.cancel(true);
			uploader = null;
			queue = null;
			throw new InterruptedIOException("interrupted while queueing content of " + nodeId);
		}
	}

	private final static class QueueInputStream extends InputStream {
		private final BlockingQueue<byte[]> queue;
		private byte[] current;
		private int pointer;
		private boolean eos;

		QueueInputStream(BlockingQueue<byte[]> queue) {
			this.queue = queue;
			current = null;
			pointer = 0;
			eos = false;
		}

		private boolean next() throws IOException {
			while (!eos && (current == null || pointer >= current.length)) {
				try {
					current = queue.take();
				} catch (InterruptedException ex) {
					Thread.currentThread().interrupt();
					throw new InterruptedIOException("upload interrupted");
				}
				pointer = 0;
				if (current == EOS) {
					eos = true;
				}
			}
			return !eos;
		}

		public int read() throws IOException {
			if (!next()) {
				return -1;
			}
			return current[pointer++] & 0xff;
		}

		public int read(byte[] b, int off, int len) throws IOException {
			if (len == 0) {
				return 0;
			}
			if (!next()) {
				return -1;
			}
			int n;
			n = Math.min(len, current.length - pointer);
			System.arraycopy(current, pointer, b, off, n);
			pointer += n;
			return n;
		}
	}
}
