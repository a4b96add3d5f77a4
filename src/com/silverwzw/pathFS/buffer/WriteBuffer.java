package com.silverwzw.pathFS.buffer;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

import org.apache.log4j.Logger;

import com.silverwzw.pathFS.store.NodeStore;

/**
 * Accumulates the bytes written through one handle and pushes them to the store.
 * The first upload of a session replaces the content unless the handle appends, later uploads append.
 * Content is durable only once {@link #close()} returned.
 * Instances are bound to a single writer, only the background upload of ASYNC and QUEUE runs on another thread.
 * @author silverwzw
 */
public abstract class WriteBuffer implements Closeable {

	private static final Logger logger;

	static {
		logger = Logger.getLogger(WriteBuffer.class);
	}

	protected final NodeStore store;
	protected final String nodeId;
	private final boolean truncate;
	private boolean replace, uploaded, closed;

	WriteBuffer(NodeStore store, String nodeId, boolean append, boolean truncate) {
		this.store = store;
		this.nodeId = nodeId;
		this.truncate = truncate;
		replace = !append || truncate;
		uploaded = false;
		closed = false;
	}

	public final static WriteBuffer create(WriteBufferType type, NodeStore store, String nodeId, int size, int queueDepth, boolean append, boolean truncate, ExecutorService executor) {
		if (size < 1) {
			throw new IllegalArgumentException("buffer size must be positive : " + size);
		}
		switch (type) {
			case NONE:
				return new DirectWrite(store, nodeId, append, truncate);
			case SIMPLE:
				return new SimpleBuffer(store, nodeId, size, append, truncate);
			case ASYNC:
				return new AsyncBuffer(store, nodeId, size, append, truncate, executor);
			case QUEUE:
				return new QueueBuffer(store, nodeId, size, queueDepth, append, truncate, executor);
			default:
				throw new RuntimeException("dead code");
		}
	}

	public abstract WriteBufferType type();

	/**
	 * accept len bytes, may block while a previous upload is pending
	 */
	public abstract void write(byte[] b, int off, int len) throws IOException;

	/**
	 * push every byte accepted so far to the store and wait for it
	 */
	public abstract void flush() throws IOException;

	public final void write(byte[] b) throws IOException {
		write(b, 0, b.length);
	}

	public final boolean closed() {
		return closed;
	}

	public final String nodeId() {
		return nodeId;
	}

	/**
	 * flush, then empty the content if the handle truncates and nothing was uploaded
	 */
	public void close() throws IOException {
		if (closed) {
			return;
		}
		closed = true;
		flush();
		if (truncate && !uploaded) {
			store.writeContent(nodeId, new byte[0], 0, 0, nextReplace());
		}
		logger.debug(type() + " buffer of " + nodeId + " closed");
	}

	protected final void ensureOpen() throws IOException {
		if (closed) {
			throw new IOException("write buffer of " + nodeId + " is closed");
		}
	}

	/**
	 * hand a background upload to the executor, a shut down executor fails the write
	 */
	protected final <T> Future<T> submit(ExecutorService executor, Callable<T> task) throws IOException {
		try {
			return executor.submit(task);
		} catch (RejectedExecutionException ex) {
			throw shutDown(ex);
		}
	}

	protected final void ensureRunning(ExecutorService executor) throws IOException {
		if (executor.isShutdown()) {
			throw shutDown(null);
		}
	}

	private final IOException shutDown(RejectedExecutionException cause) {
		return new IOException("uploader shut down, content of " + nodeId + " not written", cause);
	}

	protected final static void checkRange(byte[] b, int off, int len) {
		if (off < 0 || len < 0 || off + len > b.length) {
			throw new IndexOutOfBoundsException("off " + off + ", len " + len + ", length " + b.length);
		}
	}

	/**
	 * consume the replace flag, must be called in write order
	 * @return true if the upload about to start replaces the content
	 */
	protected final synchronized boolean nextReplace() {
		boolean ret;
		ret = replace;
		replace = false;
		uploaded = true;
		return ret;
	}

	protected final void upload(byte[] b, int off, int len) throws IOException {
		store.writeContent(nodeId, b, off, len, nextReplace());
	}

	protected final long upload(InputStream in, boolean replace) throws IOException {
		return store.uploadContent(nodeId, in, replace);
	}

	/**
	 * wait for a background upload, rethrowing its failure
	 */
	protected final static <T> T await(Future<T> future) throws IOException {
		try {
			return future.get();
		} catch (InterruptedException ex) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			throw new InterruptedIOException("interrupted while waiting for upload");
		} catch (ExecutionException ex) {
			if (ex.getCause() instanceof IOException) {
				throw (IOException) ex.getCause();
			}
			throw new IOException("background upload failed", ex.getCause());
		}
	}
}
