package com.silverwzw.pathFS.buffer;

import java.io.IOException;

import com.silverwzw.pathFS.store.NodeStore;

/**
 * no buffering, each write is its own content patch
 */
final class DirectWrite extends WriteBuffer {

	DirectWrite(NodeStore store, String nodeId, boolean append, boolean truncate) {
		super(store, nodeId, append, truncate);
	}

	public final WriteBufferType type() {
		return WriteBufferType.NONE;
	}

	public final void write(byte[] b, int off, int len) throws IOException {
		checkRange(b, off, len);
		ensureOpen();
		if (len > 0) {
			upload(b, off, len);
		}
	}

	public final void flush() {
	}
}
