package com.silverwzw.pathFS.buffer;

import java.io.IOException;

import com.silverwzw.pathFS.store.NodeStore;

/**
 * one buffer, a full buffer is uploaded before the write returns
 */
final class SimpleBuffer extends WriteBuffer {

	private final byte[] buf;
	private int pos;

	SimpleBuffer(NodeStore store, String nodeId, int size, boolean append, boolean truncate) {
		super(store, nodeId, append, truncate);
		buf = new byte[size];
		pos = 0;
	}

	public final WriteBufferType type() {
		return WriteBufferType.SIMPLE;
	}

	public final void write(byte[] b, int off, int len) throws IOException {
		checkRange(b, off, len);
		ensureOpen();
		while (len > 0) {
			int n;
			n = Math.min(len, buf.length - pos);
			System.arraycopy(b, off, buf, pos, n);
			pos += n;
			off += n;
			len -= n;
			if (pos == buf.length) {
				flush();
			}
		}
	}

	public final void flush() throws IOException {
		if (pos > 0) {
			upload(buf, 0, pos);
			pos = 0;
		}
	}
}
