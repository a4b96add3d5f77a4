package com.silverwzw.pathFS;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.silverwzw.pathFS.buffer.WriteBuffer;
import com.silverwzw.pathFS.store.ChildPage;
import com.silverwzw.pathFS.store.NodeStore;
import com.silverwzw.pathFS.store.StoreException;
import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.util.Constant;
import com.silverwzw.pathFS.util.Helper;
import com.silverwzw.pathFS.util.Path2NodeCache;

/**
 * An open session on one node.
 * Carries a read cursor, a directory listing cursor of its own and, when writable, one {@link WriteBuffer}.
 * Written bytes are durable once {@link #close()} returned.
 * @author silverwzw
 */
public class FileHandle implements Closeable {

	private static final int LIST_PAGE;

	static {
		LIST_PAGE = 100;
	}

	private final NodeStore store;
	private final Path2NodeCache cache;
	private final Logger oplog;
	private final String path, parentId;
	private final Node node;
	private final WriteBuffer buffer;

	private InputStream content;
	private long offset;
	private String pageToken;
	private boolean listed, closed;

	{
		content = null;
		offset = 0;
		pageToken = null;
		listed = false;
		closed = false;
	}

	/**
	 * @param parentId id of the directory node was resolved under, null for the root
	 * @param buffer null for a read only session
	 */
	FileHandle(NodeStore store, Path2NodeCache cache, Logger oplog, String path, String parentId, Node node, WriteBuffer buffer) {
		this.store = store;
		this.cache = cache;
		this.oplog = oplog;
		this.path = path;
		this.parentId = parentId;
		this.node = node;
		this.buffer = buffer;
	}

	/**
	 * @return base name of the opened path, "" for the root
	 */
	public final String name() {
		return Helper.nameOf(path);
	}

	public final String path() {
		return path;
	}

	/**
	 * @return node as it was when the handle was opened
	 */
	public final Node node() {
		return node;
	}

	public final boolean writable() {
		return buffer != null;
	}

	/**
	 * fresh metadata, buffered bytes are flushed first
	 */
	public synchronized final Node stat() throws FSException {
		Node fresh;
		oplog.info("fstat : " + path);
		ensureOpen();
		flushForRead();
		try {
			fresh = store.get(node.id());
		} catch (StoreException ex) {
			oplog.info("\tEIO");
			throw new FSException.Remote("stat", path, ex);
		}
		if (fresh == null) {
			oplog.info("\tENOENT");
			throw new FSException.NotExist(path);
		}
		oplog.info("\t0");
		return fresh;
	}

	/**
	 * read from the cursor, a writable handle flushes its buffer first
	 * @return bytes read, {@link Constant#EOF} at end of content
	 */
	public synchronized final int read(byte[] b, int off, int len) throws IOException {
		int n;
		ensureOpen();
		if (node.isDirectory()) {
			throw new FSException.IsADirectory(path);
		}
		if (len == 0) {
			return 0;
		}
		if (buffer != null) {
			flushForRead();
			closeContent();
		}
		if (content == null) {
			try {
				content = store.openContent(node.id(), offset);
			} catch (StoreException ex) {
				throw new FSException.Remote("read", path, ex);
			}
		}
		n = content.read(b, off, len);
		if (n > 0) {
			offset += n;
		}
		return n < 0 ? Constant.EOF : n;
	}

	public final int read(byte[] b) throws IOException {
		return read(b, 0, b.length);
	}

	/**
	 * move the read cursor, writes stay sequential
	 */
	public synchronized final long seek(long position) throws IOException {
		ensureOpen();
		if (position < 0) {
			throw new FSException.InvalidArgument("negative position " + position + " for " + path);
		}
		if (position != offset) {
			closeContent();
			offset = position;
		}
		return offset;
	}

	public synchronized final long position() {
		return offset;
	}

	public synchronized final void write(byte[] b, int off, int len) throws IOException {
		ensureOpen();
		if (node.isDirectory()) {
			throw new FSException.IsADirectory(path);
		}
		if (buffer == null) {
			throw new FSException.InvalidArgument("file " + path + " is not opened for writing");
		}
		buffer.write(b, off, len);
	}

	public final void write(byte[] b) throws IOException {
		write(b, 0, b.length);
	}

	public final void writeString(String s) throws IOException {
		write(s.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * list children ordered by name, continuing where the previous call of this handle stopped
	 * @param limit at most this many entries, 0 or less for all remaining
	 * @return the entries, empty once the listing is exhausted
	 */
	public synchronized final List<Node> readdir(int limit) throws FSException {
		List<Node> list;

		oplog.info("readdir : " + path + ", " + limit);
		ensureOpen();
		if (!node.isDirectory()) {
			oplog.info("\tENOTDIR");
			throw new FSException.NotADirectory(path);
		}
		list = new ArrayList<Node>();
		try {
			while (!listed && (limit <= 0 || list.size() < limit)) {
				ChildPage page;
				page = store.children(node.id(), pageToken, limit <= 0 ? LIST_PAGE : limit - list.size());
				for (Node child : page.nodes()) {
					cache.put(node.id(), child);
					list.add(child);
				}
				pageToken = page.nextToken();
				listed = page.last();
			}
		} catch (StoreException ex) {
			oplog.info("\tEIO");
			throw new FSException.Remote("readdir", path, ex);
		}
		oplog.info("\t" + list.size());
		return list;
	}

	public final List<String> readdirnames(int limit) throws FSException {
		List<String> names;
		List<Node> nodes;
		nodes = readdir(limit);
		names = new ArrayList<String>(nodes.size());
		for (Node n : nodes) {
			names.add(n.name());
		}
		return names;
	}

	public final void truncate(long size) throws FSException {
		throw new FSException.NotSupported();
	}

	/**
	 * finalize buffered content, waits for pending uploads
	 */
	public synchronized void close() throws IOException {
		if (closed) {
			return;
		}
		closed = true;
		oplog.info("close : " + path);
		try {
			closeContent();
			if (buffer != null) {
				buffer.close();
			}
		} catch (IOException ex) {
			oplog.info("\tEIO");
			throw ex;
		} finally {
			if (buffer != null && parentId != null) {
				cache.dirty(parentId, node.name());
			}
		}
		oplog.info("\t0");
	}

	private final void ensureOpen() throws FSException {
		if (closed) {
			throw new FSException.InvalidArgument("file " + path + " is closed");
		}
	}

	private final void flushForRead() throws FSException {
		if (buffer == null) {
			return;
		}
		try {
			buffer.flush();
		} catch (IOException ex) {
			if (ex instanceof StoreException) {
				throw new FSException.Remote("flush", path, (StoreException) ex);
			}
			throw new FSException.Remote("flush", path, new StoreException(ex.getMessage(), ex));
		}
	}

	private final void closeContent() throws IOException {
		if (content != null) {
			InputStream in;
			in = content;
			content = null;
			in.close();
		}
	}
}
