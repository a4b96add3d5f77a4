package com.silverwzw.pathFS;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.log4j.Level;
import org.apache.log4j.Logger;

import com.silverwzw.pathFS.buffer.WriteBuffer;
import com.silverwzw.pathFS.buffer.WriteBufferType;
import com.silverwzw.pathFS.store.ChildPage;
import com.silverwzw.pathFS.store.NodePatch;
import com.silverwzw.pathFS.store.NodeStore;
import com.silverwzw.pathFS.store.StoreException;
import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.structure.Node.NodeType;
import com.silverwzw.pathFS.structure.TrashEntry;
import com.silverwzw.pathFS.util.Constant;
import com.silverwzw.pathFS.util.Helper;
import com.silverwzw.pathFS.util.MountOptions;
import com.silverwzw.pathFS.util.Path2NodeCache;

/**
 * Path addressed filesystem over a {@link NodeStore}.
 * Safe for concurrent use, operations on disjoint paths never wait for each other.
 * Every operation is logged to the "FSOP" logger as the operation line followed by its outcome.
 * @author silverwzw
 */
public class PathFS implements VirtualFileSystem, Closeable {

	private static final Logger logger;
	private static final Logger quiet;

	static {
		logger = Logger.getLogger(PathFS.class);
		quiet = Logger.getLogger("FSOP.quiet");
		quiet.setLevel(Level.OFF);
		quiet.setAdditivity(false);
	}

	private final NodeStore store;
	private final Path2NodeCache path2nodeCache;
	private final PathResolver resolver;
	private final TrashBin trashBin;
	private final ExecutorService uploader;

	private volatile Logger fsoplogger;
	private volatile boolean trashForDelete;
	private volatile WriteBufferType writeBufferType;
	private volatile int writeBufferSize, queueDepth;

	{
		fsoplogger = Logger.getLogger("FSOP");
		trashForDelete = false;
		writeBufferType = WriteBufferType.SIMPLE;
		writeBufferSize = 16 * 1024;
		queueDepth = 4;
	}

	/**
	 * @param cacheSize path cache entries, 0 or less disables the cache
	 */
	public PathFS(NodeStore store, int cacheSize) throws FSException {
		this.store = store;
		path2nodeCache = new Path2NodeCache(cacheSize);
		resolver = new PathResolver(store, path2nodeCache);
		trashBin = new TrashBin(store, resolver);
		uploader = Executors.newCachedThreadPool(new ThreadFactory() {
			private final AtomicInteger count = new AtomicInteger();
			public Thread newThread(Runnable r) {
				Thread t;
				t = new Thread(r, "pathfs-upload-" + count.incrementAndGet());
				t.setDaemon(true);
				return t;
			}
		});
	}

	public PathFS(NodeStore store) throws FSException {
		this(store, 1000);
	}

	/**
	 * configure from parsed options, root included
	 */
	public PathFS(NodeStore store, MountOptions options) throws FSException {
		this(store, options.cacheSize());
		trashForDelete = options.trashForDelete();
		setWriteBuffer(options.bufferType(), options.bufferSize());
		setQueueDepth(options.queueDepth());
		if (options.rootId() != null) {
			setRootNode(options.rootId());
		} else if (!options.rootPath().isEmpty()) {
			setRootDirectory(options.rootPath());
		}
		logger.info("PathFS ready, " + options);
	}

	public final String name() {
		return "PathFS";
	}

	/**
	 * replace the operation logger, null turns operation logging off
	 */
	public final void setLog(Logger logger) {
		fsoplogger = logger == null ? quiet : logger;
	}

	public final NodeStore store() {
		return store;
	}

	public final Node root() {
		return resolver.root();
	}

	public final Node setRootDirectory(String path) throws FSException {
		fsoplogger.info("setroot : " + path);
		try {
			Node node;
			node = resolver.setRootDirectory(path);
			fsoplogger.info("\t0");
			return node;
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final void setRootNode(String id) throws FSException {
		fsoplogger.info("setroot : #" + id);
		try {
			resolver.setRootNode(id);
			fsoplogger.info("\t0");
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final boolean trashForDelete() {
		return trashForDelete;
	}

	/**
	 * @param trash true to trash instead of deleting on remove
	 */
	public final void setTrashForDelete(boolean trash) {
		trashForDelete = trash;
	}

	public final WriteBufferType writeBufferType() {
		return writeBufferType;
	}

	public final int writeBufferSize() {
		return writeBufferSize;
	}

	/**
	 * strategy and size for handles opened from now on
	 */
	public final void setWriteBuffer(WriteBufferType type, int size) {
		if (size < 1) {
			throw new IllegalArgumentException("buffer size must be positive : " + size);
		}
		writeBufferType = type == null ? WriteBufferType.SIMPLE : type;
		writeBufferSize = size;
	}

	public final int queueDepth() {
		return queueDepth;
	}

	public final void setQueueDepth(int depth) {
		if (depth < 1) {
			throw new IllegalArgumentException("queue depth must be positive : " + depth);
		}
		queueDepth = depth;
	}

	public final FileHandle open(String path) throws FSException {
		return openFile(path, Constant.O_RDONLY, 0);
	}

	public final FileHandle create(String path) throws FSException {
		return openFile(path, Constant.O_RDWR | Constant.O_CREATE | Constant.O_TRUNC, Constant.DEFAULT_FILE_MODE);
	}

	public final FileHandle openFile(String path, int flags, int mode) throws FSException {
		fsoplogger.info("open : " + path + ", 0" + Integer.toOctalString(flags));
		try {
			String p;
			boolean writable;
			Node parent, node;
			WriteBuffer buffer;
			FileHandle handle;

			p = Helper.normalize(path);
			writable = (flags & Constant.O_ACCMODE) != Constant.O_RDONLY;

			if (Helper.isRoot(p) && (writable || (flags & Constant.O_CREATE) != 0)) {
				throw new FSException.EmptyPath();
			}
			if (Helper.isRoot(p)) {
				parent = null;
				node = resolver.root();
			} else {
				try {
					parent = directory(Helper.parentPath(p));
					node = resolver.child(parent, Helper.nameOf(p), p);
					if (node == null) {
						throw new FSException.NotExist(p);
					}
				} catch (FSException.NotExist ex) {
					if ((flags & Constant.O_CREATE) == 0 || !writable) {
						throw ex;
					}
					parent = makeDirs(Helper.parentPath(p), Constant.DEFAULT_DIR_MODE);
					node = makeNode(parent, Helper.nameOf(p), p, NodeType.FILE, mode);
				}
			}

			if (node.isDirectory() && writable) {
				throw new FSException.IsADirectory(p);
			}
			buffer = null;
			if (writable) {
				buffer = WriteBuffer.create(
						writeBufferType,
						store,
						node.id(),
						writeBufferSize,
						queueDepth,
						(flags & Constant.O_APPEND) != 0,
						(flags & Constant.O_TRUNC) != 0,
						uploader);
			}
			handle = new FileHandle(store, path2nodeCache, fsoplogger, p, parent == null ? null : parent.id(), node, buffer);
			fsoplogger.info("\t0");
			return handle;
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final void mkdir(String path, int mode) throws FSException {
		fsoplogger.info("mkdir : " + path);
		try {
			String p;
			Node parent, node;

			p = Helper.normalize(path);
			if (!Helper.isRoot(p)) {
				parent = directory(Helper.parentPath(p));
				node = resolver.child(parent, Helper.nameOf(p), p);
				if (node == null) {
					node = makeNode(parent, Helper.nameOf(p), p, NodeType.DIRECTORY, mode);
				}
				if (!node.isDirectory()) {
					throw new FSException.NotADirectory(p);
				}
			}
			fsoplogger.info("\t0");
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final void mkdirAll(String path, int mode) throws FSException {
		fsoplogger.info("mkdirAll : " + path);
		try {
			makeDirs(Helper.normalize(path), mode);
			fsoplogger.info("\t0");
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final Node stat(String path) throws FSException {
		fsoplogger.info("stat : " + path);
		try {
			String p;
			Node node;

			p = Helper.normalize(path);
			if (Helper.isRoot(p)) {
				node = fetch(resolver.root().id(), p);
			} else {
				node = resolver.resolve(p);
			}
			fsoplogger.info("\t0");
			return node;
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final void rename(String oldPath, String newPath) throws FSException {
		fsoplogger.info("rename : " + oldPath + " -> " + newPath);
		try {
			String from, to;
			Node srcParent, src, dstParent, target, moved;
			NodePatch patch;

			from = Helper.normalize(oldPath);
			to = Helper.normalize(newPath);
			if (Helper.isRoot(from)) {
				throw new FSException.ForbiddenRoot();
			}
			if (Helper.isRoot(to)) {
				throw new FSException.EmptyPath();
			}

			srcParent = directory(Helper.parentPath(from));
			src = resolver.child(srcParent, Helper.nameOf(from), from);
			if (src == null) {
				throw new FSException.NotExist(from);
			}
			if (from.equals(to)) {
				fsoplogger.info("\t0");
				return;
			}
			if (Helper.within(to, from)) {
				throw new FSException.InvalidArgument("cannot move " + from + " beneath itself");
			}

			dstParent = directory(Helper.parentPath(to));
			target = resolver.child(dstParent, Helper.nameOf(to), to);
			if (target != null && !target.sameNode(src)) {
				replaceable(src, target, to);
				discard(dstParent, target, to);
			}

			patch = new NodePatch().name(Helper.nameOf(to));
			if (!srcParent.sameNode(dstParent)) {
				List<String> parents;
				parents = new ArrayList<String>(src.parents().size());
				for (String pid : src.parents()) {
					parents.add(pid.equals(srcParent.id()) ? dstParent.id() : pid);
				}
				if (!parents.contains(dstParent.id())) {
					parents.add(dstParent.id());
				}
				patch.parents(parents);
			}
			try {
				moved = store.patch(src.id(), patch);
			} catch (StoreException ex) {
				throw new FSException.Remote("rename", from, ex);
			} finally {
				path2nodeCache.dirty(srcParent.id(), src.name());
			}
			path2nodeCache.put(dstParent.id(), moved);
			fsoplogger.info("\t0");
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final void remove(String path) throws FSException {
		fsoplogger.info("remove : " + path);
		try {
			removePath(Helper.normalize(path));
			fsoplogger.info("\t0");
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final void removeAll(String path) throws FSException {
		fsoplogger.info("removeAll : " + path);
		try {
			try {
				removePath(Helper.normalize(path));
			} catch (FSException.NotExist ex) {
				fsoplogger.info("\t0 (absent)");
				return;
			}
			fsoplogger.info("\t0");
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	/**
	 * a missing path is accepted and left alone
	 */
	public final void chmod(String path, int mode) throws FSException {
		fsoplogger.info("chmod : " + path + ", 0" + Integer.toOctalString(mode));
		try {
			if (!update(Helper.normalize(path), "chmod", new NodePatch().mode(mode))) {
				fsoplogger.info("\t0 (absent)");
				return;
			}
			fsoplogger.info("\t0");
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	/**
	 * a missing path is accepted and left alone
	 */
	public final void chtimes(String path, Date atime, Date mtime) throws FSException {
		fsoplogger.info("chtimes : " + path);
		try {
			NodePatch patch;
			patch = new NodePatch();
			if (atime != null) {
				patch.access(atime);
			}
			if (mtime != null) {
				patch.modify(mtime);
			}
			if (!update(Helper.normalize(path), "chtimes", patch)) {
				fsoplogger.info("\t0 (absent)");
				return;
			}
			fsoplogger.info("\t0");
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final void chown(String path, int uid, int gid) throws FSException {
		fsoplogger.info("chown : " + path);
		throw failed(new FSException.NotSupported());
	}

	public final void truncate(String path, long size) throws FSException {
		fsoplogger.info("truncate : " + path + ", " + size);
		throw failed(new FSException.NotSupported());
	}

	/**
	 * flag the node trashed whatever {@link #trashForDelete()} says
	 */
	public final Node trashPath(String path) throws FSException {
		fsoplogger.info("trash : " + path);
		try {
			Node node;
			node = trashBin.trashPath(Helper.normalize(path));
			fsoplogger.info("\t0");
			return node;
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	/**
	 * @param scope path the entries must lie at or beneath, "" for the whole root
	 * @param limit maximum entries, 0 or less for all
	 */
	public final List<TrashEntry> listTrash(String scope, int limit) throws FSException {
		fsoplogger.info("lstrash : " + scope + ", " + limit);
		try {
			List<TrashEntry> entries;
			entries = trashBin.listTrash(scope, limit);
			fsoplogger.info("\t" + entries.size());
			return entries;
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	public final Node restore(TrashEntry entry) throws FSException {
		fsoplogger.info("restore : " + entry.path());
		try {
			Node node;
			node = trashBin.restore(entry);
			fsoplogger.info("\t0");
			return node;
		} catch (FSException ex) {
			throw failed(ex);
		}
	}

	/**
	 * stop the upload threads, handles still open can no longer flush in background
	 */
	public void close() {
		uploader.shutdown();
		logger.info("PathFS closed, " + path2nodeCache.count() + " cached entries dropped");
		path2nodeCache.clear();
	}

	private final FSException failed(FSException ex) {
		String code;
		if (ex instanceof FSException.NotExist) {
			code = "ENOENT";
		} else if (ex instanceof FSException.NotADirectory) {
			code = "ENOTDIR";
		} else if (ex instanceof FSException.IsADirectory) {
			code = "EISDIR";
		} else if (ex instanceof FSException.ForbiddenRoot) {
			code = "EPERM";
		} else if (ex instanceof FSException.NotSupported) {
			code = "ENOSYS";
		} else if (ex instanceof FSException.NotEmpty) {
			code = "ENOTEMPTY";
		} else if (ex instanceof FSException.Remote) {
			code = ((FSException.Remote) ex).alreadyExists() ? "EEXIST" : "EIO";
			logger.warn(ex.getMessage(), ex.getCause());
		} else {
			code = "EINVAL";
		}
		fsoplogger.info("\t" + code);
		return ex;
	}

	/**
	 * resolve path, which must be a directory
	 */
	private final Node directory(String path) throws FSException {
		Node node;
		node = resolver.resolve(path);
		if (!node.isDirectory()) {
			throw new FSException.NotADirectory(path);
		}
		return node;
	}

	private final Node fetch(String id, String path) throws FSException {
		Node node;
		try {
			node = store.get(id);
		} catch (StoreException ex) {
			throw new FSException.Remote("stat", path, ex);
		}
		if (node == null) {
			throw new FSException.NotExist(path);
		}
		return node;
	}

	/**
	 * walk from the root creating every missing directory, no rollback on failure
	 * @return the directory at path
	 */
	private final Node makeDirs(String path, int mode) throws FSException {
		Node cur;
		String walked;

		cur = resolver.root();
		walked = "";
		for (String seg : Helper.split(path)) {
			Node next;
			walked = Helper.buildPath(walked, seg);
			next = resolver.child(cur, seg, walked);
			if (next == null) {
				next = makeNode(cur, seg, walked, NodeType.DIRECTORY, mode);
			}
			if (!next.isDirectory()) {
				throw new FSException.NotADirectory(walked);
			}
			cur = next;
		}
		return cur;
	}

	/**
	 * create a node, losing the race against a concurrent creator counts as success
	 */
	private final Node makeNode(Node parent, String name, String path, NodeType type, int mode) throws FSException {
		Node node;
		try {
			node = store.create(parent.id(), name, type, mode);
		} catch (StoreException.AlreadyExists ex) {
			logger.debug(path + " created concurrently, using the existing node");
			path2nodeCache.dirty(parent.id(), name);
			node = resolver.child(parent, name, path);
			if (node == null) {
				throw new FSException.Remote("create", path, ex);
			}
			return node;
		} catch (StoreException ex) {
			throw new FSException.Remote("create", path, ex);
		}
		path2nodeCache.put(parent.id(), node);
		return node;
	}

	private final void removePath(String p) throws FSException {
		Node parent, node;

		if (Helper.isRoot(p)) {
			throw new FSException.ForbiddenRoot();
		}
		parent = directory(Helper.parentPath(p));
		node = resolver.child(parent, Helper.nameOf(p), p);
		if (node == null) {
			throw new FSException.NotExist(p);
		}
		discard(parent, node, p);
	}

	/**
	 * trash or delete, depending on {@link #trashForDelete()}
	 */
	private final void discard(Node parent, Node node, String path) throws FSException {
		if (trashForDelete) {
			trashBin.trash(parent, node, path);
			return;
		}
		try {
			store.delete(node.id());
		} catch (StoreException ex) {
			throw new FSException.Remote("delete", path, ex);
		} finally {
			path2nodeCache.dirtyTree(parent.id(), node);
		}
	}

	/**
	 * a rename target may only be replaced by a node of the same kind, a directory only while empty
	 */
	private final void replaceable(Node src, Node target, String path) throws FSException {
		ChildPage page;

		if (!src.isDirectory() && target.isDirectory()) {
			throw new FSException.IsADirectory(path);
		}
		if (src.isDirectory() && !target.isDirectory()) {
			throw new FSException.NotADirectory(path);
		}
		if (!target.isDirectory()) {
			return;
		}
		try {
			page = store.children(target.id(), null, 1);
		} catch (StoreException ex) {
			throw new FSException.Remote("rename", path, ex);
		}
		if (!page.nodes().isEmpty()) {
			throw new FSException.NotEmpty(path);
		}
	}

	/**
	 * @return false when nothing lives at p
	 */
	private final boolean update(String p, String op, NodePatch patch) throws FSException {
		Node parent, node, updated;

		if (Helper.isRoot(p)) {
			parent = null;
			node = resolver.root();
		} else {
			try {
				parent = directory(Helper.parentPath(p));
			} catch (FSException.NotExist ex) {
				return false;
			}
			node = resolver.child(parent, Helper.nameOf(p), p);
			if (node == null) {
				return false;
			}
		}
		try {
			updated = store.patch(node.id(), patch);
		} catch (StoreException ex) {
			throw new FSException.Remote(op, p, ex);
		}
		if (parent != null) {
			path2nodeCache.put(parent.id(), updated);
		}
		return true;
	}
}
