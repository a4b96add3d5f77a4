package com.silverwzw.pathFS;

import java.util.LinkedList;

import org.apache.log4j.Logger;

import com.silverwzw.pathFS.store.NodeStore;
import com.silverwzw.pathFS.store.StoreException;
import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.util.Helper;
import com.silverwzw.pathFS.util.Path2NodeCache;

/**
 * Holds the active root and turns root relative paths into nodes.
 * Each segment is a cache hit on (parent id, name) or one findChild round trip.
 * Concurrent resolutions of the same path may both go to the store, nothing here blocks.
 * @author silverwzw
 */
public final class PathResolver {

	private static final Logger logger;
	private static final int MAX_DEPTH;

	static {
		logger = Logger.getLogger(PathResolver.class);
		MAX_DEPTH = 4096;
	}

	/**
	 * outcome of {@link PathResolver#isInRoot(Node)}
	 */
	public final static class InRoot {
		private final boolean inRoot;
		private final String path;

		InRoot(boolean inRoot, String path) {
			this.inRoot = inRoot;
			this.path = path;
		}

		public final boolean inRoot() {
			return inRoot;
		}

		/**
		 * @return path relative to the active root, null if not in root
		 */
		public final String path() {
			return path;
		}
	}

	private final NodeStore store;
	private final Path2NodeCache cache;
	private volatile Node top, root;

	public PathResolver(NodeStore store, Path2NodeCache cache) throws FSException {
		this.store = store;
		this.cache = cache;
		try {
			top = store.top();
		} catch (StoreException ex) {
			throw new FSException.Remote("top", "", ex);
		}
		root = top;
	}

	public final Node top() {
		return top;
	}

	public final Node root() {
		return root;
	}

	public final Path2NodeCache cache() {
		return cache;
	}

	/**
	 * resolve path from the backend top and make it the active root
	 */
	public final Node setRootDirectory(String path) throws FSException {
		Node node;
		path = Helper.normalize(path);
		node = resolveFrom(top, path);
		if (!node.isDirectory()) {
			throw new FSException.NotADirectory(path);
		}
		root = node;
		logger.info("root set to /" + path + " (" + node.id() + ")");
		return node;
	}

	/**
	 * adopt a node as root by id, its ancestry is not checked
	 */
	public final Node setRootNode(String id) throws FSException {
		Node node;
		try {
			node = store.get(id);
		} catch (StoreException ex) {
			throw new FSException.Remote("setroot", id, ex);
		}
		if (node == null) {
			throw new FSException.NotExist(id);
		}
		root = node;
		logger.info("root set to node " + id);
		return node;
	}

	public final Node resolve(String path) throws FSException {
		return resolveFrom(root, path);
	}

	/**
	 * @param path normalized path relative to start
	 * @throws FSException.NotExist naming the shortest prefix that does not resolve
	 * @throws FSException.NotADirectory naming the prefix that is a file
	 */
	public final Node resolveFrom(Node start, String path) throws FSException {
		Node cur;
		String walked;

		cur = start;
		walked = "";
		for (String seg : Helper.split(path)) {
			Node next;
			if (!cur.isDirectory()) {
				throw new FSException.NotADirectory(walked);
			}
			walked = Helper.buildPath(walked, seg);
			next = child(cur, seg, walked);
			if (next == null) {
				throw new FSException.NotExist(walked);
			}
			cur = next;
		}
		return cur;
	}

	/**
	 * @param path path of the child, for error reporting
	 * @return the live child named name, null if there is none
	 */
	public final Node child(Node parent, String name, String path) throws FSException {
		Node node;
		node = cache.get(parent.id(), name);
		if (node != null) {
			return node;
		}
		try {
			node = store.findChild(parent.id(), name);
		} catch (StoreException ex) {
			throw new FSException.Remote("resolve", path, ex);
		}
		if (node != null) {
			cache.put(parent.id(), node);
		}
		return node;
	}

	/**
	 * Walk the parent chain of node up to the active root.
	 * With several parent links the first one that exists and is not trashed is followed;
	 * a node without parents is only reachable if it is the root itself.
	 */
	public final InRoot isInRoot(Node node) throws FSException {
		LinkedList<String> names;
		Node cur, rootNode;
		int depth;

		names = new LinkedList<String>();
		rootNode = root;
		cur = node;
		depth = 0;
		while (!cur.id().equals(rootNode.id())) {
			Node parent;
			if (++depth > MAX_DEPTH) {
				logger.warn("parent chain of " + node.id() + " is deeper than " + MAX_DEPTH + ", cycle?");
				return new InRoot(false, null);
			}
			parent = null;
			for (String pid : cur.parents()) {
				Node p;
				try {
					p = store.get(pid);
				} catch (StoreException ex) {
					throw new FSException.Remote("ancestry", node.id(), ex);
				}
				if (p != null && !p.trashed()) {
					parent = p;
					break;
				}
			}
			if (parent == null) {
				return new InRoot(false, null);
			}
			names.addFirst(cur.name());
			cur = parent;
		}
		return new InRoot(true, Helper.buildPath(names.toArray(new String[names.size()])));
	}
}
