package com.silverwzw.pathFS;

import java.util.LinkedList;
import java.util.List;

import org.apache.log4j.Logger;

import com.silverwzw.pathFS.PathResolver.InRoot;
import com.silverwzw.pathFS.store.NodePatch;
import com.silverwzw.pathFS.store.NodeStore;
import com.silverwzw.pathFS.store.StoreException;
import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.structure.TrashEntry;
import com.silverwzw.pathFS.util.Helper;

/**
 * Soft delete. A trashed node keeps its id and its parent links, so its path can be rebuilt later.
 * @author silverwzw
 */
public final class TrashBin {

	private static final Logger logger;

	static {
		logger = Logger.getLogger(TrashBin.class);
	}

	private final NodeStore store;
	private final PathResolver resolver;

	public TrashBin(NodeStore store, PathResolver resolver) {
		this.store = store;
		this.resolver = resolver;
	}

	/**
	 * @param path normalized, non root path
	 */
	public final Node trashPath(String path) throws FSException {
		Node parent, node;
		String parentPath;

		if (Helper.isRoot(path)) {
			throw new FSException.ForbiddenRoot();
		}
		parentPath = Helper.parentPath(path);
		parent = resolver.resolve(parentPath);
		if (!parent.isDirectory()) {
			throw new FSException.NotADirectory(parentPath);
		}
		node = resolver.child(parent, Helper.nameOf(path), path);
		if (node == null) {
			throw new FSException.NotExist(path);
		}
		return trash(parent, node, path);
	}

	/**
	 * flag node trashed, parent links untouched
	 */
	final Node trash(Node parent, Node node, String path) throws FSException {
		Node trashed;
		try {
			trashed = store.patch(node.id(), new NodePatch().trashed(true));
		} catch (StoreException ex) {
			throw new FSException.Remote("trash", path, ex);
		} finally {
			resolver.cache().dirty(parent.id(), node.name());
		}
		logger.debug("trashed " + path + " (" + node.id() + ")");
		return trashed;
	}

	/**
	 * trashed nodes reachable from the active root, with their root relative path
	 * @param scope only entries at or beneath this path, "" for all
	 * @param limit maximum entries, 0 or less for all
	 */
	public final List<TrashEntry> listTrash(String scope, int limit) throws FSException {
		List<TrashEntry> entries;
		List<Node> trashed;

		scope = Helper.normalize(scope);
		try {
			trashed = store.trashed();
		} catch (StoreException ex) {
			throw new FSException.Remote("lstrash", scope, ex);
		}

		entries = new LinkedList<TrashEntry>();
		for (Node node : trashed) {
			InRoot where;
			if (limit > 0 && entries.size() >= limit) {
				break;
			}
			where = resolver.isInRoot(node);
			if (!where.inRoot() || Helper.isRoot(where.path())) {
				continue;
			}
			if (Helper.within(where.path(), scope)) {
				entries.add(new TrashEntry(node, where.path()));
			}
		}
		return entries;
	}

	/**
	 * clear the trashed flag, parent links are left as they are
	 * @throws FSException.Remote with {@link FSException.Remote#alreadyExists()} if the path is taken again
	 */
	public final Node restore(TrashEntry entry) throws FSException {
		Node node;
		try {
			node = store.patch(entry.node().id(), new NodePatch().trashed(false));
		} catch (StoreException ex) {
			throw new FSException.Remote("restore", entry.path(), ex);
		}
		for (String pid : node.parents()) {
			resolver.cache().dirty(pid, node.name());
		}
		logger.debug("restored " + entry.path() + " (" + node.id() + ")");
		return node;
	}
}
