package com.silverwzw.pathFS.util;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.Map.Entry;

import com.silverwzw.pathFS.structure.Node;

/**
 * Bounded move-to-front cache of path segments, keyed by (parent id, child name).
 * Keys never contain a path, so renaming a directory does not invalidate what lies beneath it
 * and switching the root needs no eviction.
 * @author silverwzw
 */
public final class Path2NodeCache {
	protected HashMap<String, Node> map;
	protected LinkedList<String> mtfList;
	protected int size;

	public Path2NodeCache(int size) {
		this.size = size;
		if (size > 0) {
			map = new HashMap<String, Node>();
			mtfList = new LinkedList<String>();
		}
	}

	private static final String key(String parentId, String name) {
		return parentId + Helper.separator + name;
	}

	public synchronized void put(String parentId, Node node) {
		if (size < 1) {
			return;
		}
		String key;
		key = key(parentId, node.name());
		if (map.put(key, node) != null) {
			mtfList.remove(key);
		}
		mtfList.offerFirst(key);
		while (mtfList.size() > size) {
			map.remove(mtfList.removeLast());
		}
	}

	public synchronized Node get(String parentId, String name) {
		if (size < 1) {
			return null;
		}
		String key;
		Node ret;
		key = key(parentId, name);
		ret = map.get(key);
		if (ret != null) {
			mtfList.remove(key);
			mtfList.offerFirst(key);
		}
		return ret;
	}

	public synchronized void dirty(String parentId, String name) {
		if (size > 0) {
			String key;
			key = key(parentId, name);
			if (map.remove(key) != null) {
				mtfList.remove(key);
			}
		}
	}

	/**
	 * evict the entry of node and every cached entry lying beneath it
	 */
	public synchronized void dirtyTree(String parentId, Node node) {
		if (size < 1) {
			return;
		}
		LinkedList<String> frontier;

		dirty(parentId, node.name());
		frontier = new LinkedList<String>();
		frontier.add(node.id());
		while (!frontier.isEmpty()) {
			String prefix;
			Iterator<Entry<String, Node>> it;

			prefix = frontier.removeFirst() + Helper.separator;
			it = map.entrySet().iterator();
			while (it.hasNext()) {
				Entry<String, Node> en;
				en = it.next();
				if (en.getKey().startsWith(prefix)) {
					frontier.add(en.getValue().id());
					mtfList.remove(en.getKey());
					it.remove();
				}
			}
		}
	}

	public synchronized int count() {
		return size < 1 ? 0 : map.size();
	}

	public synchronized void clear() {
		if (size > 0) {
			map = new HashMap<String, Node>();
			mtfList = new LinkedList<String>();
		}
	}
}
