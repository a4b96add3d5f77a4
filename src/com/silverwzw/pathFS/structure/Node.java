package com.silverwzw.pathFS.structure;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;

/**
 * Immutable snapshot of one node of the remote store.
 * A fresh lookup always produces a new instance.
 * @author silverwzw
 */
public final class Node {

	public static enum NodeType {
		FILE,
		DIRECTORY;
		public final static NodeType getType(String type) {
			if (type == null) {
				return FILE;
			}
			try {
				return valueOf(type.toUpperCase());
			} catch (IllegalArgumentException ex) {
				return FILE;
			}
		}
	}

	private final String id;
	private final String name;
	private final List<String> parents;
	private final NodeType type;
	private final long size;
	private final long modify, access;
	private final int mode;
	private final boolean trashed;

	public Node(String id, String name, List<String> parents, NodeType type, long size, Date modify, Date access, int mode, boolean trashed) {
		if (id == null) {
			throw new NullPointerException("node id");
		}
		this.id = id;
		this.name = name == null ? "" : name;
		this.parents = parents == null
				? Collections.<String>emptyList()
				: Collections.unmodifiableList(new ArrayList<String>(parents));
		this.type = type == null ? NodeType.FILE : type;
		this.size = size;
		this.modify = modify == null ? 0 : modify.getTime();
		this.access = access == null ? this.modify : access.getTime();
		this.mode = mode;
		this.trashed = trashed;
	}

	public final String id() {
		return id;
	}

	public final String name() {
		return name;
	}

	/**
	 * @return parent ids in backend order, possibly empty, never null
	 */
	public final List<String> parents() {
		return parents;
	}

	public final NodeType type() {
		return type;
	}

	public final boolean isDirectory() {
		return type == NodeType.DIRECTORY;
	}

	public final long size() {
		return size;
	}

	public final Date modify() {
		return new Date(modify);
	}

	public final Date access() {
		return new Date(access);
	}

	public final int mode() {
		return mode;
	}

	public final boolean trashed() {
		return trashed;
	}

	public final boolean sameNode(Node o) {
		return o != null && id.equals(o.id);
	}

	public final String toString() {
		return (isDirectory() ? "d " : "- ") + name + " (" + id + ", " + size + " byte" + (trashed ? ", trashed" : "") + ")";
	}
}
