package com.silverwzw.pathFS.structure;

/**
 * a trashed node together with the root-relative path it had before trashing.
 * @author silverwzw
 */
public final class TrashEntry {
	private final Node node;
	private final String path;

	public TrashEntry(Node node, String path) {
		this.node = node;
		this.path = path;
	}

	public final Node node() {
		return node;
	}

	public final String path() {
		return path;
	}

	public final String toString() {
		return path + " -> " + node.id();
	}
}
