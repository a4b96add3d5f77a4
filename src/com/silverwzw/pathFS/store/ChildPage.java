package com.silverwzw.pathFS.store;

import java.util.List;

import com.silverwzw.pathFS.structure.Node;

/**
 * one page of a children listing plus the token of the next page (null when exhausted).
 * @author silverwzw
 */
public final class ChildPage {
	private final List<Node> nodes;
	private final String nextToken;

	public ChildPage(List<Node> nodes, String nextToken) {
		this.nodes = nodes;
		this.nextToken = nextToken;
	}

	public final List<Node> nodes() {
		return nodes;
	}

	public final String nextToken() {
		return nextToken;
	}

	public final boolean last() {
		return nextToken == null;
	}
}
