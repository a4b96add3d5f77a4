package com.silverwzw.pathFS.store;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Metadata changes applied to one node by a single atomic {@link NodeStore#patch} call.
 * Fields left unset are not touched.
 * @author silverwzw
 */
public final class NodePatch {
	private String name;
	private List<String> parents;
	private Boolean trashed;
	private Integer mode;
	private Date modify, access;

	{
		name = null;
		parents = null;
		trashed = null;
		mode = null;
		modify = null;
		access = null;
	}

	public final NodePatch name(String name) {
		this.name = name;
		return this;
	}

	/**
	 * replace the whole parent list, used for moves so name and parents change together
	 */
	public final NodePatch parents(List<String> parents) {
		this.parents = new ArrayList<String>(parents);
		return this;
	}

	public final NodePatch trashed(boolean trashed) {
		this.trashed = trashed;
		return this;
	}

	public final NodePatch mode(int mode) {
		this.mode = mode;
		return this;
	}

	public final NodePatch modify(Date modify) {
		this.modify = modify;
		return this;
	}

	public final NodePatch access(Date access) {
		this.access = access;
		return this;
	}

	public final String name() {
		return name;
	}

	public final List<String> parents() {
		return parents;
	}

	public final Boolean trashed() {
		return trashed;
	}

	public final Integer mode() {
		return mode;
	}

	public final Date modify() {
		return modify;
	}

	public final Date access() {
		return access;
	}

	public final boolean isEmpty() {
		return name == null && parents == null && trashed == null && mode == null && modify == null && access == null;
	}

	public final String toString() {
		return "Patch:{"
				+ (name == null ? "" : " name:" + name)
				+ (parents == null ? "" : " parents:" + parents)
				+ (trashed == null ? "" : " trashed:" + trashed)
				+ (mode == null ? "" : " mode:" + Integer.toOctalString(mode))
				+ (modify == null ? "" : " modify:" + modify.getTime())
				+ (access == null ? "" : " access:" + access.getTime())
				+ " }";
	}
}
