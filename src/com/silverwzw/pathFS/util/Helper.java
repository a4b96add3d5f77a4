package com.silverwzw.pathFS.util;

import java.util.LinkedList;
import java.util.List;


/**
 * Helper Class, root relative paths: "" is the root, segments are joined by '/', no leading or trailing '/'
 * @author silverwzw
 *
 */
public final class Helper {

	public static final char separatorChar = '/';
	public static final String separator = "/";

	/**
	 * Build a path, e.g. input [a,b,c] returns a/b/c
	 * @param args directory names
	 * @return corresponding path
	 */
	public static final String buildPath(String ... args) {
		StringBuilder path;
		path = new StringBuilder();
		for (String dir : args) {
			if (dir == null || dir.isEmpty()) {
				continue;
			}
			if (path.length() > 0) {
				path.append(separatorChar);
			}
			path.append(dir);
		}
		return path.toString();
	}
	/**
	 * normalize a user supplied path: drop empty and "." segments, apply "..", never go above the root
	 * @param path any path, null is the root
	 * @return root relative normalized path
	 */
	public static final String normalize(String path) {
		if (path == null) {
			return "";
		}
		LinkedList<String> comps;
		comps = new LinkedList<String>();
		for (String comp : path.split(separator)) {
			if (comp.isEmpty() || comp.equals(".")) {
				continue;
			}
			if (comp.equals("..")) {
				if (!comps.isEmpty()) {
					comps.removeLast();
				}
				continue;
			}
			comps.add(comp);
		}
		return buildPath(comps.toArray(new String[comps.size()]));
	}
	/**
	 * @param path normalized path
	 * @return segments, empty for the root
	 */
	public static final List<String> split(String path) {
		List<String> comps;
		comps = new LinkedList<String>();
		if (path.isEmpty()) {
			return comps;
		}
		for (String comp : path.split(separator)) {
			comps.add(comp);
		}
		return comps;
	}
	/**
	 * return parent path in string
	 * @param path normalized path
	 * @return parent path, "" for top level entries and for the root itself
	 */
	public static final String parentPath(String path) {
		int last;
		last = path.lastIndexOf(separatorChar);
		if (last == -1) {
			return "";
		}
		return path.substring(0, last);
	}
	public static final String nameOf(String path) {
		return path.substring(path.lastIndexOf(separatorChar) + 1);
	}
	public static final boolean isRoot(String path) {
		return path.isEmpty();
	}
	/**
	 * @return true if path equals ancestor or lies beneath it
	 */
	public static final boolean within(String path, String ancestor) {
		if (ancestor.isEmpty() || path.equals(ancestor)) {
			return true;
		}
		return path.startsWith(ancestor) && path.charAt(ancestor.length()) == separatorChar;
	}
}
