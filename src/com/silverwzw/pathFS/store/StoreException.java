package com.silverwzw.pathFS.store;

import java.io.IOException;

/**
 * failure reported by a {@link NodeStore}. Driver exceptions are wrapped, never leaked.
 * @author silverwzw
 */
@SuppressWarnings("serial")
public class StoreException extends IOException {

	public StoreException(String message) {
		super(message);
	}

	public StoreException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * a live (non trashed) sibling already carries the requested name
	 */
	public static class AlreadyExists extends StoreException {
		private final String parentId, name;

		public AlreadyExists(String parentId, String name, Throwable cause) {
			super("node " + name + " already exists under " + parentId, cause);
			this.parentId = parentId;
			this.name = name;
		}

		public final String parentId() {
			return parentId;
		}

		public final String name() {
			return name;
		}
	}
}
