package com.silverwzw.pathFS;

import java.io.IOException;

import com.silverwzw.pathFS.store.StoreException;

/**
 * every failure reported by {@link PathFS} and {@link FileHandle}.
 * Messages are stable, callers may match on them.
 * @author silverwzw
 */
@SuppressWarnings("serial")
public class FSException extends IOException {

	protected FSException(String message) {
		super(message);
	}

	protected FSException(String message, Throwable cause) {
		super(message, cause);
	}

	/**
	 * path resolution failed, carries the shortest prefix that could not be resolved
	 */
	public static class NotExist extends FSException {
		private final String path;
		public NotExist(String path) {
			super("`" + path + "' does not exist");
			this.path = path;
		}
		public final String path() {
			return path;
		}
	}

	/**
	 * a file stands where a directory is required
	 */
	public static class NotADirectory extends FSException {
		private final String path;
		public NotADirectory(String path) {
			super("file " + path + " is not a directory");
			this.path = path;
		}
		public final String path() {
			return path;
		}
	}

	public static class IsADirectory extends FSException {
		private final String path;
		public IsADirectory(String path) {
			super("file " + path + " is a directory");
			this.path = path;
		}
		public final String path() {
			return path;
		}
	}

	public static class EmptyPath extends FSException {
		public EmptyPath() {
			super("path cannot be empty");
		}
	}

	/**
	 * rename or remove of the virtual root
	 */
	public static class ForbiddenRoot extends FSException {
		public ForbiddenRoot() {
			super("forbidden for root directory");
		}
	}

	public static class NotSupported extends FSException {
		public NotSupported() {
			super("not supported");
		}
	}

	/**
	 * a directory with children stands where an empty one is required
	 */
	public static class NotEmpty extends FSException {
		private final String path;
		public NotEmpty(String path) {
			super("directory " + path + " is not empty");
			this.path = path;
		}
		public final String path() {
			return path;
		}
	}

	public static class InvalidArgument extends FSException {
		public InvalidArgument(String message) {
			super(message);
		}
	}

	/**
	 * store failure, with the operation and path that triggered it
	 */
	public static class Remote extends FSException {
		private final String op, path;
		public Remote(String op, String path, StoreException cause) {
			super(op + " " + path + ": " + cause.getMessage(), cause);
			this.op = op;
			this.path = path;
		}
		public final String op() {
			return op;
		}
		public final String path() {
			return path;
		}
		/**
		 * @return true if the store refused because a live sibling carries the name
		 */
		public final boolean alreadyExists() {
			return getCause() instanceof StoreException.AlreadyExists;
		}
	}
}
