package com.silverwzw.pathFS;

import java.util.Date;

import com.silverwzw.pathFS.structure.Node;

/**
 * path addressed filesystem operations. Paths are relative to the active root, "" is the root itself.
 * @author silverwzw
 */
public interface VirtualFileSystem {

	String name();

	/**
	 * open read only
	 */
	FileHandle open(String path) throws FSException;

	/**
	 * open read write, creating the file (and its missing parents) or truncating it
	 */
	FileHandle create(String path) throws FSException;

	/**
	 * @param flags combination of the O_* flags in {@link com.silverwzw.pathFS.util.Constant}
	 * @param mode used if the file is created
	 */
	FileHandle openFile(String path, int flags, int mode) throws FSException;

	void mkdir(String path, int mode) throws FSException;

	void mkdirAll(String path, int mode) throws FSException;

	Node stat(String path) throws FSException;

	void rename(String oldPath, String newPath) throws FSException;

	void remove(String path) throws FSException;

	/**
	 * like remove, a missing path is not an error
	 */
	void removeAll(String path) throws FSException;

	void chmod(String path, int mode) throws FSException;

	void chtimes(String path, Date atime, Date mtime) throws FSException;

	/**
	 * always fails {@link FSException.NotSupported}
	 */
	void chown(String path, int uid, int gid) throws FSException;

	/**
	 * always fails {@link FSException.NotSupported}
	 */
	void truncate(String path, long size) throws FSException;
}
