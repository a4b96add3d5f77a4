package com.silverwzw.pathFS.store;

import java.io.InputStream;
import java.util.List;

import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.structure.Node.NodeType;

/**
 * The remote calls the filesystem needs from the node store.
 * Every method is one round trip (or a short fixed sequence of them) and is safe to call concurrently.
 * Nodes are addressed by opaque id only; there is no notion of path at this level.
 * @author silverwzw
 */
public interface NodeStore {

	/**
	 * @return the backend's absolute top node
	 */
	Node top() throws StoreException;

	/**
	 * @return the node, trashed or not, or null if the id is unknown
	 */
	Node get(String id) throws StoreException;

	/**
	 * find a non trashed child by name. When the backend holds several, the oldest wins.
	 * @return the child or null
	 */
	Node findChild(String parentId, String name) throws StoreException;

	/**
	 * list non trashed children ordered by name then id.
	 * @param pageToken null for the first page, otherwise {@link ChildPage#nextToken()} of the previous page
	 * @param limit maximum entries in the page, must be positive
	 */
	ChildPage children(String parentId, String pageToken, int limit) throws StoreException;

	/**
	 * create an empty node under parentId.
	 * @throws StoreException.AlreadyExists if a non trashed sibling has the same name
	 */
	Node create(String parentId, String name, NodeType type, int mode) throws StoreException;

	/**
	 * apply all fields of the patch in one atomic update.
	 * @return the node after the update
	 * @throws StoreException.AlreadyExists if the new name/parents collide with a live sibling
	 */
	Node patch(String id, NodePatch patch) throws StoreException;

	/**
	 * delete permanently, cascading to every descendant only reachable through this node.
	 */
	void delete(String id) throws StoreException;

	/**
	 * @return every trashed node known to the backend
	 */
	List<Node> trashed() throws StoreException;

	/**
	 * one content patch.
	 * @param replace true to replace the whole content, false to append
	 */
	void writeContent(String id, byte[] data, int off, int len, boolean replace) throws StoreException;

	/**
	 * one continuous upload consuming the stream until its end.
	 * @param replace true to replace the whole content, false to append
	 * @return number of bytes uploaded
	 */
	long uploadContent(String id, InputStream in, boolean replace) throws StoreException;

	/**
	 * @return a stream over the content starting at offset
	 */
	InputStream openContent(String id, long offset) throws StoreException;
}
