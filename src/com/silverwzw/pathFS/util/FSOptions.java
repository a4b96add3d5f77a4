package com.silverwzw.pathFS.util;

import com.mongodb.BasicDBObject;
import com.mongodb.DBCollection;
import com.mongodb.DBObject;

/**
 * Store side parameters, read from the parameters collection.
 * Each parameter is one document {_id: name, value: value}; missing documents keep the default.
 * @author silverwzw
 */
public final class FSOptions {
	private int block_size;
	private String node_collection, chunk_collection;
	private String top;
	private final String fsoptions_collection;
	{
		block_size = 256 * 1024;
		node_collection = "node";
		chunk_collection = "chunk";
		top = null;
	}
	public FSOptions(DBCollection dbcoll) {
		DBObject dbo;

		fsoptions_collection = dbcoll.getName();

		dbo = dbcoll.findOne(new BasicDBObject("_id", "block_size"));
		if (dbo != null) {
			block_size = ((Number) dbo.get("value")).intValue();
			if (block_size < 1) {
				block_size = 1;
			}
		}

		dbo = dbcoll.findOne(new BasicDBObject("_id", "node_collection"));
		if (dbo != null) {
			String value = (String) dbo.get("value");
			if (!value.isEmpty()) {
				node_collection = value;
			}
		}

		dbo = dbcoll.findOne(new BasicDBObject("_id", "chunk_collection"));
		if (dbo != null) {
			String value = (String) dbo.get("value");
			if (!value.isEmpty()) {
				chunk_collection = value;
			}
		}

		dbo = dbcoll.findOne(new BasicDBObject("_id", "top"));
		if (dbo != null && dbo.get("value") != null) {
			top = dbo.get("value").toString();
		}
	}
	public final String toString(){
		return
				"block_size = " + block_size + "byte\n"
				+ "node collection : " + node_collection + "\n"
				+ "chunk collection : " + chunk_collection + "\n"
				+ "top : " + (top == null ? "<not formatted>" : top) + "\n";
	}
	/**
	 * @return largest chunk document written by a content patch, in bytes
	 */
	public final int block_size(){
		return block_size;
	}
	public final String fsoptions_collection_name() {
		return fsoptions_collection;
	}
	public final String node_collection() {
		return node_collection;
	}
	public final String chunk_collection() {
		return chunk_collection;
	}
	/**
	 * @return hex id of the backend top node, null if the store was never formatted
	 */
	public final String top() {
		return top;
	}
	public final void top(String top) {
		this.top = top;
	}
}
