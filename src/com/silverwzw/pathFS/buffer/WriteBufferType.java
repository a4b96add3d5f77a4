package com.silverwzw.pathFS.buffer;

/**
 * how a write handle accumulates bytes before they reach the store
 * @author silverwzw
 */
public enum WriteBufferType {
	/**
	 * every write is one content patch
	 */
	NONE,
	/**
	 * one buffer, flushed synchronously when full
	 */
	SIMPLE,
	/**
	 * a full buffer is uploaded in background while the writer fills the next one
	 */
	ASYNC,
	/**
	 * bounded queue feeding a single streamed upload
	 */
	QUEUE;
	/**
	 * convert a String representation to WriteBufferType, unknown names fall back to SIMPLE
	 */
	public final static WriteBufferType getType(String type){
		if (type == null) {
			return SIMPLE;
		}
		try {
			return valueOf(type.toUpperCase());
		} catch (IllegalArgumentException ex) {
			return SIMPLE;
		}
	}
}
