package com.silverwzw.pathFS.util;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.silverwzw.pathFS.buffer.WriteBufferType;


/**
 * This Object will parse and carry all options passed to PathFS
 * @author silverwzw
 */
public class MountOptions {

	@SuppressWarnings("serial")
	public static class ParseException extends Exception {
		public ParseException(String message) {
			super(message);
		}
	};

	public static final String usage;

	static {
		usage = "Usage: PathFS <config_file> <command> [args...]\n"
				+ "  config : a json config file, use \'-\' to read from stdin.\n"
				+ "\troot(String): path of the directory used as root, from the store top\n"
				+ "\trootId(String): id of the node used as root, wins over root\n"
				+ "\ttrash(Boolean): trash instead of delete, default false\n"
				+ "\tcache(Number): path cache entries, 0 disables, default 1000\n"
				+ "\tbuffer(Object): write buffering\n"
				+ "\t  type(String): NONE, SIMPLE (default), ASYNC or QUEUE\n"
				+ "\t  size(Number): buffer size in byte, default 16384\n"
				+ "\t  queue(Number): queued chunks for QUEUE, default 4\n"
				+ "\tmongo(Object): mongodb connection details\n"
				+ "\t  servers(Array): specify the mongo servers\n"
				+ "\t  db(String): specify the db of File System\n"
				+ "\t  fsoptions(String): specify the collection that contains FS parameters\n"
				+ "\t  credential(Object): user, source, password\n";
	}

	private static final ObjectMapper mapper;

	static {
		mapper = new ObjectMapper();
	}

	private String originJson;

	protected String rootPath;
	protected String rootId;
	protected boolean trashForDelete;
	protected int cacheSize;
	protected WriteBufferType bufferType;
	protected int bufferSize;
	protected int queueDepth;
	protected MongoConn mongoConn;
	protected String[] command;

	{
		rootPath = "";
		rootId = null;
		trashForDelete = false;
		cacheSize = 1000;
		bufferType = WriteBufferType.SIMPLE;
		bufferSize = 16 * 1024;
		queueDepth = 4;
		command = new String[0];
	}

	/**
	 * parse command line arguments to an Option object
	 * @param args config file followed by the command
	 * @throws IOException if I/O exception occurs or the file is not valid json
	 * @throws ParseException if the arguments or a config value is not acceptable
	 */
	public MountOptions(String ... args) throws ParseException, IOException {

		if (args.length < 2) {
			throw new ParseException("missing config file or command");
		}

		JsonNode config;
		if (args[0].equals("-")) {
			config = mapper.readTree(System.in);
		} else {
			config = mapper.readTree(new File(args[0]));
		}

		command = Arrays.copyOfRange(args, 1, args.length);
		parse(config);
	}

	public MountOptions(JsonNode config) throws ParseException {
		parse(config);
	}

	private final void parse(JsonNode config) throws ParseException {
		if (config == null || !config.isObject()) {
			throw new ParseException("config must be a json object");
		}
		try {
			originJson = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
		} catch (JsonProcessingException ex) {
			originJson = config.toString();
		}

		rootPath = Helper.normalize(config.path("root").asText(""));
		rootId = config.hasNonNull("rootId") ? config.get("rootId").asText() : null;
		trashForDelete = config.path("trash").asBoolean(false);
		cacheSize = config.path("cache").asInt(1000);

		if (config.hasNonNull("buffer")) {
			JsonNode buffer;
			buffer = config.get("buffer");
			bufferType = WriteBufferType.getType(buffer.path("type").asText(null));
			bufferSize = buffer.path("size").asInt(16 * 1024);
			queueDepth = buffer.path("queue").asInt(4);
		}
		if (bufferSize < 1) {
			throw new ParseException("buffer size must be positive : " + bufferSize);
		}
		if (queueDepth < 1) {
			throw new ParseException("queue depth must be positive : " + queueDepth);
		}

		mongoConn = new MongoConn(config.get("mongo"));
	}
	/**
	 * @return mongodb conn config object
	 */
	public final MongoConn mongoConn(){
		return mongoConn;
	}
	/**
	 * @return root directory path from the store top, "" for the top itself
	 */
	public final String rootPath() {
		return rootPath;
	}
	/**
	 * @return raw root node id, null if the root is given by path
	 */
	public final String rootId() {
		return rootId;
	}
	public final boolean trashForDelete() {
		return trashForDelete;
	}
	public final int cacheSize() {
		return cacheSize;
	}
	public final WriteBufferType bufferType() {
		return bufferType;
	}
	public final int bufferSize() {
		return bufferSize;
	}
	public final int queueDepth() {
		return queueDepth;
	}
	/**
	 * @return command and its arguments
	 */
	public final String[] command() {
		return command;
	}
	/**
	 * @return String representation of this instance, good for debug
	 */
	public String toString() {
		return "Options:{"
				+ " root:" + (rootId == null ? "/" + rootPath : "#" + rootId)
				+ " trash:" + trashForDelete
				+ " cache:" + cacheSize
				+ " buffer:" + bufferType + "/" + bufferSize + (bufferType == WriteBufferType.QUEUE ? "x" + queueDepth : "")
				+ " " + mongoConn
				+ " command:" + Arrays.toString(command)
				+ "}";
	}
	/**
	 * @return the config as it was read, pretty printed
	 */
	public String toConfigString() {
		return originJson;
	}
}
