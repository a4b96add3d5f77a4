package com.silverwzw.pathFS.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.JsonNode;
import com.mongodb.DB;
import com.mongodb.MongoClient;
import com.mongodb.MongoClientOptions;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;


/**
 * Object representation of all the info need to connect a db in mongodb
 * @author silverwzw
 */
public final class MongoConn {
	/**
	 * Object representation of mongo server
	 * @author silverwzw
	 */
	public static class Server {
		private String address;
		private int port;
		private Server(String address, Integer port) {
			this.address = address == null ? "localhost" : address;
			this.port = port == null ? 27017 : (int)port;
		}
		public final int hashCode() {
			return address.hashCode() ^ port;
		}
		public final boolean equals(Object o) {
			if (o instanceof Server) {
				Server lhs;
				lhs = (Server) o;
				return address.equals(lhs.address) && (port == lhs.port);
			} else {
				return false;
			}

		}
		/**
		 * the port of mongo
		 * @return port in int
		 */
		public final int port() {
			return port;
		}
		/**
		 * the address of the server
		 * @return the address in String
		 */
		public final String address() {
			return address;
		}
		public final String toString() {
			return address + ":" + port;
		}
	}

	private final Set<Server> servers;
	private final String db;
	private final String fsoptions;
	private String user, source;
	private char[] password;
	{
		servers = new LinkedHashSet<Server>();
		user = null;
		source = null;
		password = null;
	}
	/**
	 * parse a json config to MongoConn, if null -> use default value {db="pathfs", servers=["localhost:27017"]}
	 * @param mongoConfig the "mongo" section of the config
	 */
	public MongoConn(JsonNode mongoConfig) {
		if (mongoConfig == null || mongoConfig.isNull()) {
			servers.add(new Server(null, null));
			db = "pathfs";
			fsoptions = "parameters";
			return;
		}

		fsoptions = mongoConfig.path("fsoptions").asText("parameters");
		db = mongoConfig.path("db").asText("pathfs");

		if (!mongoConfig.path("servers").isArray() || mongoConfig.path("servers").size() == 0) {
			servers.add(new Server(null, null));
		} else {
			for (JsonNode serverConfig : mongoConfig.get("servers")) {
				String address;
				Integer port;
				address = serverConfig.hasNonNull("address") ? serverConfig.get("address").asText() : null;
				port = serverConfig.hasNonNull("port") ? serverConfig.get("port").asInt() : null;
				servers.add(new Server(address, port));
			}
		}

		if (mongoConfig.hasNonNull("credential")) {
			JsonNode credential;
			credential = mongoConfig.get("credential");
			user = credential.path("user").asText(null);
			source = credential.path("source").asText(db);
			password = credential.path("password").asText("").toCharArray();
		}
	}
	/**
	 * get the collection of mongo server
	 * @return collection of Server Object
	 */
	public final Collection<Server> servers(){
		return servers;
	}
	/**
	 * get the db name
	 * @return name of the db in String
	 */
	public final String db() {
		return db;
	}
	public final String fsoptions() {
		return fsoptions;
	}
	public final boolean authenticated() {
		return user != null;
	}
	/**
	 * open an authenticated connection. The caller owns the returned db and its client.
	 */
	public final DB connect() {
		List<ServerAddress> addresses;
		MongoClient client;

		addresses = new ArrayList<ServerAddress>(servers.size());
		for (Server s : servers) {
			addresses.add(new ServerAddress(s.address(), s.port()));
		}
		if (authenticated()) {
			client = new MongoClient(addresses, MongoCredential.createCredential(user, source, password), MongoClientOptions.builder().build());
		} else {
			client = new MongoClient(addresses);
		}
		return client.getDB(db);
	}
	public final String toString() {
		return "Mongo:{ servers:" + servers + " db:" + db + " fsoptions:" + fsoptions + (authenticated() ? " user:" + user + "@" + source : "") + " }";
	}
}
