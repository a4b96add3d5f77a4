package com.silverwzw.pathFS.store;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedList;
import java.util.List;

import org.apache.log4j.Logger;
import org.bson.types.ObjectId;

import com.mongodb.BasicDBObject;
import com.mongodb.DB;
import com.mongodb.DBCollection;
import com.mongodb.DBCursor;
import com.mongodb.DBObject;
import com.mongodb.DuplicateKeyException;
import com.mongodb.MongoException;
import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.structure.Node.NodeType;
import com.silverwzw.pathFS.util.FSOptions;
import com.silverwzw.pathFS.util.MongoConn;

/**
 * {@link NodeStore} over mongodb.
 * <br>node document : {_id, name, parents:[ObjectId], type, size, modify, access, mode, trashed, arc:[{obj, length}]}
 * <br>chunk document : {_id, data}
 * @author silverwzw
 */
public class MongoNodeStore implements NodeStore {

	private static final Logger logger;

	static {
		logger = Logger.getLogger(MongoNodeStore.class);
	}

	private final DB db;
	private final FSOptions fsoptions;
	private final DBCollection nodes, chunks;

	/**
	 * @param db an authenticated connection, owned by the caller
	 * @param fsoptionsCollection name of the parameters collection
	 */
	public MongoNodeStore(DB db, String fsoptionsCollection) {
		this.db = db;
		fsoptions = new FSOptions(db.getCollection(fsoptionsCollection));
		nodes = db.getCollection(fsoptions.node_collection());
		chunks = db.getCollection(fsoptions.chunk_collection());
	}

	public MongoNodeStore(MongoConn connCFG) {
		this(connCFG.connect(), connCFG.fsoptions());
	}

	public final DB db() {
		return db;
	}

	public final FSOptions fsoptions() {
		return fsoptions;
	}

	/**
	 * drop everything and create an empty store holding only the top directory.
	 */
	public final Node format() throws StoreException {
		try {
			DBObject dbo;
			DBCollection parameters;
			Date now;

			nodes.drop();
			chunks.drop();

			nodes.createIndex(
					new BasicDBObject("parents", 1).append("name", 1),
					new BasicDBObject("unique", true)
						.append("partialFilterExpression", new BasicDBObject("trashed", false)));
			nodes.createIndex(new BasicDBObject("trashed", 1));

			now = new Date();
			dbo = new BasicDBObject()
				.append("name", "")
				.append("parents", new ArrayList<ObjectId>(0))
				.append("type", NodeType.DIRECTORY.name())
				.append("size", 0L)
				.append("modify", now)
				.append("access", now)
				.append("mode", 0777)
				.append("trashed", false);
			nodes.insert(dbo);

			parameters = db.getCollection(fsoptions.fsoptions_collection_name());
			parameters.save(new BasicDBObject("_id", "top").append("value", dbo.get("_id")));
			fsoptions.top(dbo.get("_id").toString());

			logger.info("formatted store, top : " + fsoptions.top());
			return toNode(dbo);
		} catch (MongoException ex) {
			throw new StoreException("format failed", ex);
		}
	}

	public final Node top() throws StoreException {
		if (fsoptions.top() == null) {
			throw new StoreException("store is not formatted, no top node in " + fsoptions.fsoptions_collection_name());
		}
		Node top;
		top = get(fsoptions.top());
		if (top == null) {
			throw new StoreException("top node " + fsoptions.top() + " is missing");
		}
		return top;
	}

	public final Node get(String id) throws StoreException {
		if (!ObjectId.isValid(id)) {
			return null;
		}
		try {
			DBObject dbo;
			dbo = nodes.findOne(new BasicDBObject("_id", new ObjectId(id)), nodeFields());
			return dbo == null ? null : toNode(dbo);
		} catch (MongoException ex) {
			throw new StoreException("get " + id, ex);
		}
	}

	public final Node findChild(String parentId, String name) throws StoreException {
		DBCursor cur;
		cur = null;
		try {
			DBObject query;
			query = new BasicDBObject("parents", new ObjectId(parentId))
				.append("name", name)
				.append("trashed", false);
			cur = nodes.find(query, nodeFields()).sort(new BasicDBObject("_id", 1)).limit(1);
			return cur.hasNext() ? toNode(cur.next()) : null;
		} catch (MongoException ex) {
			throw new StoreException("find " + name + " under " + parentId, ex);
		} finally {
			if (cur != null) {
				cur.close();
			}
		}
	}

	public final ChildPage children(String parentId, String pageToken, int limit) throws StoreException {
		if (limit < 1) {
			throw new IllegalArgumentException("page limit must be positive : " + limit);
		}
		DBCursor cur;
		cur = null;
		try {
			BasicDBObject query;
			List<Node> page;

			query = new BasicDBObject("parents", new ObjectId(parentId)).append("trashed", false);
			if (pageToken != null) {
				String lastId, lastName;
				List<DBObject> after;

				lastId = pageToken.substring(0, pageToken.indexOf('/'));
				lastName = pageToken.substring(pageToken.indexOf('/') + 1);
				after = new ArrayList<DBObject>(2);
				after.add(new BasicDBObject("name", new BasicDBObject("$gt", lastName)));
				after.add(new BasicDBObject("name", lastName).append("_id", new BasicDBObject("$gt", new ObjectId(lastId))));
				query.append("$or", after);
			}

			// one extra row tells whether another page exists
			cur = nodes.find(query, nodeFields()).sort(new BasicDBObject("name", 1).append("_id", 1)).limit(limit + 1);
			page = new ArrayList<Node>(limit);
			while (cur.hasNext() && page.size() < limit) {
				page.add(toNode(cur.next()));
			}
			if (cur.hasNext() && !page.isEmpty()) {
				Node last;
				last = page.get(page.size() - 1);
				return new ChildPage(page, last.id() + "/" + last.name());
			}
			return new ChildPage(page, null);
		} catch (MongoException ex) {
			throw new StoreException("list children of " + parentId, ex);
		} finally {
			if (cur != null) {
				cur.close();
			}
		}
	}

	public final Node create(String parentId, String name, NodeType type, int mode) throws StoreException {
		try {
			DBObject dbo;
			List<ObjectId> parents;
			Date now;

			now = new Date();
			parents = new ArrayList<ObjectId>(1);
			parents.add(new ObjectId(parentId));
			dbo = new BasicDBObject()
				.append("name", name)
				.append("parents", parents)
				.append("type", type.name())
				.append("size", 0L)
				.append("modify", now)
				.append("access", now)
				.append("mode", mode % 01000)
				.append("trashed", false)
				.append("arc", new ArrayList<DBObject>(0));
			nodes.insert(dbo);
			logger.debug("created " + type + " " + name + " under " + parentId);
			return toNode(dbo);
		} catch (MongoException ex) {
			if (duplicate(ex)) {
				throw new StoreException.AlreadyExists(parentId, name, ex);
			}
			throw new StoreException("create " + name + " under " + parentId, ex);
		}
	}

	public final Node patch(String id, NodePatch patch) throws StoreException {
		try {
			BasicDBObject set;
			DBObject dbo;

			set = new BasicDBObject();
			if (patch.name() != null) {
				set.append("name", patch.name());
			}
			if (patch.parents() != null) {
				List<ObjectId> parents;
				parents = new ArrayList<ObjectId>(patch.parents().size());
				for (String p : patch.parents()) {
					parents.add(new ObjectId(p));
				}
				set.append("parents", parents);
			}
			if (patch.trashed() != null) {
				set.append("trashed", patch.trashed());
			}
			if (patch.mode() != null) {
				set.append("mode", patch.mode() % 01000);
			}
			if (patch.modify() != null) {
				set.append("modify", patch.modify());
			}
			if (patch.access() != null) {
				set.append("access", patch.access());
			}
			if (set.isEmpty()) {
				return get(id);
			}

			dbo = nodes.findAndModify(
					new BasicDBObject("_id", new ObjectId(id)), // query
					nodeFields(),
					null, // sort
					false, // remove
					new BasicDBObject("$set", set),
					true, // return new
					false); // upsert
			if (dbo == null) {
				throw new StoreException("patch " + id + " : no such node");
			}
			logger.debug("patched " + id + " " + patch);
			return toNode(dbo);
		} catch (MongoException ex) {
			if (duplicate(ex)) {
				throw new StoreException.AlreadyExists(
						patch.parents() == null || patch.parents().isEmpty() ? null : patch.parents().get(0),
						patch.name(),
						ex);
			}
			throw new StoreException("patch " + id, ex);
		}
	}

	public final void delete(String id) throws StoreException {
		try {
			LinkedList<ObjectId> frontier;
			ObjectId oid;
			int count;

			oid = new ObjectId(id);
			if (oid.toString().equals(fsoptions.top())) {
				throw new StoreException("the top node cannot be deleted");
			}

			frontier = new LinkedList<ObjectId>();
			frontier.add(oid);
			removeNode(oid);
			count = 1;

			while (!frontier.isEmpty()) {
				ObjectId parent;
				DBCursor cur;

				parent = frontier.removeFirst();
				cur = nodes.find(new BasicDBObject("parents", parent), new BasicDBObject("parents", 1));
				try {
					while (cur.hasNext()) {
						DBObject child;
						List<?> parents;

						child = cur.next();
						parents = (List<?>) child.get("parents");
						if (parents != null && parents.size() > 1) {
							// still linked elsewhere, only drop this link
							nodes.update(
									new BasicDBObject("_id", child.get("_id")),
									new BasicDBObject("$pull", new BasicDBObject("parents", parent)));
						} else {
							frontier.add((ObjectId) child.get("_id"));
							removeNode((ObjectId) child.get("_id"));
							count++;
						}
					}
				} finally {
					cur.close();
				}
			}
			logger.debug("deleted " + id + " and " + (count - 1) + " descendant(s)");
		} catch (MongoException ex) {
			throw new StoreException("delete " + id, ex);
		}
	}

	public final List<Node> trashed() throws StoreException {
		DBCursor cur;
		cur = null;
		try {
			List<Node> list;

			list = new LinkedList<Node>();
			cur = nodes.find(new BasicDBObject("trashed", true), nodeFields()).sort(new BasicDBObject("_id", 1));
			while (cur.hasNext()) {
				list.add(toNode(cur.next()));
			}
			return list;
		} catch (MongoException ex) {
			throw new StoreException("list trash", ex);
		} finally {
			if (cur != null) {
				cur.close();
			}
		}
	}

	public final void writeContent(String id, byte[] data, int off, int len, boolean replace) throws StoreException {
		if (len == 0 && !replace) {
			return;
		}
		List<DBObject> arcs;
		arcs = new ArrayList<DBObject>();
		try {
			int pointer;
			pointer = off;
			while (pointer < off + len) {
				int blockLen;
				blockLen = Math.min(fsoptions.block_size(), off + len - pointer);
				arcs.add(addChunk(data, pointer, blockLen));
				pointer += blockLen;
			}
			commitArcs(id, arcs, len, replace);
		} catch (MongoException ex) {
			removeChunks(arcs);
			throw new StoreException("write content of " + id, ex);
		}
	}

	public final long uploadContent(String id, InputStream in, boolean replace) throws StoreException {
		List<DBObject> arcs;
		arcs = new ArrayList<DBObject>();
		try {
			byte[] block;
			long total;
			int filled;

			block = new byte[fsoptions.block_size()];
			total = 0;
			filled = 0;
			while (true) {
				int read;
				read = in.read(block, filled, block.length - filled);
				if (read < 0) {
					break;
				}
				filled += read;
				if (filled == block.length) {
					arcs.add(addChunk(block, 0, filled));
					total += filled;
					filled = 0;
				}
			}
			if (filled > 0) {
				arcs.add(addChunk(block, 0, filled));
				total += filled;
			}
			commitArcs(id, arcs, total, replace);
			return total;
		} catch (IOException ex) {
			removeChunks(arcs);
			throw new StoreException("upload content of " + id + " : input failed", ex);
		} catch (MongoException ex) {
			removeChunks(arcs);
			throw new StoreException("upload content of " + id, ex);
		}
	}

	public final InputStream openContent(String id, long offset) throws StoreException {
		try {
			DBObject dbo;
			List<?> arc;

			dbo = nodes.findOne(new BasicDBObject("_id", new ObjectId(id)), new BasicDBObject("arc", 1));
			if (dbo == null) {
				throw new StoreException("read content of " + id + " : no such node");
			}
			arc = (List<?>) dbo.get("arc");
			return new ChunkInputStream(arc == null ? new ArrayList<Object>(0) : arc, offset);
		} catch (MongoException ex) {
			throw new StoreException("read content of " + id, ex);
		}
	}

	/**
	 * lazily fetches chunk documents of one content snapshot
	 */
	private final class ChunkInputStream extends InputStream {
		private final List<?> arc;
		private int index;
		private byte[] current;
		private int pointer;

		ChunkInputStream(List<?> arc, long offset) {
			this.arc = arc;
			index = 0;
			current = null;
			pointer = 0;
			while (index < arc.size() && offset >= length(index)) {
				offset -= length(index);
				index++;
			}
			pointer = (int) offset;
		}

		private long length(int i) {
			return ((Number) ((DBObject) arc.get(i)).get("length")).longValue();
		}

		private boolean load() throws IOException {
			while (current == null || pointer >= current.length) {
				if (current != null) {
					index++;
					pointer = 0;
				}
				if (index >= arc.size()) {
					return false;
				}
				try {
					DBObject chunk;
					chunk = chunks.findOne(new BasicDBObject("_id", ((DBObject) arc.get(index)).get("obj")));
					if (chunk == null) {
						throw new IOException("chunk " + ((DBObject) arc.get(index)).get("obj") + " is missing");
					}
					current = (byte[]) chunk.get("data");
				} catch (MongoException ex) {
					throw new IOException("read chunk", ex);
				}
			}
			return true;
		}

		public int read() throws IOException {
			if (!load()) {
				return -1;
			}
			return current[pointer++] & 0xff;
		}

		public int read(byte[] b, int off, int len) throws IOException {
			if (len == 0) {
				return 0;
			}
			if (!load()) {
				return -1;
			}
			int n;
			n = Math.min(len, current.length - pointer);
			System.arraycopy(current, pointer, b, off, n);
			pointer += n;
			return n;
		}
	}

	private final DBObject addChunk(byte[] data, int off, int len) {
		byte[] bytes;
		DBObject chunk;

		bytes = new byte[len];
		System.arraycopy(data, off, bytes, 0, len);
		chunk = new BasicDBObject("data", bytes);
		chunks.insert(chunk);
		return new BasicDBObject("obj", chunk.get("_id")).append("length", len);
	}

	private final void commitArcs(String id, List<DBObject> arcs, long len, boolean replace) throws StoreException {
		DBObject update, old;
		Date now;

		now = new Date();
		if (replace) {
			update = new BasicDBObject("$set", new BasicDBObject("arc", arcs).append("size", len).append("modify", now));
		} else {
			update = new BasicDBObject("$push", new BasicDBObject("arc", new BasicDBObject("$each", arcs)))
				.append("$inc", new BasicDBObject("size", len))
				.append("$set", new BasicDBObject("modify", now));
		}

		old = nodes.findAndModify(
				new BasicDBObject("_id", new ObjectId(id)).append("type", NodeType.FILE.name()),
				new BasicDBObject("arc", 1),
				null,
				false,
				update,
				false, // return the old document, its chunks may be garbage now
				false);
		if (old == null) {
			removeChunks(arcs);
			throw new StoreException("write content of " + id + " : no such file");
		}
		if (replace) {
			removeChunks((List<?>) old.get("arc"));
		}
	}

	private final void removeChunks(List<?> arcs) {
		if (arcs == null) {
			return;
		}
		for (Object o : arcs) {
			try {
				chunks.remove(new BasicDBObject("_id", ((DBObject) o).get("obj")));
			} catch (MongoException ex) {
				logger.warn("orphan chunk left behind : " + ((DBObject) o).get("obj"), ex);
			}
		}
	}

	private final void removeNode(ObjectId oid) {
		DBObject dbo;
		dbo = nodes.findAndModify(new BasicDBObject("_id", oid), new BasicDBObject("arc", 1), null, true, null, false, false);
		if (dbo != null) {
			removeChunks((List<?>) dbo.get("arc"));
		}
	}

	private final static DBObject nodeFields() {
		return new BasicDBObject("arc", 0);
	}

	private final static boolean duplicate(MongoException ex) {
		return ex instanceof DuplicateKeyException || ex.getCode() == 11000 || ex.getCode() == 11001;
	}

	private final static Node toNode(DBObject dbo) {
		List<String> parents;
		List<?> parentList;
		Number size, mode;
		Boolean trashed;

		parentList = (List<?>) dbo.get("parents");
		parents = new ArrayList<String>(parentList == null ? 0 : parentList.size());
		if (parentList != null) {
			for (Object p : parentList) {
				parents.add(p.toString());
			}
		}
		size = (Number) dbo.get("size");
		mode = (Number) dbo.get("mode");
		trashed = (Boolean) dbo.get("trashed");

		return new Node(
				dbo.get("_id").toString(),
				(String) dbo.get("name"),
				parents,
				NodeType.getType((String) dbo.get("type")),
				size == null ? 0 : size.longValue(),
				(Date) dbo.get("modify"),
				(Date) dbo.get("access"),
				mode == null ? 0 : mode.intValue(),
				trashed != null && trashed);
	}
}
