package com.silverwzw.pathFS.store;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Date;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.structure.Node.NodeType;

/**
 * in memory {@link NodeStore} for tests, counts every call by method name
 */
public class MemoryNodeStore implements NodeStore {

	private final static class Entry {
		String id, name;
		List<String> parents;
		NodeType type;
		int mode;
		Date modify, access;
		boolean trashed;
		byte[] content;
	}

	private final TreeMap<String, Entry> nodes;
	private final Map<String, Integer> calls;
	private final String topId;
	private long nextId;
	private volatile boolean failContent;
	private volatile long contentDelay;
	private volatile CountDownLatch gate;
	private final AtomicInteger inFlight, maxInFlight;

	public MemoryNodeStore() {
		Entry top;
		nodes = new TreeMap<String, Entry>();
		calls = new HashMap<String, Integer>();
		nextId = 1;
		failContent = false;
		contentDelay = 0;
		gate = null;
		inFlight = new AtomicInteger();
		maxInFlight = new AtomicInteger();
		top = newEntry("", new ArrayList<String>(0), NodeType.DIRECTORY, 0777);
		topId = top.id;
	}

	public synchronized int calls(String method) {
		Integer n;
		n = calls.get(method);
		return n == null ? 0 : n;
	}

	public synchronized int totalCalls() {
		int total;
		total = 0;
		for (Integer n : calls.values()) {
			total += n;
		}
		return total;
	}

	public synchronized void resetCalls() {
		calls.clear();
	}

	/**
	 * make every following content call fail
	 */
	public void failContent(boolean fail) {
		failContent = fail;
	}

	/**
	 * slow down content calls, in milliseconds
	 */
	public void contentDelay(long ms) {
		contentDelay = ms;
	}

	/**
	 * block every following content call until {@link #releaseContent()}
	 */
	public void holdContent() {
		gate = new CountDownLatch(1);
	}

	public void releaseContent() {
		if (gate != null) {
			gate.countDown();
		}
	}

	/**
	 * most content calls ever running at the same time
	 */
	public int maxInFlight() {
		return maxInFlight.get();
	}

	/**
	 * add one more parent link, the backend allows it
	 */
	public synchronized void link(String childId, String parentId) {
		nodes.get(childId).parents.add(parentId);
	}

	/**
	 * bypass the name check, the backend may hold duplicates
	 */
	public synchronized Node createDuplicate(String parentId, String name, NodeType type) {
		List<String> parents;
		parents = new ArrayList<String>();
		parents.add(parentId);
		return toNode(newEntry(name, parents, type, 0644));
	}

	public synchronized byte[] content(String id) {
		return nodes.get(id).content.clone();
	}

	public synchronized int size() {
		return nodes.size();
	}

	private void count(String method) {
		Integer n;
		n = calls.get(method);
		calls.put(method, n == null ? 1 : n + 1);
	}

	private Entry newEntry(String name, List<String> parents, NodeType type, int mode) {
		Entry e;
		e = new Entry();
		e.id = String.format("%024x", nextId++);
		e.name = name;
		e.parents = new ArrayList<String>(parents);
		e.type = type;
		e.mode = mode;
		e.modify = new Date();
		e.access = e.modify;
		e.trashed = false;
		e.content = new byte[0];
		nodes.put(e.id, e);
		return e;
	}

	private static Node toNode(Entry e) {
		return new Node(e.id, e.name, e.parents, e.type, e.content.length, e.modify, e.access, e.mode, e.trashed);
	}

	private Entry live(String parentId, String name, String except) {
		for (Entry e : nodes.values()) {
			if (!e.trashed && e.name.equals(name) && e.parents.contains(parentId) && !e.id.equals(except)) {
				return e;
			}
		}
		return null;
	}

	public synchronized Node top() {
		count("top");
		return toNode(nodes.get(topId));
	}

	public synchronized Node get(String id) {
		count("get");
		Entry e;
		e = nodes.get(id);
		return e == null ? null : toNode(e);
	}

	public synchronized Node findChild(String parentId, String name) {
		count("findChild");
		Entry e;
		e = live(parentId, name, null);
		return e == null ? null : toNode(e);
	}

	public synchronized ChildPage children(String parentId, String pageToken, int limit) {
		count("children");
		if (limit < 1) {
			throw new IllegalArgumentException("page limit must be positive : " + limit);
		}
		List<Entry> all;
		List<Node> page;

		all = new ArrayList<Entry>();
		for (Entry e : nodes.values()) {
			if (!e.trashed && e.parents.contains(parentId)) {
				all.add(e);
			}
		}
		Collections.sort(all, new Comparator<Entry>() {
			public int compare(Entry a, Entry b) {
				int c;
				c = a.name.compareTo(b.name);
				return c != 0 ? c : a.id.compareTo(b.id);
			}
		});
		page = new ArrayList<Node>();
		for (Entry e : all) {
			if (pageToken != null && !after(e, pageToken)) {
				continue;
			}
			if (page.size() == limit) {
				Node last;
				last = page.get(page.size() - 1);
				return new ChildPage(page, last.id() + "/" + last.name());
			}
			page.add(toNode(e));
		}
		return new ChildPage(page, null);
	}

	private static boolean after(Entry e, String pageToken) {
		String lastId, lastName;
		int c;
		lastId = pageToken.substring(0, pageToken.indexOf('/'));
		lastName = pageToken.substring(pageToken.indexOf('/') + 1);
		c = e.name.compareTo(lastName);
		return c > 0 || (c == 0 && e.id.compareTo(lastId) > 0);
	}

	public synchronized Node create(String parentId, String name, NodeType type, int mode) throws StoreException {
		count("create");
		List<String> parents;
		if (live(parentId, name, null) != null) {
			throw new StoreException.AlreadyExists(parentId, name, null);
		}
		parents = new ArrayList<String>();
		parents.add(parentId);
		return toNode(newEntry(name, parents, type, mode));
	}

	public synchronized Node patch(String id, NodePatch patch) throws StoreException {
		count("patch");
		Entry e;
		String name;
		List<String> parents;
		boolean trashed;

		e = nodes.get(id);
		if (e == null) {
			throw new StoreException("patch " + id + " : no such node");
		}
		name = patch.name() == null ? e.name : patch.name();
		parents = patch.parents() == null ? e.parents : patch.parents();
		trashed = patch.trashed() == null ? e.trashed : patch.trashed();
		if (!trashed) {
			for (String pid : parents) {
				if (live(pid, name, id) != null) {
					throw new StoreException.AlreadyExists(pid, name, null);
				}
			}
		}
		e.name = name;
		e.parents = new ArrayList<String>(parents);
		e.trashed = trashed;
		if (patch.mode() != null) {
			e.mode = patch.mode();
		}
		if (patch.modify() != null) {
			e.modify = patch.modify();
		}
		if (patch.access() != null) {
			e.access = patch.access();
		}
		return toNode(e);
	}

	public synchronized void delete(String id) throws StoreException {
		count("delete");
		LinkedList<String> frontier;
		if (id.equals(topId)) {
			throw new StoreException("the top node cannot be deleted");
		}
		frontier = new LinkedList<String>();
		frontier.add(id);
		nodes.remove(id);
		while (!frontier.isEmpty()) {
			String parent;
			parent = frontier.removeFirst();
			for (Entry e : new ArrayList<Entry>(nodes.values())) {
				if (!e.parents.contains(parent)) {
					continue;
				}
				if (e.parents.size() > 1) {
					e.parents.remove(parent);
				} else {
					nodes.remove(e.id);
					frontier.add(e.id);
				}
			}
		}
	}

	public synchronized List<Node> trashed() {
		count("trashed");
		List<Node> list;
		list = new ArrayList<Node>();
		for (Entry e : nodes.values()) {
			if (e.trashed) {
				list.add(toNode(e));
			}
		}
		return list;
	}

	public void writeContent(String id, byte[] data, int off, int len, boolean replace) throws StoreException {
		enter();
		try {
			pause();
			synchronized (this) {
				count("writeContent");
				append(id, data, off, len, replace);
			}
		} finally {
			inFlight.decrementAndGet();
		}
	}

	public long uploadContent(String id, InputStream in, boolean replace) throws StoreException {
		ByteArrayOutputStream received;
		byte[] buf;
		int read;

		synchronized (this) {
			count("uploadContent");
		}
		enter();
		try {
			received = new ByteArrayOutputStream();
			buf = new byte[7];
			try {
				while ((read = in.read(buf)) != -1) {
					received.write(buf, 0, read);
					if (failContent) {
						throw new StoreException("upload of " + id + " : injected failure");
					}
				}
			} catch (IOException ex) {
				throw new StoreException("upload of " + id + " : input failed", ex);
			}
			pause();
			synchronized (this) {
				append(id, received.toByteArray(), 0, received.size(), replace);
			}
			return received.size();
		} finally {
			inFlight.decrementAndGet();
		}
	}

	public synchronized InputStream openContent(String id, long offset) throws StoreException {
		count("openContent");
		Entry e;
		e = nodes.get(id);
		if (e == null) {
			throw new StoreException("read content of " + id + " : no such node");
		}
		if (offset >= e.content.length) {
			return new ByteArrayInputStream(new byte[0]);
		}
		return new ByteArrayInputStream(e.content, (int) offset, e.content.length - (int) offset);
	}

	/**
	 * count the call as running, then wait at the gate if one is set
	 */
	private void enter() throws StoreException {
		int now, max;
		CountDownLatch g;

		now = inFlight.incrementAndGet();
		do {
			max = maxInFlight.get();
		} while (now > max && !maxInFlight.compareAndSet(max, now));
		g = gate;
		if (g != null) {
			try {
				g.await();
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				inFlight.decrementAndGet();
				throw new StoreException("interrupted");
			}
		}
	}

	private void pause() throws StoreException {
		if (contentDelay > 0) {
			try {
				Thread.sleep(contentDelay);
			} catch (InterruptedException ex) {
				Thread.currentThread().interrupt();
				throw new StoreException("interrupted");
			}
		}
	}

	private void append(String id, byte[] data, int off, int len, boolean replace) throws StoreException {
		Entry e;
		ByteArrayOutputStream merged;

		if (failContent) {
			throw new StoreException("write content of " + id + " : injected failure");
		}
		e = nodes.get(id);
		if (e == null || e.type != NodeType.FILE) {
			throw new StoreException("write content of " + id + " : no such file");
		}
		merged = new ByteArrayOutputStream();
		if (!replace) {
			merged.write(e.content, 0, e.content.length);
		}
		merged.write(data, off, len);
		e.content = merged.toByteArray();
		e.modify = new Date();
	}
}
