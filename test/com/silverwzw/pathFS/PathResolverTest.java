package com.silverwzw.pathFS;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.silverwzw.pathFS.PathResolver.InRoot;
import com.silverwzw.pathFS.store.MemoryNodeStore;
import com.silverwzw.pathFS.store.NodePatch;
import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.structure.Node.NodeType;
import com.silverwzw.pathFS.util.Path2NodeCache;

public class PathResolverTest {

	private MemoryNodeStore store;
	private PathResolver resolver;
	private Node folder1, folder2, file;

	@BeforeEach
	public void setUp() throws IOException {
		store = new MemoryNodeStore();
		resolver = new PathResolver(store, new Path2NodeCache(100));
		folder1 = store.create(store.top().id(), "Folder1", NodeType.DIRECTORY, 0755);
		folder2 = store.create(store.top().id(), "Folder2", NodeType.DIRECTORY, 0755);
		file = store.create(folder1.id(), "File", NodeType.FILE, 0644);
	}

	@Test
	public void testResolve() throws IOException {
		Assertions.assertTrue(resolver.resolve("").sameNode(store.top()));
		Assertions.assertTrue(resolver.resolve("Folder1/File").sameNode(file));
		Assertions.assertEquals("Folder1/Missing",
				Assertions.assertThrows(FSException.NotExist.class, () -> resolver.resolve("Folder1/Missing/Deeper")).path());
		Assertions.assertEquals("Folder1/File",
				Assertions.assertThrows(FSException.NotADirectory.class, () -> resolver.resolve("Folder1/File/Deeper")).path());
	}

	@Test
	public void testEverySegmentCached() throws IOException {
		resolver.resolve("Folder1/File");
		Assertions.assertEquals(2, store.calls("findChild"));
		resolver.resolve("Folder1/File");
		resolver.resolve("Folder1");
		Assertions.assertEquals(2, store.calls("findChild"));
	}

	@Test
	public void testIsInRoot() throws IOException {
		InRoot where;

		where = resolver.isInRoot(file);
		Assertions.assertTrue(where.inRoot());
		Assertions.assertEquals("Folder1/File", where.path());

		resolver.setRootDirectory("Folder1");
		Assertions.assertEquals("File", resolver.isInRoot(file).path());
		Assertions.assertEquals("", resolver.isInRoot(folder1).path());
		Assertions.assertFalse(resolver.isInRoot(folder2).inRoot());
		Assertions.assertNull(resolver.isInRoot(folder2).path());
	}

	@Test
	public void testFirstValidParentWins() throws IOException {
		store.link(file.id(), folder2.id());
		file = store.get(file.id());
		resolver.setRootDirectory("Folder2");

		Assertions.assertFalse(resolver.isInRoot(file).inRoot());

		store.patch(folder1.id(), new NodePatch().trashed(true));
		Assertions.assertEquals("File", resolver.isInRoot(file).path());
	}

	@Test
	public void testOrphanOnlyReachableAsRoot() throws IOException {
		Node orphan;
		orphan = store.patch(folder2.id(), new NodePatch().parents(new ArrayList<String>(0)));

		Assertions.assertFalse(resolver.isInRoot(orphan).inRoot());
		resolver.setRootNode(orphan.id());
		Assertions.assertTrue(resolver.isInRoot(orphan).inRoot());
	}

	@Test
	public void testCycleTerminates() throws IOException {
		Node a, b;
		a = store.create(folder2.id(), "A", NodeType.DIRECTORY, 0755);
		b = store.create(a.id(), "B", NodeType.DIRECTORY, 0755);
		a = store.patch(a.id(), new NodePatch().parents(Collections.singletonList(b.id())));

		Assertions.assertFalse(resolver.isInRoot(a).inRoot());
	}

	@Test
	public void testSwitchingRootKeepsGraph() throws IOException {
		int nodes = store.size();
		resolver.setRootDirectory("Folder1");
		resolver.setRootNode(folder2.id());
		resolver.setRootDirectory("");
		Assertions.assertEquals(nodes, store.size());
		Assertions.assertEquals(0, store.calls("patch"));
		Assertions.assertTrue(resolver.root().sameNode(resolver.top()));
	}
}
