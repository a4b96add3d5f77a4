package com.silverwzw.pathFS;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.silverwzw.pathFS.store.MemoryNodeStore;
import com.silverwzw.pathFS.structure.Node;
import com.silverwzw.pathFS.structure.TrashEntry;

public class TrashBinTest {

	private MemoryNodeStore store;
	private PathFS fs;

	@BeforeEach
	public void setUp() throws IOException {
		store = new MemoryNodeStore();
		fs = new PathFS(store);
		fs.mkdirAll("Folder1/Folder2", 0755);
		PathFSTest.writeFile(fs, "Folder1/File1", "one");
		PathFSTest.writeFile(fs, "Folder1/Folder2/File2", "two");
	}

	@AfterEach
	public void tearDown() {
		fs.close();
	}

	@Test
	public void testTrashThenList() throws IOException {
		Node node = fs.stat("Folder1/File1");

		fs.trashPath("Folder1/File1");

		List<TrashEntry> entries = fs.listTrash("Folder1", 0);
		Assertions.assertEquals(1, entries.size());
		Assertions.assertEquals("Folder1/File1", entries.get(0).path());
		Assertions.assertTrue(entries.get(0).node().sameNode(node));
		Assertions.assertEquals("`Folder1/File1' does not exist",
				Assertions.assertThrows(FSException.NotExist.class, () -> fs.stat("Folder1/File1")).getMessage());
	}

	@Test
	public void testTrashKeepsParentLink() throws IOException {
		Node node = fs.stat("Folder1/File1");
		Node folder = fs.stat("Folder1");

		fs.trashPath("Folder1/File1");

		Assertions.assertEquals(node.parents(), store.get(node.id()).parents());
		Assertions.assertTrue(store.get(node.id()).parents().contains(folder.id()));
	}

	@Test
	public void testListTrashScope() throws IOException {
		fs.trashPath("Folder1/File1");
		fs.trashPath("Folder1/Folder2/File2");

		Assertions.assertEquals(2, fs.listTrash("", 0).size());
		Assertions.assertEquals(2, fs.listTrash("Folder1", 0).size());
		Assertions.assertEquals(1, fs.listTrash("Folder1/Folder2", 0).size());
		Assertions.assertEquals(0, fs.listTrash("Folder1/Folder", 0).size());
		Assertions.assertEquals(1, fs.listTrash("", 1).size());
	}

	@Test
	public void testListTrashIsRootRelative() throws IOException {
		fs.trashPath("Folder1/Folder2/File2");
		fs.trashPath("Folder1/File1");

		fs.setRootDirectory("Folder1/Folder2");
		List<TrashEntry> entries = fs.listTrash("", 0);
		Assertions.assertEquals(1, entries.size());
		Assertions.assertEquals("File2", entries.get(0).path());
	}

	@Test
	public void testTrashedAncestorHidesDescendants() throws IOException {
		fs.trashPath("Folder1/Folder2/File2");
		fs.trashPath("Folder1/Folder2");

		List<TrashEntry> entries = fs.listTrash("", 0);
		Assertions.assertEquals(1, entries.size());
		Assertions.assertEquals("Folder1/Folder2", entries.get(0).path());
	}

	@Test
	public void testRestore() throws IOException {
		fs.trashPath("Folder1/File1");
		TrashEntry entry = fs.listTrash("", 0).get(0);

		fs.restore(entry);

		Assertions.assertEquals("one", PathFSTest.readFile(fs, "Folder1/File1"));
		Assertions.assertTrue(fs.listTrash("", 0).isEmpty());
	}

	@Test
	public void testRestoreOntoOccupiedPath() throws IOException {
		fs.trashPath("Folder1/File1");
		TrashEntry entry = fs.listTrash("", 0).get(0);
		PathFSTest.writeFile(fs, "Folder1/File1", "again");

		FSException.Remote ex = Assertions.assertThrows(FSException.Remote.class, () -> fs.restore(entry));
		Assertions.assertTrue(ex.alreadyExists());
		Assertions.assertEquals("again", PathFSTest.readFile(fs, "Folder1/File1"));
	}

	@Test
	public void testTrashValidation() {
		Assertions.assertThrows(FSException.ForbiddenRoot.class, () -> fs.trashPath(""));
		Assertions.assertThrows(FSException.NotExist.class, () -> fs.trashPath("Folder1/Missing"));
		Assertions.assertThrows(FSException.NotADirectory.class, () -> fs.trashPath("Folder1/File1/Deeper"));
	}
}
