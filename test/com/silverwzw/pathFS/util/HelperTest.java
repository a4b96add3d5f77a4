package com.silverwzw.pathFS.util;

import java.util.Arrays;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class HelperTest {

	@Test
	public void testNormalize() {
		Assertions.assertEquals("", Helper.normalize(null));
		Assertions.assertEquals("", Helper.normalize("/"));
		Assertions.assertEquals("a/b", Helper.normalize("/a//b/"));
		Assertions.assertEquals("a/c", Helper.normalize("a/./b/../c"));
		Assertions.assertEquals("b", Helper.normalize("../../b"));
	}

	@Test
	public void testSplitAndBuild() {
		Assertions.assertTrue(Helper.split("").isEmpty());
		Assertions.assertEquals(Arrays.asList("a", "b", "c"), Helper.split("a/b/c"));
		Assertions.assertEquals("a/b/c", Helper.buildPath("a", "", "b", null, "c"));
		Assertions.assertEquals("", Helper.buildPath());
	}

	@Test
	public void testParentAndName() {
		Assertions.assertEquals("a/b", Helper.parentPath("a/b/c"));
		Assertions.assertEquals("", Helper.parentPath("a"));
		Assertions.assertEquals("c", Helper.nameOf("a/b/c"));
		Assertions.assertEquals("a", Helper.nameOf("a"));
		Assertions.assertTrue(Helper.isRoot(""));
	}

	@Test
	public void testWithin() {
		Assertions.assertTrue(Helper.within("a/b", ""));
		Assertions.assertTrue(Helper.within("a/b", "a"));
		Assertions.assertTrue(Helper.within("a", "a"));
		Assertions.assertFalse(Helper.within("ab", "a"));
		Assertions.assertFalse(Helper.within("a", "a/b"));
	}
}
