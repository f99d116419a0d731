package edu.upf.taln.treediff.core.extraction;

import edu.upf.taln.treediff.core.structures.Fragment;
import edu.upf.taln.treediff.core.structures.NamedTree;
import edu.upf.taln.treediff.core.structures.Node;
import org.junit.Assert;
import org.junit.Test;

import java.util.*;

public class SubtreeIndexerTest
{
	private static Fragment fragment(String label, int depth)
	{
		return new Fragment(Collections.singletonList(Node.element("p", label, depth)));
	}

	private static List<Fragment> fragments(int... depths)
	{
		List<Fragment> fragments = new ArrayList<>();
		for (int i = 0; i < depths.length; ++i)
			fragments.add(fragment("n" + i, depths[i]));
		return fragments;
	}

	@Test
	public void testNesting()
	{
		NamedTree tree = SubtreeIndexer.index(fragments(0, 1, 2, 1, 0), "A");

		Assert.assertEquals(Arrays.asList("A0", "A1", "A2", "A3", "A4"), new ArrayList<>(tree.getIdentities()));
		Assert.assertEquals(Arrays.asList("A0", "A4"), tree.getRoots());
		Assert.assertEquals(Arrays.asList("A1", "A3"), tree.get("A0").getChildren());
		Assert.assertEquals(Collections.singletonList("A2"), tree.get("A1").getChildren());
		Assert.assertEquals(Optional.of("A1"), tree.get("A2").getParent());
		Assert.assertEquals(Optional.of("A0"), tree.get("A3").getParent());
		Assert.assertFalse(tree.get("A4").getParent().isPresent());
	}

	@Test
	public void testEachFragmentIndexedOnce()
	{
		List<Fragment> fragments = fragments(1, 3, 4, 5, 3, 2, 4, 0, 1, 1, 2);
		NamedTree tree = SubtreeIndexer.index(fragments, "B");

		Assert.assertEquals(fragments.size(), tree.size());
		Assert.assertEquals(fragments.size(), new HashSet<>(tree.getIdentities()).size());
		for (int i = 0; i < fragments.size(); ++i)
			Assert.assertSame(fragments.get(i), tree.getFragment("B" + i));

		// each non-root identity is the child of exactly one parent
		long num_children = tree.getEntries().stream().mapToLong(e -> e.getChildren().size()).sum();
		Assert.assertEquals(tree.size() - tree.getRoots().size(), num_children);
	}

	@Test
	public void testSiblingsWithEqualDepth()
	{
		NamedTree tree = SubtreeIndexer.index(fragments(0, 2, 2, 1, 2), "A");
		Assert.assertEquals(Arrays.asList("A1", "A2", "A3"), tree.get("A0").getChildren());
		Assert.assertEquals(Collections.singletonList("A4"), tree.get("A3").getChildren());
		Assert.assertTrue(tree.get("A1").getChildren().isEmpty());
	}

	@Test
	public void testExtractedFragmentsAreRoots()
	{
		// extracted fragments have strictly decreasing base depths, so none nests under another
		List<Node> nodes = Arrays.asList(Node.element("b", "c", 2), Node.element("r", "b", 1), Node.element("0", "r", 0));
		NamedTree tree = SubtreeIndexer.index(SubtreeExtractor.extract(nodes), "A");
		Assert.assertEquals(Arrays.asList("A0", "A1", "A2"), tree.getRoots());
	}

	@Test
	public void testDeepNestingDoesNotRecurse()
	{
		int[] depths = new int[50000];
		for (int i = 0; i < depths.length; ++i)
			depths[i] = i;
		NamedTree tree = SubtreeIndexer.index(fragments(depths), "A");
		Assert.assertEquals(1, tree.getRoots().size());
		Assert.assertEquals(Optional.of("A49998"), tree.get("A49999").getParent());
		Assert.assertEquals(depths.length, Flattener.flatten(tree).size());
	}

	@Test
	public void testEmptyList()
	{
		NamedTree tree = SubtreeIndexer.index(Collections.emptyList(), "A");
		Assert.assertEquals(0, tree.size());
		Assert.assertTrue(tree.getRoots().isEmpty());
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyFragment()
	{
		SubtreeIndexer.index(Collections.singletonList(Fragment.EMPTY), "A");
	}
}
