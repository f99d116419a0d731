package edu.upf.taln.treediff.core;

import edu.upf.taln.treediff.core.structures.EditOperation;
import edu.upf.taln.treediff.core.structures.Label;
import edu.upf.taln.treediff.core.structures.Node;
import org.junit.Assert;
import org.junit.Test;

import java.util.*;

import static java.util.stream.Collectors.toList;

/**
 * End-to-end tests of the comparison pipeline on linearized trees
 */
public class TreeComparatorTest
{
	private static Node n(String parent, String label, int depth)
	{
		return new Node(parent, Label.tag(label), depth);
	}

	private static Node n(String parent, String label, int depth, String text)
	{
		return new Node(parent, Label.tag(label), depth, text);
	}

	// <doc version="2"><title>Trees</title><body><p>one two</p><p/></body></doc>
	private static List<Node> document()
	{
		return Arrays.asList(
				n("0", "doc", 0, ""),
				new Node("doc", Label.attribute("version", "2"), 1, "2"),
				n("doc", "title", 1, "Trees"),
				n("title", "0", 2, ""),
				n("doc", "body", 1, ""),
				n("body", "p", 2, "one two"),
				n("p", "0", 3, ""),
				n("body", "p", 2, ""),
				n("p", "0", 3, ""));
	}

	private static List<EditOperation.Type> types(List<EditOperation> script)
	{
		return script.stream().map(EditOperation::getType).collect(toList());
	}

	@Test
	public void testSelfDiff()
	{
		for (ComparisonMode mode : ComparisonMode.values())
		{
			List<EditOperation> script = TreeComparator.run(document(), new ArrayList<>(document()), mode);
			Assert.assertTrue(script.isEmpty());
			Assert.assertTrue(TreeComparator.patch(script).isEmpty());
		}
	}

	@Test
	public void testChildAddedToSingleRootDocument()
	{
		// <a/> vs <a><b/></a>: a whole document is one fragment, so the changed fragment is replaced entirely.
		// This yields a Delete as well as the Insert, even though only a child was added.
		List<Node> source = Arrays.asList(n("0", "a", 0), n("a", "0", 1));
		List<Node> target = Arrays.asList(n("0", "a", 0), n("a", "b", 1), n("b", "0", 2));

		List<EditOperation> script = TreeComparator.run(source, target, ComparisonMode.LABEL_ONLY);
		Assert.assertEquals(Arrays.asList(EditOperation.Type.DELETE, EditOperation.Type.INSERT), types(script));
		Assert.assertEquals(source, script.get(0).getSource().get().getNodes());
		Assert.assertEquals(target, TreeComparator.patch(script));
	}

	@Test
	public void testFragmentAdded()
	{
		List<Node> source = Arrays.asList(n("b", "c", 2), n("c", "0", 3), n("r", "a", 1), n("a", "0", 2));
		List<Node> target = Arrays.asList(n("b", "c", 2), n("c", "0", 3), n("r", "a", 1), n("a", "0", 2),
				n("0", "b", 0), n("b", "0", 1));

		ComparisonContext context = new ComparisonContext(ComparisonMode.LABEL_ONLY);
		List<EditOperation> script = TreeComparator.run(source, target, context);

		Assert.assertEquals(Collections.singletonList(EditOperation.Type.INSERT), types(script));
		Assert.assertEquals(Arrays.asList(n("0", "b", 0), n("b", "0", 1)), TreeComparator.patch(script));
		Assert.assertEquals(Arrays.asList("B2", "B1", "B0"), context.getTargetIds());
	}

	@Test
	public void testContextIsFilled()
	{
		List<Node> source = Arrays.asList(n("b", "c", 2), n("c", "0", 3), n("r", "a", 1), n("a", "0", 2));
		List<Node> target = Arrays.asList(n("x", "d", 1), n("0", "x", 0));

		ComparisonContext context = new ComparisonContext(ComparisonMode.LABEL_ONLY);
		List<EditOperation> script = TreeComparator.run(source, target, context);

		Assert.assertEquals(2, context.getSourceFragments().size());
		Assert.assertEquals(2, context.getTargetFragments().size());
		Assert.assertEquals(Arrays.asList("A0", "A1"), new ArrayList<>(context.getSourceTree().getIdentities()));
		Assert.assertEquals(Arrays.asList("B0", "B1"), new ArrayList<>(context.getTargetTree().getIdentities()));
		Assert.assertEquals(4, context.getSourceCosts().size());
		Assert.assertEquals(4, context.getTargetCosts().size());
		Assert.assertEquals(Arrays.asList("A1", "A0"), context.getSourceIds());
		Assert.assertEquals(script, context.getEditScript());
		Assert.assertEquals(Arrays.asList(EditOperation.Type.DELETE, EditOperation.Type.DELETE,
				EditOperation.Type.INSERT, EditOperation.Type.INSERT), types(script));
	}

	@Test
	public void testConsistentRelabelling()
	{
		List<Node> source = Arrays.asList(n("b", "c", 2), n("c", "0", 3), n("r", "a", 1), n("a", "0", 2),
				n("0", "r", 0));
		List<Node> target = Arrays.asList(n("r", "a", 1), n("a", "0", 2), n("b", "c", 2), n("c", "0", 3),
				n("0", "r", 0), n("r", "e", 1));

		Map<String, String> bijection = new HashMap<>();
		bijection.put("a", "k");
		bijection.put("b", "l");
		bijection.put("c", "m");
		bijection.put("e", "n");
		bijection.put("r", "o");

		List<EditOperation> script = TreeComparator.run(source, target, ComparisonMode.LABEL_ONLY);
		List<EditOperation> relabelled = TreeComparator.run(relabel(source, bijection), relabel(target, bijection),
				ComparisonMode.LABEL_ONLY);

		Assert.assertFalse(script.isEmpty());
		Assert.assertEquals(types(script), types(relabelled));
	}

	private static List<Node> relabel(List<Node> tree, Map<String, String> bijection)
	{
		return tree.stream()
				.map(node -> new Node(bijection.getOrDefault(node.getParentLabel(), node.getParentLabel()),
						node.getLabel().isTag() ? Label.tag(bijection.get(node.getLabel().getName())) : node.getLabel(),
						node.getDepth()))
				.collect(toList());
	}

	@Test
	public void testTextAwareTextChange()
	{
		List<Node> source = document();
		List<Node> target = new ArrayList<>(document());
		target.set(2, n("doc", "title", 1, "Forests"));

		List<EditOperation> script = TreeComparator.run(source, target, ComparisonMode.TEXT_AWARE);
		Assert.assertEquals(Arrays.asList(EditOperation.Type.DELETE, EditOperation.Type.INSERT), types(script));
	}

	@Test(expected = EmptyTreeException.class)
	public void testEmptySource()
	{
		TreeComparator.run(Collections.emptyList(), document(), ComparisonMode.LABEL_ONLY);
	}

	@Test(expected = MalformedNodeException.class)
	public void testTextAwareWithoutText()
	{
		List<Node> tree = Arrays.asList(n("0", "a", 0), n("a", "0", 1));
		TreeComparator.run(tree, tree, ComparisonMode.TEXT_AWARE);
	}

	@Test
	public void testLabelOnlyIgnoresMissingText()
	{
		List<Node> tree = Arrays.asList(n("0", "a", 0), n("a", "0", 1));
		Assert.assertTrue(TreeComparator.run(tree, tree, ComparisonMode.LABEL_ONLY).isEmpty());
	}

	@Test(expected = InvalidModeException.class)
	public void testMissingMode()
	{
		new ComparisonContext(null);
	}
}
