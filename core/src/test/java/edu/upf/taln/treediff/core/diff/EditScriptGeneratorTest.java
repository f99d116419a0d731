package edu.upf.taln.treediff.core.diff;

import edu.upf.taln.treediff.core.ComparisonMode;
import edu.upf.taln.treediff.core.InvalidModeException;
import edu.upf.taln.treediff.core.MalformedNodeException;
import edu.upf.taln.treediff.core.extraction.SubtreeIndexer;
import edu.upf.taln.treediff.core.structures.EditOperation;
import edu.upf.taln.treediff.core.structures.Fragment;
import edu.upf.taln.treediff.core.structures.Label;
import edu.upf.taln.treediff.core.structures.NamedTree;
import edu.upf.taln.treediff.core.structures.Node;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Fragments below share a base depth, so every identity is a root and flattening reverses their order.
 * Matched target identities are paired with kept source identities by position among matched identities
 * (see testReorderedFragmentsAreUpdated), not with whichever source identity the delete pass visited last.
 */
public class EditScriptGeneratorTest
{
	private static Fragment fragment(String label)
	{
		return new Fragment(Arrays.asList(Node.element("r", label, 1), new Node(label, Label.TERMINAL, 2)));
	}

	private static Fragment fragment(String label, String text)
	{
		return new Fragment(Arrays.asList(Node.element("r", label, 1, text), new Node(label, Label.TERMINAL, 2, "")));
	}

	private static NamedTree tree(String prefix, Fragment... fragments)
	{
		return SubtreeIndexer.index(Arrays.asList(fragments), prefix);
	}

	@Test
	public void testIdenticalTrees()
	{
		NamedTree source = tree("A", fragment("x"), fragment("y"), fragment("z"));
		NamedTree target = tree("B", fragment("x"), fragment("y"), fragment("z"));
		Assert.assertTrue(EditScriptGenerator.generate(source, target, ComparisonMode.LABEL_ONLY).isEmpty());
		Assert.assertTrue(EditScriptGenerator.generate(source, target, ComparisonMode.TEXT_AWARE).isEmpty());
	}

	@Test
	public void testDeletesBeforeInserts()
	{
		NamedTree source = tree("A", fragment("x"), fragment("y"));
		NamedTree target = tree("B", fragment("x"), fragment("z"), fragment("w"));

		List<EditOperation> script = EditScriptGenerator.generate(source, target, ComparisonMode.LABEL_ONLY);
		Assert.assertEquals(Arrays.asList(
				EditOperation.delete(fragment("y")),
				EditOperation.insert(fragment("w")),
				EditOperation.insert(fragment("z"))), script);
	}

	@Test
	public void testReorderedFragmentsAreUpdated()
	{
		NamedTree source = tree("A", fragment("x"), fragment("y"));
		NamedTree target = tree("B", fragment("y"), fragment("x"));

		// flattened source is [y, x], flattened target is [x, y]
		List<EditOperation> script = EditScriptGenerator.generate(source, target, ComparisonMode.LABEL_ONLY);
		Assert.assertEquals(Arrays.asList(
				EditOperation.update(fragment("y"), fragment("x")),
				EditOperation.update(fragment("x"), fragment("y"))), script);
	}

	@Test
	public void testInsertsDoNotShiftMatches()
	{
		NamedTree source = tree("A", fragment("x"), fragment("y"));
		NamedTree target = tree("B", fragment("x"), fragment("y"), fragment("z"));

		List<EditOperation> script = EditScriptGenerator.generate(source, target, ComparisonMode.LABEL_ONLY);
		Assert.assertEquals(Collections.singletonList(EditOperation.insert(fragment("z"))), script);
	}

	@Test
	public void testRepeatedFragmentsMatchByValue()
	{
		// two identical source fragments, one of them survives in the target: nothing is deleted
		NamedTree source = tree("A", fragment("x"), fragment("x"));
		NamedTree target = tree("B", fragment("x"));
		Assert.assertTrue(EditScriptGenerator.generate(source, target, ComparisonMode.LABEL_ONLY).isEmpty());

		// and the other way round, the extra target copy is paired with an equal source fragment
		Assert.assertTrue(EditScriptGenerator.generate(target, source, ComparisonMode.LABEL_ONLY).isEmpty());
	}

	@Test
	public void testTextAwareSuppressesUpdatesWithoutText()
	{
		NamedTree source = tree("A", fragment("x", ""), fragment("y", ""));
		NamedTree target = tree("B", fragment("y", ""), fragment("x", ""));

		Assert.assertEquals(2, EditScriptGenerator.generate(source, target, ComparisonMode.LABEL_ONLY).size());
		Assert.assertTrue(EditScriptGenerator.generate(source, target, ComparisonMode.TEXT_AWARE).isEmpty());
	}

	@Test
	public void testTextAwareWordCosts()
	{
		// identical words cost 1, so equal non-empty texts still allow the update
		NamedTree source = tree("A", fragment("x", "hello"), fragment("y", "hello"));
		NamedTree target = tree("B", fragment("y", "hello"), fragment("x", "hello"));
		Assert.assertEquals(2, EditScriptGenerator.generate(source, target, ComparisonMode.TEXT_AWARE).size());

		// different words of the same length cost nothing
		source = tree("A", fragment("x", "ab"), fragment("y", "cd"));
		target = tree("B", fragment("y", "cd"), fragment("x", "ab"));
		Assert.assertTrue(EditScriptGenerator.generate(source, target, ComparisonMode.TEXT_AWARE).isEmpty());
	}

	@Test(expected = MalformedNodeException.class)
	public void testTextAwareRequiresText()
	{
		NamedTree source = tree("A", fragment("x"), fragment("y"));
		NamedTree target = tree("B", fragment("y"), fragment("x"));
		EditScriptGenerator.generate(source, target, ComparisonMode.TEXT_AWARE);
	}

	@Test(expected = InvalidModeException.class)
	public void testMissingMode()
	{
		EditScriptGenerator.generate(tree("A", fragment("x")), tree("B", fragment("x")), null);
	}
}
