package edu.upf.taln.treediff.core.utils;

import edu.upf.taln.treediff.core.EmptyTreeException;
import edu.upf.taln.treediff.core.structures.Label;
import edu.upf.taln.treediff.core.structures.Node;
import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

public class TreeStatsTest
{
	@Test
	public void testStats()
	{
		TreeStats stats = TreeStats.of(Arrays.asList(
				Node.element("0", "a", 0),
				new Node("a", Label.attribute("id", "x"), 1),
				Node.element("a", "b", 1),
				new Node("b", Label.TERMINAL, 2),
				Node.element("a", "c", 1),
				Node.element("c", "d", 2),
				new Node("d", Label.TERMINAL, 3)));

		Assert.assertEquals(3, stats.getMaxDepth());
		Assert.assertEquals(7, stats.getTotalNodes());
		Assert.assertEquals(2, stats.getLeafNodes());
	}

	@Test(expected = EmptyTreeException.class)
	public void testEmpty()
	{
		TreeStats.of(Collections.emptyList());
	}
}
