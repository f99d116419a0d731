package edu.upf.taln.treediff.common;

import edu.upf.taln.treediff.core.ComparisonMode;
import edu.upf.taln.treediff.core.structures.Node;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class TreePrinterTest
{
	@Test
	public void testPrint()
	{
		List<Node> nodes = new XmlLinearizer(ComparisonMode.TEXT_AWARE).linearize("<a><b>x</b></a>");
		Assert.assertEquals("[0, a, 0]\n  [a, b, 1]\n    [b, 0, 2]", TreePrinter.print(nodes, ComparisonMode.LABEL_ONLY));
		Assert.assertEquals("  [a, b, 1] (text: x)", TreePrinter.print(nodes.get(1), ComparisonMode.TEXT_AWARE));
	}
}
