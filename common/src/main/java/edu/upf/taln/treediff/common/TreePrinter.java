package edu.upf.taln.treediff.common;

import com.google.common.base.Strings;
import edu.upf.taln.treediff.core.ComparisonMode;
import edu.upf.taln.treediff.core.structures.Node;

import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * Indented one-line-per-node rendering of linearized trees, for debugging.
 */
public class TreePrinter
{
	public static String print(List<Node> nodes, ComparisonMode mode)
	{
		return nodes.stream()
				.map(n -> print(n, mode))
				.collect(joining("\n"));
	}

	public static String print(Node node, ComparisonMode mode)
	{
		final String line = Strings.repeat("  ", node.getDepth()) +
				"[" + node.getParentLabel() + ", " + node.getLabel() + ", " + node.getDepth() + "]";
		if (mode.isTextAware() && node.getText().isPresent())
			return line + " (text: " + node.getText().get() + ")";
		return line;
	}
}
