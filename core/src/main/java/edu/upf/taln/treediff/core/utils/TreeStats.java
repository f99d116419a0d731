package edu.upf.taln.treediff.core.utils;

import edu.upf.taln.treediff.core.EmptyTreeException;
import edu.upf.taln.treediff.core.structures.Node;

import java.util.List;

/**
 * Basic statistics of a linearized tree.
 * Field names follow the keys of the exported metrics.
 */
public final class TreeStats
{
	private final int max_depth;
	private final int total_nodes;
	private final int leaf_nodes;

	public TreeStats(int max_depth, int total_nodes, int leaf_nodes)
	{
		this.max_depth = max_depth;
		this.total_nodes = total_nodes;
		this.leaf_nodes = leaf_nodes;
	}

	public static TreeStats of(List<Node> tree)
	{
		if (tree == null || tree.isEmpty())
			throw new EmptyTreeException("Cannot compute statistics of an empty tree");

		final int max_depth = tree.stream().mapToInt(Node::getDepth).max().orElse(0);
		final int terminals = (int) tree.stream().filter(Node::isTerminal).count();
		return new TreeStats(max_depth, tree.size(), terminals);
	}

	public int getMaxDepth() { return max_depth; }
	public int getTotalNodes() { return total_nodes; }

	/**
	 * @return number of terminal markers, i.e. of elements without children
	 */
	public int getLeafNodes() { return leaf_nodes; }

	@Override
	public String toString()
	{
		return "max_depth=" + max_depth + ", total_nodes=" + total_nodes + ", leaf_nodes=" + leaf_nodes;
	}
}
