package edu.upf.taln.treediff.core.extraction;

import edu.upf.taln.treediff.core.EmptyTreeException;
import edu.upf.taln.treediff.core.structures.Fragment;
import edu.upf.taln.treediff.core.structures.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Partitions a linearized tree into a flat list of fragments.
 * A fragment grows while nodes stay at or below its base depth, and a node shallower than the base depth starts
 * a new fragment. Concatenating the fragments gives back the original tree.
 */
public class SubtreeExtractor
{
	private final static Logger log = LogManager.getLogger();

	public static List<Fragment> extract(List<Node> tree)
	{
		if (tree == null || tree.isEmpty())
			throw new EmptyTreeException("Cannot extract subtrees from an empty tree");

		final List<Fragment> fragments = new ArrayList<>();
		List<Node> current = new ArrayList<>();
		current.add(tree.get(0));
		int base_depth = tree.get(0).getDepth();

		for (Node node : tree.subList(1, tree.size()))
		{
			if (node.getDepth() >= base_depth)
				current.add(node);
			else
			{
				if (!current.isEmpty())
					fragments.add(new Fragment(current));
				current = new ArrayList<>();
				current.add(node);
				base_depth = node.getDepth();
			}
		}

		if (!current.isEmpty())
			fragments.add(new Fragment(current));

		log.debug("Extracted " + fragments.size() + " fragments from tree with " + tree.size() + " nodes");
		return fragments;
	}
}
