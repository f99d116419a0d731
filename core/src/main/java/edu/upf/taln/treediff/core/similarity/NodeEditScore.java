package edu.upf.taln.treediff.core.similarity;

import edu.upf.taln.treediff.core.structures.Node;
import edu.upf.taln.treediff.treeeditdistance.EditScore;

/**
 * Node-level costs: inserting or deleting a node costs 1, replacing it costs 0 if both labels are equal and 1
 * otherwise. Attribute labels are compared on both name and value. Text is ignored.
 * Immutable class.
 */
public final class NodeEditScore implements EditScore<Node>
{
	@Override
	public double replace(Node node1, Node node2)
	{
		if (node1 == null || node2 == null)
			return 1.0;
		return node1.getLabel().equals(node2.getLabel()) ? 0.0 : 1.0;
	}

	@Override
	public double delete(Node node1)
	{
		return 1.0;
	}

	@Override
	public double insert(Node node2)
	{
		return 1.0;
	}
}
