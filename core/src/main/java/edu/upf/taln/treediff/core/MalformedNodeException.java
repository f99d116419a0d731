package edu.upf.taln.treediff.core;

import edu.upf.taln.treediff.core.structures.Node;

/**
 * A node lacks a field required by the active comparison mode
 */
public class MalformedNodeException extends TreeDiffException
{
	private final Node node;

	public MalformedNodeException(Node node, String message)
	{
		super(message + ": " + node);
		this.node = node;
	}

	public Node getNode() { return node; }
}
