package edu.upf.taln.treediff.core.diff;

import edu.upf.taln.treediff.core.structures.EditOperation;
import edu.upf.taln.treediff.core.structures.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies an edit script by collecting, in script order, the nodes of the target fragment of every update and
 * insert. Deletes contribute nothing. The result is a flat node list, parent/child nesting is left to the
 * serializer.
 */
public class Patcher
{
	public static List<Node> patch(List<EditOperation> script)
	{
		final List<Node> nodes = new ArrayList<>();
		for (EditOperation operation : script)
		{
			switch (operation.getType())
			{
				case UPDATE:
				case INSERT:
					operation.getTarget().ifPresent(f -> nodes.addAll(f.getNodes()));
					break;
				case DELETE:
				default:
					break;
			}
		}

		return nodes;
	}
}
