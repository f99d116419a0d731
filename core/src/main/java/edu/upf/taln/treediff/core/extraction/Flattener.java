package edu.upf.taln.treediff.core.extraction;

import com.google.common.collect.Lists;
import edu.upf.taln.treediff.core.structures.NamedTree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Turns a named tree into a single list of identities by a pre-order walk of its forest.
 */
public class Flattener
{
	/**
	 * Roots are stacked in registration order, so the last registered root is walked first.
	 * Children are visited in the order they were recorded.
	 */
	public static List<String> flatten(NamedTree tree)
	{
		final List<String> preorder = new ArrayList<>();
		final Deque<String> stack = new ArrayDeque<>();
		tree.getRoots().forEach(stack::push);

		while (!stack.isEmpty())
		{
			final String current = stack.pop();
			preorder.add(current); // visit
			Lists.reverse(tree.get(current).getChildren()).forEach(stack::push);
		}

		return preorder;
	}
}
