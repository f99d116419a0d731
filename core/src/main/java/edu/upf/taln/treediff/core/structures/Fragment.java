package edu.upf.taln.treediff.core.structures;

import com.google.common.collect.ImmutableList;

import java.io.Serializable;
import java.util.Iterator;
import java.util.List;

/**
 * A contiguous run of pre-order nodes sliced from a linearized tree. The first node is the root of the fragment.
 * Immutable class.
 */
public final class Fragment implements Iterable<Node>, Serializable
{
	public static final Fragment EMPTY = new Fragment(ImmutableList.of());

	private final ImmutableList<Node> nodes;
	private final static long serialVersionUID = 1L;

	public Fragment(List<Node> nodes)
	{
		this.nodes = ImmutableList.copyOf(nodes);
	}

	public List<Node> getNodes() { return nodes; }
	public Node get(int i) { return nodes.get(i); }
	public int size() { return nodes.size(); }
	public boolean isEmpty() { return nodes.isEmpty(); }

	public Node getRoot()
	{
		if (nodes.isEmpty())
			throw new IllegalStateException("Empty fragment has no root");
		return nodes.get(0);
	}

	public Label getLabel() { return getRoot().getLabel(); }

	/**
	 * @return depth of the root node
	 */
	public int getBaseDepth() { return getRoot().getDepth(); }

	@Override
	public Iterator<Node> iterator()
	{
		return nodes.iterator();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return nodes.equals(((Fragment) o).nodes);
	}

	@Override
	public int hashCode()
	{
		return nodes.hashCode();
	}

	/**
	 * String form used to key fragments in cost matrices
	 */
	@Override
	public String toString()
	{
		return nodes.toString();
	}
}
