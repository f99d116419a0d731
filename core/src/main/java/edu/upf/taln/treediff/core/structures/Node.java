package edu.upf.taln.treediff.core.structures;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * One element, attribute or terminal marker of a linearized document, in pre-order.
 * Nodes are compared by value: two nodes with the same fields are indistinguishable.
 * Immutable class.
 */
public final class Node implements Serializable
{
	public static final String ROOT = "0"; // parent label of the document root

	private final String parent_label;
	private final Label label;
	private final int depth;
	private final String text; // null unless the text-aware linearization was used
	private final static long serialVersionUID = 1L;

	public Node(String parent_label, Label label, int depth)
	{
		this(parent_label, label, depth, null);
	}

	public Node(String parent_label, Label label, int depth, String text)
	{
		Objects.requireNonNull(parent_label, "Parent label cannot be null");
		Objects.requireNonNull(label, "Label cannot be null");
		if (depth < 0)
			throw new IllegalArgumentException("Negative depth " + depth + " for node " + label);

		this.parent_label = parent_label;
		this.label = label;
		this.depth = depth;
		this.text = text;
	}

	public static Node element(String parent_label, String tag, int depth)
	{
		return new Node(parent_label, Label.tag(tag), depth);
	}

	public static Node element(String parent_label, String tag, int depth, String text)
	{
		return new Node(parent_label, Label.tag(tag), depth, text);
	}

	public String getParentLabel() { return parent_label; }
	public Label getLabel() { return label; }
	public int getDepth() { return depth; }
	public boolean isRoot() { return parent_label.equals(ROOT); }
	public boolean isTerminal() { return label.isTerminal(); }
	public boolean hasText() { return text != null; }
	public Optional<String> getText() { return Optional.ofNullable(text); }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Node other = (Node) o;
		return depth == other.depth && parent_label.equals(other.parent_label) && label.equals(other.label) &&
				Objects.equals(text, other.text);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(parent_label, label, depth, text);
	}

	@Override
	public String toString()
	{
		final String base = "[" + parent_label + ", " + label + ", " + depth;
		return text == null ? base + "]" : base + ", " + text + "]";
	}
}
