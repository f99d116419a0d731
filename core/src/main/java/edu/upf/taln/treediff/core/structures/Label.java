package edu.upf.taln.treediff.core.structures;

import org.apache.commons.lang3.tuple.Pair;

import java.io.Serializable;
import java.util.Objects;

/**
 * Label of a linearized node: an element tag, the terminal marker of a childless element, or an attribute
 * given as a (name, value) pair.
 * Immutable class.
 */
public final class Label implements Serializable
{
	public enum Kind {TAG, TERMINAL, ATTRIBUTE}

	public static final String TERMINAL_MARKER = "0";
	public static final Label TERMINAL = new Label(Kind.TERMINAL, TERMINAL_MARKER, null);

	private final Kind kind;
	private final String name;
	private final String value; // only set for attributes
	private final static long serialVersionUID = 1L;

	private Label(Kind kind, String name, String value)
	{
		this.kind = kind;
		this.name = name;
		this.value = value;
	}

	public static Label tag(String name)
	{
		Objects.requireNonNull(name, "Tag name cannot be null");
		if (name.equals(TERMINAL_MARKER))
			return TERMINAL;
		return new Label(Kind.TAG, name, null);
	}

	public static Label attribute(String name, String value)
	{
		Objects.requireNonNull(name, "Attribute name cannot be null");
		Objects.requireNonNull(value, "Attribute value cannot be null");
		return new Label(Kind.ATTRIBUTE, name, value);
	}

	public Kind getKind() { return kind; }
	public boolean isTag() { return kind == Kind.TAG; }
	public boolean isTerminal() { return kind == Kind.TERMINAL; }
	public boolean isAttribute() { return kind == Kind.ATTRIBUTE; }

	/**
	 * @return tag name, attribute name, or the terminal marker
	 */
	public String getName() { return name; }

	public Pair<String, String> getAttribute()
	{
		if (!isAttribute())
			throw new IllegalStateException("Label " + this + " is not an attribute");
		return Pair.of(name, value);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		Label other = (Label) o;
		return kind == other.kind && name.equals(other.name) && Objects.equals(value, other.value);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(kind, name, value);
	}

	@Override
	public String toString()
	{
		if (isAttribute())
			return "[" + name + ", " + value + "]";
		return name;
	}
}
