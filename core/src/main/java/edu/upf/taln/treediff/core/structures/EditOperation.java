package edu.upf.taln.treediff.core.structures;

import java.util.Objects;
import java.util.Optional;

/**
 * A single operation of an edit script: update a source fragment into a target fragment, delete a source
 * fragment or insert a target fragment.
 * Immutable class.
 */
public final class EditOperation
{
	public enum Type {UPDATE, DELETE, INSERT}

	private final Type type;
	private final Fragment source; // null for inserts
	private final Fragment target; // null for deletes

	private EditOperation(Type type, Fragment source, Fragment target)
	{
		this.type = type;
		this.source = source;
		this.target = target;
	}

	public static EditOperation update(Fragment source, Fragment target)
	{
		return new EditOperation(Type.UPDATE, Objects.requireNonNull(source), Objects.requireNonNull(target));
	}

	public static EditOperation delete(Fragment source)
	{
		return new EditOperation(Type.DELETE, Objects.requireNonNull(source), null);
	}

	public static EditOperation insert(Fragment target)
	{
		return new EditOperation(Type.INSERT, null, Objects.requireNonNull(target));
	}

	public Type getType() { return type; }
	public Optional<Fragment> getSource() { return Optional.ofNullable(source); }
	public Optional<Fragment> getTarget() { return Optional.ofNullable(target); }

	@Override
	public boolean equals(Object o)
	{
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;

		EditOperation other = (EditOperation) o;
		return type == other.type && Objects.equals(source, other.source) && Objects.equals(target, other.target);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, source, target);
	}

	@Override
	public String toString()
	{
		return "(" + type.name().toLowerCase() + ", " + source + ", " + target + ")";
	}
}
