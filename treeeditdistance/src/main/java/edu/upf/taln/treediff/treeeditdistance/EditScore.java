package edu.upf.taln.treediff.treeeditdistance;

/**
 * Unit costs of the edit operations used by the distance calculators.
 * Implementations must be side-effect free.
 */
public interface EditScore<T>
{
	double replace(T item1, T item2);

	double delete(T item1);

	double insert(T item2);
}
