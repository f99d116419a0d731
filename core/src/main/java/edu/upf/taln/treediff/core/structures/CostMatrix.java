package edu.upf.taln.treediff.core.structures;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Distances from the identities of one named tree to the fragments of another tree, keyed by the string form
 * of the target fragment. Not symmetric: a matrix is built once per direction.
 */
public final class CostMatrix
{
	private final Map<String, Map<String, Double>> costs = new LinkedHashMap<>();

	public void addIdentity(String id)
	{
		costs.putIfAbsent(id, new LinkedHashMap<>());
	}

	public void put(String id, Fragment target, double cost)
	{
		costs.computeIfAbsent(id, k -> new LinkedHashMap<>()).put(target.toString(), cost);
	}

	public OptionalDouble get(String id, Fragment target)
	{
		final Map<String, Double> row = costs.get(id);
		if (row == null || !row.containsKey(target.toString()))
			return OptionalDouble.empty();
		return OptionalDouble.of(row.get(target.toString()));
	}

	public Map<String, Double> getRow(String id)
	{
		return Collections.unmodifiableMap(costs.getOrDefault(id, Collections.emptyMap()));
	}

	public Map<String, Map<String, Double>> asMap()
	{
		return Collections.unmodifiableMap(costs);
	}

	public int numIdentities() { return costs.size(); }

	/**
	 * @return total number of cells, i.e. identity-fragment pairs with distinct fragment keys
	 */
	public int size()
	{
		return costs.values().stream().mapToInt(Map::size).sum();
	}
}
