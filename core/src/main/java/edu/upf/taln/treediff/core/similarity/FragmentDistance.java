package edu.upf.taln.treediff.core.similarity;

import edu.upf.taln.treediff.core.structures.Fragment;
import edu.upf.taln.treediff.core.structures.Node;
import edu.upf.taln.treediff.treeeditdistance.EditScore;

/**
 * Alignment cost between the node sequences of two fragments.
 * Cell (i,j) takes the cheapest of replacing node i by node j on its own, deleting node i after cell (i-1,j) or
 * inserting node j after cell (i,j-1). Cells in the first row or column can only be reached by replacement.
 * This is a sequence alignment heuristic and not a tree edit distance in the Zhang-Shasha sense.
 * Immutable class.
 */
public final class FragmentDistance
{
	private final EditScore<Node> score;

	public FragmentDistance()
	{
		this(new NodeEditScore());
	}

	public FragmentDistance(EditScore<Node> score)
	{
		this.score = score;
	}

	/**
	 * @return distance between the fragments, infinite if either of them is empty
	 */
	public double compute(Fragment fragment1, Fragment fragment2)
	{
		if (fragment1.isEmpty() || fragment2.isEmpty())
			return Double.POSITIVE_INFINITY;

		final int m = fragment1.size();
		final int n = fragment2.size();
		double[][] cost = new double[m][n];

		for (int i = 0; i < m; ++i)
		{
			for (int j = 0; j < n; ++j)
			{
				final Node node1 = fragment1.get(i);
				final Node node2 = fragment2.get(j);
				final double replace = score.replace(node1, node2);
				final double delete = i > 0 ? score.delete(node1) + cost[i - 1][j] : Double.POSITIVE_INFINITY;
				final double insert = j > 0 ? score.insert(node2) + cost[i][j - 1] : Double.POSITIVE_INFINITY;
				cost[i][j] = Math.min(replace, Math.min(delete, insert));
			}
		}

		return cost[m - 1][n - 1];
	}
}
