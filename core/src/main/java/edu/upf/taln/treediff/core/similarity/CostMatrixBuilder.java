package edu.upf.taln.treediff.core.similarity;

import com.google.common.base.Stopwatch;
import edu.upf.taln.treediff.core.structures.CostMatrix;
import edu.upf.taln.treediff.core.structures.Fragment;
import edu.upf.taln.treediff.core.structures.NamedTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Computes the distance of every identity of a named tree to every fragment of another tree.
 * Cost is O(F1 x F2 x S^2) for F1, F2 fragments of at most S nodes, so it grows quadratically on large documents.
 * The matrix is exported for analysis only; edit scripts are not derived from it.
 */
public class CostMatrixBuilder
{
	private final static Logger log = LogManager.getLogger();

	public static CostMatrix build(NamedTree source, List<Fragment> target_fragments)
	{
		return build(source, target_fragments, new FragmentDistance());
	}

	public static CostMatrix build(NamedTree source, List<Fragment> target_fragments, FragmentDistance distance)
	{
		Stopwatch timer = Stopwatch.createStarted();
		final CostMatrix matrix = new CostMatrix();

		for (NamedTree.Entry entry : source.getEntries())
		{
			matrix.addIdentity(entry.getId());
			for (Fragment target : target_fragments)
				matrix.put(entry.getId(), target, distance.compute(entry.getFragment(), target));
		}

		log.debug("Cost matrix for " + source.getPrefix() + " (" + source.size() + "x" + target_fragments.size() +
				") computed in " + timer.stop());
		return matrix;
	}
}
