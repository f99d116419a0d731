package edu.upf.taln.treediff.core.extraction;

import edu.upf.taln.treediff.core.structures.Fragment;
import edu.upf.taln.treediff.core.structures.NamedTree;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Assigns an identity to every fragment and recovers the nesting among fragments.
 * Fragment i gets identity prefix + i and is nested under the most recently opened fragment with a strictly
 * smaller base depth. A fragment stays open until a fragment at its base depth or shallower is found.
 */
public class SubtreeIndexer
{
	private static class Frame
	{
		private final String id;
		private final int base_depth;

		private Frame(String id, int base_depth)
		{
			this.id = id;
			this.base_depth = base_depth;
		}
	}

	private final static Logger log = LogManager.getLogger();

	public static NamedTree index(List<Fragment> fragments, String prefix)
	{
		final NamedTree tree = new NamedTree(prefix);

		// explicit stack of open fragments, so that deep documents do not exhaust the call stack
		final Deque<Frame> open = new ArrayDeque<>();
		for (int i = 0; i < fragments.size(); ++i)
		{
			final Fragment fragment = fragments.get(i);
			if (fragment.isEmpty())
				throw new IllegalArgumentException("Cannot index empty fragment at position " + i);

			final int base_depth = fragment.getBaseDepth();
			while (!open.isEmpty() && open.peek().base_depth >= base_depth)
				open.pop();

			final String id = createId(prefix, i);
			final String parent = open.isEmpty() ? null : open.peek().id;
			tree.register(id, parent, fragment);
			open.push(new Frame(id, base_depth));
		}

		log.debug("Indexed " + tree.size() + " fragments with prefix " + prefix + ", " + tree.getRoots().size() + " roots");
		return tree;
	}

	public static String createId(String prefix, int position)
	{
		return prefix + position;
	}
}
