package edu.upf.taln.treediff.core;

import com.google.common.base.Stopwatch;
import edu.upf.taln.treediff.core.diff.EditScriptGenerator;
import edu.upf.taln.treediff.core.diff.Patcher;
import edu.upf.taln.treediff.core.extraction.Flattener;
import edu.upf.taln.treediff.core.extraction.SubtreeExtractor;
import edu.upf.taln.treediff.core.extraction.SubtreeIndexer;
import edu.upf.taln.treediff.core.similarity.CostMatrixBuilder;
import edu.upf.taln.treediff.core.structures.*;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Entry point for comparing two linearized trees. Given a source and a target tree, produces an edit script
 * turning the former into the latter.
 */
public final class TreeComparator
{
	public static final String SOURCE_PREFIX = "A";
	public static final String TARGET_PREFIX = "B";
	private final static Logger log = LogManager.getLogger();

	/**
	 * Convenience method using a fresh context
	 */
	public static List<EditOperation> run(List<Node> source, List<Node> target, ComparisonMode mode)
	{
		return run(source, target, new ComparisonContext(mode));
	}

	/**
	 * Compares two trees, leaving all intermediate structures in the given context
	 */
	public static List<EditOperation> run(List<Node> source, List<Node> target, ComparisonContext context)
	{
		log.info("*Comparison started* (" + context.getMode() + ")");
		Stopwatch timer = Stopwatch.createStarted();

		validate(source, context.getMode());
		validate(target, context.getMode());

		// 1- Split trees into fragments
		final List<Fragment> source_fragments = SubtreeExtractor.extract(source);
		final List<Fragment> target_fragments = SubtreeExtractor.extract(target);
		context.setFragments(source_fragments, target_fragments);

		// 2- Name fragments and recover their nesting
		final NamedTree source_tree = SubtreeIndexer.index(source_fragments, SOURCE_PREFIX);
		final NamedTree target_tree = SubtreeIndexer.index(target_fragments, TARGET_PREFIX);
		context.setTrees(source_tree, target_tree);

		// 3- Costs in both directions
		final CostMatrix source_costs = CostMatrixBuilder.build(source_tree, target_fragments);
		final CostMatrix target_costs = CostMatrixBuilder.build(target_tree, source_fragments);
		context.setCosts(source_costs, target_costs);

		// 4- Flatten and derive edit script
		final List<String> source_ids = Flattener.flatten(source_tree);
		final List<String> target_ids = Flattener.flatten(target_tree);
		context.setIds(source_ids, target_ids);

		final List<EditOperation> script = EditScriptGenerator.generate(source_tree, source_ids, target_tree,
				target_ids, context.getMode());
		context.setEditScript(script);

		log.info("Comparison of " + source.size() + " and " + target.size() + " nodes produced " + script.size() +
				" operations in " + timer.stop());
		return script;
	}

	public static List<Node> patch(List<EditOperation> script)
	{
		return Patcher.patch(script);
	}

	/**
	 * Checks that all nodes carry the fields required by the mode
	 * @throws EmptyTreeException if the tree is empty
	 * @throws MalformedNodeException if a node has no text in text-aware mode
	 */
	public static void validate(List<Node> tree, ComparisonMode mode)
	{
		if (tree == null || tree.isEmpty())
			throw new EmptyTreeException("Cannot compare an empty tree");
		if (mode == null)
			throw new InvalidModeException("No comparison mode given");

		if (mode.isTextAware())
		{
			tree.stream()
					.filter(n -> !n.hasText())
					.findFirst()
					.ifPresent(n -> { throw new MalformedNodeException(n, "Text-aware comparison requires node text"); });
		}
	}
}
