package edu.upf.taln.treediff.core.diff;

import edu.upf.taln.treediff.core.ComparisonMode;
import edu.upf.taln.treediff.core.InvalidModeException;
import edu.upf.taln.treediff.core.MalformedNodeException;
import edu.upf.taln.treediff.core.extraction.Flattener;
import edu.upf.taln.treediff.core.structures.EditOperation;
import edu.upf.taln.treediff.core.structures.Fragment;
import edu.upf.taln.treediff.core.structures.NamedTree;
import edu.upf.taln.treediff.core.structures.Node;
import edu.upf.taln.treediff.treeeditdistance.WordDistance;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.*;

import static java.util.stream.Collectors.toList;

/**
 * Derives an edit script from two named trees.
 *
 * 1- Source identities whose fragment occurs nowhere in the target tree are deleted.
 * 2- Target identities whose fragment occurs nowhere in the source tree are inserted.
 * 3- Remaining target identities are matched. The k-th matched target identity is paired with the k-th source
 *    identity that survived step 1, both in flattened order. If there are fewer surviving source identities, the
 *    first source identity holding an equal fragment is used instead. Matched pairs with different root labels are
 *    updated. In text-aware mode an update also requires a positive word distance between the root texts.
 *
 * Fragments are matched by value, so repeated identical substructures can be matched against each other
 * regardless of where they occur.
 */
public class EditScriptGenerator
{
	private final static Logger log = LogManager.getLogger();

	public static List<EditOperation> generate(NamedTree source, NamedTree target, ComparisonMode mode)
	{
		return generate(source, Flattener.flatten(source), target, Flattener.flatten(target), mode);
	}

	/**
	 * @param source_ids flattened identities of the source tree
	 * @param target_ids flattened identities of the target tree
	 */
	public static List<EditOperation> generate(NamedTree source, List<String> source_ids,
	                                           NamedTree target, List<String> target_ids, ComparisonMode mode)
	{
		if (mode == null)
			throw new InvalidModeException("No comparison mode given");

		final List<Fragment> source_fragments = source_ids.stream()
				.map(source::getFragment)
				.collect(toList());
		final List<Fragment> target_fragments = target_ids.stream()
				.map(target::getFragment)
				.collect(toList());
		final Set<Fragment> source_set = new HashSet<>(source_fragments);
		final Set<Fragment> target_set = new HashSet<>(target_fragments);

		final List<EditOperation> script = new ArrayList<>();
		final List<Fragment> kept = new ArrayList<>();
		for (Fragment fragment : source_fragments)
		{
			if (target_set.contains(fragment))
				kept.add(fragment);
			else
				script.add(EditOperation.delete(fragment));
		}

		final WordDistance word_distance = new WordDistance();
		int k = 0; // position among matched target identities
		for (Fragment target_fragment : target_fragments)
		{
			if (!source_set.contains(target_fragment))
			{
				script.add(EditOperation.insert(target_fragment));
				continue;
			}

			final Fragment source_fragment = k < kept.size() ? kept.get(k) :
					source_fragments.get(source_fragments.indexOf(target_fragment));
			++k;
			compare(source_fragment, target_fragment, mode, word_distance).ifPresent(script::add);
		}

		log.debug("Edit script:\n\t" + script.stream().map(EditOperation::toString).collect(toList()));
		return script;
	}

	private static Optional<EditOperation> compare(Fragment source, Fragment target, ComparisonMode mode,
	                                               WordDistance word_distance)
	{
		if (source.getLabel().equals(target.getLabel()))
			return Optional.empty();

		if (mode.isTextAware())
		{
			final double distance = word_distance.distance(getText(source.getRoot()), getText(target.getRoot()));
			if (distance <= 0.0)
				return Optional.empty();
		}

		return Optional.of(EditOperation.update(source, target));
	}

	private static String getText(Node node)
	{
		return node.getText()
				.orElseThrow(() -> new MalformedNodeException(node, "Text-aware comparison requires node text"));
	}
}
