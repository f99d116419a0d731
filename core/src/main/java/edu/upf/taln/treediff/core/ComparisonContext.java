package edu.upf.taln.treediff.core;

import edu.upf.taln.treediff.core.structures.CostMatrix;
import edu.upf.taln.treediff.core.structures.EditOperation;
import edu.upf.taln.treediff.core.structures.Fragment;
import edu.upf.taln.treediff.core.structures.NamedTree;

import java.util.Collections;
import java.util.List;

/**
 * Intermediate state of a single comparison between a source and a target tree.
 * Created by the caller, filled by {@link TreeComparator#run} and discarded afterwards. Not shared between
 * comparisons.
 */
public final class ComparisonContext
{
	private final ComparisonMode mode;
	private List<Fragment> source_fragments = Collections.emptyList();
	private List<Fragment> target_fragments = Collections.emptyList();
	private NamedTree source_tree;
	private NamedTree target_tree;
	private CostMatrix source_costs; // source identities vs target fragments
	private CostMatrix target_costs; // target identities vs source fragments
	private List<String> source_ids = Collections.emptyList();
	private List<String> target_ids = Collections.emptyList();
	private List<EditOperation> edit_script = Collections.emptyList();

	public ComparisonContext(ComparisonMode mode)
	{
		if (mode == null)
			throw new InvalidModeException("No comparison mode given");
		this.mode = mode;
	}

	public ComparisonMode getMode() { return mode; }
	public List<Fragment> getSourceFragments() { return source_fragments; }
	public List<Fragment> getTargetFragments() { return target_fragments; }
	public NamedTree getSourceTree() { return source_tree; }
	public NamedTree getTargetTree() { return target_tree; }
	public CostMatrix getSourceCosts() { return source_costs; }
	public CostMatrix getTargetCosts() { return target_costs; }
	public List<String> getSourceIds() { return source_ids; }
	public List<String> getTargetIds() { return target_ids; }
	public List<EditOperation> getEditScript() { return edit_script; }

	void setFragments(List<Fragment> source, List<Fragment> target)
	{
		this.source_fragments = Collections.unmodifiableList(source);
		this.target_fragments = Collections.unmodifiableList(target);
	}

	void setTrees(NamedTree source, NamedTree target)
	{
		this.source_tree = source;
		this.target_tree = target;
	}

	void setCosts(CostMatrix source, CostMatrix target)
	{
		this.source_costs = source;
		this.target_costs = target;
	}

	void setIds(List<String> source, List<String> target)
	{
		this.source_ids = Collections.unmodifiableList(source);
		this.target_ids = Collections.unmodifiableList(target);
	}

	void setEditScript(List<EditOperation> script)
	{
		this.edit_script = Collections.unmodifiableList(script);
	}
}
