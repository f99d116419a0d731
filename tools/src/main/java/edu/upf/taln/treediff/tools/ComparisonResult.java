package edu.upf.taln.treediff.tools;

import edu.upf.taln.treediff.core.utils.TreeStats;

/**
 * Metrics of a single comparison. Field names are the keys of the exported JSON metrics.
 */
public class ComparisonResult
{
	private final String document1;
	private final String document2;
	private final String algorithm;
	private final TreeStats tree1_stats;
	private final TreeStats tree2_stats;
	private final double processing_time; // seconds
	private final int edit_script_size;
	private final String output_document;
	private final String diff_report;

	public ComparisonResult(String document1, String document2, String algorithm, TreeStats tree1_stats,
	                        TreeStats tree2_stats, double processing_time, int edit_script_size,
	                        String output_document, String diff_report)
	{
		this.document1 = document1;
		this.document2 = document2;
		this.algorithm = algorithm;
		this.tree1_stats = tree1_stats;
		this.tree2_stats = tree2_stats;
		this.processing_time = processing_time;
		this.edit_script_size = edit_script_size;
		this.output_document = output_document;
		this.diff_report = diff_report;
	}

	public String getDocument1() { return document1; }
	public String getDocument2() { return document2; }
	public String getAlgorithm() { return algorithm; }
	public TreeStats getTree1Stats() { return tree1_stats; }
	public TreeStats getTree2Stats() { return tree2_stats; }
	public double getProcessingTime() { return processing_time; }
	public int getEditScriptSize() { return edit_script_size; }
	public String getOutputDocument() { return output_document; }
	public String getDiffReport() { return diff_report; }

	@Override
	public String toString()
	{
		return "Comparison: " + document1 + " vs " + document2 +
				"\n\tEdit script size: " + edit_script_size +
				"\n\tProcessing time: " + String.format("%.2f", processing_time) + " seconds" +
				"\n\tOutput document: " + output_document +
				"\n\tDiff report: " + diff_report;
	}
}
