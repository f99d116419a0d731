package edu.upf.taln.treediff.tools;

import com.google.common.base.Stopwatch;
import edu.upf.taln.treediff.common.DiffProperties;
import edu.upf.taln.treediff.common.DiffReport;
import edu.upf.taln.treediff.common.FileUtils;
import edu.upf.taln.treediff.common.InvalidDocumentException;
import edu.upf.taln.treediff.common.TreePrinter;
import edu.upf.taln.treediff.common.XmlLinearizer;
import edu.upf.taln.treediff.common.XmlSerializer;
import edu.upf.taln.treediff.core.ComparisonContext;
import edu.upf.taln.treediff.core.ComparisonMode;
import edu.upf.taln.treediff.core.TreeComparator;
import edu.upf.taln.treediff.core.structures.EditOperation;
import edu.upf.taln.treediff.core.structures.Node;
import edu.upf.taln.treediff.core.utils.TreeStats;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Compares XML documents and stores patched documents, diff reports and metrics in an output folder.
 */
public class ComparisonRunner
{
	public static final String ANALYSIS_FOLDER = "analysis";
	public static final String DOCUMENTS_FOLDER = "documents";

	private final ComparisonMode mode;
	private final DiffProperties properties;
	private final boolean export_costs;
	private final XmlLinearizer linearizer;
	private final XmlSerializer serializer;
	private final static Logger log = LogManager.getLogger();

	public ComparisonRunner(ComparisonMode mode, DiffProperties properties)
	{
		this(mode, properties, properties.exportCosts());
	}

	public ComparisonRunner(ComparisonMode mode, DiffProperties properties, boolean export_costs)
	{
		this.mode = mode;
		this.properties = properties;
		this.export_costs = export_costs;
		linearizer = new XmlLinearizer(mode, properties.includeAttributes());
		serializer = new XmlSerializer(mode, properties.getOutputWrapper(), properties.getOutputIndent());
	}

	public ComparisonResult compare(Path document1, Path document2, Path output_folder)
	{
		log.info("*Comparing " + document1 + " and " + document2 + "*");
		for (Path document : new Path[]{document1, document2})
		{
			if (!XmlLinearizer.isWellFormed(document))
				throw new InvalidDocumentException(document);
		}

		final Path analysis_folder = FileUtils.createFolder(output_folder.resolve(ANALYSIS_FOLDER));
		final Path documents_folder = FileUtils.createFolder(output_folder.resolve(DOCUMENTS_FOLDER));

		final List<Node> tree1 = linearizer.linearize(document1);
		final List<Node> tree2 = linearizer.linearize(document2);
		log.debug("Source tree:\n" + TreePrinter.print(tree1, mode));
		log.debug("Target tree:\n" + TreePrinter.print(tree2, mode));
		final TreeStats stats1 = TreeStats.of(tree1);
		final TreeStats stats2 = TreeStats.of(tree2);

		final ComparisonContext context = new ComparisonContext(mode);
		final Stopwatch timer = Stopwatch.createStarted();
		final List<EditOperation> script = TreeComparator.run(tree1, tree2, context);
		final double processing_time = timer.stop().elapsed(TimeUnit.MICROSECONDS) / 1_000_000.0;

		final String name1 = FileUtils.getFileName(document1);
		final String name2 = FileUtils.getFileName(document2);
		final Path output_document = documents_folder.resolve("output_" + name1 + "_" + name2);
		serializer.write(TreeComparator.patch(script), output_document);

		final Path diff_report = analysis_folder.resolve("diff_" + name1 + "_" + name2 + ".txt");
		DiffReport.write(script, diff_report);

		if (export_costs)
			MetricsWriter.writeCosts(context, analysis_folder.resolve("costs_" + name1 + "_" + name2 + ".json"));

		return new ComparisonResult(document1.toString(), document2.toString(), mode.getAlgorithm(), stats1, stats2,
				processing_time, script.size(), output_document.toString(), diff_report.toString());
	}

	/**
	 * Compares a document against every document in a folder. Pairs that fail are logged and skipped.
	 * @return results sorted by ascending edit script size
	 */
	public List<ComparisonResult> compareWithDataset(Path input_document, Path dataset_folder, Path output_folder)
	{
		final List<Path> files = FileUtils.getFilesInFolder(dataset_folder, properties.getDatasetSuffix());
		log.info("*Comparing " + input_document + " against " + files.size() + " documents in " + dataset_folder + "*");
		Stopwatch timer = Stopwatch.createStarted();

		final List<ComparisonResult> results = new ArrayList<>();
		for (Path file : files)
		{
			if (FileUtils.isSameFile(input_document, file))
				continue;

			try
			{
				results.add(compare(input_document, file, output_folder));
			}
			catch (RuntimeException e)
			{
				log.error("Error processing " + file + ": " + e.getMessage());
			}
		}

		results.sort(Comparator.comparingInt(ComparisonResult::getEditScriptSize));
		log.info("Completed " + results.size() + " comparisons in " + timer.stop());
		return results;
	}

	public static Path writeMetrics(List<ComparisonResult> results, Path output_folder)
	{
		return MetricsWriter.writeMetrics(results, output_folder.resolve(ANALYSIS_FOLDER));
	}

	public static void logSummary(ComparisonMode mode, List<ComparisonResult> results, Path output_folder, Path metrics_file)
	{
		final StringBuilder summary = new StringBuilder("Comparison summary:")
				.append("\nAlgorithm used: ").append(mode.getAlgorithm())
				.append("\nNumber of comparisons: ").append(results.size())
				.append("\nResults saved to: ").append(output_folder)
				.append("\nMetrics saved to: ").append(metrics_file);
		results.forEach(r -> summary.append("\n").append(r));
		log.info(summary);
	}
}
