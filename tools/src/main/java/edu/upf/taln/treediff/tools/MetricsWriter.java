package edu.upf.taln.treediff.tools;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import edu.upf.taln.treediff.common.FileUtils;
import edu.upf.taln.treediff.core.ComparisonContext;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON export of comparison metrics and cost matrices
 */
public class MetricsWriter
{
	public static final String METRICS_FILE = "comparison_metrics.json";
	private final static Gson gson = new GsonBuilder()
			.setPrettyPrinting()
			.serializeSpecialFloatingPointValues()
			.create();
	private final static Logger log = LogManager.getLogger();

	public static Path writeMetrics(List<ComparisonResult> results, Path analysis_folder)
	{
		final Path metrics_file = FileUtils.createFolder(analysis_folder).resolve(METRICS_FILE);
		FileUtils.writeTextToFile(metrics_file, gson.toJson(results));
		log.info("Metrics of " + results.size() + " comparisons written to " + metrics_file);
		return metrics_file;
	}

	/**
	 * Writes both cost matrices of a comparison, keyed by identity and then by fragment
	 */
	public static void writeCosts(ComparisonContext context, Path costs_file)
	{
		final Map<String, Object> costs = new LinkedHashMap<>();
		costs.put("mode", context.getMode().getName());
		costs.put("source", context.getSourceCosts().asMap());
		costs.put("target", context.getTargetCosts().asMap());
		FileUtils.writeTextToFile(costs_file, gson.toJson(costs));
		log.debug("Cost matrices written to " + costs_file);
	}
}
