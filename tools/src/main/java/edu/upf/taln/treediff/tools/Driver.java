package edu.upf.taln.treediff.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import edu.upf.taln.treediff.common.CMLCheckers;
import edu.upf.taln.treediff.common.DiffProperties;
import edu.upf.taln.treediff.common.FileUtils;
import edu.upf.taln.treediff.core.ComparisonMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Collections;
import java.util.Date;
import java.util.List;

public class Driver
{
	private static final String single_command = "single";
	private static final String dataset_command = "dataset";
	private final static Logger log = LogManager.getLogger();

	private static abstract class BaseCommand
	{
		@Parameter(names = {"-a", "-algorithm"}, description = "Comparison mode: label-only (nierman) or text-aware (wagner)", arity = 1, required = true,
				converter = CMLCheckers.ComparisonModeConverter.class, validateWith = CMLCheckers.ComparisonModeValidator.class)
		protected ComparisonMode mode;
		@Parameter(names = {"-i1", "-input1"}, description = "Path to first XML document", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path input1;
		@Parameter(names = {"-o", "-output"}, description = "Path to output folder", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFolder.class)
		protected Path output;
		@Parameter(names = {"-p", "-properties"}, description = "Path to properties file", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path properties;
		@Parameter(names = {"-c", "-costs"}, description = "If set, cost matrices are exported for every comparison")
		protected boolean costs = false;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Compare two XML documents")
	private static class SingleCommand extends BaseCommand
	{
		@Parameter(names = {"-i2", "-input2"}, description = "Path to second XML document", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path input2;
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Compare an XML document against every document in a folder")
	private static class DatasetCommand extends BaseCommand
	{
		@Parameter(names = {"-d", "-dataset"}, description = "Path to folder containing XML documents", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFolder.class)
		private Path dataset;
	}

	private static DiffProperties loadProperties(BaseCommand command)
	{
		final DiffProperties properties = command.properties != null ? new DiffProperties(command.properties) : new DiffProperties();
		log.info(properties);
		return properties;
	}

	public static void main(String[] args)
	{
		SingleCommand single = new SingleCommand();
		DatasetCommand dataset = new DatasetCommand();

		JCommander jc = new JCommander();
		jc.addCommand(single_command, single);
		jc.addCommand(dataset_command, dataset);
		jc.parse(args);

		DateFormat dateFormat = new SimpleDateFormat("dd/MM/yyyy HH:mm:ss");
		Date date = new Date();
		log.info(dateFormat.format(date) + " running \n\t" + String.join("\n\t", args));
		log.info("\n*********************************************************");

		final String command = jc.getParsedCommand();
		if (command == null)
		{
			jc.usage();
			return;
		}

		switch (command)
		{
			case single_command:
			{
				DiffProperties properties = loadProperties(single);
				FileUtils.createFolder(single.output);
				ComparisonRunner runner = new ComparisonRunner(single.mode, properties, single.costs || properties.exportCosts());
				List<ComparisonResult> results = Collections.singletonList(runner.compare(single.input1, single.input2, single.output));
				Path metrics = ComparisonRunner.writeMetrics(results, single.output);
				ComparisonRunner.logSummary(single.mode, results, single.output, metrics);
				break;
			}
			case dataset_command:
			{
				DiffProperties properties = loadProperties(dataset);
				FileUtils.createFolder(dataset.output);
				ComparisonRunner runner = new ComparisonRunner(dataset.mode, properties, dataset.costs || properties.exportCosts());
				List<ComparisonResult> results = runner.compareWithDataset(dataset.input1, dataset.dataset, dataset.output);
				Path metrics = ComparisonRunner.writeMetrics(results, dataset.output);
				ComparisonRunner.logSummary(dataset.mode, results, dataset.output, metrics);
				break;
			}
			default:
				jc.usage();
				break;
		}

		log.debug("\n\n");
	}
}
