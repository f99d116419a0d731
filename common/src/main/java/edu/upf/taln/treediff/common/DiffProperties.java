package edu.upf.taln.treediff.common;

import com.google.common.base.Preconditions;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Settings of the comparison tools. Defaults are read from treediff.properties in the classpath and can be
 * overridden by a user properties file.
 */
public class DiffProperties
{
	public static final String DEFAULTS_RESOURCE = "treediff.properties";

	private final boolean includeAttributes;
	private final String outputWrapper;
	private final int outputIndent;
	private final String datasetSuffix;
	private final boolean exportCosts;

	private final static Logger log = LogManager.getLogger();

	public DiffProperties()
	{
		this(loadDefaults());
	}

	public DiffProperties(Path properties_file)
	{
		this(load(properties_file));
	}

	private DiffProperties(Properties prop)
	{
		includeAttributes = parseBoolean(prop, "td.attributes.include");
		outputWrapper = prop.getProperty("td.output.wrapper", "").trim();
		Preconditions.checkArgument(!outputWrapper.isEmpty(), "td.output.wrapper cannot be empty");
		outputIndent = parseInt(prop, "td.output.indent");
		Preconditions.checkArgument(outputIndent >= 0, "td.output.indent must be greater or equal to 0: %s", outputIndent);
		datasetSuffix = prop.getProperty("td.dataset.suffix", "").trim().toLowerCase();
		Preconditions.checkArgument(!datasetSuffix.isEmpty(), "td.dataset.suffix cannot be empty");
		exportCosts = parseBoolean(prop, "td.export.costs");
	}

	private static Properties loadDefaults()
	{
		Properties prop = new Properties();
		try (InputStream input = DiffProperties.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE))
		{
			if (input == null)
				throw new IllegalStateException("Missing resource " + DEFAULTS_RESOURCE);
			prop.load(input);
		}
		catch (IOException e)
		{
			log.error("Failed to load default properties");
			throw new UncheckedIOException(e);
		}
		return prop;
	}

	private static Properties load(Path properties_file)
	{
		Properties prop = new Properties(loadDefaults());
		try (FileInputStream input = new FileInputStream(properties_file.toFile()))
		{
			prop.load(input);
		}
		catch (IOException e)
		{
			log.error("Failed to load properties from " + properties_file);
			throw new UncheckedIOException(e);
		}
		return prop;
	}

	private static boolean parseBoolean(Properties prop, String key)
	{
		final String value = prop.getProperty(key, "").trim();
		Preconditions.checkArgument(value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false"),
				"%s must be true or false: %s", key, value);
		return Boolean.parseBoolean(value);
	}

	private static int parseInt(Properties prop, String key)
	{
		final String value = prop.getProperty(key, "").trim();
		try
		{
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException(key + " must be an integer: " + value, e);
		}
	}

	public boolean includeAttributes() { return includeAttributes; }
	public String getOutputWrapper() { return outputWrapper; }
	public int getOutputIndent() { return outputIndent; }
	public String getDatasetSuffix() { return datasetSuffix; }
	public boolean exportCosts() { return exportCosts; }

	@Override
	public String toString()
	{
		return "Properties:" +
				"\n\ttd.attributes.include = " + includeAttributes +
				"\n\ttd.output.wrapper = " + outputWrapper +
				"\n\ttd.output.indent = " + outputIndent +
				"\n\ttd.dataset.suffix = " + datasetSuffix +
				"\n\ttd.export.costs = " + exportCosts;
	}
}
