package edu.upf.taln.treediff.core;

import java.util.Arrays;
import java.util.List;

import static java.util.stream.Collectors.joining;

/**
 * How fragments are compared when deriving an edit script.
 */
public enum ComparisonMode
{
	/**
	 * Labels only. Also accepted under the algorithm name "nierman".
	 */
	LABEL_ONLY("label-only", "nierman"),
	/**
	 * Labels plus per-node text, compared with word-level edit distance. Also accepted as "wagner".
	 */
	TEXT_AWARE("text-aware", "wagner");

	private final String name;
	private final String algorithm;

	ComparisonMode(String name, String algorithm)
	{
		this.name = name;
		this.algorithm = algorithm;
	}

	public String getName() { return name; }
	public String getAlgorithm() { return algorithm; }
	public boolean isTextAware() { return this == TEXT_AWARE; }

	/**
	 * Parses a mode from its name, its algorithm name or its constant name, ignoring case
	 * @throws InvalidModeException if the value matches no mode
	 */
	public static ComparisonMode parse(String value)
	{
		if (value == null)
			throw new InvalidModeException("No comparison mode given");

		final String v = value.trim();
		for (ComparisonMode mode : values())
		{
			if (mode.name.equalsIgnoreCase(v) || mode.algorithm.equalsIgnoreCase(v) || mode.name().equalsIgnoreCase(v))
				return mode;
		}

		throw new InvalidModeException("Unsupported comparison mode '" + value + "', expected one of " + validNames());
	}

	public static String validNames()
	{
		List<ComparisonMode> modes = Arrays.asList(values());
		return modes.stream()
				.map(m -> m.name + "|" + m.algorithm)
				.collect(joining(", "));
	}

	@Override
	public String toString()
	{
		return name;
	}
}
