package edu.upf.taln.treediff.common;

import edu.upf.taln.treediff.core.structures.EditOperation;
import edu.upf.taln.treediff.core.structures.Fragment;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static java.util.stream.Collectors.toList;

/**
 * Human-readable report of an edit script, one line per operation. Fragments are named after the label of
 * their root node.
 */
public class DiffReport
{
	private final static Logger log = LogManager.getLogger();

	public static List<String> render(List<EditOperation> script)
	{
		return script.stream()
				.map(DiffReport::render)
				.collect(toList());
	}

	public static String render(EditOperation operation)
	{
		switch (operation.getType())
		{
			case UPDATE:
				return "Update: " + label(operation.getSource().get()) + " -> " + label(operation.getTarget().get());
			case DELETE:
				return "Delete: " + label(operation.getSource().get());
			case INSERT:
				return "Insert: " + label(operation.getTarget().get());
			default:
				throw new IllegalArgumentException("Unknown operation " + operation.getType());
		}
	}

	private static String label(Fragment fragment)
	{
		return fragment.isEmpty() ? "" : fragment.getLabel().toString();
	}

	public static void write(List<EditOperation> script, Path output_file)
	{
		try
		{
			FileUtils.writeLines(output_file.toFile(), StandardCharsets.UTF_8.name(), render(script), "\n");
		}
		catch (IOException e)
		{
			log.error("Cannot write diff report " + output_file + ": " + e);
			throw new UncheckedIOException(e);
		}
	}
}
