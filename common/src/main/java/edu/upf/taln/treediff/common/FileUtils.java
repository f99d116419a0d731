package edu.upf.taln.treediff.common;

import org.apache.commons.io.FilenameUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static java.util.stream.Collectors.toList;

public class FileUtils
{
	private final static Logger log = LogManager.getLogger();

	/**
	 * @return files in the folder with the given suffix, sorted by name
	 */
	public static List<Path> getFilesInFolder(Path input_folder, String suffix)
	{
		final File[] files = input_folder.toFile().listFiles(f -> f.isFile() && f.getName().toLowerCase().endsWith(suffix));
		if (files == null)
		{
			log.error("Failed to list files in " + input_folder);
			throw new UncheckedIOException(new IOException("Cannot list folder " + input_folder));
		}

		return Arrays.stream(files)
				.map(File::toPath)
				.sorted()
				.collect(toList());
	}

	public static String readTextFile(Path file)
	{
		try
		{
			return org.apache.commons.io.FileUtils.readFileToString(file.toFile(), StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			log.error("Cannot read file " + file + ": " + e);
			throw new UncheckedIOException(e);
		}
	}

	public static void writeTextToFile(Path file, String text)
	{
		try
		{
			org.apache.commons.io.FileUtils.writeStringToFile(file.toFile(), text, StandardCharsets.UTF_8);
		}
		catch (IOException e)
		{
			log.error("Cannot write to file " + file + ": " + e);
			throw new UncheckedIOException(e);
		}
	}

	public static Path createFolder(Path folder)
	{
		try
		{
			if (!Files.exists(folder))
				Files.createDirectories(folder);
			return folder;
		}
		catch (IOException e)
		{
			log.error("Cannot create folder " + folder + ": " + e);
			throw new UncheckedIOException(e);
		}
	}

	public static String getFileName(Path file)
	{
		return FilenameUtils.getName(file.toString());
	}

	/**
	 * Checks whether two paths point to the same file, falling back to comparing normalized absolute paths
	 */
	public static boolean isSameFile(Path file1, Path file2)
	{
		try
		{
			return Files.isSameFile(file1, file2);
		}
		catch (IOException e)
		{
			return file1.toAbsolutePath().normalize().equals(file2.toAbsolutePath().normalize());
		}
	}
}
