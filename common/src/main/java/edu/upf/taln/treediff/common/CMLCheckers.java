package edu.upf.taln.treediff.common;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;
import edu.upf.taln.treediff.core.ComparisonMode;
import edu.upf.taln.treediff.core.InvalidModeException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class CMLCheckers
{
	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	public static class ComparisonModeConverter implements IStringConverter<ComparisonMode>
	{
		@Override
		public ComparisonMode convert(String value)
		{
			try
			{
				return ComparisonMode.parse(value);
			}
			catch (InvalidModeException e)
			{
				throw new ParameterException(e.getMessage());
			}
		}
	}

	public static class ComparisonModeValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try
			{
				ComparisonMode.parse(value);
			}
			catch (InvalidModeException e)
			{
				throw new ParameterException("Parameter " + name + " has invalid value " + value + ": " + e.getMessage());
			}
		}
	}

	public static class ValidPathToFolder implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value).toAbsolutePath();
			if ((Files.exists(path) && Files.isRegularFile(path)) || path.getParent() == null || !Files.exists(path.getParent()))
			{
				throw new ParameterException("Cannot use output folder " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isRegularFile(path))
			{
				throw new ParameterException("Cannot open file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFolder implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isDirectory(path))
			{
				throw new ParameterException("Cannot open folder " + name + " = " + value);
			}
		}
	}
}
