package edu.upf.taln.treediff.core;

/**
 * Base class of the errors raised while comparing linearized trees. Errors are raised where the violation is
 * detected and propagated to the caller unrecovered.
 */
public class TreeDiffException extends RuntimeException
{
	public TreeDiffException(String message)
	{
		super(message);
	}

	public TreeDiffException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
