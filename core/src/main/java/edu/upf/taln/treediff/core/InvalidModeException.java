package edu.upf.taln.treediff.core;

public class InvalidModeException extends TreeDiffException
{
	public InvalidModeException(String message)
	{
		super(message);
	}
}
