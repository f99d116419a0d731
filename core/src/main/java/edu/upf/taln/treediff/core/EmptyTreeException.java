package edu.upf.taln.treediff.core;

public class EmptyTreeException extends TreeDiffException
{
	public EmptyTreeException(String message)
	{
		super(message);
	}
}
