package edu.upf.taln.treediff.common;

import edu.upf.taln.treediff.core.TreeDiffException;

import java.nio.file.Path;

public class InvalidDocumentException extends TreeDiffException
{
	public InvalidDocumentException(Path document)
	{
		super("Invalid XML document " + document);
	}
}
