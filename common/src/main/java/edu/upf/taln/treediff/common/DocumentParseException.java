package edu.upf.taln.treediff.common;

import edu.upf.taln.treediff.core.TreeDiffException;

/**
 * A document could not be parsed. The message is the one reported by the XML parser.
 */
public class DocumentParseException extends TreeDiffException
{
	public DocumentParseException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
