package edu.upf.taln.treediff.treeeditdistance;

/**
 * Word-level costs. Deleting or inserting a word costs its length.
 * Replacing a word by an identical one costs 1, replacing it by a different word costs the difference in length.
 * Immutable class.
 */
public final class WordEditScore implements EditScore<String>
{
	@Override
	public double replace(String word1, String word2)
	{
		if (word1.equals(word2))
			return 1.0;
		return Math.abs(length(word1) - length(word2));
	}

	@Override
	public double delete(String word1)
	{
		return length(word1);
	}

	@Override
	public double insert(String word2)
	{
		return length(word2);
	}

	private static int length(String word)
	{
		return word.codePointCount(0, word.length());
	}
}
