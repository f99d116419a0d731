package edu.upf.taln.treediff.treeeditdistance;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

import java.util.Collections;
import java.util.List;

/**
 * Wagner-Fischer edit distance between two texts, computed over their whitespace-separated words.
 * Immutable class.
 */
public final class WordDistance
{
	private static final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();
	private final EditScore<String> score;

	public static final class Result
	{
		private final double[][] matrix;

		private Result(double[][] matrix)
		{
			this.matrix = matrix;
		}

		/**
		 * @return full (M+1)x(N+1) distance matrix, where M and N are the number of words in each text
		 */
		public double[][] getMatrix() { return matrix; }

		public double getTotal()
		{
			return matrix[matrix.length - 1][matrix[0].length - 1];
		}
	}

	public WordDistance()
	{
		this(new WordEditScore());
	}

	public WordDistance(EditScore<String> score)
	{
		this.score = score;
	}

	public Result compute(String text1, String text2)
	{
		final List<String> words1 = split(text1);
		final List<String> words2 = split(text2);
		final int m = words1.size();
		final int n = words2.size();

		double[][] dist = new double[m + 1][n + 1];
		for (int i = 1; i <= m; ++i)
			dist[i][0] = dist[i - 1][0] + score.delete(words1.get(i - 1));
		for (int j = 1; j <= n; ++j)
			dist[0][j] = dist[0][j - 1] + score.insert(words2.get(j - 1));

		for (int i = 1; i <= m; ++i)
		{
			for (int j = 1; j <= n; ++j)
			{
				final String w1 = words1.get(i - 1);
				final String w2 = words2.get(j - 1);
				dist[i][j] = Math.min(dist[i - 1][j - 1] + score.replace(w1, w2),
						Math.min(dist[i - 1][j] + score.delete(w1), dist[i][j - 1] + score.insert(w2)));
			}
		}

		return new Result(dist);
	}

	/**
	 * Shortcut returning the bottom-right cell of the distance matrix
	 */
	public double distance(String text1, String text2)
	{
		return compute(text1, text2).getTotal();
	}

	static List<String> split(String text)
	{
		if (text == null || text.isEmpty())
			return Collections.emptyList();
		return splitter.splitToList(text);
	}
}
