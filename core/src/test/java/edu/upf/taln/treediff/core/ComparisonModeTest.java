package edu.upf.taln.treediff.core;

import org.junit.Assert;
import org.junit.Test;

public class ComparisonModeTest
{
	@Test
	public void testParse()
	{
		Assert.assertEquals(ComparisonMode.LABEL_ONLY, ComparisonMode.parse("label-only"));
		Assert.assertEquals(ComparisonMode.LABEL_ONLY, ComparisonMode.parse("nierman"));
		Assert.assertEquals(ComparisonMode.TEXT_AWARE, ComparisonMode.parse(" Text-Aware "));
		Assert.assertEquals(ComparisonMode.TEXT_AWARE, ComparisonMode.parse("wagner"));
		Assert.assertEquals(ComparisonMode.TEXT_AWARE, ComparisonMode.parse("TEXT_AWARE"));
	}

	@Test
	public void testInvalid()
	{
		try
		{
			ComparisonMode.parse("zhang-shasha");
			Assert.fail();
		}
		catch (InvalidModeException e)
		{
			Assert.assertTrue(e.getMessage().contains("zhang-shasha"));
			Assert.assertTrue(e.getMessage().contains("label-only|nierman"));
		}
	}

	@Test(expected = InvalidModeException.class)
	public void testNull()
	{
		ComparisonMode.parse(null);
	}
}
