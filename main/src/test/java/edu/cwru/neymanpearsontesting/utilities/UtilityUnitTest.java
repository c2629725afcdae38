package edu.cwru.neymanpearsontesting.utilities;

import org.testng.Assert;
import org.testng.annotations.Test;

public final class UtilityUnitTest {

    @Test
    public void testMasks() {
        Assert.assertEquals(Utility.indicesOf(0), new int[0]);
        Assert.assertEquals(Utility.indicesOf(0b10110), new int[] { 1, 2, 4 });
        Assert.assertEquals(Utility.maskOf(4, 1, 2), 0b10110);
        Assert.assertEquals(Utility.maskOf(), 0);
        Assert.assertEquals(Utility.fullMask(0), 0);
        Assert.assertEquals(Utility.fullMask(5), 0b11111);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMaskOfRejectsLargeIndex() {
        Utility.maskOf(31);
    }

    @Test
    public void testRatiosTie() {
        Assert.assertTrue(Utility.ratiosTie(3.0, 3.0 * (1 + 1e-12), 1e-9));
        Assert.assertFalse(Utility.ratiosTie(3.0, 3.0 * (1 + 1e-6), 1e-9));
        Assert.assertTrue(Utility.ratiosTie(0.0, 0.0, 1e-9));
        Assert.assertTrue(Utility.ratiosTie(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, 1e-9));
        Assert.assertFalse(Utility.ratiosTie(Double.POSITIVE_INFINITY, Double.MAX_VALUE, 1e-9));
        Assert.assertTrue(Utility.ratiosTie(Double.NaN, Double.NaN, 1e-9));
        Assert.assertFalse(Utility.ratiosTie(Double.NaN, 1.0, 1e-9));
        Assert.assertFalse(Utility.ratiosTie(0.0, 1e-300, 1e-9));
    }
}
