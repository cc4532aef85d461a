package org.broadinstitute.repeatresolver.utils.param;

import org.testng.Assert;
import org.testng.annotations.Test;

public class ParamUtilsUnitTest {

    @Test
    public void testInRangeSuccess(){
        Assert.assertEquals(ParamUtils.inRange(0.5, 0.0, 1.0, "error"), 0.5);
        Assert.assertEquals(ParamUtils.inRange(0.0, 0.0, 1.0, "error"), 0.0);
        Assert.assertEquals(ParamUtils.inRange(1.0, 0.0, 1.0, "error"), 1.0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInRangeAboveMax(){
        ParamUtils.inRange(1.1, 0.0, 1.0, "error");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testInRangeNaN(){
        ParamUtils.inRange(Double.NaN, 0.0, 1.0, "error");
    }

    @Test
    public void testIsPositiveOrZero(){
        Assert.assertEquals(ParamUtils.isPositiveOrZero(0, "error"), 0);
        Assert.assertEquals(ParamUtils.isPositiveOrZero(3, "error"), 3);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testIsPositiveOrZeroFail(){
        ParamUtils.isPositiveOrZero(-1, "error");
    }

    @Test
    public void testIsPositive(){
        Assert.assertEquals(ParamUtils.isPositive(1, "error"), 1);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testIsPositiveFail(){
        ParamUtils.isPositive(0, "error");
    }
}
