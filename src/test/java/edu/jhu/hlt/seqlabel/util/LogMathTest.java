package edu.jhu.hlt.seqlabel.util;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class LogMathTest {

  private static final double NINF = Double.NEGATIVE_INFINITY;

  @Test
  public void logAdd() {
    assertEquals(Math.log(5), LogMath.logAdd(Math.log(2), Math.log(3)), 1e-12);
    assertEquals(1.5, LogMath.logAdd(1.5, NINF), 0d);
    assertEquals(1.5, LogMath.logAdd(NINF, 1.5), 0d);
    assertEquals(NINF, LogMath.logAdd(NINF, NINF), 0d);
    assertEquals(800 + Math.log(2), LogMath.logAdd(800, 800), 1e-9);
  }

  @Test
  public void logSumExp() {
    double[] v = new double[] {Math.log(1), Math.log(2), NINF, Math.log(3)};
    assertEquals(Math.log(6), LogMath.logSumExp(v), 1e-12);
    assertEquals(Math.log(3), LogMath.logSumExp(v, 2), 1e-12);
    assertEquals(NINF, LogMath.logSumExp(v, 0), 0d);
    assertEquals(NINF, LogMath.logSumExp(new double[] {NINF, NINF}), 0d);
    assertEquals(-1000 + Math.log(3), LogMath.logSumExp(new double[] {-1000, -1000, -1000}), 1e-9);
  }

  @Test
  public void singleValueIsUnchanged() {
    double x = 0.1 + 0.2;
    assertEquals(x, LogMath.logSumExp(new double[] {x, 99}, 1), 0d);
    assertEquals(NINF, LogMath.logSumExp(new double[] {NINF}), 0d);
  }

  @Test
  public void prob() {
    assertEquals(0d, LogMath.prob(NINF, 3), 0d);
    assertEquals(0.5, LogMath.prob(Math.log(1), Math.log(2)), 1e-12);
  }
}
