package edu.jhu.hlt.seqlabel.util;

import org.apache.commons.math3.util.FastMath;

/**
 * Log-domain arithmetic. Every value here is a log score, so
 * {@link Double#NEGATIVE_INFINITY} plays the role of zero probability.
 *
 * @author travis
 */
public final class LogMath {

  private LogMath() {}

  /**
   * log(exp(a) + exp(b)), computed without overflow.
   */
  public static double logAdd(double a, double b) {
    if (a == Double.NEGATIVE_INFINITY)
      return b;
    if (b == Double.NEGATIVE_INFINITY)
      return a;
    if (a < b) {
      double t = a;
      a = b;
      b = t;
    }
    return a + FastMath.log1p(FastMath.exp(b - a));
  }

  /**
   * log(sum_i exp(values[i])) over the first n values, via max-subtraction.
   * Returns negative infinity if n == 0 or every value is negative infinity.
   * A single value is returned unchanged (no rounding from exp/log).
   */
  public static double logSumExp(double[] values, int n) {
    if (n < 0 || n > values.length)
      throw new IllegalArgumentException("n=" + n + " values.length=" + values.length);
    if (n == 0)
      return Double.NEGATIVE_INFINITY;
    if (n == 1)
      return values[0];
    double max = Double.NEGATIVE_INFINITY;
    for (int i = 0; i < n; i++)
      if (values[i] > max)
        max = values[i];
    if (max == Double.NEGATIVE_INFINITY || max == Double.POSITIVE_INFINITY)
      return max;
    double sum = 0d;
    for (int i = 0; i < n; i++) {
      if (values[i] == Double.NEGATIVE_INFINITY)
        continue;
      sum += FastMath.exp(values[i] - max);
    }
    return max + FastMath.log(sum);
  }

  public static double logSumExp(double[] values) {
    return logSumExp(values, values.length);
  }

  /** exp(logValue - logNormalizer), with exp(-inf) = 0 */
  public static double prob(double logValue, double logNormalizer) {
    if (logValue == Double.NEGATIVE_INFINITY)
      return 0d;
    return FastMath.exp(logValue - logNormalizer);
  }
}
