package edu.jhu.hlt.seqlabel.inference;

import java.util.Arrays;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.util.LogMath;

/**
 * Computes the log partition function of a linear-chain CRF:
 * <pre>
 *   alpha[0][c] = T[START][c] + E[0][c]
 *   alpha[t][c] = E[t][c] + logsumexp_p (alpha[t-1][p] + T[p][c])
 *   Z           = logsumexp_c (alpha[n-1][c] + T[c][END])
 * </pre>
 * where c ranges over {@link AllowedTags#at(int)} t and p over the tags
 * allowed at t-1. With every tag allowed this is the normalizer, with a
 * singleton per position it is the score of that one path, and with
 * candidate sets it is the restricted normalizer used by partial supervision.
 *
 * O(n * C^2) time per row. Everything here is a pure function of its
 * arguments, so rows may be run on different threads as long as the
 * {@link TransitionParams} are not updated concurrently.
 *
 * @author travis
 */
public final class ForwardAlgorithm {

  private ForwardAlgorithm() {}

  /**
   * Runs the forward recursion, returning a lattice which holds alpha and Z
   * (and can compute marginals).
   *
   * @param emissions is indexed [position][tag], may be longer than length
   * (padding rows are ignored).
   * @param length is the number of valid positions, must be in [1, emissions.length].
   * @throws InfeasibleLatticeException if Z is negative infinity.
   */
  public static Lattice forward(double[][] emissions, int length,
      TransitionParams params, AllowedTags allowed) {
    LabelSpace space = params.getLabelSpace();
    checkRow(emissions, length, space);
    if (allowed.length() < length) {
      throw new IllegalArgumentException("allowed tags cover " + allowed.length()
          + " positions but the row has length " + length);
    }
    final int C = space.numTags();
    double[][] alpha = new double[length][C];
    double[] buf = new double[C];

    int[] cur = checkAllowed(allowed, 0, space);
    Arrays.fill(alpha[0], Double.NEGATIVE_INFINITY);
    boolean anyFinite = false;
    for (int c : cur) {
      alpha[0][c] = params.start(c) + emissions[0][c];
      anyFinite |= alpha[0][c] > Double.NEGATIVE_INFINITY;
    }
    if (!anyFinite)
      throw infeasible(0, allowed);

    for (int t = 1; t < length; t++) {
      int[] prev = cur;
      cur = checkAllowed(allowed, t, space);
      Arrays.fill(alpha[t], Double.NEGATIVE_INFINITY);
      anyFinite = false;
      for (int c : cur) {
        for (int i = 0; i < prev.length; i++) {
          int p = prev[i];
          buf[i] = alpha[t - 1][p] + params.get(p, c);
        }
        alpha[t][c] = emissions[t][c] + LogMath.logSumExp(buf, prev.length);
        anyFinite |= alpha[t][c] > Double.NEGATIVE_INFINITY;
      }
      if (!anyFinite)
        throw infeasible(t, allowed);
    }

    for (int i = 0; i < cur.length; i++) {
      int c = cur[i];
      buf[i] = alpha[length - 1][c] + params.end(c);
    }
    double logZ = LogMath.logSumExp(buf, cur.length);
    if (logZ == Double.NEGATIVE_INFINITY)
      throw infeasible(length - 1, allowed);
    if (Double.isNaN(logZ) || Double.isInfinite(logZ))
      throw new IllegalStateException("log partition function is " + logZ);
    return new Lattice(emissions, length, params, allowed, alpha, logZ);
  }

  /** log Z over every tag sequence of the given length */
  public static double logPartition(double[][] emissions, int length, TransitionParams params) {
    AllowedTags all = AllowedTags.unconstrained(params.getLabelSpace(), length);
    return forward(emissions, length, params, all).logZ();
  }

  /**
   * The score of one tag sequence:
   * T[START][g0] + E[0][g0] + sum_t (T[g(t-1)][g(t)] + E[t][g(t)]) + T[g(n-1)][END].
   * Sums are associated the same way as in {@link #forward}, so this is
   * bit-for-bit equal to the forward algorithm run with singleton tag sets.
   */
  public static double pathScore(double[][] emissions, int length,
      TransitionParams params, int[] tags) {
    LabelSpace space = params.getLabelSpace();
    checkRow(emissions, length, space);
    if (tags.length < length)
      throw new IllegalArgumentException("path has " + tags.length + " tags but length is " + length);
    for (int t = 0; t < length; t++)
      space.checkTag(tags[t]);
    double s = params.start(tags[0]) + emissions[0][tags[0]];
    for (int t = 1; t < length; t++)
      s = emissions[t][tags[t]] + (s + params.get(tags[t - 1], tags[t]));
    return s + params.end(tags[length - 1]);
  }

  /**
   * Checks the shape of one row of emissions. Negative infinity is allowed
   * (it hard-forbids a tag at a position), NaN and positive infinity are not.
   */
  public static void checkRow(double[][] emissions, int length, LabelSpace space) {
    if (length <= 0)
      throw new IllegalArgumentException("valid length must be positive: " + length);
    if (emissions.length < length) {
      throw new IllegalArgumentException("length " + length
          + " exceeds the " + emissions.length + " rows of emissions");
    }
    final int C = space.numTags();
    for (int t = 0; t < length; t++) {
      if (emissions[t].length != C) {
        throw new IllegalArgumentException("emissions at position " + t
            + " have width " + emissions[t].length + " but there are " + C + " tags");
      }
      for (int c = 0; c < C; c++) {
        double e = emissions[t][c];
        if (Double.isNaN(e) || e == Double.POSITIVE_INFINITY)
          throw new IllegalArgumentException("emission[" + t + "][" + c + "] = " + e);
      }
    }
  }

  static int[] checkAllowed(AllowedTags allowed, int t, LabelSpace space) {
    int[] a = allowed.at(t);
    if (a.length == 0)
      throw new IllegalArgumentException("no tags allowed at position " + t);
    for (int c : a)
      space.checkTag(c);
    return a;
  }

  static InfeasibleLatticeException infeasible(int t, AllowedTags allowed) {
    return new InfeasibleLatticeException("every path is forbidden by position "
        + t + ", allowed=" + allowed, t);
  }
}
