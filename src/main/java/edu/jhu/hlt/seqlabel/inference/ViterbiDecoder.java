package edu.jhu.hlt.seqlabel.inference;

import java.util.Arrays;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;

/**
 * Finds the highest scoring tag sequence with a max-product pass run right to
 * left, then reads the path off left to right:
 * <pre>
 *   phi[n-1][c] = E[n-1][c] + T[c][END]
 *   phi[t][c]   = E[t][c] + max_d (T[c][d] + phi[t+1][d]),  next[t][c] = argmax_d
 *   first       = argmax_c (T[START][c] + phi[0][c])
 * </pre>
 * phi[t][c] is the best score of any suffix starting with tag c at t. Every
 * argmax takes the smallest tag among ties, and since the path is fixed from
 * the first position on, the result is the lexicographically smallest of the
 * highest scoring paths.
 *
 * @author travis
 */
public final class ViterbiDecoder {

  private ViterbiDecoder() {}

  /** A decoded tag sequence and its score */
  public static final class Path {
    private final int[] tags;
    private final double score;
    public Path(int[] tags, double score) {
      this.tags = tags;
      this.score = score;
    }
    /** One tag per valid position */
    public int[] getTags() {
      return tags;
    }
    public double getScore() {
      return score;
    }
    public int length() {
      return tags.length;
    }
    @Override
    public String toString() {
      return String.format("(Path %s score=%.4f)", Arrays.toString(tags), score);
    }
  }

  /** Unconstrained decoding, which is what inference always uses */
  public static Path decode(double[][] emissions, int length, TransitionParams params) {
    return decode(emissions, length, params,
        AllowedTags.unconstrained(params.getLabelSpace(), length));
  }

  /**
   * @param emissions is indexed [position][tag], rows at or beyond length are ignored.
   * @return a path of exactly length tags.
   * @throws InfeasibleLatticeException if every path has score negative infinity.
   */
  public static Path decode(double[][] emissions, int length,
      TransitionParams params, AllowedTags allowed) {
    LabelSpace space = params.getLabelSpace();
    ForwardAlgorithm.checkRow(emissions, length, space);
    if (allowed.length() < length) {
      throw new IllegalArgumentException("allowed tags cover " + allowed.length()
          + " positions but the row has length " + length);
    }
    final int C = space.numTags();
    int[][] tagsAt = new int[length][];
    for (int t = 0; t < length; t++)
      tagsAt[t] = ForwardAlgorithm.checkAllowed(allowed, t, space);
    double[][] phi = new double[length][C];
    int[][] next = new int[length][C];

    Arrays.fill(phi[length - 1], Double.NEGATIVE_INFINITY);
    for (int c : tagsAt[length - 1])
      phi[length - 1][c] = emissions[length - 1][c] + params.end(c);

    for (int t = length - 2; t >= 0; t--) {
      int[] succ = tagsAt[t + 1];
      Arrays.fill(phi[t], Double.NEGATIVE_INFINITY);
      for (int c : tagsAt[t]) {
        int bestD = -1;
        double best = Double.NEGATIVE_INFINITY;
        for (int d : succ) {
          double s = params.get(c, d) + phi[t + 1][d];
          if (bestD < 0 || s > best || (s == best && d < bestD)) {
            best = s;
            bestD = d;
          }
        }
        phi[t][c] = emissions[t][c] + best;
        next[t][c] = bestD;
      }
    }

    int first = -1;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (int c : tagsAt[0]) {
      double s = params.start(c) + phi[0][c];
      if (first < 0 || s > bestScore || (s == bestScore && c < first)) {
        bestScore = s;
        first = c;
      }
    }
    if (bestScore == Double.NEGATIVE_INFINITY) {
      // the forward pass reports the first position with no surviving prefix
      ForwardAlgorithm.forward(emissions, length, params, allowed);
      throw ForwardAlgorithm.infeasible(length - 1, allowed);
    }

    int[] tags = new int[length];
    tags[0] = first;
    for (int t = 1; t < length; t++)
      tags[t] = next[t - 1][tags[t - 1]];
    return new Path(tags, bestScore);
  }
}
