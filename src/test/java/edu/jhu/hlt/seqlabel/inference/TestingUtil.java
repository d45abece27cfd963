package edu.jhu.hlt.seqlabel.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.util.LogMath;

/**
 * Brute force versions of the CRF computations, for small C and T only.
 */
public class TestingUtil {

  public static double[][] randomEmissions(Random rand, int length, int numTags) {
    double[][] e = new double[length][numTags];
    for (int t = 0; t < length; t++)
      for (int c = 0; c < numTags; c++)
        e[t][c] = 4 * rand.nextDouble() - 2;
    return e;
  }

  /** Every allowed cell uniform in [-2, 2] */
  public static TransitionParams randomParams(LabelSpace space, Random rand) {
    TransitionParams tp = new TransitionParams(space);
    int n = space.numTransitionStates();
    for (int a = 0; a < n; a++)
      for (int b = 0; b < n; b++)
        if (space.isAllowedTransition(a, b))
          tp.set(a, b, 4 * rand.nextDouble() - 2);
    return tp;
  }

  /** Every path of the given length using only allowed tags */
  public static List<int[]> allPaths(AllowedTags allowed, int length) {
    List<int[]> out = new ArrayList<>();
    enumerate(allowed, new int[length], 0, out);
    return out;
  }

  private static void enumerate(AllowedTags allowed, int[] prefix, int t, List<int[]> out) {
    if (t == prefix.length) {
      out.add(prefix.clone());
      return;
    }
    for (int c : allowed.at(t)) {
      prefix[t] = c;
      enumerate(allowed, prefix, t + 1, out);
    }
  }

  /** log sum_paths exp(score(path)), by enumeration */
  public static double bruteForceLogZ(double[][] emissions, int length,
      TransitionParams params, AllowedTags allowed) {
    List<int[]> paths = allPaths(allowed, length);
    double[] scores = new double[paths.size()];
    for (int i = 0; i < scores.length; i++)
      scores[i] = ForwardAlgorithm.pathScore(emissions, length, params, paths.get(i));
    return LogMath.logSumExp(scores);
  }

  /** The highest path score, by enumeration */
  public static double bruteForceMax(double[][] emissions, int length, TransitionParams params) {
    AllowedTags all = AllowedTags.unconstrained(params.getLabelSpace(), length);
    double best = Double.NEGATIVE_INFINITY;
    for (int[] p : allPaths(all, length))
      best = Math.max(best, ForwardAlgorithm.pathScore(emissions, length, params, p));
    return best;
  }

  public static int[] randomLabels(Random rand, LabelSpace space, int length) {
    int[] real = space.realTags();
    int[] l = new int[length];
    for (int t = 0; t < length; t++)
      l[t] = real[rand.nextInt(real.length)];
    return l;
  }
}
