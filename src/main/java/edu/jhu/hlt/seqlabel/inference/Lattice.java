package edu.jhu.hlt.seqlabel.inference;

import java.util.Arrays;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.util.LogMath;

/**
 * The result of running {@link ForwardAlgorithm#forward} on one row: alpha,
 * log Z, and (computed lazily) beta, from which tag and transition marginals
 * follow:
 * <pre>
 *   beta[n-1][c] = T[c][END]
 *   beta[t][c]   = logsumexp_d (T[c][d] + E[t+1][d] + beta[t+1][d])
 *   p(tag_t = c)              = exp(alpha[t][c] + beta[t][c] - Z)
 *   p(tag_t-1 = b, tag_t = c) = exp(alpha[t-1][b] + T[b][c] + E[t][c] + beta[t][c] - Z)
 * </pre>
 * The derivative of log Z w.r.t. E[t][c] is p(tag_t = c) and w.r.t. T[b][c]
 * is the expected number of b -> c transitions, which is what
 * {@link #addExpectedCounts} accumulates.
 *
 * Not thread safe (beta is cached on first use).
 *
 * @author travis
 */
public class Lattice {

  private final double[][] emissions;
  private final int length;
  private final TransitionParams params;
  private final AllowedTags allowed;
  private final double[][] alpha;
  private final double logZ;
  private final long paramsVersion;
  private double[][] beta;

  Lattice(double[][] emissions, int length, TransitionParams params,
      AllowedTags allowed, double[][] alpha, double logZ) {
    this.emissions = emissions;
    this.length = length;
    this.params = params;
    this.allowed = allowed;
    this.alpha = alpha;
    this.logZ = logZ;
    this.paramsVersion = params.version();
  }

  public double logZ() {
    return logZ;
  }

  public int length() {
    return length;
  }

  public AllowedTags getAllowedTags() {
    return allowed;
  }

  public TransitionParams getParams() {
    return params;
  }

  /** log-sum of the scores of every prefix ending in tag c at position t */
  public double alpha(int t, int c) {
    return alpha[t][c];
  }

  /** log-sum of the scores of every suffix leaving tag c at position t (excludes E[t][c]) */
  public double beta(int t, int c) {
    ensureBeta();
    return beta[t][c];
  }

  /** p(tag_t = c) under this lattice's distribution */
  public double marginal(int t, int c) {
    ensureBeta();
    return LogMath.prob(alpha[t][c] + beta[t][c], logZ);
  }

  private void ensureBeta() {
    if (beta != null)
      return;
    checkVersion();
    LabelSpace space = params.getLabelSpace();
    final int C = space.numTags();
    double[] buf = new double[C];
    beta = new double[length][C];
    for (double[] row : beta)
      Arrays.fill(row, Double.NEGATIVE_INFINITY);
    for (int c : allowed.at(length - 1))
      beta[length - 1][c] = params.end(c);
    for (int t = length - 2; t >= 0; t--) {
      int[] next = allowed.at(t + 1);
      for (int c : allowed.at(t)) {
        for (int i = 0; i < next.length; i++) {
          int d = next[i];
          buf[i] = params.get(c, d) + emissions[t + 1][d] + beta[t + 1][d];
        }
        beta[t][c] = LogMath.logSumExp(buf, next.length);
      }
    }
  }

  /**
   * Adds scale * d(log Z)/d(E) into dEmissions ([position][tag], only the
   * first length rows are touched) and scale * d(log Z)/d(T) into
   * dTransitions ((C+2) x (C+2)). Either may be null to skip it.
   */
  public void addExpectedCounts(double[][] dEmissions, double[][] dTransitions, double scale) {
    checkVersion();
    ensureBeta();
    LabelSpace space = params.getLabelSpace();
    final int start = space.start();
    final int end = space.end();

    for (int t = 0; t < length; t++) {
      for (int c : allowed.at(t)) {
        double p = LogMath.prob(alpha[t][c] + beta[t][c], logZ);
        if (p == 0d)
          continue;
        if (dEmissions != null)
          dEmissions[t][c] += scale * p;
        if (dTransitions != null) {
          if (t == 0)
            dTransitions[start][c] += scale * p;
          if (t == length - 1)
            dTransitions[c][end] += scale * p;
        }
      }
    }

    if (dTransitions == null)
      return;
    for (int t = 1; t < length; t++) {
      int[] prev = allowed.at(t - 1);
      for (int c : allowed.at(t)) {
        double right = emissions[t][c] + beta[t][c];
        if (right == Double.NEGATIVE_INFINITY)
          continue;
        for (int b : prev) {
          double p = LogMath.prob(alpha[t - 1][b] + params.get(b, c) + right, logZ);
          if (p != 0d)
            dTransitions[b][c] += scale * p;
        }
      }
    }
  }

  private void checkVersion() {
    if (params.version() != paramsVersion) {
      throw new IllegalStateException("transition params were updated (version "
          + paramsVersion + " -> " + params.version() + ") while this lattice was in use");
    }
  }
}
