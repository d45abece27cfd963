package edu.jhu.hlt.seqlabel.inference;

import java.util.List;

/**
 * Negative log likelihood of one row: log Z(all paths) - log Z(supervised paths).
 * With full supervision the second term is the gold path's score, with partial
 * supervision it sums over every path consistent with the candidate sets.
 *
 * Always >= 0 (up to rounding), and exactly 0 when the supervision allows
 * every tag everywhere.
 *
 * @author travis
 */
public class CrfLoss implements Adjoints {

  private final Lattice total;
  private final Lattice supervised;
  private final Gradient gradient;
  private final double[][] dEmissions;
  private final double value;

  /**
   * @param gradient receives the transition part of the gradient in
   * {@link #backwards(double)}, may be null.
   */
  public CrfLoss(Lattice total, Lattice supervised, Gradient gradient) {
    if (total.length() != supervised.length())
      throw new IllegalArgumentException("lattice lengths differ: " + total.length() + " vs " + supervised.length());
    this.total = total;
    this.supervised = supervised;
    this.gradient = gradient;
    this.dEmissions = new double[total.length()][];
    this.value = total.logZ() - supervised.logZ();
  }

  @Override
  public double forwards() {
    return value;
  }

  /**
   * d(loss)/d(E[t][c]) = p_total(tag_t = c) - p_supervised(tag_t = c), and
   * likewise for the expected transition counts. The emission part is kept
   * here (see {@link #getEmissionGradient()}) for whoever produced the
   * emissions.
   */
  @Override
  public void backwards(double dErr_dForwards) {
    if (dEmissions[0] == null) {
      int C = total.getParams().getLabelSpace().numTags();
      for (int t = 0; t < dEmissions.length; t++)
        dEmissions[t] = new double[C];
    }
    double[][] dT = null;
    if (gradient != null) {
      int n = total.getParams().getLabelSpace().numTransitionStates();
      dT = new double[n][n];
    }
    total.addExpectedCounts(dEmissions, dT, dErr_dForwards);
    supervised.addExpectedCounts(dEmissions, dT, -dErr_dForwards);
    if (gradient != null)
      gradient.addTransitions(dT, 1d);
  }

  /** [position][tag], populated by {@link #backwards(double)}, null before that */
  public double[][] getEmissionGradient() {
    return dEmissions[0] == null ? null : dEmissions;
  }

  public int numTokens() {
    return total.length();
  }

  public Lattice getTotal() {
    return total;
  }

  public Lattice getSupervised() {
    return supervised;
  }

  @Override
  public String toString() {
    return String.format("(CrfLoss %.4f = %.4f - %.4f)", value, total.logZ(), supervised.logZ());
  }

  /**
   * The loss of a batch: either the sum over rows or the sum divided by the
   * number of valid tokens in the batch.
   */
  public static class Batch implements Adjoints {
    private final List<CrfLoss> rows;
    private final double scale;
    private final int numTokens;

    public Batch(List<CrfLoss> rows, CrfLayer.Normalization normalization) {
      this.rows = rows;
      int n = 0;
      for (CrfLoss r : rows)
        n += r.numTokens();
      this.numTokens = n;
      this.scale = normalization == CrfLayer.Normalization.TOKEN_MEAN && n > 0 ? 1d / n : 1d;
    }

    public List<CrfLoss> getRows() {
      return rows;
    }

    public int numTokens() {
      return numTokens;
    }

    @Override
    public double forwards() {
      double s = 0d;
      for (CrfLoss r : rows)
        s += r.forwards();
      return scale * s;
    }

    @Override
    public void backwards(double dErr_dForwards) {
      for (CrfLoss r : rows)
        r.backwards(scale * dErr_dForwards);
    }
  }
}
