package edu.jhu.hlt.seqlabel.inference;

import org.apache.commons.math3.util.FastMath;

/**
 * Accumulates d(loss)/d(params) for one batch: the transition matrix and,
 * optionally, the emission projection's weights and bias.
 *
 * Adds are synchronized so that rows of a batch may be run backwards on
 * different threads.
 */
public class Gradient {

  private final double[][] transitions;
  private final double[][] weights;   // may be null
  private final double[] bias;        // may be null

  /** Transitions only */
  public Gradient(int numTransitionStates) {
    this(numTransitionStates, 0, 0);
  }

  public Gradient(int numTransitionStates, int numTags, int featureDimension) {
    transitions = new double[numTransitionStates][numTransitionStates];
    if (featureDimension > 0) {
      weights = new double[numTags][featureDimension];
      bias = new double[numTags];
    } else {
      weights = null;
      bias = null;
    }
  }

  public double[][] getTransitions() {
    return transitions;
  }

  public boolean hasProjection() {
    return weights != null;
  }

  public double[][] getWeights() {
    return weights;
  }

  public double[] getBias() {
    return bias;
  }

  public synchronized void addTransitions(double[][] d, double scale) {
    for (int a = 0; a < transitions.length; a++)
      for (int b = 0; b < transitions[a].length; b++)
        transitions[a][b] += scale * d[a][b];
  }

  public synchronized void addWeights(double[][] dW, double[] db, double scale) {
    if (weights == null)
      throw new IllegalStateException("this gradient has no projection part");
    for (int c = 0; c < weights.length; c++) {
      for (int h = 0; h < weights[c].length; h++)
        weights[c][h] += scale * dW[c][h];
      bias[c] += scale * db[c];
    }
  }

  public double l2Norm() {
    double ss = 0d;
    for (double[] row : transitions)
      for (double d : row)
        ss += d * d;
    if (weights != null) {
      for (double[] row : weights)
        for (double d : row)
          ss += d * d;
      for (double d : bias)
        ss += d * d;
    }
    return FastMath.sqrt(ss);
  }

  public void scale(double factor) {
    for (double[] row : transitions)
      for (int i = 0; i < row.length; i++)
        row[i] *= factor;
    if (weights != null) {
      for (double[] row : weights)
        for (int i = 0; i < row.length; i++)
          row[i] *= factor;
      for (int i = 0; i < bias.length; i++)
        bias[i] *= factor;
    }
  }

  /**
   * Rescales so that the global L2 norm is at most maxNorm.
   * @return the norm before clipping.
   */
  public double clip(double maxNorm) {
    double norm = l2Norm();
    if (maxNorm > 0 && norm > maxNorm)
      scale(maxNorm / norm);
    return norm;
  }
}
