package edu.jhu.hlt.seqlabel.inference;

import org.apache.commons.math3.util.FastMath;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;

/**
 * Turns a (clipped) batch gradient into a parameter update on a
 * {@link Tagger}. Stateful implementations keep one slot per parameter, so an
 * instance belongs to a single tagger.
 *
 * @author travis
 */
public interface Optimizer {

  /** Takes one step. Must not overlap with any loss or decode call. */
  public void step(Tagger tagger, Gradient g, double learningRate);

  public static Optimizer byName(String name) {
    switch (name.toLowerCase()) {
    case "sgd":
      return new Sgd();
    case "adam":
      return new Adam();
    default:
      throw new IllegalArgumentException("unknown optimizer: " + name);
    }
  }

  /** params -= learningRate * gradient */
  public static class Sgd implements Optimizer {
    @Override
    public void step(Tagger tagger, Gradient g, double learningRate) {
      tagger.apply(g, learningRate);
    }
    @Override
    public String toString() {
      return "(Sgd)";
    }
  }

  /**
   * Adam (Kingma and Ba, 2015) with bias corrected first and second moments:
   * <pre>
   *   m = b1 * m + (1 - b1) * g
   *   v = b2 * v + (1 - b2) * g^2
   *   params -= lr * (m / (1 - b1^t)) / (sqrt(v / (1 - b2^t)) + eps)
   * </pre>
   * Forbidden transitions keep zero moments and are never moved.
   */
  public static class Adam implements Optimizer {
    public final double beta1;
    public final double beta2;
    public final double eps;

    private int steps;
    private double[][] mT, vT;        // transitions
    private double[][] mW, vW;        // projection weights
    private double[] mB, vB;          // projection bias

    public Adam() {
      this(0.9, 0.999, 1e-8);
    }

    public Adam(double beta1, double beta2, double eps) {
      if (beta1 < 0 || beta1 >= 1 || beta2 < 0 || beta2 >= 1)
        throw new IllegalArgumentException("betas must be in [0,1): " + beta1 + ", " + beta2);
      if (eps <= 0)
        throw new IllegalArgumentException("eps must be positive: " + eps);
      this.beta1 = beta1;
      this.beta2 = beta2;
      this.eps = eps;
    }

    public int getSteps() {
      return steps;
    }

    @Override
    public void step(Tagger tagger, Gradient g, double learningRate) {
      LabelSpace space = tagger.getTransitions().getLabelSpace();
      int n = space.numTransitionStates();
      int C = space.numTags();
      int H = tagger.getProjection().featureDimension();
      if (mT == null) {
        mT = new double[n][n];
        vT = new double[n][n];
        mW = new double[C][H];
        vW = new double[C][H];
        mB = new double[C];
        vB = new double[C];
      } else if (mT.length != n || mW.length != C || (C > 0 && mW[0].length != H)) {
        throw new IllegalStateException("this optimizer was used with a differently shaped tagger");
      }

      steps++;
      double c1 = 1 - FastMath.pow(beta1, steps);
      double c2 = 1 - FastMath.pow(beta2, steps);
      Gradient direction = tagger.newGradient();

      double[][] gT = g.getTransitions();
      double[][] dT = direction.getTransitions();
      for (int a = 0; a < n; a++) {
        for (int b = 0; b < n; b++) {
          if (!space.isAllowedTransition(a, b))
            continue;
          dT[a][b] = moment(gT[a][b], mT[a], vT[a], b, c1, c2);
        }
      }
      double[][] gW = g.getWeights();
      double[] gB = g.getBias();
      double[][] dW = direction.getWeights();
      double[] dB = direction.getBias();
      for (int c = 0; c < C; c++) {
        for (int h = 0; h < H; h++)
          dW[c][h] = moment(gW[c][h], mW[c], vW[c], h, c1, c2);
        dB[c] = moment(gB[c], mB, vB, c, c1, c2);
      }
      tagger.apply(direction, learningRate);
    }

    /** Updates m[i] and v[i] with gradient value d, returns the step direction */
    private double moment(double d, double[] m, double[] v, int i, double c1, double c2) {
      m[i] = beta1 * m[i] + (1 - beta1) * d;
      v[i] = beta2 * v[i] + (1 - beta2) * d * d;
      return (m[i] / c1) / (FastMath.sqrt(v[i] / c2) + eps);
    }

    @Override
    public String toString() {
      return "(Adam beta1=" + beta1 + " beta2=" + beta2 + " eps=" + eps + " steps=" + steps + ")";
    }
  }
}
