package edu.jhu.hlt.seqlabel.inference;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.Random;

import org.apache.commons.math3.util.FastMath;

import edu.jhu.hlt.seqlabel.util.ModelIO;

/**
 * Linear map from encoder features to per-tag emission scores:
 * E[t][c] = sum_h W[c][h] * x[t][h] + b[c].
 */
public class EmissionProjection {

  private double[][] weights;   // [tag][feature]
  private double[] bias;        // [tag]

  public EmissionProjection(int numTags, int featureDimension) {
    if (numTags <= 0 || featureDimension <= 0)
      throw new IllegalArgumentException("numTags=" + numTags + " featureDimension=" + featureDimension);
    this.weights = new double[numTags][featureDimension];
    this.bias = new double[numTags];
  }

  /** Uniform in +/- 1/sqrt(featureDimension) */
  public void initRandom(Random rand) {
    double r = 1d / FastMath.sqrt(featureDimension());
    for (int c = 0; c < weights.length; c++) {
      for (int h = 0; h < weights[c].length; h++)
        weights[c][h] = (2 * rand.nextDouble() - 1) * r;
      bias[c] = (2 * rand.nextDouble() - 1) * r;
    }
  }

  public int numTags() {
    return weights.length;
  }

  public int featureDimension() {
    return weights[0].length;
  }

  public double[][] getWeights() {
    return weights;
  }

  public double[] getBias() {
    return bias;
  }

  /** [position][feature] => [position][tag] */
  public double[][] forward(double[][] features) {
    int H = featureDimension();
    double[][] e = new double[features.length][weights.length];
    for (int t = 0; t < features.length; t++) {
      if (features[t].length != H) {
        throw new IllegalArgumentException("features at position " + t + " have width "
            + features[t].length + " but the projection expects " + H);
      }
      for (int c = 0; c < weights.length; c++) {
        double s = bias[c];
        double[] w = weights[c];
        for (int h = 0; h < H; h++)
          s += w[h] * features[t][h];
        e[t][c] = s;
      }
    }
    return e;
  }

  /**
   * Adds d(loss)/d(W) and d(loss)/d(b) given d(loss)/d(E) for one row.
   * Only the first dEmissions.length positions are used.
   */
  public void backward(double[][] features, double[][] dEmissions, double[][] dW, double[] db) {
    for (int t = 0; t < dEmissions.length; t++) {
      double[] x = features[t];
      for (int c = 0; c < weights.length; c++) {
        double g = dEmissions[t][c];
        if (g == 0d)
          continue;
        db[c] += g;
        double[] dw = dW[c];
        for (int h = 0; h < x.length; h++)
          dw[h] += g * x[h];
      }
    }
  }

  /** L2 norm of the weights (not squared, bias excluded) */
  public double l2Norm() {
    double ss = 0d;
    for (double[] row : weights)
      for (double w : row)
        ss += w * w;
    return FastMath.sqrt(ss);
  }

  /** Adds the gradient of coef * ||W||_2 into dW */
  public void addL2Gradient(double coef, double[][] dW) {
    double norm = l2Norm();
    if (coef == 0d || norm == 0d)
      return;
    for (int c = 0; c < weights.length; c++)
      for (int h = 0; h < weights[c].length; h++)
        dW[c][h] += coef * weights[c][h] / norm;
  }

  public void update(double[][] dW, double[] db, double learningRate) {
    for (int c = 0; c < weights.length; c++) {
      for (int h = 0; h < weights[c].length; h++)
        weights[c][h] -= learningRate * dW[c][h];
      bias[c] -= learningRate * db[c];
    }
  }

  public void serialize(DataOutputStream dos) throws IOException {
    ModelIO.writeTensor2(weights, dos);
    ModelIO.writeTensor1(bias, dos);
  }

  public void deserialize(DataInputStream dis) throws IOException {
    double[][] w = ModelIO.readTensor2(dis);
    double[] b = ModelIO.readTensor1(dis);
    if (w.length != b.length)
      throw new IOException("projection has " + w.length + " weight rows but " + b.length + " biases");
    weights = w;
    bias = b;
  }
}
