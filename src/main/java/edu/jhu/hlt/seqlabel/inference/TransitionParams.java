package edu.jhu.hlt.seqlabel.inference;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Random;

import org.apache.log4j.Logger;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.util.ModelIO;

/**
 * The (C+2) x (C+2) transition matrix, T[from][to], where rows/columns C and
 * C+1 are START and END. Cells which {@link LabelSpace#isAllowedTransition}
 * rejects hold negative infinity and never change.
 *
 * Forward/backward/Viterbi passes only read this. Updates happen between
 * passes (the trainer joins every pass of a batch before calling
 * {@link #update}) and each committed update bumps {@link #version()}.
 *
 * @author travis
 */
public class TransitionParams implements Serializable {
  private static final long serialVersionUID = 1L;
  public static final Logger LOG = Logger.getLogger(TransitionParams.class);

  public enum Init {
    ZERO,
    RANDOM,
  }

  private final LabelSpace space;
  private final double[][] weights;
  private long version;

  public TransitionParams(LabelSpace space) {
    this.space = space;
    int n = space.numTransitionStates();
    this.weights = new double[n][n];
    this.version = 0;
    forbid();
  }

  public static TransitionParams init(LabelSpace space, Init init, Random rand) {
    TransitionParams tp = new TransitionParams(space);
    if (init == Init.RANDOM) {
      // Same scale as a uniform init of a C-wide linear layer
      double r = 1d / Math.sqrt(space.numTags());
      int n = space.numTransitionStates();
      for (int a = 0; a < n; a++)
        for (int b = 0; b < n; b++)
          if (space.isAllowedTransition(a, b))
            tp.weights[a][b] = (2 * rand.nextDouble() - 1) * r;
    }
    LOG.info("[init] " + init + " transitions for " + space);
    return tp;
  }

  private void forbid() {
    int n = space.numTransitionStates();
    for (int a = 0; a < n; a++)
      for (int b = 0; b < n; b++)
        if (!space.isAllowedTransition(a, b))
          weights[a][b] = Double.NEGATIVE_INFINITY;
  }

  public LabelSpace getLabelSpace() {
    return space;
  }

  public long version() {
    return version;
  }

  /** T[from][to]; from/to may be {@link LabelSpace#start()}/{@link LabelSpace#end()} */
  public double get(int from, int to) {
    return weights[from][to];
  }

  public double start(int to) {
    return weights[space.start()][to];
  }

  public double end(int from) {
    return weights[from][space.end()];
  }

  /**
   * Sets one cell. Forbidden cells can't be set. Counts as an update, so this
   * must not be called while a pass is reading these params.
   */
  public void set(int from, int to, double value) {
    if (!space.isAllowedTransition(from, to))
      throw new IllegalArgumentException("transition " + from + " -> " + to + " is forbidden");
    if (Double.isNaN(value) || value == Double.POSITIVE_INFINITY)
      throw new IllegalArgumentException("bad transition score: " + value);
    weights[from][to] = value;
    version++;
  }

  /**
   * weights -= learningRate * gradient, skipping forbidden cells.
   */
  public void update(double[][] gradient, double learningRate) {
    int n = space.numTransitionStates();
    if (gradient.length != n)
      throw new IllegalArgumentException("gradient has " + gradient.length + " rows, expected " + n);
    for (int a = 0; a < n; a++) {
      for (int b = 0; b < n; b++) {
        if (!space.isAllowedTransition(a, b))
          continue;
        double g = gradient[a][b];
        if (Double.isNaN(g) || Double.isInfinite(g))
          throw new IllegalStateException("non-finite transition gradient at " + a + " -> " + b + ": " + g);
        weights[a][b] -= learningRate * g;
      }
    }
    version++;
  }

  /** Copy of the full matrix, including the negative infinity cells */
  public double[][] copyWeights() {
    double[][] c = new double[weights.length][];
    for (int i = 0; i < weights.length; i++)
      c[i] = Arrays.copyOf(weights[i], weights[i].length);
    return c;
  }

  public void serialize(DataOutputStream dos) throws IOException {
    dos.writeLong(version);
    ModelIO.writeTensor2(weights, dos);
  }

  public void deserialize(DataInputStream dis) throws IOException {
    long v = dis.readLong();
    double[][] w = ModelIO.readTensor2(dis);
    int n = space.numTransitionStates();
    if (w.length != n || w[0].length != n) {
      throw new IOException("transition matrix is " + w.length + "x" + w[0].length
          + " but the label space needs " + n + "x" + n);
    }
    for (int a = 0; a < n; a++)
      System.arraycopy(w[a], 0, weights[a], 0, n);
    forbid();
    version = v;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("(TransitionParams version=" + version);
    for (double[] row : weights) {
      sb.append('\n');
      for (double d : row)
        sb.append(String.format("\t%+1.2f", d));
    }
    sb.append(')');
    return sb.toString();
  }
}
