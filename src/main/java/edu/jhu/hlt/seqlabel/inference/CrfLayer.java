package edu.jhu.hlt.seqlabel.inference;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.IntFunction;

import org.apache.log4j.Logger;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;

/**
 * Linear-chain CRF classification head with full supervision: every valid
 * position has exactly one gold tag. {@link PartialCrfLayer} relaxes this.
 *
 * Batches are given padded: emissions[row] is [T][C] and lengths[row] says
 * how many of the T positions are real. Padded positions never affect a loss
 * or a decode.
 *
 * Rows are independent. If an {@link ExecutorService} is given they are run
 * on it, and every row has finished before train/decode returns, so callers
 * can safely update the {@link TransitionParams} afterwards.
 *
 * @author travis
 */
public class CrfLayer {
  public static final Logger LOG = Logger.getLogger(CrfLayer.class);

  public enum Normalization {
    SUM,          // sum of per-sequence losses
    TOKEN_MEAN,   // sum of per-sequence losses divided by number of valid tokens
  }

  protected final LabelSpace space;
  protected final TransitionParams params;
  private Normalization normalization;

  public CrfLayer(TransitionParams params) {
    this(params, Normalization.SUM);
  }

  public CrfLayer(TransitionParams params, Normalization normalization) {
    this.params = params;
    this.space = params.getLabelSpace();
    this.normalization = normalization;
  }

  public TransitionParams getParams() {
    return params;
  }

  public LabelSpace getLabelSpace() {
    return space;
  }

  public Normalization getNormalization() {
    return normalization;
  }

  public void setNormalization(Normalization normalization) {
    this.normalization = normalization;
  }

  /**
   * What the gold labels of one row allow at each valid position. Here: the
   * gold tag itself.
   */
  public AllowedTags supervision(int[] labels, int length) {
    for (int t = 0; t < length; t++)
      space.checkTag(labels[t]);
    return AllowedTags.gold(labels);
  }

  /**
   * The loss for one row.
   * @param gradient receives the transition gradient when the returned loss is
   * run backwards, may be null.
   */
  public CrfLoss loss(double[][] emissions, int length, AllowedTags supervision, Gradient gradient) {
    AllowedTags all = AllowedTags.unconstrained(space, length);
    Lattice total = ForwardAlgorithm.forward(emissions, length, params, all);
    Lattice supervised = ForwardAlgorithm.forward(emissions, length, params, supervision);
    return new CrfLoss(total, supervised, gradient);
  }

  public CrfLoss loss(double[][] emissions, int length, int[] labels, Gradient gradient) {
    if (labels.length != emissions.length) {
      throw new IllegalArgumentException("row has " + emissions.length
          + " emission vectors but " + labels.length + " labels");
    }
    ForwardAlgorithm.checkRow(emissions, length, space);
    return loss(emissions, length, supervision(labels, length), gradient);
  }

  /**
   * Computes the loss of a batch.
   * @param labels is [row][T], the same shape as emissions (minus the tag dimension).
   * @param es may be null, in which case rows are run on this thread.
   */
  public CrfLoss.Batch train(double[][][] emissions, int[] lengths, int[][] labels,
      Gradient gradient, ExecutorService es) {
    checkBatch(emissions, lengths, labels.length, "label");
    List<CrfLoss> rows = map(emissions.length,
        i -> loss(emissions[i], lengths[i], labels[i], gradient), es);
    return new CrfLoss.Batch(rows, normalization);
  }

  /**
   * Computes the loss of a batch given explicit per-row supervision.
   */
  public CrfLoss.Batch train(double[][][] emissions, int[] lengths, List<AllowedTags> supervision,
      Gradient gradient, ExecutorService es) {
    checkBatch(emissions, lengths, supervision.size(), "supervision");
    for (int i = 0; i < emissions.length; i++) {
      if (supervision.get(i).length() < lengths[i]) {
        throw new IllegalArgumentException("row " + i + " has length " + lengths[i]
            + " but supervision for only " + supervision.get(i).length() + " positions");
      }
    }
    List<CrfLoss> rows = map(emissions.length,
        i -> loss(emissions[i], lengths[i], supervision.get(i), gradient), es);
    return new CrfLoss.Batch(rows, normalization);
  }

  /** Best path for one row, length tags long */
  public int[] decode(double[][] emissions, int length) {
    return ViterbiDecoder.decode(emissions, length, params).getTags();
  }

  /**
   * Best path for each row. Output row i has exactly lengths[i] tags. Partial
   * supervision never applies here.
   */
  public int[][] decode(double[][][] emissions, int[] lengths, ExecutorService es) {
    checkBatch(emissions, lengths, emissions.length, "emission");
    List<int[]> paths = map(emissions.length, i -> decode(emissions[i], lengths[i]), es);
    return paths.toArray(new int[paths.size()][]);
  }

  protected static void checkBatch(double[][][] emissions, int[] lengths, int numLabelRows, String what) {
    if (emissions.length != lengths.length) {
      throw new IllegalArgumentException("batch has " + emissions.length
          + " emission rows but " + lengths.length + " lengths");
    }
    if (emissions.length != numLabelRows) {
      throw new IllegalArgumentException("batch has " + emissions.length
          + " emission rows but " + numLabelRows + " " + what + " rows");
    }
  }

  /**
   * Applies f to 0..n-1, in parallel if es != null, returning results in
   * order. Exceptions thrown by f are rethrown here.
   */
  protected static <T> List<T> map(int n, IntFunction<T> f, ExecutorService es) {
    List<T> out = new ArrayList<>(n);
    if (es == null || n <= 1) {
      for (int i = 0; i < n; i++)
        out.add(f.apply(i));
      return out;
    }
    List<Future<T>> futures = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      final int ii = i;
      futures.add(es.submit(() -> f.apply(ii)));
    }
    for (Future<T> fut : futures) {
      try {
        out.add(fut.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new RuntimeException(e);
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException)
          throw (RuntimeException) cause;
        throw new RuntimeException(cause);
      }
    }
    return out;
  }
}
