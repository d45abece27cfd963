package edu.jhu.hlt.seqlabel.inference;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;

import org.apache.log4j.Logger;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.datatypes.Sequence;

/**
 * A sequence tagger: encoder features -> {@link EmissionProjection} ->
 * {@link CrfLayer} (or {@link PartialCrfLayer} when word-pieces are
 * considered). Owns the learned parameters, which only change in
 * {@link #apply(Gradient, double)}.
 *
 * @author travis
 */
public class Tagger {
  public static final Logger LOG = Logger.getLogger(Tagger.class);

  private final LabelSpace space;
  private final TransitionParams transitions;
  private final EmissionProjection projection;
  private final CrfLayer crf;
  private double l2;

  public Tagger(TransitionParams transitions, EmissionProjection projection, CrfLayer crf, double l2) {
    if (crf.getParams() != transitions)
      throw new IllegalArgumentException("the crf layer must use these transitions");
    if (projection.numTags() != transitions.getLabelSpace().numTags()) {
      throw new IllegalArgumentException("projection produces " + projection.numTags()
          + " tag scores but the label space has " + transitions.getLabelSpace().numTags());
    }
    this.space = transitions.getLabelSpace();
    this.transitions = transitions;
    this.projection = projection;
    this.crf = crf;
    this.l2 = l2;
  }

  /**
   * A freshly initialized tagger.
   * @param policy null for full supervision, else the word-piece candidate policy
   * (the label space must reserve {@link LabelSpace#WORD_PIECE}).
   */
  public static Tagger build(LabelSpace space, int featureDimension, CandidatePolicy policy,
      CrfLayer.Normalization normalization, TransitionParams.Init init, double l2, Random rand) {
    TransitionParams tp = TransitionParams.init(space, init, rand);
    EmissionProjection proj = new EmissionProjection(space.numTags(), featureDimension);
    proj.initRandom(rand);
    CrfLayer crf = policy == null
        ? new CrfLayer(tp, normalization)
        : new PartialCrfLayer(tp, normalization, policy);
    LOG.info("[build] " + crf.getClass().getSimpleName() + " over " + space
        + " featureDimension=" + featureDimension + " l2=" + l2);
    return new Tagger(tp, proj, crf, l2);
  }

  public LabelSpace getLabelSpace() {
    return space;
  }

  public TransitionParams getTransitions() {
    return transitions;
  }

  public EmissionProjection getProjection() {
    return projection;
  }

  public CrfLayer getCrf() {
    return crf;
  }

  public double getL2() {
    return l2;
  }

  public void setL2(double l2) {
    this.l2 = l2;
  }

  public Gradient newGradient() {
    return new Gradient(space.numTransitionStates(), space.numTags(), projection.featureDimension());
  }

  public double[][] emissions(Sequence s) {
    return projection.forward(s.getFeatures());
  }

  /**
   * Loss of a batch of labelled sequences (CRF loss plus the L2 penalty on
   * the projection weights). Run it backwards to fill the gradient, then
   * call {@link #apply(Gradient, double)}.
   */
  public Loss loss(List<Sequence> batch, Gradient gradient, ExecutorService es) {
    int n = batch.size();
    double[][][] emissions = new double[n][][];
    int[] lengths = new int[n];
    int[][] labels = new int[n][];
    for (int i = 0; i < n; i++) {
      Sequence s = batch.get(i);
      emissions[i] = emissions(s);
      lengths[i] = s.length();
      labels[i] = s.getLabels();
    }
    CrfLoss.Batch crfLoss = crf.train(emissions, lengths, labels, gradient, es);
    return new Loss(batch, crfLoss, gradient);
  }

  /** One best tag sequence per input, in input order */
  public List<int[]> decode(List<Sequence> batch, ExecutorService es) {
    int n = batch.size();
    double[][][] emissions = new double[n][][];
    int[] lengths = new int[n];
    for (int i = 0; i < n; i++) {
      emissions[i] = emissions(batch.get(i));
      lengths[i] = batch.get(i).length();
    }
    int[][] paths = crf.decode(emissions, lengths, es);
    List<int[]> out = new ArrayList<>(n);
    for (int[] p : paths)
      out.add(p);
    return out;
  }

  /** Takes a gradient step. Must not overlap with any loss or decode call. */
  public void apply(Gradient g, double learningRate) {
    transitions.update(g.getTransitions(), learningRate);
    projection.update(g.getWeights(), g.getBias(), learningRate);
  }

  public void serialize(DataOutputStream dos) throws IOException {
    transitions.serialize(dos);
    projection.serialize(dos);
    dos.writeDouble(l2);
  }

  public void deserialize(DataInputStream dis) throws IOException {
    transitions.deserialize(dis);
    projection.deserialize(dis);
    l2 = dis.readDouble();
    if (projection.numTags() != space.numTags())
      throw new IOException("projection has " + projection.numTags() + " tags, label space has " + space.numTags());
  }

  /**
   * The batch loss: crf + l2 * ||W||_2.
   */
  public class Loss implements Adjoints {
    private final List<Sequence> batch;
    private final CrfLoss.Batch crfLoss;
    private final Gradient gradient;
    private final double penalty;

    Loss(List<Sequence> batch, CrfLoss.Batch crfLoss, Gradient gradient) {
      this.batch = batch;
      this.crfLoss = crfLoss;
      this.gradient = gradient;
      this.penalty = l2 * projection.l2Norm();
    }

    public CrfLoss.Batch getCrfLoss() {
      return crfLoss;
    }

    public int numTokens() {
      return crfLoss.numTokens();
    }

    @Override
    public double forwards() {
      return crfLoss.forwards() + penalty;
    }

    @Override
    public void backwards(double dErr_dForwards) {
      crfLoss.backwards(dErr_dForwards);
      int C = space.numTags();
      int H = projection.featureDimension();
      double[][] dW = new double[C][H];
      double[] db = new double[C];
      List<CrfLoss> rows = crfLoss.getRows();
      for (int i = 0; i < rows.size(); i++) {
        double[][] dE = rows.get(i).getEmissionGradient();
        projection.backward(batch.get(i).getFeatures(), dE, dW, db);
      }
      projection.addL2Gradient(dErr_dForwards * l2, dW);
      gradient.addWeights(dW, db, 1d);
    }
  }
}
