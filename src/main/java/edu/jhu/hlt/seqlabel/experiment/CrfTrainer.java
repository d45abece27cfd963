package edu.jhu.hlt.seqlabel.experiment;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.log4j.Logger;

import edu.jhu.hlt.seqlabel.data.Batcher;
import edu.jhu.hlt.seqlabel.data.LabelDictionary;
import edu.jhu.hlt.seqlabel.data.PredictionWriter;
import edu.jhu.hlt.seqlabel.datatypes.Sequence;
import edu.jhu.hlt.seqlabel.evaluation.Scorer;
import edu.jhu.hlt.seqlabel.inference.CrfLayer;
import edu.jhu.hlt.seqlabel.inference.Gradient;
import edu.jhu.hlt.seqlabel.inference.Optimizer;
import edu.jhu.hlt.seqlabel.inference.Tagger;
import edu.jhu.hlt.seqlabel.util.ExperimentProperties;
import edu.jhu.hlt.seqlabel.util.LearningRateSchedule;
import edu.jhu.hlt.seqlabel.util.ModelIO;

/**
 * Trains a {@link Tagger} with mini-batch SGD or Adam. Every evalSteps batches the
 * validation set is decoded and scored; a new best score saves the model (and
 * scores the test set, if there is one).
 *
 * Rows in a batch are run in parallel when threads > 1, but the parameter
 * update only happens after every row of the batch has finished, and no row
 * of the next batch starts before the update is done.
 *
 * @author travis
 */
public class CrfTrainer {
  public static final Logger LOG = Logger.getLogger(CrfTrainer.class);

  public static class Config {
    public int threads = 1;
    public int batchSize = 32;
    public int maxEpoch = 100;
    public int evalSteps = 0;       // <= 0 means once per epoch
    public double clipGrad = 1d;    // <= 0 means no clipping
    public int logEveryTokens = 1024;
    public File modelDir;           // null means never save
    public File output;             // where validation predictions go, null for a temp file
    public Random rand = new Random(1);
    public LearningRateSchedule learningRate = new LearningRateSchedule.Constant(0.01);
    public Optimizer optimizer = new Optimizer.Sgd();

    public static Config fromProperties(ExperimentProperties config) {
      Config c = new Config();
      c.threads = config.getInt("threads", c.threads);
      c.batchSize = config.getInt("batchSize", c.batchSize);
      c.maxEpoch = config.getInt("maxEpoch", c.maxEpoch);
      c.evalSteps = config.getInt("evalSteps", c.evalSteps);
      c.clipGrad = config.getDouble("clipGrad", c.clipGrad);
      c.logEveryTokens = config.getInt("logEveryTokens", c.logEveryTokens);
      c.modelDir = config.getFileOrNull("model");
      c.output = config.getFileOrNull("output");
      c.rand = new Random(config.getInt("seed", 1));
      c.learningRate = LearningRateSchedule.fromConfig(config);
      c.optimizer = Optimizer.byName(config.getString("optimizer", "sgd"));
      return c;
    }

    @Override
    public String toString() {
      return "(Config threads=" + threads + " batchSize=" + batchSize + " maxEpoch=" + maxEpoch
          + " evalSteps=" + evalSteps + " clipGrad=" + clipGrad + " lr=" + learningRate
          + " optimizer=" + optimizer
          + " modelDir=" + modelDir + ")";
    }
  }

  /** Data to evaluate on along with the file the scorer compares against */
  public static class EvalSet {
    public final String name;
    public final List<Sequence> data;
    public final File gold;
    public EvalSet(String name, List<Sequence> data, File gold) {
      if (data.isEmpty())
        throw new IllegalArgumentException(name + " has no sequences");
      this.name = name;
      this.data = data;
      this.gold = gold;
    }
  }

  public static class Result {
    public double bestValid = Double.NEGATIVE_INFINITY;
    public double test = Double.NEGATIVE_INFINITY;
    public int steps;
    public int saves;
    @Override
    public String toString() {
      return String.format("(Result bestValid=%.6f test=%.6f steps=%d saves=%d)", bestValid, test, steps, saves);
    }
  }

  private final Config conf;
  private final Tagger tagger;
  private final LabelDictionary labels;
  private final Scorer scorer;
  private final ExperimentProperties savedConfig;

  /**
   * @param savedConfig written next to the model when it is saved.
   */
  public CrfTrainer(Config conf, Tagger tagger, LabelDictionary labels, Scorer scorer,
      ExperimentProperties savedConfig) {
    if (conf.batchSize <= 0)
      throw new IllegalArgumentException("batchSize must be positive: " + conf.batchSize);
    if (conf.threads <= 0)
      throw new IllegalArgumentException("threads must be positive: " + conf.threads);
    this.conf = conf;
    this.tagger = tagger;
    this.labels = labels;
    this.scorer = scorer;
    this.savedConfig = savedConfig;
  }

  public Config getConfig() {
    return conf;
  }

  public Tagger getTagger() {
    return tagger;
  }

  /**
   * @param test may be null.
   */
  public Result train(List<Sequence> train, EvalSet valid, EvalSet test) throws IOException {
    if (train.isEmpty())
      throw new IllegalArgumentException("no training data");
    LOG.info("[train] starting, conf=" + conf + " train.size=" + train.size());
    ExecutorService es = conf.threads > 1
        ? Executors.newWorkStealingPool(conf.threads)
        : null;
    try {
      return train(train, valid, test, es);
    } finally {
      if (es != null)
        es.shutdown();
    }
  }

  private Result train(List<Sequence> train, EvalSet valid, EvalSet test, ExecutorService es) throws IOException {
    Result res = new Result();
    List<List<Integer>> batches = new Batcher(conf.batchSize, false).batches(train, conf.rand);
    int evalSteps = conf.evalSteps <= 0 || conf.evalSteps > batches.size()
        ? batches.size()
        : conf.evalSteps;
    LOG.info("[train] " + batches.size() + " batches per epoch, evaluating every " + evalSteps + " batches");
    int logEvery = Math.max(1, conf.logEveryTokens / conf.batchSize);
    for (int epoch = 0; epoch < conf.maxEpoch; epoch++) {
      Collections.shuffle(batches, conf.rand);
      double totalLoss = 0;
      long start = System.currentTimeMillis();
      for (int cnt = 1; cnt <= batches.size(); cnt++) {
        List<Sequence> batch = Batcher.select(train, batches.get(cnt - 1));
        conf.learningRate.observe(epoch, res.steps);
        double lr = conf.learningRate.learningRate();
        double loss = step(batch, lr, es);
        totalLoss += loss;
        res.steps++;

        if (cnt % logEvery == 0) {
          double avg = perTokenLoss(loss, batch, tagger.getCrf().getNormalization());
          LOG.info(String.format("[train] epoch=%d iter=%d lr=%.6f train_avg_loss=%.6f time=%.2fs",
              epoch, cnt, lr, avg, (System.currentTimeMillis() - start) / 1000d));
          start = System.currentTimeMillis();
        }

        if (cnt % evalSteps == 0) {
          double v = evaluate(valid, es);
          LOG.info(String.format("[train] epoch=%d iter=%d lr=%.6f train_loss=%.6f valid=%.6f",
              epoch, cnt, lr, totalLoss, v));
          if (v > res.bestValid) {
            LOG.info("[train] new record: " + v + " > " + res.bestValid);
            res.bestValid = v;
            if (conf.modelDir != null) {
              ModelIO.save(conf.modelDir, tagger, labels, savedConfig);
              res.saves++;
            }
            if (test != null) {
              res.test = evaluate(test, es);
              LOG.info(String.format("[train] epoch=%d iter=%d lr=%.6f test=%.6f",
                  epoch, cnt, lr, res.test));
            }
          }
        }
      }
    }
    LOG.info("[train] done, " + res);
    return res;
  }

  /** TOKEN_MEAN losses are already per token, SUM losses are divided here */
  static double perTokenLoss(double batchLoss, List<Sequence> batch, CrfLayer.Normalization norm) {
    if (norm != CrfLayer.Normalization.SUM)
      return batchLoss;
    int tokens = 0;
    for (Sequence s : batch)
      tokens += s.length();
    return batchLoss / tokens;
  }

  /**
   * One step on a batch: losses (in parallel), gradient, clipping, then the
   * optimizer's update.
   * Returns the batch loss before the update.
   */
  double step(List<Sequence> batch, double learningRate, ExecutorService es) {
    Gradient g = tagger.newGradient();
    Tagger.Loss loss = tagger.loss(batch, g, es);
    double value = loss.forwards();
    if (Double.isNaN(value) || Double.isInfinite(value))
      throw new IllegalStateException("non-finite loss: " + value);
    loss.backwards(1);
    double norm = g.clip(conf.clipGrad);
    if (LOG.isDebugEnabled())
      LOG.debug(String.format("[step] loss=%.4f |grad|=%.4f lr=%.4g", value, norm, learningRate));
    conf.optimizer.step(tagger, g, learningRate);
    return value;
  }

  /** One best path per sequence, in input order */
  public List<int[]> predict(List<Sequence> data, ExecutorService es) {
    List<int[]> out = new ArrayList<>(Collections.nCopies(data.size(), (int[]) null));
    for (List<Integer> b : new Batcher(conf.batchSize, true).batches(data, null)) {
      List<int[]> paths = tagger.decode(Batcher.select(data, b), es);
      for (int i = 0; i < b.size(); i++)
        out.set(b.get(i), paths.get(i));
    }
    return out;
  }

  /** Decodes, writes predictions and returns the score of them */
  public double evaluate(EvalSet set, ExecutorService es) throws IOException {
    List<int[]> predictions = predict(set.data, es);
    boolean temp = conf.output == null;
    File out = temp ? File.createTempFile("seqlabel-" + set.name + "-", ".tmp") : conf.output;
    try {
      new PredictionWriter(labels).write(predictions, out);
      double score = scorer.score(set.gold, out);
      LOG.debug("[evaluate] " + set.name + " score=" + score);
      return score;
    } finally {
      if (temp && !out.delete())
        LOG.warn("[evaluate] could not delete " + out.getPath());
    }
  }
}
