package edu.jhu.hlt.seqlabel.experiment;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.apache.log4j.Logger;

import edu.jhu.hlt.seqlabel.data.PredictionWriter;
import edu.jhu.hlt.seqlabel.data.TaggedCorpusReader;
import edu.jhu.hlt.seqlabel.datatypes.Sequence;
import edu.jhu.hlt.seqlabel.evaluation.Scorer;
import edu.jhu.hlt.seqlabel.evaluation.ScriptScorer;
import edu.jhu.hlt.seqlabel.evaluation.TagAccuracyScorer;
import edu.jhu.hlt.seqlabel.util.ExperimentProperties;
import edu.jhu.hlt.seqlabel.util.ModelIO;

/**
 * Tags a corpus with a saved model. Keys: model (dir written by
 * {@link TrainTagger}), input, output (stdout if missing), and optionally
 * gold plus script to score the output.
 */
public class RunTagger {
  public static final Logger LOG = Logger.getLogger(RunTagger.class);

  /** Returns the score if gold was given, else NaN */
  public static double run(ExperimentProperties config) throws IOException {
    ModelIO.Saved saved = ModelIO.load(config.getFile("model"));
    File input = config.getExistingFile("input");
    File output = config.getFileOrNull("output");
    File gold = config.getFileOrNull("gold");

    TaggedCorpusReader reader = new TaggedCorpusReader(saved.labels);
    List<Sequence> data = reader.read(input);
    if (!data.isEmpty() && reader.getFeatureDimension() != saved.tagger.getProjection().featureDimension()) {
      throw new IllegalArgumentException("input has " + reader.getFeatureDimension()
          + " features per token but the model expects "
          + saved.tagger.getProjection().featureDimension());
    }

    CrfTrainer.Config conf = new CrfTrainer.Config();
    conf.batchSize = config.getInt("batchSize", saved.config.getInt("batchSize", conf.batchSize));
    conf.threads = config.getInt("threads", 1);
    CrfTrainer trainer = new CrfTrainer(conf, saved.tagger, saved.labels, null, saved.config);
    ExecutorService es = conf.threads > 1 ? Executors.newWorkStealingPool(conf.threads) : null;
    List<int[]> predictions;
    try {
      predictions = trainer.predict(data, es);
    } finally {
      if (es != null)
        es.shutdown();
    }

    PredictionWriter pw = new PredictionWriter(saved.labels);
    if (output == null) {
      BufferedWriter w = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
      pw.write(predictions, w);
      w.flush();
    } else {
      pw.write(predictions, output);
      LOG.info("[run] wrote " + predictions.size() + " predictions to " + output.getPath());
    }

    if (gold == null)
      return Double.NaN;
    if (output == null)
      throw new IllegalArgumentException("scoring against gold requires an output file");
    Scorer scorer = config.getFileOrNull("script") == null
        ? new TagAccuracyScorer()
        : new ScriptScorer(config.getExistingFile("script"));
    double score = scorer.score(gold, output);
    LOG.info(String.format("[run] score=%.6f", score));
    return score;
  }

  public static void main(String[] args) throws IOException {
    run(ExperimentProperties.fromArgs(args));
  }
}
