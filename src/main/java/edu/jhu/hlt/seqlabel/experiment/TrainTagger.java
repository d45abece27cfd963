package edu.jhu.hlt.seqlabel.experiment;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Random;

import org.apache.log4j.Logger;

import edu.jhu.hlt.seqlabel.data.LabelDictionary;
import edu.jhu.hlt.seqlabel.data.TaggedCorpusReader;
import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.datatypes.Sequence;
import edu.jhu.hlt.seqlabel.evaluation.Scorer;
import edu.jhu.hlt.seqlabel.evaluation.ScriptScorer;
import edu.jhu.hlt.seqlabel.evaluation.TagAccuracyScorer;
import edu.jhu.hlt.seqlabel.inference.CandidatePolicy;
import edu.jhu.hlt.seqlabel.inference.CrfLayer;
import edu.jhu.hlt.seqlabel.inference.Tagger;
import edu.jhu.hlt.seqlabel.inference.TransitionParams;
import edu.jhu.hlt.seqlabel.util.ExperimentProperties;

/**
 * Trains a tagger. Arguments are "key value" pairs, e.g.
 * <pre>
 *   train train.txt valid dev.txt model out/ script eval.sh wordPiece true
 * </pre>
 */
public class TrainTagger {
  public static final Logger LOG = Logger.getLogger(TrainTagger.class);

  public static CrfTrainer.Result run(ExperimentProperties config) throws IOException {
    File trainFile = config.getExistingFile("train");
    File validFile = config.getExistingFile("valid");
    File testFile = config.getFileOrNull("test");
    config.getOrMakeDir("model");

    boolean wordPiece = config.getBoolean("wordPiece", false);
    LabelDictionary labels = LabelDictionary.forTagger(wordPiece);
    TaggedCorpusReader reader = new TaggedCorpusReader(labels);
    List<Sequence> train = reader.read(trainFile);
    labels.freeze();
    LOG.info("[run] " + labels);
    List<Sequence> valid = reader.read(validFile);
    List<Sequence> test = testFile == null ? null : reader.read(testFile);

    LabelSpace space = labels.labelSpace();
    if (space.realTags().length == 0)
      throw new IllegalArgumentException("no real labels in " + trainFile.getPath());
    CandidatePolicy policy = wordPiece
        ? labels.candidatePolicy(config.getString("wordPieceCandidates", ""))
        : null;
    Random rand = new Random(config.getInt("seed", 1));
    Tagger tagger = Tagger.build(space, reader.getFeatureDimension(), policy,
        config.getEnum("lossNorm", CrfLayer.Normalization.class, CrfLayer.Normalization.SUM),
        config.getEnum("transitionInit", TransitionParams.Init.class, TransitionParams.Init.ZERO),
        config.getDouble("l2", 1e-5),
        rand);

    Scorer scorer = config.getFileOrNull("script") == null
        ? new TagAccuracyScorer()
        : new ScriptScorer(config.getExistingFile("script"));
    File goldValid = config.getFileOrNull("goldValid");
    File goldTest = config.getFileOrNull("goldTest");

    CrfTrainer.Config conf = CrfTrainer.Config.fromProperties(config);
    LOG.info("[run] configuration:\n" + config.describe());
    CrfTrainer trainer = new CrfTrainer(conf, tagger, labels, scorer, config);
    CrfTrainer.Result res = trainer.train(train,
        new CrfTrainer.EvalSet("valid", valid, goldValid == null ? validFile : goldValid),
        test == null ? null : new CrfTrainer.EvalSet("test", test, goldTest == null ? testFile : goldTest));
    LOG.info(String.format("[run] best_valid=%.6f test=%.6f", res.bestValid, res.test));
    return res;
  }

  public static void main(String[] args) throws IOException {
    run(ExperimentProperties.fromArgs(args));
  }
}
