package edu.jhu.hlt.seqlabel.util;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.Random;

import org.apache.log4j.Logger;

import edu.jhu.hlt.seqlabel.data.LabelDictionary;
import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.inference.CandidatePolicy;
import edu.jhu.hlt.seqlabel.inference.CrfLayer;
import edu.jhu.hlt.seqlabel.inference.Tagger;
import edu.jhu.hlt.seqlabel.inference.TransitionParams;

/**
 * Saving and loading taggers. A model directory holds:
 * <ul>
 * <li>model.bin: header + transition matrix + projection, as raw doubles
 * (so a load gives back exactly the values that were saved)</li>
 * <li>label.dic: the label dictionary, "label TAB id" per line</li>
 * <li>config.properties: the configuration the model was trained with</li>
 * </ul>
 *
 * @author travis
 */
public class ModelIO {
  public static final Logger LOG = Logger.getLogger(ModelIO.class);

  public static final String MODEL_FILE = "model.bin";
  public static final String LABEL_FILE = "label.dic";
  public static final String CONFIG_FILE = "config.properties";

  private static final int MAGIC = 0x5e91abe1;
  private static final int FORMAT = 1;

  /** A tagger together with what is needed to map its tag ids to strings */
  public static class Saved {
    public final Tagger tagger;
    public final LabelDictionary labels;
    public final ExperimentProperties config;
    public Saved(Tagger tagger, LabelDictionary labels, ExperimentProperties config) {
      this.tagger = tagger;
      this.labels = labels;
      this.config = config;
    }
  }

  public static void save(File modelDir, Tagger tagger, LabelDictionary labels,
      ExperimentProperties config) throws IOException {
    if (!modelDir.isDirectory() && !modelDir.mkdirs())
      throw new IOException("could not create model dir: " + modelDir.getPath());
    File mf = new File(modelDir, MODEL_FILE);
    LOG.info("[save] writing model to " + modelDir.getPath());
    try (DataOutputStream dos = new DataOutputStream(
        new BufferedOutputStream(new FileOutputStream(mf)))) {
      writeBinary(tagger, dos);
    }
    labels.write(new File(modelDir, LABEL_FILE));
    try (Writer w = FileUtil.getWriter(new File(modelDir, CONFIG_FILE))) {
      config.store(w, "seqlabel tagger configuration");
    }
  }

  public static Saved load(File modelDir) throws IOException {
    LOG.info("[load] reading model from " + modelDir.getPath());
    if (!modelDir.isDirectory())
      throw new IllegalArgumentException(modelDir.getPath() + " is not a directory");
    ExperimentProperties config = new ExperimentProperties();
    try (Reader r = FileUtil.getReader(new File(modelDir, CONFIG_FILE))) {
      config.load(r);
    }
    LabelDictionary labels = LabelDictionary.read(new File(modelDir, LABEL_FILE));
    labels.freeze();
    Tagger tagger;
    try (DataInputStream dis = new DataInputStream(
        new BufferedInputStream(new FileInputStream(new File(modelDir, MODEL_FILE))))) {
      tagger = readBinary(dis, labels, config);
    }
    return new Saved(tagger, labels, config);
  }

  public static void writeBinary(Tagger tagger, DataOutputStream dos) throws IOException {
    LabelSpace space = tagger.getLabelSpace();
    dos.writeInt(MAGIC);
    dos.writeInt(FORMAT);
    dos.writeInt(space.numTags());
    dos.writeBoolean(space.isReserved(LabelSpace.WORD_PIECE));
    dos.writeInt(tagger.getProjection().featureDimension());
    dos.writeUTF(tagger.getCrf().getNormalization().name());
    tagger.serialize(dos);
  }

  /**
   * Reads what {@link #writeBinary} wrote. The candidate policy for
   * word-pieces comes from the config, since it refers to labels by name.
   */
  public static Tagger readBinary(DataInputStream dis, LabelDictionary labels,
      ExperimentProperties config) throws IOException {
    if (dis.readInt() != MAGIC)
      throw new IOException("not a seqlabel model file");
    int format = dis.readInt();
    if (format != FORMAT)
      throw new IOException("unsupported model format: " + format);
    int numTags = dis.readInt();
    boolean wordPiece = dis.readBoolean();
    int featureDimension = dis.readInt();
    CrfLayer.Normalization norm = CrfLayer.Normalization.valueOf(dis.readUTF());
    if (numTags != labels.size()) {
      throw new IOException("model has " + numTags + " tags but the label dictionary has "
          + labels.size());
    }
    LabelSpace space = LabelSpace.forTagger(numTags, wordPiece);
    CandidatePolicy policy = wordPiece ? labels.candidatePolicy(config.getString("wordPieceCandidates", "")) : null;
    Tagger t = Tagger.build(space, featureDimension, policy, norm,
        TransitionParams.Init.ZERO, 0d, new Random(0));
    t.deserialize(dis);
    return t;
  }

  public static double[][] readTensor2(DataInputStream dis) throws IOException {
    int rows = dis.readInt();
    int cols = dis.readInt();
    if (rows < 0 || cols < 0)
      throw new IOException("bad tensor shape: " + rows + "x" + cols);
    double[][] t2 = new double[rows][cols];
    for (int i = 0; i < rows; i++)
      for (int j = 0; j < cols; j++)
        t2[i][j] = dis.readDouble();
    return t2;
  }

  public static double[] readTensor1(DataInputStream dis) throws IOException {
    int n = dis.readInt();
    if (n < 0)
      throw new IOException("bad tensor length: " + n);
    double[] t1 = new double[n];
    for (int i = 0; i < n; i++)
      t1[i] = dis.readDouble();
    return t1;
  }

  /** Rows must all be the same length */
  public static void writeTensor2(double[][] t2, DataOutputStream dos) throws IOException {
    int rows = t2.length;
    int cols = rows == 0 ? 0 : t2[0].length;
    dos.writeInt(rows);
    dos.writeInt(cols);
    for (int i = 0; i < rows; i++) {
      if (t2[i].length != cols)
        throw new IllegalArgumentException("ragged tensor: row " + i + " has " + t2[i].length + " != " + cols);
      for (int j = 0; j < cols; j++)
        dos.writeDouble(t2[i][j]);
    }
  }

  public static void writeTensor1(double[] t1, DataOutputStream dos) throws IOException {
    dos.writeInt(t1.length);
    for (double d : t1)
      dos.writeDouble(d);
  }
}
