package edu.jhu.hlt.seqlabel.data;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Splitter;
import com.google.common.collect.BiMap;
import com.google.common.collect.HashBiMap;
import com.google.common.primitives.Ints;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.inference.CandidatePolicy;
import edu.jhu.hlt.seqlabel.util.FileUtil;

/**
 * Maps label strings to dense tag ids. Id 0 is always {@link #PAD} and, when
 * word-pieces are considered, id 1 is {@link #WORD_PIECE}. New labels get the
 * next id while the dictionary is growing (built from training data); once
 * frozen, unknown labels map to the out-of-vocabulary id (the pad id).
 *
 * Stored on disk as "label TAB id" lines.
 *
 * @author travis
 */
public class LabelDictionary {
  public static final Logger LOG = Logger.getLogger(LabelDictionary.class);

  public static final String PAD = "<pad>";
  public static final String WORD_PIECE = "-word-piece-";

  private final BiMap<String, Integer> label2id;
  private final int oovId;
  private boolean growing;
  private int numOov;

  private LabelDictionary() {
    this.label2id = HashBiMap.create();
    this.oovId = LabelSpace.PAD;
    this.growing = true;
  }

  public static LabelDictionary forTagger(boolean wordPiece) {
    LabelDictionary d = new LabelDictionary();
    d.label2id.put(PAD, LabelSpace.PAD);
    if (wordPiece)
      d.label2id.put(WORD_PIECE, LabelSpace.WORD_PIECE);
    return d;
  }

  /**
   * Returns the id of label, adding it if this dictionary is growing. A
   * frozen dictionary returns {@link #oovId()} for labels it hasn't seen.
   */
  public int lookupIndex(String label) {
    Integer id = label2id.get(label);
    if (id != null)
      return id;
    if (growing) {
      int i = label2id.size();
      label2id.put(label, i);
      return i;
    }
    numOov++;
    if (numOov <= 10 || Integer.bitCount(numOov) == 1)
      LOG.warn("[lookupIndex] unknown label \"" + label + "\" mapped to " + oovId + ", numOov=" + numOov);
    return oovId;
  }

  public String lookupLabel(int id) {
    String l = label2id.inverse().get(id);
    if (l == null)
      throw new IllegalArgumentException("no label has id " + id);
    return l;
  }

  public boolean contains(String label) {
    return label2id.containsKey(label);
  }

  public int size() {
    return label2id.size();
  }

  public int oovId() {
    return oovId;
  }

  /** How many lookups of unknown labels there have been since freezing */
  public int numOov() {
    return numOov;
  }

  public boolean hasWordPiece() {
    Integer id = label2id.get(WORD_PIECE);
    return id != null && id == LabelSpace.WORD_PIECE;
  }

  public boolean isGrowing() {
    return growing;
  }

  public void freeze() {
    growing = false;
  }

  public LabelSpace labelSpace() {
    return LabelSpace.forTagger(size(), hasWordPiece());
  }

  /**
   * @param candidateLabels comma separated label names allowed at word-piece
   * positions, or empty for every real tag.
   */
  public CandidatePolicy candidatePolicy(String candidateLabels) {
    if (candidateLabels == null || candidateLabels.trim().isEmpty())
      return new CandidatePolicy.AllRealTags();
    List<Integer> ids = new ArrayList<>();
    for (String l : Splitter.on(',').trimResults().omitEmptyStrings().split(candidateLabels)) {
      Integer id = label2id.get(l);
      if (id == null)
        throw new IllegalArgumentException("word-piece candidate \"" + l + "\" is not a known label");
      if (id == LabelSpace.PAD || (hasWordPiece() && id == LabelSpace.WORD_PIECE))
        throw new IllegalArgumentException("word-piece candidate \"" + l + "\" is reserved");
      ids.add(id);
    }
    return new CandidatePolicy.Fixed(Ints.toArray(ids));
  }

  public void write(File f) throws IOException {
    try (BufferedWriter w = FileUtil.getWriter(f)) {
      for (int i = 0; i < size(); i++) {
        String l = lookupLabel(i);
        if (l.indexOf('\t') >= 0 || l.indexOf('\n') >= 0)
          throw new IllegalArgumentException("label contains a delimiter: \"" + l + "\"");
        w.write(l);
        w.write('\t');
        w.write(String.valueOf(i));
        w.newLine();
      }
    }
    LOG.info("[write] wrote " + size() + " labels to " + f.getPath());
  }

  /**
   * Reads a dictionary written by {@link #write(File)}. The result is growing;
   * call {@link #freeze()} before using it on test data.
   */
  public static LabelDictionary read(File f) throws IOException {
    LabelDictionary d = new LabelDictionary();
    int lineNo = 0;
    try (BufferedReader r = FileUtil.getReader(f)) {
      for (String line = r.readLine(); line != null; line = r.readLine()) {
        lineNo++;
        if (line.isEmpty())
          continue;
        int tab = line.lastIndexOf('\t');
        if (tab <= 0)
          throw new IOException(f.getPath() + ":" + lineNo + " is not \"label TAB id\": " + line);
        String label = line.substring(0, tab);
        int id;
        try {
          id = Integer.parseInt(line.substring(tab + 1).trim());
        } catch (NumberFormatException e) {
          throw new IOException(f.getPath() + ":" + lineNo + " has a bad id: " + line, e);
        }
        if (d.label2id.containsKey(label) || d.label2id.containsValue(id))
          throw new IOException(f.getPath() + ":" + lineNo + " duplicates a label or id: " + line);
        d.label2id.put(label, id);
      }
    }
    for (int i = 0; i < d.size(); i++)
      if (!d.label2id.containsValue(i))
        throw new IOException(f.getPath() + " is missing id " + i);
    if (!PAD.equals(d.label2id.inverse().get(LabelSpace.PAD)))
      throw new IOException(f.getPath() + " must map " + PAD + " to " + LabelSpace.PAD);
    LOG.info("[read] read " + d.size() + " labels from " + f.getPath());
    return d;
  }

  @Override
  public String toString() {
    return "(LabelDictionary size=" + size() + " growing=" + growing + " wordPiece=" + hasWordPiece() + ")";
  }
}
