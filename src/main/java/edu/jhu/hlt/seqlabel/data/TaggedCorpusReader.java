package edu.jhu.hlt.seqlabel.data;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Splitter;

import edu.jhu.hlt.seqlabel.datatypes.Sequence;
import edu.jhu.hlt.seqlabel.util.FileUtil;

/**
 * Reads sentences with encoder features. Sentences are separated by blank
 * lines, and each token is one line:
 * <pre>
 *   label TAB word TAB f1 f2 ... fH
 * </pre>
 * where the features are the encoder's output for that token. Every token in
 * a file must have the same number of features.
 *
 * @author travis
 */
public class TaggedCorpusReader {
  public static final Logger LOG = Logger.getLogger(TaggedCorpusReader.class);

  private static final Splitter TAB = Splitter.on('\t');
  private static final Splitter SPACE = Splitter.on(' ').omitEmptyStrings();

  private final LabelDictionary labels;
  private int featureDimension = -1;

  /**
   * @param labels is grown with new labels if it is growing, otherwise unknown
   * labels become the OOV id.
   */
  public TaggedCorpusReader(LabelDictionary labels) {
    this.labels = labels;
  }

  /** The feature width seen so far, or -1 if nothing has been read */
  public int getFeatureDimension() {
    return featureDimension;
  }

  public List<Sequence> read(File f) throws IOException {
    List<Sequence> out = new ArrayList<>();
    List<String> words = new ArrayList<>();
    List<Integer> tags = new ArrayList<>();
    List<double[]> feats = new ArrayList<>();
    int lineNo = 0;
    try (BufferedReader r = FileUtil.getReader(f)) {
      for (String line = r.readLine(); line != null; line = r.readLine()) {
        lineNo++;
        if (line.trim().isEmpty()) {
          if (!words.isEmpty()) {
            out.add(build(f, out.size(), words, tags, feats));
            words.clear();
            tags.clear();
            feats.clear();
          }
          continue;
        }
        List<String> cols = TAB.splitToList(line);
        if (cols.size() != 3)
          throw new IOException(f.getPath() + ":" + lineNo + " needs 3 tab separated columns, has " + cols.size());
        tags.add(labels.lookupIndex(cols.get(0)));
        words.add(cols.get(1));
        feats.add(parseFeatures(cols.get(2), f, lineNo));
      }
    }
    if (!words.isEmpty())
      out.add(build(f, out.size(), words, tags, feats));
    int tokens = 0;
    for (Sequence s : out)
      tokens += s.length();
    LOG.info("[read] " + out.size() + " sequences, " + tokens + " tokens, featureDimension="
        + featureDimension + " from " + f.getPath());
    return out;
  }

  private double[] parseFeatures(String s, File f, int lineNo) throws IOException {
    List<String> toks = SPACE.splitToList(s);
    if (toks.isEmpty())
      throw new IOException(f.getPath() + ":" + lineNo + " has no features");
    if (featureDimension < 0)
      featureDimension = toks.size();
    if (toks.size() != featureDimension) {
      throw new IOException(f.getPath() + ":" + lineNo + " has " + toks.size()
          + " features, expected " + featureDimension);
    }
    double[] x = new double[toks.size()];
    for (int i = 0; i < x.length; i++) {
      try {
        x[i] = Double.parseDouble(toks.get(i));
      } catch (NumberFormatException e) {
        throw new IOException(f.getPath() + ":" + lineNo + " has a bad feature: " + toks.get(i), e);
      }
    }
    return x;
  }

  private static Sequence build(File f, int index, List<String> words, List<Integer> tags, List<double[]> feats) {
    int n = words.size();
    int[] t = new int[n];
    for (int i = 0; i < n; i++)
      t[i] = tags.get(i);
    return new Sequence(f.getName() + ":" + index,
        words.toArray(new String[n]),
        feats.toArray(new double[n][]),
        t);
  }
}
