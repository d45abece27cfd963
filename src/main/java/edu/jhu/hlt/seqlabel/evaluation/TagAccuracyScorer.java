package edu.jhu.hlt.seqlabel.evaluation;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Splitter;

import edu.jhu.hlt.seqlabel.data.LabelDictionary;
import edu.jhu.hlt.seqlabel.util.FileUtil;

/**
 * Token accuracy, used when no evaluation script is configured. The gold file
 * may be a tagged corpus (the label is the first tab separated column) or a
 * predictions style file. Tokens whose gold label is the word-piece marker are
 * not counted.
 */
public class TagAccuracyScorer implements Scorer {
  public static final Logger LOG = Logger.getLogger(TagAccuracyScorer.class);

  private static final Splitter TAB = Splitter.on('\t');

  @Override
  public double score(File gold, File predicted) throws IOException {
    List<String> g = readTags(gold);
    List<String> p = readTags(predicted);
    if (g.size() != p.size()) {
      throw new IllegalArgumentException("gold has " + g.size() + " tokens but predictions have "
          + p.size() + ": " + gold.getPath() + " " + predicted.getPath());
    }
    int correct = 0, total = 0;
    for (int i = 0; i < g.size(); i++) {
      if (LabelDictionary.WORD_PIECE.equals(g.get(i)))
        continue;
      total++;
      if (g.get(i).equals(p.get(i)))
        correct++;
    }
    if (total == 0) {
      LOG.warn("[score] no tokens to score in " + gold.getPath());
      return 0;
    }
    return ((double) correct) / total;
  }

  /** First column of every non-blank line */
  static List<String> readTags(File f) throws IOException {
    List<String> tags = new ArrayList<>();
    try (BufferedReader r = FileUtil.getReader(f)) {
      for (String line = r.readLine(); line != null; line = r.readLine()) {
        if (line.trim().isEmpty())
          continue;
        tags.add(TAB.split(line).iterator().next().trim());
      }
    }
    return tags;
  }
}
