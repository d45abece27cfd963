package edu.jhu.hlt.seqlabel.data;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

import edu.jhu.hlt.seqlabel.util.FileUtil;

/**
 * Writes decoded tags: one tag string per line, a blank line after every
 * sequence, sequences in input order.
 */
public class PredictionWriter {

  private final LabelDictionary labels;

  public PredictionWriter(LabelDictionary labels) {
    this.labels = labels;
  }

  /**
   * @param predictions indexed by position in the input, i.e. predictions[i]
   * is the path for the i-th input sequence regardless of how it was batched.
   */
  public void write(List<int[]> predictions, Writer w) throws IOException {
    for (int i = 0; i < predictions.size(); i++) {
      int[] path = predictions.get(i);
      if (path == null)
        throw new IllegalArgumentException("no prediction for sequence " + i);
      for (int tag : path) {
        w.write(labels.lookupLabel(tag));
        w.write('\n');
      }
      w.write('\n');
    }
  }

  public void write(List<int[]> predictions, File f) throws IOException {
    try (BufferedWriter w = FileUtil.getWriter(f)) {
      write(predictions, w);
    }
  }
}
