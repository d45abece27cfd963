package edu.jhu.hlt.seqlabel.datatypes;

import java.util.Arrays;

/**
 * One input sentence: the words, the per-position feature vectors produced by
 * the (external) encoder, and optionally the gold tag ids.
 *
 * Positions are [0, length()), there is no padding inside a Sequence. Labels
 * may contain {@link LabelSpace#WORD_PIECE} at word-piece continuations.
 */
public class Sequence {

  private final String id;
  private final String[] words;
  private final double[][] features;
  private final int[] labels;   // may be null

  public Sequence(String id, String[] words, double[][] features, int[] labels) {
    if (words == null || features == null)
      throw new IllegalArgumentException();
    if (words.length == 0)
      throw new IllegalArgumentException("empty sequence: " + id);
    if (words.length != features.length) {
      throw new IllegalArgumentException(id + " has " + words.length
          + " words but " + features.length + " feature vectors");
    }
    if (labels != null && labels.length != words.length) {
      throw new IllegalArgumentException(id + " has " + words.length
          + " words but " + labels.length + " labels");
    }
    int dim = features[0].length;
    for (int i = 1; i < features.length; i++) {
      if (features[i].length != dim) {
        throw new IllegalArgumentException(id + " feature width changes at position "
            + i + ": " + features[i].length + " vs " + dim);
      }
    }
    this.id = id;
    this.words = words;
    this.features = features;
    this.labels = labels;
  }

  public String getId() {
    return id;
  }

  public int length() {
    return words.length;
  }

  public String getWord(int i) {
    return words[i];
  }

  public int featureDimension() {
    return features[0].length;
  }

  public double[][] getFeatures() {
    return features;
  }

  public boolean hasLabels() {
    return labels != null;
  }

  public int[] getLabels() {
    if (labels == null)
      throw new IllegalStateException(id + " has no labels");
    return labels;
  }

  @Override
  public String toString() {
    return "(Sequence " + id + " " + Arrays.toString(words)
        + (labels == null ? "" : " " + Arrays.toString(labels)) + ")";
  }
}
