package edu.jhu.hlt.seqlabel.evaluation;

import java.io.File;
import java.io.IOException;

/**
 * Scores a predictions file (one tag per line, blank line between sequences)
 * against a gold file. Higher is better.
 */
public interface Scorer {

  public double score(File gold, File predicted) throws IOException;
}
