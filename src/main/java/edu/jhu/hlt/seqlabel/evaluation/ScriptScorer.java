package edu.jhu.hlt.seqlabel.evaluation;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;

import edu.jhu.hlt.seqlabel.util.InputStreamGobbler;

/**
 * Calls an external evaluation program as {@code script gold predicted} and
 * takes the score to be the last whitespace separated token on the last
 * non-empty line it prints.
 *
 * @author travis
 */
public class ScriptScorer implements Scorer {
  public static final Logger LOG = Logger.getLogger(ScriptScorer.class);

  private final File script;

  public ScriptScorer(File script) {
    if (!script.isFile())
      throw new IllegalArgumentException("not a file: " + script.getPath());
    this.script = script;
  }

  public File getScript() {
    return script;
  }

  @Override
  public double score(File gold, File predicted) throws IOException {
    String[] command = new String[] {
        script.getPath(),
        gold.getPath(),
        predicted.getPath(),
    };
    ProcessBuilder pb = new ProcessBuilder(command);
    Process p = pb.start();
    InputStreamGobbler stdout = new InputStreamGobbler(p.getInputStream());
    InputStreamGobbler stderr = new InputStreamGobbler(p.getErrorStream());
    stdout.start();
    stderr.start();
    int r;
    try {
      r = p.waitFor();
      stdout.join();
      stderr.join();
    } catch (InterruptedException e) {
      p.destroy();
      Thread.currentThread().interrupt();
      throw new IOException("interrupted while running " + script.getPath(), e);
    }
    if (r != 0) {
      throw new RuntimeException("exit value " + r + " from " + Joiner.on(' ').join(command)
          + "\n" + Joiner.on('\n').join(stderr.getLines()));
    }
    double score = parseScore(stdout.getLines());
    LOG.debug("[score] " + predicted.getPath() + " => " + score);
    return score;
  }

  static double parseScore(List<String> lines) {
    for (int i = lines.size() - 1; i >= 0; i--) {
      List<String> toks = Splitter.onPattern("\\s+").omitEmptyStrings().splitToList(lines.get(i));
      if (toks.isEmpty())
        continue;
      String last = toks.get(toks.size() - 1);
      try {
        return Double.parseDouble(last);
      } catch (NumberFormatException e) {
        throw new RuntimeException("eval script did not end with a number: " + lines.get(i), e);
      }
    }
    throw new RuntimeException("eval script printed nothing");
  }

  @Override
  public String toString() {
    return "(ScriptScorer " + script.getPath() + ")";
  }
}
