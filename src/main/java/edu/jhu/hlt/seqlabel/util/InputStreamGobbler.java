package edu.jhu.hlt.seqlabel.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Drains a child process's output on its own thread so the child never blocks
 * on a full pipe. Call {@link #join()} before {@link #getLines()}.
 */
public class InputStreamGobbler extends Thread {
  private final InputStream is;
  private final List<String> lines;
  private volatile IOException error;

  public InputStreamGobbler(InputStream is) {
    this.is = is;
    this.lines = Collections.synchronizedList(new ArrayList<>());
    setDaemon(true);
  }

  @Override
  public void run() {
    try (BufferedReader r = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
      for (String line = r.readLine(); line != null; line = r.readLine())
        lines.add(line);
    } catch (IOException e) {
      error = e;
    }
  }

  public List<String> getLines() {
    if (error != null)
      throw new UncheckedIOException(error);
    synchronized (lines) {
      return new ArrayList<>(lines);
    }
  }
}
