package edu.jhu.hlt.seqlabel.util;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * UTF-8 readers and writers which transparently (de)compress files ending in ".gz".
 */
public final class FileUtil {

  private FileUtil() {}

  public static boolean isGzip(File f) {
    return f.getName().toLowerCase().endsWith(".gz");
  }

  public static BufferedReader getReader(File f) throws IOException {
    InputStream is = new FileInputStream(f);
    if (isGzip(f))
      is = new GZIPInputStream(is);
    return new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
  }

  public static BufferedWriter getWriter(File f) throws IOException {
    OutputStream os = new FileOutputStream(f);
    if (isGzip(f))
      os = new GZIPOutputStream(os);
    return new BufferedWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8));
  }
}
