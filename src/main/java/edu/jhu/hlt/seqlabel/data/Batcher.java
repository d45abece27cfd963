package edu.jhu.hlt.seqlabel.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.apache.log4j.Logger;

import edu.jhu.hlt.seqlabel.datatypes.Sequence;

/**
 * Groups sequences into batches of similar length, by way of indices into the
 * full dataset. Sequences are (optionally) shuffled, then stably sorted by
 * decreasing length, then cut into consecutive batches. Since batches hold
 * the original indices, predictions can always be put back in input order.
 *
 * @author travis
 */
public class Batcher {
  public static final Logger LOG = Logger.getLogger(Batcher.class);

  private final int batchSize;
  private final boolean keepFull;

  /**
   * @param keepFull if true, a batch only ever holds sequences of one length
   * (it is cut short when the length changes).
   */
  public Batcher(int batchSize, boolean keepFull) {
    if (batchSize <= 0)
      throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
    this.batchSize = batchSize;
    this.keepFull = keepFull;
  }

  /**
   * @param rand if non-null the data is shuffled first (which only changes the
   * order among sequences of equal length).
   */
  public List<List<Integer>> batches(List<Sequence> data, Random rand) {
    List<Integer> order = new ArrayList<>(data.size());
    for (int i = 0; i < data.size(); i++)
      order.add(i);
    if (rand != null)
      Collections.shuffle(order, rand);
    order.sort(Comparator.comparingInt((Integer i) -> data.get(i).length()).reversed());

    List<List<Integer>> batches = new ArrayList<>();
    int start = 0;
    long sumLen = 0;
    while (start < order.size()) {
      int end = Math.min(start + batchSize, order.size());
      if (keepFull) {
        int len = data.get(order.get(start)).length();
        int e = start + 1;
        while (e < end && data.get(order.get(e)).length() == len)
          e++;
        end = e;
      }
      List<Integer> b = new ArrayList<>(order.subList(start, end));
      for (int i : b)
        sumLen += data.get(i).length();
      batches.add(b);
      start = end;
    }
    if (!data.isEmpty()) {
      LOG.info(String.format("[batches] %d batches, avg len: %.1f",
          batches.size(), ((double) sumLen) / data.size()));
    }
    return batches;
  }

  public static List<Sequence> select(List<Sequence> data, List<Integer> indices) {
    List<Sequence> out = new ArrayList<>(indices.size());
    for (int i : indices)
      out.add(data.get(i));
    return out;
  }
}
