package edu.jhu.hlt.seqlabel.inference;

import java.util.Arrays;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;

/**
 * Says which tags a lattice may use at each position. The forward algorithm
 * and Viterbi are written once against this: the unconstrained lattice allows
 * every tag, full supervision allows a singleton per position, and partial
 * supervision allows a candidate set.
 *
 * @author travis
 */
public interface AllowedTags {

  /** How many positions this covers (the padded length of the row) */
  public int length();

  /**
   * Non-empty, strictly increasing tag ids allowed at position t.
   * Callers must not modify the returned array.
   */
  public int[] at(int t);

  /** Every tag in the label space, at every position */
  public static AllowedTags unconstrained(LabelSpace space, int length) {
    return new Unconstrained(space, length);
  }

  /** Exactly labels[t] at position t */
  public static AllowedTags gold(int[] labels) {
    return new Gold(labels);
  }

  /** candidates[t] at position t. Arrays are copied, sorted, and checked. */
  public static AllowedTags candidates(int[][] candidates) {
    return new Candidates(candidates);
  }

  public static class Unconstrained implements AllowedTags {
    private final int[] tags;
    private final int length;
    public Unconstrained(LabelSpace space, int length) {
      this.tags = space.allTags();
      this.length = length;
    }
    @Override
    public int length() {
      return length;
    }
    @Override
    public int[] at(int t) {
      return tags;
    }
    @Override
    public String toString() {
      return "(Unconstrained " + tags.length + " tags)";
    }
  }

  public static class Gold implements AllowedTags {
    private final int[][] singletons;
    public Gold(int[] labels) {
      singletons = new int[labels.length][];
      for (int t = 0; t < labels.length; t++)
        singletons[t] = new int[] {labels[t]};
    }
    @Override
    public int length() {
      return singletons.length;
    }
    @Override
    public int[] at(int t) {
      return singletons[t];
    }
    @Override
    public String toString() {
      return "(Gold " + Arrays.deepToString(singletons) + ")";
    }
  }

  public static class Candidates implements AllowedTags {
    private final int[][] sets;
    public Candidates(int[][] candidates) {
      sets = new int[candidates.length][];
      for (int t = 0; t < candidates.length; t++) {
        if (candidates[t] == null || candidates[t].length == 0)
          throw new IllegalArgumentException("empty candidate set at position " + t);
        int[] c = Arrays.copyOf(candidates[t], candidates[t].length);
        Arrays.sort(c);
        for (int i = 1; i < c.length; i++) {
          if (c[i] == c[i - 1]) {
            throw new IllegalArgumentException("duplicate tag " + c[i]
                + " in candidate set at position " + t);
          }
        }
        sets[t] = c;
      }
    }
    @Override
    public int length() {
      return sets.length;
    }
    @Override
    public int[] at(int t) {
      return sets[t];
    }
    @Override
    public String toString() {
      return "(Candidates " + Arrays.deepToString(sets) + ")";
    }
  }
}
