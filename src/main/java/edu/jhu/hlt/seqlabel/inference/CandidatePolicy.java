package edu.jhu.hlt.seqlabel.inference;

import java.util.Arrays;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;

/**
 * Decides which tags are admissible at a word-piece continuation, i.e. a
 * position whose gold label is {@link LabelSpace#WORD_PIECE}. Positions with
 * any other label are always singletons.
 */
public interface CandidatePolicy {

  /**
   * @param labels the gold labels of the whole row.
   * @param position a position with labels[position] == WORD_PIECE.
   * @return a non-empty set of tag ids, must not be modified by the caller.
   */
  public int[] candidates(LabelSpace space, int[] labels, int position);

  /** Every tag except the reserved ones (pad and the word-piece marker) */
  public static class AllRealTags implements CandidatePolicy {
    @Override
    public int[] candidates(LabelSpace space, int[] labels, int position) {
      return space.realTags();
    }
    @Override
    public String toString() {
      return "AllRealTags";
    }
  }

  /** A configured subset of the tags, the same at every word-piece */
  public static class Fixed implements CandidatePolicy {
    private final int[] tags;
    public Fixed(int[] tags) {
      if (tags.length == 0)
        throw new IllegalArgumentException("need at least one candidate tag");
      this.tags = Arrays.copyOf(tags, tags.length);
      Arrays.sort(this.tags);
    }
    @Override
    public int[] candidates(LabelSpace space, int[] labels, int position) {
      for (int t : tags) {
        if (!space.contains(t) || space.isReserved(t))
          throw new IllegalArgumentException("candidate tag " + t + " is not a real tag of " + space);
      }
      return tags;
    }
    @Override
    public String toString() {
      return "(Fixed " + Arrays.toString(tags) + ")";
    }
  }
}
