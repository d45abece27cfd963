package edu.jhu.hlt.seqlabel.datatypes;

import java.io.Serializable;
import java.util.Arrays;

/**
 * The integer tag ids [0, C) a tagger chooses from, plus the two virtual
 * boundary tags START = C and END = C+1 which only exist as rows/columns of
 * the transition matrix.
 *
 * Some tags may be reserved (the padding tag, and the word-piece marker when
 * word-pieces are considered). Reserved tags are part of the label space (they
 * have emission scores) but every transition into or out of them is
 * forbidden, so no path through them is ever scored or decoded.
 *
 * @author travis
 */
public final class LabelSpace implements Serializable {
  private static final long serialVersionUID = 1L;

  public static final int PAD = 0;
  public static final int WORD_PIECE = 1;

  private final int numTags;
  private final boolean[] reserved;
  private final int[] allTags;
  private final int[] realTags;

  public LabelSpace(int numTags, int... reservedTags) {
    if (numTags <= 0)
      throw new IllegalArgumentException("numTags must be positive: " + numTags);
    this.numTags = numTags;
    this.reserved = new boolean[numTags];
    for (int r : reservedTags) {
      if (r < 0 || r >= numTags)
        throw new IllegalArgumentException("reserved tag out of range: " + r);
      reserved[r] = true;
    }
    this.allTags = new int[numTags];
    int nReal = 0;
    for (int i = 0; i < numTags; i++) {
      allTags[i] = i;
      if (!reserved[i])
        nReal++;
    }
    if (nReal == 0)
      throw new IllegalArgumentException("every tag is reserved");
    this.realTags = new int[nReal];
    for (int i = 0, j = 0; i < numTags; i++)
      if (!reserved[i])
        realTags[j++] = i;
  }

  /** A label space with no reserved tags */
  public static LabelSpace plain(int numTags) {
    return new LabelSpace(numTags);
  }

  /**
   * The layout used by label dictionaries: {@link #PAD} is always reserved,
   * and {@link #WORD_PIECE} is too if wordPiece is true.
   */
  public static LabelSpace forTagger(int numTags, boolean wordPiece) {
    return wordPiece
        ? new LabelSpace(numTags, PAD, WORD_PIECE)
        : new LabelSpace(numTags, PAD);
  }

  /** C, the number of tags which have emission scores (includes reserved ones) */
  public int numTags() {
    return numTags;
  }

  /** C + 2, the width of the transition matrix */
  public int numTransitionStates() {
    return numTags + 2;
  }

  public int start() {
    return numTags;
  }

  public int end() {
    return numTags + 1;
  }

  public boolean isReserved(int tag) {
    return tag >= 0 && tag < numTags && reserved[tag];
  }

  public boolean contains(int tag) {
    return tag >= 0 && tag < numTags;
  }

  /** Every tag id in [0, C), in increasing order. Do not modify. */
  public int[] allTags() {
    return allTags;
  }

  /** Every tag id which is not reserved, in increasing order. Do not modify. */
  public int[] realTags() {
    return realTags;
  }

  /**
   * Whether a transition between two transition states may ever be scored.
   * START may only be left, END may only be entered, reserved tags may be
   * neither, and START may not go directly to END (sequences are non-empty).
   */
  public boolean isAllowedTransition(int from, int to) {
    if (from == end() || to == start())
      return false;
    if (from == start() && to == end())
      return false;
    if (from < numTags && reserved[from])
      return false;
    if (to < numTags && reserved[to])
      return false;
    return true;
  }

  public void checkTag(int tag) {
    if (!contains(tag))
      throw new IllegalArgumentException("tag " + tag + " is not in [0, " + numTags + ")");
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof LabelSpace))
      return false;
    LabelSpace ls = (LabelSpace) other;
    return numTags == ls.numTags && Arrays.equals(reserved, ls.reserved);
  }

  @Override
  public int hashCode() {
    return 31 * numTags + Arrays.hashCode(reserved);
  }

  @Override
  public String toString() {
    return "(LabelSpace numTags=" + numTags + " real=" + realTags.length + ")";
  }
}
