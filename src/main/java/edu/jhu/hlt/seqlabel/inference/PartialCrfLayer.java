package edu.jhu.hlt.seqlabel.inference;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;

/**
 * CRF head trained with partial supervision. Positions labelled
 * {@link LabelSpace#WORD_PIECE} (sub-tokens with no tag of their own) may take
 * any tag the {@link CandidatePolicy} allows, every other position is fixed
 * to its gold tag. The loss is log Z(all) - log Z(consistent paths), which is
 * the full CRF loss when there are no word-pieces.
 *
 * Decoding is the same unconstrained Viterbi as {@link CrfLayer}.
 *
 * @author travis
 */
public class PartialCrfLayer extends CrfLayer {

  private final CandidatePolicy policy;

  public PartialCrfLayer(TransitionParams params) {
    this(params, Normalization.SUM, new CandidatePolicy.AllRealTags());
  }

  public PartialCrfLayer(TransitionParams params, Normalization normalization, CandidatePolicy policy) {
    super(params, normalization);
    if (!space.isReserved(LabelSpace.WORD_PIECE)) {
      throw new IllegalArgumentException("partial supervision needs the word-piece"
          + " marker reserved in the label space: " + space);
    }
    this.policy = policy;
  }

  public CandidatePolicy getPolicy() {
    return policy;
  }

  @Override
  public AllowedTags supervision(int[] labels, int length) {
    int[][] sets = new int[length][];
    for (int t = 0; t < length; t++) {
      space.checkTag(labels[t]);
      if (labels[t] == LabelSpace.WORD_PIECE)
        sets[t] = policy.candidates(space, labels, t);
      else
        sets[t] = new int[] {labels[t]};
    }
    return AllowedTags.candidates(sets);
  }

  /**
   * Loss for a batch where the caller provides the candidate sets directly.
   * @param candidates is [row][T][], each row as long as that row's emissions;
   * only the first lengths[row] sets are read.
   */
  public CrfLoss.Batch train(double[][][] emissions, int[] lengths, int[][][] candidates,
      Gradient gradient, ExecutorService es) {
    checkBatch(emissions, lengths, candidates.length, "candidate");
    List<AllowedTags> supervision = new ArrayList<>(candidates.length);
    for (int i = 0; i < candidates.length; i++) {
      if (candidates[i].length != emissions[i].length) {
        throw new IllegalArgumentException("row " + i + " has " + emissions[i].length
            + " emission vectors but " + candidates[i].length + " candidate sets");
      }
      if (lengths[i] <= 0 || lengths[i] > candidates[i].length)
        throw new IllegalArgumentException("row " + i + " has bad length " + lengths[i]);
      int[][] valid = Arrays.copyOf(candidates[i], lengths[i]);
      for (int[] set : valid)
        if (set != null)
          for (int c : set)
            space.checkTag(c);
      supervision.add(AllowedTags.candidates(valid));
    }
    return train(emissions, lengths, supervision, gradient, es);
  }

  @Override
  public String toString() {
    return "(PartialCrfLayer policy=" + policy + " " + space + ")";
  }
}
