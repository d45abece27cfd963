package edu.jhu.hlt.seqlabel.inference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Random;

import org.junit.Test;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;

public class ForwardAlgorithmTest {

  @Test
  public void threeTagExample() {
    LabelSpace space = LabelSpace.plain(3);
    TransitionParams tp = new TransitionParams(space);
    tp.set(0, 1, 5);
    double[][] e = new double[][] {
      {2, 1, 0},
      {0, 2, 1},
    };
    double z = 0;
    for (int a = 0; a < 3; a++)
      for (int b = 0; b < 3; b++)
        z += Math.exp(e[0][a] + e[1][b] + (a == 0 && b == 1 ? 5 : 0));
    assertEquals(Math.log(z), ForwardAlgorithm.logPartition(e, 2, tp), 1e-5);

    ViterbiDecoder.Path p = ViterbiDecoder.decode(e, 2, tp);
    assertEquals(0, p.getTags()[0]);
    assertEquals(1, p.getTags()[1]);
    assertEquals(9, p.getScore(), 1e-12);
  }

  @Test
  public void matchesBruteForce() {
    Random rand = new Random(9001);
    for (int C = 1; C <= 3; C++) {
      LabelSpace space = LabelSpace.plain(C);
      for (int T = 1; T <= 4; T++) {
        for (int iter = 0; iter < 5; iter++) {
          TransitionParams tp = TestingUtil.randomParams(space, rand);
          double[][] e = TestingUtil.randomEmissions(rand, T, C);
          AllowedTags all = AllowedTags.unconstrained(space, T);
          double expected = TestingUtil.bruteForceLogZ(e, T, tp, all);
          assertEquals(expected, ForwardAlgorithm.logPartition(e, T, tp), 1e-9);
        }
      }
    }
  }

  @Test
  public void reservedTagsContributeNothing() {
    Random rand = new Random(4);
    LabelSpace space = LabelSpace.forTagger(5, true);
    TransitionParams tp = TestingUtil.randomParams(space, rand);
    double[][] e = TestingUtil.randomEmissions(rand, 3, 5);
    int[][] real = new int[3][];
    for (int t = 0; t < 3; t++)
      real[t] = space.realTags();
    double expected = TestingUtil.bruteForceLogZ(e, 3, tp, AllowedTags.candidates(real));
    assertEquals(expected, ForwardAlgorithm.logPartition(e, 3, tp), 1e-9);
  }

  @Test
  public void goldLatticeIsExactlyThePathScore() {
    Random rand = new Random(1);
    LabelSpace space = LabelSpace.forTagger(6, false);
    for (int iter = 0; iter < 20; iter++) {
      int T = 1 + rand.nextInt(8);
      TransitionParams tp = TestingUtil.randomParams(space, rand);
      double[][] e = TestingUtil.randomEmissions(rand, T, 6);
      int[] gold = TestingUtil.randomLabels(rand, space, T);
      double s = ForwardAlgorithm.pathScore(e, T, tp, gold);
      double z = ForwardAlgorithm.forward(e, T, tp, AllowedTags.gold(gold)).logZ();
      assertEquals(s, z, 0d);
      assertTrue(ForwardAlgorithm.logPartition(e, T, tp) >= s);
    }
  }

  @Test
  public void paddingIsIgnored() {
    Random rand = new Random(2);
    LabelSpace space = LabelSpace.plain(3);
    TransitionParams tp = TestingUtil.randomParams(space, rand);
    double[][] e = TestingUtil.randomEmissions(rand, 3, 3);
    double[][] padded = new double[][] {e[0], e[1], e[2], {Double.NaN, 1e300, 0}, {}};
    assertEquals(ForwardAlgorithm.logPartition(e, 3, tp),
        ForwardAlgorithm.logPartition(padded, 3, tp), 0d);
  }

  @Test
  public void negativeInfinityEmissionRemovesPaths() {
    Random rand = new Random(3);
    LabelSpace space = LabelSpace.plain(3);
    TransitionParams tp = TestingUtil.randomParams(space, rand);
    double[][] e = TestingUtil.randomEmissions(rand, 3, 3);
    e[1][2] = Double.NEGATIVE_INFINITY;
    int[][] sets = new int[][] {{0, 1, 2}, {0, 1}, {0, 1, 2}};
    double expected = TestingUtil.bruteForceLogZ(e, 3, tp, AllowedTags.candidates(sets));
    double z = ForwardAlgorithm.logPartition(e, 3, tp);
    assertEquals(expected, z, 1e-9);
    assertTrue(z > Double.NEGATIVE_INFINITY);
  }

  @Test
  public void infeasible() {
    LabelSpace space = LabelSpace.plain(2);
    TransitionParams tp = new TransitionParams(space);
    double ninf = Double.NEGATIVE_INFINITY;
    double[][] e = new double[][] {{0, 0}, {ninf, ninf}, {0, 0}};
    try {
      ForwardAlgorithm.logPartition(e, 3, tp);
      fail("expected an infeasible lattice");
    } catch (InfeasibleLatticeException ex) {
      assertEquals(1, ex.getPosition());
    }
    // Every transition out of tag 0 forbidden by score, tag 1 forbidden by emission
    tp.set(0, 0, ninf);
    tp.set(0, 1, ninf);
    double[][] e2 = new double[][] {{0, ninf}, {0, 0}};
    try {
      ForwardAlgorithm.logPartition(e2, 2, tp);
      fail("expected an infeasible lattice");
    } catch (InfeasibleLatticeException ex) {
      assertEquals(1, ex.getPosition());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void zeroLength() {
    LabelSpace space = LabelSpace.plain(2);
    ForwardAlgorithm.logPartition(new double[][] {{0, 0}}, 0, new TransitionParams(space));
  }

  @Test(expected = IllegalArgumentException.class)
  public void lengthBeyondEmissions() {
    LabelSpace space = LabelSpace.plain(2);
    ForwardAlgorithm.logPartition(new double[][] {{0, 0}}, 2, new TransitionParams(space));
  }

  @Test(expected = IllegalArgumentException.class)
  public void wrongWidth() {
    LabelSpace space = LabelSpace.plain(3);
    ForwardAlgorithm.logPartition(new double[][] {{0, 0}}, 1, new TransitionParams(space));
  }

  @Test(expected = IllegalArgumentException.class)
  public void nanEmission() {
    LabelSpace space = LabelSpace.plain(2);
    ForwardAlgorithm.logPartition(new double[][] {{0, Double.NaN}}, 1, new TransitionParams(space));
  }

  @Test
  public void marginalsSumToOne() {
    Random rand = new Random(5);
    LabelSpace space = LabelSpace.forTagger(4, true);
    TransitionParams tp = TestingUtil.randomParams(space, rand);
    double[][] e = TestingUtil.randomEmissions(rand, 5, 4);
    Lattice l = ForwardAlgorithm.forward(e, 5, tp, AllowedTags.unconstrained(space, 5));
    for (int t = 0; t < 5; t++) {
      double s = 0;
      for (int c = 0; c < 4; c++)
        s += l.marginal(t, c);
      assertEquals(1, s, 1e-9);
      assertEquals(0, l.marginal(t, LabelSpace.PAD), 0d);
      assertEquals(0, l.marginal(t, LabelSpace.WORD_PIECE), 0d);
    }
  }

  @Test
  public void largeScoresDoNotOverflow() {
    LabelSpace space = LabelSpace.plain(2);
    TransitionParams tp = new TransitionParams(space);
    double[][] e = new double[][] {{1000, 1000}, {1000, 1000}};
    // four paths, each scoring 2000
    assertEquals(2000 + Math.log(4), ForwardAlgorithm.logPartition(e, 2, tp), 1e-9);
  }
}
