package edu.jhu.hlt.seqlabel.inference;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;
import java.util.Random;

import org.junit.Test;

import edu.jhu.hlt.seqlabel.datatypes.LabelSpace;
import edu.jhu.hlt.seqlabel.datatypes.Sequence;

public class OptimizerTest {

  private static Tagger tagger(LabelSpace space, int H, Random rand) {
    return Tagger.build(space, H, null, CrfLayer.Normalization.TOKEN_MEAN,
        TransitionParams.Init.ZERO, 0, rand);
  }

  @Test
  public void firstAdamStepMovesBySignTimesRate() {
    LabelSpace space = LabelSpace.forTagger(4, false);
    Tagger t = tagger(space, 2, new Random(1));
    double w00 = t.getProjection().getWeights()[2][0];
    double w01 = t.getProjection().getWeights()[2][1];

    Gradient g = t.newGradient();
    g.getTransitions()[2][3] = 0.5;
    g.getTransitions()[3][2] = -2;
    g.getTransitions()[LabelSpace.PAD][2] = 7;   // forbidden, must be ignored
    g.getWeights()[2][0] = 3;

    Optimizer.Adam adam = new Optimizer.Adam();
    adam.step(t, g, 0.1);
    assertEquals(1, adam.getSteps());
    TransitionParams tp = t.getTransitions();
    assertEquals(-0.1, tp.get(2, 3), 1e-6);
    assertEquals(0.1, tp.get(3, 2), 1e-6);
    assertEquals(0, tp.get(2, 2), 0d);
    assertEquals(Double.NEGATIVE_INFINITY, tp.get(LabelSpace.PAD, 2), 0d);
    assertEquals(w00 - 0.1, t.getProjection().getWeights()[2][0], 1e-6);
    assertEquals(w01, t.getProjection().getWeights()[2][1], 0d);
  }

  @Test
  public void sgdIsAPlainStep() {
    LabelSpace space = LabelSpace.forTagger(3, false);
    Tagger t = tagger(space, 2, new Random(2));
    Gradient g = t.newGradient();
    g.getTransitions()[1][2] = 0.5;
    Optimizer.byName("SGD").step(t, g, 0.1);
    assertEquals(-0.05, t.getTransitions().get(1, 2), 1e-15);
  }

  @Test
  public void adamLowersTheLoss() {
    Random rand = new Random(3);
    LabelSpace space = LabelSpace.forTagger(4, false);
    List<Sequence> data = TaggerTest.oneHotData(rand, space, 6, 5);
    Tagger t = tagger(space, 4, rand);
    Optimizer adam = Optimizer.byName("adam");
    double first = t.loss(data, null, null).forwards();
    for (int iter = 0; iter < 50; iter++) {
      Gradient g = t.newGradient();
      t.loss(data, g, null).backwards(1);
      adam.step(t, g, 0.05);
    }
    double last = t.loss(data, null, null).forwards();
    assertTrue("first=" + first + " last=" + last, last < first);
    for (int c = 0; c < space.numTransitionStates(); c++)
      assertEquals(Double.NEGATIVE_INFINITY, t.getTransitions().get(c, LabelSpace.PAD), 0d);
  }

  @Test(expected = IllegalStateException.class)
  public void adamBelongsToOneTagger() {
    Random rand = new Random(4);
    Optimizer.Adam adam = new Optimizer.Adam();
    Tagger a = tagger(LabelSpace.forTagger(3, false), 2, rand);
    adam.step(a, a.newGradient(), 0.1);
    Tagger b = tagger(LabelSpace.forTagger(5, false), 2, rand);
    adam.step(b, b.newGradient(), 0.1);
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownOptimizer() {
    Optimizer.byName("rmsprop");
  }
}
