package edu.jhu.hlt.seqlabel.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class LearningRateScheduleTest {

  @Test
  public void constantByDefault() {
    ExperimentProperties config = new ExperimentProperties();
    LearningRateSchedule lr = LearningRateSchedule.fromConfig(config);
    assertTrue(lr instanceof LearningRateSchedule.Constant);
    lr.observe(10, 1000);
    assertEquals(0.01, lr.learningRate(), 0d);
  }

  @Test
  public void epochDecay() {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(new String[] {"lr", "0.1", "lrDecay", "0.5"});
    LearningRateSchedule lr = LearningRateSchedule.fromConfig(config);
    assertTrue(lr instanceof LearningRateSchedule.EpochDecay);
    lr.observe(0, 0);
    assertEquals(0.1, lr.learningRate(), 1e-12);
    lr.observe(0, 50);
    assertEquals(0.1, lr.learningRate(), 1e-12);
    lr.observe(2, 51);
    assertEquals(0.025, lr.learningRate(), 1e-12);
  }

  @Test
  public void decayAboveOneGrowsTheRate() {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(new String[] {"lr", "0.1", "lrDecay", "2"});
    LearningRateSchedule lr = LearningRateSchedule.fromConfig(config);
    assertTrue(lr instanceof LearningRateSchedule.EpochDecay);
    lr.observe(3, 0);
    assertEquals(0.8, lr.learningRate(), 1e-12);
  }

  @Test(expected = IllegalArgumentException.class)
  public void nonPositiveDecay() {
    new LearningRateSchedule.EpochDecay(0.1, -0.5);
  }

  @Test
  public void normalDecreases() {
    LearningRateSchedule lr = new LearningRateSchedule.Normal(1);
    lr.observe(0, 0);
    double a = lr.learningRate();
    lr.observe(0, 1000);
    double b = lr.learningRate();
    assertTrue(a > b);
    assertTrue(b > 0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void unknownSchedule() {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(new String[] {"lrSchedule", "cosine"});
    LearningRateSchedule.fromConfig(config);
  }

  @Test(expected = IllegalArgumentException.class)
  public void nonPositiveRate() {
    new LearningRateSchedule.Constant(0);
  }
}
