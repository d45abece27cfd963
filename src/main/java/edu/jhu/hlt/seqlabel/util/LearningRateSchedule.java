package edu.jhu.hlt.seqlabel.util;

import org.apache.commons.math3.util.FastMath;

/**
 * Learning rate as a function of training progress. The trainer calls
 * {@link #observe(int, int)} before every step.
 */
public interface LearningRateSchedule {

  public void observe(int epoch, int step);

  public double learningRate();

  public static LearningRateSchedule fromConfig(ExperimentProperties config) {
    double lr = config.getDouble("lr", 0.01);
    String name = config.getString("lrSchedule", "auto");
    double decay = config.getDouble("lrDecay", 0);
    switch (name.toLowerCase()) {
    case "auto":
      return decay > 0 ? new EpochDecay(lr, decay) : new Constant(lr);
    case "constant":
      return new Constant(lr);
    case "decay":
      return new EpochDecay(lr, decay);
    case "normal":
      return new Normal(lr);
    default:
      throw new IllegalArgumentException("unknown lrSchedule: " + name);
    }
  }

  public static class Constant implements LearningRateSchedule {
    private final double learningRate;
    public Constant(double learningRate) {
      if (Double.isInfinite(learningRate) || Double.isNaN(learningRate) || learningRate <= 0)
        throw new IllegalArgumentException("learning rate must be positive: " + learningRate);
      this.learningRate = learningRate;
    }
    @Override
    public void observe(int epoch, int step) {
      // no-op
    }
    @Override
    public double learningRate() {
      return learningRate;
    }
    @Override
    public String toString() {
      return String.format("(Constant %.3g)", learningRate);
    }
  }

  /**
   * initial * decay^epoch, i.e. the rate is multiplied by decay at the end of
   * every epoch. A decay above 1 grows the rate.
   */
  public static class EpochDecay implements LearningRateSchedule {
    private final double initial;
    private final double decay;
    private int epoch;
    public EpochDecay(double initial, double decay) {
      if (initial <= 0)
        throw new IllegalArgumentException("learning rate must be positive: " + initial);
      if (decay <= 0 || Double.isNaN(decay) || Double.isInfinite(decay))
        throw new IllegalArgumentException("decay must be positive and finite: " + decay);
      this.initial = initial;
      this.decay = decay;
    }
    @Override
    public void observe(int epoch, int step) {
      this.epoch = epoch;
    }
    @Override
    public double learningRate() {
      return initial * FastMath.pow(decay, epoch);
    }
    @Override
    public String toString() {
      return String.format("(EpochDecay init=%.3g decay=%.3g epoch=%d lr=%.3g)",
          initial, decay, epoch, learningRate());
    }
  }

  /** initial * smooth / (smooth + (step+1)^squish) */
  public static class Normal implements LearningRateSchedule {
    private final double initial;
    private final double smooth;
    private final double squish;
    private int step;
    public Normal(double initial) {
      this(initial, 100d, 0.75d);
    }
    public Normal(double initial, double smooth, double squish) {
      if (squish > 1 || squish <= 0)
        throw new IllegalArgumentException("squish must be in (0, 1]: " + squish);
      this.initial = initial;
      this.smooth = smooth;
      this.squish = squish;
    }
    @Override
    public void observe(int epoch, int step) {
      this.step = step;
    }
    @Override
    public double learningRate() {
      double it = FastMath.pow(step + 1, squish);
      return initial * smooth / (smooth + it);
    }
    @Override
    public String toString() {
      return String.format("(Normal init=%.3g smooth=%.3g squish=%.3g step=%d lr=%.3g)",
          initial, smooth, squish, step, learningRate());
    }
  }
}
