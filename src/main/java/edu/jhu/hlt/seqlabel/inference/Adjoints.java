package edu.jhu.hlt.seqlabel.inference;

/**
 * Wraps the result of a forward pass, which is needed again for computing a
 * gradient.
 *
 * @author travis
 */
public interface Adjoints {

  /**
   * Compute the circuit's value when run forwards.
   */
  public double forwards();

  /**
   * Accumulate dErr_dForwards * d(forwards)/d(params) into whatever gradient
   * this was built with. Must not change the parameters themselves, so the
   * order in which a batch of Adjoints is run backwards doesn't matter.
   */
  public void backwards(double dErr_dForwards);
}
