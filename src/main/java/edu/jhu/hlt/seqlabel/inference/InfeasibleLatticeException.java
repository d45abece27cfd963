package edu.jhu.hlt.seqlabel.inference;

/**
 * Thrown when every path through a lattice has score negative infinity, e.g.
 * a position whose allowed tags are all forbidden. This is a bug in the caller
 * (bad candidate sets, a gold tag which can't be reached), not a low score.
 */
public class InfeasibleLatticeException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final int position;

  public InfeasibleLatticeException(String message, int position) {
    super(message);
    this.position = position;
  }

  /** The first position at which no allowed tag was reachable, or -1 if unknown */
  public int getPosition() {
    return position;
  }
}
