package org.ggp.graphmcts.game;

/**
 * An accumulable game outcome.  Payoffs are immutable.
 *
 * @param <P> - the concrete payoff type.
 */
public interface Payoff<P extends Payoff<P>>
{
  /**
   * @return the number of observations folded into this payoff.
   */
  public int getWeight();

  /**
   * @return the sum of this payoff and another.
   *
   * @param xiOther - the payoff to add.
   */
  public P plus(P xiOther);

  /**
   * @return the per-player maximum of this payoff and another.
   *
   * @param xiOther - the other payoff.
   */
  public P max(P xiOther);

  /**
   * @return the score credited to the specified player.
   *
   * @param xiPlayer - the player index.
   */
  public double getScore(int xiPlayer);
}
