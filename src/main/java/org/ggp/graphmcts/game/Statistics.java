package org.ggp.graphmcts.game;

/**
 * A thread-safe accumulator of payoffs, held by every edge of the search graph.
 *
 * Implementations must not block in increment() - it is called concurrently from every search worker.
 *
 * @param <P> - the payoff type accumulated.
 */
public interface Statistics<P extends Payoff<P>>
{
  /**
   * @return the number of observations accumulated so far.  Never decreases.
   */
  public int getVisits();

  /**
   * @return the accumulated score for the specified player.
   *
   * @param xiPlayer - the player index.
   */
  public double getScore(int xiPlayer);

  /**
   * Atomically fold a payoff into these statistics.
   *
   * @param xiPayoff - the payoff.
   */
  public void increment(P xiPayoff);

  /**
   * @return a snapshot of these statistics, as a payoff.
   */
  public P asPayoff();
}
