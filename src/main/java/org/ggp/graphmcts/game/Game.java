package org.ggp.graphmcts.game;

/**
 * Game capability consumed by the search engine.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public interface Game<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  /**
   * @return the outcome of the specified state if it is terminal, or null if play continues.
   *
   * @param xiState - the state.
   */
  public P payoffOf(S xiState);

  /**
   * @return a payoff with no weight and no score.
   */
  public P zeroPayoff();

  /**
   * @return a new, empty, statistics accumulator.
   */
  public Statistics<P> newStatistics();
}
