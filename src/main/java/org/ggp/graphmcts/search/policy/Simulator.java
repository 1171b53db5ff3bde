package org.ggp.graphmcts.search.policy;

import java.util.Random;

import org.ggp.graphmcts.game.Game;
import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.search.exceptions.SelectorException;

/**
 * Strategy for estimating the payoff of a non-terminal state.  Simulators never touch the search graph.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public interface Simulator<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  /**
   * Estimate a state's payoff.
   *
   * @param xiGame   - the game.
   * @param xiState  - the state.  Must not be modified.
   * @param xiCount  - the number of playouts to run.
   * @param xiRandom - the calling worker's source of randomness.
   *
   * @return the sum of the playout payoffs.
   *
   * @throws SelectorException if the simulation failed.
   */
  public P simulate(Game<S, A, P> xiGame, S xiState, int xiCount, Random xiRandom) throws SelectorException;
}
