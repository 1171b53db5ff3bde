package org.ggp.graphmcts.search.policy;

import java.util.Random;

import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.SearchSettings;
import org.ggp.graphmcts.search.exceptions.SelectorException;

/**
 * Strategy for choosing which child edge a rollout descends through.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public interface RolloutSelector<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  /**
   * Choose a child edge.  Called with the graph's read lock held.
   *
   * @param xiVertex   - an expanded vertex with at least one child.
   * @param xiSettings - the settings for the current round.
   * @param xiRandom   - the calling worker's source of randomness.
   *
   * @return the chosen edge.
   *
   * @throws SelectorException if no edge could be chosen.
   */
  public EdgeRef<S, A, P> select(VertexRef<S, A, P> xiVertex,
                                 SearchSettings xiSettings,
                                 Random xiRandom) throws SelectorException;
}
