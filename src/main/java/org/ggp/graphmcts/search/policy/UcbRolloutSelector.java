package org.ggp.graphmcts.search.policy;

import java.util.Random;

import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.SearchSettings;

/**
 * Rollout selector which descends through the UCB1-best child.
 *
 * Children known to lead only into cycles are passed over while any other child remains.  The best-parent backprop
 * selector judges parents against the same candidates.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public class UcbRolloutSelector<S extends GameState<S, A>, A, P extends Payoff<P>>
  implements RolloutSelector<S, A, P>
{
  @Override
  public EdgeRef<S, A, P> select(VertexRef<S, A, P> xiVertex,
                                 SearchSettings xiSettings,
                                 Random xiRandom) throws UcbException
  {
    return Ucb.findBestChild(xiVertex, Ucb.selectionCandidates(xiVertex), xiSettings.getExploreBias(), xiRandom);
  }
}
