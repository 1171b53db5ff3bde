package org.ggp.graphmcts.search.policy;

import java.util.Collections;
import java.util.List;

import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.SearchSettings;

/**
 * Backprop selector which always propagates through the oldest parent edge only, making the search behave as a
 * tree search over the first route found to each state.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public class FirstParentBackpropSelector<S extends GameState<S, A>, A, P extends Payoff<P>>
  implements BackpropSelector<S, A, P>
{
  @Override
  public List<EdgeRef<S, A, P>> selectParents(VertexRef<S, A, P> xiVertex, SearchSettings xiSettings)
  {
    if (xiVertex.getNumParents() == 0)
    {
      return Collections.emptyList();
    }
    return Collections.singletonList(xiVertex.getParents().get(0));
  }
}
