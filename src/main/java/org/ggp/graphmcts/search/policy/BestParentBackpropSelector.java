package org.ggp.graphmcts.search.policy;

import java.util.ArrayList;
import java.util.List;

import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.SearchSettings;

/**
 * Backprop selector which propagates through every parent edge that is currently a UCB1-best child of its own
 * source.  With transpositions this can be more than one edge.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public class BestParentBackpropSelector<S extends GameState<S, A>, A, P extends Payoff<P>>
  implements BackpropSelector<S, A, P>
{
  @Override
  public List<EdgeRef<S, A, P>> selectParents(VertexRef<S, A, P> xiVertex,
                                              SearchSettings xiSettings) throws UcbException
  {
    List<EdgeRef<S, A, P>> lSelected = new ArrayList<>(xiVertex.getNumParents());
    for (EdgeRef<S, A, P> lParent : xiVertex.getParents())
    {
      if (Ucb.isBestChild(lParent, xiSettings.getExploreBias()))
      {
        lSelected.add(lParent);
      }
    }
    return lSelected;
  }
}
