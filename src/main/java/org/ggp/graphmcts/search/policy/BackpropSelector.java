package org.ggp.graphmcts.search.policy;

import java.util.List;

import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.SearchSettings;
import org.ggp.graphmcts.search.exceptions.SelectorException;

/**
 * Strategy for choosing which parent edges of a vertex receive a backpropagated payoff.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public interface BackpropSelector<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  /**
   * Choose the parent edges to propagate through.  Called with the graph's read lock held, before any of the
   * returned edges has been updated.
   *
   * @param xiVertex   - the vertex whose parents are being considered.
   * @param xiSettings - the settings for the current round.
   *
   * @return the chosen parent edges, possibly none.
   *
   * @throws SelectorException if the choice couldn't be made.
   */
  public List<EdgeRef<S, A, P>> selectParents(VertexRef<S, A, P> xiVertex,
                                              SearchSettings xiSettings) throws SelectorException;
}
