package org.ggp.graphmcts.search;

import java.util.Random;

import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.Target;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.exceptions.CycleException;
import org.ggp.graphmcts.search.exceptions.NoTerminalPayoffException;
import org.ggp.graphmcts.search.exceptions.SelectorException;
import org.ggp.graphmcts.search.policy.RolloutSelector;

import gnu.trove.list.array.TIntArrayList;

/**
 * The descent phase of an iteration: walk from the root, choosing an edge at each vertex, until reaching a vertex
 * whose payoff is known or an edge that hasn't been expanded.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public class Rollout<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  /**
   * Where a descent stopped.
   */
  public static final class Result<S extends GameState<S, A>, A, P extends Payoff<P>>
  {
    /**
     * The ways a descent can stop.
     */
    public static enum Kind
    {
      /**
       * At a vertex whose payoff is known (terminal, or proven from its children).
       */
      KNOWN_PAYOFF,

      /**
       * At an edge which needs expanding.
       */
      UNEXPANDED_EDGE,

      /**
       * At a vertex whose children were never enumerated (left by a failed expansion).
       */
      UNEXPANDED_VERTEX;
    }

    private final Kind               mKind;
    private final VertexRef<S, A, P> mVertex;
    private final EdgeRef<S, A, P>   mEdge;

    private Result(Kind xiKind, VertexRef<S, A, P> xiVertex, EdgeRef<S, A, P> xiEdge)
    {
      mKind = xiKind;
      mVertex = xiVertex;
      mEdge = xiEdge;
    }

    public Kind getKind()
    {
      return mKind;
    }

    /**
     * @return the vertex reached.  Null for {@link Kind#UNEXPANDED_EDGE}.
     */
    public VertexRef<S, A, P> getVertex()
    {
      return mVertex;
    }

    /**
     * @return the edge reached.  Only set for {@link Kind#UNEXPANDED_EDGE}.
     */
    public EdgeRef<S, A, P> getEdge()
    {
      return mEdge;
    }
  }

  private final RolloutSelector<S, A, P> mSelector;

  /**
   * Create a rollout phase.
   *
   * @param xiSelector - strategy for choosing the edge to descend through.
   */
  public Rollout(RolloutSelector<S, A, P> xiSelector)
  {
    mSelector = xiSelector;
  }

  /**
   * Descend from the root.  The caller must hold the graph's read lock.
   *
   * Every edge chosen is marked in the worker's rollout lane and appended to the path.  The caller is responsible
   * for clearing the marks once the pass is over, whether or not it succeeded.
   *
   * A vertex with a proven payoff stops the descent unless it is the root.
   *
   * @param xiRoot     - the vertex to start from.
   * @param xiSettings - settings for the current round.
   * @param xiEpoch    - the current epoch.
   * @param xiWorker   - the worker running this pass.
   * @param xiRandom   - the worker's source of randomness.
   * @param xoPath     - ids of the edges traversed, in order.
   *
   * @return where the descent stopped.
   *
   * @throws CycleException if the same edge was chosen twice.
   * @throws SelectorException if the selector failed.
   */
  public Result<S, A, P> descend(VertexRef<S, A, P> xiRoot,
                                 SearchSettings xiSettings,
                                 Epoch xiEpoch,
                                 WorkerId xiWorker,
                                 Random xiRandom,
                                 TIntArrayList xoPath) throws CycleException, SelectorException
  {
    VertexRef<S, A, P> lVertex = xiRoot;
    while (true)
    {
      if (lVertex.isTerminal() || ((lVertex.getProvenPayoff() != null) && !lVertex.equals(xiRoot)))
      {
        return new Result<>(Result.Kind.KNOWN_PAYOFF, lVertex, null);
      }

      if (!lVertex.isExpanded())
      {
        return new Result<>(Result.Kind.UNEXPANDED_VERTEX, lVertex, null);
      }

      if (lVertex.getNumChildren() == 0)
      {
        throw new NoTerminalPayoffException(lVertex.getState());
      }

      EdgeRef<S, A, P> lEdge = mSelector.select(lVertex, xiSettings, xiRandom);
      xoPath.add(lEdge.getId());
      if (lEdge.getTraversals().markRolloutTraversal(xiWorker.getIndex()))
      {
        throw new CycleException(xiEpoch, xiWorker, xoPath.toArray());
      }

      Target lTarget = lEdge.getTarget();
      if (lTarget.isUnexpanded())
      {
        return new Result<>(Result.Kind.UNEXPANDED_EDGE, null, lEdge);
      }

      lVertex = lEdge.getTargetVertex();
    }
  }
}
