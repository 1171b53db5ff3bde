package org.ggp.graphmcts.search;

import java.util.HashSet;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.graphmcts.game.ActionVisitor;
import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.SearchGraph;
import org.ggp.graphmcts.graph.Target;
import org.ggp.graphmcts.graph.VertexRef;

/**
 * The expansion phase of an iteration: resolve an unexpanded edge and, if it leads to a new state, enumerate that
 * state's children.
 *
 * All work is done under the graph's mutation lock.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public class Expansion<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * The result of an expansion.
   */
  public static final class Outcome<S extends GameState<S, A>, A, P extends Payoff<P>>
  {
    private final VertexRef<S, A, P> mVertex;
    private final S                  mState;
    private final boolean            mFresh;
    private final P                  mPayoff;

    Outcome(VertexRef<S, A, P> xiVertex, boolean xiFresh, P xiPayoff)
    {
      mVertex = xiVertex;
      mState = xiVertex.getState();
      mFresh = xiFresh;
      mPayoff = xiPayoff;
    }

    /**
     * @return the vertex reached.
     */
    public VertexRef<S, A, P> getVertex()
    {
      return mVertex;
    }

    /**
     * @return the state of the vertex reached, captured while the lock was held.
     */
    public S getState()
    {
      return mState;
    }

    /**
     * @return whether this expansion enumerated the vertex's children.
     */
    public boolean isFresh()
    {
      return mFresh;
    }

    /**
     * @return the payoff to backpropagate, or null if a simulation is needed to estimate it.
     */
    public P getPayoff()
    {
      return mPayoff;
    }
  }

  /**
   * Resolve an edge reached by a rollout and expand the vertex it leads to if that is new.
   *
   * If another worker resolved the edge first, the outcome is as for an edge resolved to an existing vertex.
   *
   * @param xiEdge - the edge.
   *
   * @return the outcome.
   */
  public Outcome<S, A, P> expandEdge(EdgeRef<S, A, P> xiEdge)
  {
    SearchGraph<S, A, P> lGraph = xiEdge.getGraph();
    lGraph.lockForMutation();
    try
    {
      Target lTarget = xiEdge.getTarget();
      if (lTarget.isUnexpanded())
      {
        S lNextState = xiEdge.getSource().getState().copy();
        lNextState.doAction(xiEdge.getAction());
        lTarget = lGraph.resolveEdge(xiEdge, lNextState);
      }

      VertexRef<S, A, P> lVertex = lGraph.getVertex(lTarget.getVertexId());
      if (!lVertex.isExpanded())
      {
        return expandVertexLocked(lVertex);
      }

      LOGGER.debug(xiEdge + " reached existing " + lVertex);
      return new Outcome<>(lVertex, false, seedPayoff(lGraph, lVertex));
    }
    finally
    {
      lGraph.unlockForMutation();
    }
  }

  /**
   * Enumerate the children of a vertex, if not already done.
   *
   * @param xiVertex - the vertex.
   *
   * @return the outcome.
   */
  public Outcome<S, A, P> expandVertex(VertexRef<S, A, P> xiVertex)
  {
    SearchGraph<S, A, P> lGraph = xiVertex.getGraph();
    lGraph.lockForMutation();
    try
    {
      if (xiVertex.isExpanded())
      {
        return new Outcome<>(xiVertex, false, seedPayoff(lGraph, xiVertex));
      }
      return expandVertexLocked(xiVertex);
    }
    finally
    {
      lGraph.unlockForMutation();
    }
  }

  /**
   * Enumerate the children of an unexpanded vertex.  The caller must hold the mutation lock.
   *
   * One child edge is created per distinct successor state.  Where several actions lead to the same state, only the
   * first is kept.
   *
   * @param xiVertex - the vertex.
   *
   * @return the outcome.
   */
  Outcome<S, A, P> expandVertexLocked(final VertexRef<S, A, P> xiVertex)
  {
    final SearchGraph<S, A, P> lGraph = xiVertex.getGraph();
    assert(lGraph.checkMutationOwnership());

    if (!xiVertex.isTerminal())
    {
      final S lState = xiVertex.getState();
      final Set<S> lSuccessors = new HashSet<>();
      lState.forEachAction(new ActionVisitor<A>()
      {
        @Override
        public boolean visit(A xiAction)
        {
          S lNextState = lState.copy();
          lNextState.doAction(xiAction);
          if (lSuccessors.add(lNextState))
          {
            lGraph.appendChild(xiVertex, xiAction);
          }
          return true;
        }
      });
    }

    boolean lAlreadyExpanded = xiVertex.markExpanded();
    assert(!lAlreadyExpanded) : xiVertex + " expanded twice";

    return new Outcome<>(xiVertex, true, xiVertex.getTerminalPayoff());
  }

  /**
   * @return the payoff with which to credit an edge that has reached an already-expanded vertex: the terminal payoff
   * if there is one, otherwise the sum of the statistics of the vertex's children.
   */
  private P seedPayoff(SearchGraph<S, A, P> xiGraph, VertexRef<S, A, P> xiVertex)
  {
    if (xiVertex.isTerminal())
    {
      return xiVertex.getTerminalPayoff();
    }

    P lSum = xiGraph.getGame().zeroPayoff();
    for (EdgeRef<S, A, P> lChild : xiVertex.getChildren())
    {
      lSum = lSum.plus(lChild.getStatistics().asPayoff());
    }
    return lSum;
  }
}
