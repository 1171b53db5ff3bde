package org.ggp.graphmcts.graph;

import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.game.Statistics;

/**
 * Handle to an edge of a search graph: the graph plus the edge id.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public final class EdgeRef<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  private final SearchGraph<S, A, P> mGraph;
  private final int                  mId;

  EdgeRef(SearchGraph<S, A, P> xiGraph, int xiId)
  {
    mGraph = xiGraph;
    mId = xiId;
  }

  private Edge<A, P> edge()
  {
    return mGraph.edge(mId);
  }

  public SearchGraph<S, A, P> getGraph()
  {
    return mGraph;
  }

  public int getId()
  {
    return mId;
  }

  public A getAction()
  {
    return edge().mAction;
  }

  public Statistics<P> getStatistics()
  {
    return edge().mStatistics;
  }

  public AtomicTraversals getTraversals()
  {
    return edge().mTraversals;
  }

  public Target getTarget()
  {
    return edge().mTarget;
  }

  public VertexRef<S, A, P> getSource()
  {
    return mGraph.getVertex(edge().mSourceId);
  }

  /**
   * @return the vertex this edge leads to, or null if the edge is unexpanded.
   */
  public VertexRef<S, A, P> getTargetVertex()
  {
    Target lTarget = edge().mTarget;
    return lTarget.isUnexpanded() ? null : mGraph.getVertex(lTarget.getVertexId());
  }

  /**
   * @return whether following this edge can only lead back into a cycle.
   */
  public boolean isCyclic()
  {
    Target lTarget = edge().mTarget;
    switch (lTarget.getKind())
    {
      case CYCLE:    return true;
      case EXPANDED: return mGraph.vertex(lTarget.getVertexId()).mCyclic;
      default:       return false;
    }
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof EdgeRef))
    {
      return false;
    }
    EdgeRef<?, ?, ?> lOther = (EdgeRef<?, ?, ?>)xiOther;
    return (mGraph == lOther.mGraph) && (mId == lOther.mId);
  }

  @Override
  public int hashCode()
  {
    return mId;
  }

  @Override
  public String toString()
  {
    Edge<A, P> lEdge = edge();
    return "Edge " + mId + " (" + lEdge.mAction + ") from " + lEdge.mSourceId + " to " + lEdge.mTarget;
  }
}
