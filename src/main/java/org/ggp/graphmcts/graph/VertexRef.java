package org.ggp.graphmcts.graph;

import java.util.ArrayList;
import java.util.List;

import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;

/**
 * Handle to a vertex of a search graph: the graph plus the vertex id.
 *
 * Handles are cheap, may be freely copied and compare equal when they refer to the same vertex of the same graph.
 * A handle is only valid until the vertex is pruned.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public final class VertexRef<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  private final SearchGraph<S, A, P> mGraph;
  private final int                  mId;

  VertexRef(SearchGraph<S, A, P> xiGraph, int xiId)
  {
    mGraph = xiGraph;
    mId = xiId;
  }

  private Vertex<S, P> vertex()
  {
    return mGraph.vertex(mId);
  }

  public SearchGraph<S, A, P> getGraph()
  {
    return mGraph;
  }

  public int getId()
  {
    return mId;
  }

  /**
   * @return the game state at this vertex.  Must not be modified.
   */
  public S getState()
  {
    return vertex().mState;
  }

  /**
   * @return the payoff of this vertex's state if it is terminal, otherwise null.
   */
  public P getTerminalPayoff()
  {
    return vertex().mTerminalPayoff;
  }

  public boolean isTerminal()
  {
    return vertex().mTerminalPayoff != null;
  }

  /**
   * @return the proven payoff of this vertex, or null if not yet proven.  Terminal vertices are proven from creation.
   */
  public P getProvenPayoff()
  {
    return vertex().mProvenPayoff;
  }

  /**
   * Record a proven payoff for this vertex.
   *
   * @param xiPayoff - the payoff.
   */
  public void setProvenPayoff(P xiPayoff)
  {
    vertex().mProvenPayoff = xiPayoff;
  }

  /**
   * @return whether every route out of this vertex has been found to lead back into a cycle.
   */
  public boolean isCyclic()
  {
    return vertex().mCyclic;
  }

  public void markCyclic()
  {
    vertex().mCyclic = true;
  }

  /**
   * @return whether this vertex's children have been enumerated.
   */
  public boolean isExpanded()
  {
    return vertex().mExpanded.get();
  }

  /**
   * Mark this vertex as expanded.  The caller must hold the graph's mutation lock.
   *
   * @return whether the vertex was already expanded.
   */
  public boolean markExpanded()
  {
    assert(mGraph.checkMutationOwnership());
    return vertex().mExpanded.getAndSet(true);
  }

  public int getNumChildren()
  {
    return vertex().mChildren.size();
  }

  /**
   * @return the child edge at the specified index.
   *
   * @param xiIndex - the index, in order of creation.
   */
  public EdgeRef<S, A, P> getChild(int xiIndex)
  {
    return mGraph.getEdge(vertex().mChildren.get(xiIndex));
  }

  /**
   * @return a snapshot of this vertex's child edges.
   */
  public List<EdgeRef<S, A, P>> getChildren()
  {
    Vertex<S, P> lVertex = vertex();
    List<EdgeRef<S, A, P>> lChildren = new ArrayList<>(lVertex.mChildren.size());
    for (int lii = 0; lii < lVertex.mChildren.size(); lii++)
    {
      lChildren.add(mGraph.getEdge(lVertex.mChildren.get(lii)));
    }
    return lChildren;
  }

  public int getNumParents()
  {
    return vertex().mParents.size();
  }

  /**
   * @return a snapshot of the edges that lead to this vertex.  Edges with a cyclic target are not included.
   */
  public List<EdgeRef<S, A, P>> getParents()
  {
    Vertex<S, P> lVertex = vertex();
    List<EdgeRef<S, A, P>> lParents = new ArrayList<>(lVertex.mParents.size());
    for (int lii = 0; lii < lVertex.mParents.size(); lii++)
    {
      lParents.add(mGraph.getEdge(lVertex.mParents.get(lii)));
    }
    return lParents;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof VertexRef))
    {
      return false;
    }
    VertexRef<?, ?, ?> lOther = (VertexRef<?, ?, ?>)xiOther;
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
    return "Vertex " + mId;
  }
}
