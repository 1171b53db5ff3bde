package org.ggp.graphmcts.graph;

import java.util.Collection;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.graphmcts.game.Game;
import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.pool.GrowablePool;
import org.ggp.graphmcts.graph.pool.Pool;
import org.ggp.graphmcts.graph.pool.Pool.ObjectAllocator;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.hash.TObjectIntHashMap;
import gnu.trove.set.hash.TIntHashSet;

/**
 * A deduplicated, directed graph of game states.
 *
 * Each distinct state has exactly one vertex (found via the transposition table).  Each vertex has one outgoing edge
 * per distinct successor state.  Edges are created unexpanded and resolved, once, when their action is first
 * applied.  An edge which would close a loop is resolved as a cycle and is not recorded as a parent of its target,
 * so the graph formed by the expanded edges alone is acyclic.
 *
 * Vertices and edges live in pools and are addressed by integer id.  Callers navigate with {@link VertexRef} and
 * {@link EdgeRef} handles.
 *
 * Threading: any number of threads may navigate the graph and update edge statistics while holding the read lock.
 * Structural changes (creating vertices and edges, resolving edges, pruning) require the mutation lock, which
 * excludes all readers.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public class SearchGraph<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final int NO_VERTEX = -1;

  /**
   * Utility class for allocating vertices from a pool.
   */
  private static class VertexAllocator<S, P> implements ObjectAllocator<Vertex<S, P>>
  {
    @Override
    public Vertex<S, P> newObject(int xiPoolIndex)
    {
      return new Vertex<>(xiPoolIndex);
    }

    @Override
    public void resetObject(Vertex<S, P> xiVertex, boolean xiFree)
    {
      xiVertex.reset();
    }
  }

  /**
   * Utility class for allocating edges from a pool.
   */
  private static class EdgeAllocator<A, P extends Payoff<P>> implements ObjectAllocator<Edge<A, P>>
  {
    @Override
    public Edge<A, P> newObject(int xiPoolIndex)
    {
      return new Edge<>(xiPoolIndex);
    }

    @Override
    public void resetObject(Edge<A, P> xiEdge, boolean xiFree)
    {
      xiEdge.reset();
    }
  }

  private final Game<S, A, P>                mGame;
  private final Pool<Vertex<S, P>>           mVertexPool;
  private final Pool<Edge<A, P>>             mEdgePool;
  private final VertexAllocator<S, P>        mVertexAllocator = new VertexAllocator<>();
  private final EdgeAllocator<A, P>          mEdgeAllocator = new EdgeAllocator<>();

  // Transposition table, mapping states to vertex ids.
  private final TObjectIntHashMap<S>         mPositions;

  private final ReentrantReadWriteLock       mLock = new ReentrantReadWriteLock();

  // Counters.  Only written with the mutation lock held.
  private int                                mNumTranspositions = 0;
  private int                                mNumCycles = 0;

  /**
   * Create an empty search graph.
   *
   * @param xiGame            - the game whose states the graph holds.
   * @param xiInitialCapacity - number of vertices to allow for before growing.
   */
  public SearchGraph(Game<S, A, P> xiGame, int xiInitialCapacity)
  {
    mGame = xiGame;
    mVertexPool = new GrowablePool<>(xiInitialCapacity);
    mEdgePool = new GrowablePool<>(xiInitialCapacity * 4);
    mPositions = new TObjectIntHashMap<>(xiInitialCapacity, 0.5f, NO_VERTEX);
  }

  public Game<S, A, P> getGame()
  {
    return mGame;
  }

  /**
   * Take the mutation lock, waiting for all readers to finish.
   */
  public void lockForMutation()
  {
    mLock.writeLock().lock();
  }

  public void unlockForMutation()
  {
    mLock.writeLock().unlock();
  }

  /**
   * Take the read lock.  Many threads may hold it at once.
   */
  public void lockForReading()
  {
    mLock.readLock().lock();
  }

  public void unlockForReading()
  {
    mLock.readLock().unlock();
  }

  /**
   * Check that the calling thread holds the mutation lock.
   *
   * @return true, always.
   */
  public boolean checkMutationOwnership()
  {
    assert(mLock.isWriteLockedByCurrentThread()) :
                        Thread.currentThread().getName() + " can't modify the graph without holding the mutation lock";
    return true;
  }

  Vertex<S, P> vertex(int xiId)
  {
    return mVertexPool.get(xiId);
  }

  Edge<A, P> edge(int xiId)
  {
    return mEdgePool.get(xiId);
  }

  /**
   * @return a handle to the vertex with the specified id, which must exist.
   *
   * @param xiId - the vertex id.
   */
  public VertexRef<S, A, P> getVertex(int xiId)
  {
    assert(mVertexPool.isAllocated(xiId)) : "No vertex " + xiId;
    return new VertexRef<>(this, xiId);
  }

  /**
   * @return a handle to the edge with the specified id, which must exist.
   *
   * @param xiId - the edge id.
   */
  public EdgeRef<S, A, P> getEdge(int xiId)
  {
    assert(mEdgePool.isAllocated(xiId)) : "No edge " + xiId;
    return new EdgeRef<>(this, xiId);
  }

  /**
   * @return the vertex for the specified state, or null if the state isn't in the graph.
   *
   * @param xiState - the state.
   */
  public VertexRef<S, A, P> findVertex(S xiState)
  {
    int lId = mPositions.get(xiState);
    return (lId == NO_VERTEX) ? null : getVertex(lId);
  }

  /**
   * Find the vertex for a state, creating an (unexpanded) one if it doesn't already exist.  The caller must hold the
   * mutation lock.
   *
   * @param xiState - the state, which the graph takes ownership of.
   *
   * @return the vertex.
   */
  public VertexRef<S, A, P> findOrCreateRoot(S xiState)
  {
    assert(checkMutationOwnership());

    int lId = mPositions.get(xiState);
    if (lId == NO_VERTEX)
    {
      lId = createVertex(xiState);
    }
    return getVertex(lId);
  }

  private int createVertex(S xiState)
  {
    Vertex<S, P> lVertex = mVertexPool.allocate(mVertexAllocator);
    lVertex.mState = xiState;
    lVertex.mTerminalPayoff = mGame.payoffOf(xiState);
    lVertex.mProvenPayoff = lVertex.mTerminalPayoff;
    mPositions.put(xiState, lVertex.mId);
    return lVertex.mId;
  }

  /**
   * Add an unexpanded edge to a vertex.  The caller must hold the mutation lock.
   *
   * @param xiVertex - the source vertex.
   * @param xiAction - the action the edge represents.
   *
   * @return the new edge.
   */
  public EdgeRef<S, A, P> appendChild(VertexRef<S, A, P> xiVertex, A xiAction)
  {
    assert(checkMutationOwnership());

    Edge<A, P> lEdge = mEdgePool.allocate(mEdgeAllocator);
    lEdge.mSourceId = xiVertex.getId();
    lEdge.mAction = xiAction;
    lEdge.mStatistics = mGame.newStatistics();
    vertex(xiVertex.getId()).mChildren.add(lEdge.mId);
    return getEdge(lEdge.mId);
  }

  /**
   * Resolve an unexpanded edge to the vertex for the state its action leads to.  The caller must hold the mutation
   * lock.
   *
   * If the state isn't yet in the graph, a new (unexpanded) vertex is created.  If it is, and the edge's source can
   * be reached from it, the edge is resolved as a cycle.
   *
   * @param xiEdge      - the edge, which must be unexpanded.
   * @param xiNextState - the state reached by applying the edge's action.  The graph takes ownership of it.
   *
   * @return the edge's new target.
   */
  public Target resolveEdge(EdgeRef<S, A, P> xiEdge, S xiNextState)
  {
    assert(checkMutationOwnership());

    Edge<A, P> lEdge = edge(xiEdge.getId());
    if (!lEdge.mTarget.isUnexpanded())
    {
      throw new IllegalStateException("Edge " + lEdge.mId + " has already been resolved to " + lEdge.mTarget);
    }

    Target lTarget;
    int lExisting = mPositions.get(xiNextState);
    if (lExisting == NO_VERTEX)
    {
      lTarget = Target.expanded(createVertex(xiNextState));
    }
    else if (pathExists(lExisting, lEdge.mSourceId))
    {
      LOGGER.debug("Edge " + lEdge.mId + " closes a cycle through vertex " + lExisting);
      mNumCycles++;
      lTarget = Target.cycle(lExisting);
    }
    else
    {
      mNumTranspositions++;
      lTarget = Target.expanded(lExisting);
    }

    if (lTarget.getKind() == Target.Kind.EXPANDED)
    {
      vertex(lTarget.getVertexId()).mParents.add(lEdge.mId);
    }
    lEdge.mTarget = lTarget;
    return lTarget;
  }

  /**
   * @return whether there is a path of expanded edges from one vertex to another.  A vertex always reaches itself.
   *
   * @param xiFrom - the start vertex.
   * @param xiTo   - the destination vertex.
   */
  public boolean pathExists(VertexRef<S, A, P> xiFrom, VertexRef<S, A, P> xiTo)
  {
    return pathExists(xiFrom.getId(), xiTo.getId());
  }

  private boolean pathExists(int xiFrom, int xiTo)
  {
    TIntHashSet lVisited = new TIntHashSet();
    TIntArrayList lStack = new TIntArrayList();
    lStack.add(xiFrom);
    lVisited.add(xiFrom);

    while (!lStack.isEmpty())
    {
      int lVertexId = lStack.removeAt(lStack.size() - 1);
      if (lVertexId == xiTo)
      {
        return true;
      }

      TIntArrayList lChildren = vertex(lVertexId).mChildren;
      for (int lii = 0; lii < lChildren.size(); lii++)
      {
        Target lTarget = edge(lChildren.get(lii)).mTarget;
        if ((lTarget.getKind() == Target.Kind.EXPANDED) && lVisited.add(lTarget.getVertexId()))
        {
          lStack.add(lTarget.getVertexId());
        }
      }
    }

    return false;
  }

  /**
   * Remove every vertex and edge that can't be reached from the specified roots.  The caller must hold the mutation
   * lock.  Ids of the surviving vertices and edges are unchanged.
   *
   * @param xiKeepRoots - the vertices to keep, together with everything reachable from them.
   */
  public void prune(Collection<VertexRef<S, A, P>> xiKeepRoots)
  {
    assert(checkMutationOwnership());

    // Mark everything reachable from the roots, following cyclic edges too.
    TIntHashSet lReachable = new TIntHashSet();
    TIntArrayList lStack = new TIntArrayList();
    for (VertexRef<S, A, P> lRoot : xiKeepRoots)
    {
      if (lReachable.add(lRoot.getId()))
      {
        lStack.add(lRoot.getId());
      }
    }

    while (!lStack.isEmpty())
    {
      TIntArrayList lChildren = vertex(lStack.removeAt(lStack.size() - 1)).mChildren;
      for (int lii = 0; lii < lChildren.size(); lii++)
      {
        Target lTarget = edge(lChildren.get(lii)).mTarget;
        if (!lTarget.isUnexpanded() && lReachable.add(lTarget.getVertexId()))
        {
          lStack.add(lTarget.getVertexId());
        }
      }
    }

    // An edge survives exactly when its source does.
    int lFreedEdges = 0;
    for (int lii = 0; lii < mEdgePool.getHighWaterMark(); lii++)
    {
      if (mEdgePool.isAllocated(lii) && !lReachable.contains(mEdgePool.get(lii).mSourceId))
      {
        mEdgePool.free(mEdgeAllocator, lii);
        lFreedEdges++;
      }
    }

    int lFreedVertices = 0;
    for (int lii = 0; lii < mVertexPool.getHighWaterMark(); lii++)
    {
      if (!mVertexPool.isAllocated(lii))
      {
        continue;
      }

      Vertex<S, P> lVertex = mVertexPool.get(lii);
      if (lReachable.contains(lii))
      {
        // Drop references to parents that have gone.
        for (int lParent = lVertex.mParents.size() - 1; lParent >= 0; lParent--)
        {
          if (!mEdgePool.isAllocated(lVertex.mParents.get(lParent)))
          {
            lVertex.mParents.removeAt(lParent);
          }
        }
      }
      else
      {
        mPositions.remove(lVertex.mState);
        mVertexPool.free(mVertexAllocator, lii);
        lFreedVertices++;
      }
    }

    LOGGER.info("Pruned " + lFreedVertices + " vertices and " + lFreedEdges + " edges, leaving " +
                mVertexPool.getNumItemsInUse() + " vertices and " + mEdgePool.getNumItemsInUse() + " edges");
  }

  public int getNumVertices()
  {
    return mVertexPool.getNumItemsInUse();
  }

  public int getNumEdges()
  {
    return mEdgePool.getNumItemsInUse();
  }

  /**
   * @return the number of edges resolved to a vertex that already existed (excluding cycles).
   */
  public int getNumTranspositions()
  {
    return mNumTranspositions;
  }

  /**
   * @return the number of edges resolved as cycles.
   */
  public int getNumCycles()
  {
    return mNumCycles;
  }

  /**
   * Check the structural consistency of the whole graph.  Expensive - for testing and debugging only.  The caller
   * must hold either lock.
   *
   * @throws IllegalStateException if the graph is inconsistent.
   */
  public void validate()
  {
    if (mPositions.size() != mVertexPool.getNumItemsInUse())
    {
      throw new IllegalStateException("Transposition table has " + mPositions.size() + " entries for " +
                                      mVertexPool.getNumItemsInUse() + " vertices");
    }

    for (int lii = 0; lii < mVertexPool.getHighWaterMark(); lii++)
    {
      if (!mVertexPool.isAllocated(lii))
      {
        continue;
      }

      Vertex<S, P> lVertex = mVertexPool.get(lii);
      if (mPositions.get(lVertex.mState) != lii)
      {
        throw new IllegalStateException("Vertex " + lii + " is missing from the transposition table");
      }

      for (int lParent : lVertex.mParents.toArray())
      {
        if (!mEdgePool.isAllocated(lParent) || !mEdgePool.get(lParent).mTarget.equals(Target.expanded(lii)))
        {
          throw new IllegalStateException("Vertex " + lii + " has bad parent edge " + lParent);
        }
      }

      for (int lChild : lVertex.mChildren.toArray())
      {
        if (!mEdgePool.isAllocated(lChild) || (mEdgePool.get(lChild).mSourceId != lii))
        {
          throw new IllegalStateException("Vertex " + lii + " has bad child edge " + lChild);
        }
      }
    }

    for (int lii = 0; lii < mEdgePool.getHighWaterMark(); lii++)
    {
      if (!mEdgePool.isAllocated(lii))
      {
        continue;
      }

      Edge<A, P> lEdge = mEdgePool.get(lii);
      if (!mVertexPool.isAllocated(lEdge.mSourceId) || !mVertexPool.get(lEdge.mSourceId).mChildren.contains(lii))
      {
        throw new IllegalStateException("Edge " + lii + " has bad source " + lEdge.mSourceId);
      }

      Target lTarget = lEdge.mTarget;
      if (!lTarget.isUnexpanded())
      {
        if (!mVertexPool.isAllocated(lTarget.getVertexId()))
        {
          throw new IllegalStateException("Edge " + lii + " leads to missing vertex " + lTarget.getVertexId());
        }
        boolean lIsParent = mVertexPool.get(lTarget.getVertexId()).mParents.contains(lii);
        if (lIsParent != (lTarget.getKind() == Target.Kind.EXPANDED))
        {
          throw new IllegalStateException("Edge " + lii + " to " + lTarget + " has inconsistent parent link");
        }
      }
    }
  }
}
