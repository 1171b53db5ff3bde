package org.ggp.graphmcts.search;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.Target;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.exceptions.SelectorException;
import org.ggp.graphmcts.search.policy.BackpropSelector;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;

/**
 * The backpropagation phase of an iteration: fold a new payoff into the statistics of the edges above the point
 * where it was observed.
 *
 * Propagation proceeds a level at a time.  For each vertex on the frontier, the backprop selector picks which parent
 * edges to credit.  The picks for the whole level are made before any of them is updated, so that they're judged
 * against unmodified siblings.  Each vertex is visited at most once per pass, however many routes lead to it.
 *
 * There is no explicit player toggle: the selector judges each parent edge from the viewpoint of the player to move
 * at that edge's source.
 *
 * Edges resolved as cycles are never parents of their targets, so a payoff credited to such an edge goes no further.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public class Backprop<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final BackpropSelector<S, A, P> mSelector;

  /**
   * Create a backprop phase.
   *
   * @param xiSelector - strategy for choosing which parents to propagate through.
   */
  public Backprop(BackpropSelector<S, A, P> xiSelector)
  {
    mSelector = xiSelector;
  }

  /**
   * Propagate a payoff observed through an edge.  The caller must hold the graph's read lock.
   *
   * @param xiEdge     - the edge.  It is always credited.
   * @param xiPayoff   - the payoff.
   * @param xiSettings - settings for the current round.
   * @param xiWorker   - the worker running this pass.
   * @param xoMarked   - ids of edges marked in the worker's backprop lane.  The caller must clear them.
   *
   * @throws SelectorException if the backprop selector failed.
   */
  public void fromEdge(EdgeRef<S, A, P> xiEdge,
                       P xiPayoff,
                       SearchSettings xiSettings,
                       WorkerId xiWorker,
                       TIntArrayList xoMarked) throws SelectorException
  {
    xiEdge.getTraversals().markBackpropTraversal(xiWorker.getIndex());
    xoMarked.add(xiEdge.getId());
    xiEdge.getStatistics().increment(xiPayoff);

    VertexRef<S, A, P> lSource = xiEdge.getSource();
    if (xiEdge.getTarget().getKind() == Target.Kind.CYCLE)
    {
      LOGGER.debug("Absorbed payoff at cyclic " + xiEdge);
    }
    else
    {
      propagate(lSource, xiPayoff, xiSettings, xiWorker, xoMarked);
    }

    updateProvenStatus(lSource);
  }

  /**
   * Propagate a payoff observed at a vertex (because its payoff is known).  The caller must hold the graph's read
   * lock.
   *
   * @param xiVertex   - the vertex.
   * @param xiPayoff   - the payoff.
   * @param xiSettings - settings for the current round.
   * @param xiWorker   - the worker running this pass.
   * @param xoMarked   - ids of edges marked in the worker's backprop lane.  The caller must clear them.
   *
   * @throws SelectorException if the backprop selector failed.
   */
  public void fromVertex(VertexRef<S, A, P> xiVertex,
                         P xiPayoff,
                         SearchSettings xiSettings,
                         WorkerId xiWorker,
                         TIntArrayList xoMarked) throws SelectorException
  {
    propagate(xiVertex, xiPayoff, xiSettings, xiWorker, xoMarked);
    updateProvenStatus(xiVertex);
  }

  private void propagate(VertexRef<S, A, P> xiStart,
                         P xiPayoff,
                         SearchSettings xiSettings,
                         WorkerId xiWorker,
                         TIntArrayList xoMarked) throws SelectorException
  {
    TIntHashSet lVisited = new TIntHashSet();
    List<VertexRef<S, A, P>> lFrontier = new ArrayList<>();
    lFrontier.add(xiStart);

    while (!lFrontier.isEmpty())
    {
      // Decide on the whole level first.
      List<EdgeRef<S, A, P>> lIncluded = new ArrayList<>();
      for (VertexRef<S, A, P> lVertex : lFrontier)
      {
        if (!lVisited.add(lVertex.getId()))
        {
          continue;
        }

        for (EdgeRef<S, A, P> lParent : mSelector.selectParents(lVertex, xiSettings))
        {
          if (!lParent.getTraversals().markBackpropTraversal(xiWorker.getIndex()))
          {
            xoMarked.add(lParent.getId());
            lIncluded.add(lParent);
          }
        }
      }

      // Then update it.
      List<VertexRef<S, A, P>> lNextFrontier = new ArrayList<>(lIncluded.size());
      for (EdgeRef<S, A, P> lParent : lIncluded)
      {
        lParent.getStatistics().increment(xiPayoff);
        lNextFrontier.add(lParent.getSource());
      }
      lFrontier = lNextFrontier;
    }
  }

  /**
   * Re-derive the proven status of a vertex from its children, and carry any change up to its ancestors.
   *
   * A vertex is proven once every child leads to a proven vertex; its proven payoff is then the per-player maximum
   * of theirs.  A vertex is cyclic once every child is cyclic.
   *
   * @param xiVertex - the vertex whose children may have changed.
   */
  void updateProvenStatus(VertexRef<S, A, P> xiVertex)
  {
    TIntHashSet lQueued = new TIntHashSet();
    List<VertexRef<S, A, P>> lStack = new ArrayList<>();
    lStack.add(xiVertex);
    lQueued.add(xiVertex.getId());

    while (!lStack.isEmpty())
    {
      VertexRef<S, A, P> lVertex = lStack.remove(lStack.size() - 1);
      if (!lVertex.isExpanded() || (lVertex.getNumChildren() == 0))
      {
        continue;
      }

      boolean lChanged = false;
      List<EdgeRef<S, A, P>> lChildren = lVertex.getChildren();

      if (lVertex.getProvenPayoff() == null)
      {
        P lMax = null;
        for (EdgeRef<S, A, P> lChild : lChildren)
        {
          P lChildPayoff = null;
          if (lChild.getTarget().getKind() == Target.Kind.EXPANDED)
          {
            lChildPayoff = lChild.getTargetVertex().getProvenPayoff();
          }

          if (lChildPayoff == null)
          {
            lMax = null;
            break;
          }
          lMax = (lMax == null) ? lChildPayoff : lMax.max(lChildPayoff);
        }

        if (lMax != null)
        {
          LOGGER.debug(lVertex + " proven with payoff " + lMax);
          lVertex.setProvenPayoff(lMax);
          lChanged = true;
        }
      }

      if (!lVertex.isCyclic())
      {
        boolean lAllCyclic = true;
        for (EdgeRef<S, A, P> lChild : lChildren)
        {
          if (!lChild.isCyclic())
          {
            lAllCyclic = false;
            break;
          }
        }

        if (lAllCyclic)
        {
          LOGGER.debug(lVertex + " is cyclic");
          lVertex.markCyclic();
          lChanged = true;
        }
      }

      if (lChanged)
      {
        for (EdgeRef<S, A, P> lParent : lVertex.getParents())
        {
          VertexRef<S, A, P> lGrandparent = lParent.getSource();
          if (lQueued.add(lGrandparent.getId()))
          {
            lStack.add(lGrandparent);
          }
        }
      }
    }
  }
}
