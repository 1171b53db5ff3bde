package org.ggp.graphmcts.search.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.policy.UcbException.Kind;

/**
 * UCB1 scoring of child edges.
 *
 * An edge with no visits is always preferred to one with visits.  Otherwise an edge scores
 *
 *   score(player) / visits + bias * sqrt(ln(parentVisits) / visits)
 *
 * where the player is the one to move at the edge's source and parentVisits is the sum of the visits of the source's
 * children.
 *
 * Each edge's statistics are read once, as a payoff snapshot, so that visits and score are consistent with each other
 * even while other workers are updating them.
 */
public final class Ucb
{
  private Ucb()
  {
    // Static utility class.
  }

  /**
   * @return the natural log of the total visits of a set of sibling edges, or 0 if none has been visited.
   *
   * @param xiSiblings - all the children of a vertex.
   */
  public static <S extends GameState<S, A>, A, P extends Payoff<P>>
    double logParentVisits(List<EdgeRef<S, A, P>> xiSiblings)
  {
    long lTotal = 0;
    for (EdgeRef<S, A, P> lSibling : xiSiblings)
    {
      lTotal += lSibling.getStatistics().getVisits();
    }
    return (lTotal == 0) ? 0 : Math.log(lTotal);
  }

  /**
   * @return the UCB1 score of a visited edge.
   *
   * @param xiSnapshot        - snapshot of the edge's statistics, with a non-zero weight.
   * @param xiPlayer          - the player to move at the edge's source.
   * @param xiLogParentVisits - as returned by logParentVisits().
   * @param xiExploreBias     - the exploration bias.
   *
   * @throws UcbException if the score isn't a number.
   */
  public static <P extends Payoff<P>> double score(P xiSnapshot,
                                                   int xiPlayer,
                                                   double xiLogParentVisits,
                                                   double xiExploreBias) throws UcbException
  {
    double lVisits = xiSnapshot.getWeight();
    assert(lVisits > 0);

    double lScore = xiSnapshot.getScore(xiPlayer) / lVisits +
                    xiExploreBias * Math.sqrt(xiLogParentVisits / lVisits);
    if (Double.isNaN(lScore))
    {
      throw new UcbException(Kind.INVALID_COMPUTATION, "UCB score is not a number for " + xiSnapshot);
    }
    return lScore;
  }

  /**
   * Choose the best of a vertex's children.
   *
   * The first unvisited candidate is returned immediately.  Otherwise the candidate with the highest score is chosen,
   * with exact ties broken uniformly at random by reservoir sampling.
   *
   * @param xiVertex      - the vertex.
   * @param xiCandidates  - the children to choose between (all of them, or a subset).
   * @param xiExploreBias - the exploration bias.
   * @param xiRandom      - source of randomness for breaking ties.
   *
   * @return the chosen edge.
   *
   * @throws UcbException if there were no candidates or a score couldn't be computed.
   */
  public static <S extends GameState<S, A>, A, P extends Payoff<P>>
    EdgeRef<S, A, P> findBestChild(VertexRef<S, A, P> xiVertex,
                                   List<EdgeRef<S, A, P>> xiCandidates,
                                   double xiExploreBias,
                                   Random xiRandom) throws UcbException
  {
    if (xiCandidates.isEmpty())
    {
      throw new UcbException(Kind.NO_CHILDREN, xiVertex + " has no children to select from");
    }

    int lPlayer = xiVertex.getState().getActivePlayer();
    double lLogParentVisits = logParentVisits(xiVertex.getChildren());

    EdgeRef<S, A, P> lBest = null;
    double lBestScore = Double.NEGATIVE_INFINITY;
    int lSamplingCount = 0;

    for (EdgeRef<S, A, P> lCandidate : xiCandidates)
    {
      P lSnapshot = lCandidate.getStatistics().asPayoff();
      if (lSnapshot.getWeight() == 0)
      {
        return lCandidate;
      }

      double lScore = score(lSnapshot, lPlayer, lLogParentVisits, xiExploreBias);
      if ((lBest == null) || (lScore > lBestScore))
      {
        lBest = lCandidate;
        lBestScore = lScore;
        lSamplingCount = 1;
      }
      else if (lScore == lBestScore)
      {
        // Replace the current choice with probability 1/k, k being the number of ties seen so far.
        lSamplingCount++;
        if (xiRandom.nextInt(lSamplingCount) == 0)
        {
          lBest = lCandidate;
        }
      }
    }

    return lBest;
  }

  /**
   * @return the children of a vertex which selection should choose between: those not known to lead only into
   * cycles, or every child if there are no such children.
   *
   * @param xiVertex - the vertex.
   */
  public static <S extends GameState<S, A>, A, P extends Payoff<P>>
    List<EdgeRef<S, A, P>> selectionCandidates(VertexRef<S, A, P> xiVertex)
  {
    List<EdgeRef<S, A, P>> lChildren = xiVertex.getChildren();
    List<EdgeRef<S, A, P>> lCandidates = new ArrayList<>(lChildren.size());
    for (EdgeRef<S, A, P> lChild : lChildren)
    {
      if (!lChild.isCyclic())
      {
        lCandidates.add(lChild);
      }
    }

    return lCandidates.isEmpty() ? lChildren : lCandidates;
  }

  /**
   * Test whether an edge is currently a best child of its source, judged against the source's selection candidates.
   *
   * @param xiEdge        - the edge.
   * @param xiExploreBias - the exploration bias.
   *
   * @return whether the edge is a best child.
   *
   * @throws UcbException if a score couldn't be computed.
   *
   * @see #selectionCandidates(VertexRef)
   */
  public static <S extends GameState<S, A>, A, P extends Payoff<P>>
    boolean isBestChild(EdgeRef<S, A, P> xiEdge, double xiExploreBias) throws UcbException
  {
    return isBestChild(xiEdge, selectionCandidates(xiEdge.getSource()), xiExploreBias);
  }

  /**
   * Test whether an edge is currently a best child among a set of its siblings.
   *
   * An edge outside the set never is.  Otherwise an unvisited edge always is, and a visited edge is a best child if
   * no candidate is unvisited and no candidate scores strictly higher.
   *
   * @param xiEdge        - the edge.
   * @param xiCandidates  - the siblings to judge it against.
   * @param xiExploreBias - the exploration bias.
   *
   * @return whether the edge is a best child.
   *
   * @throws UcbException if a score couldn't be computed.
   */
  public static <S extends GameState<S, A>, A, P extends Payoff<P>>
    boolean isBestChild(EdgeRef<S, A, P> xiEdge,
                        List<EdgeRef<S, A, P>> xiCandidates,
                        double xiExploreBias) throws UcbException
  {
    if (!xiCandidates.contains(xiEdge))
    {
      return false;
    }

    if (xiEdge.getStatistics().getVisits() == 0)
    {
      return true;
    }

    VertexRef<S, A, P> lSource = xiEdge.getSource();
    int lPlayer = lSource.getState().getActivePlayer();
    double lLogParentVisits = logParentVisits(lSource.getChildren());

    // Take every snapshot up front so that the edge is judged against one consistent set of siblings.
    List<P> lSnapshots = new ArrayList<>(xiCandidates.size());
    for (EdgeRef<S, A, P> lCandidate : xiCandidates)
    {
      lSnapshots.add(lCandidate.getStatistics().asPayoff());
    }

    double lEdgeScore = Double.NaN;
    double lBestScore = Double.NEGATIVE_INFINITY;
    for (int lii = 0; lii < xiCandidates.size(); lii++)
    {
      boolean lIsEdge = xiCandidates.get(lii).equals(xiEdge);
      P lSnapshot = lSnapshots.get(lii);
      if (lSnapshot.getWeight() == 0)
      {
        // An unvisited sibling outranks every visited edge.
        return lIsEdge;
      }

      double lScore = score(lSnapshot, lPlayer, lLogParentVisits, xiExploreBias);
      if (lIsEdge)
      {
        lEdgeScore = lScore;
      }
      lBestScore = Math.max(lBestScore, lScore);
    }

    assert(!Double.isNaN(lEdgeScore)) : xiEdge + " is not a child of its source";
    return lEdgeScore >= lBestScore;
  }

  /**
   * @return the UCB1 assessment of every child of a vertex, in child order.  Failures are reported per child rather
   * than thrown.
   *
   * @param xiVertex      - the vertex.
   * @param xiExploreBias - the exploration bias.
   */
  public static <S extends GameState<S, A>, A, P extends Payoff<P>>
    List<UcbValue> childValues(VertexRef<S, A, P> xiVertex, double xiExploreBias)
  {
    List<EdgeRef<S, A, P>> lChildren = xiVertex.getChildren();
    int lPlayer = xiVertex.getState().getActivePlayer();
    double lLogParentVisits = logParentVisits(lChildren);

    List<UcbValue> lValues = new ArrayList<>(lChildren.size());
    for (EdgeRef<S, A, P> lChild : lChildren)
    {
      P lSnapshot = lChild.getStatistics().asPayoff();
      if (lSnapshot.getWeight() == 0)
      {
        lValues.add(UcbValue.select());
        continue;
      }

      try
      {
        lValues.add(UcbValue.value(score(lSnapshot, lPlayer, lLogParentVisits, xiExploreBias)));
      }
      catch (UcbException lEx)
      {
        lValues.add(UcbValue.invalid(lEx));
      }
    }
    return lValues;
  }
}
