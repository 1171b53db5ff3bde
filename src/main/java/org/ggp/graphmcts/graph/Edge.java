package org.ggp.graphmcts.graph;

import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.game.Statistics;

/**
 * Storage for one edge of a search graph.  Accessed through {@link EdgeRef}.
 */
final class Edge<A, P extends Payoff<P>>
{
  final int                 mId;
  int                       mSourceId = -1;
  A                         mAction;
  Statistics<P>             mStatistics;
  volatile Target           mTarget = Target.UNEXPANDED;
  final AtomicTraversals    mTraversals = new AtomicTraversals();

  Edge(int xiId)
  {
    mId = xiId;
  }

  void reset()
  {
    mSourceId = -1;
    mAction = null;
    mStatistics = null;
    mTarget = Target.UNEXPANDED;
    mTraversals.reset();
  }
}
