package org.ggp.graphmcts.graph;

import java.util.concurrent.atomic.AtomicBoolean;

import gnu.trove.list.array.TIntArrayList;

/**
 * Storage for one vertex of a search graph.  Accessed through {@link VertexRef}.
 */
final class Vertex<S, P>
{
  final int                 mId;
  S                         mState;
  P                         mTerminalPayoff;
  volatile P                mProvenPayoff;
  volatile boolean          mCyclic;
  final AtomicBoolean       mExpanded = new AtomicBoolean();

  // Ids of outgoing and incoming edges.
  final TIntArrayList       mChildren = new TIntArrayList(4);
  final TIntArrayList       mParents  = new TIntArrayList(1);

  Vertex(int xiId)
  {
    mId = xiId;
  }

  void reset()
  {
    mState = null;
    mTerminalPayoff = null;
    mProvenPayoff = null;
    mCyclic = false;
    mExpanded.set(false);
    mChildren.clear();
    mParents.clear();
  }
}
