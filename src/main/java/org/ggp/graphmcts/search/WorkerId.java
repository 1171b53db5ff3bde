package org.ggp.graphmcts.search;

import org.ggp.graphmcts.graph.AtomicTraversals;

/**
 * Identifies a search worker.  Each concurrently active worker must have a distinct id, because the id selects the
 * worker's bit in every edge's traversal lanes.
 */
public final class WorkerId
{
  private final int mIndex;

  /**
   * Create a worker id.
   *
   * @param xiIndex - the index, below {@link AtomicTraversals#MAX_WORKERS}.
   */
  public WorkerId(int xiIndex)
  {
    if ((xiIndex < 0) || (xiIndex >= AtomicTraversals.MAX_WORKERS))
    {
      throw new IllegalArgumentException("Worker index " + xiIndex + " out of range");
    }
    mIndex = xiIndex;
  }

  public int getIndex()
  {
    return mIndex;
  }

  @Override
  public boolean equals(Object xiOther)
  {
    return (xiOther instanceof WorkerId) && (((WorkerId)xiOther).mIndex == mIndex);
  }

  @Override
  public int hashCode()
  {
    return mIndex;
  }

  @Override
  public String toString()
  {
    return "worker " + mIndex;
  }
}
