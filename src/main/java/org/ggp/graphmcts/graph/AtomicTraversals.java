package org.ggp.graphmcts.graph;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-edge record of which workers have traversed the edge in their current pass.
 *
 * There are two lanes - rollout (low 32 bits) and backprop (high 32 bits) - with one bit per worker in each.
 * Marking a lane for a worker sets that worker's bit in the lane and clears it in the other lane, in a single atomic
 * update, so for any one worker the lanes are mutually exclusive.
 */
public class AtomicTraversals
{
  /**
   * The number of workers that can be tracked.
   */
  public static final int MAX_WORKERS = 32;

  private static final int BACKPROP_SHIFT = 32;

  private final AtomicLong mBits = new AtomicLong();

  private static long rolloutBit(int xiWorker)
  {
    assert(xiWorker >= 0 && xiWorker < MAX_WORKERS) : "Invalid worker " + xiWorker;
    return 1L << xiWorker;
  }

  private static long backpropBit(int xiWorker)
  {
    return rolloutBit(xiWorker) << BACKPROP_SHIFT;
  }

  private boolean mark(long xiSet, long xiClear)
  {
    long lOld;
    do
    {
      lOld = mBits.get();
    }
    while (!mBits.compareAndSet(lOld, (lOld | xiSet) & ~xiClear));

    return (lOld & xiSet) != 0;
  }

  /**
   * Record a rollout traversal by the specified worker.
   *
   * @param xiWorker - the worker.
   *
   * @return whether the worker had already marked this edge in its rollout lane.
   */
  public boolean markRolloutTraversal(int xiWorker)
  {
    return mark(rolloutBit(xiWorker), backpropBit(xiWorker));
  }

  /**
   * Record a backprop traversal by the specified worker.
   *
   * @param xiWorker - the worker.
   *
   * @return whether the worker had already marked this edge in its backprop lane.
   */
  public boolean markBackpropTraversal(int xiWorker)
  {
    return mark(backpropBit(xiWorker), rolloutBit(xiWorker));
  }

  /**
   * Clear both of the specified worker's lanes.
   *
   * @param xiWorker - the worker.
   */
  public void clear(int xiWorker)
  {
    mark(0, rolloutBit(xiWorker) | backpropBit(xiWorker));
  }

  public boolean isRolloutTraversed(int xiWorker)
  {
    return (mBits.get() & rolloutBit(xiWorker)) != 0;
  }

  public boolean isBackpropTraversed(int xiWorker)
  {
    return (mBits.get() & backpropBit(xiWorker)) != 0;
  }

  void reset()
  {
    mBits.set(0);
  }
}
