package org.ggp.graphmcts.search.exceptions;

import java.util.Arrays;

import org.ggp.graphmcts.search.Epoch;
import org.ggp.graphmcts.search.WorkerId;

/**
 * A rollout tried to traverse an edge it had already traversed in the same pass.
 *
 * The pass is discarded.  Statistics already applied by earlier passes stand.
 */
@SuppressWarnings("serial")
public class CycleException extends SearchException
{
  private final Epoch    mEpoch;
  private final WorkerId mWorker;
  private final int[]    mPath;

  /**
   * Create an exception.
   *
   * @param xiEpoch  - the epoch of the failed pass.
   * @param xiWorker - the worker that ran it.
   * @param xiPath   - ids of the edges traversed, ending with the repeated one.
   */
  public CycleException(Epoch xiEpoch, WorkerId xiWorker, int[] xiPath)
  {
    super(xiWorker + " revisited edge " + xiPath[xiPath.length - 1] + " in " + xiEpoch + ", path " +
          Arrays.toString(xiPath));
    mEpoch = xiEpoch;
    mWorker = xiWorker;
    mPath = xiPath;
  }

  public Epoch getEpoch()
  {
    return mEpoch;
  }

  public WorkerId getWorker()
  {
    return mWorker;
  }

  /**
   * @return ids of the edges traversed before the pass was abandoned, ending with the repeated edge.
   */
  public int[] getPath()
  {
    return mPath.clone();
  }
}
