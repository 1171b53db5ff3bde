package org.ggp.graphmcts.search;

import org.ggp.graphmcts.graph.AtomicTraversals;
import org.ggp.graphmcts.util.MachineSpecificConfiguration;
import org.ggp.graphmcts.util.MachineSpecificConfiguration.CfgItem;
import org.ggp.graphmcts.util.ThreadControl;

/**
 * Parameters for a search round.  Immutable.
 */
public final class SearchSettings
{
  private final int    mSimulationCount;
  private final double mExploreBias;
  private final int    mIterationCount;
  private final int    mWorkerCount;
  private final long   mRoundTimeLimitMs;

  /**
   * Create single-worker settings with no time limit.
   *
   * @param xiSimulationCount - number of random playouts per simulation.
   * @param xiExploreBias     - UCB1 exploration bias.
   * @param xiIterationCount  - number of iterations per round.
   */
  public SearchSettings(int xiSimulationCount, double xiExploreBias, int xiIterationCount)
  {
    this(xiSimulationCount, xiExploreBias, xiIterationCount, 1, 0);
  }

  /**
   * Create settings.
   *
   * @param xiSimulationCount - number of random playouts per simulation.
   * @param xiExploreBias     - UCB1 exploration bias.
   * @param xiIterationCount  - number of iterations per round, shared between all workers.
   * @param xiWorkerCount     - number of concurrent workers.
   * @param xiRoundTimeLimitMs - wall-clock limit on a round, in milliseconds, or 0 for no limit.
   */
  public SearchSettings(int xiSimulationCount,
                        double xiExploreBias,
                        int xiIterationCount,
                        int xiWorkerCount,
                        long xiRoundTimeLimitMs)
  {
    if (xiSimulationCount < 1)
    {
      throw new IllegalArgumentException("Simulation count must be positive: " + xiSimulationCount);
    }
    if (Double.isNaN(xiExploreBias) || (xiExploreBias < 0))
    {
      throw new IllegalArgumentException("Invalid explore bias: " + xiExploreBias);
    }
    if (xiIterationCount < 0)
    {
      throw new IllegalArgumentException("Iteration count must not be negative: " + xiIterationCount);
    }
    if ((xiWorkerCount < 1) || (xiWorkerCount > AtomicTraversals.MAX_WORKERS))
    {
      throw new IllegalArgumentException("Worker count must be between 1 and " + AtomicTraversals.MAX_WORKERS +
                                         ": " + xiWorkerCount);
    }
    if (xiRoundTimeLimitMs < 0)
    {
      throw new IllegalArgumentException("Time limit must not be negative: " + xiRoundTimeLimitMs);
    }

    mSimulationCount = xiSimulationCount;
    mExploreBias = xiExploreBias;
    mIterationCount = xiIterationCount;
    mWorkerCount = xiWorkerCount;
    mRoundTimeLimitMs = xiRoundTimeLimitMs;
  }

  /**
   * @return settings built from the current configuration.
   */
  public static SearchSettings fromConfiguration()
  {
    return new SearchSettings(MachineSpecificConfiguration.getCfgInt(CfgItem.SIMULATION_COUNT),
                              MachineSpecificConfiguration.getCfgDouble(CfgItem.EXPLORE_BIAS),
                              MachineSpecificConfiguration.getCfgInt(CfgItem.ITERATION_COUNT),
                              ThreadControl.WORKER_THREADS,
                              MachineSpecificConfiguration.getCfgInt(CfgItem.ROUND_TIME_LIMIT_MS));
  }

  public int getSimulationCount()
  {
    return mSimulationCount;
  }

  public double getExploreBias()
  {
    return mExploreBias;
  }

  public int getIterationCount()
  {
    return mIterationCount;
  }

  public int getWorkerCount()
  {
    return mWorkerCount;
  }

  /**
   * @return the wall-clock limit on a round, in milliseconds, or 0 for no limit.
   */
  public long getRoundTimeLimitMs()
  {
    return mRoundTimeLimitMs;
  }

  @Override
  public String toString()
  {
    return "{simulations: " + mSimulationCount + ", bias: " + mExploreBias + ", iterations: " + mIterationCount +
           ", workers: " + mWorkerCount + ", time limit: " + mRoundTimeLimitMs + "ms}";
  }
}
