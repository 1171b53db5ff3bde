package org.ggp.graphmcts.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.ggp.graphmcts.graph.AtomicTraversals;
import org.ggp.graphmcts.search.WorkerId;
import org.ggp.graphmcts.util.MachineSpecificConfiguration.CfgItem;

/**
 * Utility class for controlling threading behaviour.
 */
public class ThreadControl
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * The number of vCPUs available on the system.  (For a hyper-threaded system, each hyper-thread counts as a CPU.)
   */
  public static final int NUM_CPUS = Runtime.getRuntime().availableProcessors();

  /**
   * Whether to perform all iterations synchronously on the calling thread.  Used to disable threading for debugging.
   */
  public static final boolean RUN_SYNCHRONOUSLY = MachineSpecificConfiguration.getCfgBool(CfgItem.RUN_SYNCHRONOUSLY);

  /**
   * The default number of search worker threads.
   *
   * Unless configured otherwise, use half the available vCPUs.  Never more than the number of workers that edge
   * traversal lanes can track.
   */
  public static int WORKER_THREADS;
  static
  {
    if (RUN_SYNCHRONOUSLY)
    {
      // When running synchronously, there's just the 1 worker.
      WORKER_THREADS = 1;
    }
    else
    {
      // Get the configured value.
      int lConfiguredValue = MachineSpecificConfiguration.getCfgInt(CfgItem.WORKER_THREADS);
      if (lConfiguredValue == -1)
      {
        // No configured value - calculate a default.  Use half the available vCPUs.
        WORKER_THREADS = (NUM_CPUS + 1) / 2;
      }
      else
      {
        // Use the configured value.
        WORKER_THREADS = lConfiguredValue;
      }
      WORKER_THREADS = Math.max(1, Math.min(WORKER_THREADS, AtomicTraversals.MAX_WORKERS));
    }
  }

  private ThreadControl()
  {
    // Private default constructor.
  }

  /**
   * Register the calling thread as a search worker, tagging its log output.
   *
   * @param xiWorker - the worker.
   */
  public static void registerWorkerThread(WorkerId xiWorker)
  {
    ThreadContext.put("worker", Integer.toString(xiWorker.getIndex()));
    LOGGER.debug("Registered " + Thread.currentThread().getName() + " as " + xiWorker);
  }
}
