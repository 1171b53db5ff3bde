package org.ggp.graphmcts.search;

import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A fixed set of search workers which together run each round they're given.
 */
public class SearchWorkerPool
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final SearchWorker[] mWorkers;

  /**
   * Create a pool and start its workers.
   *
   * @param xiNumWorkers - the number of workers.
   * @param xiSeeds      - source of seeds for the workers' sources of randomness.
   */
  public SearchWorkerPool(int xiNumWorkers, Random xiSeeds)
  {
    LOGGER.info("Starting " + xiNumWorkers + " search workers");
    mWorkers = new SearchWorker[xiNumWorkers];
    for (int lii = 0; lii < xiNumWorkers; lii++)
    {
      mWorkers[lii] = new SearchWorker(new WorkerId(lii), xiSeeds.nextLong());
      mWorkers[lii].start();
    }
  }

  public int getNumWorkers()
  {
    return mWorkers.length;
  }

  /**
   * Run a round on every worker and wait for them all to finish.
   *
   * @param xiRound - the round.
   *
   * @throws InterruptedException if interrupted while waiting.  The round is abandoned.
   */
  void run(SearchRound<?, ?, ?> xiRound) throws InterruptedException
  {
    xiRound.expectWorkers(mWorkers.length);
    for (SearchWorker lWorker : mWorkers)
    {
      lWorker.submit(xiRound);
    }

    try
    {
      xiRound.awaitWorkers();
    }
    catch (InterruptedException lEx)
    {
      xiRound.abort();
      throw lEx;
    }
  }

  /**
   * Stop all the workers.
   */
  public void stop()
  {
    for (SearchWorker lWorker : mWorkers)
    {
      lWorker.stop();
    }
  }
}
