package org.ggp.graphmcts.search;

import java.util.Random;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.ggp.graphmcts.util.ThreadControl;

/**
 * A search worker, with its own thread, which runs iterations of whatever rounds it is given.
 */
class SearchWorker implements Runnable
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final WorkerId                              mWorkerId;
  private final Random                                mRandom;
  private final Thread                                mThread;
  private final BlockingQueue<SearchRound<?, ?, ?>>   mRounds = new LinkedBlockingQueue<>();

  /**
   * Create a worker.  The worker's thread isn't started until start() is called.
   *
   * @param xiWorkerId - the worker's id, distinct from every other concurrent worker.
   * @param xiSeed     - seed for the worker's source of randomness.
   */
  SearchWorker(WorkerId xiWorkerId, long xiSeed)
  {
    mWorkerId = xiWorkerId;
    mRandom = new Random(xiSeed);
    mThread = new Thread(this, "Search worker " + xiWorkerId.getIndex());
    mThread.setDaemon(true);
  }

  WorkerId getWorkerId()
  {
    return mWorkerId;
  }

  /**
   * Start the worker's thread.
   */
  void start()
  {
    mThread.start();
  }

  /**
   * Queue a round for this worker.  The round must be expecting this worker.
   *
   * @param xiRound - the round.
   */
  void submit(SearchRound<?, ?, ?> xiRound)
  {
    mRounds.add(xiRound);
  }

  /**
   * Stop the worker, waiting (briefly) for its thread to finish.
   */
  void stop()
  {
    mThread.interrupt();
    try
    {
      mThread.join(5000);
    }
    catch (InterruptedException lEx)
    {
      LOGGER.warn("Interrupted whilst waiting for " + mThread.getName() + " to stop");
      Thread.currentThread().interrupt();
    }
  }

  @Override
  public void run()
  {
    ThreadControl.registerWorkerThread(mWorkerId);

    try
    {
      while (!Thread.interrupted())
      {
        SearchRound<?, ?, ?> lRound = mRounds.take();
        ThreadContext.put("epoch", Long.toString(lRound.getEpoch().getValue()));
        try
        {
          lRound.runIterations(mWorkerId, mRandom);
        }
        catch (Exception lEx)
        {
          LOGGER.error("Exception in search worker", lEx);
        }
        finally
        {
          lRound.workerFinished();
        }
      }
    }
    catch (InterruptedException lEx)
    {
      LOGGER.debug(mThread.getName() + " interrupted - stopping");
    }
  }
}
