package org.ggp.graphmcts.search;

import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.SearchGraph;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.exceptions.CycleException;
import org.ggp.graphmcts.search.exceptions.SearchException;
import org.ggp.graphmcts.search.exceptions.SelectorException;
import org.ggp.graphmcts.search.policy.Simulator;

import gnu.trove.list.array.TIntArrayList;

/**
 * One round of search: a budget of iterations shared between any number of workers, all working on the same graph
 * from the same root.
 *
 * The first failure (other than a discarded cycle) stops the round.  Workers finish the iteration they're on and
 * claim no more.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
class SearchRound<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private final SearchGraph<S, A, P>      mGraph;
  private final VertexRef<S, A, P>        mRoot;
  private final SearchSettings            mSettings;
  private final Epoch                     mEpoch;
  private final Rollout<S, A, P>          mRollout;
  private final Expansion<S, A, P>        mExpansion;
  private final Simulator<S, A, P>        mSimulator;
  private final Backprop<S, A, P>         mBackprop;

  private final AtomicInteger             mIterationsRemaining;
  private final long                      mDeadline;
  private final AtomicInteger             mNumCompleted = new AtomicInteger();
  private final AtomicInteger             mNumDiscarded = new AtomicInteger();
  private final AtomicReference<Throwable> mFailure = new AtomicReference<>();
  private volatile boolean                mAborted = false;
  private CountDownLatch                  mWorkersRunning;

  SearchRound(SearchGraph<S, A, P> xiGraph,
              VertexRef<S, A, P> xiRoot,
              SearchSettings xiSettings,
              Epoch xiEpoch,
              Rollout<S, A, P> xiRollout,
              Expansion<S, A, P> xiExpansion,
              Simulator<S, A, P> xiSimulator,
              Backprop<S, A, P> xiBackprop)
  {
    mGraph = xiGraph;
    mRoot = xiRoot;
    mSettings = xiSettings;
    mEpoch = xiEpoch;
    mRollout = xiRollout;
    mExpansion = xiExpansion;
    mSimulator = xiSimulator;
    mBackprop = xiBackprop;

    mIterationsRemaining = new AtomicInteger(xiSettings.getIterationCount());
    mDeadline = (xiSettings.getRoundTimeLimitMs() == 0) ? 0 :
                                                 System.currentTimeMillis() + xiSettings.getRoundTimeLimitMs();
  }

  Epoch getEpoch()
  {
    return mEpoch;
  }

  private boolean claimIteration()
  {
    if (mAborted)
    {
      return false;
    }

    if ((mDeadline != 0) && (System.currentTimeMillis() >= mDeadline))
    {
      return false;
    }

    return mIterationsRemaining.getAndDecrement() > 0;
  }

  /**
   * Run iterations until the budget is exhausted or the round is abandoned.
   *
   * @param xiWorker - the calling worker.
   * @param xiRandom - the worker's source of randomness.
   */
  void runIterations(WorkerId xiWorker, Random xiRandom)
  {
    while (claimIteration())
    {
      try
      {
        iterate(xiWorker, xiRandom);
        mNumCompleted.incrementAndGet();
      }
      catch (CycleException lEx)
      {
        mNumDiscarded.incrementAndGet();
        LOGGER.debug("Discarding pass: " + lEx.getMessage());
      }
      catch (SelectorException | RuntimeException | Error lEx)
      {
        fail(lEx);
      }
    }
  }

  /**
   * Run a single Rollout - Expansion - Simulation - Backprop iteration.
   */
  private void iterate(WorkerId xiWorker, Random xiRandom) throws CycleException, SelectorException
  {
    TIntArrayList lPath = new TIntArrayList();
    TIntArrayList lMarked = new TIntArrayList();

    try
    {
      Rollout.Result<S, A, P> lResult;
      mGraph.lockForReading();
      try
      {
        lResult = mRollout.descend(mRoot, mSettings, mEpoch, xiWorker, xiRandom, lPath);
      }
      finally
      {
        mGraph.unlockForReading();
      }

      switch (lResult.getKind())
      {
        case KNOWN_PAYOFF:
        {
          mGraph.lockForReading();
          try
          {
            VertexRef<S, A, P> lVertex = lResult.getVertex();
            mBackprop.fromVertex(lVertex, lVertex.getProvenPayoff(), mSettings, xiWorker, lMarked);
          }
          finally
          {
            mGraph.unlockForReading();
          }
        }
        break;

        case UNEXPANDED_VERTEX:
        {
          Expansion.Outcome<S, A, P> lOutcome = mExpansion.expandVertex(lResult.getVertex());
          P lPayoff = payoffOf(lOutcome, xiRandom);
          mGraph.lockForReading();
          try
          {
            mBackprop.fromVertex(lOutcome.getVertex(), lPayoff, mSettings, xiWorker, lMarked);
          }
          finally
          {
            mGraph.unlockForReading();
          }
        }
        break;

        case UNEXPANDED_EDGE:
        {
          Expansion.Outcome<S, A, P> lOutcome = mExpansion.expandEdge(lResult.getEdge());
          P lPayoff = payoffOf(lOutcome, xiRandom);
          mGraph.lockForReading();
          try
          {
            mBackprop.fromEdge(lResult.getEdge(), lPayoff, mSettings, xiWorker, lMarked);
          }
          finally
          {
            mGraph.unlockForReading();
          }
        }
        break;

        default:
          throw new IllegalStateException("Unexpected rollout result " + lResult.getKind());
      }
    }
    finally
    {
      clearTraversals(xiWorker, lPath);
      clearTraversals(xiWorker, lMarked);
    }
  }

  /**
   * @return the payoff to backpropagate for an expansion, simulating if it doesn't supply one.  Called without any
   * lock held.
   */
  private P payoffOf(Expansion.Outcome<S, A, P> xiOutcome, Random xiRandom) throws SelectorException
  {
    P lPayoff = xiOutcome.getPayoff();
    if (lPayoff == null)
    {
      assert(xiOutcome.isFresh());
      lPayoff = mSimulator.simulate(mGraph.getGame(), xiOutcome.getState(), mSettings.getSimulationCount(), xiRandom);
    }
    return lPayoff;
  }

  private void clearTraversals(WorkerId xiWorker, TIntArrayList xiEdges)
  {
    if (xiEdges.isEmpty())
    {
      return;
    }

    mGraph.lockForReading();
    try
    {
      for (int lii = 0; lii < xiEdges.size(); lii++)
      {
        mGraph.getEdge(xiEdges.get(lii)).getTraversals().clear(xiWorker.getIndex());
      }
    }
    finally
    {
      mGraph.unlockForReading();
    }
  }

  private void fail(Throwable xiFailure)
  {
    if (mFailure.compareAndSet(null, xiFailure))
    {
      LOGGER.warn("Abandoning search round in " + mEpoch, xiFailure);
    }
    mAborted = true;
  }

  /**
   * Stop claiming iterations.
   */
  void abort()
  {
    mAborted = true;
  }

  /**
   * Prepare for the specified number of workers to run this round concurrently.
   *
   * @param xiNumWorkers - the number of workers.
   */
  void expectWorkers(int xiNumWorkers)
  {
    mWorkersRunning = new CountDownLatch(xiNumWorkers);
  }

  /**
   * Called by each worker when it has finished with this round.
   */
  void workerFinished()
  {
    mWorkersRunning.countDown();
  }

  /**
   * Wait for every expected worker to finish.
   *
   * @throws InterruptedException if interrupted while waiting.
   */
  void awaitWorkers() throws InterruptedException
  {
    mWorkersRunning.await();
  }

  /**
   * Surface the failure that stopped the round, if any.
   *
   * @throws SearchException if a strategy failed.
   */
  void rethrowFailure() throws SearchException
  {
    Throwable lFailure = mFailure.get();
    if (lFailure instanceof SearchException)
    {
      throw (SearchException)lFailure;
    }
    if (lFailure instanceof RuntimeException)
    {
      throw (RuntimeException)lFailure;
    }
    if (lFailure instanceof Error)
    {
      throw (Error)lFailure;
    }
  }

  int getNumCompleted()
  {
    return mNumCompleted.get();
  }

  int getNumDiscarded()
  {
    return mNumDiscarded.get();
  }
}
