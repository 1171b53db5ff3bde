package org.ggp.graphmcts.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ggp.graphmcts.game.Game;
import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.SearchGraph;
import org.ggp.graphmcts.graph.Target;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.exceptions.NoRootStateException;
import org.ggp.graphmcts.search.exceptions.SearchException;
import org.ggp.graphmcts.search.policy.BackpropSelector;
import org.ggp.graphmcts.search.policy.BestParentBackpropSelector;
import org.ggp.graphmcts.search.policy.RandomSimulator;
import org.ggp.graphmcts.search.policy.RolloutSelector;
import org.ggp.graphmcts.search.policy.Simulator;
import org.ggp.graphmcts.search.policy.Ucb;
import org.ggp.graphmcts.search.policy.UcbRolloutSelector;
import org.ggp.graphmcts.search.policy.UcbValue;
import org.ggp.graphmcts.util.MachineSpecificConfiguration;
import org.ggp.graphmcts.util.MachineSpecificConfiguration.CfgItem;
import org.ggp.graphmcts.util.ThreadControl;

/**
 * Entry point to the search engine.
 *
 * A search state tracks the current root of a game and runs search rounds against a {@link SearchGraph}.  Typical
 * use is:
 *
 * <pre>
 *   SearchGraph graph = search.newGraph();
 *   search.initialize(graph, initialState);
 *   while (game not over)
 *   {
 *     List&lt;ActionStatistics&gt; report = search.runRound(graph, search.getRootState(), settings);
 *     search.commitAction(graph, choose(report));
 *   }
 * </pre>
 *
 * The methods of this class must be called from one thread at a time.  Rounds with more than one worker run them on
 * a pool of worker threads, which is kept until stop() is called.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public class SearchState<S extends GameState<S, A>, A, P extends Payoff<P>>
{
  private static final Logger LOGGER = LogManager.getLogger();
  static
  {
    MachineSpecificConfiguration.logConfig();
  }

  private final Game<S, A, P>           mGame;
  private final Rollout<S, A, P>        mRollout;
  private final Expansion<S, A, P>      mExpansion;
  private final Simulator<S, A, P>      mSimulator;
  private final Backprop<S, A, P>       mBackprop;
  private final Random                  mRandom;
  private final boolean                 mPruneOnCommit;

  private S                             mRootState;
  private Epoch                         mEpoch = Epoch.INITIAL;
  private SearchWorkerPool              mWorkerPool;
  private SearchRound<S, A, P>          mLastRound;

  /**
   * Create a search state.
   *
   * @param xiGame             - the game.
   * @param xiRolloutSelector  - strategy for descending the graph.
   * @param xiBackpropSelector - strategy for choosing which parents to update.
   * @param xiSimulator        - strategy for estimating the payoff of new states.
   * @param xiRandom           - source of randomness.  Seeds every worker.
   */
  public SearchState(Game<S, A, P> xiGame,
                     RolloutSelector<S, A, P> xiRolloutSelector,
                     BackpropSelector<S, A, P> xiBackpropSelector,
                     Simulator<S, A, P> xiSimulator,
                     Random xiRandom)
  {
    mGame = xiGame;
    mRollout = new Rollout<>(xiRolloutSelector);
    mExpansion = new Expansion<>();
    mSimulator = xiSimulator;
    mBackprop = new Backprop<>(xiBackpropSelector);
    mRandom = xiRandom;
    mPruneOnCommit = MachineSpecificConfiguration.getCfgBool(CfgItem.PRUNE_ON_COMMIT);
  }

  /**
   * Create a search state with UCB1 descent, best-parent backprop and random simulation.
   *
   * @param xiGame   - the game.
   * @param xiRandom - source of randomness.
   *
   * @return the search state.
   */
  public static <S extends GameState<S, A>, A, P extends Payoff<P>>
    SearchState<S, A, P> withDefaultStrategies(Game<S, A, P> xiGame, Random xiRandom)
  {
    return new SearchState<>(xiGame,
                             new UcbRolloutSelector<S, A, P>(),
                             new BestParentBackpropSelector<S, A, P>(),
                             new RandomSimulator<S, A, P>(),
                             xiRandom);
  }

  /**
   * @return a new, empty, graph for this search's game.
   */
  public SearchGraph<S, A, P> newGraph()
  {
    return new SearchGraph<>(mGame, MachineSpecificConfiguration.getCfgInt(CfgItem.INITIAL_POOL_SIZE));
  }

  /**
   * @return the current root state.  Null until initialize() has been called.
   */
  public S getRootState()
  {
    return mRootState;
  }

  public Epoch getEpoch()
  {
    return mEpoch;
  }

  /**
   * Make a state the root of the search, adding it to the graph (with its children) if necessary.
   *
   * @param xiGraph     - the graph.
   * @param xiRootState - the root state.  The graph takes ownership of it.
   */
  public void initialize(SearchGraph<S, A, P> xiGraph, S xiRootState)
  {
    xiGraph.lockForMutation();
    try
    {
      VertexRef<S, A, P> lRoot = xiGraph.findOrCreateRoot(xiRootState);
      if (!lRoot.isExpanded())
      {
        mExpansion.expandVertexLocked(lRoot);
      }
      mRootState = lRoot.getState();
    }
    finally
    {
      xiGraph.unlockForMutation();
    }

    mEpoch = mEpoch.next();
    LOGGER.info("Initialized search in " + mEpoch + ", graph has " + xiGraph.getNumVertices() + " vertices");
  }

  /**
   * Run a round of search.
   *
   * @param xiGraph     - the graph.
   * @param xiRootState - the state to search from, which must be in the graph.
   * @param xiSettings  - settings for the round.
   *
   * @return a report on each of the root's actions.
   *
   * @throws NoRootStateException if the root state isn't in the graph.
   * @throws SearchException if a strategy failed.  The graph remains valid.
   */
  public List<ActionStatistics<A, P>> runRound(SearchGraph<S, A, P> xiGraph,
                                               S xiRootState,
                                               SearchSettings xiSettings) throws SearchException
  {
    VertexRef<S, A, P> lRoot;
    xiGraph.lockForReading();
    try
    {
      lRoot = xiGraph.findVertex(xiRootState);
    }
    finally
    {
      xiGraph.unlockForReading();
    }

    if (lRoot == null)
    {
      throw new NoRootStateException();
    }
    mExpansion.expandVertex(lRoot);

    mEpoch = mEpoch.next();
    SearchRound<S, A, P> lRound = new SearchRound<>(xiGraph,
                                                    lRoot,
                                                    xiSettings,
                                                    mEpoch,
                                                    mRollout,
                                                    mExpansion,
                                                    mSimulator,
                                                    mBackprop);
    mLastRound = lRound;
    long lStartTime = System.currentTimeMillis();

    if ((xiSettings.getWorkerCount() == 1) || ThreadControl.RUN_SYNCHRONOUSLY)
    {
      lRound.runIterations(new WorkerId(0), mRandom);
    }
    else
    {
      try
      {
        getWorkerPool(xiSettings.getWorkerCount()).run(lRound);
      }
      catch (InterruptedException lEx)
      {
        Thread.currentThread().interrupt();
        throw new SearchException("Interrupted during search round", lEx);
      }
    }

    lRound.rethrowFailure();

    LOGGER.info("Completed " + lRound.getNumCompleted() + " iterations (" + lRound.getNumDiscarded() +
                " discarded) in " + mEpoch + " in " + (System.currentTimeMillis() - lStartTime) + "ms, graph has " +
                xiGraph.getNumVertices() + " vertices (" + xiGraph.getNumTranspositions() + " transpositions, " +
                xiGraph.getNumCycles() + " cycles)");

    return report(xiGraph, lRoot, xiSettings);
  }

  /**
   * @return the most recently started round, for inspection by tests.
   */
  SearchRound<S, A, P> getLastRound()
  {
    return mLastRound;
  }

  private SearchWorkerPool getWorkerPool(int xiNumWorkers)
  {
    if ((mWorkerPool != null) && (mWorkerPool.getNumWorkers() != xiNumWorkers))
    {
      mWorkerPool.stop();
      mWorkerPool = null;
    }

    if (mWorkerPool == null)
    {
      mWorkerPool = new SearchWorkerPool(xiNumWorkers, mRandom);
    }
    return mWorkerPool;
  }

  private List<ActionStatistics<A, P>> report(SearchGraph<S, A, P> xiGraph,
                                              VertexRef<S, A, P> xiRoot,
                                              SearchSettings xiSettings)
  {
    xiGraph.lockForReading();
    try
    {
      List<EdgeRef<S, A, P>> lChildren = xiRoot.getChildren();
      List<UcbValue> lValues = Ucb.childValues(xiRoot, xiSettings.getExploreBias());

      List<ActionStatistics<A, P>> lReport = new ArrayList<>(lChildren.size());
      for (int lii = 0; lii < lChildren.size(); lii++)
      {
        EdgeRef<S, A, P> lChild = lChildren.get(lii);
        lReport.add(new ActionStatistics<>(lChild.getAction(), lChild.getStatistics().asPayoff(), lValues.get(lii)));
      }
      return lReport;
    }
    finally
    {
      xiGraph.unlockForReading();
    }
  }

  /**
   * Advance the root by playing an action.  Unless configured otherwise, everything no longer reachable from the new
   * root is then pruned from the graph.
   *
   * @param xiGraph  - the graph.
   * @param xiAction - the action, which must be legal in the current root state.
   *
   * @throws NoRootStateException if the current root state isn't in the graph.
   */
  public void commitAction(SearchGraph<S, A, P> xiGraph, A xiAction) throws NoRootStateException
  {
    xiGraph.lockForMutation();
    try
    {
      VertexRef<S, A, P> lRoot = (mRootState == null) ? null : xiGraph.findVertex(mRootState);
      if (lRoot == null)
      {
        throw new NoRootStateException();
      }

      if (!lRoot.isExpanded())
      {
        mExpansion.expandVertexLocked(lRoot);
      }

      S lNextState = mRootState.copy();
      lNextState.doAction(xiAction);

      // Find the edge for the action.  Where several actions lead to the same state, only one of them has an edge, so
      // fall back to looking up the state reached.
      EdgeRef<S, A, P> lChosen = null;
      for (EdgeRef<S, A, P> lChild : lRoot.getChildren())
      {
        if (lChild.getAction().equals(xiAction))
        {
          lChosen = lChild;
          break;
        }
      }

      VertexRef<S, A, P> lNewRoot;
      if (lChosen == null)
      {
        lNewRoot = xiGraph.findOrCreateRoot(lNextState);
      }
      else
      {
        Target lTarget = lChosen.getTarget();
        if (lTarget.isUnexpanded())
        {
          lTarget = xiGraph.resolveEdge(lChosen, lNextState);
        }
        lNewRoot = xiGraph.getVertex(lTarget.getVertexId());
      }

      if (!lNewRoot.isExpanded())
      {
        mExpansion.expandVertexLocked(lNewRoot);
      }
      mRootState = lNewRoot.getState();

      if (mPruneOnCommit)
      {
        xiGraph.prune(Collections.singletonList(lNewRoot));
      }
    }
    finally
    {
      xiGraph.unlockForMutation();
    }

    mEpoch = mEpoch.next();
    LOGGER.info("Committed " + xiAction + " in " + mEpoch);
  }

  /**
   * Stop any worker threads.  The search state can still be used afterwards - threads are restarted as needed.
   */
  public void stop()
  {
    if (mWorkerPool != null)
    {
      mWorkerPool.stop();
      mWorkerPool = null;
    }
  }
}
