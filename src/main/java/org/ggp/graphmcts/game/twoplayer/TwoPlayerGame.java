package org.ggp.graphmcts.game.twoplayer;

import org.ggp.graphmcts.game.Game;
import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Statistics;

/**
 * Base class for two-player games scored with {@link ScoredPayoff}.  Subclasses only need to supply terminal
 * detection.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 */
public abstract class TwoPlayerGame<S extends GameState<S, A>, A> implements Game<S, A, ScoredPayoff>
{
  @Override
  public ScoredPayoff zeroPayoff()
  {
    return ScoredPayoff.ZERO;
  }

  @Override
  public Statistics<ScoredPayoff> newStatistics()
  {
    return new ScoredStatistics();
  }
}
