package org.ggp.graphmcts.search.policy;

import java.util.Random;

import org.ggp.graphmcts.game.ActionVisitor;
import org.ggp.graphmcts.game.Game;
import org.ggp.graphmcts.game.GameState;
import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.search.exceptions.NoTerminalPayoffException;

/**
 * Simulator which plays uniformly random legal actions until the game ends.
 *
 * @param <S> - the state type.
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public class RandomSimulator<S extends GameState<S, A>, A, P extends Payoff<P>> implements Simulator<S, A, P>
{
  /**
   * Chooses one action uniformly from a single pass over the legal actions.
   */
  private static class RandomActionVisitor<A> implements ActionVisitor<A>
  {
    private final Random mRandom;
    private A            mChosen;
    private int          mCount;

    RandomActionVisitor(Random xiRandom)
    {
      mRandom = xiRandom;
    }

    @Override
    public boolean visit(A xiAction)
    {
      mCount++;
      if (mRandom.nextInt(mCount) == 0)
      {
        mChosen = xiAction;
      }
      return true;
    }
  }

  @Override
  public P simulate(Game<S, A, P> xiGame, S xiState, int xiCount, Random xiRandom)
  {
    P lTotal = xiGame.zeroPayoff();
    for (int lii = 0; lii < xiCount; lii++)
    {
      lTotal = lTotal.plus(playout(xiGame, xiState.copy(), xiRandom));
    }
    return lTotal;
  }

  private P playout(Game<S, A, P> xiGame, S xiState, Random xiRandom)
  {
    while (true)
    {
      P lPayoff = xiGame.payoffOf(xiState);
      if (lPayoff != null)
      {
        return lPayoff;
      }

      RandomActionVisitor<A> lVisitor = new RandomActionVisitor<>(xiRandom);
      xiState.forEachAction(lVisitor);
      if (lVisitor.mChosen == null)
      {
        throw new NoTerminalPayoffException(xiState);
      }
      xiState.doAction(lVisitor.mChosen);
    }
  }
}
