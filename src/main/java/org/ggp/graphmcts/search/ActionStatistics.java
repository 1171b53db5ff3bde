package org.ggp.graphmcts.search;

import org.ggp.graphmcts.game.Payoff;
import org.ggp.graphmcts.search.policy.UcbValue;

/**
 * Report on one of the root's actions at the end of a search round.
 *
 * @param <A> - the action type.
 * @param <P> - the payoff type.
 */
public final class ActionStatistics<A, P extends Payoff<P>>
{
  private final A        mAction;
  private final P        mPayoff;
  private final UcbValue mUcb;

  ActionStatistics(A xiAction, P xiPayoff, UcbValue xiUcb)
  {
    mAction = xiAction;
    mPayoff = xiPayoff;
    mUcb = xiUcb;
  }

  public A getAction()
  {
    return mAction;
  }

  /**
   * @return everything accumulated through this action.
   */
  public P getPayoff()
  {
    return mPayoff;
  }

  public int getVisits()
  {
    return mPayoff.getWeight();
  }

  public UcbValue getUcb()
  {
    return mUcb;
  }

  @Override
  public String toString()
  {
    return mAction + ": " + mPayoff + " UCB " + mUcb;
  }
}
