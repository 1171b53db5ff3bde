package org.ggp.graphmcts.game.twoplayer;

import org.ggp.graphmcts.game.Payoff;

/**
 * Payoff of a two-player game in which each player accumulates a non-negative integer score.
 *
 * The score credited to a player is its net score: its own total less its opponent's.
 */
public final class ScoredPayoff implements Payoff<ScoredPayoff>
{
  /**
   * The payoff with no observations.
   */
  public static final ScoredPayoff ZERO = new ScoredPayoff(0, 0, 0);

  private final int mWeight;
  private final int mScoreOne;
  private final int mScoreTwo;

  /**
   * Create a payoff.
   *
   * @param xiWeight   - the number of observations.
   * @param xiScoreOne - total score for player one.
   * @param xiScoreTwo - total score for player two.
   */
  public ScoredPayoff(int xiWeight, int xiScoreOne, int xiScoreTwo)
  {
    if ((xiWeight < 0) || (xiScoreOne < 0) || (xiScoreTwo < 0))
    {
      throw new IllegalArgumentException("Negative payoff: " + xiWeight + "/" + xiScoreOne + "/" + xiScoreTwo);
    }
    mWeight = xiWeight;
    mScoreOne = xiScoreOne;
    mScoreTwo = xiScoreTwo;
  }

  /**
   * @return a single-observation payoff for a game which ended with the specified scores.
   *
   * @param xiScoreOne - final score for player one.
   * @param xiScoreTwo - final score for player two.
   */
  public static ScoredPayoff finalScore(int xiScoreOne, int xiScoreTwo)
  {
    return new ScoredPayoff(1, xiScoreOne, xiScoreTwo);
  }

  @Override
  public int getWeight()
  {
    return mWeight;
  }

  /**
   * @return the raw (not net) score total for the specified player.
   *
   * @param xiPlayer - the player.
   */
  public int getValue(Player xiPlayer)
  {
    return (xiPlayer == Player.ONE) ? mScoreOne : mScoreTwo;
  }

  /**
   * @return the net score for the specified player.
   *
   * @param xiPlayer - the player.
   */
  public int getNetScore(Player xiPlayer)
  {
    return getValue(xiPlayer) - getValue(xiPlayer.getOpponent());
  }

  @Override
  public double getScore(int xiPlayer)
  {
    return getNetScore(Player.fromIndex(xiPlayer));
  }

  @Override
  public ScoredPayoff plus(ScoredPayoff xiOther)
  {
    return new ScoredPayoff(mWeight + xiOther.mWeight, mScoreOne + xiOther.mScoreOne, mScoreTwo + xiOther.mScoreTwo);
  }

  @Override
  public ScoredPayoff max(ScoredPayoff xiOther)
  {
    return new ScoredPayoff(Math.max(mWeight, xiOther.mWeight),
                            Math.max(mScoreOne, xiOther.mScoreOne),
                            Math.max(mScoreTwo, xiOther.mScoreTwo));
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (!(xiOther instanceof ScoredPayoff))
    {
      return false;
    }
    ScoredPayoff lOther = (ScoredPayoff)xiOther;
    return (mWeight == lOther.mWeight) && (mScoreOne == lOther.mScoreOne) && (mScoreTwo == lOther.mScoreTwo);
  }

  @Override
  public int hashCode()
  {
    return (mWeight * 31 + mScoreOne) * 31 + mScoreTwo;
  }

  @Override
  public String toString()
  {
    return "{weight: " + mWeight + ", scores: [" + mScoreOne + ", " + mScoreTwo + "]}";
  }
}
