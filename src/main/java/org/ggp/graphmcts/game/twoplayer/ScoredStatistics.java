package org.ggp.graphmcts.game.twoplayer;

import java.util.concurrent.atomic.AtomicLong;

import org.ggp.graphmcts.game.Statistics;

/**
 * Lock-free statistics for a two-player scored game.
 *
 * Visits and both players' score totals are packed into a single long so that an increment is a single
 * compare-and-swap.  Each field saturates at its maximum rather than wrapping.
 *
 * Layout: 20 bits of visits | 22 bits of player one's score | 22 bits of player two's score.
 */
public class ScoredStatistics implements Statistics<ScoredPayoff>
{
  static final long VISITS_MASK     = 0xFFFFF00000000000L;
  static final long ONE_SCORE_MASK  = 0x00000FFFFFC00000L;
  static final long TWO_SCORE_MASK  = 0x00000000003FFFFFL;
  static final int  VISITS_SHIFT    = 44;
  static final int  ONE_SCORE_SHIFT = 22;

  /**
   * The largest number of visits that can be recorded.
   */
  public static final int VISITS_MAX = 0xFFFFF;

  /**
   * The largest score total that can be recorded for either player.
   */
  public static final int SCORE_MAX  = 0x3FFFFF;

  private final AtomicLong mPacked;

  /**
   * Create empty statistics.
   */
  public ScoredStatistics()
  {
    mPacked = new AtomicLong(0);
  }

  /**
   * Create statistics with the specified initial values.  Values out of range are saturated.
   *
   * @param xiVisits   - initial visits.
   * @param xiScoreOne - initial score total for player one.
   * @param xiScoreTwo - initial score total for player two.
   */
  public ScoredStatistics(long xiVisits, long xiScoreOne, long xiScoreTwo)
  {
    mPacked = new AtomicLong(pack(xiVisits, xiScoreOne, xiScoreTwo));
  }

  static long pack(long xiVisits, long xiScoreOne, long xiScoreTwo)
  {
    return (saturate(xiVisits, VISITS_MAX) << VISITS_SHIFT) |
           (saturate(xiScoreOne, SCORE_MAX) << ONE_SCORE_SHIFT) |
           saturate(xiScoreTwo, SCORE_MAX);
  }

  private static long saturate(long xiValue, long xiMax)
  {
    assert(xiValue >= 0) : "Negative statistic " + xiValue;
    return Math.min(xiValue, xiMax);
  }

  private static int visitsOf(long xiPacked)
  {
    return (int)((xiPacked & VISITS_MASK) >>> VISITS_SHIFT);
  }

  private static int scoreOneOf(long xiPacked)
  {
    return (int)((xiPacked & ONE_SCORE_MASK) >>> ONE_SCORE_SHIFT);
  }

  private static int scoreTwoOf(long xiPacked)
  {
    return (int)(xiPacked & TWO_SCORE_MASK);
  }

  @Override
  public int getVisits()
  {
    return visitsOf(mPacked.get());
  }

  /**
   * @return the raw score total for the specified player.
   *
   * @param xiPlayer - the player.
   */
  public int getValue(Player xiPlayer)
  {
    long lPacked = mPacked.get();
    return (xiPlayer == Player.ONE) ? scoreOneOf(lPacked) : scoreTwoOf(lPacked);
  }

  @Override
  public double getScore(int xiPlayer)
  {
    // Read once so that both totals come from the same snapshot.
    long lPacked = mPacked.get();
    int lNet = scoreOneOf(lPacked) - scoreTwoOf(lPacked);
    return (Player.fromIndex(xiPlayer) == Player.ONE) ? lNet : -lNet;
  }

  @Override
  public void increment(ScoredPayoff xiPayoff)
  {
    long lOld;
    long lNew;
    do
    {
      lOld = mPacked.get();
      lNew = pack((long)visitsOf(lOld) + xiPayoff.getWeight(),
                  (long)scoreOneOf(lOld) + xiPayoff.getValue(Player.ONE),
                  (long)scoreTwoOf(lOld) + xiPayoff.getValue(Player.TWO));
    }
    while (!mPacked.compareAndSet(lOld, lNew));
  }

  @Override
  public ScoredPayoff asPayoff()
  {
    long lPacked = mPacked.get();
    return new ScoredPayoff(visitsOf(lPacked), scoreOneOf(lPacked), scoreTwoOf(lPacked));
  }

  @Override
  public String toString()
  {
    long lPacked = mPacked.get();
    return "{visits: " + visitsOf(lPacked) + ", scores: [" + scoreOneOf(lPacked) + ", " + scoreTwoOf(lPacked) + "]}";
  }
}
