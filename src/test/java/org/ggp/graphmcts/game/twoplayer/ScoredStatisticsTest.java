package org.ggp.graphmcts.game.twoplayer;

import org.junit.Assert;
import org.junit.Test;

public class ScoredStatisticsTest extends Assert
{
  @Test
  public void testIncrement() throws Exception
  {
    ScoredStatistics lStats = new ScoredStatistics();
    assertEquals(0, lStats.getVisits());
    assertEquals(ScoredPayoff.ZERO, lStats.asPayoff());

    lStats.increment(ScoredPayoff.finalScore(3, 1));
    lStats.increment(ScoredPayoff.finalScore(3, 1));
    assertEquals(2, lStats.getVisits());
    assertEquals(6, lStats.getValue(Player.ONE));
    assertEquals(2, lStats.getValue(Player.TWO));
    assertEquals(4.0, lStats.getScore(0), 0);
    assertEquals(-4.0, lStats.getScore(1), 0);
    assertEquals(new ScoredPayoff(2, 6, 2), lStats.asPayoff());
  }

  @Test
  public void testIncrementByWeight() throws Exception
  {
    ScoredStatistics lStats = new ScoredStatistics();
    lStats.increment(new ScoredPayoff(5, 2, 7));
    assertEquals(5, lStats.getVisits());
    assertEquals(-5.0, lStats.getScore(0), 0);

    // Weightless payoffs change nothing.
    lStats.increment(ScoredPayoff.ZERO);
    assertEquals(new ScoredPayoff(5, 2, 7), lStats.asPayoff());
  }

  @Test
  public void testSaturation() throws Exception
  {
    ScoredStatistics lStats = new ScoredStatistics(ScoredStatistics.VISITS_MAX, ScoredStatistics.SCORE_MAX, 0);
    lStats.increment(ScoredPayoff.finalScore(5, 5));
    assertEquals(ScoredStatistics.VISITS_MAX, lStats.getVisits());
    assertEquals(ScoredStatistics.SCORE_MAX, lStats.getValue(Player.ONE));
    assertEquals(5, lStats.getValue(Player.TWO));

    // Out of range initial values are clamped too.
    ScoredStatistics lBig = new ScoredStatistics(1L << 40, 1L << 40, 1L << 40);
    assertEquals(ScoredStatistics.VISITS_MAX, lBig.getVisits());
    assertEquals(ScoredStatistics.SCORE_MAX, lBig.getValue(Player.TWO));
  }

  @Test
  public void testFieldsDontOverlap() throws Exception
  {
    long lPacked = ScoredStatistics.pack(ScoredStatistics.VISITS_MAX, 0, 0);
    assertEquals(ScoredStatistics.VISITS_MASK, lPacked);
    lPacked = ScoredStatistics.pack(0, ScoredStatistics.SCORE_MAX, 0);
    assertEquals(ScoredStatistics.ONE_SCORE_MASK, lPacked);
    lPacked = ScoredStatistics.pack(0, 0, ScoredStatistics.SCORE_MAX);
    assertEquals(ScoredStatistics.TWO_SCORE_MASK, lPacked);
  }

  @Test
  public void testConcurrentIncrements() throws Exception
  {
    final ScoredStatistics lStats = new ScoredStatistics();
    final int lIncrementsPerThread = 10000;

    Thread[] lThreads = new Thread[4];
    for (int lii = 0; lii < lThreads.length; lii++)
    {
      final ScoredPayoff lPayoff = (lii % 2 == 0) ? ScoredPayoff.finalScore(1, 0) : ScoredPayoff.finalScore(0, 2);
      lThreads[lii] = new Thread(new Runnable()
      {
        @Override
        public void run()
        {
          for (int lIteration = 0; lIteration < lIncrementsPerThread; lIteration++)
          {
            lStats.increment(lPayoff);
          }
        }
      });
    }

    for (Thread lThread : lThreads)
    {
      lThread.start();
    }
    for (Thread lThread : lThreads)
    {
      lThread.join();
    }

    assertEquals(4 * lIncrementsPerThread, lStats.getVisits());
    assertEquals(2 * lIncrementsPerThread, lStats.getValue(Player.ONE));
    assertEquals(4 * lIncrementsPerThread, lStats.getValue(Player.TWO));
  }
}
