package org.ggp.graphmcts.search.policy;

import java.util.List;
import java.util.Random;

import org.ggp.graphmcts.game.ScriptedGame;
import org.ggp.graphmcts.game.ScriptedGame.Node;
import org.ggp.graphmcts.game.twoplayer.ScoredPayoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.SearchGraph;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.SearchSettings;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

public class UcbTest extends Assert
{
  private final ScriptedGame mGame = new ScriptedGame().move("r", "p", "rp")
                                                       .move("r", "q", "rq")
                                                       .move("r", "s", "rs")
                                                       .player("o", 1)
                                                       .move("o", "p", "op")
                                                       .move("o", "q", "oq");

  private final Random mRandom = new Random(42);
  private SearchGraph<Node, String, ScoredPayoff> mGraph;

  @Before
  public void setUp()
  {
    mGraph = new SearchGraph<>(mGame, 16);
  }

  private VertexRef<Node, String, ScoredPayoff> vertexWithChildren(String xiState, ScoredPayoff... xiStats)
  {
    mGraph.lockForMutation();
    try
    {
      VertexRef<Node, String, ScoredPayoff> lVertex = mGraph.findOrCreateRoot(mGame.state(xiState));
      final String[] lActions = {"p", "q", "s"};
      for (int lii = 0; lii < xiStats.length; lii++)
      {
        EdgeRef<Node, String, ScoredPayoff> lEdge = mGraph.appendChild(lVertex, lActions[lii]);
        lEdge.getStatistics().increment(xiStats[lii]);
      }
      lVertex.markExpanded();
      return lVertex;
    }
    finally
    {
      mGraph.unlockForMutation();
    }
  }

  @Test
  public void testScore() throws Exception
  {
    ScoredPayoff lSnapshot = new ScoredPayoff(4, 3, 1);
    double lExploration = Math.sqrt(Math.log(8) / 4);
    assertEquals(0.5 + lExploration, Ucb.score(lSnapshot, 0, Math.log(8), 1.0), 1e-9);
    assertEquals(-0.5 + 2 * lExploration, Ucb.score(lSnapshot, 1, Math.log(8), 2.0), 1e-9);
    assertEquals(0.5, Ucb.score(lSnapshot, 0, Math.log(8), 0.0), 1e-9);
  }

  @Test
  public void testLogParentVisits() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r",
                                                                       new ScoredPayoff(3, 0, 0),
                                                                       new ScoredPayoff(5, 0, 0),
                                                                       ScoredPayoff.ZERO);
    assertEquals(Math.log(8), Ucb.logParentVisits(lVertex.getChildren()), 1e-12);

    VertexRef<Node, String, ScoredPayoff> lCold = vertexWithChildren("o", ScoredPayoff.ZERO, ScoredPayoff.ZERO);
    assertEquals(0.0, Ucb.logParentVisits(lCold.getChildren()), 0);
  }

  @Test
  public void testUnvisitedChildFirst() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r",
                                                                       new ScoredPayoff(10, 10, 0),
                                                                       ScoredPayoff.ZERO,
                                                                       ScoredPayoff.ZERO);
    List<EdgeRef<Node, String, ScoredPayoff>> lChildren = lVertex.getChildren();
    for (int lii = 0; lii < 10; lii++)
    {
      assertEquals(lChildren.get(1), Ucb.findBestChild(lVertex, lChildren, 1.4, mRandom));
    }
  }

  @Test
  public void testBestChildForActivePlayer() throws Exception
  {
    // Player one wins through p and loses through q.
    VertexRef<Node, String, ScoredPayoff> lOne = vertexWithChildren("r",
                                                                    new ScoredPayoff(10, 10, 0),
                                                                    new ScoredPayoff(10, 0, 10));
    assertEquals("p", Ucb.findBestChild(lOne, lOne.getChildren(), 0.5, mRandom).getAction());

    // Player two is to move at o, so prefers the reverse.
    VertexRef<Node, String, ScoredPayoff> lTwo = vertexWithChildren("o",
                                                                    new ScoredPayoff(10, 10, 0),
                                                                    new ScoredPayoff(10, 0, 10));
    assertEquals("q", Ucb.findBestChild(lTwo, lTwo.getChildren(), 0.5, mRandom).getAction());
  }

  @Test
  public void testExploration() throws Exception
  {
    // q scores less on average, but has been tried so rarely that exploration favours it.
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r",
                                                                       new ScoredPayoff(1000, 600, 0),
                                                                       new ScoredPayoff(1, 0, 0));
    assertEquals("q", Ucb.findBestChild(lVertex, lVertex.getChildren(), 1.4, mRandom).getAction());
    assertEquals("p", Ucb.findBestChild(lVertex, lVertex.getChildren(), 0.0, mRandom).getAction());
  }

  @Test
  public void testTiesBrokenFairly() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r",
                                                                       ScoredPayoff.finalScore(1, 0),
                                                                       ScoredPayoff.finalScore(1, 0),
                                                                       ScoredPayoff.finalScore(1, 0));
    List<EdgeRef<Node, String, ScoredPayoff>> lChildren = lVertex.getChildren();

    int lTrials = 30000;
    int[] lCounts = new int[3];
    for (int lii = 0; lii < lTrials; lii++)
    {
      lCounts[lChildren.indexOf(Ucb.findBestChild(lVertex, lChildren, 1.4, mRandom))]++;
    }

    for (int lCount : lCounts)
    {
      assertEquals(1.0 / 3, (double)lCount / lTrials, 0.02);
    }
  }

  @Test
  public void testNoChildren() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r");
    try
    {
      Ucb.findBestChild(lVertex, lVertex.getChildren(), 1.4, mRandom);
      fail("Selected from no children");
    }
    catch (UcbException lEx)
    {
      assertEquals(UcbException.Kind.NO_CHILDREN, lEx.getKind());
    }
  }

  @Test
  public void testInvalidComputation() throws Exception
  {
    // One visit in total, so ln(1) = 0, and an infinite bias makes the exploration term 0 * infinity.
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r", ScoredPayoff.finalScore(1, 0));
    try
    {
      Ucb.findBestChild(lVertex, lVertex.getChildren(), Double.POSITIVE_INFINITY, mRandom);
      fail("Computed a score of NaN");
    }
    catch (UcbException lEx)
    {
      assertEquals(UcbException.Kind.INVALID_COMPUTATION, lEx.getKind());
    }
  }

  @Test
  public void testIsBestChild() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r",
                                                                       new ScoredPayoff(10, 10, 0),
                                                                       new ScoredPayoff(10, 0, 10),
                                                                       ScoredPayoff.ZERO);
    List<EdgeRef<Node, String, ScoredPayoff>> lChildren = lVertex.getChildren();

    // While a sibling is unvisited, only unvisited edges are best.
    assertFalse(Ucb.isBestChild(lChildren.get(0), 0.5));
    assertFalse(Ucb.isBestChild(lChildren.get(1), 0.5));
    assertTrue(Ucb.isBestChild(lChildren.get(2), 0.5));

    lChildren.get(2).getStatistics().increment(new ScoredPayoff(10, 5, 5));
    assertTrue(Ucb.isBestChild(lChildren.get(0), 0.5));
    assertFalse(Ucb.isBestChild(lChildren.get(1), 0.5));
    assertFalse(Ucb.isBestChild(lChildren.get(2), 0.5));
  }

  @Test
  public void testEarlierUnvisitedSiblingOutranks() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r",
                                                                       ScoredPayoff.ZERO,
                                                                       new ScoredPayoff(10, 10, 0));
    List<EdgeRef<Node, String, ScoredPayoff>> lChildren = lVertex.getChildren();
    assertTrue(Ucb.isBestChild(lChildren.get(0), 1.4));
    assertFalse(Ucb.isBestChild(lChildren.get(1), 1.4));
    assertEquals(lChildren.get(0), Ucb.findBestChild(lVertex, lChildren, 1.4, mRandom));
  }

  @Test
  public void testIsBestChildWithTies() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r",
                                                                       ScoredPayoff.finalScore(1, 0),
                                                                       ScoredPayoff.finalScore(1, 0));
    for (EdgeRef<Node, String, ScoredPayoff> lChild : lVertex.getChildren())
    {
      assertTrue(Ucb.isBestChild(lChild, 1.4));
    }
  }

  @Test
  public void testChildValues() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lVertex = vertexWithChildren("r",
                                                                       new ScoredPayoff(2, 2, 0),
                                                                       ScoredPayoff.ZERO);
    List<UcbValue> lValues = Ucb.childValues(lVertex, 1.0);
    assertEquals(2, lValues.size());
    assertEquals(UcbValue.Kind.VALUE, lValues.get(0).getKind());
    assertEquals(1.0 + Math.sqrt(Math.log(2) / 2), lValues.get(0).getValue(), 1e-9);
    assertEquals(UcbValue.Kind.SELECT, lValues.get(1).getKind());

    VertexRef<Node, String, ScoredPayoff> lBroken = vertexWithChildren("o", ScoredPayoff.finalScore(0, 1));
    lValues = Ucb.childValues(lBroken, Double.POSITIVE_INFINITY);
    assertEquals(UcbValue.Kind.INVALID, lValues.get(0).getKind());
    assertEquals(UcbException.Kind.INVALID_COMPUTATION, lValues.get(0).getError().getKind());
  }

  @Test
  public void testSelectorSkipsCyclicChildren() throws Exception
  {
    ScriptedGame lGame = new ScriptedGame().move("a", "loop", "a").move("a", "on", "b");
    SearchGraph<Node, String, ScoredPayoff> lGraph = new SearchGraph<>(lGame, 16);
    VertexRef<Node, String, ScoredPayoff> lA;
    lGraph.lockForMutation();
    try
    {
      lA = lGraph.findOrCreateRoot(lGame.state("a"));
      EdgeRef<Node, String, ScoredPayoff> lLoop = lGraph.appendChild(lA, "loop");
      lGraph.appendChild(lA, "on");
      lA.markExpanded();
      lGraph.resolveEdge(lLoop, lGame.state("a"));
    }
    finally
    {
      lGraph.unlockForMutation();
    }

    UcbRolloutSelector<Node, String, ScoredPayoff> lSelector = new UcbRolloutSelector<>();
    SearchSettings lSettings = new SearchSettings(1, 1.4, 1);
    for (int lii = 0; lii < 10; lii++)
    {
      assertEquals("on", lSelector.select(lA, lSettings, mRandom).getAction());
    }
  }
}
