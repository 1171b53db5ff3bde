package org.ggp.graphmcts.search;

import java.util.Collections;

import org.ggp.graphmcts.game.ScriptedGame;
import org.ggp.graphmcts.game.ScriptedGame.Node;
import org.ggp.graphmcts.game.twoplayer.ScoredPayoff;
import org.ggp.graphmcts.graph.EdgeRef;
import org.ggp.graphmcts.graph.SearchGraph;
import org.ggp.graphmcts.graph.VertexRef;
import org.ggp.graphmcts.search.policy.BestParentBackpropSelector;
import org.ggp.graphmcts.search.policy.FirstParentBackpropSelector;
import org.ggp.graphmcts.search.policy.Ucb;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import gnu.trove.list.array.TIntArrayList;

public class BackpropTest extends Assert
{
  private static final ScoredPayoff WIN = ScoredPayoff.finalScore(1, 0);

  private final ScriptedGame mGame = new ScriptedGame().move("r", "a", "x")
                                                       .move("r", "b", "y")
                                                       .move("x", "c", "t")
                                                       .move("y", "d", "t")
                                                       .move("t", "e", "u")
                                                       .end("u", 1, 0)
                                                       .move("p", "l", "q")
                                                       .move("q", "k", "p")
                                                       .move("m", "g", "win")
                                                       .move("m", "h", "loss")
                                                       .end("win", 1, 0)
                                                       .end("loss", 0, 1)
                                                       .move("s", "a", "v")
                                                       .move("v", "back", "s")
                                                       .move("v", "go", "goal")
                                                       .end("goal", 1, 0);

  private final Expansion<Node, String, ScoredPayoff> mExpansion = new Expansion<>();
  private final Backprop<Node, String, ScoredPayoff> mBackprop =
                                         new Backprop<>(new BestParentBackpropSelector<Node, String, ScoredPayoff>());
  private final SearchSettings mSettings = new SearchSettings(1, 1.4, 10);
  private final WorkerId mWorker = new WorkerId(0);
  private SearchGraph<Node, String, ScoredPayoff> mGraph;

  @Before
  public void setUp()
  {
    mGraph = new SearchGraph<>(mGame, 16);
  }

  private VertexRef<Node, String, ScoredPayoff> root(String xiState)
  {
    mGraph.lockForMutation();
    try
    {
      VertexRef<Node, String, ScoredPayoff> lRoot = mGraph.findOrCreateRoot(mGame.state(xiState));
      mExpansion.expandVertexLocked(lRoot);
      return lRoot;
    }
    finally
    {
      mGraph.unlockForMutation();
    }
  }

  private EdgeRef<Node, String, ScoredPayoff> child(VertexRef<Node, String, ScoredPayoff> xiVertex, String xiAction)
  {
    for (EdgeRef<Node, String, ScoredPayoff> lChild : xiVertex.getChildren())
    {
      if (lChild.getAction().equals(xiAction))
      {
        return lChild;
      }
    }
    throw new IllegalArgumentException("No action " + xiAction);
  }

  private VertexRef<Node, String, ScoredPayoff> expand(VertexRef<Node, String, ScoredPayoff> xiVertex, String xiAction)
  {
    return mExpansion.expandEdge(child(xiVertex, xiAction)).getVertex();
  }

  private void fromVertex(VertexRef<Node, String, ScoredPayoff> xiVertex, ScoredPayoff xiPayoff) throws Exception
  {
    TIntArrayList lMarked = new TIntArrayList();
    mGraph.lockForReading();
    try
    {
      mBackprop.fromVertex(xiVertex, xiPayoff, mSettings, mWorker, lMarked);
    }
    finally
    {
      mGraph.unlockForReading();
    }
    clear(lMarked);
  }

  private void fromEdge(EdgeRef<Node, String, ScoredPayoff> xiEdge, ScoredPayoff xiPayoff) throws Exception
  {
    TIntArrayList lMarked = new TIntArrayList();
    mGraph.lockForReading();
    try
    {
      mBackprop.fromEdge(xiEdge, xiPayoff, mSettings, mWorker, lMarked);
    }
    finally
    {
      mGraph.unlockForReading();
    }
    clear(lMarked);
  }

  private void clear(TIntArrayList xiMarked)
  {
    for (int lii = 0; lii < xiMarked.size(); lii++)
    {
      EdgeRef<Node, String, ScoredPayoff> lEdge = mGraph.getEdge(xiMarked.get(lii));
      assertTrue(lEdge.getTraversals().isBackpropTraversed(mWorker.getIndex()));
      lEdge.getTraversals().clear(mWorker.getIndex());
    }
  }

  @Test
  public void testTranspositionCreditsBothParents() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lR = root("r");
    VertexRef<Node, String, ScoredPayoff> lX = expand(lR, "a");
    VertexRef<Node, String, ScoredPayoff> lY = expand(lR, "b");
    VertexRef<Node, String, ScoredPayoff> lT = expand(lX, "c");
    assertEquals(lT, expand(lY, "d"));
    assertEquals(2, lT.getNumParents());

    fromVertex(lT, WIN);

    assertEquals(WIN, child(lX, "c").getStatistics().asPayoff());
    assertEquals(WIN, child(lY, "d").getStatistics().asPayoff());
    assertEquals(WIN, child(lR, "a").getStatistics().asPayoff());
    assertEquals(WIN, child(lR, "b").getStatistics().asPayoff());

    // Both routes still tie, so a second pass credits both again.
    fromVertex(lT, WIN);
    assertEquals(2, child(lR, "a").getStatistics().getVisits());
    assertEquals(2, child(lR, "b").getStatistics().getVisits());
  }

  @Test
  public void testNonBestParentSkipped() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lR = root("r");
    VertexRef<Node, String, ScoredPayoff> lX = expand(lR, "a");
    expand(lR, "b");
    child(lR, "a").getStatistics().increment(new ScoredPayoff(10, 0, 10));
    child(lR, "b").getStatistics().increment(new ScoredPayoff(10, 10, 0));

    fromVertex(lX, WIN);
    assertEquals(10, child(lR, "a").getStatistics().getVisits());

    // The edge a payoff arrives through is always credited.
    fromEdge(child(lR, "a"), WIN);
    assertEquals(11, child(lR, "a").getStatistics().getVisits());
    assertEquals(10, child(lR, "b").getStatistics().getVisits());
  }

  @Test
  public void testFirstParentOnly() throws Exception
  {
    Backprop<Node, String, ScoredPayoff> lBackprop =
                                       new Backprop<>(new FirstParentBackpropSelector<Node, String, ScoredPayoff>());
    VertexRef<Node, String, ScoredPayoff> lR = root("r");
    VertexRef<Node, String, ScoredPayoff> lX = expand(lR, "a");
    VertexRef<Node, String, ScoredPayoff> lY = expand(lR, "b");
    VertexRef<Node, String, ScoredPayoff> lT = expand(lX, "c");
    expand(lY, "d");

    TIntArrayList lMarked = new TIntArrayList();
    mGraph.lockForReading();
    try
    {
      lBackprop.fromVertex(lT, WIN, mSettings, mWorker, lMarked);
    }
    finally
    {
      mGraph.unlockForReading();
    }
    clear(lMarked);

    assertEquals(1, child(lX, "c").getStatistics().getVisits());
    assertEquals(1, child(lR, "a").getStatistics().getVisits());
    assertEquals(0, child(lY, "d").getStatistics().getVisits());
    assertEquals(0, child(lR, "b").getStatistics().getVisits());
  }

  @Test
  public void testCycleAbsorbed() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lP = root("p");
    VertexRef<Node, String, ScoredPayoff> lQ = expand(lP, "l");
    EdgeRef<Node, String, ScoredPayoff> lBack = child(lQ, "k");
    assertEquals(lP, expand(lQ, "k"));
    assertTrue(lBack.isCyclic());

    fromEdge(lBack, WIN);
    assertEquals(1, lBack.getStatistics().getVisits());
    assertEquals(0, child(lP, "l").getStatistics().getVisits());
  }

  @Test
  public void testCyclicStatusPropagates() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lP = root("p");
    VertexRef<Node, String, ScoredPayoff> lQ = expand(lP, "l");
    expand(lQ, "k");
    assertFalse(lQ.isCyclic());

    mBackprop.updateProvenStatus(lQ);
    assertTrue(lQ.isCyclic());
    assertTrue(lP.isCyclic());
    assertNull(lP.getProvenPayoff());
  }

  @Test
  public void testProvenStatusPropagates() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lM = root("m");
    VertexRef<Node, String, ScoredPayoff> lWin = expand(lM, "g");
    assertTrue(lWin.isTerminal());

    fromEdge(child(lM, "g"), WIN);
    assertNull(lM.getProvenPayoff());

    expand(lM, "h");
    fromEdge(child(lM, "h"), ScoredPayoff.finalScore(0, 1));
    assertEquals(new ScoredPayoff(1, 1, 1), lM.getProvenPayoff());
    assertFalse(lM.isCyclic());
  }

  @Test
  public void testProvenThroughChain() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lR = root("r");
    VertexRef<Node, String, ScoredPayoff> lX = expand(lR, "a");
    VertexRef<Node, String, ScoredPayoff> lT = expand(lX, "c");
    VertexRef<Node, String, ScoredPayoff> lU = expand(lT, "e");
    assertEquals(WIN, lU.getProvenPayoff());

    fromEdge(child(lT, "e"), WIN);
    assertEquals(WIN, lT.getProvenPayoff());
    assertEquals(WIN, lX.getProvenPayoff());

    // r's other child is unexplored.
    assertNull(lR.getProvenPayoff());
    assertEquals(Collections.singletonList(child(lX, "c")), lT.getParents());
  }

  @Test
  public void testCyclicSiblingDoesNotBlockCredit() throws Exception
  {
    VertexRef<Node, String, ScoredPayoff> lS = root("s");
    VertexRef<Node, String, ScoredPayoff> lV = expand(lS, "a");
    assertEquals(lS, expand(lV, "back"));
    VertexRef<Node, String, ScoredPayoff> lGoal = expand(lV, "go");
    assertTrue(lGoal.isTerminal());

    // The cyclic sibling outscores the edge to the goal, but is never a rollout candidate.
    EdgeRef<Node, String, ScoredPayoff> lBack = child(lV, "back");
    EdgeRef<Node, String, ScoredPayoff> lGo = child(lV, "go");
    lBack.getStatistics().increment(new ScoredPayoff(5, 5, 0));
    lGo.getStatistics().increment(new ScoredPayoff(5, 0, 5));
    child(lS, "a").getStatistics().increment(new ScoredPayoff(5, 0, 5));
    assertTrue(lBack.isCyclic());
    assertEquals(Collections.singletonList(lGo), Ucb.selectionCandidates(lV));

    fromVertex(lGoal, WIN);
    assertEquals(6, lGo.getStatistics().getVisits());
    assertEquals(6, child(lS, "a").getStatistics().getVisits());
    assertEquals(5, lBack.getStatistics().getVisits());
  }
}
