package org.ggp.graphmcts.graph;

import org.junit.Assert;
import org.junit.Test;

public class AtomicTraversalsTest extends Assert
{
  @Test
  public void testMarkReportsRepeat() throws Exception
  {
    AtomicTraversals lTraversals = new AtomicTraversals();
    assertFalse(lTraversals.markRolloutTraversal(3));
    assertTrue(lTraversals.isRolloutTraversed(3));
    assertTrue(lTraversals.markRolloutTraversal(3));

    assertFalse(lTraversals.markBackpropTraversal(3));
    assertTrue(lTraversals.markBackpropTraversal(3));
  }

  @Test
  public void testLanesAreExclusive() throws Exception
  {
    AtomicTraversals lTraversals = new AtomicTraversals();
    lTraversals.markRolloutTraversal(0);
    lTraversals.markBackpropTraversal(0);
    assertFalse(lTraversals.isRolloutTraversed(0));
    assertTrue(lTraversals.isBackpropTraversed(0));

    // A fresh rollout mark isn't a repeat, even straight after a backprop.
    assertFalse(lTraversals.markRolloutTraversal(0));
    assertFalse(lTraversals.isBackpropTraversed(0));
  }

  @Test
  public void testWorkersAreIndependent() throws Exception
  {
    AtomicTraversals lTraversals = new AtomicTraversals();
    assertFalse(lTraversals.markRolloutTraversal(0));
    assertFalse(lTraversals.markRolloutTraversal(AtomicTraversals.MAX_WORKERS - 1));
    assertFalse(lTraversals.markBackpropTraversal(5));

    lTraversals.clear(0);
    assertFalse(lTraversals.isRolloutTraversed(0));
    assertTrue(lTraversals.isRolloutTraversed(AtomicTraversals.MAX_WORKERS - 1));
    assertTrue(lTraversals.isBackpropTraversed(5));

    lTraversals.clear(5);
    assertFalse(lTraversals.isBackpropTraversed(5));
    assertFalse(lTraversals.isRolloutTraversed(5));
  }
}
