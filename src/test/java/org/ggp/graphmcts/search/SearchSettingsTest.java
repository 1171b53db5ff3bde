package org.ggp.graphmcts.search;

import org.ggp.graphmcts.util.MachineSpecificConfiguration;
import org.ggp.graphmcts.util.MachineSpecificConfiguration.CfgItem;
import org.ggp.graphmcts.util.ThreadControl;
import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class SearchSettingsTest extends Assert
{
  @After
  public void tearDown()
  {
    MachineSpecificConfiguration.utResetOverrides();
  }

  @Test
  public void testSimpleSettings() throws Exception
  {
    SearchSettings lSettings = new SearchSettings(2, 0.7, 300);
    assertEquals(2, lSettings.getSimulationCount());
    assertEquals(0.7, lSettings.getExploreBias(), 0);
    assertEquals(300, lSettings.getIterationCount());
    assertEquals(1, lSettings.getWorkerCount());
    assertEquals(0, lSettings.getRoundTimeLimitMs());
  }

  @Test
  public void testFromConfiguration() throws Exception
  {
    MachineSpecificConfiguration.utOverrideCfgVal(CfgItem.SIMULATION_COUNT, 3);
    MachineSpecificConfiguration.utOverrideCfgVal(CfgItem.EXPLORE_BIAS, "0.5");
    MachineSpecificConfiguration.utOverrideCfgVal(CfgItem.ITERATION_COUNT, 77);
    MachineSpecificConfiguration.utOverrideCfgVal(CfgItem.ROUND_TIME_LIMIT_MS, 250);

    SearchSettings lSettings = SearchSettings.fromConfiguration();
    assertEquals(3, lSettings.getSimulationCount());
    assertEquals(0.5, lSettings.getExploreBias(), 0);
    assertEquals(77, lSettings.getIterationCount());
    assertEquals(250, lSettings.getRoundTimeLimitMs());
    assertEquals(ThreadControl.WORKER_THREADS, lSettings.getWorkerCount());
  }

  @Test
  public void testValidation() throws Exception
  {
    assertInvalid(0, 1.4, 10, 1, 0);
    assertInvalid(1, Double.NaN, 10, 1, 0);
    assertInvalid(1, -0.1, 10, 1, 0);
    assertInvalid(1, 1.4, -1, 1, 0);
    assertInvalid(1, 1.4, 10, 0, 0);
    assertInvalid(1, 1.4, 10, 33, 0);
    assertInvalid(1, 1.4, 10, 1, -5);

    // Edge cases that are allowed.
    new SearchSettings(1, 0, 0, 32, 0);
    new SearchSettings(1, Double.POSITIVE_INFINITY, 10);
  }

  private static void assertInvalid(int xiSimulations, double xiBias, int xiIterations, int xiWorkers, long xiLimit)
  {
    try
    {
      new SearchSettings(xiSimulations, xiBias, xiIterations, xiWorkers, xiLimit);
      fail("Accepted invalid settings");
    }
    catch (IllegalArgumentException lEx)
    {
      // Expected.
    }
  }

  @Test
  public void testWorkerIds() throws Exception
  {
    assertEquals(new WorkerId(3), new WorkerId(3));
    assertEquals("worker 31", new WorkerId(31).toString());
    try
    {
      new WorkerId(32);
      fail("Created a worker id beyond the traversal lanes");
    }
    catch (IllegalArgumentException lEx)
    {
      // Expected.
    }
  }

  @Test
  public void testEpochs() throws Exception
  {
    Epoch lNext = Epoch.INITIAL.next();
    assertEquals(1, lNext.getValue());
    assertEquals(lNext, Epoch.INITIAL.next());
    assertNotEquals(Epoch.INITIAL, lNext);
    assertEquals("epoch 2", lNext.next().toString());
  }
}
