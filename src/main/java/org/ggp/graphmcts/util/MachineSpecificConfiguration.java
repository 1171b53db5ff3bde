package org.ggp.graphmcts.util;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map.Entry;
import java.util.Properties;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Class giving access to search configuration.
 *
 * Values are taken from (highest priority first) unit-test overrides, the machine-specific file
 * data/cfg/&lt;COMPUTERNAME or HOSTNAME&gt;.properties, the graphmcts.properties classpath resource and finally the
 * defaults built into {@link CfgItem}.
 */
public class MachineSpecificConfiguration
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final String DEFAULTS_RESOURCE = "graphmcts.properties";

  /**
   * Available configuration items.
   */
  public static enum CfgItem
  {
    /**
     * The number of search worker threads.  By default, we calculate based on the number of available CPUs.
     */
    WORKER_THREADS(-1),

    /**
     * Whether to run all iterations on the calling thread.  Used to disable threading for debugging.
     */
    RUN_SYNCHRONOUSLY(false),

    /**
     * Number of random playouts per simulation.
     */
    SIMULATION_COUNT(1),

    /**
     * UCB1 exploration bias.
     */
    EXPLORE_BIAS("1.4"),

    /**
     * Number of iterations per search round.
     */
    ITERATION_COUNT(1000),

    /**
     * Wall-clock limit on a search round, in milliseconds.  0 for no limit.
     */
    ROUND_TIME_LIMIT_MS(0),

    /**
     * Whether to prune the graph to the new root when an action is committed.
     */
    PRUNE_ON_COMMIT(true),

    /**
     * Number of vertices to allow for in a new search graph before it needs to grow.
     */
    INITIAL_POOL_SIZE(4096);

    /**
     * Default value, as a string.
     */
    public final String mDefault;

    private CfgItem(String xiDefault)
    {
      mDefault = xiDefault;
    }

    private CfgItem(int xiDefault)
    {
      mDefault = "" + xiDefault;
    }

    private CfgItem(boolean xiDefault)
    {
      mDefault = xiDefault ? "true" : "false";
    }
  }

  private static final Properties MACHINE_PROPERTIES = new Properties();
  private static final Properties UT_OVERRIDES = new Properties();
  static
  {
    try (InputStream lDefaults = MachineSpecificConfiguration.class.getClassLoader()
                                                                   .getResourceAsStream(DEFAULTS_RESOURCE))
    {
      if (lDefaults != null)
      {
        MACHINE_PROPERTIES.load(lDefaults);
      }
    }
    catch (IOException lEx)
    {
      LOGGER.error("Invalid " + DEFAULTS_RESOURCE, lEx);
    }

    // Computer is identified by the COMPUTERNAME environment variable (Windows) or HOSTNAME (Linux).
    String lComputerName = System.getenv("COMPUTERNAME");
    if (lComputerName == null)
    {
      lComputerName = System.getenv("HOSTNAME");
    }

    if (lComputerName != null)
    {
      Path lMachineFile = Paths.get("data", "cfg", lComputerName + ".properties");
      if (Files.isReadable(lMachineFile))
      {
        try (InputStream lPropStream = new FileInputStream(lMachineFile.toFile()))
        {
          MACHINE_PROPERTIES.load(lPropStream);
        }
        catch (IOException lEx)
        {
          LOGGER.error("Invalid machine-specific configuration for " + lComputerName, lEx);
        }
      }
    }
  }

  private MachineSpecificConfiguration()
  {
    // Private default constructor.
  }

  /**
   * @return the specified String configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static String getCfgStr(CfgItem xiKey)
  {
    String lValue = UT_OVERRIDES.getProperty(xiKey.toString());
    if (lValue == null)
    {
      lValue = MACHINE_PROPERTIES.getProperty(xiKey.toString(), xiKey.mDefault);
    }
    return lValue.trim();
  }

  /**
   * @return the specified integer configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static int getCfgInt(CfgItem xiKey)
  {
    return Integer.parseInt(getCfgStr(xiKey));
  }

  /**
   * @return the specified floating point configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static double getCfgDouble(CfgItem xiKey)
  {
    return Double.parseDouble(getCfgStr(xiKey));
  }

  /**
   * @return the specified boolean configuration value, or the default if not configured.
   *
   * @param xiKey - the configuration item.
   */
  public static boolean getCfgBool(CfgItem xiKey)
  {
    return Boolean.parseBoolean(getCfgStr(xiKey));
  }

  /**
   * Log all configured values, warning about any that aren't recognised.
   */
  public static void logConfig()
  {
    logConfig(MACHINE_PROPERTIES);
  }

  /**
   * Log a set of configured values.
   *
   * @param xiProperties - the values.
   *
   * @return the keys that don't name a configuration item.
   */
  static List<String> logConfig(Properties xiProperties)
  {
    List<String> lUnknown = new ArrayList<>();
    LOGGER.info("Running with configured properties:");
    for (Entry<Object, Object> e : xiProperties.entrySet())
    {
      // Get the key.
      String lKey = (String)e.getKey();

      // Check that this is a known configuration parameter (and not a typo in the config file).
      try
      {
        CfgItem lItem = CfgItem.valueOf(lKey);
        LOGGER.info("\t" + lKey + " = " + e.getValue() + " (default: " + lItem.mDefault + ")");
      }
      catch (IllegalArgumentException lEx)
      {
        LOGGER.warn("Unknown configuration parameter: '" + lKey + "'");
        lUnknown.add(lKey);
      }
    }
    return lUnknown;
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, String xiValue)
  {
    UT_OVERRIDES.setProperty(xiKey.toString(), xiValue);
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, boolean xiValue)
  {
    utOverrideCfgVal(xiKey, xiValue ? "true" : "false");
  }

  /**
   * UT-only method for overriding configuration.
   *
   * @param xiKey - the property to override.
   * @param xiValue - the new value.
   */
  public static void utOverrideCfgVal(CfgItem xiKey, int xiValue)
  {
    utOverrideCfgVal(xiKey, "" + xiValue);
  }

  /**
   * UT-only method for removing all overrides.
   */
  public static void utResetOverrides()
  {
    UT_OVERRIDES.clear();
  }
}
