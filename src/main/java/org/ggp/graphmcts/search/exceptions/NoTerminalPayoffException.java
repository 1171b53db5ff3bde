package org.ggp.graphmcts.search.exceptions;

/**
 * A state with no legal actions produced no payoff.  This means the game implementation is inconsistent, so it isn't
 * recoverable.
 */
@SuppressWarnings("serial")
public class NoTerminalPayoffException extends IllegalStateException
{
  public NoTerminalPayoffException(Object xiState)
  {
    super("State has no legal actions but no payoff: " + xiState);
  }
}
