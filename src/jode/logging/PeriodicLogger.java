package jode.logging;

import java.util.List;

import jode.model.State;

/**
 * Receives a simulated trajectory one reporting time at a time.
 * Used by exporters that turn a result into text, tables or plots.
 */
public interface PeriodicLogger
{
	public void logStart(List<String> compartments) throws LoggingException;
	public void logPeriodic(double time, State state) throws LoggingException;
	public void logEnd() throws LoggingException;
}
