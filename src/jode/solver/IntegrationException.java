package jode.solver;

import jode.model.SimulationException;

/**
 * Thrown when the integrator cannot advance the solution. No partial result
 * is returned; {@link #getLastTime()} tells how far the solution got.
 */
@SuppressWarnings("serial")
public class IntegrationException extends SimulationException
{
	private double lastTime;
	
	public IntegrationException(String message, double lastTime)
	{
		super(message + " (last time reached: " + lastTime + ")");
		this.lastTime = lastTime;
	}
	
	public IntegrationException(String message, double lastTime, Throwable cause)
	{
		super(message + " (last time reached: " + lastTime + ")", cause);
		this.lastTime = lastTime;
	}
	
	public double getLastTime()
	{
		return lastTime;
	}
}
