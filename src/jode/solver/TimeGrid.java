package jode.solver;

import java.util.Arrays;

import jode.model.ConfigurationException;

/**
 * Strictly increasing, finite sequence of reporting times.
 */
public final class TimeGrid
{
	// Upper bound on grid size, to catch step/horizon mix-ups early
	public static final int MAX_POINTS = 10000000;
	
	private final double[] times;
	
	public TimeGrid(double... times) throws ConfigurationException
	{
		if(times == null || times.length == 0)
			throw new ConfigurationException("Time grid must contain at least one point.");
		
		for(int i = 0; i < times.length; i++)
		{
			if(Double.isNaN(times[i]) || Double.isInfinite(times[i]))
				throw new ConfigurationException(String.format(
						"Time grid point %d is not finite (%s)", i, times[i]));
			if(i > 0 && !(times[i] > times[i - 1]))
				throw new ConfigurationException(String.format(
						"Time grid must be strictly increasing: t[%d]=%s, t[%d]=%s",
						i - 1, times[i - 1], i, times[i]));
		}
		
		this.times = times.clone();
	}
	
	/**
	 * start, start + step, start + 2 step, ... up to end. The end point is
	 * included when it lies on the lattice, allowing for rounding error.
	 */
	public static TimeGrid uniform(double start, double end, double step) throws ConfigurationException
	{
		if(Double.isNaN(start) || Double.isInfinite(start)
				|| Double.isNaN(end) || Double.isInfinite(end))
			throw new ConfigurationException(String.format(
					"Time grid bounds must be finite: [%s, %s]", start, end));
		if(Double.isNaN(step) || Double.isInfinite(step) || step <= 0)
			throw new ConfigurationException("Time step must be positive and finite, got " + step);
		if(end < start)
			throw new ConfigurationException(String.format(
					"Time grid end %s is before start %s", end, start));
		
		double intervals = Math.floor((end - start) / step + 1e-9);
		if(intervals + 1 > MAX_POINTS)
			throw new ConfigurationException(String.format(
					"Time grid [%s, %s] with step %s has more than %d points",
					start, end, step, MAX_POINTS));
		
		int n = (int)intervals + 1;
		double[] times = new double[n];
		for(int i = 0; i < n; i++)
			times[i] = start + i * step;
		
		// Snap the last point onto end when they only differ by rounding
		if(n > 1 && (times[n - 1] > end
				|| Math.abs(times[n - 1] - end) <= 1e-9 * Math.max(1.0, Math.abs(end))))
			times[n - 1] = end;
		
		return new TimeGrid(times);
	}
	
	public int size()
	{
		return times.length;
	}
	
	public double get(int index)
	{
		return times[index];
	}
	
	public double getStart()
	{
		return times[0];
	}
	
	public double getEnd()
	{
		return times[times.length - 1];
	}
	
	public double[] toArray()
	{
		return times.clone();
	}
	
	@Override
	public String toString()
	{
		if(times.length <= 6)
			return Arrays.toString(times);
		return String.format("[%s, %s, ..., %s] (%d points)",
				times[0], times[1], times[times.length - 1], times.length);
	}
}
