package jode.solver;

import java.util.*;

import jode.logging.LoggingException;
import jode.logging.PeriodicLogger;
import jode.model.State;

/**
 * Trajectory produced by one integration: one state per grid point, in
 * increasing time order. Immutable.
 */
public final class SimulationResult
{
	private final List<String> compartments;
	private final double[] times;
	private final State[] states;

	private final int acceptedSteps;
	private final int rejectedSteps;
	private final int evaluations;

	public SimulationResult(List<String> compartments, double[] times, State[] states,
			int acceptedSteps, int rejectedSteps, int evaluations)
	{
		if(times.length != states.length)
			throw new IllegalArgumentException(String.format(
					"%d times but %d states", times.length, states.length));
		for(State state : states)
		{
			if(state == null)
				throw new IllegalArgumentException("Missing state in result.");
			if(!state.getCompartments().equals(compartments))
				throw new IllegalArgumentException(String.format(
						"State compartments %s do not match %s", state.getCompartments(), compartments));
		}

		this.compartments = Collections.unmodifiableList(new ArrayList<String>(compartments));
		this.times = times.clone();
		this.states = states.clone();
		this.acceptedSteps = acceptedSteps;
		this.rejectedSteps = rejectedSteps;
		this.evaluations = evaluations;
	}

	public List<String> getCompartments()
	{
		return compartments;
	}

	public int size()
	{
		return times.length;
	}

	public double getTime(int index)
	{
		return times[index];
	}

	public double[] getTimes()
	{
		return times.clone();
	}

	public State getState(int index)
	{
		return states[index];
	}

	public State getInitialState()
	{
		return states[0];
	}

	public State getFinalState()
	{
		return states[states.length - 1];
	}

	/**
	 * Values of one compartment over time.
	 */
	public double[] getSeries(String compartment)
	{
		int index = states[0].indexOf(compartment);
		double[] series = new double[states.length];
		for(int i = 0; i < states.length; i++)
			series[i] = states[i].get(index);
		return series;
	}

	/**
	 * Long-format view: one row per (time, compartment), time-major,
	 * compartments in model order.
	 */
	public List<TidyRow> toTidyRows()
	{
		List<TidyRow> rows = new ArrayList<TidyRow>(states.length * compartments.size());
		for(int i = 0; i < states.length; i++)
		{
			for(int j = 0; j < compartments.size(); j++)
				rows.add(new TidyRow(times[i], compartments.get(j), states[i].get(j)));
		}
		return rows;
	}

	public int getAcceptedSteps()
	{
		return acceptedSteps;
	}

	public int getRejectedSteps()
	{
		return rejectedSteps;
	}

	public int getEvaluations()
	{
		return evaluations;
	}

	/**
	 * Replays the trajectory into a logger. logEnd is attempted even when
	 * logging a row fails.
	 */
	public void log(PeriodicLogger logger) throws LoggingException
	{
		logger.logStart(compartments);
		try
		{
			for(int i = 0; i < states.length; i++)
				logger.logPeriodic(times[i], states[i]);
		}
		catch(LoggingException e)
		{
			try
			{
				logger.logEnd();
			}
			catch(LoggingException endException)
			{
				e.addSuppressed(endException);
			}
			throw e;
		}
		logger.logEnd();
	}

	@Override
	public String toString()
	{
		return String.format("SimulationResult%s: %d points in [%s, %s], %d steps (%d rejected)",
				compartments, times.length, times[0], times[times.length - 1],
				acceptedSteps + rejectedSteps, rejectedSteps);
	}

	public static final class TidyRow
	{
		private final double time;
		private final String compartment;
		private final double value;

		public TidyRow(double time, String compartment, double value)
		{
			this.time = time;
			this.compartment = compartment;
			this.value = value;
		}

		public double getTime()
		{
			return time;
		}

		public String getCompartment()
		{
			return compartment;
		}

		public double getValue()
		{
			return value;
		}

		@Override
		public String toString()
		{
			return String.format("(%s, %s, %s)", time, compartment, value);
		}
	}
}
