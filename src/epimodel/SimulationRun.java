package epimodel;

import java.util.*;

import jode.model.*;
import jode.solver.*;

/**
 * Validates the inputs of one epidemic simulation, builds the model, the
 * initial state and the time grid, and hands them to an integrator.
 * No I/O happens here.
 */
public class SimulationRun
{
	private Integrator integrator;
	
	public SimulationRun()
	{
		this(new DormandPrinceIntegrator());
	}
	
	public SimulationRun(Integrator integrator)
	{
		this.integrator = integrator;
	}
	
	/**
	 * Transmission rate for a basic reproduction number: beta = R0 * gamma.
	 */
	public static double betaFromR0(double r0, double gamma)
	{
		return r0 * gamma;
	}
	
	/**
	 * Runs a variant from t = 0 to horizon, reporting every step time units.
	 * 
	 * @param initialCounts starting counts by compartment name; compartments
	 *        left out start at zero, and whatever the counts leave of the
	 *        population is added to the susceptible compartment
	 */
	public SimulationResult run(Variant variant, double population, Map<String, Double> initialCounts,
			Map<String, Double> parameters, double horizon, double step)
			throws ConfigurationException, IntegrationException
	{
		CompartmentModel model = variant.createModel();
		State initialState = buildInitialState(model, population, initialCounts);
		ParameterSet params = buildParameters(variant, parameters);
		TimeGrid grid = buildTimeGrid(horizon, step);
		
		return integrator.integrate(model, initialState, params, grid);
	}
	
	static State buildInitialState(CompartmentModel model, double population,
			Map<String, Double> initialCounts) throws ConfigurationException
	{
		if(Double.isNaN(population) || Double.isInfinite(population) || population <= 0)
			throw new ConfigurationException("Population must be positive, got " + population);
		
		double assigned = 0;
		for(Map.Entry<String, Double> entry : initialCounts.entrySet())
		{
			Double count = entry.getValue();
			if(count == null || count.isNaN() || count.isInfinite() || count < 0)
				throw new ConfigurationException(String.format(
						"Initial count of %s must be a non-negative number, got %s",
						entry.getKey(), count));
			assigned += count;
		}
		if(assigned > population)
			throw new ConfigurationException(String.format(
					"Initial counts %s sum to %s, more than the population %s",
					initialCounts, assigned, population));
		
		Map<String, Double> counts = new LinkedHashMap<String, Double>(initialCounts);
		Double susceptible = counts.get(Variant.SUSCEPTIBLE);
		counts.put(Variant.SUSCEPTIBLE, (susceptible == null ? 0.0 : susceptible) + (population - assigned));
		
		return model.createState(counts);
	}
	
	static ParameterSet buildParameters(Variant variant, Map<String, Double> parameters)
			throws ConfigurationException
	{
		for(String name : parameters.keySet())
		{
			if(!variant.hasParameter(name))
				throw new ConfigurationException(String.format(
						"%s model has no parameter %s; expected %s",
						variant, name, Arrays.asList(variant.getParameters())));
		}
		for(String name : variant.getParameters())
		{
			Double value = parameters.get(name);
			if(value == null)
				throw new ConfigurationException(String.format("%s model needs parameter %s", variant, name));
			if(value < 0)
				throw new ConfigurationException(String.format(
						"Parameter %s must not be negative, got %s", name, value));
		}
		return new ParameterSet(parameters);
	}
	
	static TimeGrid buildTimeGrid(double horizon, double step) throws ConfigurationException
	{
		if(Double.isNaN(horizon) || Double.isInfinite(horizon) || horizon <= 0)
			throw new ConfigurationException("Horizon must be positive, got " + horizon);
		if(Double.isNaN(step) || Double.isInfinite(step) || step <= 0)
			throw new ConfigurationException("Step must be positive, got " + step);
		if(step > horizon)
			throw new ConfigurationException(String.format(
					"Step %s is larger than the horizon %s", step, horizon));
		
		return TimeGrid.uniform(0, horizon, step);
	}
}
