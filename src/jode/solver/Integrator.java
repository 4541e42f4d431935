package jode.solver;

import jode.model.*;

/**
 * Solves the initial value problem of a compartment model and reports the
 * state at every point of a time grid.
 * 
 * Implementations keep no per-run state, so one instance can serve
 * independent runs on several threads.
 */
public interface Integrator
{
	public SimulationResult integrate(CompartmentModel model, State initialState,
			ParameterSet params, TimeGrid grid) throws ConfigurationException, IntegrationException;
}
