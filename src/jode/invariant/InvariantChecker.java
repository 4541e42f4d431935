package jode.invariant;

import java.util.*;

import jode.model.State;
import jode.solver.SimulationResult;

/**
 * Checks a finished trajectory for population conservation and
 * non-negativity. Violations are returned as data; the result is not
 * touched.
 */
public class InvariantChecker
{
	public List<Violation> check(SimulationResult result, double population, double tolerance)
	{
		if(!(tolerance >= 0) || Double.isInfinite(tolerance))
			throw new IllegalArgumentException("Tolerance must be a non-negative number, got " + tolerance);
		
		List<Violation> violations = new ArrayList<Violation>();
		List<String> compartments = result.getCompartments();
		
		for(int i = 0; i < result.size(); i++)
		{
			State state = result.getState(i);
			double time = result.getTime(i);
			
			double total = state.getTotal();
			if(!(Math.abs(total - population) <= tolerance))
				violations.add(new Violation(i, time, Violation.Kind.POPULATION_NOT_CONSERVED, null, total));
			
			for(int j = 0; j < state.size(); j++)
			{
				double value = state.get(j);
				if(!(value >= -tolerance))
					violations.add(new Violation(i, time, Violation.Kind.NEGATIVE_COMPARTMENT,
							compartments.get(j), value));
			}
		}
		
		return violations;
	}
	
	public boolean holds(SimulationResult result, double population, double tolerance)
	{
		return check(result, population, tolerance).isEmpty();
	}
}
