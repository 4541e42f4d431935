package jode.model;

/**
 * Rate function for a flow between two compartments. The returned value is
 * the total number of individuals moved per unit time, not a per-capita rate.
 * 
 * Every compartment and parameter read by {@link #getRate} must be listed by
 * {@link #getCompartments()} and {@link #getParameters()}; the model checks
 * these names when the flow is added.
 */
public interface FlowRate
{
	public String[] getCompartments();
	public String[] getParameters();
	
	public double getRate(double time, State state, ParameterSet params);
}
