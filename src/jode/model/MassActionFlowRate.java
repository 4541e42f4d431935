package jode.model;

/**
 * Mass-action flux: k * source * product of reactants, with each reactant
 * divided by the total population when the density method is Fractional.
 */
public class MassActionFlowRate implements FlowRate
{
	private String source;
	private String parameter;
	private String[] reactants;
	private DensityMethod densityMethod;
	
	public MassActionFlowRate(String source, String parameter, String[] reactants,
			DensityMethod densityMethod)
	{
		this.source = source;
		this.parameter = parameter;
		this.reactants = reactants == null ? new String[0] : reactants.clone();
		this.densityMethod = densityMethod;
	}
	
	public String[] getCompartments()
	{
		String[] names = new String[reactants.length + 1];
		names[0] = source;
		System.arraycopy(reactants, 0, names, 1, reactants.length);
		return names;
	}
	
	public String[] getParameters()
	{
		return new String[] { parameter };
	}
	
	public double getRate(double time, State state, ParameterSet params)
	{
		double rate = params.get(parameter) * state.get(source);
		if(reactants.length == 0) return rate;
		
		double total = state.getTotal();
		for(String reactant : reactants)
		{
			rate *= state.get(reactant);
			switch(densityMethod)
			{
				case Fractional:
					rate /= total;
					break;
				case Absolute:
					break;
			}
		}
		
		return rate;
	}
	
	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append(parameter).append('*').append(source);
		for(String reactant : reactants)
		{
			sb.append('*').append(reactant);
			if(densityMethod == DensityMethod.Fractional) sb.append("/N");
		}
		return sb.toString();
	}
}
