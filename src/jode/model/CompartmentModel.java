package jode.model;

import java.util.*;

import jode.util.ArrayUtils;

/**
 * A closed-population compartmental model: a fixed, ordered set of named
 * compartments and a list of flows that move individuals from one
 * compartment to another.
 *
 * The derivative of each compartment is the sum of its inflows minus the
 * sum of its outflows, so the derivatives always sum to zero and the total
 * population is conserved by construction.
 *
 * All compartment and parameter names used by a flow are checked when the
 * flow is added; a model that builds without a ConfigurationException can
 * never look up an undeclared name during integration.
 */
public class CompartmentModel
{
	private String name;

	private List<String> compartments;
	private Map<String, Integer> indexes;

	private Set<String> parameters;
	private List<Flow> flows;

	public CompartmentModel(String name, String... compartments) throws ConfigurationException
	{
		if(compartments == null || compartments.length == 0)
			throw new ConfigurationException("Model " + name + " needs at least one compartment.");

		this.name = name;

		List<String> names = new ArrayList<String>(compartments.length);
		Set<String> seen = new HashSet<String>();
		for(String compartment : compartments)
		{
			if(compartment == null || compartment.isEmpty())
				throw new ConfigurationException("Model " + name + ": empty compartment name in "
						+ ArrayUtils.arrayToLongString(compartments));
			if(!seen.add(compartment))
				throw new ConfigurationException("Model " + name + ": duplicate compartment "
						+ compartment + " in " + ArrayUtils.arrayToLongString(compartments));
			names.add(compartment);
		}
		this.compartments = Collections.unmodifiableList(names);
		this.indexes = State.buildIndexes(this.compartments);

		parameters = new LinkedHashSet<String>();
		flows = new ArrayList<Flow>();
	}

	public void addParameter(String... names) throws ConfigurationException
	{
		for(String parameter : names)
		{
			if(parameter == null || parameter.isEmpty())
				throw new ConfigurationException("Model " + name + ": empty parameter name.");
			if(!parameters.add(parameter))
				throw new ConfigurationException("Model " + name + ": duplicate parameter " + parameter);
		}
	}

	public void addMassActionFlow(String from, String to, String parameter, String[] reactants,
			DensityMethod densityMethod) throws ConfigurationException
	{
		addFlow(from, to, new MassActionFlowRate(from, parameter, reactants, densityMethod));
	}

	public void addFlow(String from, String to, FlowRate rateFunction) throws ConfigurationException
	{
		checkCompartment(from, "source");
		checkCompartment(to, "destination");
		if(from.equals(to))
			throw new ConfigurationException(String.format(
					"Model %s: flow %s->%s has the same source and destination", name, from, to));

		for(String compartment : rateFunction.getCompartments())
		{
			if(!indexes.containsKey(compartment))
				throw new ConfigurationException(String.format(
						"Model %s: flow %s->%s reads undeclared compartment %s",
						name, from, to, compartment));
		}
		for(String parameter : rateFunction.getParameters())
		{
			if(!parameters.contains(parameter))
				throw new ConfigurationException(String.format(
						"Model %s: flow %s->%s reads undeclared parameter %s",
						name, from, to, parameter));
		}

		flows.add(new Flow(from, to, rateFunction));
	}

	private void checkCompartment(String compartment, String role) throws ConfigurationException
	{
		if(compartment == null || !indexes.containsKey(compartment))
			throw new ConfigurationException(String.format(
					"Model %s: flow %s %s is not a declared compartment %s",
					name, role, compartment, compartments));
	}

	public String getName()
	{
		return name;
	}

	public List<String> getCompartments()
	{
		return compartments;
	}

	public Set<String> getParameters()
	{
		return Collections.unmodifiableSet(parameters);
	}

	/**
	 * Flows in the order they were added, formatted as "from->to".
	 */
	public List<String> getFlows()
	{
		List<String> names = new ArrayList<String>(flows.size());
		for(Flow flow : flows)
			names.add(flow.toString());
		return names;
	}

	/**
	 * Checks that every declared parameter has a value.
	 */
	public void validate(ParameterSet params) throws ConfigurationException
	{
		List<String> missing = new ArrayList<String>();
		for(String parameter : parameters)
		{
			if(!params.contains(parameter))
				missing.add(parameter);
		}
		if(!missing.isEmpty())
			throw new ConfigurationException("Model " + name + ": missing parameter(s) " + missing);
	}

	/**
	 * Checks that a state can serve as the initial condition of this model:
	 * same compartments in the same order, finite values, positive total.
	 */
	public void checkInitialState(State state) throws ConfigurationException
	{
		if(!compartments.equals(state.getCompartments()))
			throw new ConfigurationException(String.format(
					"Model %s has compartments %s but the state has %s",
					name, compartments, state.getCompartments()));

		for(int i = 0; i < state.size(); i++)
		{
			double value = state.get(i);
			if(Double.isNaN(value) || Double.isInfinite(value))
				throw new ConfigurationException(String.format(
						"Model %s: initial value of %s is not finite (%s)",
						name, compartments.get(i), value));
		}

		// Fractional rates divide by the total
		if(!(state.getTotal() > 0))
			throw new ConfigurationException(String.format(
					"Model %s: total population must be positive, got %s", name, state.getTotal()));
	}

	/**
	 * Builds a state of this model from a name-to-value map. Compartments
	 * missing from the map start at zero.
	 */
	public State createState(Map<String, Double> values) throws ConfigurationException
	{
		double[] array = new double[compartments.size()];
		for(Map.Entry<String, Double> entry : values.entrySet())
		{
			Integer index = indexes.get(entry.getKey());
			if(index == null)
				throw new ConfigurationException(String.format(
						"Model %s has no compartment %s", name, entry.getKey()));
			if(entry.getValue() == null)
				throw new ConfigurationException("No value for compartment " + entry.getKey());
			array[index] = entry.getValue();
		}
		return new State(compartments, indexes, array);
	}

	/**
	 * Rates of change of every compartment. Pure: the result depends only on
	 * the arguments. Negative compartment values are evaluated with the same
	 * formulas as positive ones.
	 */
	public Map<String, Double> derivatives(double time, State state, ParameterSet params)
	{
		if(!compartments.equals(state.getCompartments()))
			throw new IllegalArgumentException(String.format(
					"State compartments %s do not match model %s %s",
					state.getCompartments(), name, compartments));

		double[] rates = new double[compartments.size()];
		accumulate(flows.toArray(new CompartmentModel.Flow[0]), time, state, params, rates);

		Map<String, Double> result = new LinkedHashMap<String, Double>();
		for(int i = 0; i < rates.length; i++)
			result.put(compartments.get(i), rates[i]);
		return result;
	}

	/**
	 * Binds a parameter set to this model, producing the array-form right-hand
	 * side used by integrators. Flows added afterwards do not affect the
	 * returned function.
	 */
	public DerivativeFunction bind(final ParameterSet params) throws ConfigurationException
	{
		validate(params);

		final Flow[] boundFlows = flows.toArray(new CompartmentModel.Flow[0]);
		final int dimension = compartments.size();

		return new DerivativeFunction()
		{
			public int getDimension()
			{
				return dimension;
			}

			public void computeDerivatives(double time, double[] y, double[] yDot)
			{
				State state = new State(compartments, indexes, y.clone());
				Arrays.fill(yDot, 0.0);
				accumulate(boundFlows, time, state, params, yDot);
			}
		};
	}

	private static void accumulate(Flow[] flowArray, double time, State state,
			ParameterSet params, double[] rates)
	{
		for(Flow flow : flowArray)
		{
			double flux = flow.rateFunction.getRate(time, state, params);
			rates[flow.fromIndex] -= flux;
			rates[flow.toIndex] += flux;
		}
	}

	@Override
	public String toString()
	{
		return name + compartments + " " + getFlows();
	}

	private class Flow
	{
		private String from;
		private String to;
		private int fromIndex;
		private int toIndex;
		private FlowRate rateFunction;

		public Flow(String from, String to, FlowRate rateFunction)
		{
			this.from = from;
			this.to = to;
			this.fromIndex = indexes.get(from);
			this.toIndex = indexes.get(to);
			this.rateFunction = rateFunction;
		}

		public String toString()
		{
			return from + "->" + to;
		}
	}
}
