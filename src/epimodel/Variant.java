package epimodel;

import jode.model.*;

/**
 * The four compartmental epidemic models. Every infection flow uses
 * beta * S * I / N with N the current total population.
 */
public enum Variant
{
	SI("Susceptible-Infectious",
			new String[] { "S", "I" },
			new String[] { "beta" })
	{
		void addFlows(CompartmentModel model) throws ConfigurationException
		{
			addInfection(model, "I");
		}
	},
	
	SIS("Susceptible-Infectious-Susceptible",
			new String[] { "S", "I" },
			new String[] { "beta", "gamma" })
	{
		void addFlows(CompartmentModel model) throws ConfigurationException
		{
			addInfection(model, "I");
			model.addMassActionFlow("I", "S", "gamma", null, DensityMethod.Absolute);
		}
	},
	
	SIR("Susceptible-Infectious-Recovered",
			new String[] { "S", "I", "R" },
			new String[] { "beta", "gamma" })
	{
		void addFlows(CompartmentModel model) throws ConfigurationException
		{
			addInfection(model, "I");
			model.addMassActionFlow("I", "R", "gamma", null, DensityMethod.Absolute);
		}
	},
	
	SEIR("Susceptible-Exposed-Infectious-Recovered",
			new String[] { "S", "E", "I", "R" },
			new String[] { "beta", "sigma", "gamma" })
	{
		void addFlows(CompartmentModel model) throws ConfigurationException
		{
			// Newly infected individuals enter the latent compartment
			addInfection(model, "E");
			model.addMassActionFlow("E", "I", "sigma", null, DensityMethod.Absolute);
			model.addMassActionFlow("I", "R", "gamma", null, DensityMethod.Absolute);
		}
	};
	
	public static final String SUSCEPTIBLE = "S";
	public static final String INFECTIOUS = "I";
	
	private String description;
	private String[] compartments;
	private String[] parameters;
	
	Variant(String description, String[] compartments, String[] parameters)
	{
		this.description = description;
		this.compartments = compartments;
		this.parameters = parameters;
	}
	
	abstract void addFlows(CompartmentModel model) throws ConfigurationException;
	
	private static void addInfection(CompartmentModel model, String destination)
			throws ConfigurationException
	{
		model.addMassActionFlow(SUSCEPTIBLE, destination, "beta",
				new String[] { INFECTIOUS }, DensityMethod.Fractional);
	}
	
	public CompartmentModel createModel() throws ConfigurationException
	{
		CompartmentModel model = new CompartmentModel(name(), compartments);
		model.addParameter(parameters);
		addFlows(model);
		return model;
	}
	
	public String getDescription()
	{
		return description;
	}
	
	public String[] getCompartments()
	{
		return compartments.clone();
	}
	
	public String[] getParameters()
	{
		return parameters.clone();
	}
	
	public boolean hasParameter(String parameter)
	{
		for(String name : parameters)
		{
			if(name.equals(parameter)) return true;
		}
		return false;
	}
}
