package epimodel;

import java.io.Reader;
import java.util.*;

import com.google.gson.*;

import jode.model.ConfigurationException;
import jode.util.EasyMap;

public class Config {
	Variant variant = Variant.SIR;
	
	// Total population N
	double population = 100000;
	
	// Starting counts by compartment; the rest of the population is susceptible
	Map<String, Double> initialCounts = new EasyMap<String, Double>("I", 10.0);
	
	// Rate constants by name (beta, gamma, sigma)
	Map<String, Double> parameters = new EasyMap<String, Double>("beta", 15.0 / 8.0, "gamma", 1.0 / 8.0);
	
	// If set, beta is derived as R0 * gamma
	Double R0 = null;
	
	// Simulated time span [0, horizon], reported every step
	double horizon = 100;
	double step = 1.0;
	
	// Integrator error tolerances
	double relativeTolerance = 1e-6;
	double absoluteTolerance = 1e-8;
	
	// Allowed deviation when checking conservation and non-negativity
	double invariantTolerance = 1e-4;
	
	// If failOnViolation == true, invariant violations make the run fail;
	// otherwise they are only reported
	boolean failOnViolation = false;
	
	// "Wide" writes one column per compartment;
	// "Tidy" writes one (time, compartment, value) row per line
	public enum OutputFormat
	{
		Wide,
		Tidy
	}
	
	OutputFormat outputFormat = OutputFormat.Wide;
	
	Integer runNum = null;
	
	/**
	 * The standard scenario for each variant.
	 */
	public static Config defaults(Variant variant) {
		Config config = new Config();
		config.variant = variant;
		switch(variant) {
			case SI:
				config.population = 1000;
				config.initialCounts = new EasyMap<String, Double>("I", 1.0);
				config.parameters = new EasyMap<String, Double>("beta", 0.5);
				config.R0 = null;
				config.horizon = 50;
				break;
			case SIS:
				config.population = 1000;
				config.initialCounts = new EasyMap<String, Double>("I", 1.0);
				config.parameters = new EasyMap<String, Double>("beta", 0.5, "gamma", 0.1);
				config.R0 = null;
				config.horizon = 150;
				break;
			case SIR:
				// Measles-like outbreak
				config.population = 100000;
				config.initialCounts = new EasyMap<String, Double>("I", 10.0, "R", 0.0);
				config.parameters = new EasyMap<String, Double>("gamma", 1.0 / 8.0);
				config.R0 = 15.0;
				config.horizon = 100;
				break;
			case SEIR:
				config.population = 100000;
				config.initialCounts = new EasyMap<String, Double>("E", 10.0, "I", 0.0, "R", 0.0);
				config.parameters = new EasyMap<String, Double>("sigma", 1.0 / 5.0, "gamma", 1.0 / 7.0);
				config.R0 = 2.5;
				config.horizon = 200;
				break;
		}
		return config;
	}
	
	public static Config read(Reader reader) throws ConfigurationException {
		try {
			Config config = new Gson().fromJson(reader, Config.class);
			if(config == null)
				throw new ConfigurationException("Configuration is empty.");
			if(config.variant == null)
				throw new ConfigurationException("Unknown or missing model variant.");
			if(config.initialCounts == null)
				config.initialCounts = new EasyMap<String, Double>();
			if(config.parameters == null)
				config.parameters = new EasyMap<String, Double>();
			if(config.outputFormat == null)
				config.outputFormat = OutputFormat.Wide;
			return config;
		}
		catch(JsonParseException e) {
			throw new ConfigurationException("Malformed configuration: " + e.getMessage(), e);
		}
	}
	
	public String toJson() {
		return new GsonBuilder().setPrettyPrinting().serializeNulls().create().toJson(this);
	}
	
	/**
	 * Parameter values with beta filled in from R0 when R0 is given.
	 */
	public Map<String, Double> resolveParameters() throws ConfigurationException {
		Map<String, Double> resolved = new EasyMap<String, Double>(parameters);
		if(R0 != null) {
			if(parameters.containsKey("beta"))
				throw new ConfigurationException("Give either beta or R0, not both.");
			Double gamma = parameters.get("gamma");
			if(gamma == null)
				throw new ConfigurationException("R0 needs a recovery rate gamma to derive beta; the "
						+ variant + " model has none, give beta instead.");
			resolved.put("beta", SimulationRun.betaFromR0(R0, gamma));
		}
		return resolved;
	}
	
	public Variant getVariant() {
		return variant;
	}
	
	public double getPopulation() {
		return population;
	}
	
	public Map<String, Double> getInitialCounts() {
		return initialCounts;
	}
	
	public double getHorizon() {
		return horizon;
	}
	
	public double getStep() {
		return step;
	}
	
	public double getInvariantTolerance() {
		return invariantTolerance;
	}
	
	public OutputFormat getOutputFormat() {
		return outputFormat;
	}
	
	public Integer getRunNum() {
		return runNum;
	}
}
