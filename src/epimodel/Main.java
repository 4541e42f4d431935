package epimodel;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

import jode.invariant.*;
import jode.logging.*;
import jode.model.*;
import jode.solver.*;

/**
 * Command-line entry point.
 * 
 * <pre>
 * Main config.json        run the model described by a JSON configuration
 * Main --variant SEIR     run the standard scenario of one variant
 * </pre>
 */
public class Main
{
	public static void main(String[] args) throws Throwable
	{
		if(args.length == 0)
		{
			System.err.println("Usage: Main <config.json> | --variant SI|SIS|SIR|SEIR");
			System.exit(1);
		}
		
		try
		{
			Config config = loadConfig(args);
			int status = run(config);
			if(status != 0) System.exit(status);
		}
		catch(SimulationException e)
		{
			System.err.println("Simulation failed: " + e.getMessage());
			System.exit(1);
		}
	}
	
	static Config loadConfig(String[] args) throws IOException, ConfigurationException
	{
		if(args[0].equals("--variant"))
		{
			if(args.length < 2)
				throw new ConfigurationException("--variant needs one of " + Arrays.toString(Variant.values()));
			try
			{
				return Config.defaults(Variant.valueOf(args[1].toUpperCase(Locale.ROOT)));
			}
			catch(IllegalArgumentException e)
			{
				throw new ConfigurationException("Unknown variant " + args[1], e);
			}
		}
		
		Reader r = new InputStreamReader(new FileInputStream(args[0]), StandardCharsets.UTF_8);
		try
		{
			return Config.read(r);
		}
		finally
		{
			r.close();
		}
	}
	
	static int run(Config config) throws IOException, SimulationException
	{
		// Write parameters file as read
		PrintStream paramsStream = Util.openBufferedPrintStream(
				Util.runFilename("parameters_out", "json", config.runNum));
		paramsStream.println(config.toJson());
		paramsStream.close();
		
		System.err.println("Start date: " + new Date());
		SimulationResult result = simulate(config);
		
		List<Violation> violations = new InvariantChecker().check(
				result, config.population, config.invariantTolerance);
		for(Violation violation : violations)
			System.err.println("Invariant violation: " + violation);
		
		String filename = Util.runFilename(
				config.outputFormat == Config.OutputFormat.Tidy ? "output_tidy" : "output",
				"csv", config.runNum);
		try
		{
			result.log(createLogger(config, filename));
		}
		catch(LoggingException e)
		{
			throw new SimulationException("Logging exception thrown", e);
		}
		
		System.err.println("End date: " + new Date());
		System.err.printf("%s (%s) model simulation complete (%d steps, %d rejected). Output saved as %s%n",
				config.variant, config.variant.getDescription(), result.getAcceptedSteps() + result.getRejectedSteps(),
				result.getRejectedSteps(), filename);
		
		if(!violations.isEmpty() && config.failOnViolation)
		{
			System.err.printf("%d invariant violation(s)%n", violations.size());
			return 2;
		}
		return 0;
	}
	
	public static SimulationResult simulate(Config config) throws ConfigurationException, IntegrationException
	{
		Integrator integrator = new DormandPrinceIntegrator(
				config.relativeTolerance, config.absoluteTolerance);
		return new SimulationRun(integrator).run(config.variant, config.population,
				config.initialCounts, config.resolveParameters(), config.horizon, config.step);
	}
	
	static PeriodicLogger createLogger(Config config, String filename)
	{
		switch(config.outputFormat)
		{
			case Tidy:
				return new TidyTextLogger(filename);
			default:
				return new TextLogger(filename);
		}
	}
}
