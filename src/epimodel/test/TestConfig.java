package epimodel.test;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

import epimodel.*;
import jode.model.ConfigurationException;
import jode.solver.SimulationResult;

import org.junit.*;

import static org.junit.Assert.*;

public class TestConfig
{
	@Test
	public void readJson() throws Exception
	{
		Config config = Config.read(new StringReader(
				"{ \"variant\": \"SEIR\", \"population\": 1000, \"initialCounts\": { \"E\": 5 },"
				+ " \"parameters\": { \"sigma\": 0.2, \"gamma\": 0.1 }, \"R0\": 2.0,"
				+ " \"horizon\": 10, \"step\": 0.5, \"outputFormat\": \"Tidy\", \"runNum\": 3 }"));
		
		assertEquals(Variant.SEIR, config.getVariant());
		assertEquals(1000.0, config.getPopulation(), 0.0);
		assertEquals(5.0, config.getInitialCounts().get("E"), 0.0);
		assertEquals(Config.OutputFormat.Tidy, config.getOutputFormat());
		assertEquals(Integer.valueOf(3), config.getRunNum());
		
		Map<String, Double> parameters = config.resolveParameters();
		assertEquals(0.2, parameters.get("beta"), 1e-12);
		assertEquals(0.1, parameters.get("gamma"), 0.0);
		
		SimulationResult result = Main.simulate(config);
		assertEquals(21, result.size());
		assertEquals(10.0, result.getTime(20), 0.0);
	}
	
	@Test
	public void missingFieldsKeepDefaults() throws Exception
	{
		Config config = Config.read(new StringReader(
				"{ \"variant\": \"SI\", \"parameters\": { \"beta\": 0.3 } }"));
		assertEquals(1.0, config.getStep(), 0.0);
		assertEquals(1e-4, config.getInvariantTolerance(), 0.0);
		assertEquals(Config.OutputFormat.Wide, config.getOutputFormat());
		assertNull(config.getRunNum());
		assertEquals(0.3, config.resolveParameters().get("beta"), 0.0);
	}
	
	@Test
	public void writtenConfigReadsBack() throws Exception
	{
		Config config = Config.defaults(Variant.SEIR);
		Config copy = Config.read(new StringReader(config.toJson()));
		assertEquals(config.getVariant(), copy.getVariant());
		assertEquals(config.resolveParameters(), copy.resolveParameters());
		assertEquals(config.getHorizon(), copy.getHorizon(), 0.0);
	}
	
	@Test
	public void defaultScenarios() throws Exception
	{
		assertEquals(50.0, Config.defaults(Variant.SI).getHorizon(), 0.0);
		assertEquals(150.0, Config.defaults(Variant.SIS).getHorizon(), 0.0);
		assertEquals(1.875, Config.defaults(Variant.SIR).resolveParameters().get("beta"), 1e-12);
		assertEquals(2.5 / 7.0, Config.defaults(Variant.SEIR).resolveParameters().get("beta"), 1e-12);
	}
	
	@Test
	public void exampleConfigsMatchDefaults() throws Exception
	{
		for(Variant variant : Variant.values())
		{
			String path = "config/" + variant.name().toLowerCase(Locale.ROOT) + ".json";
			Reader reader = new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8);
			try
			{
				Config config = Config.read(reader);
				Config defaults = Config.defaults(variant);
				assertEquals(path, variant, config.getVariant());
				assertEquals(path, defaults.getPopulation(), config.getPopulation(), 0.0);
				assertEquals(path, defaults.getHorizon(), config.getHorizon(), 0.0);
				Map<String, Double> expected = defaults.resolveParameters();
				Map<String, Double> actual = config.resolveParameters();
				assertEquals(path, expected.keySet(), actual.keySet());
				for(String name : expected.keySet())
					assertEquals(path + " " + name, expected.get(name), actual.get(name), 1e-12);
			}
			finally
			{
				reader.close();
			}
		}
	}
	
	@Test(expected = ConfigurationException.class)
	public void betaAndR0() throws Exception
	{
		Config.read(new StringReader(
				"{ \"variant\": \"SIR\", \"parameters\": { \"beta\": 1, \"gamma\": 0.1 }, \"R0\": 3 }"))
				.resolveParameters();
	}
	
	@Test(expected = ConfigurationException.class)
	public void r0WithoutGamma() throws Exception
	{
		Config.read(new StringReader("{ \"variant\": \"SI\", \"parameters\": {}, \"R0\": 3 }"))
				.resolveParameters();
	}
	
	@Test(expected = ConfigurationException.class)
	public void unknownVariant() throws Exception
	{
		Config.read(new StringReader("{ \"variant\": \"SIRS\" }"));
	}
	
	@Test(expected = ConfigurationException.class)
	public void malformedJson() throws Exception
	{
		Config.read(new StringReader("{ \"variant\": "));
	}
}
