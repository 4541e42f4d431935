package epimodel.test;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;

import epimodel.*;
import jode.logging.*;
import jode.model.State;
import jode.solver.SimulationResult;
import jode.util.EasyMap;

import org.junit.*;

import static org.junit.Assert.*;

public class TestTextLogger
{
	SimulationResult result;
	ByteArrayOutputStream bytes;
	PrintStream stream;
	
	@Before
	public void setUp() throws Exception
	{
		result = new SimulationRun().run(Variant.SI, 1000, new EasyMap<String, Double>("I", 1.0),
				new EasyMap<String, Double>("beta", 0.5), 2, 1);
		bytes = new ByteArrayOutputStream();
		stream = new PrintStream(bytes, true, "UTF-8");
	}
	
	String[] lines()
	{
		return new String(bytes.toByteArray(), StandardCharsets.UTF_8).split("\n");
	}
	
	@Test
	public void wideFormat() throws Exception
	{
		result.log(new TextLogger(stream));
		
		String[] lines = lines();
		assertEquals(4, lines.length);
		assertEquals("time,S,I", lines[0]);
		assertEquals("0.000000,999.000000,1.000000", lines[1]);
		assertTrue(lines[3].startsWith("2.000000,"));
	}
	
	@Test
	public void tidyFormat() throws Exception
	{
		result.log(new TidyTextLogger(stream));
		
		String[] lines = lines();
		assertEquals(1 + 3 * 2, lines.length);
		assertEquals("time,compartment,value", lines[0]);
		assertEquals("0.000000,S,999.000000", lines[1]);
		assertEquals("0.000000,I,1.000000", lines[2]);
		assertTrue(lines[6].startsWith("2.000000,I,"));
		assertEquals(result.toTidyRows().size(), lines.length - 1);
	}
	
	@Test
	public void failingLoggerIsClosed() throws Exception
	{
		final boolean[] ended = new boolean[1];
		PeriodicLogger failing = new PeriodicLogger()
		{
			public void logStart(List<String> compartments)
			{
			}
			
			public void logPeriodic(double time, State state) throws LoggingException
			{
				throw new LoggingException(this, "disk full");
			}
			
			public void logEnd()
			{
				ended[0] = true;
			}
		};
		
		try
		{
			result.log(failing);
			fail("Expected LoggingException");
		}
		catch(LoggingException e)
		{
			assertSame(failing, e.getLogger());
			assertTrue(ended[0]);
		}
	}
}
