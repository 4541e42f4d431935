package jode.invariant.test;

import java.util.*;

import jode.invariant.*;
import jode.model.State;
import jode.solver.SimulationResult;

import org.junit.*;

import static org.junit.Assert.*;

public class TestInvariantChecker
{
	InvariantChecker checker;
	List<String> compartments;
	
	@Before
	public void setUp()
	{
		checker = new InvariantChecker();
		compartments = Arrays.asList("S", "I");
	}
	
	SimulationResult result(double[][] values)
	{
		double[] times = new double[values.length];
		State[] states = new State[values.length];
		for(int i = 0; i < values.length; i++)
		{
			times[i] = i;
			states[i] = new State(compartments, values[i]);
		}
		return new SimulationResult(compartments, times, states, 0, 0, 0);
	}
	
	@Test
	public void cleanResult()
	{
		SimulationResult r = result(new double[][] { { 999, 1 }, { 900, 100 }, { 0, 1000 } });
		assertTrue(checker.check(r, 1000, 1e-4).isEmpty());
		assertTrue(checker.holds(r, 1000, 0));
	}
	
	@Test
	public void populationDrift()
	{
		SimulationResult r = result(new double[][] { { 999, 1 }, { 990, 9.5 }, { 500, 500.00001 } });
		List<Violation> violations = checker.check(r, 1000, 1e-4);
		
		assertEquals(1, violations.size());
		Violation v = violations.get(0);
		assertEquals(Violation.Kind.POPULATION_NOT_CONSERVED, v.getKind());
		assertEquals(1, v.getIndex());
		assertEquals(1.0, v.getTime(), 0.0);
		assertNull(v.getCompartment());
		assertEquals(999.5, v.getValue(), 1e-12);
	}
	
	@Test
	public void negativeCompartment()
	{
		SimulationResult r = result(new double[][] { { 1000.0000005, -0.0000005 }, { 1000.001, -0.001 } });
		List<Violation> violations = checker.check(r, 1000, 1e-6);
		
		// Small overshoot is accepted as noise
		assertEquals(1, violations.size());
		Violation v = violations.get(0);
		assertEquals(Violation.Kind.NEGATIVE_COMPARTMENT, v.getKind());
		assertEquals(1, v.getIndex());
		assertEquals("I", v.getCompartment());
		assertEquals(-0.001, v.getValue(), 0.0);
		assertTrue(v.toString().contains("I"));
	}
	
	@Test
	public void bothKindsInTimeOrder()
	{
		SimulationResult r = result(new double[][] { { 1002, -2 }, { 1000, 0 }, { 995, 0 } });
		List<Violation> violations = checker.check(r, 1000, 1e-4);
		
		assertEquals(2, violations.size());
		assertEquals(Violation.Kind.NEGATIVE_COMPARTMENT, violations.get(0).getKind());
		assertEquals(0, violations.get(0).getIndex());
		assertEquals(Violation.Kind.POPULATION_NOT_CONSERVED, violations.get(1).getKind());
		assertEquals(2, violations.get(1).getIndex());
	}
	
	@Test
	public void nanIsAViolation()
	{
		SimulationResult r = result(new double[][] { { Double.NaN, 1000 } });
		List<Violation> violations = checker.check(r, 1000, 1e-4);
		assertEquals(2, violations.size());
	}
	
	@Test
	public void resultIsNotModified()
	{
		SimulationResult r = result(new double[][] { { 1001, -2 } });
		checker.check(r, 1000, 1e-4);
		assertEquals(-2.0, r.getState(0).get("I"), 0.0);
	}
}
