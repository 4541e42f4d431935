package jode.solver.test;

import jode.model.ConfigurationException;
import jode.solver.TimeGrid;

import org.junit.*;

import static org.junit.Assert.*;

public class TestTimeGrid
{
	@Test
	public void unitStepIncludesHorizon() throws Exception
	{
		TimeGrid grid = TimeGrid.uniform(0, 50, 1);
		assertEquals(51, grid.size());
		assertEquals(0.0, grid.getStart(), 0.0);
		assertEquals(50.0, grid.getEnd(), 0.0);
		assertEquals(17.0, grid.get(17), 0.0);
	}
	
	@Test
	public void fractionalStepHitsEndExactly() throws Exception
	{
		TimeGrid grid = TimeGrid.uniform(0, 1, 0.1);
		assertEquals(11, grid.size());
		assertEquals(1.0, grid.getEnd(), 0.0);
	}
	
	@Test
	public void endOffLatticeIsDropped() throws Exception
	{
		TimeGrid grid = TimeGrid.uniform(0, 5, 2);
		assertArrayEquals(new double[] { 0, 2, 4 }, grid.toArray(), 0.0);
	}
	
	@Test
	public void nonUniformGrid() throws Exception
	{
		TimeGrid grid = new TimeGrid(-1, 0.5, 0.75, 10);
		assertEquals(4, grid.size());
		assertEquals(-1.0, grid.getStart(), 0.0);
	}
	
	@Test(expected = ConfigurationException.class)
	public void repeatedTime() throws Exception
	{
		new TimeGrid(0, 1, 1, 2);
	}
	
	@Test(expected = ConfigurationException.class)
	public void decreasingTime() throws Exception
	{
		new TimeGrid(0, 2, 1);
	}
	
	@Test(expected = ConfigurationException.class)
	public void emptyGrid() throws Exception
	{
		new TimeGrid();
	}
	
	@Test(expected = ConfigurationException.class)
	public void nonFiniteTime() throws Exception
	{
		new TimeGrid(0, Double.POSITIVE_INFINITY);
	}
	
	@Test(expected = ConfigurationException.class)
	public void zeroStep() throws Exception
	{
		TimeGrid.uniform(0, 10, 0);
	}
	
	@Test(expected = ConfigurationException.class)
	public void endBeforeStart() throws Exception
	{
		TimeGrid.uniform(10, 0, 1);
	}
}
