package jode.model;

import java.util.*;

/**
 * Immutable snapshot of the number of individuals in each compartment,
 * in the compartment order of the model that produced it.
 */
public final class State
{
	private final List<String> compartments;
	private final Map<String, Integer> indexes;
	private final double[] values;
	
	public State(List<String> compartments, double[] values)
	{
		this(Collections.unmodifiableList(new ArrayList<String>(compartments)),
				buildIndexes(compartments), values.clone());
	}
	
	// Shares the name list and index map; caller hands over the array
	State(List<String> compartments, Map<String, Integer> indexes, double[] values)
	{
		if(compartments.size() != values.length)
			throw new IllegalArgumentException(String.format(
					"%d compartments but %d values", compartments.size(), values.length));
		
		this.compartments = compartments;
		this.indexes = indexes;
		this.values = values;
	}
	
	static Map<String, Integer> buildIndexes(List<String> compartments)
	{
		Map<String, Integer> indexes = new HashMap<String, Integer>(compartments.size() * 2);
		for(int i = 0; i < compartments.size(); i++)
		{
			String name = compartments.get(i);
			if(name == null)
				throw new IllegalArgumentException("Compartment names must not be null.");
			if(indexes.put(name, i) != null)
				throw new IllegalArgumentException("Duplicate compartment " + name);
		}
		return Collections.unmodifiableMap(indexes);
	}
	
	/**
	 * Returns a state over the same compartments with new values.
	 * The array is copied.
	 */
	public State withValues(double[] newValues)
	{
		return new State(compartments, indexes, newValues.clone());
	}
	
	public List<String> getCompartments()
	{
		return compartments;
	}
	
	public int size()
	{
		return values.length;
	}
	
	public boolean hasCompartment(String compartment)
	{
		return indexes.containsKey(compartment);
	}
	
	public int indexOf(String compartment)
	{
		Integer index = indexes.get(compartment);
		if(index == null)
			throw new IllegalArgumentException("Unknown compartment " + compartment);
		return index;
	}
	
	public double get(String compartment)
	{
		return values[indexOf(compartment)];
	}
	
	public double get(int index)
	{
		return values[index];
	}
	
	/**
	 * Sum over all compartments, i.e. the current population size.
	 */
	public double getTotal()
	{
		double total = 0;
		for(double value : values)
			total += value;
		return total;
	}
	
	public double[] toArray()
	{
		return values.clone();
	}
	
	public Map<String, Double> toMap()
	{
		Map<String, Double> map = new LinkedHashMap<String, Double>();
		for(int i = 0; i < values.length; i++)
			map.put(compartments.get(i), values[i]);
		return map;
	}
	
	@Override
	public boolean equals(Object obj)
	{
		if(this == obj) return true;
		if(!(obj instanceof State)) return false;
		
		State other = (State)obj;
		return compartments.equals(other.compartments) && Arrays.equals(values, other.values);
	}
	
	@Override
	public int hashCode()
	{
		return compartments.hashCode() * 31 + Arrays.hashCode(values);
	}
	
	@Override
	public String toString()
	{
		return toMap().toString();
	}
}
