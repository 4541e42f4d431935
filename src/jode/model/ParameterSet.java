package jode.model;

import java.util.*;

/**
 * Immutable set of named rate constants for one simulation run.
 */
public final class ParameterSet
{
	private final Map<String, Double> values;
	
	public ParameterSet(Map<String, Double> values) throws ConfigurationException
	{
		Map<String, Double> copy = new LinkedHashMap<String, Double>();
		for(Map.Entry<String, Double> entry : values.entrySet())
		{
			String name = entry.getKey();
			Double value = entry.getValue();
			if(name == null)
				throw new ConfigurationException("Parameter names must not be null.");
			if(value == null || value.isNaN() || value.isInfinite())
				throw new ConfigurationException(String.format(
						"Parameter %s must be a finite number, got %s", name, value));
			copy.put(name, value);
		}
		this.values = Collections.unmodifiableMap(copy);
	}
	
	public boolean contains(String name)
	{
		return values.containsKey(name);
	}
	
	public double get(String name)
	{
		Double value = values.get(name);
		if(value == null)
			throw new IllegalArgumentException("Unknown parameter " + name);
		return value;
	}
	
	public Set<String> getNames()
	{
		return values.keySet();
	}
	
	public Map<String, Double> toMap()
	{
		return values;
	}
	
	@Override
	public boolean equals(Object obj)
	{
		if(this == obj) return true;
		if(!(obj instanceof ParameterSet)) return false;
		return values.equals(((ParameterSet)obj).values);
	}
	
	@Override
	public int hashCode()
	{
		return values.hashCode();
	}
	
	@Override
	public String toString()
	{
		return values.toString();
	}
}
