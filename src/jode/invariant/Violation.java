package jode.invariant;

/**
 * One failed invariant at one reporting time.
 */
public final class Violation
{
	public enum Kind
	{
		POPULATION_NOT_CONSERVED,
		NEGATIVE_COMPARTMENT
	}
	
	private final int index;
	private final double time;
	private final Kind kind;
	private final String compartment;
	private final double value;
	
	public Violation(int index, double time, Kind kind, String compartment, double value)
	{
		this.index = index;
		this.time = time;
		this.kind = kind;
		this.compartment = compartment;
		this.value = value;
	}
	
	/**
	 * Position of the offending point in the result.
	 */
	public int getIndex()
	{
		return index;
	}
	
	public double getTime()
	{
		return time;
	}
	
	public Kind getKind()
	{
		return kind;
	}
	
	/**
	 * Offending compartment, or null for population violations.
	 */
	public String getCompartment()
	{
		return compartment;
	}
	
	/**
	 * The compartment value, or the total population for conservation failures.
	 */
	public double getValue()
	{
		return value;
	}
	
	@Override
	public String toString()
	{
		switch(kind)
		{
			case NEGATIVE_COMPARTMENT:
				return String.format("t=%s: compartment %s is negative (%s)", time, compartment, value);
			default:
				return String.format("t=%s: total population is %s", time, value);
		}
	}
}
