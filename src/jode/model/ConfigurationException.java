package jode.model;

/**
 * Thrown when a model, its inputs or the solver settings are invalid.
 * Always raised before the first integration step.
 */
@SuppressWarnings("serial")
public class ConfigurationException extends SimulationException
{
	public ConfigurationException(String message)
	{
		super(message);
	}

	public ConfigurationException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
