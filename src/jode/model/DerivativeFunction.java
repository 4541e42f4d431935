package jode.model;

/**
 * Right-hand side of an ODE system in array form, with parameters
 * already bound. Implementations must not keep state between calls.
 */
public interface DerivativeFunction
{
	public int getDimension();
	public void computeDerivatives(double time, double[] y, double[] yDot);
}
