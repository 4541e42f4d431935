package jode.model;

/**
 * How reactant populations enter a mass-action rate.
 */
public enum DensityMethod
{
	// Reactant counts are used as-is
	Absolute,
	
	// Reactant counts are divided by the current total population
	Fractional
}
