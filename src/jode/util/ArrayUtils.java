package jode.util;

public class ArrayUtils
{
	public static <T> String arrayToLongString(T[] array)
	{
		StringBuilder sb = new StringBuilder();
		
		sb.append("[");
		for(int i = 0; i < array.length; i++)
		{
			sb.append(array[i]);
			if(i != array.length - 1) sb.append(", ");
		}
		sb.append("]");
		
		return sb.toString();
	}
	
	public static String arrayToLongString(double[] array)
	{
		StringBuilder sb = new StringBuilder();
		
		sb.append("[");
		for(int i = 0; i < array.length; i++)
		{
			sb.append(array[i]);
			if(i != array.length - 1) sb.append(", ");
		}
		sb.append("]");
		
		return sb.toString();
	}
	
	/**
	 * Index of the largest element; the first one on ties.
	 */
	public static int argMax(double[] array)
	{
		if(array.length == 0)
			throw new IllegalArgumentException("Empty array has no maximum.");
		
		int best = 0;
		for(int i = 1; i < array.length; i++)
		{
			if(array[i] > array[best]) best = i;
		}
		return best;
	}
	
	public static boolean allFinite(double[] array)
	{
		for(double value : array)
		{
			if(Double.isNaN(value) || Double.isInfinite(value)) return false;
		}
		return true;
	}
}
