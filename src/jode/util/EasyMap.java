package jode.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Insertion-ordered map that can be filled from alternating keys and values,
 * e.g. {@code new EasyMap<String, Double>("S", 999.0, "I", 1.0)}.
 */
public class EasyMap<K, V> extends LinkedHashMap<K, V>
{
	private static final long serialVersionUID = 1L;

	@SuppressWarnings("unchecked")
	public EasyMap(Object... keysAndValues)
	{
		super(keysAndValues.length);
		
		if(keysAndValues.length % 2 == 1)
			throw new IllegalArgumentException("Need an even number of arguments to create map from key/value pairs.");
		
		for(int i = 0; i < keysAndValues.length; i += 2)
		{
			put((K)keysAndValues[i], (V)keysAndValues[i + 1]);
		}
	}
	
	public EasyMap(Map<? extends K, ? extends V> m)
	{
		super(m);
	}
	
	/**
	 * Returns this map with one more entry, for chained construction.
	 */
	public EasyMap<K, V> with(K key, V value)
	{
		put(key, value);
		return this;
	}
}
