package epimodel;

import java.io.*;
import java.util.List;

import jode.logging.*;
import jode.model.State;
import static epimodel.Util.*;

/**
 * Writes a trajectory as CSV with one row per time and one column per
 * compartment.
 */
public class TextLogger implements PeriodicLogger
{
	private String filename;
	private PrintStream stream;
	
	long logCount = 0;
	
	public TextLogger(String filename)
	{
		this.filename = filename;
	}
	
	public TextLogger(PrintStream stream)
	{
		this.stream = stream;
	}
	
	public void logStart(List<String> compartments) throws LoggingException
	{
		try
		{
			if(filename != null)
				stream = openBufferedPrintStream(filename);
		}
		catch(IOException e)
		{
			throw new LoggingException(this, "Could not open " + filename, e);
		}
		
		stream.print("time");
		for(String compartment : compartments)
			stream.print("," + compartment);
		stream.print("\n");
		stream.flush();
	}
	
	public void logPeriodic(double time, State state) throws LoggingException
	{
		StringBuilder line = new StringBuilder(formatNumber(time));
		for(int i = 0; i < state.size(); i++)
			line.append(',').append(formatNumber(state.get(i)));
		stream.print(line.append('\n'));
		
		if(stream.checkError())
			throw new LoggingException(this, "Error writing row " + logCount);
		logCount++;
	}
	
	public void logEnd() throws LoggingException
	{
		stream.flush();
		if(filename != null)
			stream.close();
	}
}
