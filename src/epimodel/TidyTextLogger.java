package epimodel;

import java.io.*;
import java.util.List;

import jode.logging.*;
import jode.model.State;
import static epimodel.Util.*;

/**
 * Writes a trajectory in long format, one "time,compartment,value" row per
 * compartment and time, as plotting libraries usually expect.
 */
public class TidyTextLogger implements PeriodicLogger
{
	private String filename;
	private PrintStream stream;
	private List<String> compartments;
	
	public TidyTextLogger(String filename)
	{
		this.filename = filename;
	}
	
	public TidyTextLogger(PrintStream stream)
	{
		this.stream = stream;
	}
	
	public void logStart(List<String> compartments) throws LoggingException
	{
		this.compartments = compartments;
		try
		{
			if(filename != null)
				stream = openBufferedPrintStream(filename);
		}
		catch(IOException e)
		{
			throw new LoggingException(this, "Could not open " + filename, e);
		}
		
		stream.print("time,compartment,value\n");
	}
	
	public void logPeriodic(double time, State state) throws LoggingException
	{
		for(int i = 0; i < compartments.size(); i++)
		{
			stream.printf("%s,%s,%s\n", formatNumber(time), compartments.get(i),
					formatNumber(state.get(i)));
		}
		if(stream.checkError())
			throw new LoggingException(this, "Error writing rows for time " + time);
	}
	
	public void logEnd() throws LoggingException
	{
		stream.flush();
		if(filename != null)
			stream.close();
	}
}
