package jode.solver;

import jode.model.*;
import jode.util.ArrayUtils;

/**
 * Adaptive explicit Runge-Kutta 5(4) integrator of Dormand and Prince,
 * with the step size controlled by the embedded 4th-order error estimate
 * and grid states obtained from the 4th-order continuous extension, so the
 * internal steps do not depend on the grid spacing.
 *
 * Every quantity the method produces is a linear combination of derivative
 * evaluations, so a model whose derivatives sum to zero keeps its total
 * population up to rounding error.
 *
 * Coefficients follow Hairer, Norsett and Wanner, Solving Ordinary
 * Differential Equations I, section II.5 and the DOPRI5 code.
 */
public class DormandPrinceIntegrator implements Integrator
{
	public static final double DEFAULT_RELATIVE_TOLERANCE = 1e-6;
	public static final double DEFAULT_ABSOLUTE_TOLERANCE = 1e-8;
	public static final int DEFAULT_MAX_STEPS = 100000;
	public static final int DEFAULT_MAX_CONSECUTIVE_REJECTIONS = 50;

	private static final double C2 = 1.0 / 5.0;
	private static final double C3 = 3.0 / 10.0;
	private static final double C4 = 4.0 / 5.0;
	private static final double C5 = 8.0 / 9.0;

	private static final double A21 = 1.0 / 5.0;
	private static final double A31 = 3.0 / 40.0;
	private static final double A32 = 9.0 / 40.0;
	private static final double A41 = 44.0 / 45.0;
	private static final double A42 = -56.0 / 15.0;
	private static final double A43 = 32.0 / 9.0;
	private static final double A51 = 19372.0 / 6561.0;
	private static final double A52 = -25360.0 / 2187.0;
	private static final double A53 = 64448.0 / 6561.0;
	private static final double A54 = -212.0 / 729.0;
	private static final double A61 = 9017.0 / 3168.0;
	private static final double A62 = -355.0 / 33.0;
	private static final double A63 = 46732.0 / 5247.0;
	private static final double A64 = 49.0 / 176.0;
	private static final double A65 = -5103.0 / 18656.0;

	// 5th-order weights; also the last row of the tableau (FSAL)
	private static final double B1 = 35.0 / 384.0;
	private static final double B3 = 500.0 / 1113.0;
	private static final double B4 = 125.0 / 192.0;
	private static final double B5 = -2187.0 / 6784.0;
	private static final double B6 = 11.0 / 84.0;

	// Difference between 5th- and 4th-order weights
	private static final double E1 = 71.0 / 57600.0;
	private static final double E3 = -71.0 / 16695.0;
	private static final double E4 = 71.0 / 1920.0;
	private static final double E5 = -17253.0 / 339200.0;
	private static final double E6 = 22.0 / 525.0;
	private static final double E7 = -1.0 / 40.0;

	// Continuous extension
	private static final double D1 = -12715105075.0 / 11282082432.0;
	private static final double D3 = 87487479700.0 / 32700410799.0;
	private static final double D4 = -10690763975.0 / 1880347072.0;
	private static final double D5 = 701980252875.0 / 199316789632.0;
	private static final double D6 = -1453857185.0 / 822651844.0;
	private static final double D7 = 69997945.0 / 29380423.0;

	private static final double SAFETY = 0.9;
	private static final double MIN_FACTOR = 0.2;
	private static final double MAX_FACTOR = 10.0;

	private double relativeTolerance;
	private double absoluteTolerance;
	private double maxStep = Double.POSITIVE_INFINITY;
	private int maxSteps = DEFAULT_MAX_STEPS;
	private int maxConsecutiveRejections = DEFAULT_MAX_CONSECUTIVE_REJECTIONS;

	public DormandPrinceIntegrator()
	{
		relativeTolerance = DEFAULT_RELATIVE_TOLERANCE;
		absoluteTolerance = DEFAULT_ABSOLUTE_TOLERANCE;
	}

	public DormandPrinceIntegrator(double relativeTolerance, double absoluteTolerance)
			throws ConfigurationException
	{
		if(!(relativeTolerance > 0) || Double.isInfinite(relativeTolerance))
			throw new ConfigurationException("Relative tolerance must be positive, got " + relativeTolerance);
		if(!(absoluteTolerance > 0) || Double.isInfinite(absoluteTolerance))
			throw new ConfigurationException("Absolute tolerance must be positive, got " + absoluteTolerance);

		this.relativeTolerance = relativeTolerance;
		this.absoluteTolerance = absoluteTolerance;
	}

	public double getRelativeTolerance()
	{
		return relativeTolerance;
	}

	public double getAbsoluteTolerance()
	{
		return absoluteTolerance;
	}

	public void setMaxStep(double maxStep) throws ConfigurationException
	{
		if(!(maxStep > 0))
			throw new ConfigurationException("Maximum step must be positive, got " + maxStep);
		this.maxStep = maxStep;
	}

	public void setMaxSteps(int maxSteps) throws ConfigurationException
	{
		if(maxSteps < 1)
			throw new ConfigurationException("Step budget must be at least 1, got " + maxSteps);
		this.maxSteps = maxSteps;
	}

	public void setMaxConsecutiveRejections(int maxConsecutiveRejections) throws ConfigurationException
	{
		if(maxConsecutiveRejections < 0)
			throw new ConfigurationException("Rejection bound must not be negative, got "
					+ maxConsecutiveRejections);
		this.maxConsecutiveRejections = maxConsecutiveRejections;
	}

	public SimulationResult integrate(CompartmentModel model, State initialState,
			ParameterSet params, TimeGrid grid) throws ConfigurationException, IntegrationException
	{
		model.checkInitialState(initialState);
		DerivativeFunction f = model.bind(params);

		double[] times = grid.toArray();
		State[] states = new State[times.length];
		states[0] = initialState;

		if(times.length == 1)
			return new SimulationResult(model.getCompartments(), times, states, 0, 0, 0);

		Run run = new Run(f, times[0], initialState.toArray());
		run.integrateTo(times, states, initialState);

		return new SimulationResult(model.getCompartments(), times, states,
				run.accepted, run.rejected, run.evaluations);
	}

	/**
	 * Working storage of a single integration.
	 */
	private class Run
	{
		private DerivativeFunction f;
		private int n;

		private double t;
		private double[] y;
		private double[] yNew;
		private double[] yStage;
		private double[] k1, k2, k3, k4, k5, k6, k7;

		int accepted = 0;
		int rejected = 0;
		int evaluations = 0;

		Run(DerivativeFunction f, double t0, double[] y0)
		{
			this.f = f;
			n = f.getDimension();
			t = t0;
			y = y0;
			yNew = new double[n];
			yStage = new double[n];
			k1 = new double[n];
			k2 = new double[n];
			k3 = new double[n];
			k4 = new double[n];
			k5 = new double[n];
			k6 = new double[n];
			k7 = new double[n];
		}

		void integrateTo(double[] times, State[] states, State template) throws IntegrationException
		{
			double tEnd = times[times.length - 1];
			double hMax = Math.min(maxStep, tEnd - t);

			evaluate(t, y, k1);
			if(!ArrayUtils.allFinite(k1))
				throw new IntegrationException("Derivatives are not finite at the initial state "
						+ ArrayUtils.arrayToLongString(y), t);

			double h = initialStepSize(hMax);
			boolean lastRejected = false;
			int consecutiveRejections = 0;
			int nextOutput = 1;

			while(nextOutput < times.length)
			{
				if(accepted + rejected >= maxSteps)
					throw new IntegrationException(String.format(
							"Step budget of %d steps exhausted", maxSteps), t);

				boolean lastStep = false;
				if(h >= tEnd - t)
				{
					h = tEnd - t;
					lastStep = true;
				}
				if(h <= 16 * Math.ulp(Math.max(Math.abs(t), Math.abs(tEnd))))
					throw new IntegrationException(String.format(
							"Step size underflow (h=%g)", h), t);

				double tNew = lastStep ? tEnd : t + h;
				double error = attemptStep(h, tNew);

				if(error <= 1.0)
				{
					// Report grid points inside (t, tNew]
					while(nextOutput < times.length && times[nextOutput] <= tNew)
					{
						double[] values;
						if(times[nextOutput] == tNew)
							values = yNew.clone();
						else
							values = interpolate((times[nextOutput] - t) / h, h);
						states[nextOutput] = template.withValues(values);
						nextOutput++;
					}

					double[] swap = y;
					y = yNew;
					yNew = swap;
					swap = k1;
					k1 = k7;
					k7 = swap;
					t = tNew;

					accepted++;
					consecutiveRejections = 0;

					double factor = error == 0 ? MAX_FACTOR
							: Math.min(MAX_FACTOR, Math.max(MIN_FACTOR, SAFETY * Math.pow(error, -0.2)));
					if(lastRejected)
						factor = Math.min(factor, 1.0);
					lastRejected = false;
					h = Math.min(h * factor, hMax);
				}
				else
				{
					rejected++;
					consecutiveRejections++;
					if(consecutiveRejections > maxConsecutiveRejections)
						throw new IntegrationException(String.format(
								"No acceptable step after %d step size reductions (h=%g)",
								consecutiveRejections - 1, h), t);

					double factor = Double.isNaN(error) || Double.isInfinite(error) ? MIN_FACTOR
							: Math.max(MIN_FACTOR, SAFETY * Math.pow(error, -0.2));
					h *= factor;
					lastRejected = true;
				}
			}
		}

		/**
		 * Computes yNew and k7 for a step of size h from (t, y) and returns
		 * the scaled error norm; infinite when anything is not finite.
		 */
		private double attemptStep(double h, double tNew)
		{
			for(int i = 0; i < n; i++)
				yStage[i] = y[i] + h * A21 * k1[i];
			evaluate(t + C2 * h, yStage, k2);

			for(int i = 0; i < n; i++)
				yStage[i] = y[i] + h * (A31 * k1[i] + A32 * k2[i]);
			evaluate(t + C3 * h, yStage, k3);

			for(int i = 0; i < n; i++)
				yStage[i] = y[i] + h * (A41 * k1[i] + A42 * k2[i] + A43 * k3[i]);
			evaluate(t + C4 * h, yStage, k4);

			for(int i = 0; i < n; i++)
				yStage[i] = y[i] + h * (A51 * k1[i] + A52 * k2[i] + A53 * k3[i] + A54 * k4[i]);
			evaluate(t + C5 * h, yStage, k5);

			for(int i = 0; i < n; i++)
				yStage[i] = y[i] + h * (A61 * k1[i] + A62 * k2[i] + A63 * k3[i]
						+ A64 * k4[i] + A65 * k5[i]);
			evaluate(tNew, yStage, k6);

			for(int i = 0; i < n; i++)
				yNew[i] = y[i] + h * (B1 * k1[i] + B3 * k3[i] + B4 * k4[i] + B5 * k5[i] + B6 * k6[i]);
			evaluate(tNew, yNew, k7);

			double sum = 0;
			for(int i = 0; i < n; i++)
			{
				double err = h * (E1 * k1[i] + E3 * k3[i] + E4 * k4[i]
						+ E5 * k5[i] + E6 * k6[i] + E7 * k7[i]);
				double scale = absoluteTolerance
						+ relativeTolerance * Math.max(Math.abs(y[i]), Math.abs(yNew[i]));
				double ratio = err / scale;
				sum += ratio * ratio;
			}
			double error = Math.sqrt(sum / n);

			if(Double.isNaN(error) || !ArrayUtils.allFinite(yNew) || !ArrayUtils.allFinite(k7))
				return Double.POSITIVE_INFINITY;
			return error;
		}

		/**
		 * Dense output at t + theta h for the step just attempted
		 * (y, k1..k7 and yNew must still describe that step).
		 */
		private double[] interpolate(double theta, double h)
		{
			double theta1 = 1.0 - theta;
			double[] values = new double[n];
			for(int i = 0; i < n; i++)
			{
				double yDiff = yNew[i] - y[i];
				double bspl = h * k1[i] - yDiff;
				double c4 = yDiff - h * k7[i] - bspl;
				double c5 = h * (D1 * k1[i] + D3 * k3[i] + D4 * k4[i]
						+ D5 * k5[i] + D6 * k6[i] + D7 * k7[i]);
				values[i] = y[i] + theta * (yDiff + theta1 * (bspl + theta * (c4 + theta1 * c5)));
			}
			return values;
		}

		/**
		 * Starting step size from the size of the solution, its derivative
		 * and a finite-difference estimate of the second derivative.
		 */
		private double initialStepSize(double hMax)
		{
			double dnf = 0;
			double dny = 0;
			for(int i = 0; i < n; i++)
			{
				double scale = absoluteTolerance + relativeTolerance * Math.abs(y[i]);
				dnf += (k1[i] / scale) * (k1[i] / scale);
				dny += (y[i] / scale) * (y[i] / scale);
			}

			double h;
			if(dnf <= 1e-10 || dny <= 1e-10)
				h = 1e-6;
			else
				h = 0.01 * Math.sqrt(dny / dnf);
			h = Math.min(h, hMax);

			// Explicit Euler step to estimate the second derivative
			for(int i = 0; i < n; i++)
				yStage[i] = y[i] + h * k1[i];
			evaluate(t + h, yStage, k2);

			double der2 = 0;
			for(int i = 0; i < n; i++)
			{
				double scale = absoluteTolerance + relativeTolerance * Math.abs(y[i]);
				double d = (k2[i] - k1[i]) / scale;
				der2 += d * d;
			}
			der2 = Math.sqrt(der2) / h;
			if(Double.isNaN(der2) || Double.isInfinite(der2))
				return h;

			double der12 = Math.max(der2, Math.sqrt(dnf));
			double h1;
			if(der12 <= 1e-15)
				h1 = Math.max(1e-6, h * 1e-3);
			else
				h1 = Math.pow(0.01 / der12, 0.2);

			return Math.min(Math.min(100 * h, h1), hMax);
		}

		private void evaluate(double time, double[] state, double[] derivatives)
		{
			f.computeDerivatives(time, state, derivatives);
			evaluations++;
		}
	}
}
