/**
 * MIT License
 * <p>
 * Copyright (c) 2021 Justin Kunimune
 * <p>
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * <p>
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 * <p>
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package dotrecon;

import java.util.Locale;

/**
 * a file with some useful numerical stuff that doesn't belong to any one stage of the
 * reconstruction.
 */
public class Math2 {

	/**
	 * @param active an array of whether each element is important
	 * @return the indices of the true elements of active, in increasing order
	 */
	public static int[] where(boolean[] active) {
		int reduced_length = 0;
		for (boolean a: active)
			if (a)
				reduced_length += 1;

		int[] indices = new int[reduced_length];
		int j = 0;
		for (int i = 0; i < active.length; i ++) {
			if (active[i]) {
				indices[j] = i;
				j ++;
			}
		}
		return indices;
	}

	/**
	 * @param full an array about only some of whose values we care
	 * @param indices the indices of the values we care about, in the order we want them
	 * @return an array with one element for each index
	 */
	public static double[] select(double[] full, int[] indices) {
		double[] reduced = new double[indices.length];
		for (int j = 0; j < indices.length; j ++)
			reduced[j] = full[indices[j]];
		return reduced;
	}

	/**
	 * copy a 2D array so that nobody downstream can mess with the original.
	 */
	public static double[][] deepCopy(double[][] input) {
		double[][] output = new double[input.length][];
		for (int i = 0; i < input.length; i ++)
			output[i] = input[i].clone();
		return output;
	}

	/**
	 * clamp a value into [min, max].
	 */
	public static double clamp(double x, double min, double max) {
		return Math.max(min, Math.min(max, x));
	}

	/**
	 * a discrete representation of an unknown function, evaluated by linear interpolation.
	 * unlike a spline it never overshoots the tabulated data, which is what you want for a
	 * table of physical coefficients.
	 */
	public static class DiscreteFunction {

		private final double[] X;
		private final double[] Y;

		/**
		 * instantiate a new function given raw data. x must monotonically
		 * increase, or the evaluation technique won't work.
		 * @param x the x values
		 * @param y the corresponding y values
		 */
		public DiscreteFunction(double[] x, double[] y) {
			if (x.length != y.length)
				throw new IllegalArgumentException("datums lengths must match");
			if (x.length < 2)
				throw new IllegalArgumentException("you need at least two points to interpolate");
			for (int i = 1; i < x.length; i ++)
				if (x[i] <= x[i-1])
					throw new IllegalArgumentException("x must be strictly increasing.");

			this.X = x.clone();
			this.Y = y.clone();
		}

		/**
		 * @return whether x is within the tabulated range, so that evaluate won't extrapolate
		 */
		public boolean covers(double x) {
			return x >= X[0] && x <= X[X.length-1];
		}

		/**
		 * it's a function. evaluate it, in O(log(n)) time.  outside the tabulated range the
		 * end segments are extended linearly.
		 * @param x the x value at which to find f
		 * @return f(x)
		 */
		public double evaluate(double x) {
			int i; // we will linearly interpolate x from (X[i], X[i+1]) onto (Y[i], Y[i+1]).
			if (x < X[0])
				i = 0;
			else if (x >= X[X.length-1])
				i = X.length-2;
			else {
				int min = 0, max = X.length - 1; // binary search for the segment containing x
				while (max - min > 1) {
					int mid = (min + max)/2;
					if (X[mid] <= x)
						min = mid;
					else
						max = mid;
				}
				i = min;
			}
			return Y[i] + (x - X[i]) / (X[i+1] - X[i]) * (Y[i+1] - Y[i]);
		}

		@Override
		public String toString() {
			StringBuilder s = new StringBuilder("[");
			for (int i = 0; i < X.length; i ++)
				s.append(String.format(Locale.US, "[%g,%g],", X[i], Y[i]));
			s.append("]");
			return s.toString();
		}
	}

}
