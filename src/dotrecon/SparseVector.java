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

import java.util.HashMap;
import java.util.Map;

/**
 * a vector that only remembers its nonzero elements.  the rows of vol2gm and of the grid
 * interpolation operator touch a handful of nodes each, so they are stored like this.
 */
public class SparseVector extends Vector {
	private final int length;
	private final Map<Integer, Double> values;

	/**
	 * build an all-zero SparseVector
	 * @param length the number of elements, almost all of which will be zero
	 */
	public SparseVector(int length) {
		this(length, new HashMap<>());
	}

	/**
	 * build a SparseVector given a map that contains the index and value of every nonzero element
	 * @param length the maximum allowable index of the vector
	 * @param values a map where each key is the index of a nonzero element and the corresponding value is that element
	 */
	public SparseVector(int length, Map<Integer, Double> values) {
		for (int i: values.keySet())
			if (i < 0 || i >= length)
				throw new IndexOutOfBoundsException("index "+i+" doesn't fit in a vector of length "+length);
		this.length = length;
		this.values = values;
	}

	@Override
	public double dot(Vector that) {
		if (this.getLength() != that.getLength())
			throw new IllegalArgumentException("the dimensions don't match.");
		double product = 0;
		for (Map.Entry<Integer, Double> entry: this.values.entrySet())
			product += entry.getValue()*that.get(entry.getKey());
		return product;
	}

	@Override
	public int getLength() {
		return this.length;
	}

	@Override
	public double get(int i) {
		return this.values.getOrDefault(i, 0.);
	}

	public void set(int i, double value) {
		if (i < 0 || i >= length)
			throw new IndexOutOfBoundsException("index "+i+" doesn't fit in a vector of length "+length);
		if (value == 0)
			this.values.remove(i);
		else
			this.values.put(i, value);
	}

	/**
	 * add something to one element, which is how the interpolation weits get bilt up.
	 */
	public void add(int i, double value) {
		this.set(i, this.get(i) + value);
	}

	@Override
	public double[] getValues() {
		double[] dense = new double[this.length];
		for (Map.Entry<Integer, Double> entry: this.values.entrySet())
			dense[entry.getKey()] = entry.getValue();
		return dense;
	}
}
