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

/**
 * a vector that stores every one of its values.  this is what images and measurement
 * vectors look like.
 */
public class DenseVector extends Vector {
	private final double[] values;

	/**
	 * build a DenseVector that wraps the given values.  the array is not copied, so don't
	 * go changing it afterward.
	 */
	public DenseVector(double... values) {
		this.values = values;
	}

	/**
	 * @return a new vector with every value's sign flipped
	 */
	public DenseVector neg() {
		double[] negation = new double[this.getLength()];
		for (int i = 0; i < this.getLength(); i ++)
			negation[i] = -this.values[i];
		return new DenseVector(negation);
	}

	@Override
	public double dot(Vector that) {
		if (that instanceof SparseVector) // the sparse dot is faster, so do that if you can
			return that.dot(this);
		if (this.getLength() != that.getLength())
			throw new IllegalArgumentException("the dimensions don't match.");
		double product = 0;
		for (int i = 0; i < this.getLength(); i ++)
			product += this.values[i]*that.get(i);
		return product;
	}

	@Override
	public double get(int i) {
		return this.values[i];
	}

	public void set(int i, double value) {
		this.values[i] = value;
	}

	@Override
	public int getLength() {
		return values.length;
	}

	@Override
	public double[] getValues() {
		return this.values.clone();
	}
}
