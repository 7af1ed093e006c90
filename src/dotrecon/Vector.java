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
 * a real-valued vector in some node space or measurement space.  the storage is up to the
 * subclass; dense for images and measurements, sparse for the rows of mapping operators.
 */
public abstract class Vector {
	public abstract double dot(Vector that);

	/**
	 * pull out a contiguus chunk of this vector.
	 * @param start the first index to include
	 * @param end the first index to exclude
	 * @return a new dense vector of length end - start
	 */
	public DenseVector slice(int start, int end) {
		if (start < 0 || end > this.getLength() || start > end)
			throw new IndexOutOfBoundsException(String.format(
					"can't take [%d, %d) from a vector of length %d", start, end, this.getLength()));
		double[] chunk = new double[end - start];
		for (int i = start; i < end; i ++)
			chunk[i - start] = this.get(i);
		return new DenseVector(chunk);
	}

	public abstract int getLength();

	public abstract double get(int i);

	/**
	 * @return the values of this vector as a fresh array that the caller may keep
	 */
	public abstract double[] getValues();

	@Override
	public String toString() {
		if (this.getLength() > 100)
			return String.format("Vector %d [ … ]", this.getLength());
		StringBuilder s = new StringBuilder("[");
		for (int i = 0; i < this.getLength(); i ++)
			s.append(String.format("  %8.4g", this.get(i)));
		s.append(" ]");
		return s.toString();
	}
}
