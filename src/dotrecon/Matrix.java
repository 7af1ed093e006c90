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

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

/**
 * a row-major matrix whose rows may each be dense or sparse.  inverse operators are dense;
 * vol2gm and the basis interpolation operators are sparse.  instances are never modified once
 * the pipeline has them, so they can be shared between threads freely.
 */
public class Matrix {
	/** the number of rows */
	public final int m;
	/** the number of collums */
	public final int n;
	/** the data */
	private final Vector[] rows;

	/**
	 * generate a new matrix by giving dimensions and a list of rows.
	 */
	public Matrix(int m, int n, Vector[] rows) {
		this.m = m;
		if (rows.length != m)
			throw new IllegalArgumentException("the height doesn’t match the data.");
		this.n = n;
		for (Vector row: rows)
			if (row.getLength() != n)
				throw new IllegalArgumentException("do not accept jagged arrays.");
		this.rows = rows;
	}

	/**
	 * generate a new matrix by specifying all of its values explicitly.
	 */
	public Matrix(int m, int n, double[][] values) {
		this.m = m;
		if (values.length != m)
			throw new IllegalArgumentException("the height doesn’t match the data.");
		this.n = n;
		for (double[] row: values)
			if (row.length != n)
				throw new IllegalArgumentException("do not accept jagged arrays.");
		this.rows = new Vector[values.length];
		for (int i = 0; i < values.length; i ++)
			this.rows[i] = new DenseVector(values[i].clone());
	}

	/**
	 * generate a new matrix from a non-jagged 2D array, taking the dimensions from the array.
	 * an array with no rows makes a 0×0 matrix.
	 */
	public Matrix(double[][] values) {
		this(values.length, (values.length > 0) ? values[0].length : 0, values);
	}

	/**
	 * generate a sparse matrix from a list of (row, collum, value) triplets.  repeated
	 * entries are summed.
	 */
	public static Matrix sparse(int m, int n, double[][] triplets) {
		SparseVector[] rows = new SparseVector[m];
		for (int i = 0; i < m; i ++)
			rows[i] = new SparseVector(n);
		for (double[] triplet: triplets) {
			if (triplet.length != 3)
				throw new IllegalArgumentException("each sparse entry must be a (row, collum, value) triplet, not "+triplet.length+" numbers.");
			int i = (int) triplet[0], j = (int) triplet[1];
			if (i != triplet[0] || j != triplet[1] || i < 0 || i >= m || j < 0 || j >= n)
				throw new IllegalArgumentException(String.format(
						"(%s, %s) is not an index into a %d×%d matrix", triplet[0], triplet[1], m, n));
			rows[i].add(j, triplet[2]);
		}
		return new Matrix(m, n, rows);
	}

	/**
	 * generate an identity matrix.
	 */
	public static Matrix identity(int n) {
		Vector[] rows = new Vector[n];
		for (int i = 0; i < n; i ++) {
			SparseVector row = new SparseVector(n);
			row.set(i, 1);
			rows[i] = row;
		}
		return new Matrix(n, n, rows);
	}

	public DenseVector matmul(double... v) {
		return this.matmul(new DenseVector(v));
	}

	public DenseVector matmul(Vector v) {
		if (v.getLength() != this.n)
			throw new IllegalArgumentException(String.format(
					"can't multiply a %d×%d matrix by a vector of length %d.", m, n, v.getLength()));
		double[] product = new double[this.m];
		for (int i = 0; i < this.m; i ++)
			product[i] = this.rows[i].dot(v);
		return new DenseVector(product);
	}

	/**
	 * multiply this by a matrix whose rows are given as vectors.  this is how the spectral
	 * unmixing matrix gets applied to a whole stack of node-space images at once.
	 * @param those the rows of the right-hand matrix; there must be this.n of them
	 * @return the rows of the product; there will be this.m of them
	 */
	public DenseVector[] matmul(Vector[] those) {
		if (those.length != this.n)
			throw new IllegalArgumentException(String.format(
					"can't multiply a %d×%d matrix by a stack of %d vectors.", m, n, those.length));
		int width = (those.length > 0) ? those[0].getLength() : 0;
		DenseVector[] product = new DenseVector[this.m];
		for (int i = 0; i < this.m; i ++) {
			double[] row = new double[width];
			for (int k = 0; k < this.n; k ++) {
				double a_ik = this.get(i, k);
				if (a_ik != 0)
					for (int j = 0; j < width; j ++)
						row[j] += a_ik*those[k].get(j);
			}
			product[i] = new DenseVector(row);
		}
		return product;
	}

	/**
	 * compute the Moore–Penrose pseudoinverse by singular value decomposition.  singular
	 * values below the decomposition's default tolerance are treated as zero, so a rank-
	 * deficient or underdetermined matrix gets the minimum-norm solution rather than an error.
	 * @return the n×m pseudoinverse
	 */
	public Matrix pseudoinverse() {
		if (this.m == 0 || this.n == 0)
			throw new IllegalArgumentException("a "+m+"×"+n+" matrix has no pseudoinverse worth computing.");
		RealMatrix decomposable = new Array2DRowRealMatrix(this.getValues(), false);
		SingularValueDecomposition svd = new SingularValueDecomposition(decomposable);
		RealMatrix inverse = svd.getSolver().getInverse();
		return new Matrix(this.n, this.m, inverse.getData());
	}

	public double get(int i, int j) {
		return this.rows[i].get(j);
	}

	/**
	 * @return a copy of row i; changing it won't change this matrix
	 */
	public DenseVector getRow(int i) {
		return new DenseVector(this.rows[i].getValues());
	}

	public double[][] getValues() {
		double[][] values = new double[this.m][];
		for (int i = 0; i < this.m; i ++)
			values[i] = this.rows[i].getValues();
		return values;
	}

	@Override
	public String toString() {
		if (this.m*this.n < 1000) {
			StringBuilder s = new StringBuilder(String.format("Matrix %d×%d [\n  ", m, n));
			for (int i = 0; i < this.m; i++) {
				for (int j = 0; j < this.n; j++) {
					s.append(String.format("%8.4g", this.get(i, j)));
					s.append("  ");
				}
				s.append("\n  ");
			}
			return s.append("]").toString();
		}
		else {
			return String.format("Matrix %d×%d [ … ]", m, n);
		}
	}

}
