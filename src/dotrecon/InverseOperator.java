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

import java.util.Arrays;
import java.util.List;

/**
 * the regularized inverse of the Jacobian: one matrix per wavelength for a standard
 * reconstruction, or a single matrix for a multispectral one.  each matrix maps a vector of
 * active-channel measurements to a vector of node values; a multispectral matrix has twice
 * as many rows as there are nodes, with all the HbO values before all the HbR values.
 */
public class InverseOperator {

	private final List<Matrix> matrices;
	private final int[] basis;
	private final ProvenanceLog log;
	private final String source;

	/**
	 * @param matrices the inverted Jacobians, in wavelength order
	 * @param basis the dimensions of the basis grid the unknowns live on, or null if there's no basis
	 * @param log the settings the operator was bilt with, or null if nobody wrote them down
	 * @param source the name of the file this came from, or a description of how it was made
	 */
	public InverseOperator(List<Matrix> matrices, int[] basis, ProvenanceLog log, String source) {
		if (matrices.isEmpty())
			throw new MissingInputException("an inverse operator needs at least one matrix");
		if (basis != null && basis.length != 3)
			throw new DimensionMismatchException("number of basis grid dimensions", 3, basis.length);
		this.matrices = List.copyOf(matrices);
		this.basis = (basis != null) ? basis.clone() : null;
		this.log = (log != null) ? log : new ProvenanceLog();
		this.source = source;
	}

	public Matrix getMatrix(int index) {
		return matrices.get(index);
	}

	public int getNumMatrices() {
		return matrices.size();
	}

	/**
	 * @return the number of values in each output vector, which is twice the node count for a multispectral operator
	 */
	public int getNumRows() {
		return matrices.get(0).m;
	}

	public boolean hasBasis() {
		return basis != null;
	}

	/**
	 * @return the basis grid dimensions {nx, ny, nz}, or null
	 */
	public int[] getBasis() {
		return (basis != null) ? basis.clone() : null;
	}

	public ProvenanceLog getLog() {
		return log;
	}

	public String getSource() {
		return source;
	}

	@Override
	public String toString() {
		return String.format("InverseOperator(%s, %d matrices of %d rows, basis %s)",
		                     source, matrices.size(), getNumRows(), Arrays.toString(basis));
	}
}
