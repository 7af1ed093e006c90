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
 * a basis mapping given explicitly as a volumeNodes × basisSize matrix.
 */
public class MatrixBasisMapping implements BasisMapping {

	private final Matrix basisToVolume;

	public MatrixBasisMapping(Matrix basisToVolume) {
		this.basisToVolume = basisToVolume;
	}

	@Override
	public Vector basisToVolume(Vector coefficients) {
		if (coefficients.getLength() != getBasisSize())
			throw new DimensionMismatchException("number of basis coefficients", getBasisSize(), coefficients.getLength());
		return basisToVolume.matmul(coefficients);
	}

	@Override
	public int getBasisSize() {
		return basisToVolume.n;
	}

	@Override
	public int getVolumeSize() {
		return basisToVolume.m;
	}
}
