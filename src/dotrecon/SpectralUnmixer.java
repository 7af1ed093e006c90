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

import java.util.logging.Logger;

/**
 * separates absorption images at several wavelengths into oxy- and deoxy-haemoglobin images,
 * by least squares against the haemoglobin extinction spectra.
 */
public class SpectralUnmixer {

	/**
	 * the scale that extinction coefficients are divided by before inversion.  it is kept
	 * exactly as the existing pipelines use it, so that images stay comparable.
	 */
	public static final double EXTINCTION_NORMALIZATION = 1e7;

	private static final Logger logger = Logger.getLogger("root");

	/** the 2×wavelengths pseudoinverse of the extinction matrix */
	private final Matrix unmixing;

	/**
	 * @param wavelengths the wavelength of each absorption image (nm)
	 * @param table the table from which to get each wavelength's extinction coefficients
	 * @throws DimensionMismatchException if a wavelength isn't in the table
	 */
	public SpectralUnmixer(double[] wavelengths, ExtinctionTable table) {
		this(lookupAll(wavelengths, table));
	}

	/**
	 * @param extinction the {HbO, HbR} extinction coefficients at each wavelength, before normalization
	 */
	public SpectralUnmixer(double[][] extinction) {
		if (extinction.length == 0)
			throw new DimensionMismatchException("you can't unmix zero wavelengths");
		double[][] normalized = new double[extinction.length][2];
		for (int w = 0; w < extinction.length; w ++) {
			if (extinction[w].length != 2)
				throw new DimensionMismatchException("number of chromophores at wavelength "+w, 2, extinction[w].length);
			for (int c = 0; c < 2; c ++)
				normalized[w][c] = extinction[w][c]/EXTINCTION_NORMALIZATION;
		}
		if (extinction.length < 2)
			logger.warning("unmixing two chromophores from one wavelength; the result will be the minimum-norm solution");
		this.unmixing = new Matrix(normalized).pseudoinverse();
	}

	private static double[][] lookupAll(double[] wavelengths, ExtinctionTable table) {
		if (table == null)
			throw new MissingInputException("haemoglobin images require an extinction table, but the measurements have none");
		double[][] extinction = new double[wavelengths.length][];
		for (int w = 0; w < wavelengths.length; w ++)
			extinction[w] = table.lookup(wavelengths[w]);
		return extinction;
	}

	/**
	 * @param mua the absorption image at each wavelength, all the same length
	 * @return the {HbO, HbR} images
	 */
	public DenseVector[] unmix(Vector[] mua) {
		if (mua.length != unmixing.n)
			throw new DimensionMismatchException("number of absorption images", unmixing.n, mua.length);
		return unmixing.matmul(mua);
	}

	/**
	 * @return the 2×wavelengths matrix that gets applied to the absorption images
	 */
	public Matrix getUnmixingMatrix() {
		return unmixing;
	}

	public int getNumWavelengths() {
		return unmixing.n;
	}
}
