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

import dotrecon.Math2.DiscreteFunction;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * molar extinction coefficients of oxy- and deoxy-haemoglobin as a function of wavelength.
 * the coefficients are stored on a natural-log basis, to match optical density data,
 * which is -ln(I/I0).  tables on disk use the usual decadic convention (cm^-1/M) and are
 * converted on loading.
 */
public class ExtinctionTable {

	/** the factor that turns decadic extinction coefficients into natural-log ones */
	public static final double LN_10 = Math.log(10);

	private static final String DEFAULT_TABLE = "/extinction.csv";

	private final double[] wavelengths;
	private final double[] hbo;
	private final double[] hbr;
	private final DiscreteFunction hboFunction;
	private final DiscreteFunction hbrFunction;

	/**
	 * @param wavelengths the tabulated wavelengths, strictly increasing (nm)
	 * @param hbo the natural-log molar extinction of oxy-haemoglobin at each wavelength (cm^-1/M)
	 * @param hbr the natural-log molar extinction of deoxy-haemoglobin at each wavelength (cm^-1/M)
	 */
	public ExtinctionTable(double[] wavelengths, double[] hbo, double[] hbr) {
		if (wavelengths.length == 0)
			throw new IllegalArgumentException("an extinction table needs at least one row");
		if (hbo.length != wavelengths.length)
			throw new DimensionMismatchException("number of HbO coefficients", wavelengths.length, hbo.length);
		if (hbr.length != wavelengths.length)
			throw new DimensionMismatchException("number of HbR coefficients", wavelengths.length, hbr.length);
		this.wavelengths = wavelengths.clone();
		this.hbo = hbo.clone();
		this.hbr = hbr.clone();
		if (wavelengths.length >= 2) {
			this.hboFunction = new DiscreteFunction(wavelengths, hbo);
			this.hbrFunction = new DiscreteFunction(wavelengths, hbr);
		}
		else {
			this.hboFunction = null;
			this.hbrFunction = null;
		}
	}

	/**
	 * bild a table from rows of (wavelength, HbO, HbR) in decadic units.
	 */
	public static ExtinctionTable fromDecadic(double[][] rows) {
		double[] wavelengths = new double[rows.length];
		double[] hbo = new double[rows.length];
		double[] hbr = new double[rows.length];
		for (int i = 0; i < rows.length; i ++) {
			if (rows[i].length != 3)
				throw new DimensionMismatchException("number of collums in extinction table row "+i, 3, rows[i].length);
			wavelengths[i] = rows[i][0];
			hbo[i] = rows[i][1]*LN_10;
			hbr[i] = rows[i][2]*LN_10;
		}
		return new ExtinctionTable(wavelengths, hbo, hbr);
	}

	/**
	 * load a decadic table from a CSV file with a header row and collums wavelength, HbO, HbR.
	 * @throws IOException if the file can't be read
	 */
	public static ExtinctionTable load(File file) throws IOException {
		return fromDecadic(CSV.read(file, ',', 1));
	}

	/**
	 * the tabulated haemoglobin spectra that come with this package, from 650 to 900 nm.
	 * @throws IOException if the resource is missing from the classpath
	 */
	public static ExtinctionTable defaultTable() throws IOException {
		try (InputStream in = ExtinctionTable.class.getResourceAsStream(DEFAULT_TABLE)) {
			if (in == null)
				throw new IOException("the default extinction table "+DEFAULT_TABLE+" is not on the classpath");
			return fromDecadic(CSV.read(in, ',', 1));
		}
	}

	/**
	 * @param wavelength the wavelength of interest (nm)
	 * @return the natural-log extinction coefficients {HbO, HbR} (cm^-1/M)
	 * @throws DimensionMismatchException if the wavelength is outside the table
	 */
	public double[] lookup(double wavelength) {
		for (int i = 0; i < wavelengths.length; i ++)
			if (wavelengths[i] == wavelength)
				return new double[] {hbo[i], hbr[i]};
		if (hboFunction == null || !hboFunction.covers(wavelength))
			throw new DimensionMismatchException(String.format(
					"%.1f nm is outside the extinction table, which covers %.1f to %.1f nm",
					wavelength, wavelengths[0], wavelengths[wavelengths.length - 1]));
		return new double[] {hboFunction.evaluate(wavelength), hbrFunction.evaluate(wavelength)};
	}
}
