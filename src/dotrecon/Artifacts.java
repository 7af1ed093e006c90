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

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * loads the inputs of a reconstruction from directories of CSV files.
 * <ul>
 *   <li>measurements: dod.csv, t.csv, wavelengths.csv, channels.csv, and optionally extinction.csv</li>
 *   <li>inverse operator: invJ-1.csv, invJ-2.csv, …, and optionally basis.csv and log.csv</li>
 *   <li>spatial mapping: volume-nodes.csv, surface-nodes.csv, vol2gm.csv</li>
 * </ul>
 */
public class Artifacts {

	private static final Logger logger = Logger.getLogger("root");

	/**
	 * @param directory the measurement directory
	 * @return the measurement series, whose source is the directory's name
	 * @throws MissingInputException if a required file is missing
	 * @throws DimensionMismatchException if the files disagree about the number of channels or frames
	 * @throws IOException if a file can't be read
	 */
	public static MeasurementSeries loadMeasurements(File directory) throws IOException {
		double[][] dod = CSV.read(require(directory, "dod.csv"), ',');
		double[] time = CSV.readColumn(require(directory, "t.csv"));
		double[] wavelengths = CSV.readColumn(require(directory, "wavelengths.csv"));
		double[][] channels = CSV.read(require(directory, "channels.csv"), ',', 1);

		int[] wavelengthIndex = new int[channels.length];
		boolean[] active = new boolean[channels.length];
		for (int j = 0; j < channels.length; j ++) {
			if (channels[j].length != 4)
				throw new DimensionMismatchException("number of collums in channels.csv row "+j, 4, channels[j].length);
			wavelengthIndex[j] = toInteger(channels[j][2], "the wavelength index in channels.csv row "+j) - 1;
			active[j] = channels[j][3] != 0;
		}

		File extinctionFile = new File(directory, "extinction.csv");
		ExtinctionTable extinction;
		if (extinctionFile.isFile())
			extinction = ExtinctionTable.load(extinctionFile);
		else
			extinction = ExtinctionTable.defaultTable();

		logger.info(String.format("loaded %d frames of %d channels at %d wavelengths from %s",
		                          dod.length, channels.length, wavelengths.length, directory));
		return new MeasurementSeries(dod, time, wavelengthIndex, active, wavelengths,
		                             extinction, directory.getName());
	}

	/**
	 * @param directory the inverse operator directory
	 * @return the inverse operator, whose source is the directory's name
	 * @throws MissingInputException if there isn't even an invJ-1.csv
	 * @throws DimensionMismatchException if a matrix is jagged or basis.csv isn't three whole numbers
	 * @throws IOException if a file can't be read
	 */
	public static InverseOperator loadInverseOperator(File directory) throws IOException {
		List<Matrix> matrices = new ArrayList<>();
		for (int w = 1; new File(directory, "invJ-"+w+".csv").isFile(); w ++)
			matrices.add(toMatrix(CSV.read(new File(directory, "invJ-"+w+".csv"), ','), "invJ-"+w+".csv"));
		if (matrices.isEmpty())
			throw new MissingInputException("there is no invJ-1.csv in "+directory);

		int[] basis = null;
		File basisFile = new File(directory, "basis.csv");
		if (basisFile.isFile()) {
			double[][] shape = CSV.read(basisFile, ',');
			if (shape.length != 1 || shape[0].length != 3)
				throw new DimensionMismatchException("basis.csv should be one row of three grid sizes");
			basis = new int[3];
			for (int a = 0; a < 3; a ++)
				basis[a] = toInteger(shape[0][a], "grid size "+a+" in basis.csv");
		}

		ProvenanceLog log = new ProvenanceLog();
		File logFile = new File(directory, "log.csv");
		if (logFile.isFile()) {
			for (String[] row: CSV.readStrings(logFile, ','))
				log = log.plus(row[0], (row.length > 1) ? row[1] : "");
		}

		logger.info(String.format("loaded %d inverse operator matrices of %dx%d from %s",
		                          matrices.size(), matrices.get(0).m, matrices.get(0).n, directory));
		return new InverseOperator(matrices, basis, log, directory.getName());
	}

	/**
	 * @param directory the spatial mapping directory
	 * @return the meshes and the volume-to-surface operator
	 * @throws MissingInputException if a required file is missing
	 * @throws DimensionMismatchException if a vol2gm.csv entry doesn't index into the meshes
	 * @throws IOException if a file can't be read
	 */
	public static SpatialMapping loadMapping(File directory) throws IOException {
		double[][] volumeNodes = CSV.read(require(directory, "volume-nodes.csv"), ',');
		double[][] surfaceNodes = CSV.read(require(directory, "surface-nodes.csv"), ',');
		double[][] triplets = CSV.read(require(directory, "vol2gm.csv"), ',');
		for (int k = 0; k < triplets.length; k ++) {
			if (triplets[k].length != 3)
				throw new DimensionMismatchException("number of collums in vol2gm.csv row "+k, 3, triplets[k].length);
			int i = toInteger(triplets[k][0], "the surface node in vol2gm.csv row "+k);
			int j = toInteger(triplets[k][1], "the volume node in vol2gm.csv row "+k);
			if (i < 0 || i >= surfaceNodes.length || j < 0 || j >= volumeNodes.length)
				throw new DimensionMismatchException(String.format(
						"vol2gm.csv row %d refers to (%d, %d), which isn't in a %d×%d operator",
						k, i, j, surfaceNodes.length, volumeNodes.length));
		}
		Matrix vol2gm = Matrix.sparse(surfaceNodes.length, volumeNodes.length, triplets);
		logger.info(String.format("loaded a %d-node volume mesh and a %d-node surface mesh from %s",
		                          volumeNodes.length, surfaceNodes.length, directory));
		return new SpatialMapping(volumeNodes, surfaceNodes, vol2gm, directory.getName());
	}

	private static Matrix toMatrix(double[][] values, String name) {
		for (int i = 1; i < values.length; i ++)
			if (values[i].length != values[0].length)
				throw new DimensionMismatchException("number of collums in "+name+" row "+i, values[0].length, values[i].length);
		return new Matrix(values);
	}

	private static int toInteger(double value, String what) {
		if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE)
			throw new DimensionMismatchException(what+" should be a whole number, not "+value);
		return (int) value;
	}

	private static File require(File directory, String name) {
		File file = new File(directory, name);
		if (!file.isFile())
			throw new MissingInputException("there is no "+name+" in "+directory);
		return file;
	}
}
