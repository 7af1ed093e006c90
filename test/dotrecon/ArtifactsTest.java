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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.File;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactsTest {

	private static void writeChannels(File directory, String... rows) throws IOException {
		String[][] table = new String[rows.length + 1][];
		table[0] = new String[] {"source", "detector", "wavelength", "active"};
		for (int i = 0; i < rows.length; i ++)
			table[i + 1] = rows[i].split(",");
		CSV.writeStrings(table, new File(directory, "channels.csv"), ',');
	}

	@Nested
	@DisplayName("measurements")
	class Measurements {
		private File directory;

		@BeforeEach
		void setUp(@TempDir File root) throws IOException {
			directory = new File(root, "subject01");
			assertTrue(directory.mkdir());
			CSV.write(new double[][] {{.1, .2, .3}, {.4, .5, .6}}, new File(directory, "dod.csv"), ',');
			CSV.writeColumn(new double[] {0, 0.1}, new File(directory, "t.csv"));
			CSV.writeColumn(new double[] {690, 830}, new File(directory, "wavelengths.csv"));
			writeChannels(directory, "1,1,1,1", "1,1,2,1", "1,2,1,0");
		}

		@Test
		void loads() throws IOException {
			MeasurementSeries series = Artifacts.loadMeasurements(directory);
			assertEquals(2, series.getNumFrames());
			assertEquals(3, series.getNumChannels());
			assertEquals(2, series.getNumWavelengths());
			assertEquals(0, series.getWavelengthIndex(0));
			assertEquals(1, series.getWavelengthIndex(1));
			assertTrue(series.isActive(1));
			assertFalse(series.isActive(2));
			assertArrayEquals(new double[] {0, 0.1}, series.getTime());
			assertEquals("subject01", series.getSource());
			assertNotNull(series.getExtinction());
		}

		@Test
		@DisplayName("an extinction table in the directory replaces the bundled one")
		void ownExtinctionTable() throws IOException {
			CSV.writeStrings(new String[][] {{"wavelength", "hbo", "hbr"}, {"690", "1", "2"}, {"830", "3", "4"}},
			                 new File(directory, "extinction.csv"), ',');
			MeasurementSeries series = Artifacts.loadMeasurements(directory);
			assertArrayEquals(new double[] {3*ExtinctionTable.LN_10, 4*ExtinctionTable.LN_10},
			                  series.getExtinction().lookup(830), 1e-12);
		}

		@Test
		void missingFile() {
			assertTrue(new File(directory, "t.csv").delete());
			assertThrows(MissingInputException.class, () -> Artifacts.loadMeasurements(directory));
		}

		@Test
		void badChannelTable() throws IOException {
			writeChannels(directory, "1,1,1", "1,1,2", "1,2,1");
			assertThrows(DimensionMismatchException.class, () -> Artifacts.loadMeasurements(directory));
		}

		@Test
		@DisplayName("a wavelength index has to be a whole number")
		void fractionalWavelengthIndex() throws IOException {
			writeChannels(directory, "1,1,1,1", "1,1,1.5,1", "1,2,1,0");
			assertThrows(DimensionMismatchException.class, () -> Artifacts.loadMeasurements(directory));
		}

		@Test
		@DisplayName("more channels in the table than in the data")
		void inconsistentChannels() throws IOException {
			writeChannels(directory, "1,1,1,1", "1,1,2,1", "1,2,1,0", "1,2,2,1");
			assertThrows(DimensionMismatchException.class, () -> Artifacts.loadMeasurements(directory));
		}
	}

	@Nested
	@DisplayName("inverse operators")
	class InverseOperators {
		private File directory;

		@BeforeEach
		void setUp(@TempDir File root) throws IOException {
			directory = new File(root, "invjac01");
			assertTrue(directory.mkdir());
			CSV.write(new double[][] {{1, 2}, {3, 4}, {5, 6}}, new File(directory, "invJ-1.csv"), ',');
			CSV.write(new double[][] {{1}, {2}, {3}}, new File(directory, "invJ-2.csv"), ',');
		}

		@Test
		void loads() throws IOException {
			InverseOperator operator = Artifacts.loadInverseOperator(directory);
			assertEquals(2, operator.getNumMatrices());
			assertEquals(3, operator.getNumRows());
			assertEquals(2, operator.getMatrix(0).n);
			assertEquals(6, operator.getMatrix(0).get(2, 1));
			assertEquals(1, operator.getMatrix(1).n);
			assertFalse(operator.hasBasis());
			assertEquals(0, operator.getLog().size());
			assertEquals("invjac01", operator.getSource());
		}

		@Test
		void basisAndLog() throws IOException {
			CSV.write(new double[][] {{3, 1, 1}}, new File(directory, "basis.csv"), ',');
			CSV.writeStrings(new String[][] {{"hyperParameter", "0.05"}, {"regMethod", "spatial"}, {"note", ""}},
			                 new File(directory, "log.csv"), ',');
			InverseOperator operator = Artifacts.loadInverseOperator(directory);
			assertArrayEquals(new int[] {3, 1, 1}, operator.getBasis());
			assertEquals("0.05", operator.getLog().get("hyperParameter").orElseThrow());
			assertEquals("spatial", operator.getLog().get("regMethod").orElseThrow());
			assertEquals("", operator.getLog().get("note").orElseThrow());
		}

		@Test
		void badBasis() throws IOException {
			CSV.write(new double[][] {{3, 1}}, new File(directory, "basis.csv"), ',');
			assertThrows(DimensionMismatchException.class, () -> Artifacts.loadInverseOperator(directory));
		}

		@Test
		@DisplayName("a grid size has to be a whole number")
		void fractionalBasis() throws IOException {
			CSV.write(new double[][] {{3, 1.5, 1}}, new File(directory, "basis.csv"), ',');
			assertThrows(DimensionMismatchException.class, () -> Artifacts.loadInverseOperator(directory));
		}

		@Test
		@DisplayName("a matrix with a short row is rejected")
		void jaggedMatrix() throws IOException {
			CSV.writeStrings(new String[][] {{"1", "2"}, {"3"}, {"5", "6"}}, new File(directory, "invJ-1.csv"), ',');
			assertThrows(DimensionMismatchException.class, () -> Artifacts.loadInverseOperator(directory));
		}

		@Test
		@DisplayName("the matrices have to start at invJ-1")
		void noMatrices() {
			assertTrue(new File(directory, "invJ-1.csv").delete());
			assertThrows(MissingInputException.class, () -> Artifacts.loadInverseOperator(directory));
		}
	}

	@Nested
	@DisplayName("spatial mappings")
	class Mappings {
		private File directory;

		@BeforeEach
		void setUp(@TempDir File root) throws IOException {
			directory = new File(root, "mesh");
			assertTrue(directory.mkdir());
			CSV.write(new double[][] {{0, 0, 0}, {1, 0, 0}, {0, 1, 0}}, new File(directory, "volume-nodes.csv"), ',');
			CSV.write(new double[][] {{.5, .5, 1}, {0, 0, 1}}, new File(directory, "surface-nodes.csv"), ',');
		}

		@Test
		void loads() throws IOException {
			CSV.write(new double[][] {{0, 1, .5}, {0, 2, .5}, {1, 0, 1}}, new File(directory, "vol2gm.csv"), ',');
			SpatialMapping mapping = Artifacts.loadMapping(directory);
			assertEquals(3, mapping.getNumVolumeNodes());
			assertEquals(2, mapping.getNumSurfaceNodes());
			assertArrayEquals(new double[] {0, .5, .5}, mapping.getVol2gm().getRow(0).getValues());
			assertArrayEquals(new double[] {1, 0, 0}, mapping.getVol2gm().getRow(1).getValues());
		}

		@ParameterizedTest
		@ValueSource(strings = {"0;5;1", "2;0;1", "-1;0;1", "0;0.5;1", "0;1"})
		@DisplayName("vol2gm entries have to be whole-number indices into the meshes")
		void badProjection(String row) throws IOException {
			CSV.writeStrings(new String[][] {{"1", "0", "1"}, row.split(";")}, new File(directory, "vol2gm.csv"), ',');
			assertThrows(DimensionMismatchException.class, () -> Artifacts.loadMapping(directory));
		}

		@Test
		void missingProjection() {
			assertThrows(MissingInputException.class, () -> Artifacts.loadMapping(directory));
		}
	}
}
