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

import dotrecon.ImageSet.Image;
import dotrecon.Scenarios.RecordingWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static dotrecon.Scenarios.FIXED_CLOCK;
import static dotrecon.Scenarios.options;
import static org.junit.jupiter.api.Assertions.*;

class ReconstructionTest {

	private static final int NUM_FRAMES = 5;
	private static final int NUM_VOLUME = 3;
	private static final int NUM_SURFACE = 2;
	private static final int[] WAVELENGTH_INDEX = {0, 1, 0, 1, 0, 1, 0, 1};
	private static final boolean[] ACTIVE = {true, true, true, true, true, false, true, true};

	private MeasurementSeries measurements;
	private SpatialMapping mapping;
	private RecordingWriter writer;

	@BeforeEach
	void setUp() throws IOException {
		measurements = Scenarios.series(Scenarios.randomValues(NUM_FRAMES, 8, 1),
		                                WAVELENGTH_INDEX, ACTIVE, 690, 830);
		mapping = Scenarios.chainMapping(NUM_VOLUME, NUM_SURFACE);
		writer = new RecordingWriter();
	}

	private InverseOperator standardOperator() {
		return Scenarios.operator(Scenarios.randomMatrix(NUM_VOLUME, 4, 2),
		                          Scenarios.randomMatrix(NUM_VOLUME, 3, 3));
	}

	private ImageSet run(InverseOperator operator, Map<String, String> options) throws IOException {
		return new Reconstruction(null, writer, FIXED_CLOCK)
				.reconstruct(measurements, null, operator, mapping, options);
	}

	@Nested
	@DisplayName("image shapes")
	class Shapes {

		@Test
		void standardHaemoglobinInTheVolume() throws IOException {
			ImageSet images = run(standardOperator(), options());
			assertTrue(images.hasHaemoglobin());
			for (Image image: List.of(images.getHbo(), images.getHbr())) {
				assertEquals(NUM_FRAMES, image.getVolume().length);
				assertEquals(NUM_VOLUME, image.getVolume()[0].length);
				assertEquals(NUM_FRAMES, image.getSurface().length);
				assertEquals(NUM_SURFACE, image.getSurface()[0].length);
			}
			assertEquals(0, images.getMua().length);
			assertEquals(NUM_FRAMES, images.getNumFrames());
		}

		@Test
		void bothImageTypes() throws IOException {
			ImageSet images = run(standardOperator(), options("imageType", "both"));
			assertTrue(images.hasHaemoglobin());
			assertEquals(2, images.getMua().length);
			for (Image image: images.getMua()) {
				assertEquals(NUM_FRAMES, image.getVolume().length);
				assertEquals(NUM_SURFACE, image.getSurface()[0].length);
			}
		}

		@Test
		void muaOnly() throws IOException {
			ImageSet images = run(standardOperator(), options("imageType", "mua"));
			assertFalse(images.hasHaemoglobin());
			assertNull(images.getHbo());
			assertEquals(2, images.getMua().length);
		}

		@Test
		@DisplayName("a cortex reconstruction has no volume images")
		void cortex() throws IOException {
			InverseOperator operator = Scenarios.operator(Scenarios.randomMatrix(NUM_SURFACE, 4, 2),
			                                              Scenarios.randomMatrix(NUM_SURFACE, 3, 3));
			ImageSet images = run(operator, options("reconSpace", "cortex", "imageType", "both"));
			assertFalse(images.getHbo().hasVolume());
			assertEquals(0, images.getHbo().getVolume().length);
			assertEquals(NUM_FRAMES, images.getHbo().getSurface().length);
			assertEquals(NUM_SURFACE, images.getHbo().getSurface()[0].length);
			for (Image image: images.getMua())
				assertFalse(image.hasVolume());
		}
	}

	@ParameterizedTest
	@DisplayName("saveVolumeImages=false leaves every volume series empty")
	@CsvSource({"volume,haem", "volume,mua", "volume,both", "cortex,haem", "cortex,both"})
	void volumeSuppression(String space, String imageType) throws IOException {
		int numNodes = space.equals("cortex") ? NUM_SURFACE : NUM_VOLUME;
		InverseOperator operator = Scenarios.operator(Scenarios.randomMatrix(numNodes, 4, 2),
		                                              Scenarios.randomMatrix(numNodes, 3, 3));
		ImageSet images = run(operator, options("reconSpace", space, "imageType", imageType,
		                                        "saveVolumeImages", "false"));
		if (images.hasHaemoglobin()) {
			assertEquals(0, images.getHbo().getVolume().length);
			assertEquals(0, images.getHbr().getVolume().length);
			assertEquals(NUM_FRAMES, images.getHbo().getSurface().length);
		}
		for (Image image: images.getMua()) {
			assertEquals(0, image.getVolume().length);
			assertEquals(NUM_FRAMES, image.getSurface().length);
		}
	}

	@Test
	@DisplayName("repeated runs without persisting give identical images")
	void idempotence() throws IOException {
		InverseOperator operator = standardOperator();
		Map<String, String> options = options("imageType", "both", "persist", "false");
		ImageSet first = run(operator, options);
		ImageSet second = run(operator, options);

		assertArrayEquals(first.getHbo().getVolume(), second.getHbo().getVolume());
		assertArrayEquals(first.getHbo().getSurface(), second.getHbo().getSurface());
		assertArrayEquals(first.getHbr().getSurface(), second.getHbr().getSurface());
		for (int w = 0; w < 2; w ++) {
			assertArrayEquals(first.getMua()[w].getVolume(), second.getMua()[w].getVolume());
			assertArrayEquals(first.getMua()[w].getSurface(), second.getMua()[w].getSurface());
		}
		assertArrayEquals(first.getTime(), second.getTime());
		assertEquals(first.getLog().getEntries(), second.getLog().getEntries());
		assertEquals(2, writer.calls);
		assertFalse(writer.lastPersist);
	}

	@Test
	@DisplayName("an identity operator and identity mapping give back the measurement vector")
	void identityRoundTrip() throws IOException {
		double[][] dod = Scenarios.randomValues(4, 3, 7);
		measurements = Scenarios.series(dod, new int[] {0, 0, 0}, Scenarios.allActive(3), 830);
		mapping = Scenarios.identityMapping(3);

		ImageSet images = run(Scenarios.operator(Matrix.identity(3)), options("imageType", "mua"));

		assertEquals(1, images.getMua().length);
		double[][] volume = images.getMua()[0].getVolume();
		double[][] surface = images.getMua()[0].getSurface();
		for (int t = 0; t < dod.length; t ++) {
			double[] v = new DenseVector(dod[t]).neg().getValues();
			assertArrayEquals(v, volume[t], 1e-12);
			assertArrayEquals(v, surface[t], 1e-12);
		}
	}

	@Test
	@DisplayName("standard mua images are each wavelength's operator applied to its active channels")
	void standardMua() throws IOException {
		InverseOperator operator = standardOperator();
		ImageSet images = run(operator, options("imageType", "mua"));

		double[][] dod = Scenarios.randomValues(NUM_FRAMES, 8, 1);
		int t = 3;
		DenseVector d690 = new DenseVector(-dod[t][0], -dod[t][2], -dod[t][4], -dod[t][6]);
		DenseVector d830 = new DenseVector(-dod[t][1], -dod[t][3], -dod[t][7]);
		DenseVector mua690 = operator.getMatrix(0).matmul(d690);
		DenseVector mua830 = operator.getMatrix(1).matmul(d830);

		assertArrayEquals(mua690.getValues(), images.getMua()[0].getVolume()[t], 1e-12);
		assertArrayEquals(mua830.getValues(), images.getMua()[1].getVolume()[t], 1e-12);
		assertArrayEquals(mapping.getVol2gm().matmul(mua690).getValues(),
		                  images.getMua()[0].getSurface()[t], 1e-12);
	}

	@Test
	@DisplayName("two wavelengths unmix into the haemoglobin concentrations that made them")
	void unmixing() throws IOException {
		int n = 3;
		double[] oxy = {1.0, -0.5, 0.25};
		double[] deoxy = {-0.3, 0.8, 0.1};
		ExtinctionTable table = ExtinctionTable.defaultTable();
		double[][] coefficients = {table.lookup(690), table.lookup(830)};

		double[][] dod = new double[1][2*n];
		int[] wavelengthIndex = new int[2*n];
		for (int w = 0; w < 2; w ++) {
			double a = coefficients[w][0]/SpectralUnmixer.EXTINCTION_NORMALIZATION;
			double b = coefficients[w][1]/SpectralUnmixer.EXTINCTION_NORMALIZATION;
			for (int i = 0; i < n; i ++) {
				dod[0][w*n + i] = -(oxy[i]*a + deoxy[i]*b);
				wavelengthIndex[w*n + i] = w;
			}
		}
		measurements = Scenarios.series(dod, wavelengthIndex, Scenarios.allActive(2*n), 690, 830);
		mapping = Scenarios.identityMapping(n);

		ImageSet images = run(Scenarios.operator(Matrix.identity(n), Matrix.identity(n)), options());

		assertArrayEquals(oxy, images.getHbo().getVolume()[0], 1e-9);
		assertArrayEquals(deoxy, images.getHbr().getVolume()[0], 1e-9);
	}

	@Nested
	@DisplayName("multispectral")
	class Multispectral {

		@Test
		@DisplayName("the first half of the operator's output is HbO and the second half is HbR")
		void splitsOutput() throws IOException {
			Matrix invJ = Scenarios.randomMatrix(2*NUM_VOLUME, 7, 4);
			ImageSet images = run(Scenarios.operator(invJ), options("reconMethod", "multispectral"));

			double[][] dod = Scenarios.randomValues(NUM_FRAMES, 8, 1);
			int t = 1;
			DenseVector y = new DenseVector(-dod[t][0], -dod[t][1], -dod[t][2], -dod[t][3],
			                                -dod[t][4], -dod[t][6], -dod[t][7]);
			DenseVector x = invJ.matmul(y);
			assertArrayEquals(x.slice(0, NUM_VOLUME).getValues(), images.getHbo().getVolume()[t], 1e-12);
			assertArrayEquals(x.slice(NUM_VOLUME, 2*NUM_VOLUME).getValues(), images.getHbr().getVolume()[t], 1e-12);
			assertEquals(0, images.getMua().length);
		}

		@Test
		@DisplayName("in the cortex, the node count comes from the surface mesh")
		void cortex() throws IOException {
			Matrix invJ = Scenarios.randomMatrix(2*NUM_SURFACE, 7, 5);
			ImageSet images = run(Scenarios.operator(invJ),
			                      options("reconMethod", "multispectral", "reconSpace", "cortex"));

			assertFalse(images.getHbo().hasVolume());
			double[][] dod = Scenarios.randomValues(NUM_FRAMES, 8, 1);
			DenseVector y = new DenseVector(-dod[0][0], -dod[0][1], -dod[0][2], -dod[0][3],
			                                -dod[0][4], -dod[0][6], -dod[0][7]);
			DenseVector x = invJ.matmul(y);
			assertArrayEquals(x.slice(NUM_SURFACE, 2*NUM_SURFACE).getValues(),
			                  images.getHbr().getSurface()[0], 1e-12);
		}

		@Test
		@DisplayName("asking for mua images from a multispectral reconstruction is rejected before anything is written")
		void rejectsMua() {
			Matrix invJ = Scenarios.randomMatrix(2*NUM_VOLUME, 7, 4);
			assertThrows(InvalidConfigurationException.class, () ->
					run(Scenarios.operator(invJ), options("reconMethod", "multispectral", "imageType", "mua")));
			assertEquals(0, writer.calls);
		}

		@Test
		@DisplayName("the operator's own reconMethod counts when checking imageType")
		void rejectsMuaFromOperatorLog() {
			ProvenanceLog log = new ProvenanceLog().plus("reconMethod", "multispectral");
			Matrix invJ = Scenarios.randomMatrix(2*NUM_VOLUME, 7, 4);
			assertThrows(InvalidConfigurationException.class, () ->
					run(Scenarios.operator(log, invJ), options("imageType", "both")));
			assertEquals(0, writer.calls);
		}

		@Test
		@DisplayName("a standard operator doesn't rescue a request for multispectral mua images")
		void rejectsMuaRequestEvenWithStandardOperator() {
			ProvenanceLog log = new ProvenanceLog().plus("reconMethod", "standard");
			InverseOperator plain = standardOperator();
			assertThrows(InvalidConfigurationException.class, () ->
					run(Scenarios.operator(log, plain.getMatrix(0), plain.getMatrix(1)),
					    options("reconMethod", "multispectral", "imageType", "mua")));
			assertEquals(0, writer.calls);
		}
	}

	@Test
	@DisplayName("the hyperparameter an operator was bilt with beats the requested one")
	void operatorSettingsTakePrecedence() throws IOException {
		ProvenanceLog log = new ProvenanceLog()
				.plus("hyperParameter", "0.05")
				.plus("regMethod", "spatial");
		InverseOperator plain = standardOperator();
		ImageSet images = run(Scenarios.operator(log, plain.getMatrix(0), plain.getMatrix(1)),
		                      options("hyperParameter", "0.01", "regMethod", "tikhonov"));
		assertEquals("0.05", images.getLog().get("hyperParameter").orElseThrow());
		assertEquals("spatial", images.getLog().get("regMethod").orElseThrow());
	}

	@Test
	void provenanceLog() throws IOException {
		ImageSet images = run(standardOperator(), options());
		ProvenanceLog log = images.getLog();
		assertEquals(Scenarios.FIXED_TIMESTAMP, log.get("Created on").orElseThrow());
		assertEquals("subject01", log.get("Associated measurement file").orElseThrow());
		assertEquals("invjac01", log.get("Associated inverse operator file").orElseThrow());
		assertEquals("standard", log.get("reconMethod").orElseThrow());
		assertEquals("tikhonov", log.get("regMethod").orElseThrow());
		assertEquals("0.01", log.get("hyperParameter").orElseThrow());
	}

	@Test
	@DisplayName("the writer gets the measurement name and the persist flag")
	void writerCall() throws IOException {
		ImageSet images = run(standardOperator(), options("saveFlag", "0"));
		assertEquals(1, writer.calls);
		assertEquals("subject01", writer.lastName);
		assertSame(images, writer.lastImages);
		assertFalse(writer.lastPersist);

		run(standardOperator(), options());
		assertTrue(writer.lastPersist);
	}

	@Test
	@DisplayName("several threads give exactly the same images as one")
	void parallelMatchesSequential() throws IOException {
		InverseOperator operator = standardOperator();
		ImageSet sequential = run(operator, options("imageType", "both"));
		ImageSet parallel = run(operator, options("imageType", "both", "threads", "4"));
		assertArrayEquals(sequential.getHbo().getVolume(), parallel.getHbo().getVolume());
		assertArrayEquals(sequential.getHbr().getSurface(), parallel.getHbr().getSurface());
		assertArrayEquals(sequential.getMua()[1].getSurface(), parallel.getMua()[1].getSurface());
	}

	@Test
	@DisplayName("an operator on a grid basis is interpolated onto the volume mesh")
	void gridBasis() throws IOException {
		InverseOperator operator = new InverseOperator(
				List.of(Scenarios.randomMatrix(2, 4, 2), Scenarios.randomMatrix(2, 3, 3)),
				new int[] {2, 1, 1}, new ProvenanceLog(), "invjac-basis");
		ImageSet images = run(operator, options("imageType", "mua"));

		double[][] volume = images.getMua()[0].getVolume();
		for (double[] frame: volume) {
			assertEquals(NUM_VOLUME, frame.length);
			assertEquals((frame[0] + frame[2])/2, frame[1], 1e-12); // the middle node is halfway between the grid points
		}
	}

	@Nested
	@DisplayName("bad inputs")
	class Failures {

		@Test
		@DisplayName("no operator and no Jacobian")
		void nothingToInvert() {
			assertThrows(MissingInputException.class, () -> run(null, options()));
			assertEquals(0, writer.calls);
		}

		@Test
		@DisplayName("a Jacobian but no provider")
		void noProvider() {
			Jacobian jacobian = new Jacobian(List.of(Matrix.identity(3)), null, "jac01");
			assertThrows(MissingInputException.class, () ->
					new Reconstruction(null, writer, FIXED_CLOCK)
							.reconstruct(measurements, jacobian, null, mapping, options()));
		}

		@Test
		@DisplayName("the provider is called once and its operator is used")
		void providerIsUsed() throws IOException {
			Jacobian jacobian = new Jacobian(List.of(Matrix.identity(3)), null, "jac01");
			int[] calls = {0};
			double[] hyperParameter = {0};
			InverseOperatorProvider provider = (jac, data, space, config) -> {
				calls[0] ++;
				hyperParameter[0] = config.hyperParameter().get(0);
				return standardOperator();
			};
			ImageSet images = new Reconstruction(provider, writer, FIXED_CLOCK)
					.reconstruct(measurements, jacobian, null, mapping, options("hyperParameter", "0.2"));
			assertEquals(1, calls[0]);
			assertEquals(0.2, hyperParameter[0]);
			assertEquals(NUM_FRAMES, images.getNumFrames());
			assertEquals(Reconstruction.COMPUTED_OPERATOR,
			             images.getLog().get("Associated inverse operator file").orElseThrow());
		}

		@Test
		@DisplayName("a failing provider is reported as missing input")
		void providerFailure() {
			Jacobian jacobian = new Jacobian(List.of(Matrix.identity(3)), null, "jac01");
			IOException cause = new IOException("the Jacobian is corrupt");
			InverseOperatorProvider provider = (jac, data, space, config) -> {
				throw cause;
			};
			MissingInputException e = assertThrows(MissingInputException.class, () ->
					new Reconstruction(provider, writer, FIXED_CLOCK)
							.reconstruct(measurements, jacobian, null, mapping, options()));
			assertSame(cause, e.getCause());
			assertEquals(0, writer.calls);
		}

		@Test
		@DisplayName("a provider that gets interrupted leaves the thread interrupted")
		void providerInterrupted() {
			Jacobian jacobian = new Jacobian(List.of(Matrix.identity(3)), null, "jac01");
			InverseOperatorProvider provider = (jac, data, space, config) -> {
				throw new InterruptedException("cancelled");
			};
			try {
				MissingInputException e = assertThrows(MissingInputException.class, () ->
						new Reconstruction(provider, writer, FIXED_CLOCK)
								.reconstruct(measurements, jacobian, null, mapping, options()));
				assertInstanceOf(InterruptedException.class, e.getCause());
				assertTrue(Thread.currentThread().isInterrupted());
			} finally {
				Thread.interrupted();
			}
			assertEquals(0, writer.calls);
		}

		@Test
		@DisplayName("a provider that returns nothing is reported as missing input")
		void providerReturnsNull() {
			Jacobian jacobian = new Jacobian(List.of(Matrix.identity(3)), null, "jac01");
			assertThrows(MissingInputException.class, () ->
					new Reconstruction((jac, data, space, config) -> null, writer, FIXED_CLOCK)
							.reconstruct(measurements, jacobian, null, mapping, options()));
		}

		@Test
		@DisplayName("an operator with the wrong number of collums")
		void wrongChannelCount() {
			InverseOperator operator = Scenarios.operator(Scenarios.randomMatrix(NUM_VOLUME, 4, 2),
			                                              Scenarios.randomMatrix(NUM_VOLUME, 4, 3));
			assertThrows(DimensionMismatchException.class, () -> run(operator, options()));
			assertEquals(0, writer.calls);
		}

		@Test
		@DisplayName("an operator with the wrong number of nodes")
		void wrongNodeCount() {
			InverseOperator operator = Scenarios.operator(Scenarios.randomMatrix(NUM_VOLUME + 1, 4, 2),
			                                              Scenarios.randomMatrix(NUM_VOLUME + 1, 3, 3));
			assertThrows(DimensionMismatchException.class, () -> run(operator, options()));
		}

		@Test
		@DisplayName("an operator for the wrong number of wavelengths")
		void wrongWavelengthCount() {
			InverseOperator operator = Scenarios.operator(Scenarios.randomMatrix(NUM_VOLUME, 4, 2));
			assertThrows(DimensionMismatchException.class, () -> run(operator, options()));
		}

		@Test
		void unrecognizedOption() {
			assertThrows(InvalidConfigurationException.class, () ->
					run(standardOperator(), options("colorMap", "viridis")));
		}
	}
}
