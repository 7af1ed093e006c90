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

import dotrecon.FrameReconstructor.FrameImage;
import dotrecon.ParameterResolver.Resolution;
import dotrecon.SpatialMapper.MappedImage;

import java.io.File;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * the whole linear reconstruction: resolve the options, get an inverse operator, apply it
 * to every frame, map the results onto the meshes, and hand the finished images to the
 * writer.
 */
public class Reconstruction {

	/** what the provenance log says in place of a file name when the operator wasn't loaded */
	public static final String COMPUTED_OPERATOR = "computed during reconstruction";

	private static final Logger logger = Logger.getLogger("root");

	private final InverseOperatorProvider provider;
	private final ImageWriter writer;
	private final Clock clock;

	/**
	 * @param provider the thing to call if no inverse operator is supplied, or null if there isn't one
	 * @param writer where to send the finished images, or null to not send them anywhere
	 * @param clock the source of the creation time in the provenance log
	 */
	public Reconstruction(InverseOperatorProvider provider, ImageWriter writer, Clock clock) {
		this.provider = provider;
		this.writer = writer;
		this.clock = clock;
	}

	/**
	 * reconstruct images from every frame of a measurement series.
	 * @param measurements the optical density changes
	 * @param jacobian the forward sensitivity, used only if there's no inverse operator
	 * @param operator the precomputed inverse operator, or null to compute one from the jacobian
	 * @param mapping the meshes and the volume-to-surface operator
	 * @param options the caller's options; any that the operator was bilt with are overridden
	 * @return the images, whether or not they were persisted
	 * @throws InvalidConfigurationException if the options are bad or conflict
	 * @throws MissingInputException if there's no inverse operator and no way to make one
	 * @throws DimensionMismatchException if the inputs don't fit together
	 * @throws IOException if the writer fails
	 */
	public ImageSet reconstruct(MeasurementSeries measurements, Jacobian jacobian,
	                            InverseOperator operator, SpatialMapping mapping,
	                            Map<String, String> options) throws IOException {
		Resolution resolution = ParameterResolver.resolve(options, operator);
		ReconstructionConfig config = resolution.config();

		String operatorSource;
		if (operator == null) {
			operator = computeOperator(jacobian, measurements, mapping, config);
			operatorSource = COMPUTED_OPERATOR;
		}
		else {
			operatorSource = operator.getSource();
		}

		BasisMapping basis = null;
		if (operator.hasBasis()) {
			basis = new GridBasisMapping(operator.getBasis(), mapping);
			logger.info(String.format("using a %d-function grid basis", basis.getBasisSize()));
		}
		SpatialMapper mapper = new SpatialMapper(mapping, basis, config.reconSpace());

		MeasurementPreparer preparer = new MeasurementPreparer(measurements);
		SpectralUnmixer unmixer = null;
		if (config.reconMethod() == ReconMethod.STANDARD && config.imageType().wantsHaemoglobin())
			unmixer = new SpectralUnmixer(measurements.getWavelengths(), measurements.getExtinction());

		FrameReconstructor reconstructor = new FrameReconstructor(
				operator, preparer, unmixer, config, mapper.getNativeNodeCount());
		ImageAssembler assembler = new ImageAssembler(
				config, measurements.getNumFrames(), measurements.getNumWavelengths(), mapper);

		logger.info(String.format("reconstructing %d frames...", measurements.getNumFrames()));
		if (config.threads() > 1 && measurements.getNumFrames() > 1)
			runInParallel(reconstructor, mapper, assembler, measurements.getNumFrames(), config.threads());
		else
			for (int t = 0; t < measurements.getNumFrames(); t ++)
				reconstructFrame(t, reconstructor, mapper, assembler);
		logger.info("done reconstructing.");

		ProvenanceLog log = ImageAssembler.provenance(
				clock, measurements.getSource(), operatorSource, config);
		ImageSet images = assembler.finish(measurements.getTime(), log);

		if (writer != null)
			writer.write(measurements.getSource(), images, config.persist());
		return images;
	}

	private InverseOperator computeOperator(Jacobian jacobian, MeasurementSeries measurements,
	                                        SpatialMapping mapping, ReconstructionConfig config) {
		if (jacobian == null)
			throw new MissingInputException("there is neither an inverse operator nor a Jacobian from which to compute one");
		if (provider == null)
			throw new MissingInputException("there is no inverse operator, and nothing to compute one from the Jacobian");

		logger.info(String.format("inverting %s with %s regularization (%s)...",
		                          jacobian.source(), config.regMethod(), config.formatHyperParameter()));
		InverseOperator operator;
		try {
			operator = provider.invert(jacobian, measurements, mapping, config);
		} catch (Exception e) {
			if (e instanceof InterruptedException)
				Thread.currentThread().interrupt();
			throw new MissingInputException("could not compute the inverse operator from "+jacobian.source(), e);
		}
		if (operator == null)
			throw new MissingInputException("the inverse operator provider didn't return anything for "+jacobian.source());
		return operator;
	}

	private static void reconstructFrame(int frame, FrameReconstructor reconstructor,
	                                     SpatialMapper mapper, ImageAssembler assembler) {
		FrameImage image = reconstructor.reconstruct(frame);
		MappedImage hbo = (image.hbo() != null) ? mapper.map(image.hbo()) : null;
		MappedImage hbr = (image.hbr() != null) ? mapper.map(image.hbr()) : null;
		MappedImage[] mua = null;
		if (image.mua() != null) {
			mua = new MappedImage[image.mua().length];
			for (int w = 0; w < mua.length; w ++)
				mua[w] = mapper.map(image.mua()[w]);
		}
		assembler.put(frame, hbo, hbr, mua);
		logger.fine(String.format("reconstructed frame %d", frame));
	}

	/**
	 * do every frame on a fixed pool of threads.  each task only touches its own frame, so
	 * the result is the same as doing them in order.
	 */
	private static void runInParallel(FrameReconstructor reconstructor, SpatialMapper mapper,
	                                  ImageAssembler assembler, int numFrames, int numThreads) {
		ExecutorService threads = Executors.newFixedThreadPool(Math.min(numThreads, numFrames));
		List<Future<Void>> tasks = new ArrayList<>(numFrames);
		for (int t_task = 0; t_task < numFrames; t_task ++) {
			final int t = t_task;
			Callable<Void> task = () -> {
				reconstructFrame(t, reconstructor, mapper, assembler);
				return null;
			};
			tasks.add(threads.submit(task));
		}
		threads.shutdown();

		try {
			for (Future<Void> task: tasks)
				task.get();
		} catch (ExecutionException e) {
			threads.shutdownNow();
			if (e.getCause() instanceof RuntimeException)
				throw (RuntimeException) e.getCause();
			else if (e.getCause() instanceof Error)
				throw (Error) e.getCause();
			else
				throw new RuntimeException(e.getCause());
		} catch (InterruptedException e) {
			threads.shutdownNow();
			Thread.currentThread().interrupt();
			throw new RuntimeException(e);
		}

		boolean success;
		try {
			success = threads.awaitTermination(60, TimeUnit.MINUTES);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RuntimeException(e);
		}
		if (!success)
			throw new RuntimeException("the reconstruction threads never finished.");
	}

	/**
	 * reconstruct a measurement directory with a precomputed inverse operator and save the
	 * images next to it.
	 * @param args the measurement directory, the inverse operator directory, the mapping
	 *             directory, and then any number of key=value options
	 */
	public static void main(String[] args) throws IOException {
		if (args.length < 3)
			throw new IllegalArgumentException("usage: Reconstruction MEASUREMENT_DIR INVERSE_OPERATOR_DIR MAPPING_DIR [KEY=VALUE ...]");
		File measurementDirectory = new File(args[0]);
		File operatorDirectory = new File(args[1]);
		File mappingDirectory = new File(args[2]);

		Map<String, String> options = new LinkedHashMap<>();
		for (int i = 3; i < args.length; i ++) {
			int split = args[i].indexOf('=');
			if (split <= 0)
				throw new InvalidConfigurationException("options should look like key=value, not '"+args[i]+"'");
			options.put(args[i].substring(0, split), args[i].substring(split + 1));
		}

		Logging.configureLogger(logger, new File(measurementDirectory, "log-reconstruction.log"));
		logger.info("starting...");

		try {
			MeasurementSeries measurements = Artifacts.loadMeasurements(measurementDirectory);
			InverseOperator operator = Artifacts.loadInverseOperator(operatorDirectory);
			SpatialMapping mapping = Artifacts.loadMapping(mappingDirectory);

			File outputDirectory = measurementDirectory.getAbsoluteFile().getParentFile();
			Reconstruction reconstruction = new Reconstruction(
					null, new CsvImageWriter(outputDirectory), Clock.systemDefaultZone());
			reconstruction.reconstruct(measurements, null, operator, mapping, options);
		} catch (ReconstructionException e) {
			logger.log(Level.SEVERE, "the reconstruction failed", e);
			throw e;
		}
		logger.info("done!");
	}
}
