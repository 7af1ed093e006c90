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
import dotrecon.SpatialMapper.MappedImage;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * collects the mapped images from each frame into time series.  every frame has its own
 * row in each array, so frames may be put in any order and from any thread, as long as no
 * two calls share a frame index.
 */
public class ImageAssembler {

	public static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

	private final int numFrames;
	private final boolean keepVolume;

	private final double[][] hboVolume, hboSurface;
	private final double[][] hbrVolume, hbrSurface;
	private final double[][][] muaVolume, muaSurface;

	/**
	 * @param config the resolved options, which say which images to keep
	 * @param numFrames the number of frames
	 * @param numWavelengths the number of wavelengths, for the mua images
	 * @param mapper the spatial mapper, which says how big the images are
	 */
	public ImageAssembler(ReconstructionConfig config, int numFrames, int numWavelengths,
	                      SpatialMapper mapper) {
		this.numFrames = numFrames;
		this.keepVolume = config.saveVolumeImages() && config.reconSpace() != ReconSpace.CORTEX
		                  && mapper.producesVolume();
		int volumeSize = keepVolume ? mapper.getNumVolumeNodes() : 0;
		int surfaceSize = mapper.getNumSurfaceNodes();

		if (config.imageType().wantsHaemoglobin()) {
			hboVolume = new double[numFrames][volumeSize];
			hboSurface = new double[numFrames][surfaceSize];
			hbrVolume = new double[numFrames][volumeSize];
			hbrSurface = new double[numFrames][surfaceSize];
		}
		else {
			hboVolume = hboSurface = hbrVolume = hbrSurface = null;
		}

		if (config.imageType().wantsMua()) {
			muaVolume = new double[numWavelengths][numFrames][volumeSize];
			muaSurface = new double[numWavelengths][numFrames][surfaceSize];
		}
		else {
			muaVolume = muaSurface = null;
		}
	}

	/**
	 * record the images from one frame.
	 * @param frame the frame index
	 * @param hbo the mapped oxy-haemoglobin image, or null if haemoglobin wasn't asked for
	 * @param hbr the mapped deoxy-haemoglobin image, or null if haemoglobin wasn't asked for
	 * @param mua the mapped absorption image at each wavelength, or null if mua wasn't asked for
	 */
	public void put(int frame, MappedImage hbo, MappedImage hbr, MappedImage[] mua) {
		if (hboSurface != null) {
			store(hbo, frame, hboVolume, hboSurface);
			store(hbr, frame, hbrVolume, hbrSurface);
		}
		if (muaSurface != null) {
			if (mua == null || mua.length != muaSurface.length)
				throw new DimensionMismatchException("number of mua images at frame "+frame,
				                                     muaSurface.length, (mua == null) ? 0 : mua.length);
			for (int w = 0; w < mua.length; w ++)
				store(mua[w], frame, muaVolume[w], muaSurface[w]);
		}
	}

	private void store(MappedImage image, int frame, double[][] volume, double[][] surface) {
		if (image == null)
			throw new IllegalArgumentException("frame "+frame+" is missing an image");
		surface[frame] = image.surface().getValues();
		if (keepVolume)
			volume[frame] = image.volume().getValues();
	}

	/**
	 * finish off the time series.  volume images are dropped if they weren't wanted or if
	 * the reconstruction was done on the cortex.
	 * @param time the time of each frame
	 * @param log the provenance log to attach
	 * @return the finished image set
	 */
	public ImageSet finish(double[] time, ProvenanceLog log) {
		if (time.length != numFrames)
			throw new DimensionMismatchException("length of the time axis", numFrames, time.length);
		Image hbo = null, hbr = null;
		if (hboSurface != null) {
			hbo = new Image(hboVolume, hboSurface);
			hbr = new Image(hbrVolume, hbrSurface);
		}
		Image[] mua = new Image[(muaSurface != null) ? muaSurface.length : 0];
		for (int w = 0; w < mua.length; w ++)
			mua[w] = new Image(muaVolume[w], muaSurface[w]);

		if (!keepVolume) {
			if (hbo != null) {
				hbo = hbo.withoutVolume();
				hbr = hbr.withoutVolume();
			}
			for (int w = 0; w < mua.length; w ++)
				mua[w] = mua[w].withoutVolume();
		}
		return new ImageSet(hbo, hbr, mua, time, log);
	}

	/**
	 * bild the provenance log for a set of images.
	 * @param clock the source of the creation time
	 * @param measurementSource where the measurements came from
	 * @param operatorSource where the inverse operator came from
	 * @param config the options that were actually used
	 */
	public static ProvenanceLog provenance(Clock clock, String measurementSource, String operatorSource,
	                                       ReconstructionConfig config) {
		return new ProvenanceLog()
				.plus("Created on", LocalDateTime.now(clock).format(TIMESTAMP))
				.plus("Associated measurement file", measurementSource)
				.plus("Associated inverse operator file", operatorSource)
				.plus(ReconstructionConfig.RECON_METHOD, config.reconMethod().toString())
				.plus(ReconstructionConfig.REG_METHOD, config.regMethod().toString())
				.plus(ReconstructionConfig.HYPER_PARAMETER, config.formatHyperParameter())
				.plus(ReconstructionConfig.RECON_SPACE, config.reconSpace().toString())
				.plus(ReconstructionConfig.IMAGE_TYPE, config.imageType().toString());
	}
}
