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
 * applies the inverse operator to the measurements at one frame.  all of the shape checking
 * happens in the constructor, so that a bad combination of inputs fails before any frame is
 * touched, and so that {@link #reconstruct} can be called from several threads at once.
 */
public class FrameReconstructor {

	private final InverseOperator operator;
	private final MeasurementPreparer preparer;
	private final SpectralUnmixer unmixer;
	private final ReconMethod method;
	private final ImageType imageType;
	private final int numNodes;

	/**
	 * @param operator the inverse operator
	 * @param preparer the source of measurement vectors
	 * @param unmixer the spectral unmixer, needed only for haemoglobin images from a standard reconstruction
	 * @param config the resolved options
	 * @param numNodes the number of nodes in the operator's native space
	 * @throws DimensionMismatchException if the operator doesn't fit the measurements or the native space
	 * @throws MissingInputException if haemoglobin images are needed and there's no unmixer
	 */
	public FrameReconstructor(InverseOperator operator, MeasurementPreparer preparer,
	                          SpectralUnmixer unmixer, ReconstructionConfig config, int numNodes) {
		this.operator = operator;
		this.preparer = preparer;
		this.unmixer = unmixer;
		this.method = config.reconMethod();
		this.imageType = config.imageType();
		this.numNodes = numNodes;

		if (method == ReconMethod.MULTISPECTRAL) {
			if (operator.getNumMatrices() != 1)
				throw new DimensionMismatchException("number of matrices in a multispectral inverse operator", 1, operator.getNumMatrices());
			Matrix invJ = operator.getMatrix(0);
			if (invJ.m != 2*numNodes)
				throw new DimensionMismatchException("number of rows in the multispectral inverse operator (two per node)", 2*numNodes, invJ.m);
			if (invJ.n != preparer.activeChannelCount())
				throw new DimensionMismatchException("number of active channels", invJ.n, preparer.activeChannelCount());
		}
		else {
			if (operator.getNumMatrices() != preparer.getNumWavelengths())
				throw new DimensionMismatchException("number of matrices in the inverse operator (one per wavelength)",
				                                     preparer.getNumWavelengths(), operator.getNumMatrices());
			for (int w = 0; w < operator.getNumMatrices(); w ++) {
				Matrix invJ = operator.getMatrix(w);
				if (invJ.m != numNodes)
					throw new DimensionMismatchException("number of rows in the inverse operator for wavelength "+w, numNodes, invJ.m);
				if (invJ.n != preparer.activeChannelCount(w))
					throw new DimensionMismatchException("number of active channels at wavelength "+w,
					                                     invJ.n, preparer.activeChannelCount(w));
			}
			if (imageType.wantsHaemoglobin()) {
				if (unmixer == null)
					throw new MissingInputException("haemoglobin images from a standard reconstruction need a spectral unmixer");
				if (unmixer.getNumWavelengths() != preparer.getNumWavelengths())
					throw new DimensionMismatchException("number of wavelengths in the unmixer",
					                                     preparer.getNumWavelengths(), unmixer.getNumWavelengths());
			}
		}
	}

	/**
	 * @param frame the index of the frame to reconstruct
	 * @return the native-space images at that frame
	 */
	public FrameImage reconstruct(int frame) {
		if (method == ReconMethod.MULTISPECTRAL) {
			Vector image = operator.getMatrix(0).matmul(preparer.prepareAll(frame));
			return new FrameImage(image.slice(0, numNodes), image.slice(numNodes, 2*numNodes), null);
		}
		else {
			Vector[] mua = new Vector[operator.getNumMatrices()];
			for (int w = 0; w < mua.length; w ++)
				mua[w] = operator.getMatrix(w).matmul(preparer.prepare(frame, w));

			Vector hbo = null, hbr = null;
			if (imageType.wantsHaemoglobin()) {
				Vector[] haemoglobin = unmixer.unmix(mua);
				hbo = haemoglobin[0];
				hbr = haemoglobin[1];
			}
			return new FrameImage(hbo, hbr, imageType.wantsMua() ? mua : null);
		}
	}

	/**
	 * the images from one frame, in the operator's native space.  any of these may be null
	 * if it wasn't asked for.
	 * @param hbo the oxy-haemoglobin image
	 * @param hbr the deoxy-haemoglobin image
	 * @param mua the absorption image at each wavelength
	 */
	public record FrameImage(Vector hbo, Vector hbr, Vector[] mua) {}
}
