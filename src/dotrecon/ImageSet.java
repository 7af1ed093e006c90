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
 * the result of a reconstruction: oxy- and deoxy-haemoglobin images and/or absorption images
 * at each wavelength, each as a time series on the volume mesh and on the surface mesh.
 * any volume series may be empty (no rows at all) if volume images weren't kept.
 */
public class ImageSet {

	private final Image hbo;
	private final Image hbr;
	private final Image[] mua;
	private final double[] time;
	private final ProvenanceLog log;

	/**
	 * @param hbo the oxy-haemoglobin images, or null if they weren't asked for
	 * @param hbr the deoxy-haemoglobin images, or null if they weren't asked for
	 * @param mua the absorption images at each wavelength, or an empty array if they weren't asked for
	 * @param time the time of each frame (s)
	 * @param log where these images came from
	 */
	public ImageSet(Image hbo, Image hbr, Image[] mua, double[] time, ProvenanceLog log) {
		this.hbo = hbo;
		this.hbr = hbr;
		this.mua = mua.clone();
		this.time = time.clone();
		this.log = log;
	}

	public boolean hasHaemoglobin() {
		return hbo != null;
	}

	/**
	 * @return the oxy-haemoglobin images, or null
	 */
	public Image getHbo() {
		return hbo;
	}

	/**
	 * @return the deoxy-haemoglobin images, or null
	 */
	public Image getHbr() {
		return hbr;
	}

	/**
	 * @return the absorption images, one per wavelength; empty if mua wasn't asked for
	 */
	public Image[] getMua() {
		return mua.clone();
	}

	public double[] getTime() {
		return time.clone();
	}

	public int getNumFrames() {
		return time.length;
	}

	public ProvenanceLog getLog() {
		return log;
	}

	/**
	 * one quantity's images at every frame.
	 */
	public static class Image {
		private final double[][] volume;
		private final double[][] surface;

		/**
		 * @param volume the values indexed [frame][volume node]; may have no rows
		 * @param surface the values indexed [frame][surface node]
		 */
		public Image(double[][] volume, double[][] surface) {
			this.volume = volume;
			this.surface = surface;
		}

		/**
		 * @return the volume images indexed [frame][node], or an array with no rows if volume images weren't kept
		 */
		public double[][] getVolume() {
			return Math2.deepCopy(volume);
		}

		/**
		 * @return the surface images indexed [frame][node]
		 */
		public double[][] getSurface() {
			return Math2.deepCopy(surface);
		}

		public boolean hasVolume() {
			return volume.length > 0;
		}

		/**
		 * @return a copy of this with the volume images thrown away
		 */
		Image withoutVolume() {
			return new Image(new double[0][], surface);
		}
	}
}
