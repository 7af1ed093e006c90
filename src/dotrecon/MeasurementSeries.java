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
 * a preprocessed optical measurement: the change in optical density on every channel at
 * every frame, together with what wavelength each channel uses and whether it survived
 * quality screening.  the channel order here is the channel order the inverse operator's
 * collums were bilt in; nothing downstream reorders channels.
 */
public class MeasurementSeries {

	private final double[][] dod;
	private final double[] time;
	private final int[] wavelengthIndex;
	private final boolean[] active;
	private final double[] wavelengths;
	private final ExtinctionTable extinction;
	private final String source;

	/**
	 * @param dod the optical density changes, -ln(I/I0), indexed [frame][channel]
	 * @param time the time of each frame (s)
	 * @param wavelengthIndex the index into wavelengths of each channel (0-based)
	 * @param active whether each channel is good enuff to use
	 * @param wavelengths the wavelengths of the system (nm)
	 * @param extinction the extinction coefficients to use for unmixing, or null if they won't be needed
	 * @param source the name of the file this came from, for provenance
	 * @throws DimensionMismatchException if any of the arrays disagree on the number of frames or channels
	 */
	public MeasurementSeries(double[][] dod, double[] time, int[] wavelengthIndex, boolean[] active,
	                         double[] wavelengths, ExtinctionTable extinction, String source) {
		if (time.length != dod.length)
			throw new DimensionMismatchException("length of the time axis", dod.length, time.length);
		if (active.length != wavelengthIndex.length)
			throw new DimensionMismatchException("number of active flags", wavelengthIndex.length, active.length);
		for (int i = 0; i < dod.length; i ++)
			if (dod[i].length != wavelengthIndex.length)
				throw new DimensionMismatchException("number of channels in frame "+i, wavelengthIndex.length, dod[i].length);
		if (wavelengths.length == 0)
			throw new DimensionMismatchException("there must be at least one wavelength");
		for (int j = 0; j < wavelengthIndex.length; j ++)
			if (wavelengthIndex[j] < 0 || wavelengthIndex[j] >= wavelengths.length)
				throw new DimensionMismatchException(String.format(
						"channel %d claims wavelength %d, but there are only %d wavelengths",
						j, wavelengthIndex[j], wavelengths.length));

		this.dod = Math2.deepCopy(dod);
		this.time = time.clone();
		this.wavelengthIndex = wavelengthIndex.clone();
		this.active = active.clone();
		this.wavelengths = wavelengths.clone();
		this.extinction = extinction;
		this.source = source;
	}

	public int getNumFrames() {
		return dod.length;
	}

	public int getNumChannels() {
		return wavelengthIndex.length;
	}

	public int getNumWavelengths() {
		return wavelengths.length;
	}

	/**
	 * @return the optical density on every channel at one frame; don't modify it
	 */
	double[] getFrame(int frame) {
		return dod[frame];
	}

	public double[] getTime() {
		return time.clone();
	}

	public int getWavelengthIndex(int channel) {
		return wavelengthIndex[channel];
	}

	public boolean isActive(int channel) {
		return active[channel];
	}

	public double getWavelength(int index) {
		return wavelengths[index];
	}

	public double[] getWavelengths() {
		return wavelengths.clone();
	}

	/**
	 * @return the extinction table, or null if none was given
	 */
	public ExtinctionTable getExtinction() {
		return extinction;
	}

	public String getSource() {
		return source;
	}
}
