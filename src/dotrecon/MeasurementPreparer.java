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
 * pulls the measurement vectors that the inverse operators expect out of a measurement
 * series.  the channel selection for each wavelength is worked out once, up front, so every
 * frame gets exactly the same ordering: active channels in their original order.  get this
 * rong and the reconstruction still runs; it just produces garbage.
 */
public class MeasurementPreparer {

	private final MeasurementSeries data;
	/** the channels that go into each wavelength's vector, indexed [wavelength][i] */
	private final int[][] channelsByWavelength;
	/** the channels that go into the multispectral vector */
	private final int[] allChannels;

	public MeasurementPreparer(MeasurementSeries data) {
		this.data = data;

		boolean[] active = new boolean[data.getNumChannels()];
		for (int j = 0; j < active.length; j ++)
			active[j] = data.isActive(j);
		this.allChannels = Math2.where(active);

		this.channelsByWavelength = new int[data.getNumWavelengths()][];
		for (int w = 0; w < channelsByWavelength.length; w ++) {
			boolean[] selected = new boolean[data.getNumChannels()];
			for (int j = 0; j < selected.length; j ++)
				selected[j] = active[j] && data.getWavelengthIndex(j) == w;
			this.channelsByWavelength[w] = Math2.where(selected);
		}
	}

	/**
	 * get the measurement vector for one wavelength at one frame.  the optical density is
	 * negated, since the operators are bilt to take ln(I/I0) rather than -ln(I/I0).
	 * @param frame the index of the frame
	 * @param wavelength the index of the wavelength
	 * @return the negated optical density on each active channel of that wavelength
	 */
	public DenseVector prepare(int frame, int wavelength) {
		return new DenseVector(Math2.select(data.getFrame(frame), channelsByWavelength[wavelength])).neg();
	}

	/**
	 * get the measurement vector for all wavelengths at one frame, for the multispectral
	 * operator.  channels are in their original order, not grouped by wavelength.
	 * @param frame the index of the frame
	 * @return the negated optical density on each active channel
	 */
	public DenseVector prepareAll(int frame) {
		return new DenseVector(Math2.select(data.getFrame(frame), allChannels)).neg();
	}

	public int activeChannelCount(int wavelength) {
		return channelsByWavelength[wavelength].length;
	}

	public int activeChannelCount() {
		return allChannels.length;
	}

	public int getNumWavelengths() {
		return channelsByWavelength.length;
	}

	public int getNumFrames() {
		return data.getNumFrames();
	}
}
