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
 * the spatial side of a reconstruction: the volume mesh of the head, the gray matter
 * surface mesh, and the fixed linear operator that projects volume node values onto the
 * surface nodes.
 */
public class SpatialMapping {

	private final double[][] volumeNodes;
	private final double[][] surfaceNodes;
	private final Matrix vol2gm;
	private final String source;

	/**
	 * @param volumeNodes the coordinates of each volume mesh node, indexed [node][x, y, z] (mm)
	 * @param surfaceNodes the coordinates of each surface mesh node (mm)
	 * @param vol2gm the surfaceNodes × volumeNodes projection operator
	 * @param source the name of the file this came from
	 * @throws DimensionMismatchException if vol2gm doesn't have one row per surface node and one collum per volume node
	 */
	public SpatialMapping(double[][] volumeNodes, double[][] surfaceNodes, Matrix vol2gm, String source) {
		if (vol2gm.m != surfaceNodes.length)
			throw new DimensionMismatchException("number of rows in vol2gm", surfaceNodes.length, vol2gm.m);
		if (vol2gm.n != volumeNodes.length)
			throw new DimensionMismatchException("number of collums in vol2gm", volumeNodes.length, vol2gm.n);
		for (int i = 0; i < volumeNodes.length; i ++)
			if (volumeNodes[i].length != 3)
				throw new DimensionMismatchException("number of coordinates of volume node "+i, 3, volumeNodes[i].length);
		this.volumeNodes = Math2.deepCopy(volumeNodes);
		this.surfaceNodes = Math2.deepCopy(surfaceNodes);
		this.vol2gm = vol2gm;
		this.source = source;
	}

	public int getNumVolumeNodes() {
		return volumeNodes.length;
	}

	public int getNumSurfaceNodes() {
		return surfaceNodes.length;
	}

	public double[] getVolumeNode(int i) {
		return volumeNodes[i].clone();
	}

	public Matrix getVol2gm() {
		return vol2gm;
	}

	public String getSource() {
		return source;
	}
}
