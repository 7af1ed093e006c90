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

import java.util.Arrays;

/**
 * a basis where values are defined at evenly spaced points on a cartesian grid spanning the
 * bounding box of the volume mesh, and are trilinearly interpolated onto the mesh nodes.
 * grid point (i, j, k) is basis function (k*ny + j)*nx + i, so x varies fastest.  the
 * interpolation weits are worked out once and kept as a sparse matrix.
 */
public class GridBasisMapping implements BasisMapping {

	private final int[] shape;
	private final Matrix interpolation;

	/**
	 * @param shape the number of grid points along each axis {nx, ny, nz}
	 * @param mapping the meshes, whose volume nodes define the extent of the grid
	 */
	public GridBasisMapping(int[] shape, SpatialMapping mapping) {
		if (shape.length != 3)
			throw new DimensionMismatchException("number of basis grid dimensions", 3, shape.length);
		for (int size: shape)
			if (size < 1)
				throw new DimensionMismatchException("the basis grid can't be "+Arrays.toString(shape));
		this.shape = shape.clone();

		int num_nodes = mapping.getNumVolumeNodes();
		double[] min = new double[3], max = new double[3];
		Arrays.fill(min, Double.POSITIVE_INFINITY);
		Arrays.fill(max, Double.NEGATIVE_INFINITY);
		for (int и = 0; и < num_nodes; и ++) {
			double[] r = mapping.getVolumeNode(и);
			for (int a = 0; a < 3; a ++) {
				min[a] = Math.min(min[a], r[a]);
				max[a] = Math.max(max[a], r[a]);
			}
		}

		SparseVector[] rows = new SparseVector[num_nodes];
		for (int и = 0; и < num_nodes; и ++) {
			double[] r = mapping.getVolumeNode(и);
			int[] i0 = new int[3];
			double[] c1 = new double[3]; // the weit of the upper neighbor along each axis
			for (int a = 0; a < 3; a ++) {
				if (shape[a] == 1 || max[a] == min[a]) {
					i0[a] = 0;
					c1[a] = 0;
				}
				else {
					double index = Math2.clamp((r[a] - min[a])/(max[a] - min[a])*(shape[a] - 1),
					                           0, shape[a] - 1);
					i0[a] = Math.min((int) index, shape[a] - 2);
					c1[a] = index - i0[a];
				}
			}
			SparseVector row = new SparseVector(getBasisSize());
			for (int di = 0; di <= 1; di ++)
				for (int dj = 0; dj <= 1; dj ++)
					for (int dk = 0; dk <= 1; dk ++) {
						double weit = ((di == 1) ? c1[0] : 1 - c1[0]) *
						              ((dj == 1) ? c1[1] : 1 - c1[1]) *
						              ((dk == 1) ? c1[2] : 1 - c1[2]);
						if (weit != 0)
							row.add(index(i0[0] + di, i0[1] + dj, i0[2] + dk), weit);
					}
			rows[и] = row;
		}
		this.interpolation = new Matrix(num_nodes, getBasisSize(), rows);
	}

	private int index(int i, int j, int k) {
		return (k*shape[1] + j)*shape[0] + i;
	}

	@Override
	public Vector basisToVolume(Vector coefficients) {
		if (coefficients.getLength() != getBasisSize())
			throw new DimensionMismatchException("number of basis coefficients", getBasisSize(), coefficients.getLength());
		return interpolation.matmul(coefficients);
	}

	@Override
	public int getBasisSize() {
		return shape[0]*shape[1]*shape[2];
	}

	@Override
	public int getVolumeSize() {
		return interpolation.m;
	}
}
