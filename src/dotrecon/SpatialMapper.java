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
 * carries node-space vectors from the space the inverse operator works in to the volume and
 * surface meshes.  there are three ways this can go, and which one applies is fixed when
 * the mapper is created:
 * <ul>
 *   <li>with a basis: basis → volume → surface</li>
 *   <li>with no basis, in the cortex: the vector is already on the surface</li>
 *   <li>with no basis, in the volume: volume → surface</li>
 * </ul>
 * mua and haemoglobin vectors are treated identically.
 */
public class SpatialMapper {

	private final BasisMapping basis;
	private final ReconSpace space;
	private final Matrix vol2gm;
	private final int numVolumeNodes;
	private final int numSurfaceNodes;

	/**
	 * @param mapping the meshes and the volume-to-surface operator
	 * @param basis the basis-to-volume mapping, or null if the operator works on mesh nodes directly
	 * @param space where the operator's unknowns live when there's no basis
	 * @throws DimensionMismatchException if the basis doesn't produce one value per volume node
	 */
	public SpatialMapper(SpatialMapping mapping, BasisMapping basis, ReconSpace space) {
		if (basis != null && basis.getVolumeSize() != mapping.getNumVolumeNodes())
			throw new DimensionMismatchException("number of volume nodes the basis maps onto",
			                                     mapping.getNumVolumeNodes(), basis.getVolumeSize());
		this.basis = basis;
		this.space = space;
		this.vol2gm = mapping.getVol2gm();
		this.numVolumeNodes = mapping.getNumVolumeNodes();
		this.numSurfaceNodes = mapping.getNumSurfaceNodes();
	}

	/**
	 * @return the length that vectors passed to {@link #map} must have
	 */
	public int getNativeNodeCount() {
		if (basis != null)
			return basis.getBasisSize();
		else if (space == ReconSpace.CORTEX)
			return numSurfaceNodes;
		else
			return numVolumeNodes;
	}

	/**
	 * @return whether mapped images will have volume values at all
	 */
	public boolean producesVolume() {
		return basis != null || space == ReconSpace.VOLUME;
	}

	public int getNumVolumeNodes() {
		return numVolumeNodes;
	}

	public int getNumSurfaceNodes() {
		return numSurfaceNodes;
	}

	/**
	 * @param image a vector in the operator's native space
	 * @return the same image on the volume mesh (if there is one) and on the surface mesh
	 */
	public MappedImage map(Vector image) {
		if (image.getLength() != getNativeNodeCount())
			throw new DimensionMismatchException("length of the native-space image", getNativeNodeCount(), image.getLength());
		Vector volume;
		if (basis != null)
			volume = basis.basisToVolume(image);
		else if (space == ReconSpace.CORTEX)
			return new MappedImage(null, image);
		else
			volume = image;
		return new MappedImage(volume, vol2gm.matmul(volume));
	}

	/**
	 * @param volume the image on the volume mesh, or null if it doesn't have a volume representation
	 * @param surface the image on the surface mesh
	 */
	public record MappedImage(Vector volume, Vector surface) {}
}
