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
 * something that can regularize and invert a Jacobian.  the reconstruction calls this at
 * most once, and only when it isn't given an inverse operator to begin with.
 */
@FunctionalInterface
public interface InverseOperatorProvider {

	/**
	 * @param jacobian the forward sensitivity matrices
	 * @param data the measurements, for channel selection and noise estimates
	 * @param mapping the meshes, for spatial regularization
	 * @param config the resolved options, including the regularization method and hyperparameter
	 * @return a freshly computed inverse operator, which the caller will not persist
	 * @throws Exception if the inversion fails for any reason; this will be reported as missing input
	 */
	InverseOperator invert(Jacobian jacobian, MeasurementSeries data, SpatialMapping mapping,
	                       ReconstructionConfig config) throws Exception;
}
