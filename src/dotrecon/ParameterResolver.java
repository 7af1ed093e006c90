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

import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * turns the caller's options into the configuration that will actually be used.  if the
 * caller supplies an inverse operator, the settings it was bilt with take precedence over
 * the caller's, since the operator can't be reinterpreted after the fact.
 */
public class ParameterResolver {

	private static final Logger logger = Logger.getLogger("root");

	/**
	 * @param options the caller's options, as strings
	 * @param supplied the inverse operator to use, or null if one is to be computed
	 * @return the effective configuration and the names of any options the operator overrode
	 * @throws InvalidConfigurationException if an option is unrecognized or the requested or merged options conflict
	 */
	public static Resolution resolve(Map<String, String> options, InverseOperator supplied) {
		ReconstructionConfig requested = ReconstructionConfig.parse(options);
		return resolve(requested, supplied);
	}

	/**
	 * @param requested the caller's parsed configuration
	 * @param supplied the inverse operator to use, or null if one is to be computed
	 * @return the effective configuration and the names of any options the operator overrode
	 * @throws InvalidConfigurationException if the requested options conflict, or if the merged ones do
	 */
	public static Resolution resolve(ReconstructionConfig requested, InverseOperator supplied) {
		requested.validate(); // before the merge as well as after
		ReconstructionConfig effective;
		List<String> overridden;
		if (supplied == null) {
			effective = requested;
			overridden = List.of();
		}
		else {
			effective = requested.overriddenBy(supplied.getLog());
			overridden = requested.operatorOptionsDifferingFrom(effective);
			logger.info(String.format("inverse operator %s supplied directly; reverting to its settings",
			                          supplied.getSource()));
			for (String key: overridden)
				logger.info(String.format("  %s overridden by the inverse operator", key));
		}
		effective.validate();
		logger.info("reconstruction parameters:\n"+effective.describe());
		return new Resolution(effective, overridden);
	}

	/**
	 * @param config the configuration to use for the reconstruction
	 * @param overridden the names of the options whose requested values were replaced by the operator's
	 */
	public record Resolution(ReconstructionConfig config, List<String> overridden) {}
}
