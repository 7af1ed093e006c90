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
import java.util.Locale;

/**
 * whether to invert one multispectral operator or each wavelength separately and then unmix.
 */
public enum ReconMethod {
	STANDARD("standard"),
	MULTISPECTRAL("multispectral");

	private final String option;

	ReconMethod(String option) {
		this.option = option;
	}

	/**
	 * read the value of the reconMethod option, ignoring case.
	 * @throws InvalidConfigurationException if it's not one of the values we kno
	 */
	public static ReconMethod parse(String value) {
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (ReconMethod candidate: values())
			if (candidate.option.equals(normalized))
				return candidate;
		throw new InvalidConfigurationException(String.format(
				"'%s' is not a recognized reconMethod; try one of %s", value, Arrays.toString(values())));
	}

	@Override
	public String toString() {
		return option;
	}
}
