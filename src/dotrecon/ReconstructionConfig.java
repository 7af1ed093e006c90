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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * the complete set of options for one reconstruction.  this is passed explicitly to every
 * stage that needs it; nothing reads options from anywhere else.
 *
 * @param reconMethod whether to use one multispectral operator or one operator per wavelength
 * @param reconSpace the native space of the operator's unknowns, if there's no basis
 * @param regMethod the regularization method, which only matters to the inverse operator provider
 * @param hyperParameter the regularization hyperparameter; one value, or several for spatial regularization
 * @param imageType which images to output
 * @param saveVolumeImages whether to keep the volume images in addition to the surface ones
 * @param persist whether to hand the result to the image writer
 * @param threads the number of frames to reconstruct at once
 */
public record ReconstructionConfig(
		ReconMethod reconMethod,
		ReconSpace reconSpace,
		RegMethod regMethod,
		List<Double> hyperParameter,
		ImageType imageType,
		boolean saveVolumeImages,
		boolean persist,
		int threads) {

	public static final String RECON_METHOD = "reconMethod";
	public static final String RECON_SPACE = "reconSpace";
	public static final String REG_METHOD = "regMethod";
	public static final String HYPER_PARAMETER = "hyperParameter";
	public static final String IMAGE_TYPE = "imageType";
	public static final String SAVE_VOLUME_IMAGES = "saveVolumeImages";
	public static final String PERSIST = "persist";
	public static final String SAVE_FLAG = "saveFlag"; // the older name for persist
	public static final String THREADS = "threads";

	/** the options that an inverse operator's own log gets to override */
	public static final List<String> OPERATOR_OPTIONS = List.of(
			HYPER_PARAMETER, RECON_METHOD, REG_METHOD, RECON_SPACE);

	public static final double DEFAULT_HYPER_PARAMETER = 0.01;

	public ReconstructionConfig {
		if (hyperParameter.isEmpty())
			throw new InvalidConfigurationException("the hyperParameter needs at least one value");
		hyperParameter = List.copyOf(hyperParameter);
		if (threads < 1)
			throw new InvalidConfigurationException("can't reconstruct with "+threads+" threads");
	}

	public static ReconstructionConfig defaults() {
		return new ReconstructionConfig(
				ReconMethod.STANDARD, ReconSpace.VOLUME, RegMethod.TIKHONOV,
				List.of(DEFAULT_HYPER_PARAMETER), ImageType.HAEM,
				true, true, 1);
	}

	/**
	 * read a set of options on top of the defaults.
	 * @param options the option names and their values as strings; names are matched without regard to case
	 * @throws InvalidConfigurationException if any name or value is unrecognized
	 */
	public static ReconstructionConfig parse(Map<String, String> options) {
		ReconstructionConfig config = defaults();
		for (Map.Entry<String, String> option: options.entrySet())
			config = config.with(option.getKey(), option.getValue());
		return config;
	}

	/**
	 * @return a copy of this with one option changed
	 * @throws InvalidConfigurationException if the name or value is unrecognized
	 */
	public ReconstructionConfig with(String key, String value) {
		if (value == null)
			throw new InvalidConfigurationException("no value was given for "+key);
		String name = key.trim();
		if (name.equalsIgnoreCase(RECON_METHOD))
			return new ReconstructionConfig(ReconMethod.parse(value), reconSpace, regMethod,
			                                hyperParameter, imageType, saveVolumeImages, persist, threads);
		else if (name.equalsIgnoreCase(RECON_SPACE))
			return new ReconstructionConfig(reconMethod, ReconSpace.parse(value), regMethod,
			                                hyperParameter, imageType, saveVolumeImages, persist, threads);
		else if (name.equalsIgnoreCase(REG_METHOD))
			return new ReconstructionConfig(reconMethod, reconSpace, RegMethod.parse(value),
			                                hyperParameter, imageType, saveVolumeImages, persist, threads);
		else if (name.equalsIgnoreCase(HYPER_PARAMETER))
			return new ReconstructionConfig(reconMethod, reconSpace, regMethod,
			                                parseNumbers(key, value), imageType, saveVolumeImages, persist, threads);
		else if (name.equalsIgnoreCase(IMAGE_TYPE))
			return new ReconstructionConfig(reconMethod, reconSpace, regMethod,
			                                hyperParameter, ImageType.parse(value), saveVolumeImages, persist, threads);
		else if (name.equalsIgnoreCase(SAVE_VOLUME_IMAGES))
			return new ReconstructionConfig(reconMethod, reconSpace, regMethod,
			                                hyperParameter, imageType, parseFlag(key, value), persist, threads);
		else if (name.equalsIgnoreCase(PERSIST) || name.equalsIgnoreCase(SAVE_FLAG))
			return new ReconstructionConfig(reconMethod, reconSpace, regMethod,
			                                hyperParameter, imageType, saveVolumeImages, parseFlag(key, value), threads);
		else if (name.equalsIgnoreCase(THREADS))
			return new ReconstructionConfig(reconMethod, reconSpace, regMethod,
			                                hyperParameter, imageType, saveVolumeImages, persist, parseCount(key, value));
		else
			throw new InvalidConfigurationException("'"+key+"' is not a recognized option");
	}

	/**
	 * merge in the settings that an inverse operator was bilt with.  for each of
	 * {@link #OPERATOR_OPTIONS} that appears in the log, the log's value replaces this one's;
	 * every other entry in the log is ignored.
	 * @param operatorLog the provenance log of a supplied inverse operator
	 * @return the merged configuration
	 * @throws InvalidConfigurationException if the log holds a value we can't read
	 */
	public ReconstructionConfig overriddenBy(ProvenanceLog operatorLog) {
		ReconstructionConfig merged = this;
		for (String key: OPERATOR_OPTIONS) {
			String recorded = operatorLog.get(key).orElse(null);
			if (recorded != null)
				merged = merged.with(key, recorded);
		}
		return merged;
	}

	/**
	 * @return the names of the operator options whose values differ between this and that
	 */
	public List<String> operatorOptionsDifferingFrom(ReconstructionConfig that) {
		List<String> differing = new ArrayList<>();
		if (!this.hyperParameter.equals(that.hyperParameter))
			differing.add(HYPER_PARAMETER);
		if (this.reconMethod != that.reconMethod)
			differing.add(RECON_METHOD);
		if (this.regMethod != that.regMethod)
			differing.add(REG_METHOD);
		if (this.reconSpace != that.reconSpace)
			differing.add(RECON_SPACE);
		return Collections.unmodifiableList(differing);
	}

	/**
	 * check the options that are fine on their own but not together.
	 * @throws InvalidConfigurationException if mua images are requested from a multispectral reconstruction
	 */
	public ReconstructionConfig validate() {
		if (imageType.wantsMua() && reconMethod != ReconMethod.STANDARD)
			throw new InvalidConfigurationException(String.format(
					"imageType %s requires reconMethod %s, but it is %s",
					imageType, ReconMethod.STANDARD, reconMethod));
		return this;
	}

	/**
	 * @return the hyperparameter the way a person would rite it: one number, or several separated by spaces
	 */
	public String formatHyperParameter() {
		StringBuilder s = new StringBuilder();
		for (double value: hyperParameter) {
			if (s.length() > 0)
				s.append(" ");
			s.append(value);
		}
		return s.toString();
	}

	/**
	 * @return a multi-line description of every option, for the log
	 */
	public String describe() {
		return String.format(Locale.ROOT,
				"%s = %s%n%s = %s%n%s = %s%n%s = %s%n%s = %s%n%s = %s%n%s = %s%n%s = %d",
				RECON_METHOD, reconMethod, RECON_SPACE, reconSpace, REG_METHOD, regMethod,
				HYPER_PARAMETER, formatHyperParameter(), IMAGE_TYPE, imageType,
				SAVE_VOLUME_IMAGES, saveVolumeImages, PERSIST, persist, THREADS, threads);
	}

	private static List<Double> parseNumbers(String key, String value) {
		String stripped = value.trim().replaceAll("^\\[|]$", "").trim();
		if (stripped.isEmpty())
			throw new InvalidConfigurationException(key+" needs at least one number");
		List<Double> numbers = new ArrayList<>();
		for (String element: stripped.split("[\\s,;]+")) {
			try {
				numbers.add(Double.parseDouble(element));
			} catch (NumberFormatException e) {
				throw new InvalidConfigurationException("'"+value+"' is not a number or list of numbers for "+key, e);
			}
		}
		return numbers;
	}

	private static boolean parseFlag(String key, String value) {
		return switch (value.trim().toLowerCase(Locale.ROOT)) {
			case "true", "1" -> true;
			case "false", "0" -> false;
			default -> throw new InvalidConfigurationException(
					"'"+value+"' is not a valid flag for "+key+"; use true or false");
		};
	}

	private static int parseCount(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new InvalidConfigurationException("'"+value+"' is not a whole number for "+key, e);
		}
	}
}
