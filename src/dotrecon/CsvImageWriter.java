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

import dotrecon.ImageSet.Image;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.logging.Logger;

/**
 * saves an image set as a directory of CSV files: one file per quantity per mesh, plus the
 * time axis and the provenance log.  volume series that were dropped are simply not ritten.
 */
public class CsvImageWriter implements ImageWriter {

	public static final String EXTENSION = ".dotimg";

	private static final Logger logger = Logger.getLogger("root");

	private final File outputDirectory;

	/**
	 * @param outputDirectory the directory in which each image set's own directory will be made
	 */
	public CsvImageWriter(File outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	@Override
	public File write(String name, ImageSet images, boolean persist) throws IOException {
		File target = new File(outputDirectory, name + EXTENSION);
		if (!persist)
			return target;
		if (!target.isDirectory() && !target.mkdirs())
			throw new IOException("could not create the output directory "+target);

		if (images.hasHaemoglobin()) {
			writeImage(images.getHbo(), target, "hbo");
			writeImage(images.getHbr(), target, "hbr");
		}
		Image[] mua = images.getMua();
		for (int w = 0; w < mua.length; w ++)
			writeImage(mua[w], target, String.format("mua-%d", w + 1));

		CSV.writeColumn(images.getTime(), new File(target, "t.csv"));

		List<ProvenanceLog.Entry> entries = images.getLog().getEntries();
		String[][] log = new String[entries.size()][];
		for (int i = 0; i < log.length; i ++)
			log[i] = new String[] {clean(entries.get(i).key()), clean(entries.get(i).value())};
		CSV.writeStrings(log, new File(target, "log.csv"), ',');

		logger.info("saved images to "+target);
		return target;
	}

	private static void writeImage(Image image, File directory, String quantity) throws IOException {
		if (image.hasVolume())
			CSV.write(image.getVolume(), new File(directory, quantity + "-vol.csv"), ',');
		CSV.write(image.getSurface(), new File(directory, quantity + "-gm.csv"), ',');
	}

	/**
	 * the log is comma-delimited, so commas in the values have to go.
	 */
	private static String clean(String text) {
		return (text == null) ? "" : text.replace(',', ';');
	}
}
