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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class CsvImageWriterTest {

	private static ImageSet images(boolean withVolume) {
		double[][] volume = withVolume ? new double[][] {{1, 2, 3}, {4, 5, 6}} : new double[0][];
		double[][] surface = {{1.5, 2.5}, {4.5, 5.5}};
		ProvenanceLog log = new ProvenanceLog()
				.plus("Created on", Scenarios.FIXED_TIMESTAMP)
				.plus("hyperParameter", "0.1 0.2")
				.plus("note", "a, b");
		return new ImageSet(new Image(volume, surface), new Image(volume, surface),
		                    new Image[] {new Image(volume, surface)}, new double[] {0, 0.1}, log);
	}

	@Test
	@DisplayName("every series goes in its own file")
	void writes(@TempDir File directory) throws IOException {
		File target = new CsvImageWriter(directory).write("subject01", images(true), true);

		assertEquals(new File(directory, "subject01.dotimg"), target);
		for (String name: new String[] {"hbo-vol", "hbo-gm", "hbr-vol", "hbr-gm", "mua-1-vol", "mua-1-gm", "t", "log"})
			assertTrue(new File(target, name + ".csv").isFile(), name);

		assertArrayEquals(new double[][] {{1, 2, 3}, {4, 5, 6}}, CSV.read(new File(target, "hbo-vol.csv"), ','));
		assertArrayEquals(new double[][] {{1.5, 2.5}, {4.5, 5.5}}, CSV.read(new File(target, "mua-1-gm.csv"), ','));
		assertArrayEquals(new double[] {0, 0.1}, CSV.readColumn(new File(target, "t.csv")));

		String[][] log = CSV.readStrings(new File(target, "log.csv"), ',');
		assertEquals(3, log.length);
		assertArrayEquals(new String[] {"Created on", Scenarios.FIXED_TIMESTAMP}, log[0]);
		assertArrayEquals(new String[] {"note", "a; b"}, log[2]);
	}

	@Test
	@DisplayName("dropped volume series aren't written at all")
	void skipsEmptyVolumes(@TempDir File directory) throws IOException {
		File target = new CsvImageWriter(directory).write("subject01", images(false), true);
		assertFalse(new File(target, "hbo-vol.csv").exists());
		assertFalse(new File(target, "mua-1-vol.csv").exists());
		assertTrue(new File(target, "hbo-gm.csv").isFile());
	}

	@Test
	@DisplayName("without persist nothing is touched")
	void noPersist(@TempDir File directory) throws IOException {
		File target = new CsvImageWriter(directory).write("subject01", images(true), false);
		assertEquals(new File(directory, "subject01.dotimg"), target);
		assertFalse(target.exists());
		String[] contents = directory.list();
		assertNotNull(contents);
		assertEquals(0, contents.length);
	}
}
