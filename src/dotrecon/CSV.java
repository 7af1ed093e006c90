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

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * reading and riting of the plain delimited text files that all of the artifacts are
 * stored in.
 */
public class CSV {

	/**
	 * read a simple CSV file, with any standard line break character, and return its contents
	 * as a double matrix. elements must be parsable as doubles. whitespace adjacent to
	 * delimiters will be stripped, and reading stops at the first blank line.
	 * @param file the CSV file to open
	 * @param delimiter the delimiting character, usually ',', sometimes '\t', occasionally '|'
	 * @return I think the return value is pretty self-explanatory.
	 * @throws IOException if file cannot be found or permission is denied
	 * @throws NumberFormatException if elements are not parsable as doubles
	 */
	public static double[][] read(File file, char delimiter)
			throws NumberFormatException, IOException {
		return read(file, delimiter, 0);
	}

	/**
	 * read a simple CSV file and return its contents as a double matrix, skipping some header rows.
	 * @param file the CSV file to open
	 * @param delimiter the delimiting character
	 * @param headerRows the number of initial rows to skip
	 * @return the table of numbers
	 * @throws IOException if file cannot be found or permission is denied
	 * @throws NumberFormatException if elements are not parsable as doubles
	 */
	public static double[][] read(File file, char delimiter, int headerRows)
			throws NumberFormatException, IOException {
		try (InputStream in = new FileInputStream(file)) {
			return read(in, delimiter, headerRows);
		}
	}

	/**
	 * read a simple CSV table of numbers from a stream, such as a resource on the classpath.
	 * the stream is not closed.
	 */
	public static double[][] read(InputStream stream, char delimiter, int headerRows)
			throws NumberFormatException, IOException {
		String[][] table = readStrings(stream, delimiter, headerRows);
		double[][] values = new double[table.length][];
		for (int i = 0; i < table.length; i ++) {
			values[i] = new double[table[i].length];
			for (int j = 0; j < table[i].length; j ++) {
				values[i][j] = switch (table[i][j].toLowerCase()) {
					case "nan" -> Double.NaN;
					case "inf" -> Double.POSITIVE_INFINITY;
					case "-inf" -> Double.NEGATIVE_INFINITY;
					default -> Double.parseDouble(table[i][j]);
				};
			}
		}
		return values;
	}

	/**
	 * read a CSV file where there is only one column, bypassing the need for a multi-
	 * dimensional array.
	 * @param file the CSV file to open
	 * @return 1D array of values from the list
	 * @throws IOException if file cannot be found or permission is denied
	 * @throws NumberFormatException if elements are not parsable as doubles
	 */
	public static double[] readColumn(File file)
		  throws NumberFormatException, IOException {
		double[][] table = read(file, ',');
		double[] out = new double[table.length];
		for (int i = 0; i < table.length; i ++) {
			if (table[i].length != 1)
				throw new NumberFormatException("expected one number per line in "+file+" but line "+i+" has "+table[i].length);
			out[i] = table[i][0];
		}
		return out;
	}

	/**
	 * read a delimited text file without trying to parse anything.
	 * @param file the file to open
	 * @param delimiter the delimiting character
	 * @return each row, split on the delimiter and trimmed
	 * @throws IOException if file cannot be found or permission is denied
	 */
	public static String[][] readStrings(File file, char delimiter) throws IOException {
		try (InputStream in = new FileInputStream(file)) {
			return readStrings(in, delimiter, 0);
		}
	}

	private static String[][] readStrings(InputStream stream, char delimiter, int headerRows)
			throws IOException {
		BufferedReader in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
		List<String[]> list = new ArrayList<>();
		String line;
		for (int i = 0; i < headerRows; i ++)
			in.readLine();
		String splitter = "\\s*" + Pattern.quote(String.valueOf(delimiter)) + "\\s*";
		while ((line = in.readLine()) != null) {
			line = line.trim();
			if (line.isEmpty())
				break;
			list.add(line.split(splitter, -1));
		}
		return list.toArray(new String[0][]);
	}

	/**
	 * save the given matrix as a simple CSV file, using the given delimiter character.
	 * @param data the numbers to be written
	 * @param file the file at which to save
	 * @param delimiter the delimiter character, usually ','
	 * @throws IOException if the file cannot be found or permission is denied
	 */
	public static void write(double[][] data, File file, char delimiter)
			throws IOException {
		String[][] text = new String[data.length][];
		for (int i = 0; i < data.length; i ++) {
			text[i] = new String[data[i].length];
			for (int j = 0; j < data[i].length; j ++)
				text[i][j] = Double.toString(data[i][j]);
		}
		writeStrings(text, file, delimiter);
	}

	/**
	 * save the given array as a column of newline-separated number strings.
	 * @param data the numbers to write, in 1D form
	 * @param file the file at which to save
	 * @throws IOException if the file cannot be found or permission is denied
	 */
	public static void writeColumn(double[] data, File file) throws IOException {
		double[][] columnVector = new double[data.length][1];
		for (int i = 0; i < data.length; i ++)
			columnVector[i][0] = data[i];
		write(columnVector, file, ',');
	}

	/**
	 * save a table of strings, one row per line.  the strings should not contain the delimiter.
	 * @throws IOException if the file cannot be found or permission is denied
	 */
	public static void writeStrings(String[][] data, File file, char delimiter) throws IOException {
		try (BufferedWriter out = new BufferedWriter(new FileWriter(file, StandardCharsets.UTF_8))) {
			for (String[] datum: data) {
				for (int j = 0; j < datum.length; j++) {
					out.append(datum[j]);
					if (j < datum.length - 1)
						out.append(delimiter);
				}
				out.newLine();
			}
		}
	}

}
