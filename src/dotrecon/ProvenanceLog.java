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
import java.util.Optional;

/**
 * an ordered list of (key, value) notes about where an artifact came from and what settings
 * made it.  inverse operators carry one so that their settings can be recovered; image sets
 * carry one so that you can tell what made them.  instances are immutable.
 */
public final class ProvenanceLog {

	private final List<Entry> entries;

	public ProvenanceLog() {
		this(List.of());
	}

	private ProvenanceLog(List<Entry> entries) {
		this.entries = Collections.unmodifiableList(entries);
	}

	/**
	 * @return a new log with one more entry at the end
	 */
	public ProvenanceLog plus(String key, String value) {
		List<Entry> extended = new ArrayList<>(this.entries);
		extended.add(new Entry(key, value));
		return new ProvenanceLog(extended);
	}

	/**
	 * look up a value by key.  keys are matched without regard to case or to a trailing
	 * colon, since logs ritten by hand tend to say "hyperParameter: " as often as "hyperParameter".
	 * if the key appears more than once, the last one wins.
	 */
	public Optional<String> get(String key) {
		String wanted = normalize(key);
		String found = null;
		for (Entry entry: entries)
			if (normalize(entry.key()).equals(wanted))
				found = entry.value();
		return Optional.ofNullable(found);
	}

	public List<Entry> getEntries() {
		return entries;
	}

	public int size() {
		return entries.size();
	}

	private static String normalize(String key) {
		String trimmed = key.trim();
		if (trimmed.endsWith(":"))
			trimmed = trimmed.substring(0, trimmed.length() - 1).trim();
		return trimmed.toLowerCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		StringBuilder s = new StringBuilder();
		for (Entry entry: entries)
			s.append(String.format("%s = %s%n", entry.key(), entry.value()));
		return s.toString();
	}

	public record Entry(String key, String value) {}
}
