// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package vcgen.util;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A print writer which remembers which tag produced each region of output.
 * This allows a position in the printed text (e.g. a line reported by an
 * external prover) to be mapped back to the item it came from.
 *
 * @param <T>
 */
public class MappablePrintWriter<T> {
	private final PrintWriter out;
	private final Mapping<T> mapping;
	private int index;

	public MappablePrintWriter(OutputStream os) {
		this(new OutputStreamWriter(os, StandardCharsets.UTF_8));
	}

	public MappablePrintWriter(Writer writer) {
		this.out = new PrintWriter(writer);
		this.mapping = new Mapping<>();
	}

	public Mapping<T> getMapping() {
		return mapping;
	}

	/**
	 * Print a string associated with a given tag.
	 *
	 * @param text
	 * @param tag
	 */
	public void print(String text, T tag) {
		out.print(text);
		if (tag != null) {
			mapping.put(tag, index, text.length());
		}
		index += text.length();
	}

	/**
	 * Print a newline.
	 */
	public void println() {
		out.println();
		mapping.newLine();
		index = 0;
	}

	public void println(String text, T tag) {
		print(text, tag);
		println();
	}

	/**
	 * Print a given level of indentation.
	 *
	 * @param n
	 */
	public void tab(int n) {
		for (int i = 0; i != n; ++i) {
			out.print("   ");
			index += 3;
		}
	}

	public void flush() {
		out.flush();
	}

	public void close() {
		out.close();
	}

	public static class Mapping<T> {
		private final ArrayList<ArrayList<Span<T>>> lines = new ArrayList<>();

		public Mapping() {
			newLine();
		}

		public void put(T tag, int start, int length) {
			int end = (start + length) - 1;
			lines.get(lines.size() - 1).add(new Span<>(tag, start, end));
		}

		public void newLine() {
			lines.add(new ArrayList<>());
		}

		/**
		 * Get the innermost tag covering a given position, where lines start from 1
		 * and columns from 0.
		 *
		 * @param line
		 * @param col
		 * @return
		 */
		public T get(int line, int col) {
			line = line - 1;
			if (line < 0 || line >= lines.size()) {
				return null;
			}
			T result = null;
			int width = Integer.MAX_VALUE;
			for (Span<T> s : lines.get(line)) {
				if (s.contains(col) && s.width() <= width) {
					result = s.tag;
					width = s.width();
				}
			}
			return result;
		}

		/**
		 * Get all tags printed on a given line (starting from 1), in the order they
		 * were printed.
		 *
		 * @param line
		 * @return
		 */
		public List<T> get(int line) {
			ArrayList<T> result = new ArrayList<>();
			line = line - 1;
			if (line >= 0 && line < lines.size()) {
				for (Span<T> s : lines.get(line)) {
					if (!result.contains(s.tag)) {
						result.add(s.tag);
					}
				}
			}
			return result;
		}

		/**
		 * Find the first line (starting from 1) on which a given tag was printed, or
		 * <code>0</code> if it never was.
		 *
		 * @param tag
		 * @return
		 */
		public int lineOf(T tag) {
			for (int i = 0; i != lines.size(); ++i) {
				for (Span<T> s : lines.get(i)) {
					if (s.tag.equals(tag)) {
						return i + 1;
					}
				}
			}
			return 0;
		}
	}

	/**
	 * Represents a given region of text on a single line.
	 */
	public static class Span<T> {
		private final T tag;
		private final int start;
		private final int end;

		public Span(T tag, int start, int end) {
			this.tag = tag;
			this.start = start;
			this.end = end;
		}

		public boolean contains(int col) {
			return start <= col && col <= end;
		}

		public int width() {
			return end - start;
		}
	}
}
