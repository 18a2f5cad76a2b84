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
package vir.util;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * A print writer which records, for every piece of text written, the tag it
 * was written on behalf of. Positions reported against the output text (e.g.
 * by a verifier) can then be mapped back to the responsible tag.
 *
 * @param <T>
 */
public class MappablePrintWriter<T> {
	private final PrintWriter out;
	private final Mapping<T> mapping;
	private int index;

	public MappablePrintWriter(OutputStream os) {
		this(new PrintWriter(new OutputStreamWriter(os, StandardCharsets.UTF_8)));
	}

	public MappablePrintWriter(PrintWriter writer) {
		this.out = writer;
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
		if (!text.isEmpty()) {
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

	/**
	 * Print a string associated with a given tag, followed by a newline.
	 *
	 * @param text
	 * @param tag
	 */
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
			out.print("  ");
			index += 2;
		}
	}

	public void flush() {
		out.flush();
	}

	public void close() {
		out.close();
	}

	public static class Mapping<T> {
		private final List<List<Span<T>>> lines = new ArrayList<>();

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
		 * Get the tag responsible for the text at a given line and column. Both
		 * lines and columns start from 1.
		 *
		 * @param line
		 * @param col
		 * @return The tag, or null if no text was written there.
		 */
		public T get(int line, int col) {
			line = line - 1;
			col = col - 1;
			if (line < 0 || line >= lines.size()) {
				return null;
			}
			for (Span<T> s : lines.get(line)) {
				if (s.contains(col)) {
					return s.tag;
				}
			}
			return null;
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
	}
}
