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
package vir.tasks;

import java.util.List;

/**
 * The external verifier to which rendered verification units are handed. How
 * it decides the outcome is of no concern here.
 */
public interface Backend {

	/**
	 * Verify a given program text.
	 *
	 * @param id      Identifies the program for reporting purposes
	 * @param program The program text
	 * @param timeout Time limit (in milliseconds)
	 * @return The diagnostics reported, which are empty on success, or null if
	 *         the time limit was reached.
	 */
	public List<Diagnostic> verify(String id, String program, int timeout);

	/**
	 * A problem reported by the backend against a given location in the program
	 * text. Lines and columns start from 1.
	 */
	public static class Diagnostic {
		private final int line;
		private final int column;
		private final String message;

		public Diagnostic(int line, int column, String message) {
			this.line = line;
			this.column = column;
			this.message = message;
		}

		public int getLine() {
			return line;
		}

		public int getColumn() {
			return column;
		}

		public String getMessage() {
			return message;
		}

		@Override
		public String toString() {
			return line + ":" + column + ": " + message;
		}
	}
}
