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

import com.google.common.collect.ImmutableList;

import vir.core.Position;
import vir.core.ViperFile;

/**
 * The outcome of verifying a single unit.
 */
public abstract class VerificationResult {

	private VerificationResult() {
	}

	public abstract boolean isSuccess();

	public static final VerificationResult SUCCESS = new Success();

	public static class Success extends VerificationResult {
		private Success() {
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		public String toString() {
			return "Success";
		}
	}

	public static class Failure extends VerificationResult {
		private final ImmutableList<Error> errors;

		public Failure(List<Error> errors) {
			this.errors = ImmutableList.copyOf(errors);
		}

		@Override
		public boolean isSuccess() {
			return false;
		}

		public List<Error> getErrors() {
			return errors;
		}

		@Override
		public String toString() {
			return "Failure" + errors;
		}
	}

	/**
	 * An error reported against the rendered unit, together with the item which
	 * produced the text at that location (if known).
	 */
	public static class Error {
		private final int line;
		private final int column;
		private final String message;
		private final ViperFile.Item item;

		public Error(int line, int column, String message, ViperFile.Item item) {
			this.line = line;
			this.column = column;
			this.message = message;
			this.item = item;
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

		/**
		 * Get the item whose text encloses this error.
		 *
		 * @return The item, or null if no item produced that text.
		 */
		public ViperFile.Item getEnclosingItem() {
			return item;
		}

		/**
		 * Get the source position of the enclosing item.
		 *
		 * @return
		 */
		public Position getPosition() {
			return item == null ? Position.UNKNOWN : item.getPosition();
		}

		@Override
		public String toString() {
			return line + ":" + column + ": " + message;
		}
	}
}
