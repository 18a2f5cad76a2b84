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
package vir.core;

/**
 * Identifies the source location from which a given item was produced. A
 * position is metadata only: it never takes part in the equality or hashing of
 * the expressions which carry it.
 */
public final class Position {
	/**
	 * The distinguished position used when no location is known.
	 */
	public static final Position UNKNOWN = new Position(0, 0, 0);

	private final int line;
	private final int column;
	private final int id;

	public Position(int line, int column, int id) {
		this.line = line;
		this.column = column;
		this.id = id;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * Get the unique identifier used to relate this position back to whatever
	 * produced it.
	 *
	 * @return
	 */
	public int getId() {
		return id;
	}

	public boolean isDefault() {
		return line == 0 && column == 0 && id == 0;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Position) {
			Position p = (Position) o;
			return line == p.line && column == p.column && id == p.id;
		}
		return false;
	}

	@Override
	public int hashCode() {
		return (line * 31 + column) * 31 + id;
	}

	@Override
	public String toString() {
		return line + ":" + column + "#" + id;
	}
}
