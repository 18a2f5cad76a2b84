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

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Describes a named member accessed from a reference, along with the type of
 * the value it holds.
 */
public final class Field {
	private final String name;
	private final Type type;

	public Field(String name, Type type) {
		this.name = checkNotNull(name, "field name required");
		this.type = checkNotNull(type, "field type required");
	}

	public String getName() {
		return name;
	}

	public Type getType() {
		return type;
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof Field) {
			Field f = (Field) o;
			return name.equals(f.name) && type.equals(f.type);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return name.hashCode() * 31 + type.hashCode();
	}

	@Override
	public String toString() {
		return name + ": " + type;
	}
}
