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

import java.util.Map;

/**
 * A typed local variable. Two variables are the same variable only when both
 * their names and types agree.
 */
public final class LocalVar {
	private final String name;
	private final Type type;

	public LocalVar(String name, Type type) {
		this.name = checkNotNull(name, "variable name required");
		this.type = checkNotNull(type, "variable type required");
	}

	public String getName() {
		return name;
	}

	public Type getType() {
		return type;
	}

	public LocalVar patch(Map<String, String> substs) {
		Type t = type.patch(substs);
		return t == type ? this : new LocalVar(name, t);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof LocalVar) {
			LocalVar v = (LocalVar) o;
			return name.equals(v.name) && type.equals(v.type);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return name.hashCode() ^ type.hashCode();
	}

	@Override
	public String toString() {
		return name;
	}
}
