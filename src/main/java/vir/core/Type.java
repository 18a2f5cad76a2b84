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
 * Types of the intermediate representation. These are either primitive value
 * types or references whose shape is described by a named predicate.
 */
public abstract class Type {
	public static final Type Int = new Int();
	public static final Type Bool = new Bool();
	public static final Type Ref = new Ref();

	private Type() {
	}

	/**
	 * Get the name of this type. For a typed reference, this is the name of the
	 * predicate describing its shape.
	 *
	 * @return
	 */
	public abstract String name();

	public boolean isRef() {
		return false;
	}

	/**
	 * Check whether a value of a given type may stand in for a value of this
	 * type. Only the kind of type matters, so typed references are compatible
	 * regardless of their predicate names.
	 *
	 * @param other
	 * @return
	 */
	public boolean isCompatible(Type other) {
		return other != null && other.getClass() == getClass();
	}

	/**
	 * Specialise a typed reference to a given arm of an enumeration. The arm's
	 * predicate is named by appending the index to the enclosing predicate name.
	 *
	 * @param index
	 * @return
	 */
	public Type variant(String index) {
		throw new IllegalStateException("cannot take variant of non-reference type " + this);
	}

	/**
	 * Patch this type according to a given set of name substitutions. Every
	 * occurrence of a key within the name is replaced by its value. Only typed
	 * references are affected.
	 *
	 * @param substs
	 * @return
	 */
	public Type patch(Map<String, String> substs) {
		return this;
	}

	public static class Int extends Type {
		private Int() {
		}

		@Override
		public String name() {
			return "Int";
		}
	}

	public static class Bool extends Type {
		private Bool() {
		}

		@Override
		public String name() {
			return "Bool";
		}
	}

	/**
	 * An untyped reference.
	 */
	public static class Ref extends Type {
		private Ref() {
		}

		@Override
		public String name() {
			return "Ref";
		}

		@Override
		public boolean isRef() {
			return true;
		}
	}

	public static class TypedRef extends Type {
		private final String predicate;

		public TypedRef(String predicate) {
			this.predicate = checkNotNull(predicate, "predicate name required");
		}

		@Override
		public String name() {
			return predicate;
		}

		@Override
		public boolean isRef() {
			return true;
		}

		@Override
		public Type variant(String index) {
			return new TypedRef(predicate + index);
		}

		@Override
		public Type patch(Map<String, String> substs) {
			String name = predicate;
			for (Map.Entry<String, String> e : substs.entrySet()) {
				name = name.replace(e.getKey(), e.getValue());
			}
			return name.equals(predicate) ? this : new TypedRef(name);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof TypedRef && ((TypedRef) o).predicate.equals(predicate);
		}

		@Override
		public int hashCode() {
			return predicate.hashCode();
		}

		@Override
		public String toString() {
			return "Ref(" + predicate + ")";
		}
	}

	@Override
	public boolean equals(Object o) {
		return o != null && o.getClass() == getClass();
	}

	@Override
	public int hashCode() {
		return getClass().hashCode();
	}

	@Override
	public String toString() {
		return name();
	}
}
