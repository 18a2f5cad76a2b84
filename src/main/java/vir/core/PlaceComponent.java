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

import vir.core.ViperFile.Expr;

/**
 * A single access step peeled from a place. A place is rebuilt from its base by
 * applying its components in order.
 */
public final class PlaceComponent {
	public enum Kind {
		FIELD, VARIANT
	}

	private final Kind kind;
	private final Field field;
	private final Position position;

	public PlaceComponent(Kind kind, Field field, Position position) {
		this.kind = checkNotNull(kind);
		this.field = checkNotNull(field);
		this.position = checkNotNull(position);
	}

	public Kind getKind() {
		return kind;
	}

	public Field getField() {
		return field;
	}

	public Position getPosition() {
		return position;
	}

	/**
	 * Apply this access step to a given base expression.
	 *
	 * @param base
	 * @return
	 */
	public Expr applyTo(Expr base) {
		if (kind == Kind.FIELD) {
			return new Expr.FieldAccess(base, field, position);
		} else {
			return new Expr.Variant(base, field, position);
		}
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof PlaceComponent) {
			PlaceComponent c = (PlaceComponent) o;
			return kind == c.kind && field.equals(c.field);
		}
		return false;
	}

	@Override
	public int hashCode() {
		return kind.hashCode() ^ field.hashCode();
	}

	@Override
	public String toString() {
		return kind == Kind.FIELD ? "." + field.getName() : "[" + field.getName() + "]";
	}
}
