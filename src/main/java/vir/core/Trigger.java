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

import java.util.List;

import com.google.common.collect.ImmutableList;

import vir.core.ViperFile.Expr;
import vir.util.Util;

/**
 * A set of terms used to instantiate a quantifier. Triggers are opaque to most
 * transformations, with substitution being the notable exception.
 */
public final class Trigger {
	private final ImmutableList<Expr> terms;

	public Trigger(List<Expr> terms) {
		this.terms = ImmutableList.copyOf(terms);
	}

	public Trigger(Expr... terms) {
		this.terms = ImmutableList.copyOf(terms);
	}

	public List<Expr> getTerms() {
		return terms;
	}

	public Trigger replacePlace(Expr target, Expr replacement) {
		return new Trigger(Util.map(terms, t -> t.replacePlace(target, replacement)));
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof Trigger && ((Trigger) o).terms.equals(terms);
	}

	@Override
	public int hashCode() {
		return terms.hashCode();
	}

	@Override
	public String toString() {
		return "{" + Util.join(terms, ", ") + "}";
	}
}
