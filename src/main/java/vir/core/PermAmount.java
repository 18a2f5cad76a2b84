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

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An amount of permission held on a field or predicate instance. Amounts are
 * totally ordered, with <code>none</code> the least and <code>write</code> the
 * greatest. Fractional amounts lie strictly between <code>read</code> and
 * <code>write</code>.
 */
public final class PermAmount implements Comparable<PermAmount> {
	public enum Kind {
		NONE, READ, FRACTIONAL, WRITE
	}

	public static final PermAmount NONE = new PermAmount(Kind.NONE, 0, 1);
	public static final PermAmount READ = new PermAmount(Kind.READ, 0, 1);
	public static final PermAmount WRITE = new PermAmount(Kind.WRITE, 1, 1);

	private final Kind kind;
	private final int numerator;
	private final int denominator;

	private PermAmount(Kind kind, int numerator, int denominator) {
		this.kind = kind;
		this.numerator = numerator;
		this.denominator = denominator;
	}

	/**
	 * Construct a fractional amount <code>numerator/denominator</code>, which must
	 * lie strictly between zero and one.
	 *
	 * @param numerator
	 * @param denominator
	 * @return
	 */
	public static PermAmount fractional(int numerator, int denominator) {
		checkArgument(denominator > 0 && numerator > 0 && numerator < denominator,
				"invalid permission amount %s/%s", numerator, denominator);
		return new PermAmount(Kind.FRACTIONAL, numerator, denominator);
	}

	public Kind getKind() {
		return kind;
	}

	public int getNumerator() {
		return numerator;
	}

	public int getDenominator() {
		return denominator;
	}

	/**
	 * Check whether this amount may be used within a specification.
	 *
	 * @return
	 */
	public boolean isValidForSpecs() {
		return kind != Kind.FRACTIONAL;
	}

	@Override
	public int compareTo(PermAmount o) {
		int c = kind.compareTo(o.kind);
		if (c != 0 || kind != Kind.FRACTIONAL) {
			return c;
		}
		return Long.compare((long) numerator * o.denominator, (long) o.numerator * denominator);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof PermAmount && compareTo((PermAmount) o) == 0;
	}

	@Override
	public int hashCode() {
		if (kind != Kind.FRACTIONAL) {
			return kind.hashCode();
		}
		// Normalise so that equal fractions hash alike
		int g = gcd(numerator, denominator);
		return (numerator / g) * 31 + (denominator / g);
	}

	@Override
	public String toString() {
		switch (kind) {
		case NONE:
			return "none";
		case READ:
			return "read";
		case WRITE:
			return "write";
		default:
			return numerator + "/" + denominator;
		}
	}

	private static int gcd(int a, int b) {
		return b == 0 ? a : gcd(b, a % b);
	}
}
