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
package vir.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static vir.core.ViperFile.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import vir.core.Field;
import vir.core.LocalVar;
import vir.core.PermAmount;
import vir.core.Position;
import vir.core.Type;
import vir.core.ViperFile.Expr;

/**
 * Tests for the derived transformations and queries over expressions.
 */
public class TransformTests {
	private static final LocalVar X = new LocalVar("x", new Type.TypedRef("T"));
	private static final LocalVar I = new LocalVar("i", Type.Int);
	private static final Field F = new Field("f", new Type.TypedRef("U"));
	private static final Field G = new Field("g", Type.Int);

	private static final Expr x = LOCAL(X);
	private static final Expr xf = FIELD(x, F);
	private static final Expr xfg = FIELD(xf, G);

	// ==================================================================
	// Old expressions
	// ==================================================================

	@Test
	public void redundantOldRemoved() {
		Expr e = LABELLED_OLD("l", FIELD(LABELLED_OLD("l", xf), G));
		assertEquals(LABELLED_OLD("l", xfg), e.removeRedundantOld());
	}

	@Test
	public void repeatedOldCollapses() {
		Expr e = xfg.old("l");
		assertEquals(e, LABELLED_OLD("l", e).removeRedundantOld());
	}

	@Test
	public void distinctLabelsKept() {
		Expr e = LABELLED_OLD("l", FIELD(LABELLED_OLD("m", xf), G));
		assertEquals(e, e.removeRedundantOld());
	}

	@Test
	public void labelsRenamed() {
		Expr e = AND(LABELLED_OLD("l", xfg), LABELLED_OLD("m", xfg));
		Expr r = e.mapLabels(l -> l.equals("l") ? "pre" : l);
		assertEquals(AND(LABELLED_OLD("pre", xfg), LABELLED_OLD("m", xfg)), r);
	}

	@Test
	public void labelsDropped() {
		Expr e = AND(LABELLED_OLD("l", xfg), LABELLED_OLD("m", xfg));
		Expr r = e.mapLabels(l -> l.equals("l") ? null : l);
		assertEquals(AND(xfg, LABELLED_OLD("m", xfg)), r);
	}

	// ==================================================================
	// Permissions
	// ==================================================================

	@Test
	public void permissionConjunctionFiltered() {
		Expr acc = ACC(xf, PermAmount.WRITE);
		Expr pred = PREDICATE_ACCESS("U", xf, PermAmount.READ);
		Expr e = AND(acc, AND(GT(xfg, CONST(0)), AND(pred, OR(TRUE, FALSE))));
		assertEquals(AND(acc, AND(TRUE, AND(pred, TRUE))), e.filterPermConjunction());
	}

	private static Stream<Expr> conjunctions() {
		return Stream.of(xfg, ACC(xf, PermAmount.WRITE), AND(ACC(xf, PermAmount.WRITE), EQ(xfg, CONST(1))),
				IMPLIES(TRUE, ACC(xf, PermAmount.READ)), AND(AND(TRUE, FALSE), PREDICATE_ACCESS("T", x,
						PermAmount.WRITE)));
	}

	@ParameterizedTest
	@MethodSource("conjunctions")
	public void permissionFilterIsIdempotent(Expr e) {
		Expr once = e.filterPermConjunction();
		assertEquals(once, once.filterPermConjunction());
	}

	@Test
	public void scenarioC() {
		Expr pred = PREDICATE_ACCESS("P", x, PermAmount.WRITE);
		Expr e = AND(pred, ACC(xf, PermAmount.READ));
		assertEquals(AND(pred, TRUE), e.removeReadPermissions());
	}

	@Test
	public void readPermissionRemovalRejectsOtherAmounts() {
		assertThrows(IllegalStateException.class,
				() -> ACC(xf, PermAmount.fractional(1, 2)).removeReadPermissions());
		assertThrows(IllegalStateException.class, () -> ACC(xf, PermAmount.NONE).removeReadPermissions());
	}

	@Test
	public void purity() {
		assertTrue(ADD(xfg, CONST(1)).isPure());
		assertTrue(LABELLED_OLD("l", xfg).isPure());
		assertFalse(AND(TRUE, ACC(xf, PermAmount.WRITE)).isPure());
		assertFalse(ITE(TRUE, PREDICATE_ACCESS("T", x, PermAmount.READ), FALSE).isPure());
		assertFalse(IMPLIES(TRUE, WAND(ACC(xf, PermAmount.WRITE), TRUE)).isPure());
	}

	@Test
	public void scenarioD() {
		List<Expr> footprint = xfg.computeFootprint(PermAmount.WRITE);
		assertEquals(Arrays.asList(ACC(xf, PermAmount.WRITE), ACC(xfg, PermAmount.WRITE)), footprint);
		assertTrue(LABELLED_OLD("l", xf).computeFootprint(PermAmount.WRITE).isEmpty());
	}

	@Test
	public void footprintOfComparison() {
		List<Expr> footprint = EQ(xfg, FIELD(x, G)).computeFootprint(PermAmount.READ);
		assertEquals(Arrays.asList(ACC(xf, PermAmount.READ), ACC(xfg, PermAmount.READ), ACC(FIELD(x, G),
				PermAmount.READ)), footprint);
	}

	@Test
	public void footprintIgnoresOldState() {
		Expr old = FIELD(LABELLED_OLD("l", xf), G);
		assertEquals(Arrays.asList(ACC(old, PermAmount.WRITE)), old.computeFootprint(PermAmount.WRITE));
		assertTrue(LABELLED_OLD("l", xfg).computeFootprint(PermAmount.WRITE).isEmpty());
	}

	@Test
	public void predicatePlacesExtracted() {
		Expr p1 = PREDICATE_ACCESS("T", x, PermAmount.WRITE);
		Expr p2 = PREDICATE_ACCESS("U", xf, PermAmount.READ);
		Expr p3 = PREDICATE_ACCESS("U", xf.variant("A"), PermAmount.WRITE);
		Expr e = AND(p1, AND(p2, AND(ACC(xfg, PermAmount.WRITE), p3)));
		assertEquals(Arrays.asList(x, xf.variant("A")), e.extractPredicatePlaces(PermAmount.WRITE));
		assertEquals(Arrays.asList(xf), e.extractPredicatePlaces(PermAmount.READ));
	}

	// ==================================================================
	// Types
	// ==================================================================

	@Test
	public void typesPatched() {
		Map<String, String> substs = Collections.singletonMap("__T", "i32");
		LocalVar b = new LocalVar("b", new Type.TypedRef("Box$__T"));
		LocalVar formal = new LocalVar("self", new Type.TypedRef("Box$__T"));
		Expr e = AND(PREDICATE_ACCESS("Box$__T", LOCAL(b), PermAmount.WRITE),
				EQ(FUNC_APP("get", Arrays.asList(LOCAL(b)), Arrays.asList(formal), new Type.TypedRef("Box$__T")),
						CONST(0)));
		LocalVar b2 = new LocalVar("b", new Type.TypedRef("Box$i32"));
		Expr.BinOp r = (Expr.BinOp) e.patchTypes(substs);
		assertEquals(PREDICATE_ACCESS("Box$i32", LOCAL(b2), PermAmount.WRITE), r.getLeftHandSide());
		Expr.FuncApp app = (Expr.FuncApp) ((Expr.BinOp) r.getRightHandSide()).getLeftHandSide();
		assertEquals(Arrays.asList(LOCAL(b2)), app.getArguments());
		assertEquals(new Type.TypedRef("Box$i32"), app.getFormals().get(0).getType());
		assertEquals(new Type.TypedRef("Box$__T"), app.getReturns());
	}

	@Test
	public void typePatchingWithoutMatchesShares() {
		Expr e = AND(xfg, ACC(xf, PermAmount.WRITE));
		assertSame(e, e.patchTypes(Collections.singletonMap("__T", "i32")));
	}

	// ==================================================================
	// Searching and rewriting
	// ==================================================================

	@Test
	public void find() {
		Expr e = IMPLIES(GT(LOCAL(I), CONST(0)), EQ(LABELLED_OLD("l", xfg), xfg));
		assertTrue(e.find(xfg));
		assertTrue(e.find(CONST(0).setPosition(new Position(2, 2, 2))));
		assertTrue(e.find(e));
		assertFalse(e.find(CONST(1)));
		assertFalse(e.find(FIELD(x, G)));
	}

	@Test
	public void placesFolded() {
		Expr e = ADD(xfg, MUL(LOCAL(I), CONST(2)));
		Expr r = e.foldPlaces(p -> p.old("l"));
		assertEquals(ADD(LABELLED_OLD("l", xfg), MUL(LOCAL(I), CONST(2))), r);
	}

	@Test
	public void expressionsFolded() {
		Expr e = ADD(CONST(1), MUL(CONST(2), CONST(3)));
		Expr r = e.foldExpressions(n -> (n instanceof Expr.BinOp) ? n.evaluate() : n);
		assertEquals(CONST(7), r);
	}

	@Test
	public void evaluationRejectsVariables() {
		assertThrows(IllegalArgumentException.class, () -> ADD(LOCAL(I), CONST(1)).evaluate());
	}

	@Test
	public void evaluation() {
		assertEquals(TRUE, IMPLIES(FALSE, EQ(CONST(1), CONST(2))).evaluate());
		assertEquals(CONST(5), ITE(LT(CONST(1), CONST(2)), CONST(5), CONST(6)).evaluate());
		assertEquals(CONST(-4), MINUS(CONST(4)).evaluate());
		assertEquals(FALSE, NOT(TRUE).evaluate());
	}
}
