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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static vir.core.ViperFile.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import vir.core.Field;
import vir.core.LocalVar;
import vir.core.PermAmount;
import vir.core.Position;
import vir.core.Trigger;
import vir.core.Type;
import vir.core.ViperFile.Expr;

public class PlaceReplacerTests {
	private static final LocalVar X = new LocalVar("x", new Type.TypedRef("T"));
	private static final LocalVar Y = new LocalVar("y", new Type.TypedRef("U"));
	private static final LocalVar I = new LocalVar("i", Type.Int);
	private static final Field F = new Field("f", new Type.TypedRef("U"));
	private static final Field G = new Field("g", Type.Int);

	private static final Expr x = LOCAL(X);
	private static final Expr y = LOCAL(Y);
	private static final Expr xf = FIELD(x, F);
	private static final Expr xfg = FIELD(xf, G);

	@Test
	public void scenarioB() {
		Expr e = AND(xfg, ACC(xf, PermAmount.WRITE));
		Expr r = e.replacePlace(xf, y);
		assertEquals(AND(FIELD(y, G), ACC(y, PermAmount.WRITE)), r);
		assertEquals("(y.g) && (acc(y, write))", r.toString());
	}

	@Test
	public void replacementKeepsPositions() {
		Position p = new Position(3, 7, 1);
		Expr e = FIELD(xf, G).setPosition(p);
		assertEquals(p, e.replacePlace(xf, y).getPosition());
	}

	@Test
	public void untouchedExpressionsAreShared() {
		Expr e = ADD(LOCAL(I), CONST(1));
		assertSame(e, e.replacePlace(xf, y));
	}

	@Test
	public void incompatibleTypes() {
		Expr z = LOCAL("z", Type.Int);
		IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> xfg.replacePlace(xf, z));
		assertEquals("Cannot substitute 'x.f' with 'z', because they have incompatible types 'Ref(U)' and 'Int'",
				ex.getMessage());
	}

	@Test
	public void targetMustBePlace() {
		assertThrows(IllegalArgumentException.class, () -> xfg.replacePlace(CONST(1), CONST(2)));
	}

	@Test
	public void nonPlaceReplacement() {
		Expr e = ADD(xfg, CONST(1));
		assertEquals(ADD(CONST(2), CONST(1)), e.replacePlace(xfg, CONST(2)));
	}

	@Test
	public void quantifierShadowsBase() {
		Expr e = FORALL(Arrays.asList(X), Collections.emptyList(), EQ(xfg, CONST(0)));
		assertSame(e, e.replacePlace(xf, y));
	}

	@Test
	public void quantifierRewritesTriggers() {
		LocalVar r = new LocalVar("r", new Type.TypedRef("U"));
		Expr app = FUNC_APP("h", Arrays.asList(xf), Arrays.asList(r), Type.Int);
		Expr e = FORALL(Arrays.asList(I), Arrays.asList(new Trigger(app)), GT(xfg, LOCAL(I)));
		Expr.ForAll q = (Expr.ForAll) e.replacePlace(xf, y);
		Expr app2 = FUNC_APP("h", Arrays.asList(y), Arrays.asList(r), Type.Int);
		assertEquals(Arrays.asList(new Trigger(app2)), q.getTriggers());
		assertEquals(GT(FIELD(y, G), LOCAL(I)), q.getBody());
	}

	@Test
	public void letShadowsBase() {
		Expr e = LET(X, xfg, xfg);
		assertEquals(LET(X, FIELD(y, G), xfg), e.replacePlace(xf, y));
	}

	@Test
	public void letWithoutShadowing() {
		Expr e = LET(I, xfg, ADD(LOCAL(I), xfg));
		assertEquals(LET(I, FIELD(y, G), ADD(LOCAL(I), FIELD(y, G))), e.replacePlace(xf, y));
	}

	@Test
	public void replacesWithinOldAndPermissions() {
		Expr e = AND(PREDICATE_ACCESS("U", xf, PermAmount.READ), EQ(LABELLED_OLD("l", xfg), xfg));
		Expr expected = AND(PREDICATE_ACCESS("U", y, PermAmount.READ), EQ(LABELLED_OLD("l", FIELD(y, G)), FIELD(y, G)));
		assertEquals(expected, e.replacePlace(xf, y));
	}

	@Test
	public void genericLocalReplacedByConcreteLocal() {
		Expr generic = LOCAL("x", new Type.TypedRef("Box$__TYPARAM__$T$__"));
		Expr concrete = LOCAL("y", new Type.TypedRef("Box$i32"));
		Field val = new Field("val", new Type.TypedRef("ref$__TYPARAM__$T$__"));
		Expr.FieldAccess r = (Expr.FieldAccess) FIELD(generic, val).replacePlace(generic, concrete);
		assertEquals(concrete, r.getOperand());
		assertEquals(new Type.TypedRef("ref$i32"), r.getField().getType());
		assertEquals("val", r.getField().getName());
	}

	@Test
	public void fieldTypesOnlyPatchedDirectlyAfterSubstitution() {
		Expr generic = LOCAL("x", new Type.TypedRef("Box$__TYPARAM__$T$__"));
		Expr concrete = LOCAL("y", new Type.TypedRef("Box$i32"));
		Field val = new Field("val", new Type.TypedRef("ref$__TYPARAM__$T$__"));
		Expr other = LOCAL("z", new Type.TypedRef("Box$__TYPARAM__$T$__"));
		Expr e = AND(EQ(FIELD(generic, val), FIELD(other, val)), TRUE);
		Expr.BinOp eq = (Expr.BinOp) ((Expr.BinOp) e.replacePlace(generic, concrete)).getLeftHandSide();
		Expr.FieldAccess lhs = (Expr.FieldAccess) eq.getLeftHandSide();
		Expr.FieldAccess rhs = (Expr.FieldAccess) eq.getRightHandSide();
		assertEquals(new Type.TypedRef("ref$i32"), lhs.getField().getType());
		assertEquals(new Type.TypedRef("ref$__TYPARAM__$T$__"), rhs.getField().getType());
	}

	@Test
	public void nonLocalTargetLearnsNothing() {
		Field box = new Field("b", new Type.TypedRef("Box$__TYPARAM__$T$__"));
		Field val = new Field("val", new Type.TypedRef("ref$__TYPARAM__$T$__"));
		Expr target = FIELD(x, box);
		Expr concrete = LOCAL("y", new Type.TypedRef("Box$i32"));
		Expr.FieldAccess r = (Expr.FieldAccess) FIELD(target, val).replacePlace(target, concrete);
		assertEquals(concrete, r.getOperand());
		assertEquals(new Type.TypedRef("ref$__TYPARAM__$T$__"), r.getField().getType());
	}

	@Test
	public void untypedReferencesLearnNothing() {
		Expr a = LOCAL("a", Type.Ref);
		Expr b = LOCAL("b", Type.Ref);
		Field next = new Field("next", Type.Ref);
		assertEquals(FIELD(b, next), FIELD(a, next).replacePlace(a, b));
		assertEquals(Type.Ref, ((Expr.FieldAccess) FIELD(a, next).replacePlace(a, b)).getField().getType());
	}

	@Test
	public void kindMismatchBetweenReferences() {
		Expr r = LOCAL("r", Type.Ref);
		assertThrows(IllegalArgumentException.class, () -> xfg.replacePlace(xf, r));
	}
}
