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
import static com.google.common.base.Preconditions.checkState;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

import com.google.common.collect.ImmutableList;

import vir.io.ViperFilePrinter;
import vir.transform.ConstantEvaluator;
import vir.transform.DefaultPositionReplacer;
import vir.transform.ExprFinder;
import vir.transform.ExpressionFolder;
import vir.transform.FootprintCollector;
import vir.transform.OldLabelMapper;
import vir.transform.PermissionConjunctionFilter;
import vir.transform.PlaceFolder;
import vir.transform.PlaceReplacer;
import vir.transform.PredicatePlaceExtractor;
import vir.transform.PurityChecker;
import vir.transform.ReadPermissionRemover;
import vir.transform.RedundantOldRemover;
import vir.transform.TypePatcher;
import vir.util.Pair;

/**
 * A verification unit handed to the backend verifier. This consists of a
 * sequence of declarations whose specifications are built from the expression
 * algebra defined here.
 */
public class ViperFile {
	/**
	 * Field name prefix used for accessing the arms of an enumeration.
	 */
	public static final String ENUM_PREFIX = "enum_";
	/**
	 * Predicate name prefix identifying reference types.
	 */
	public static final String REF_PREFIX = "ref$";
	/**
	 * Field through which a reference is dereferenced.
	 */
	public static final String VAL_REF = "val_ref";

	/**
	 * Name used to identify this unit when reporting.
	 */
	private final String name;
	/**
	 * The list of top-level declarations within this file.
	 */
	private final List<Decl> declarations;

	public ViperFile(String name) {
		this.name = checkNotNull(name, "unit name required");
		this.declarations = new ArrayList<>();
	}

	public String getName() {
		return name;
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get the source position associated with this item.
		 *
		 * @return
		 */
		public Position getPosition();
	}

	public static abstract class AbstractItem implements Item {
		private final Position position;

		public AbstractItem(Position position) {
			this.position = checkNotNull(position, "position required");
		}

		@Override
		public Position getPosition() {
			return position;
		}

		public boolean isFalse() {
			return (this instanceof Expr.Const) && Boolean.FALSE.equals(((Expr.Const) this).getValue());
		}

		public boolean isTrue() {
			return (this instanceof Expr.Const) && Boolean.TRUE.equals(((Expr.Const) this).getValue());
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		public String getName();

		/**
		 * Declares a field which may be accessed from any reference.
		 */
		public static class Field extends AbstractItem implements Decl {
			private final String name;
			private final Type type;

			public Field(String name, Type type, Position position) {
				super(position);
				this.name = checkNotNull(name);
				this.type = checkNotNull(type);
			}

			@Override
			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}

		/**
		 * Declares a predicate over a single reference. A predicate without a body
		 * is abstract.
		 */
		public static class Predicate extends AbstractItem implements Decl {
			private final String name;
			private final LocalVar parameter;
			private final Expr body;

			public Predicate(String name, LocalVar parameter, Expr body, Position position) {
				super(position);
				this.name = checkNotNull(name);
				this.parameter = checkNotNull(parameter);
				this.body = body;
			}

			@Override
			public String getName() {
				return name;
			}

			public LocalVar getParameter() {
				return parameter;
			}

			public Expr getBody() {
				return body;
			}
		}

		public static class Function extends AbstractItem implements Decl {
			private final String name;
			private final ImmutableList<LocalVar> parameters;
			private final Type returns;
			private final ImmutableList<Expr> requires;
			private final ImmutableList<Expr> ensures;
			private final Expr body;

			public Function(String name, List<LocalVar> parameters, Type returns, List<Expr> requires,
					List<Expr> ensures, Expr body, Position position) {
				super(position);
				this.name = checkNotNull(name);
				this.parameters = ImmutableList.copyOf(parameters);
				this.returns = checkNotNull(returns);
				this.requires = ImmutableList.copyOf(requires);
				this.ensures = ImmutableList.copyOf(ensures);
				this.body = body;
			}

			@Override
			public String getName() {
				return name;
			}

			public List<LocalVar> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			public List<Expr> getRequires() {
				return requires;
			}

			public List<Expr> getEnsures() {
				return ensures;
			}

			public Expr getBody() {
				return body;
			}
		}

		/**
		 * Declares a method by its specification alone.
		 */
		public static class Method extends AbstractItem implements Decl {
			private final String name;
			private final ImmutableList<LocalVar> parameters;
			private final ImmutableList<LocalVar> returns;
			private final ImmutableList<Expr> requires;
			private final ImmutableList<Expr> ensures;

			public Method(String name, List<LocalVar> parameters, List<LocalVar> returns, List<Expr> requires,
					List<Expr> ensures, Position position) {
				super(position);
				this.name = checkNotNull(name);
				this.parameters = ImmutableList.copyOf(parameters);
				this.returns = ImmutableList.copyOf(returns);
				this.requires = ImmutableList.copyOf(requires);
				this.ensures = ImmutableList.copyOf(ensures);
			}

			@Override
			public String getName() {
				return name;
			}

			public List<LocalVar> getParameters() {
				return parameters;
			}

			public List<LocalVar> getReturns() {
				return returns;
			}

			public List<Expr> getRequires() {
				return requires;
			}

			public List<Expr> getEnsures() {
				return ensures;
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	/**
	 * Represents an expression in the intermediate representation. Expressions
	 * are immutable, and equality between them is structural, disregarding
	 * positions throughout.
	 */
	public static abstract class Expr extends AbstractItem {

		protected Expr(Position position) {
			super(position);
		}

		/**
		 * Return a copy of this expression whose outermost position is replaced.
		 *
		 * @param position
		 * @return
		 */
		public abstract Expr setPosition(Position position);

		@Override
		public abstract boolean equals(Object o);

		@Override
		public abstract int hashCode();

		@Override
		public String toString() {
			return ViperFilePrinter.toString(this);
		}

		// =====================================================================
		// Places
		// =====================================================================

		/**
		 * Get the expression wrapped by this node, if it is one of the node kinds
		 * which may wrap a place.
		 */
		private Expr getWrapped() {
			if (this instanceof Variant) {
				return ((Variant) this).getOperand();
			} else if (this instanceof FieldAccess) {
				return ((FieldAccess) this).getOperand();
			} else if (this instanceof AddrOf) {
				return ((AddrOf) this).getOperand();
			} else if (this instanceof LabelledOld) {
				return ((LabelledOld) this).getBody();
			} else if (this instanceof Unfolding) {
				return ((Unfolding) this).getBody();
			} else {
				return null;
			}
		}

		public boolean isPlace() {
			if (this instanceof Local) {
				return true;
			}
			Expr wrapped = getWrapped();
			return wrapped != null && wrapped.isPlace();
		}

		/**
		 * Check whether this is a chain of field and variant accesses from a local
		 * variable.
		 *
		 * @return
		 */
		public boolean isSimplePlace() {
			if (this instanceof Local) {
				return true;
			} else if (this instanceof Variant || this instanceof FieldAccess) {
				return getWrapped().isSimplePlace();
			} else {
				return false;
			}
		}

		public boolean isLocal() {
			return this instanceof Local;
		}

		public boolean isVariant() {
			return this instanceof Variant;
		}

		public boolean isAddrOf() {
			return this instanceof AddrOf;
		}

		public int getPlaceDepth() {
			checkPlace();
			if (this instanceof Local) {
				return 1;
			} else {
				return getWrapped().getPlaceDepth() + 1;
			}
		}

		/**
		 * Get the place from which this place is accessed. Local variables, old
		 * expressions and unfoldings have no parent.
		 *
		 * @return The parent place, or null if none.
		 */
		public Expr getParent() {
			checkPlace();
			if (this instanceof Variant || this instanceof FieldAccess || this instanceof AddrOf) {
				return getWrapped();
			} else {
				return null;
			}
		}

		/**
		 * Get the variable at the root of this place.
		 *
		 * @return
		 */
		public LocalVar getBase() {
			checkPlace();
			if (this instanceof Local) {
				return ((Local) this).getVariable();
			} else {
				return getWrapped().getBase();
			}
		}

		public Type getType() {
			checkPlace();
			if (this instanceof Local) {
				return ((Local) this).getVariable().getType();
			} else if (this instanceof Variant) {
				return ((Variant) this).getVariant().getType();
			} else if (this instanceof FieldAccess) {
				return ((FieldAccess) this).getField().getType();
			} else if (this instanceof AddrOf) {
				return ((AddrOf) this).getAddressType();
			} else {
				return getWrapped().getType();
			}
		}

		/**
		 * Get the name of the predicate describing this place's type.
		 *
		 * @return The predicate name, or null if this place is not a typed
		 *         reference.
		 */
		public String getTypedRefName() {
			Type type = getType();
			return (type instanceof Type.TypedRef) ? type.name() : null;
		}

		public String getLocalType() {
			checkState(this instanceof Local && getType() instanceof Type.TypedRef,
					"expected local variable of reference type, found %s", this);
			return getType().name();
		}

		public boolean hasPrefix(Expr other) {
			if (equals(other)) {
				return true;
			}
			Expr parent = getParent();
			return parent != null && parent.hasPrefix(other);
		}

		public boolean hasProperPrefix(Expr other) {
			return !equals(other) && hasPrefix(other);
		}

		/**
		 * Get all prefixes of this place, excluding the place itself, ordered from
		 * shortest to longest.
		 *
		 * @return
		 */
		public List<Expr> getAllProperPrefixes() {
			Expr parent = getParent();
			if (parent == null) {
				return new ArrayList<>();
			} else {
				return parent.getAllPrefixes();
			}
		}

		/**
		 * Get all prefixes of this place, ending with the place itself.
		 *
		 * @return
		 */
		public List<Expr> getAllPrefixes() {
			List<Expr> prefixes = getAllProperPrefixes();
			prefixes.add(this);
			return prefixes;
		}

		/**
		 * Split this place into the irreducible base from which it is accessed, and
		 * the sequence of field or variant accesses applied to that base.
		 *
		 * @return
		 */
		public Pair<Expr, List<PlaceComponent>> explodePlace() {
			if (this instanceof Variant) {
				Variant v = (Variant) this;
				Pair<Expr, List<PlaceComponent>> p = v.getOperand().explodePlace();
				p.second().add(new PlaceComponent(PlaceComponent.Kind.VARIANT, v.getVariant(), getPosition()));
				return p;
			} else if (this instanceof FieldAccess) {
				FieldAccess f = (FieldAccess) this;
				Pair<Expr, List<PlaceComponent>> p = f.getOperand().explodePlace();
				p.second().add(new PlaceComponent(PlaceComponent.Kind.FIELD, f.getField(), getPosition()));
				return p;
			} else {
				return new Pair<>(this, new ArrayList<>());
			}
		}

		public Expr reconstructPlace(List<PlaceComponent> components) {
			Expr result = this;
			for (PlaceComponent c : components) {
				result = c.applyTo(result);
			}
			return result;
		}

		/**
		 * Access a given arm of the enumeration held in this place.
		 *
		 * @param index
		 * @return
		 */
		public Expr variant(String index) {
			checkPlace();
			Field field = new Field(ENUM_PREFIX + index, getType().variant(index));
			return new Variant(this, field, Position.UNKNOWN);
		}

		public Expr field(Field field) {
			return new FieldAccess(this, field, Position.UNKNOWN);
		}

		public Expr addrOf() {
			return new AddrOf(this, new Type.TypedRef(getType().name()), Position.UNKNOWN);
		}

		/**
		 * Check whether this place is a field accessed from a local variable whose
		 * type is a reference.
		 *
		 * @return
		 */
		public boolean isReferenceField() {
			checkPlace();
			if (this instanceof FieldAccess && ((FieldAccess) this).getOperand() instanceof Local) {
				Type t = ((FieldAccess) this).getOperand().getType();
				return t instanceof Type.TypedRef && t.name().startsWith(REF_PREFIX);
			}
			return false;
		}

		/**
		 * Dereference this place, if its type is a reference.
		 *
		 * @return The dereferenced place, or null if this place is not a
		 *         reference.
		 */
		public Expr tryDeref() {
			Type t = getType();
			if (t instanceof Type.TypedRef && t.name().startsWith(REF_PREFIX)) {
				Type inner = new Type.TypedRef(t.name().substring(REF_PREFIX.length()));
				return field(new Field(VAL_REF, inner));
			}
			return null;
		}

		private void checkPlace() {
			checkState(isPlace(), "expected place, found %s", this);
		}

		// =====================================================================
		// Old expressions
		// =====================================================================

		/**
		 * Evaluate this expression in the state at a given label. Local variables
		 * are unaffected by the state, and an expression which is already labelled
		 * is left as is.
		 *
		 * @param label
		 * @return
		 */
		public Expr old(String label) {
			if (this instanceof Local || this instanceof LabelledOld) {
				return this;
			}
			return new LabelledOld(label, this, Position.UNKNOWN);
		}

		public boolean isOld() {
			return getLabel() != null;
		}

		public boolean isCurr() {
			return !isOld();
		}

		/**
		 * @return The label of this old expression, or null if it is not one.
		 */
		public String getLabel() {
			return (this instanceof LabelledOld) ? ((LabelledOld) this).getLabel() : null;
		}

		// =====================================================================
		// Permissions
		// =====================================================================

		/**
		 * @return The place protected by this permission, or null if this is not a
		 *         permission.
		 */
		public Expr getPlace() {
			if (this instanceof PredicateAccessPredicate) {
				return ((PredicateAccessPredicate) this).getArgument();
			} else if (this instanceof FieldAccessPredicate) {
				return ((FieldAccessPredicate) this).getReceiver();
			} else {
				return null;
			}
		}

		public PermAmount getPermAmount() {
			if (this instanceof PredicateAccessPredicate) {
				return ((PredicateAccessPredicate) this).getPermission();
			} else if (this instanceof FieldAccessPredicate) {
				return ((FieldAccessPredicate) this).getPermission();
			}
			throw new IllegalStateException("expected permission, found " + this);
		}

		public boolean isPermission() {
			return this instanceof PredicateAccessPredicate || this instanceof FieldAccessPredicate;
		}

		/**
		 * Check whether this is a conjunction of permissions and nothing else.
		 *
		 * @return
		 */
		public boolean isOnlyPermissions() {
			if (isPermission()) {
				return true;
			} else if (this instanceof BinOp && ((BinOp) this).getKind() == BinOpKind.AND) {
				BinOp b = (BinOp) this;
				return b.getLeftHandSide().isOnlyPermissions() && b.getRightHandSide().isOnlyPermissions();
			} else {
				return false;
			}
		}

		// =====================================================================
		// Transformations
		// =====================================================================

		public Expr replacePlace(Expr target, Expr replacement) {
			return new PlaceReplacer(target, replacement).visitExpression(this);
		}

		public Expr removeRedundantOld() {
			return new RedundantOldRemover().visitExpression(this);
		}

		public Expr filterPermConjunction() {
			return new PermissionConjunctionFilter().visitExpression(this);
		}

		/**
		 * Rename the labels of old expressions. A label mapped to null is removed,
		 * leaving the expression it guarded evaluated in the current state.
		 *
		 * @param f
		 * @return
		 */
		public Expr mapLabels(java.util.function.Function<String, String> f) {
			return new OldLabelMapper(f).visitExpression(this);
		}

		public Expr removeReadPermissions() {
			return new ReadPermissionRemover().visitExpression(this);
		}

		public boolean isPure() {
			PurityChecker checker = new PurityChecker();
			checker.visitExpression(this);
			return checker.isPure();
		}

		public List<Expr> computeFootprint(PermAmount perm) {
			FootprintCollector collector = new FootprintCollector(perm);
			collector.visitExpression(this);
			return collector.getFootprint();
		}

		public Expr patchTypes(Map<String, String> substs) {
			return new TypePatcher(substs).visitExpression(this);
		}

		public boolean find(Expr target) {
			ExprFinder finder = new ExprFinder(target);
			finder.visitExpression(this);
			return finder.isFound();
		}

		public List<Expr> extractPredicatePlaces(PermAmount perm) {
			return new PredicatePlaceExtractor(perm).visitExpression(this);
		}

		public Expr setDefaultPosition(Position position) {
			return new DefaultPositionReplacer(position).visitExpression(this);
		}

		/**
		 * Apply a given function to every maximal place within this expression.
		 *
		 * @param f
		 * @return
		 */
		public Expr foldPlaces(UnaryOperator<Expr> f) {
			return new PlaceFolder(f).visitExpression(this);
		}

		/**
		 * Apply a given function to every node of this expression, from the leaves
		 * upwards.
		 *
		 * @param f
		 * @return
		 */
		public Expr foldExpressions(UnaryOperator<Expr> f) {
			return new ExpressionFolder(f).visitExpression(this);
		}

		/**
		 * Evaluate this expression, which must be built from constants alone.
		 *
		 * @return
		 */
		public Const evaluate() {
			return ConstantEvaluator.evaluate(this);
		}

		// =====================================================================
		// Operators
		// =====================================================================

		public enum UnaryOpKind {
			NOT("!"), MINUS("-");

			private final String symbol;

			UnaryOpKind(String symbol) {
				this.symbol = symbol;
			}

			@Override
			public String toString() {
				return symbol;
			}
		}

		public enum BinOpKind {
			EQ("=="), GT(">"), GTEQ(">="), LT("<"), LTEQ("<="), ADD("+"), SUB("-"), MUL("*"), DIV("/"), MOD("%"),
			AND("&&"), OR("||"), IMPLIES("==>");

			private final String symbol;

			BinOpKind(String symbol) {
				this.symbol = symbol;
			}

			@Override
			public String toString() {
				return symbol;
			}
		}

		// =====================================================================
		// Variants
		// =====================================================================

		public static class Local extends Expr {
			private final LocalVar variable;

			public Local(LocalVar variable, Position position) {
				super(position);
				this.variable = checkNotNull(variable);
			}

			public LocalVar getVariable() {
				return variable;
			}

			@Override
			public Local setPosition(Position position) {
				return new Local(variable, position);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Local && ((Local) o).variable.equals(variable);
			}

			@Override
			public int hashCode() {
				return variable.hashCode();
			}
		}

		/**
		 * Accesses the data of a given enumeration arm.
		 */
		public static class Variant extends Expr {
			private final Expr operand;
			private final Field variant;

			public Variant(Expr operand, Field variant, Position position) {
				super(position);
				this.operand = checkNotNull(operand);
				this.variant = checkNotNull(variant);
			}

			public Expr getOperand() {
				return operand;
			}

			public Field getVariant() {
				return variant;
			}

			@Override
			public Variant setPosition(Position position) {
				return new Variant(operand, variant, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Variant) {
					Variant v = (Variant) o;
					return operand.equals(v.operand) && variant.equals(v.variant);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(Variant.class, operand, variant);
			}
		}

		public static class FieldAccess extends Expr {
			private final Expr operand;
			private final Field field;

			public FieldAccess(Expr operand, Field field, Position position) {
				super(position);
				this.operand = checkNotNull(operand);
				this.field = checkNotNull(field);
			}

			public Expr getOperand() {
				return operand;
			}

			public Field getField() {
				return field;
			}

			@Override
			public FieldAccess setPosition(Position position) {
				return new FieldAccess(operand, field, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof FieldAccess) {
					FieldAccess f = (FieldAccess) o;
					return operand.equals(f.operand) && field.equals(f.field);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(FieldAccess.class, operand, field);
			}
		}

		/**
		 * Takes the address of a place, which is the inverse of dereferencing it.
		 */
		public static class AddrOf extends Expr {
			private final Expr operand;
			private final Type type;

			public AddrOf(Expr operand, Type type, Position position) {
				super(position);
				this.operand = checkNotNull(operand);
				this.type = checkNotNull(type);
			}

			public Expr getOperand() {
				return operand;
			}

			public Type getAddressType() {
				return type;
			}

			@Override
			public AddrOf setPosition(Position position) {
				return new AddrOf(operand, type, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof AddrOf) {
					AddrOf a = (AddrOf) o;
					return operand.equals(a.operand) && type.equals(a.type);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(AddrOf.class, operand, type);
			}
		}

		/**
		 * Evaluates its body in the state recorded at a given label.
		 */
		public static class LabelledOld extends Expr {
			private final String label;
			private final Expr body;

			public LabelledOld(String label, Expr body, Position position) {
				super(position);
				this.label = checkNotNull(label);
				this.body = checkNotNull(body);
			}

			@Override
			public String getLabel() {
				return label;
			}

			public Expr getBody() {
				return body;
			}

			@Override
			public LabelledOld setPosition(Position position) {
				return new LabelledOld(label, body, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof LabelledOld) {
					LabelledOld l = (LabelledOld) o;
					return label.equals(l.label) && body.equals(l.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(LabelledOld.class, label, body);
			}
		}

		/**
		 * A boolean or integer constant. Integers are held as either a
		 * <code>Long</code> or a <code>BigInteger</code>, and the two are distinct.
		 */
		public static class Const extends Expr {
			private final Object value;

			public Const(boolean value, Position position) {
				this((Object) value, position);
			}

			public Const(long value, Position position) {
				this((Object) value, position);
			}

			public Const(BigInteger value, Position position) {
				this((Object) checkNotNull(value), position);
			}

			private Const(Object value, Position position) {
				super(position);
				this.value = value;
			}

			public Object getValue() {
				return value;
			}

			public boolean isBoolean() {
				return value instanceof Boolean;
			}

			@Override
			public Const setPosition(Position position) {
				return new Const(value, position);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Const && ((Const) o).value.equals(value);
			}

			@Override
			public int hashCode() {
				return value.hashCode();
			}
		}

		/**
		 * States that the resources on the left-hand side can be exchanged for
		 * those on the right-hand side.
		 */
		public static class MagicWand extends Expr {
			private final Expr lhs;
			private final Expr rhs;
			private final Borrow borrow;

			public MagicWand(Expr lhs, Expr rhs, Borrow borrow, Position position) {
				super(position);
				this.lhs = checkNotNull(lhs);
				this.rhs = checkNotNull(rhs);
				this.borrow = borrow;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}

			/**
			 * @return The borrow this wand was packaged for, or null.
			 */
			public Borrow getBorrow() {
				return borrow;
			}

			@Override
			public MagicWand setPosition(Position position) {
				return new MagicWand(lhs, rhs, borrow, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof MagicWand) {
					MagicWand w = (MagicWand) o;
					return lhs.equals(w.lhs) && rhs.equals(w.rhs) && Objects.equals(borrow, w.borrow);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(MagicWand.class, lhs, rhs, borrow);
			}
		}

		public static class PredicateAccessPredicate extends Expr {
			private final String name;
			private final Expr argument;
			private final PermAmount permission;

			public PredicateAccessPredicate(String name, Expr argument, PermAmount permission, Position position) {
				super(position);
				this.name = checkNotNull(name);
				this.argument = checkNotNull(argument);
				this.permission = checkNotNull(permission);
			}

			public String getName() {
				return name;
			}

			public Expr getArgument() {
				return argument;
			}

			public PermAmount getPermission() {
				return permission;
			}

			@Override
			public PredicateAccessPredicate setPosition(Position position) {
				return new PredicateAccessPredicate(name, argument, permission, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof PredicateAccessPredicate) {
					PredicateAccessPredicate p = (PredicateAccessPredicate) o;
					return name.equals(p.name) && argument.equals(p.argument) && permission.equals(p.permission);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(PredicateAccessPredicate.class, name, argument, permission);
			}
		}

		public static class FieldAccessPredicate extends Expr {
			private final Expr receiver;
			private final PermAmount permission;

			public FieldAccessPredicate(Expr receiver, PermAmount permission, Position position) {
				super(position);
				this.receiver = checkNotNull(receiver);
				this.permission = checkNotNull(permission);
			}

			public Expr getReceiver() {
				return receiver;
			}

			public PermAmount getPermission() {
				return permission;
			}

			@Override
			public FieldAccessPredicate setPosition(Position position) {
				return new FieldAccessPredicate(receiver, permission, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof FieldAccessPredicate) {
					FieldAccessPredicate p = (FieldAccessPredicate) o;
					return receiver.equals(p.receiver) && permission.equals(p.permission);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(FieldAccessPredicate.class, receiver, permission);
			}
		}

		public static class UnaryOp extends Expr {
			private final UnaryOpKind kind;
			private final Expr operand;

			public UnaryOp(UnaryOpKind kind, Expr operand, Position position) {
				super(position);
				this.kind = checkNotNull(kind);
				this.operand = checkNotNull(operand);
			}

			public UnaryOpKind getKind() {
				return kind;
			}

			public Expr getOperand() {
				return operand;
			}

			@Override
			public UnaryOp setPosition(Position position) {
				return new UnaryOp(kind, operand, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof UnaryOp) {
					UnaryOp u = (UnaryOp) o;
					return kind == u.kind && operand.equals(u.operand);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(kind, operand);
			}
		}

		public static class BinOp extends Expr {
			private final BinOpKind kind;
			private final Expr lhs;
			private final Expr rhs;

			public BinOp(BinOpKind kind, Expr lhs, Expr rhs, Position position) {
				super(position);
				this.kind = checkNotNull(kind);
				this.lhs = checkNotNull(lhs);
				this.rhs = checkNotNull(rhs);
			}

			public BinOpKind getKind() {
				return kind;
			}

			public Expr getLeftHandSide() {
				return lhs;
			}

			public Expr getRightHandSide() {
				return rhs;
			}

			@Override
			public BinOp setPosition(Position position) {
				return new BinOp(kind, lhs, rhs, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof BinOp) {
					BinOp b = (BinOp) o;
					return kind == b.kind && lhs.equals(b.lhs) && rhs.equals(b.rhs);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(kind, lhs, rhs);
			}
		}

		/**
		 * Temporarily exchanges an instance of a predicate for its body whilst
		 * evaluating a given expression.
		 */
		public static class Unfolding extends Expr {
			private final String predicate;
			private final ImmutableList<Expr> arguments;
			private final Expr body;
			private final PermAmount permission;
			private final String variant;

			public Unfolding(String predicate, List<Expr> arguments, Expr body, PermAmount permission,
					String variant, Position position) {
				super(position);
				this.predicate = checkNotNull(predicate);
				this.arguments = ImmutableList.copyOf(arguments);
				this.body = checkNotNull(body);
				this.permission = checkNotNull(permission);
				this.variant = variant;
			}

			public String getPredicate() {
				return predicate;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public Expr getBody() {
				return body;
			}

			public PermAmount getPermission() {
				return permission;
			}

			/**
			 * @return The enumeration arm being unfolded, or null.
			 */
			public String getVariant() {
				return variant;
			}

			@Override
			public Unfolding setPosition(Position position) {
				return new Unfolding(predicate, arguments, body, permission, variant, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Unfolding) {
					Unfolding u = (Unfolding) o;
					return predicate.equals(u.predicate) && arguments.equals(u.arguments) && body.equals(u.body)
							&& permission.equals(u.permission) && Objects.equals(variant, u.variant);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(Unfolding.class, predicate, arguments, body, permission, variant);
			}
		}

		public static class Cond extends Expr {
			private final Expr guard;
			private final Expr trueBranch;
			private final Expr falseBranch;

			public Cond(Expr guard, Expr trueBranch, Expr falseBranch, Position position) {
				super(position);
				this.guard = checkNotNull(guard);
				this.trueBranch = checkNotNull(trueBranch);
				this.falseBranch = checkNotNull(falseBranch);
			}

			public Expr getGuard() {
				return guard;
			}

			public Expr getTrueBranch() {
				return trueBranch;
			}

			public Expr getFalseBranch() {
				return falseBranch;
			}

			@Override
			public Cond setPosition(Position position) {
				return new Cond(guard, trueBranch, falseBranch, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Cond) {
					Cond c = (Cond) o;
					return guard.equals(c.guard) && trueBranch.equals(c.trueBranch)
							&& falseBranch.equals(c.falseBranch);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(Cond.class, guard, trueBranch, falseBranch);
			}
		}

		public static class ForAll extends Expr {
			private final ImmutableList<LocalVar> variables;
			private final ImmutableList<Trigger> triggers;
			private final Expr body;

			public ForAll(List<LocalVar> variables, List<Trigger> triggers, Expr body, Position position) {
				super(position);
				this.variables = ImmutableList.copyOf(variables);
				this.triggers = ImmutableList.copyOf(triggers);
				this.body = checkNotNull(body);
			}

			public List<LocalVar> getVariables() {
				return variables;
			}

			public List<Trigger> getTriggers() {
				return triggers;
			}

			public Expr getBody() {
				return body;
			}

			@Override
			public ForAll setPosition(Position position) {
				return new ForAll(variables, triggers, body, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof ForAll) {
					ForAll f = (ForAll) o;
					return variables.equals(f.variables) && triggers.equals(f.triggers) && body.equals(f.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(ForAll.class, variables, triggers, body);
			}
		}

		public static class LetExpr extends Expr {
			private final LocalVar variable;
			private final Expr initialiser;
			private final Expr body;

			public LetExpr(LocalVar variable, Expr initialiser, Expr body, Position position) {
				super(position);
				this.variable = checkNotNull(variable);
				this.initialiser = checkNotNull(initialiser);
				this.body = checkNotNull(body);
			}

			public LocalVar getVariable() {
				return variable;
			}

			public Expr getInitialiser() {
				return initialiser;
			}

			public Expr getBody() {
				return body;
			}

			@Override
			public LetExpr setPosition(Position position) {
				return new LetExpr(variable, initialiser, body, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof LetExpr) {
					LetExpr l = (LetExpr) o;
					return variable.equals(l.variable) && initialiser.equals(l.initialiser) && body.equals(l.body);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(LetExpr.class, variable, initialiser, body);
			}
		}

		/**
		 * Applies a pure function. Two applications are equal when they name the
		 * same function and have equal arguments.
		 */
		public static class FuncApp extends Expr {
			private final String name;
			private final ImmutableList<Expr> arguments;
			private final ImmutableList<LocalVar> formals;
			private final Type returns;

			public FuncApp(String name, List<Expr> arguments, List<LocalVar> formals, Type returns,
					Position position) {
				super(position);
				this.name = checkNotNull(name);
				this.arguments = ImmutableList.copyOf(arguments);
				this.formals = ImmutableList.copyOf(formals);
				this.returns = checkNotNull(returns);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			public List<LocalVar> getFormals() {
				return formals;
			}

			public Type getReturns() {
				return returns;
			}

			@Override
			public FuncApp setPosition(Position position) {
				return new FuncApp(name, arguments, formals, returns, position);
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof FuncApp) {
					FuncApp f = (FuncApp) o;
					return name.equals(f.name) && arguments.equals(f.arguments);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(FuncApp.class, name, arguments);
			}
		}
	}

	// =========================================================================
	// Constructors
	// =========================================================================

	public static final Expr.Const TRUE = new Expr.Const(true, Position.UNKNOWN);
	public static final Expr.Const FALSE = new Expr.Const(false, Position.UNKNOWN);

	public static Expr.Local LOCAL(LocalVar variable) {
		return new Expr.Local(variable, Position.UNKNOWN);
	}

	public static Expr.Local LOCAL(String name, Type type) {
		return LOCAL(new LocalVar(name, type));
	}

	public static Expr.FieldAccess FIELD(Expr operand, Field field) {
		return new Expr.FieldAccess(operand, field, Position.UNKNOWN);
	}

	public static Expr VARIANT(Expr operand, String index) {
		return operand.variant(index);
	}

	public static Expr ADDR_OF(Expr operand) {
		return operand.addrOf();
	}

	/**
	 * Construct an old expression at a given label. Unlike
	 * {@link Expr#old(String)}, this always wraps its body.
	 *
	 * @param label
	 * @param body
	 * @return
	 */
	public static Expr.LabelledOld LABELLED_OLD(String label, Expr body) {
		return new Expr.LabelledOld(label, body, Position.UNKNOWN);
	}

	public static Expr.Const CONST(boolean value) {
		return value ? TRUE : FALSE;
	}

	public static Expr.Const CONST(long value) {
		return new Expr.Const(value, Position.UNKNOWN);
	}

	public static Expr.Const CONST(BigInteger value) {
		return new Expr.Const(value, Position.UNKNOWN);
	}

	public static Expr.MagicWand WAND(Expr lhs, Expr rhs) {
		return WAND(lhs, rhs, null);
	}

	public static Expr.MagicWand WAND(Expr lhs, Expr rhs, Borrow borrow) {
		return new Expr.MagicWand(lhs, rhs, borrow, Position.UNKNOWN);
	}

	public static Expr.PredicateAccessPredicate PREDICATE_ACCESS(String name, Expr place, PermAmount perm) {
		return new Expr.PredicateAccessPredicate(name, place, perm, Position.UNKNOWN);
	}

	/**
	 * Construct the permission to the predicate describing a given place.
	 *
	 * @param place
	 * @param perm
	 * @return The permission, at the position of the place, or null if the place
	 *         is not a typed reference.
	 */
	public static Expr.PredicateAccessPredicate PRED_PERMISSION(Expr place, PermAmount perm) {
		String name = place.getTypedRefName();
		if (name == null) {
			return null;
		}
		return new Expr.PredicateAccessPredicate(name, place, perm, place.getPosition());
	}

	public static Expr.FieldAccessPredicate ACC(Expr place, PermAmount perm) {
		return new Expr.FieldAccessPredicate(place, perm, Position.UNKNOWN);
	}

	public static Expr NOT(Expr operand) {
		return new Expr.UnaryOp(Expr.UnaryOpKind.NOT, operand, Position.UNKNOWN);
	}

	public static Expr MINUS(Expr operand) {
		return new Expr.UnaryOp(Expr.UnaryOpKind.MINUS, operand, Position.UNKNOWN);
	}

	public static Expr EQ(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.EQ, lhs, rhs);
	}

	public static Expr NEQ(Expr lhs, Expr rhs) {
		return NOT(EQ(lhs, rhs));
	}

	public static Expr GT(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.GT, lhs, rhs);
	}

	public static Expr GTEQ(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.GTEQ, lhs, rhs);
	}

	public static Expr LT(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.LT, lhs, rhs);
	}

	public static Expr LTEQ(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.LTEQ, lhs, rhs);
	}

	public static Expr ADD(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.ADD, lhs, rhs);
	}

	public static Expr SUB(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.SUB, lhs, rhs);
	}

	public static Expr MUL(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.MUL, lhs, rhs);
	}

	public static Expr DIV(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.DIV, lhs, rhs);
	}

	/**
	 * Construct a euclidean modulus, whose result is never negative.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Expr MOD(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.MOD, lhs, rhs);
	}

	/**
	 * Construct a remainder whose sign follows the dividend, as in
	 * <code>rem(-7,3) == -1</code>. This is encoded using the euclidean modulus,
	 * adjusting the result when the dividend is negative and the modulus is
	 * non-zero.
	 *
	 * @param lhs
	 * @param rhs
	 * @return
	 */
	public static Expr REM(Expr lhs, Expr rhs) {
		Expr abs = ITE(GTEQ(rhs, CONST(0)), rhs, MINUS(rhs));
		Expr guard = OR(GTEQ(lhs, CONST(0)), EQ(MOD(lhs, rhs), CONST(0)));
		return ITE(guard, MOD(lhs, rhs), SUB(MOD(lhs, rhs), abs));
	}

	public static Expr AND(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.AND, lhs, rhs);
	}

	public static Expr OR(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.OR, lhs, rhs);
	}

	public static Expr XOR(Expr lhs, Expr rhs) {
		return NOT(EQ(lhs, rhs));
	}

	public static Expr IMPLIES(Expr lhs, Expr rhs) {
		return BINOP(Expr.BinOpKind.IMPLIES, lhs, rhs);
	}

	private static Expr BINOP(Expr.BinOpKind kind, Expr lhs, Expr rhs) {
		return new Expr.BinOp(kind, lhs, rhs, Position.UNKNOWN);
	}

	/**
	 * Conjoin a list of expressions into a right-nested chain, ending in
	 * <code>true</code>.
	 *
	 * @param operands
	 * @return
	 */
	public static Expr CONJOIN(List<Expr> operands) {
		Expr result = TRUE;
		for (int i = operands.size() - 1; i >= 0; --i) {
			result = AND(operands.get(i), result);
		}
		return result;
	}

	/**
	 * Disjoin a list of expressions into a right-nested chain, ending in
	 * <code>false</code>.
	 *
	 * @param operands
	 * @return
	 */
	public static Expr DISJOIN(List<Expr> operands) {
		Expr result = FALSE;
		for (int i = operands.size() - 1; i >= 0; --i) {
			result = OR(operands.get(i), result);
		}
		return result;
	}

	public static Expr.ForAll FORALL(List<LocalVar> variables, List<Trigger> triggers, Expr body) {
		return new Expr.ForAll(variables, triggers, body, Position.UNKNOWN);
	}

	public static Expr.Cond ITE(Expr guard, Expr trueBranch, Expr falseBranch) {
		return new Expr.Cond(guard, trueBranch, falseBranch, Position.UNKNOWN);
	}

	public static Expr.Unfolding UNFOLDING(String predicate, List<Expr> arguments, Expr body, PermAmount perm,
			String variant) {
		return new Expr.Unfolding(predicate, arguments, body, perm, variant, Position.UNKNOWN);
	}

	/**
	 * Unfold the predicate describing a given argument, with read permission,
	 * whilst evaluating a given body. The result takes the position of the body.
	 *
	 * @param argument
	 * @param body
	 * @return
	 */
	public static Expr.Unfolding WRAP_IN_UNFOLDING(Expr argument, Expr body) {
		return new Expr.Unfolding(argument.getType().name(), Collections.singletonList(argument), body,
				PermAmount.READ, null, body.getPosition());
	}

	public static Expr.LetExpr LET(LocalVar variable, Expr initialiser, Expr body) {
		return new Expr.LetExpr(variable, initialiser, body, Position.UNKNOWN);
	}

	public static Expr.FuncApp FUNC_APP(String name, List<Expr> arguments, List<LocalVar> formals, Type returns) {
		return new Expr.FuncApp(name, arguments, formals, returns, Position.UNKNOWN);
	}
}
