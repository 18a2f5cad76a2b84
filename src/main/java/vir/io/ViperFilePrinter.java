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
package vir.io;

import java.io.ByteArrayOutputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import vir.core.LocalVar;
import vir.core.Position;
import vir.core.Trigger;
import vir.core.Type;
import vir.core.ViperFile;
import vir.core.ViperFile.Decl;
import vir.core.ViperFile.Expr;
import vir.util.MappablePrintWriter;

/**
 * Renders a verification unit as program text for the backend verifier. The
 * item responsible for each piece of text is recorded, so that errors reported
 * against the text can be traced back to the item.
 */
public class ViperFilePrinter {
	private final MappablePrintWriter<ViperFile.Item> out;
	/**
	 * Specify whether to annotate declarations with their source positions.
	 */
	private boolean positions = false;

	public ViperFilePrinter(OutputStream output) {
		this.out = new MappablePrintWriter<>(output);
	}

	public ViperFilePrinter setPositions(boolean flag) {
		this.positions = flag;
		return this;
	}

	public void flush() {
		out.flush();
	}

	public MappablePrintWriter.Mapping<ViperFile.Item> getMapping() {
		return out.getMapping();
	}

	public void write(ViperFile file) {
		for (Decl d : file.getDeclarations()) {
			writeDecl(0, d);
		}
		out.flush();
	}

	private void writeDecl(int indent, Decl d) {
		if (positions && !d.getPosition().isDefault()) {
			writePosition(indent, d);
		}
		if (d instanceof Decl.Field) {
			writeField(indent, (Decl.Field) d);
		} else if (d instanceof Decl.Predicate) {
			writePredicate(indent, (Decl.Predicate) d);
		} else if (d instanceof Decl.Function) {
			writeFunction(indent, (Decl.Function) d);
		} else if (d instanceof Decl.Method) {
			writeMethod(indent, (Decl.Method) d);
		} else {
			throw new IllegalArgumentException("unknown declaration encountered (" + d.getClass().getName() + ")");
		}
	}

	private void writePosition(int indent, Decl d) {
		Position p = d.getPosition();
		out.tab(indent);
		out.println("// " + d.getName() + " @ " + p.getLine() + ":" + p.getColumn(), d);
	}

	private void writeField(int indent, Decl.Field d) {
		out.tab(indent);
		out.print("field ", d);
		out.print(d.getName(), d);
		out.print(": ", d);
		writeType(d.getType(), d);
		out.println();
	}

	private void writePredicate(int indent, Decl.Predicate d) {
		out.tab(indent);
		out.print("predicate ", d);
		out.print(d.getName(), d);
		out.print("(", d);
		writeVariable(d.getParameter(), d);
		out.print(")", d);
		if (d.getBody() != null) {
			out.println(" {", d);
			out.tab(indent + 1);
			writeExpression(d.getBody());
			out.println();
			out.tab(indent);
			out.println("}", d);
		} else {
			out.println();
		}
	}

	private void writeFunction(int indent, Decl.Function d) {
		out.tab(indent);
		out.print("function ", d);
		out.print(d.getName(), d);
		writeParameters(d.getParameters(), d);
		out.print(": ", d);
		writeType(d.getReturns(), d);
		out.println();
		writeSpecification(indent + 1, "requires ", d.getRequires());
		writeSpecification(indent + 1, "ensures ", d.getEnsures());
		if (d.getBody() != null) {
			out.tab(indent);
			out.println("{", d);
			out.tab(indent + 1);
			writeExpression(d.getBody());
			out.println();
			out.tab(indent);
			out.println("}", d);
		}
	}

	private void writeMethod(int indent, Decl.Method d) {
		out.tab(indent);
		out.print("method ", d);
		out.print(d.getName(), d);
		writeParameters(d.getParameters(), d);
		if (!d.getReturns().isEmpty()) {
			out.print(" returns ", d);
			writeParameters(d.getReturns(), d);
		}
		out.println();
		writeSpecification(indent + 1, "requires ", d.getRequires());
		writeSpecification(indent + 1, "ensures ", d.getEnsures());
	}

	private void writeSpecification(int indent, String keyword, List<Expr> clauses) {
		for (Expr clause : clauses) {
			out.tab(indent);
			out.print(keyword, clause);
			writeExpression(clause);
			out.println();
		}
	}

	private void writeParameters(List<LocalVar> parameters, ViperFile.Item tag) {
		out.print("(", tag);
		writeVariables(parameters, tag);
		out.print(")", tag);
	}

	private void writeVariables(List<LocalVar> variables, ViperFile.Item tag) {
		for (int i = 0; i != variables.size(); ++i) {
			if (i != 0) {
				out.print(", ", tag);
			}
			writeVariable(variables.get(i), tag);
		}
	}

	private void writeVariable(LocalVar var, ViperFile.Item tag) {
		out.print(var.getName(), tag);
		out.print(": ", tag);
		writeType(var.getType(), tag);
	}

	private void writeExpressionWithBraces(Expr e) {
		out.print("(", e);
		writeExpression(e);
		out.print(")", e);
	}

	private void writeExpression(Expr e) {
		if (e instanceof Expr.Local) {
			writeLocal((Expr.Local) e);
		} else if (e instanceof Expr.Variant) {
			writeVariant((Expr.Variant) e);
		} else if (e instanceof Expr.FieldAccess) {
			writeFieldAccess((Expr.FieldAccess) e);
		} else if (e instanceof Expr.AddrOf) {
			writeAddrOf((Expr.AddrOf) e);
		} else if (e instanceof Expr.LabelledOld) {
			writeLabelledOld((Expr.LabelledOld) e);
		} else if (e instanceof Expr.Const) {
			writeConst((Expr.Const) e);
		} else if (e instanceof Expr.MagicWand) {
			writeMagicWand((Expr.MagicWand) e);
		} else if (e instanceof Expr.PredicateAccessPredicate) {
			writePredicateAccessPredicate((Expr.PredicateAccessPredicate) e);
		} else if (e instanceof Expr.FieldAccessPredicate) {
			writeFieldAccessPredicate((Expr.FieldAccessPredicate) e);
		} else if (e instanceof Expr.UnaryOp) {
			writeUnaryOp((Expr.UnaryOp) e);
		} else if (e instanceof Expr.BinOp) {
			writeBinOp((Expr.BinOp) e);
		} else if (e instanceof Expr.Unfolding) {
			writeUnfolding((Expr.Unfolding) e);
		} else if (e instanceof Expr.Cond) {
			writeCond((Expr.Cond) e);
		} else if (e instanceof Expr.ForAll) {
			writeForAll((Expr.ForAll) e);
		} else if (e instanceof Expr.LetExpr) {
			writeLetExpr((Expr.LetExpr) e);
		} else if (e instanceof Expr.FuncApp) {
			writeFuncApp((Expr.FuncApp) e);
		} else {
			throw new IllegalArgumentException("unknown expression encountered (" + e.getClass().getName() + ")");
		}
	}

	private void writeLocal(Expr.Local e) {
		out.print(e.getVariable().getName(), e);
	}

	private void writeVariant(Expr.Variant e) {
		writeExpression(e.getOperand());
		out.print("[" + e.getVariant().getName() + "]", e);
	}

	private void writeFieldAccess(Expr.FieldAccess e) {
		writeExpression(e.getOperand());
		out.print("." + e.getField().getName(), e);
	}

	private void writeAddrOf(Expr.AddrOf e) {
		out.print("&(", e);
		writeExpression(e.getOperand());
		out.print(")", e);
	}

	private void writeLabelledOld(Expr.LabelledOld e) {
		out.print("old[" + e.getLabel() + "](", e);
		writeExpression(e.getBody());
		out.print(")", e);
	}

	private void writeConst(Expr.Const e) {
		out.print(e.getValue().toString(), e);
	}

	private void writeMagicWand(Expr.MagicWand e) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(" --* ", e);
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writePredicateAccessPredicate(Expr.PredicateAccessPredicate e) {
		out.print("acc(" + e.getName() + "(", e);
		writeExpression(e.getArgument());
		out.print("), " + e.getPermission() + ")", e);
	}

	private void writeFieldAccessPredicate(Expr.FieldAccessPredicate e) {
		out.print("acc(", e);
		writeExpression(e.getReceiver());
		out.print(", " + e.getPermission() + ")", e);
	}

	private void writeUnaryOp(Expr.UnaryOp e) {
		out.print(e.getKind().toString(), e);
		writeExpressionWithBraces(e.getOperand());
	}

	private void writeBinOp(Expr.BinOp e) {
		writeExpressionWithBraces(e.getLeftHandSide());
		out.print(" " + e.getKind() + " ", e);
		writeExpressionWithBraces(e.getRightHandSide());
	}

	private void writeUnfolding(Expr.Unfolding e) {
		out.print("(unfolding acc(" + e.getPredicate(), e);
		if (e.getVariant() != null) {
			out.print(":" + e.getVariant(), e);
		}
		out.print("(", e);
		writeExpressions(e.getArguments(), e);
		out.print("), " + e.getPermission() + ") in ", e);
		writeExpression(e.getBody());
		out.print(")", e);
	}

	private void writeCond(Expr.Cond e) {
		writeExpressionWithBraces(e.getGuard());
		out.print("?", e);
		writeExpressionWithBraces(e.getTrueBranch());
		out.print(":", e);
		writeExpressionWithBraces(e.getFalseBranch());
	}

	private void writeForAll(Expr.ForAll e) {
		out.print("forall ", e);
		writeVariables(e.getVariables(), e);
		out.print(" :: ", e);
		List<Trigger> triggers = e.getTriggers();
		if (!triggers.isEmpty()) {
			for (int i = 0; i != triggers.size(); ++i) {
				if (i != 0) {
					out.print(", ", e);
				}
				out.print("{", e);
				writeExpressions(triggers.get(i).getTerms(), e);
				out.print("}", e);
			}
			out.print(" :: ", e);
		}
		writeExpression(e.getBody());
	}

	private void writeLetExpr(Expr.LetExpr e) {
		out.print("(let ", e);
		writeVariable(e.getVariable(), e);
		out.print(" == ", e);
		writeExpressionWithBraces(e.getInitialiser());
		out.print(" in ", e);
		writeExpression(e.getBody());
		out.print(")", e);
	}

	private void writeFuncApp(Expr.FuncApp e) {
		out.print(e.getName() + "<", e);
		List<LocalVar> formals = e.getFormals();
		for (int i = 0; i != formals.size(); ++i) {
			if (i != 0) {
				out.print(", ", e);
			}
			writeType(formals.get(i).getType(), e);
		}
		out.print(",", e);
		writeType(e.getReturns(), e);
		out.print(">(", e);
		writeExpressions(e.getArguments(), e);
		out.print(")", e);
	}

	private void writeExpressions(List<Expr> exprs, ViperFile.Item tag) {
		for (int i = 0; i != exprs.size(); ++i) {
			if (i != 0) {
				out.print(", ", tag);
			}
			writeExpression(exprs.get(i));
		}
	}

	private void writeType(Type t, ViperFile.Item tag) {
		out.print(t.toString(), tag);
	}

	public static String toString(Expr expr) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		ViperFilePrinter p = new ViperFilePrinter(buf);
		p.writeExpression(expr);
		p.flush();
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}

	public static String toString(ViperFile file) {
		ByteArrayOutputStream buf = new ByteArrayOutputStream();
		new ViperFilePrinter(buf).write(file);
		return new String(buf.toByteArray(), StandardCharsets.UTF_8);
	}
}
