package codemorph.print;

import codemorph.ast.c.CArrayDecl;
import codemorph.ast.c.CArraySubscript;
import codemorph.ast.c.CAssignment;
import codemorph.ast.c.CBinaryExpr;
import codemorph.ast.c.CBlock;
import codemorph.ast.c.CBooleanLiteral;
import codemorph.ast.c.CBreak;
import codemorph.ast.c.CCharLiteral;
import codemorph.ast.c.CContinue;
import codemorph.ast.c.CExpr;
import codemorph.ast.c.CExprVisitor;
import codemorph.ast.c.CExpressionStmt;
import codemorph.ast.c.CFor;
import codemorph.ast.c.CFunctionCall;
import codemorph.ast.c.CFunctionDecl;
import codemorph.ast.c.CIdentifier;
import codemorph.ast.c.CIf;
import codemorph.ast.c.CNode;
import codemorph.ast.c.CNumberLiteral;
import codemorph.ast.c.CPrintf;
import codemorph.ast.c.CProgram;
import codemorph.ast.c.CReturn;
import codemorph.ast.c.CScanf;
import codemorph.ast.c.CStmt;
import codemorph.ast.c.CStmtVisitor;
import codemorph.ast.c.CStringLiteral;
import codemorph.ast.c.CUnaryExpr;
import codemorph.ast.c.CVariableDecl;
import codemorph.ast.c.CWhile;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Indented outline of a C AST, two spaces per level:
 *
 * <pre>
 * (Program)
 *   (VariableDeclaration): int x
 *     Initializer:
 *       (NumberLiteral): 5
 * </pre>
 */
public final class AstPrinter {
	public String print(CProgram program) {
		Outline outline = new Outline();
		outline.header(0, program, "");
		for (CStmt stmt : program.statements()) {
			stmt.accept(outline, 1);
		}
		return outline.out.toString();
	}

	private static final class Outline implements CStmtVisitor<Void, Integer>, CExprVisitor<Void, Integer> {
		private final StringBuilder out = new StringBuilder();

		private void text(int indent, String text) {
			out.append("  ".repeat(indent)).append(text).append('\n');
		}

		private void header(int indent, CNode node, String detail) {
			text(indent, "(" + node.kind().displayName() + ")" + (detail.isEmpty() ? "" : ": " + detail));
		}

		private void child(int indent, String label, CExpr expr) {
			text(indent, label + ":");
			expr.accept(this, indent + 1);
		}

		private void child(int indent, String label, CStmt stmt) {
			text(indent, label + ":");
			stmt.accept(this, indent + 1);
		}

		private void arguments(int indent, List<CExpr> args) {
			if (args.isEmpty()) {
				return;
			}
			text(indent, "Arguments:");
			for (CExpr a : args) {
				a.accept(this, indent + 1);
			}
		}

		private static String quoted(String value) {
			return "\"" + TokenPrinter.visible(value) + "\"";
		}

		@Override
		public Void visitExpressionStmt(CExpressionStmt stmt, Integer indent) {
			header(indent, stmt, "");
			stmt.expr().accept(this, indent + 1);
			return null;
		}

		@Override
		public Void visitVariableDecl(CVariableDecl stmt, Integer indent) {
			header(indent, stmt, stmt.declaredType() + " " + stmt.name());
			stmt.initializer().ifPresent(init -> child(indent + 1, "Initializer", init));
			return null;
		}

		@Override
		public Void visitArrayDecl(CArrayDecl stmt, Integer indent) {
			header(indent, stmt, stmt.declaredType() + " " + stmt.name() + "[]");
			child(indent + 1, "Size", stmt.size());
			return null;
		}

		@Override
		public Void visitFunctionDecl(CFunctionDecl stmt, Integer indent) {
			String params = stmt.params().stream()
					.map(p -> p.type() + " " + p.name() + (p.isArray() ? "[]" : ""))
					.collect(Collectors.joining(", "));
			header(indent, stmt, stmt.declaredType() + " " + stmt.name() + "(" + params + ")");
			if (stmt.body().isPresent()) {
				child(indent + 1, "Body", stmt.body().get());
			} else {
				text(indent + 1, "(Prototype)");
			}
			return null;
		}

		@Override
		public Void visitBlock(CBlock stmt, Integer indent) {
			header(indent, stmt, "");
			for (CStmt s : stmt.statements()) {
				s.accept(this, indent + 1);
			}
			return null;
		}

		@Override
		public Void visitIf(CIf stmt, Integer indent) {
			header(indent, stmt, "");
			child(indent + 1, "Condition", stmt.condition());
			child(indent + 1, "ThenBranch", stmt.thenBranch());
			stmt.elseBranch().ifPresent(e -> child(indent + 1, "ElseBranch", e));
			return null;
		}

		@Override
		public Void visitWhile(CWhile stmt, Integer indent) {
			header(indent, stmt, "");
			child(indent + 1, "Condition", stmt.condition());
			child(indent + 1, "Body", stmt.body());
			return null;
		}

		@Override
		public Void visitFor(CFor stmt, Integer indent) {
			header(indent, stmt, "");
			stmt.initializer().ifPresent(s -> child(indent + 1, "Initializer", s));
			stmt.condition().ifPresent(e -> child(indent + 1, "Condition", e));
			stmt.increment().ifPresent(e -> child(indent + 1, "Increment", e));
			child(indent + 1, "Body", stmt.body());
			return null;
		}

		@Override
		public Void visitReturn(CReturn stmt, Integer indent) {
			header(indent, stmt, "");
			stmt.value().ifPresent(v -> child(indent + 1, "Value", v));
			return null;
		}

		@Override
		public Void visitBreak(CBreak stmt, Integer indent) {
			header(indent, stmt, "");
			return null;
		}

		@Override
		public Void visitContinue(CContinue stmt, Integer indent) {
			header(indent, stmt, "");
			return null;
		}

		@Override
		public Void visitPrintf(CPrintf stmt, Integer indent) {
			header(indent, stmt, quoted(stmt.format().value()));
			arguments(indent + 1, stmt.args());
			return null;
		}

		@Override
		public Void visitScanf(CScanf stmt, Integer indent) {
			header(indent, stmt, quoted(stmt.format().value()));
			arguments(indent + 1, stmt.args());
			return null;
		}

		@Override
		public Void visitIdentifier(CIdentifier expr, Integer indent) {
			header(indent, expr, expr.name());
			return null;
		}

		@Override
		public Void visitNumber(CNumberLiteral expr, Integer indent) {
			header(indent, expr, expr.text());
			return null;
		}

		@Override
		public Void visitString(CStringLiteral expr, Integer indent) {
			header(indent, expr, quoted(expr.value()));
			return null;
		}

		@Override
		public Void visitChar(CCharLiteral expr, Integer indent) {
			header(indent, expr, "'" + TokenPrinter.visible(String.valueOf(expr.value())) + "'");
			return null;
		}

		@Override
		public Void visitBoolean(CBooleanLiteral expr, Integer indent) {
			header(indent, expr, String.valueOf(expr.value()));
			return null;
		}

		@Override
		public Void visitBinary(CBinaryExpr expr, Integer indent) {
			header(indent, expr, "Operator '" + expr.op() + "'");
			child(indent + 1, "Left", expr.left());
			child(indent + 1, "Right", expr.right());
			return null;
		}

		@Override
		public Void visitUnary(CUnaryExpr expr, Integer indent) {
			header(indent, expr, "Operator '" + expr.op() + "'" + (expr.prefix() ? "" : " (postfix)"));
			child(indent + 1, "Operand", expr.operand());
			return null;
		}

		@Override
		public Void visitAssignment(CAssignment expr, Integer indent) {
			header(indent, expr, "Operator '" + expr.op() + "'");
			child(indent + 1, "Target", expr.target());
			child(indent + 1, "Value", expr.value());
			return null;
		}

		@Override
		public Void visitCall(CFunctionCall expr, Integer indent) {
			header(indent, expr, expr.name());
			arguments(indent + 1, expr.args());
			return null;
		}

		@Override
		public Void visitSubscript(CArraySubscript expr, Integer indent) {
			header(indent, expr, "");
			child(indent + 1, "Array", expr.array());
			child(indent + 1, "Index", expr.index());
			return null;
		}
	}
}
