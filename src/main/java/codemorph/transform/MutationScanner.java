package codemorph.transform;

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
import codemorph.ast.c.CNumberLiteral;
import codemorph.ast.c.CPrintf;
import codemorph.ast.c.CReturn;
import codemorph.ast.c.CScanf;
import codemorph.ast.c.CStmt;
import codemorph.ast.c.CStmtVisitor;
import codemorph.ast.c.CStringLiteral;
import codemorph.ast.c.CUnaryExpr;
import codemorph.ast.c.CVariableDecl;
import codemorph.ast.c.CWhile;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects which names a subtree rebinds, declares and mentions, and whether
 * it calls any function.
 *
 * "Rebinds" means the Python translation assigns the bare name: plain and
 * compound assignment, {@code ++}/{@code --} and scanf targets. Writes through
 * a subscript do not rebind the array.
 */
final class MutationScanner implements CExprVisitor<Void, Void>, CStmtVisitor<Void, Void> {
	private final Set<String> rebound = new LinkedHashSet<>();
	private final Set<String> declared = new LinkedHashSet<>();
	private final Set<String> mentioned = new LinkedHashSet<>();
	private final Map<String, String> declaredTypes = new HashMap<>();
	private boolean hasCalls;

	static MutationScanner of(CStmt stmt) {
		MutationScanner scanner = new MutationScanner();
		stmt.accept(scanner, null);
		return scanner;
	}

	static MutationScanner of(Collection<? extends CStmt> stmts) {
		MutationScanner scanner = new MutationScanner();
		for (CStmt stmt : stmts) {
			stmt.accept(scanner, null);
		}
		return scanner;
	}

	static MutationScanner ofExpr(CExpr expr) {
		MutationScanner scanner = new MutationScanner();
		expr.accept(scanner, null);
		return scanner;
	}

	Set<String> rebound() {
		return Collections.unmodifiableSet(rebound);
	}

	Set<String> declared() {
		return Collections.unmodifiableSet(declared);
	}

	/**
	 * Declared type per name; arrays carry a {@code []} suffix. A name declared
	 * twice with different types maps to the empty string.
	 */
	Map<String, String> declaredTypes() {
		return Collections.unmodifiableMap(declaredTypes);
	}

	/** Every identifier read or written, including function names. */
	Set<String> mentioned() {
		return Collections.unmodifiableSet(mentioned);
	}

	boolean hasCalls() {
		return hasCalls;
	}

	private void declares(String name, String type) {
		declared.add(name);
		mentioned.add(name);
		declaredTypes.merge(name, type, (a, b) -> a.equals(b) ? a : "");
	}

	private void rebinds(CExpr target) {
		if (target instanceof CIdentifier id) {
			rebound.add(id.name());
		}
	}

	// expressions

	@Override
	public Void visitIdentifier(CIdentifier expr, Void arg) {
		mentioned.add(expr.name());
		return null;
	}

	@Override
	public Void visitNumber(CNumberLiteral expr, Void arg) {
		return null;
	}

	@Override
	public Void visitString(CStringLiteral expr, Void arg) {
		return null;
	}

	@Override
	public Void visitChar(CCharLiteral expr, Void arg) {
		return null;
	}

	@Override
	public Void visitBoolean(CBooleanLiteral expr, Void arg) {
		return null;
	}

	@Override
	public Void visitBinary(CBinaryExpr expr, Void arg) {
		expr.left().accept(this, null);
		expr.right().accept(this, null);
		return null;
	}

	@Override
	public Void visitUnary(CUnaryExpr expr, Void arg) {
		if (expr.isIncrementOrDecrement()) {
			rebinds(expr.operand());
		}
		expr.operand().accept(this, null);
		return null;
	}

	@Override
	public Void visitAssignment(CAssignment expr, Void arg) {
		rebinds(expr.target());
		expr.target().accept(this, null);
		expr.value().accept(this, null);
		return null;
	}

	@Override
	public Void visitCall(CFunctionCall expr, Void arg) {
		hasCalls = true;
		mentioned.add(expr.name());
		for (CExpr a : expr.args()) {
			a.accept(this, null);
		}
		return null;
	}

	@Override
	public Void visitSubscript(CArraySubscript expr, Void arg) {
		expr.array().accept(this, null);
		expr.index().accept(this, null);
		return null;
	}

	// statements

	@Override
	public Void visitExpressionStmt(CExpressionStmt stmt, Void arg) {
		stmt.expr().accept(this, null);
		return null;
	}

	@Override
	public Void visitVariableDecl(CVariableDecl stmt, Void arg) {
		declares(stmt.name(), stmt.declaredType());
		stmt.initializer().ifPresent(e -> e.accept(this, null));
		return null;
	}

	@Override
	public Void visitArrayDecl(CArrayDecl stmt, Void arg) {
		declares(stmt.name(), stmt.declaredType() + "[]");
		stmt.size().accept(this, null);
		return null;
	}

	@Override
	public Void visitFunctionDecl(CFunctionDecl stmt, Void arg) {
		declared.add(stmt.name());
		mentioned.add(stmt.name());
		stmt.body().ifPresent(b -> b.accept(this, null));
		return null;
	}

	@Override
	public Void visitBlock(CBlock stmt, Void arg) {
		for (CStmt s : stmt.statements()) {
			s.accept(this, null);
		}
		return null;
	}

	@Override
	public Void visitIf(CIf stmt, Void arg) {
		stmt.condition().accept(this, null);
		stmt.thenBranch().accept(this, null);
		stmt.elseBranch().ifPresent(s -> s.accept(this, null));
		return null;
	}

	@Override
	public Void visitWhile(CWhile stmt, Void arg) {
		stmt.condition().accept(this, null);
		stmt.body().accept(this, null);
		return null;
	}

	@Override
	public Void visitFor(CFor stmt, Void arg) {
		stmt.initializer().ifPresent(s -> s.accept(this, null));
		stmt.condition().ifPresent(e -> e.accept(this, null));
		stmt.increment().ifPresent(e -> e.accept(this, null));
		stmt.body().accept(this, null);
		return null;
	}

	@Override
	public Void visitReturn(CReturn stmt, Void arg) {
		stmt.value().ifPresent(e -> e.accept(this, null));
		return null;
	}

	@Override
	public Void visitBreak(CBreak stmt, Void arg) {
		return null;
	}

	@Override
	public Void visitContinue(CContinue stmt, Void arg) {
		return null;
	}

	@Override
	public Void visitPrintf(CPrintf stmt, Void arg) {
		for (CExpr a : stmt.args()) {
			a.accept(this, null);
		}
		return null;
	}

	@Override
	public Void visitScanf(CScanf stmt, Void arg) {
		for (CExpr a : stmt.args()) {
			if (a instanceof CUnaryExpr u && u.op().equals("&")) {
				rebinds(u.operand());
			} else {
				rebinds(a);
			}
			a.accept(this, null);
		}
		return null;
	}
}
