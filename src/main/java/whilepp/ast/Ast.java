package whilepp.ast;

import java.util.List;

/**
 * Static factory for WHILE syntax trees.
 */
public class Ast {

	public static Expression Nl() {
		return Nil.INSTANCE;
	}

	public static Expression Cst(String name) {
		return new Constant(name);
	}

	public static Expression VarExp(String name) {
		return new VariableRef(name);
	}

	public static Expression Cons(Expression head, Expression tail) {
		return new Cons(head, tail);
	}

	public static Expression Hd(Expression arg) {
		return new Head(arg);
	}

	public static Expression Tl(Expression arg) {
		return new Tail(arg);
	}

	public static Expression Eq(Expression left, Expression right) {
		return new Equals(left, right);
	}

	public static Variable Var(String name) {
		return new Variable(name);
	}

	public static Command Nop() {
		return Nop.INSTANCE;
	}

	public static Command Set(Variable target, Expression value) {
		return new Assign(target, value);
	}

	public static Command While(Expression condition, Command ... body) {
		return new While(condition, Commands(body));
	}

	public static Command While(Expression condition, List<Command> body) {
		return new While(condition, NonEmptyList.copyOf(body));
	}

	public static Command For(Expression count, Command ... body) {
		return new For(count, Commands(body));
	}

	public static Command For(Expression count, List<Command> body) {
		return new For(count, NonEmptyList.copyOf(body));
	}

	public static Command If(Expression condition, List<Command> thenBranch, List<Command> elseBranch) {
		return new If(condition, NonEmptyList.copyOf(thenBranch), NonEmptyList.copyOf(elseBranch));
	}

	public static Program Progr(List<Variable> inputs, List<Command> body, List<Variable> outputs) {
		return new Program(NonEmptyList.copyOf(inputs), NonEmptyList.copyOf(body), NonEmptyList.copyOf(outputs));
	}

	public static NonEmptyList<Command> Commands(Command ... commands) {
		return NonEmptyList.copyOf(List.of(commands));
	}
}
