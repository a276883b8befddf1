package whilepp.printer;

import whilepp.ast.Cons;
import whilepp.ast.Constant;
import whilepp.ast.Equals;
import whilepp.ast.Expression;
import whilepp.ast.Head;
import whilepp.ast.Nil;
import whilepp.ast.Tail;
import whilepp.ast.VariableRef;

/**
 * Renders an expression to a single line of concrete syntax.
 */
public class ExpressionPrinter implements Expression.Matcher<String> {

	public String render(Expression expression) {
		return expression.match(this);
	}

	@Override
	public String case_Nil(Nil nil) {
		return "nil";
	}

	@Override
	public String case_Constant(Constant constant) {
		return constant.getName();
	}

	@Override
	public String case_VariableRef(VariableRef variableRef) {
		return variableRef.getName();
	}

	@Override
	public String case_Cons(Cons cons) {
		return "(cons " + render(cons.getHead()) + " " + render(cons.getTail()) + ")";
	}

	@Override
	public String case_Head(Head head) {
		return "(hd " + render(head.getArg()) + ")";
	}

	@Override
	public String case_Tail(Tail tail) {
		return "(tl " + render(tail.getArg()) + ")";
	}

	@Override
	public String case_Equals(Equals equals) {
		// no parentheses, =? only occurs at the top of a condition
		return render(equals.getLeft()) + " =? " + render(equals.getRight());
	}
}
