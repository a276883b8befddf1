package whilepp.ast;

/**
 * Commands of the WHILE language. Loop and branch bodies are never empty.
 */
public sealed interface Command permits Nop, Assign, While, For, If {

	<T> T match(Matcher<T> s);

	void match(MatcherVoid s);

	public interface Matcher<T> {
		T case_Nop(Nop nop);
		T case_Assign(Assign assign);
		T case_While(While whileLoop);
		T case_For(For forLoop);
		T case_If(If ifCommand);
	}

	public interface MatcherVoid {
		void case_Nop(Nop nop);
		void case_Assign(Assign assign);
		void case_While(While whileLoop);
		void case_For(For forLoop);
		void case_If(If ifCommand);
	}
}
