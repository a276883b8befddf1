package whilepp.ast;

/**
 * Value and boolean expressions of the WHILE language.
 */
public sealed interface Expression permits Nil, Constant, VariableRef, Cons, Head, Tail, Equals {

	<T> T match(Matcher<T> s);

	void match(MatcherVoid s);

	public interface Matcher<T> {
		T case_Nil(Nil nil);
		T case_Constant(Constant constant);
		T case_VariableRef(VariableRef variableRef);
		T case_Cons(Cons cons);
		T case_Head(Head head);
		T case_Tail(Tail tail);
		T case_Equals(Equals equals);
	}

	public interface MatcherVoid {
		void case_Nil(Nil nil);
		void case_Constant(Constant constant);
		void case_VariableRef(VariableRef variableRef);
		void case_Cons(Cons cons);
		void case_Head(Head head);
		void case_Tail(Tail tail);
		void case_Equals(Equals equals);
	}
}
