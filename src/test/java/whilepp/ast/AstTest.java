package whilepp.ast;

import org.junit.jupiter.api.Test;
import whilepp.ListEmptyException;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static whilepp.ast.Ast.*;

public class AstTest {

    @Test
    public void testStructuralEquality() {
        var a = While(Eq(VarExp("X"), Nl()), Set(Var("Y"), Cons(Cst("a"), Nl())));
        var b = While(Eq(VarExp("X"), Nl()), Set(Var("Y"), Cons(Cst("a"), Nl())));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotSame(a, b);
    }

    @Test
    public void testConstantAndVariableDiffer() {
        assertNotEquals(Cst("X"), VarExp("X"));
        assertNotEquals(Hd(Nl()), Tl(Nl()));
        assertNotEquals(While(Nl(), Nop()), For(Nl(), Nop()));
    }

    @Test
    public void testMatcher() {
        Command.Matcher<String> kind = new Command.Matcher<>() {
            @Override
            public String case_Nop(Nop nop) { return "nop"; }

            @Override
            public String case_Assign(Assign assign) { return "assign " + assign.getTarget().getName(); }

            @Override
            public String case_While(While whileLoop) { return "while"; }

            @Override
            public String case_For(For forLoop) { return "for"; }

            @Override
            public String case_If(If ifCommand) { return "if"; }
        };

        assertEquals("nop", Nop().match(kind));
        assertEquals("assign Z", Set(Var("Z"), Nl()).match(kind));
        assertEquals("for", For(VarExp("N"), Nop()).match(kind));
        assertEquals("if", If(Nl(), List.of(Nop()), List.of(Nop())).match(kind));
    }

    @Test
    public void testMatcherVoid() {
        List<String> seen = new ArrayList<>();
        Expression.MatcherVoid collector = new Expression.MatcherVoid() {
            @Override public void case_Nil(Nil nil) { seen.add("nil"); }
            @Override public void case_Constant(Constant constant) { seen.add(constant.getName()); }
            @Override public void case_VariableRef(VariableRef variableRef) { seen.add(variableRef.getName()); }
            @Override public void case_Cons(Cons cons) { cons.getHead().match(this); cons.getTail().match(this); }
            @Override public void case_Head(Head head) { head.getArg().match(this); }
            @Override public void case_Tail(Tail tail) { tail.getArg().match(this); }
            @Override public void case_Equals(Equals equals) { equals.getLeft().match(this); equals.getRight().match(this); }
        };

        Eq(Cons(Hd(VarExp("X")), Cst("a")), Tl(Nl())).match(collector);

        assertEquals(List.of("X", "a", "nil"), seen);
    }

    @Test
    public void testNonEmptyList() {
        var list = NonEmptyList.of("a", "b", "c");

        assertEquals("a", list.first());
        assertEquals(List.of("b", "c"), list.rest());
        assertEquals("c", list.last());
        assertEquals(3, list.size());
        assertEquals(NonEmptyList.copyOf(List.of("a", "b", "c")), list);
        assertTrue(NonEmptyList.of("x").rest().isEmpty());
    }

    @Test
    public void testNonEmptyListRejectsEmpty() {
        assertThrows(ListEmptyException.class, () -> NonEmptyList.copyOf(List.of()));
        assertThrows(ListEmptyException.class, () -> While(VarExp("X")));
        assertThrows(ListEmptyException.class, () -> If(Nl(), List.of(Nop()), List.of()));
    }

    @Test
    public void testNullChildrenAreRejected() {
        assertThrows(NullPointerException.class, () -> Cons(Nl(), null));
        assertThrows(NullPointerException.class, () -> Set(null, Nl()));
    }
}
