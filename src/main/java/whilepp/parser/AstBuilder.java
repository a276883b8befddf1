package whilepp.parser;

import java.util.List;

import org.antlr.v4.runtime.tree.TerminalNode;

import com.google.common.collect.Lists;

import whilepp.ast.Assign;
import whilepp.ast.Ast;
import whilepp.ast.Command;
import whilepp.ast.Expression;
import whilepp.ast.For;
import whilepp.ast.If;
import whilepp.ast.NonEmptyList;
import whilepp.ast.Program;
import whilepp.ast.Variable;
import whilepp.ast.While;
import whilepp.parser.WhileParser.AssignCommandContext;
import whilepp.parser.WhileParser.CommandContext;
import whilepp.parser.WhileParser.CommandsContext;
import whilepp.parser.WhileParser.ConsTermContext;
import whilepp.parser.WhileParser.ExprContext;
import whilepp.parser.WhileParser.ForCommandContext;
import whilepp.parser.WhileParser.HeadTermContext;
import whilepp.parser.WhileParser.IfCommandContext;
import whilepp.parser.WhileParser.NilTermContext;
import whilepp.parser.WhileParser.NopCommandContext;
import whilepp.parser.WhileParser.ProgramEOFContext;
import whilepp.parser.WhileParser.SymbolTermContext;
import whilepp.parser.WhileParser.TailTermContext;
import whilepp.parser.WhileParser.TermContext;
import whilepp.parser.WhileParser.VariableTermContext;
import whilepp.parser.WhileParser.VarsContext;
import whilepp.parser.WhileParser.WhileCommandContext;

/**
 * Translates ANTLR parse trees into WHILE syntax trees.
 * Only called on trees that parsed without errors.
 */
class AstBuilder {

	static Program program(ProgramEOFContext ctx) {
		return new Program(vars(ctx.inputs), commands(ctx.body), vars(ctx.outputs));
	}

	static NonEmptyList<Variable> vars(VarsContext ctx) {
		List<Variable> result = Lists.newArrayList();
		for (TerminalNode v : ctx.VARIABLE()) {
			result.add(new Variable(v.getText()));
		}
		return NonEmptyList.copyOf(result);
	}

	static NonEmptyList<Command> commands(CommandsContext ctx) {
		List<Command> result = Lists.newArrayList();
		for (CommandContext c : ctx.command()) {
			result.add(command(c));
		}
		return NonEmptyList.copyOf(result);
	}

	static Command command(CommandContext ctx) {
		if (ctx instanceof NopCommandContext) {
			return Ast.Nop();
		} else if (ctx instanceof AssignCommandContext) {
			var assign = (AssignCommandContext) ctx;
			return new Assign(new Variable(assign.VARIABLE().getText()), expression(assign.expr()));
		} else if (ctx instanceof WhileCommandContext) {
			var whileLoop = (WhileCommandContext) ctx;
			return new While(expression(whileLoop.expr()), commands(whileLoop.commands()));
		} else if (ctx instanceof ForCommandContext) {
			var forLoop = (ForCommandContext) ctx;
			return new For(expression(forLoop.expr()), commands(forLoop.commands()));
		} else if (ctx instanceof IfCommandContext) {
			var ifCommand = (IfCommandContext) ctx;
			return new If(expression(ifCommand.expr()), commands(ifCommand.thenBranch), commands(ifCommand.elseBranch));
		}
		throw new Error("Case not possible: " + ctx.getClass().getSimpleName());
	}

	static Expression expression(ExprContext ctx) {
		Expression left = term(ctx.left);
		if (ctx.right == null) {
			return left;
		}
		return Ast.Eq(left, term(ctx.right));
	}

	static Expression term(TermContext ctx) {
		if (ctx instanceof NilTermContext) {
			return Ast.Nl();
		} else if (ctx instanceof VariableTermContext) {
			return Ast.VarExp(((VariableTermContext) ctx).VARIABLE().getText());
		} else if (ctx instanceof SymbolTermContext) {
			return Ast.Cst(((SymbolTermContext) ctx).SYMBOL().getText());
		} else if (ctx instanceof ConsTermContext) {
			var cons = (ConsTermContext) ctx;
			return Ast.Cons(term(cons.first), term(cons.second));
		} else if (ctx instanceof HeadTermContext) {
			return Ast.Hd(term(((HeadTermContext) ctx).term()));
		} else if (ctx instanceof TailTermContext) {
			return Ast.Tl(term(((TailTermContext) ctx).term()));
		}
		throw new Error("Case not possible: " + ctx.getClass().getSimpleName());
	}
}
