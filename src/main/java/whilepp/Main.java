package whilepp;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

import whilepp.ast.Program;
import whilepp.parser.WhileReader;
import whilepp.parser.WhileSyntaxException;
import whilepp.printer.IndentSpec;
import whilepp.printer.PrettyPrinter;

public class Main {

	/**
	 * @param args input file and an optional indentation spec such as {@code PROGR=2,WHILE=5}
	 */
	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	/**
	 * Prints the normalised program to out.
	 *
	 * @return 0 on success, 2 on a wrong argument count, 1 on a syntax error, 3 on any other failure
	 */
	static int run(String[] args, PrintStream out, PrintStream err) {
		if (args.length < 1 || args.length > 2) {
			out.println("1 or 2 parameters required.");
			out.println("parameter 1: input file");
			out.println("parameter 2 (optional): indentation, e.g. PROGR=2,WHILE=5,FOR=3,IF=2");
			return 2;
		}
		try {
			Path inputFile = Paths.get(args[0]);
			IndentSpec indentSpec = args.length == 2 ? IndentSpec.parse(args[1]) : IndentSpec.empty();

			Program prog = WhileReader.parseProgram(inputFile);
			out.println(new PrettyPrinter(indentSpec).prettyPrint(prog));
			return 0;
		} catch (WhileSyntaxException e) {
			err.println(args[0] + ": " + e.getMessage());
			return 1;
		} catch (Throwable t) {
			t.printStackTrace(err);
			err.println(t.getMessage());
			return 3;
		}
	}

}
