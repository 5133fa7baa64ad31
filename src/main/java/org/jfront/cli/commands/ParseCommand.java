package org.jfront.cli.commands;

import org.jfront.api.FrontEndOptions;
import org.jfront.api.JavaFrontEnd;
import org.jfront.cli.AstJsonWriter;
import org.jfront.cli.CommandLineInterface;
import org.jfront.diagnostics.DiagnosticsEngine;
import org.jfront.frontend.lexer.LexerException;
import org.jfront.frontend.parser.SyntaxException;
import org.jfront.frontend.parser.ast.CompilationUnit;
import org.jfront.frontend.parser.ast.Declaration;
import org.jfront.frontend.parser.ast.Import;
import org.jfront.frontend.parser.ast.MethodDeclaration;
import org.jfront.frontend.parser.ast.TypeDeclaration;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "parse",
    description = "Parse one Java source file and print its declarations or its syntax tree"
)
public class ParseCommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "FILE", description = "The Java source file")
    private Path file;

    @Option(names = "--json", description = "Print the whole syntax tree as JSON")
    private boolean json;

    @Option(names = "--debug", description = "Trace every parse procedure at DEBUG level")
    private boolean debug;

    @Option(names = "--ignore-lex-errors", description = "Record lexical errors and keep scanning")
    private boolean ignoreLexErrors;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws IOException {
        FrontEndOptions options = FrontEndOptions.fromConfig(parent.getConfig());
        if (debug) {
            options = options.withDebug(true);
        }
        if (ignoreLexErrors) {
            options = options.withIgnoreLexErrors(true);
        }

        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        final byte[] source = Files.readAllBytes(file);

        final CompilationUnit unit;
        try {
            unit = new JavaFrontEnd(options).parseUnit(source, file.toString(), diagnostics);
        } catch (LexerException | SyntaxException e) {
            err.println(file + ": " + e.getMessage());
            return 1;
        }

        if (json) {
            out.println(new AstJsonWriter().write(unit, true));
        } else {
            printSummary(unit, out);
        }
        if (diagnostics.hasErrors()) {
            err.println(diagnostics.summary());
        }
        out.flush();
        return 0;
    }

    private static void printSummary(CompilationUnit unit, PrintWriter out) {
        if (unit.packageDeclaration() != null) {
            out.println("package " + unit.packageDeclaration().name());
        }
        for (Import anImport : unit.imports()) {
            out.println("import " + (anImport.isStatic() ? "static " : "") + anImport.path()
                    + (anImport.wildcard() ? ".*" : ""));
        }
        for (Declaration declaration : unit.types()) {
            if (declaration instanceof TypeDeclaration type) {
                out.println(kindOf(type) + " " + type.name() + " (" + type.body().size() + " member(s))");
            } else if (declaration instanceof MethodDeclaration method) {
                out.println("method " + method.name());
            }
        }
    }

    private static String kindOf(TypeDeclaration type) {
        String simpleName = type.getClass().getSimpleName();
        return simpleName.substring(0, simpleName.length() - "Declaration".length()).toLowerCase(Locale.ROOT);
    }
}
