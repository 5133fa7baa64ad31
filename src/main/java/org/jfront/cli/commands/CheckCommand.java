package org.jfront.cli.commands;

import org.jfront.api.FrontEndOptions;
import org.jfront.api.JavaFrontEnd;
import org.jfront.cli.CommandLineInterface;
import org.jfront.diagnostics.DiagnosticsEngine;
import org.jfront.frontend.lexer.LexerException;
import org.jfront.frontend.parser.SyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "check",
    description = "Parse Java source files and report whether each one is syntactically valid"
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CheckCommand.class);

    @Parameters(arity = "1..*", paramLabel = "FILE", description = "Java source files to check")
    private List<Path> files;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final JavaFrontEnd frontEnd = new JavaFrontEnd(FrontEndOptions.fromConfig(parent.getConfig()));
        final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        final PrintWriter out = spec.commandLine().getOut();

        int failed = 0;
        for (final Path file : files) {
            final String fileName = file.toString();
            try {
                final byte[] source = Files.readAllBytes(file);
                frontEnd.parseUnit(source, fileName, diagnostics);
                out.println(fileName + ": OK");
            } catch (IOException e) {
                diagnostics.reportError("Cannot read file: " + e.getMessage(), fileName, -1);
                out.println(fileName + ": cannot read file");
                failed++;
            } catch (LexerException | SyntaxException e) {
                out.println(fileName + ": " + e.getMessage());
                failed++;
            }
        }
        out.flush();

        if (diagnostics.hasErrors()) {
            LOG.warn("{} of {} file(s) failed, {} diagnostic(s) reported", failed, files.size(),
                    diagnostics.getDiagnostics().size());
            spec.commandLine().getErr().println(diagnostics.summary());
            return 1;
        }
        LOG.info("Checked {} file(s) without errors", files.size());
        return 0;
    }
}
