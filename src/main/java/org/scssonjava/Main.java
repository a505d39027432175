package org.scssonjava;

import org.scssonjava.ArgumentParser.CompilerOptions;
import org.scssonjava.astnode.Statement;
import org.scssonjava.astvisitor.PrintVisitor;
import org.scssonjava.parser.ScssParser;
import org.scssonjava.runtime.ScssCompilerException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point: scans a stylesheet and prints its statements as an
 * indented outline.
 */
public class Main {

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs the scanner with the given arguments.
     *
     * @return the process exit status
     */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        CompilerOptions options;
        try {
            options = ArgumentParser.parseArguments(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            return Configuration.EXIT_USAGE;
        } catch (IOException e) {
            err.println("Error: Unable to read options file: " + e.getMessage());
            return Configuration.EXIT_IO_ERROR;
        }

        if (options.showHelp) {
            ArgumentParser.printHelp(out);
            return 0;
        }
        if (options.showVersion) {
            out.println("scssonjava " + Configuration.version);
            return 0;
        }

        String code;
        try {
            code = readInput(options);
        } catch (IOException e) {
            err.println("Error: Unable to read file " + options.fileName);
            return Configuration.EXIT_IO_ERROR;
        }

        try {
            ScssParser parser = new ScssParser(code, options.fileName == null ? "-" : options.fileName, options);
            List<Statement> statements = parser.parse();
            if (options.printTree) {
                PrintVisitor printVisitor = new PrintVisitor();
                printVisitor.visit(statements);
                out.print(printVisitor.getResult());
            }
            return 0;
        } catch (ScssCompilerException e) {
            err.print("Error: " + e.getMessage());
            return Configuration.EXIT_PARSE_ERROR;
        }
    }

    private static String readInput(CompilerOptions options) throws IOException {
        if (options.code != null) {
            return options.code;
        }
        if (options.fileName == null || options.fileName.equals("-")) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Path.of(options.fileName), StandardCharsets.UTF_8);
    }
}
