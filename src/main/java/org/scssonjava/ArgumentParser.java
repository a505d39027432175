package org.scssonjava;

import org.scssonjava.runtime.Deprecation;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;

/**
 * The ArgumentParser class is responsible for parsing command-line arguments
 * and configuring the CompilerOptions accordingly. It handles the flags that
 * select the parsing mode, control diagnostics, and name the input.
 */
public class ArgumentParser {

    /**
     * Parses the command-line arguments and returns a CompilerOptions object
     * configured based on the provided arguments.
     *
     * @param args The command-line arguments to parse.
     * @return A CompilerOptions object with settings derived from the arguments.
     * @throws IllegalArgumentException for unknown switches or missing switch values
     * @throws IOException              if an options file cannot be read
     */
    public static CompilerOptions parseArguments(String[] args) throws IOException {
        CompilerOptions parsedArgs = new CompilerOptions();
        processArgs(args, parsedArgs);
        return parsedArgs;
    }

    /**
     * Processes the command-line arguments, distinguishing between switch and non-switch arguments.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CompilerOptions object to configure.
     */
    private static void processArgs(String[] args, CompilerOptions parsedArgs) throws IOException {
        boolean readingFiles = false; // After "--" every argument is a file name

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingFiles || !arg.startsWith("-") || arg.equals("-")) {
                processNonSwitchArgument(parsedArgs, arg);
            } else if (arg.equals("--")) {
                readingFiles = true;
            } else if (arg.startsWith("--")) {
                // Process long-form switches (e.g., --debug, --plain-css)
                i = processLongSwitches(args, parsedArgs, arg, i);
            } else {
                // Process single-character switches (e.g., -e, -h)
                i = processShortSwitch(args, parsedArgs, arg, i);
            }
        }
    }

    /**
     * Records the input file. Only one input is accepted.
     */
    private static void processNonSwitchArgument(CompilerOptions parsedArgs, String arg) {
        if (parsedArgs.code != null || parsedArgs.fileName != null) {
            throw new IllegalArgumentException("Only one input may be given: " + arg);
        }
        parsedArgs.fileName = arg;
    }

    private static int processShortSwitch(String[] args, CompilerOptions parsedArgs, String arg, int index) {
        switch (arg) {
            case "-e":
                if (index + 1 >= args.length) {
                    throw new IllegalArgumentException("No code specified for -e.");
                }
                if (parsedArgs.fileName != null) {
                    throw new IllegalArgumentException("Only one input may be given: -e");
                }
                // Several -e's are joined into one document
                parsedArgs.code = parsedArgs.code == null ? args[++index] : parsedArgs.code + "\n" + args[++index];
                break;
            case "-h":
            case "-?":
                parsedArgs.showHelp = true;
                break;
            case "-v":
                parsedArgs.showVersion = true;
                break;
            default:
                throw new IllegalArgumentException("Unrecognized switch: " + arg + "  (-h will show valid options)");
        }
        return index;
    }

    /**
     * Processes long-form switches. Switches that take a value accept it either
     * after {@code =} or as the next argument.
     *
     * @param args       The command-line arguments.
     * @param parsedArgs The CompilerOptions object to configure.
     * @param arg        The current argument being processed.
     * @param index      The current index in the arguments array.
     * @return The updated index after processing the long-form switch.
     */
    private static int processLongSwitches(String[] args, CompilerOptions parsedArgs, String arg, int index)
            throws IOException {
        String name = arg;
        String value = null;
        int eq = arg.indexOf('=');
        if (eq >= 0) {
            name = arg.substring(0, eq);
            value = arg.substring(eq + 1);
        }

        switch (name) {
            case "--debug":
                parsedArgs.debugEnabled = true;
                break;
            case "--plain-css":
                parsedArgs.plainCss = true;
                break;
            case "--quiet":
                parsedArgs.quietDeps = true;
                break;
            case "--verbose":
                parsedArgs.verbose = true;
                break;
            case "--no-tree":
                parsedArgs.printTree = false;
                break;
            case "--fatal-deprecation":
                if (value == null) {
                    value = requireValue(args, ++index, name);
                }
                parsedArgs.fatalDeprecations.addAll(parseDeprecations(value));
                break;
            case "--silence-deprecation":
                if (value == null) {
                    value = requireValue(args, ++index, name);
                }
                parsedArgs.silenceDeprecations.addAll(parseDeprecations(value));
                break;
            case "--config":
                if (value == null) {
                    value = requireValue(args, ++index, name);
                }
                OptionsFile.load(Path.of(value), parsedArgs);
                break;
            case "--help":
                parsedArgs.showHelp = true;
                break;
            case "--version":
                parsedArgs.showVersion = true;
                break;
            default:
                throw new IllegalArgumentException("Unrecognized switch: " + arg + "  (-h will show valid options)");
        }
        return index;
    }

    private static String requireValue(String[] args, int index, String name) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + name + ".");
        }
        return args[index];
    }

    /**
     * Parses a comma-separated list of deprecation ids.
     *
     * @throws IllegalArgumentException for an unknown id
     */
    static Set<Deprecation> parseDeprecations(String value) {
        Set<Deprecation> result = EnumSet.noneOf(Deprecation.class);
        for (String id : value.split(",")) {
            String trimmed = id.trim();
            if (!trimmed.isEmpty()) {
                result.add(Deprecation.fromId(trimmed));
            }
        }
        return result;
    }

    static void printHelp(PrintStream out) {
        out.println("Usage: java -jar target/scssonjava-" + Configuration.version + ".jar [options] [file]");
        out.println();
        out.println("  -e code                      scan one line of stylesheet (several -e's allowed, omit file)");
        out.println("  --plain-css                  accept plain CSS only");
        out.println("  --quiet                      don't print warnings");
        out.println("  --verbose                    print all deprecation warnings, even repetitive ones");
        out.println("  --fatal-deprecation=ids      treat these deprecations as errors");
        out.println("  --silence-deprecation=ids    don't print these deprecation warnings");
        out.println("  --config file.yaml           read options from a YAML file");
        out.println("  --no-tree                    check syntax only, don't print statements");
        out.println("  --debug                      enable debugging mode");
        out.println("  -v, --version                print the version");
        out.println("  -h, --help                   displays this help message");
        out.println();
        out.println("Reads standard input when no file or -e is given, or when the file is \"-\".");
    }

    /**
     * CompilerOptions is a configuration class that holds the settings and flags
     * used by the parser. It also stores the source code and the file name, if provided.
     */
    public static class CompilerOptions implements Cloneable {
        public boolean debugEnabled = false;
        // Accept plain CSS only: no silent comments, variables or interpolation
        public boolean plainCss = false;
        // Don't print any warnings
        public boolean quietDeps = false;
        // Don't limit repetitive deprecation warnings
        public boolean verbose = false;
        public boolean printTree = true;
        public boolean showHelp = false;
        public boolean showVersion = false;
        public Set<Deprecation> fatalDeprecations = EnumSet.noneOf(Deprecation.class);
        public Set<Deprecation> silenceDeprecations = EnumSet.noneOf(Deprecation.class);
        public String code = null;
        public String fileName = null;

        @Override
        public CompilerOptions clone() {
            try {
                CompilerOptions copy = (CompilerOptions) super.clone();
                copy.fatalDeprecations = EnumSet.noneOf(Deprecation.class);
                copy.fatalDeprecations.addAll(fatalDeprecations);
                copy.silenceDeprecations = EnumSet.noneOf(Deprecation.class);
                copy.silenceDeprecations.addAll(silenceDeprecations);
                return copy;
            } catch (CloneNotSupportedException e) {
                // This shouldn't happen, since we're implementing Cloneable
                throw new AssertionError();
            }
        }

        @Override
        public String toString() {
            return "CompilerOptions{\n" +
                    "    debugEnabled=" + debugEnabled + ",\n" +
                    "    plainCss=" + plainCss + ",\n" +
                    "    quietDeps=" + quietDeps + ",\n" +
                    "    verbose=" + verbose + ",\n" +
                    "    printTree=" + printTree + ",\n" +
                    "    fatalDeprecations=" + fatalDeprecations + ",\n" +
                    "    silenceDeprecations=" + silenceDeprecations + ",\n" +
                    "    fileName='" + fileName + "',\n" +
                    "    code='" + code + "'\n" +
                    "}";
        }
    }
}
