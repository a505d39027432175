package org.scssonjava.parser;

import org.scssonjava.ArgumentParser.CompilerOptions;
import org.scssonjava.runtime.RecordingLogger;

/**
 * Builds parsers over in-memory source for the parser tests.
 */
final class ScssParserTestSupport {

    private ScssParserTestSupport() {
    }

    static ScssParser parser(String source, RecordingLogger logger) {
        return new ScssParser(source, "test.scss", new CompilerOptions(), logger);
    }

    static ScssParser parser(String source) {
        return parser(source, new RecordingLogger());
    }

    static ScssParser plainCssParser(String source) {
        CompilerOptions options = new CompilerOptions();
        options.plainCss = true;
        return new ScssParser(source, "test.css", options, new RecordingLogger());
    }
}
