package org.scssonjava;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.scssonjava.ArgumentParser.CompilerOptions;
import org.scssonjava.runtime.Deprecation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class ArgumentParserTest {

    @Test
    public void testDefaults() throws IOException {
        CompilerOptions options = ArgumentParser.parseArguments(new String[]{});
        assertFalse(options.plainCss);
        assertFalse(options.debugEnabled);
        assertFalse(options.quietDeps);
        assertTrue(options.printTree);
        assertTrue(options.fatalDeprecations.isEmpty());
        assertNull(options.code);
        assertNull(options.fileName);
    }

    @Test
    public void testSwitches() throws IOException {
        CompilerOptions options = ArgumentParser.parseArguments(new String[]{
                "--plain-css", "--debug", "--quiet", "--verbose", "--no-tree", "style.css"});
        assertTrue(options.plainCss);
        assertTrue(options.debugEnabled);
        assertTrue(options.quietDeps);
        assertTrue(options.verbose);
        assertFalse(options.printTree);
        assertEquals("style.css", options.fileName);
    }

    @Test
    public void testDeprecationSwitches() throws IOException {
        CompilerOptions options = ArgumentParser.parseArguments(new String[]{
                "--fatal-deprecation=elseif", "--silence-deprecation", "elseif"});
        assertEquals(Set.of(Deprecation.ELSEIF), options.fatalDeprecations);
        assertEquals(Set.of(Deprecation.ELSEIF), options.silenceDeprecations);
    }

    @Test
    public void testUnknownDeprecation() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ArgumentParser.parseArguments(new String[]{"--fatal-deprecation=nope"}));
        assertEquals("Invalid deprecation \"nope\".", e.getMessage());
    }

    @Test
    public void testInlineCode() throws IOException {
        CompilerOptions options = ArgumentParser.parseArguments(new String[]{"-e", "a {}", "-e", "b {}"});
        assertEquals("a {}\nb {}", options.code);
    }

    @Test
    public void testMissingInlineCode() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"-e"}));
    }

    @Test
    public void testUnknownSwitch() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"--bogus"}));
        assertThrows(IllegalArgumentException.class, () -> ArgumentParser.parseArguments(new String[]{"-z"}));
    }

    @Test
    public void testOnlyOneInput() {
        assertThrows(IllegalArgumentException.class,
                () -> ArgumentParser.parseArguments(new String[]{"a.scss", "b.scss"}));
        assertThrows(IllegalArgumentException.class,
                () -> ArgumentParser.parseArguments(new String[]{"-e", "a {}", "b.scss"}));
    }

    @Test
    public void testDoubleDashEndsSwitches() throws IOException {
        CompilerOptions options = ArgumentParser.parseArguments(new String[]{"--", "--odd-name.scss"});
        assertEquals("--odd-name.scss", options.fileName);
    }

    @Test
    public void testHelpAndVersion() throws IOException {
        assertTrue(ArgumentParser.parseArguments(new String[]{"-h"}).showHelp);
        assertTrue(ArgumentParser.parseArguments(new String[]{"--version"}).showVersion);
    }

    @Test
    public void testConfigFileThenOverride(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("options.yaml");
        Files.writeString(config, "plainCss: true\nverbose: true\nfatalDeprecations: [elseif]\n");

        CompilerOptions options = ArgumentParser.parseArguments(new String[]{
                "--config", config.toString(), "--debug"});

        assertTrue(options.plainCss);
        assertTrue(options.verbose);
        assertTrue(options.debugEnabled);
        assertEquals(Set.of(Deprecation.ELSEIF), options.fatalDeprecations);
    }

    @Test
    public void testMissingConfigFile(@TempDir Path dir) {
        assertThrows(IOException.class, () -> ArgumentParser.parseArguments(new String[]{
                "--config=" + dir.resolve("missing.yaml")}));
    }

    @Test
    public void testCloneCopiesDeprecationSets() throws IOException {
        CompilerOptions options = ArgumentParser.parseArguments(new String[]{"--fatal-deprecation=elseif"});
        CompilerOptions copy = options.clone();
        copy.fatalDeprecations.clear();
        assertEquals(Set.of(Deprecation.ELSEIF), options.fatalDeprecations);
    }
}
