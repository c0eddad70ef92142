package com.vibeforge.core.validation;

import com.vibeforge.config.VibeForgeSettings;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class NodeSyntaxCheckerTest {

    @TempDir
    Path tempDir;

    private NodeSyntaxChecker checkerRunning(String script) throws Exception {
        Path executable = tempDir.resolve("fake-node.sh");
        Files.writeString(executable, "#!/bin/sh\n" + script);
        assertTrue(executable.toFile().setExecutable(true));
        return new NodeSyntaxChecker(new VibeForgeSettings(tempDir.toString(), 1024 * 1024, 3, 120,
                true, executable.toString()));
    }

    @Test
    void testFailingCheckReportsErrorLine() throws Exception {
        NodeSyntaxChecker checker = checkerRunning(
                "echo \"$2:2\"\n"
                + "echo \"  return (1;\"\n"
                + "echo \"SyntaxError: Unexpected token ';'\"\n"
                + "exit 1\n");

        Optional<String> fault = checker.check("export default function W() { return (1; }");

        assertEquals(Optional.of("SyntaxError: Unexpected token ';'"), fault);
    }

    @Test
    void testLargeOutputIsReadCompletely() throws Exception {
        NodeSyntaxChecker checker = checkerRunning(
                "i=0\n"
                + "while [ $i -lt 5000 ]; do echo \"padding line $i\"; i=$((i+1)); done\n"
                + "echo \"ReferenceError: chart is not defined\"\n"
                + "exit 1\n");

        Optional<String> fault = checker.check("chart.draw();");

        assertEquals(Optional.of("ReferenceError: chart is not defined"), fault);
    }

    @Test
    void testPassingCheckIsNoFinding() throws Exception {
        NodeSyntaxChecker checker = checkerRunning("exit 0\n");

        assertTrue(checker.check("export default function W() { return 1; }").isEmpty());
    }
}
