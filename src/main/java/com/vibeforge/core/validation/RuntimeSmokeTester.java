package com.vibeforge.core.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * RuntimeSmokeTester: best-effort load-time check of a module in isolation.
 *
 * Always runs the lexical {@link SyntaxScanner}; additionally asks
 * {@link NodeSyntaxChecker} when it is enabled and the lexical pass was clean.
 */
@Component
public class RuntimeSmokeTester {

    private static final Logger log = LoggerFactory.getLogger(RuntimeSmokeTester.class);

    private final NodeSyntaxChecker nodeChecker;

    public RuntimeSmokeTester(NodeSyntaxChecker nodeChecker) {
        this.nodeChecker = nodeChecker;
    }

    public SmokeTestResult test(String code) {
        List<String> issues = new ArrayList<>();

        Optional<String> lexical = SyntaxScanner.firstFault(code);
        lexical.ifPresent(issues::add);

        if (lexical.isEmpty() && nodeChecker.isEnabled()) {
            nodeChecker.check(code).ifPresent(issues::add);
        }

        if (issues.isEmpty()) {
            return SmokeTestResult.passed();
        }
        log.info("[SmokeTest] {}", issues.get(0));
        return SmokeTestResult.failed(issues);
    }
}
