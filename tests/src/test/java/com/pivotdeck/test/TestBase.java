package com.pivotdeck.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for engine tests: logs test boundaries and numbered steps.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;
    private int step;

    @BeforeEach
    void logTestStart(TestInfo testInfo) {
        testName = testInfo.getDisplayName();
        step = 0;
        logger.debug("Starting test: {}", testName);
    }

    @AfterEach
    void logTestEnd() {
        logger.debug("Finished test: {} ({} steps)", testName, step);
    }

    /**
     * Logs a numbered step of the current test.
     *
     * @param description what the step does
     */
    protected void logStep(String description) {
        step++;
        logger.debug("[{}] Step {}: {}", testName, step, description);
    }
}
