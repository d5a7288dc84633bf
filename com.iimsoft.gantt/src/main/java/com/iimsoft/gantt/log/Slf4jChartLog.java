package com.iimsoft.gantt.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChartLog} backed by an SLF4J logger: output -> INFO, warning -> WARN, error -> ERROR.
 */
public class Slf4jChartLog implements ChartLog {

    private final Logger logger;

    public Slf4jChartLog(Class<?> owner) {
        this.logger = LoggerFactory.getLogger(owner);
    }

    @Override
    public void output(String format, Object... args) {
        logger.info(format, args);
    }

    @Override
    public void warning(String format, Object... args) {
        logger.warn(format, args);
    }

    @Override
    public void error(String format, Object... args) {
        logger.error(format, args);
    }
}
