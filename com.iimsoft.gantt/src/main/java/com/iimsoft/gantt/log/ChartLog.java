package com.iimsoft.gantt.log;

/**
 * Output sink used by the chart pipeline. Messages use SLF4J style {@code {}} placeholders.
 */
public interface ChartLog {

    void output(String format, Object... args);

    void warning(String format, Object... args);

    void error(String format, Object... args);
}
