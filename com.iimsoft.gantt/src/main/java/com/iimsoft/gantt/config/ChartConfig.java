package com.iimsoft.gantt.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chart rendering options.
 *
 * 配置来源（优先级从高到低）：
 * 1) 命令行参数（见 GanttChartApp）
 * 2) JVM 参数：-Dgantt.config=JSON，例如 {"titleWidth":250,"addResourceTable":true}
 * 3) 默认值：titleWidth=210, maxMonthWidth=80, addResourceTable=false
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ChartConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChartConfig.class);

    /** JVM 参数 key */
    public static final String CONFIG_JSON_PROPERTY = "gantt.config";

    public static final double DEFAULT_TITLE_WIDTH = 210.0;
    public static final double DEFAULT_MAX_MONTH_WIDTH = 80.0;

    /** Width of the item title column */
    @JsonProperty("titleWidth")
    private double titleWidth = DEFAULT_TITLE_WIDTH;

    /** Width of a 31 day month; shorter months are proportionally narrower */
    @JsonProperty("maxMonthWidth")
    private double maxMonthWidth = DEFAULT_MAX_MONTH_WIDTH;

    /** Add a resource table at the bottom of the chart */
    @JsonProperty("addResourceTable")
    private boolean addResourceTable;

    public ChartConfig() {
    }

    public ChartConfig(double titleWidth, double maxMonthWidth, boolean addResourceTable) {
        this.titleWidth = titleWidth;
        this.maxMonthWidth = maxMonthWidth;
        this.addResourceTable = addResourceTable;
    }

    public static ChartConfig defaults() {
        return new ChartConfig();
    }

    /**
     * Reads {@value #CONFIG_JSON_PROPERTY} from the system properties. A missing property yields
     * the defaults; an unparseable one is logged and also yields the defaults.
     */
    public static ChartConfig fromSystemProperties() {
        String json = System.getProperty(CONFIG_JSON_PROPERTY);
        if (json == null || json.isBlank()) {
            return defaults();
        }
        try {
            return new ObjectMapper().readValue(json, ChartConfig.class).validate();
        } catch (Exception e) {
            // -Dgantt.config 解析或校验失败：记一条警告，忽略该属性
            LOGGER.warn("Ignoring invalid -D{}: {}", CONFIG_JSON_PROPERTY, e.getMessage());
            return defaults();
        }
    }

    public ChartConfig validate() {
        if (titleWidth < 0 || Double.isNaN(titleWidth)) {
            throw new IllegalArgumentException("titleWidth must be non-negative: " + titleWidth);
        }
        if (maxMonthWidth < 0 || Double.isNaN(maxMonthWidth)) {
            throw new IllegalArgumentException("maxMonthWidth must be non-negative: " + maxMonthWidth);
        }
        return this;
    }

    public double getTitleWidth() {
        return titleWidth;
    }

    public void setTitleWidth(double titleWidth) {
        this.titleWidth = titleWidth;
    }

    public double getMaxMonthWidth() {
        return maxMonthWidth;
    }

    public void setMaxMonthWidth(double maxMonthWidth) {
        this.maxMonthWidth = maxMonthWidth;
    }

    public boolean isAddResourceTable() {
        return addResourceTable;
    }

    public void setAddResourceTable(boolean addResourceTable) {
        this.addResourceTable = addResourceTable;
    }

    @Override
    public String toString() {
        return "ChartConfig{titleWidth=" + titleWidth + ", maxMonthWidth=" + maxMonthWidth
                + ", addResourceTable=" + addResourceTable + '}';
    }
}
