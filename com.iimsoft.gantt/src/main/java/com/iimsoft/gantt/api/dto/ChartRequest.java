package com.iimsoft.gantt.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class ChartRequest {

    public String title;

    /** 可选：标记日期（画一条竖虚线） */
    public String markedDate; // YYYY-MM-DD

    /** 资源名称，下标即 resource id */
    public List<String> resources;

    public List<ItemDto> items;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ItemDto {
        public String title;

        /** 工期（天）；为空表示里程碑 */
        public Integer duration;

        /** 下标引用 resources；为空则沿用上一项 */
        public Integer resource;

        public String startDate; // YYYY-MM-DDTHH:mm[:ss] 或 YYYY-MM-DD

        /** startDate 的替代写法：Unix 毫秒（UTC） */
        public Long startMs;

        public Boolean open;

        public ItemDto() {
        }

        public ItemDto(String title, Integer duration, Integer resource, String startDate) {
            this.title = title;
            this.duration = duration;
            this.resource = resource;
            this.startDate = startDate;
        }
    }
}
