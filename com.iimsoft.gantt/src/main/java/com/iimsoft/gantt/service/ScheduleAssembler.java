package com.iimsoft.gantt.service;

import com.iimsoft.gantt.api.dto.ChartRequest;
import com.iimsoft.gantt.domain.Schedule;
import com.iimsoft.gantt.domain.ScheduleItem;
import com.iimsoft.gantt.layout.ChartLayoutEngine;
import com.iimsoft.gantt.log.ChartLog;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * DTO -> domain. Only checks the shape of the document (required fields, date formats); the
 * scheduling rules are checked by the layout engine.
 */
public class ScheduleAssembler {

    private final ChartLog log;

    public ScheduleAssembler(ChartLog log) {
        this.log = Objects.requireNonNull(log, "log");
    }

    public Schedule assemble(ChartRequest request) {
        Objects.requireNonNull(request, "request");
        if (request.title == null) {
            throw new IllegalArgumentException("chart.title is required");
        }
        if (request.items == null) {
            throw new IllegalArgumentException("chart.items is required");
        }

        LocalDate markedDate = null;
        if (request.markedDate != null && !request.markedDate.isBlank()) {
            markedDate = parseDate(request.markedDate.trim(), "chart.markedDate");
        }

        List<String> resources = request.resources == null ? List.of() : request.resources;
        for (int i = 0; i < resources.size(); i++) {
            if (resources.get(i) == null) {
                throw new IllegalArgumentException("chart.resources[" + i + "] must not be null");
            }
        }

        List<ScheduleItem> items = new ArrayList<>(request.items.size());
        for (int i = 0; i < request.items.size(); i++) {
            items.add(toItem(request.items.get(i), i));
        }
        return new Schedule(request.title, markedDate, resources, items);
    }

    private ScheduleItem toItem(ChartRequest.ItemDto dto, int index) {
        String path = "chart.items[" + index + "]";
        if (dto == null) {
            throw new IllegalArgumentException(path + " must not be null");
        }
        if (dto.title == null) {
            throw new IllegalArgumentException(path + ".title is required");
        }
        if (dto.duration != null && dto.duration < 0) {
            throw new IllegalArgumentException(path + ".duration must be >= 0: " + dto.duration);
        }
        if (dto.duration != null && dto.duration > ChartLayoutEngine.MAX_DURATION_DAYS) {
            throw new IllegalArgumentException(path + ".duration must be <= "
                    + ChartLayoutEngine.MAX_DURATION_DAYS + ": " + dto.duration);
        }

        LocalDateTime start = null;
        if (dto.startDate != null && !dto.startDate.isBlank()) {
            start = parseDateTime(dto.startDate.trim(), path + ".startDate");
            if (dto.startMs != null) {
                log.warning("{} ('{}') has both startDate and startMs, using startDate", path, dto.title);
            }
        } else if (dto.startMs != null) {
            start = LocalDateTime.ofInstant(Instant.ofEpochMilli(dto.startMs), ZoneOffset.UTC);
        }

        boolean open = dto.open != null && dto.open;
        return new ScheduleItem(dto.title, dto.duration, start, dto.resource, open);
    }

    static LocalDate parseDate(String text, String path) {
        try {
            return LocalDate.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(path + " is not a date (yyyy-MM-dd): '" + text + "'", e);
        }
    }

    /** Accepts an ISO local date-time, or a plain date meaning midnight. */
    static LocalDateTime parseDateTime(String text, String path) {
        try {
            if (text.indexOf('T') < 0) {
                return LocalDate.parse(text).atStartOfDay();
            }
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(path + " is not a date-time (yyyy-MM-ddTHH:mm:ss): '" + text + "'", e);
        }
    }
}
