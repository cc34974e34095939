package org.archivum.retention.model;

import org.archivum.retention.enums.ScheduleFrequency;
import org.archivum.retention.exception.ConfigurationException;

import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

public record ExecutionSchedule(ScheduleFrequency frequency, String time) {

    private static final DateTimeFormatter HOUR_MINUTE = DateTimeFormatter.ofPattern("H:mm");

    public static ExecutionSchedule dailyAt(String time) {
        return new ExecutionSchedule(ScheduleFrequency.DAILY, time);
    }

    public static ExecutionSchedule defaultSchedule() {
        return dailyAt("02:00");
    }

    public ScheduleFrequency frequencyOrDefault() {
        return frequency != null ? frequency : ScheduleFrequency.DAILY;
    }

    public LocalTime localTime() {
        if (time == null || time.isBlank()) {
            return LocalTime.of(2, 0);
        }
        try {
            return LocalTime.parse(time.trim(), HOUR_MINUTE);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid execution time '" + time + "', expected HH:mm");
        }
    }
}
