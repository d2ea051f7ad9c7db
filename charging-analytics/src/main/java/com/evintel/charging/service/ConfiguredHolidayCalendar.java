package com.evintel.charging.service;

import com.evintel.charging.config.ChargingAnalyticsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.MonthDay;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holiday calendar backed by configuration: recurring MM-dd dates plus one-off dates.
 *
 * Default recurring set: New Year's Day, Independence Day, Christmas.
 * Replace this bean to plug in a real calendar service.
 */
@Component
@Slf4j
public class ConfiguredHolidayCalendar implements HolidayCalendar {

    private static final DateTimeFormatter MONTH_DAY = DateTimeFormatter.ofPattern("MM-dd");

    private final Set<MonthDay> recurring;
    private final Set<LocalDate> oneOff;

    @Autowired
    public ConfiguredHolidayCalendar(ChargingAnalyticsProperties properties) {
        this(properties.getHolidays().getFixedDates(), properties.getHolidays().getExtraDates());
    }

    ConfiguredHolidayCalendar(List<String> fixedDates, List<String> extraDates) {
        this.recurring = fixedDates.stream()
                .map(d -> MonthDay.parse(d.trim(), MONTH_DAY))
                .collect(Collectors.toUnmodifiableSet());
        this.oneOff = extraDates.stream()
                .map(d -> LocalDate.parse(d.trim()))
                .collect(Collectors.toUnmodifiableSet());
        log.info("Holiday calendar: {} recurring, {} one-off dates", recurring.size(), oneOff.size());
    }

    @Override
    public boolean isHoliday(LocalDate date) {
        return oneOff.contains(date) || recurring.contains(MonthDay.from(date));
    }
}
