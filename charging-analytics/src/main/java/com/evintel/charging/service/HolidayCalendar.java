package com.evintel.charging.service;

import java.time.LocalDate;

/**
 * Holiday lookup supplied from outside the pipeline.
 */
public interface HolidayCalendar {

    boolean isHoliday(LocalDate date);
}
