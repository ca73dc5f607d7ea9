package com.incidents.stats.dto;

import java.time.LocalDate;

public record DayCount(LocalDate day, long count) {
}
