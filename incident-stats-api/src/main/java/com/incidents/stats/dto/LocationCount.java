package com.incidents.stats.dto;

public record LocationCount(String label, long count) {
}
