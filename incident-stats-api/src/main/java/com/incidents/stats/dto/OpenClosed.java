package com.incidents.stats.dto;

public record OpenClosed(long open, long closed) {
}
