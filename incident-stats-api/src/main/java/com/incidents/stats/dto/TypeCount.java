package com.incidents.stats.dto;

public record TypeCount(String type, long count) {
}
