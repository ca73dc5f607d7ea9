package com.incidents.adapter.model;

public record Coordinates(double lat, double lon) {
}
