package com.aerostar.core.model;

public record GeoLocation(String country, String continent, String region) {
}
