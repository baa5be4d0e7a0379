package com.aerostar.service.geo;

import com.aerostar.core.model.GeoLocation;
import org.locationtech.jts.geom.Geometry;

record CountryBoundary(int order, GeoLocation location, Geometry geometry) {
}
