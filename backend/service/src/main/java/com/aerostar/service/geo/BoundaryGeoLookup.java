package com.aerostar.service.geo;

import com.aerostar.core.model.GeoLocation;
import com.aerostar.core.util.JsonUtils;
import com.aerostar.transform.site.GeoLookup;
import com.fasterxml.jackson.databind.JsonNode;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.index.strtree.STRtree;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Point-in-polygon lookup against a GeoJSON FeatureCollection of country boundaries
 * (for example Natural Earth admin-0 countries). Features carry {@code ADMIN},
 * {@code CONTINENT} and {@code REGION_UN} properties.
 *
 * <p>A boundary that strictly contains the point wins; otherwise the first boundary touching
 * the point is used, so sites on a border or coastline still resolve.
 */
public final class BoundaryGeoLookup implements GeoLookup {
    private static final Logger LOGGER = Logger.getLogger(BoundaryGeoLookup.class.getName());
    private static final int WGS84 = 4326;

    private final GeometryFactory geometryFactory;
    private final STRtree index = new STRtree();
    private final int boundaryCount;

    BoundaryGeoLookup(GeometryFactory geometryFactory, List<CountryBoundary> boundaries) {
        this.geometryFactory = geometryFactory;
        for (CountryBoundary boundary : boundaries) {
            index.insert(boundary.geometry().getEnvelopeInternal(), boundary);
        }
        index.build();
        this.boundaryCount = boundaries.size();
    }

    public static BoundaryGeoLookup load(Path file) {
        GeometryFactory factory = new GeometryFactory(new PrecisionModel(), WGS84);
        try (InputStream in = Files.newInputStream(file)) {
            JsonNode root = JsonUtils.objectMapper().readTree(in);
            JsonNode features = root.path("features");
            if (!features.isArray()) {
                throw new IllegalStateException("Boundary file " + file + " is not a GeoJSON FeatureCollection");
            }
            List<CountryBoundary> boundaries = new ArrayList<>();
            for (JsonNode feature : features) {
                Optional<Geometry> geometry = toGeometry(factory, feature.path("geometry"));
                if (geometry.isEmpty()) {
                    continue;
                }
                boundaries.add(new CountryBoundary(boundaries.size(), location(feature.path("properties")), geometry.get()));
            }
            LOGGER.info("Loaded " + boundaries.size() + " boundaries from " + file);
            return new BoundaryGeoLookup(factory, boundaries);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read boundary file " + file, e);
        }
    }

    public int boundaryCount() {
        return boundaryCount;
    }

    @Override
    public Optional<GeoLocation> locate(double latitude, double longitude) {
        Point point = geometryFactory.createPoint(new Coordinate(longitude, latitude));
        List<CountryBoundary> candidates = candidates(point);
        for (CountryBoundary candidate : candidates) {
            if (candidate.geometry().contains(point)) {
                return Optional.of(candidate.location());
            }
        }
        for (CountryBoundary candidate : candidates) {
            if (candidate.geometry().intersects(point)) {
                return Optional.of(candidate.location());
            }
        }
        return Optional.empty();
    }

    @SuppressWarnings("unchecked")
    private List<CountryBoundary> candidates(Point point) {
        List<CountryBoundary> hits = new ArrayList<>((List<CountryBoundary>) index.query(point.getEnvelopeInternal()));
        hits.sort(Comparator.comparingInt(CountryBoundary::order));
        return hits;
    }

    private static GeoLocation location(JsonNode properties) {
        return new GeoLocation(
                text(properties, "ADMIN", "NAME"),
                text(properties, "CONTINENT"),
                text(properties, "REGION_UN", "SUBREGION")
        );
    }

    private static String text(JsonNode properties, String... fields) {
        for (String field : fields) {
            JsonNode value = properties.path(field);
            if (value.isTextual() && !value.asText().isBlank()) {
                return value.asText().trim();
            }
        }
        return null;
    }

    static Optional<Geometry> toGeometry(GeometryFactory factory, JsonNode geometry) {
        String type = geometry.path("type").asText("");
        JsonNode coordinates = geometry.path("coordinates");
        switch (type) {
            case "Polygon":
                return Optional.of(polygon(factory, coordinates));
            case "MultiPolygon":
                List<Polygon> polygons = new ArrayList<>();
                for (JsonNode polygon : coordinates) {
                    polygons.add(polygon(factory, polygon));
                }
                return Optional.of(factory.createMultiPolygon(polygons.toArray(Polygon[]::new)));
            default:
                LOGGER.fine("Skipping boundary feature with geometry type '" + type + "'");
                return Optional.empty();
        }
    }

    private static Polygon polygon(GeometryFactory factory, JsonNode rings) {
        if (!rings.isArray() || rings.isEmpty()) {
            throw new IllegalStateException("Polygon without rings in boundary file");
        }
        LinearRing shell = ring(factory, rings.get(0));
        LinearRing[] holes = new LinearRing[rings.size() - 1];
        for (int i = 1; i < rings.size(); i++) {
            holes[i - 1] = ring(factory, rings.get(i));
        }
        return factory.createPolygon(shell, holes);
    }

    private static LinearRing ring(GeometryFactory factory, JsonNode positions) {
        List<Coordinate> coordinates = new ArrayList<>(positions.size() + 1);
        for (JsonNode position : positions) {
            coordinates.add(new Coordinate(position.get(0).asDouble(), position.get(1).asDouble()));
        }
        if (!coordinates.isEmpty() && !coordinates.get(0).equals2D(coordinates.get(coordinates.size() - 1))) {
            coordinates.add(new Coordinate(coordinates.get(0)));
        }
        return factory.createLinearRing(coordinates.toArray(Coordinate[]::new));
    }
}
