package com.address.resolution.domain.service;

import com.address.resolution.domain.model.GeoPoint;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Reads the point format location records are stored in.
 *
 * Two shapes are accepted, both longitude first:
 * - a bare array: {@code [-74.006, 40.7128]}
 * - a GeoJSON-style object: {@code {"type": "Point", "coordinates": [-74.006, 40.7128]}}
 */
@Service
public class StoredLocationDecoder {

    private static final Logger logger = LoggerFactory.getLogger(StoredLocationDecoder.class);

    private final ObjectMapper objectMapper;

    public StoredLocationDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decode a stored point.
     *
     * @param storedPoint Array or object node, may be null
     * @return Point when the node has a usable, in-range coordinate pair
     */
    public Optional<GeoPoint> decode(JsonNode storedPoint) {
        if (storedPoint == null || storedPoint.isNull() || storedPoint.isMissingNode()) {
            return Optional.empty();
        }

        JsonNode pair = storedPoint.isObject() ? storedPoint.get("coordinates") : storedPoint;
        if (pair == null || !pair.isArray() || pair.size() < 2
                || !pair.get(0).isNumber() || !pair.get(1).isNumber()) {
            logger.debug("Stored point has no [lng, lat] pair: {}", storedPoint);
            return Optional.empty();
        }

        double lng = pair.get(0).asDouble();
        double lat = pair.get(1).asDouble();
        if (!CoordinateValidator.validate(lat, lng)) {
            logger.debug("Stored point out of range: lat={}, lng={}", lat, lng);
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(lat, lng));
    }

    /**
     * Encode a point in the stored {@code [lng, lat]} order.
     */
    public ArrayNode encode(GeoPoint point) {
        if (!CoordinateValidator.validate(point)) {
            throw new IllegalArgumentException("Cannot store an invalid point: " + point);
        }
        ArrayNode pair = objectMapper.createArrayNode();
        pair.add(point.getLng());
        pair.add(point.getLat());
        return pair;
    }
}
