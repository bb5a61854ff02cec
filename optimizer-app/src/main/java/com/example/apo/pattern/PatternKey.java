package com.example.apo.pattern;

import com.example.apo.geo.Coordinate;

/** Identity of a {@link Pattern}: exact location plus model id. */
public record PatternKey(Coordinate location, String modelId) {}
