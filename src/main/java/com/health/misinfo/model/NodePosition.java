package com.health.misinfo.model;

public record NodePosition(double x, double y) {

    public static final NodePosition ORIGIN = new NodePosition(0.0, 0.0);
}
