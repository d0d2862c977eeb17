package com.health.misinfo.model;

/**
 * Histogram bucket covering [lowerBound, upperBound); the last bucket also includes 100.
 */
public record ScoreBucket(double lowerBound, double upperBound, int posts) {}
