package com.health.misinfo.model;

/**
 * Subgraph kept by a minimum-connections filter, with the statistics computed on it.
 */
public record FilteredNetwork(int minConnections, InteractionGraph graph, NetworkStatistics statistics) {}
