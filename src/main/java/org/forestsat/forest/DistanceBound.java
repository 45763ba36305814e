package org.forestsat.forest;

/**
 * Richiesta di distanza minima dalla radice: dist(node) ≥ minDistance.
 */
public record DistanceBound(String node, int minDistance) {
}
