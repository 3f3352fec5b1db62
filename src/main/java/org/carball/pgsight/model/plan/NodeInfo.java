package org.carball.pgsight.model.plan;

/**
 * Static rendering hint for a node type.
 */
public record NodeInfo(String color, String description) {}
