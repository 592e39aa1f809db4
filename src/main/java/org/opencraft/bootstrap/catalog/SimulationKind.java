package org.opencraft.bootstrap.catalog;

/**
 * Simulation groups a system can belong to. The engine selects catalogs by these kinds.
 */
public enum SimulationKind {
    CLIENT_SIMULATION,
    THIN_CLIENT_SIMULATION,
    SERVER_SIMULATION,
    PRESENTATION
}
