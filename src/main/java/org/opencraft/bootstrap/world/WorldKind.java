package org.opencraft.bootstrap.world;

import org.opencraft.bootstrap.catalog.SimulationKind;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * The role a world plays. Determines which simulation kinds its catalog is drawn from.
 */
public enum WorldKind {

    GAME_CLIENT(EnumSet.of(SimulationKind.CLIENT_SIMULATION, SimulationKind.PRESENTATION)),
    GAME_SERVER(EnumSet.of(SimulationKind.SERVER_SIMULATION)),
    GAME_THIN_CLIENT(EnumSet.of(SimulationKind.THIN_CLIENT_SIMULATION)),
    DEPLOYMENT_CLIENT(EnumSet.of(SimulationKind.CLIENT_SIMULATION)),
    DEPLOYMENT_SERVER(EnumSet.of(SimulationKind.SERVER_SIMULATION)),
    /** A plain world with a hand-picked system list, used for streamed guests. */
    GAME(EnumSet.noneOf(SimulationKind.class));

    private final Set<SimulationKind> simulationKinds;

    WorldKind(final EnumSet<SimulationKind> simulationKinds) {
        this.simulationKinds = Collections.unmodifiableSet(simulationKinds);
    }

    public Set<SimulationKind> simulationKinds() {
        return simulationKinds;
    }
}
