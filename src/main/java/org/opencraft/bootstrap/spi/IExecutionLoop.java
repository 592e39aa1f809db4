package org.opencraft.bootstrap.spi;

import org.opencraft.bootstrap.world.World;

/**
 * The engine's global execution loop. Every world is registered with it exactly once and is ticked
 * by it from then on.
 */
public interface IExecutionLoop {

    /**
     * Appends a world to the loop.
     *
     * @param world The world to tick.
     * @throws IllegalStateException if the world is already registered or the engine cannot accept it.
     */
    void register(World world);
}
