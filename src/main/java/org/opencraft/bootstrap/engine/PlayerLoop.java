package org.opencraft.bootstrap.engine;

import com.typesafe.config.Config;
import org.opencraft.bootstrap.spi.IExecutionLoop;
import org.opencraft.bootstrap.world.World;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * An in-process execution loop that ticks every registered world at a fixed rate on one thread.
 * Worlds registered while the loop runs join on the next frame.
 */
public final class PlayerLoop implements IExecutionLoop {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlayerLoop.class);
    private static final String TICK_RATE_CONFIG_PATH = "engine.tick-rate-hz";
    private static final int DEFAULT_TICK_RATE_HZ = 30;

    private final List<World> worlds = new CopyOnWriteArrayList<>();
    private final int tickRateHz;
    private ScheduledExecutorService scheduler;

    public PlayerLoop(final int tickRateHz) {
        if (tickRateHz <= 0) {
            throw new IllegalArgumentException("tickRateHz must be positive, was " + tickRateHz);
        }
        this.tickRateHz = tickRateHz;
    }

    public static PlayerLoop fromConfig(final Config config) {
        return new PlayerLoop(config.hasPath(TICK_RATE_CONFIG_PATH)
            ? config.getInt(TICK_RATE_CONFIG_PATH)
            : DEFAULT_TICK_RATE_HZ);
    }

    @Override
    public synchronized void register(final World world) {
        if (worlds.contains(world)) {
            throw new IllegalStateException("World " + world + " is already part of the player loop");
        }
        worlds.add(world);
        LOGGER.debug("Appended {} to the player loop", world);
    }

    /**
     * Starts ticking. Does nothing if the loop is already running.
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread thread = new Thread(r, "player-loop");
            thread.setDaemon(true);
            return thread;
        });
        final long periodMicros = TimeUnit.SECONDS.toMicros(1) / tickRateHz;
        scheduler.scheduleAtFixedRate(this::tickAll, 0, periodMicros, TimeUnit.MICROSECONDS);
        LOGGER.info("Player loop started at {} Hz with {} world(s).", tickRateHz, worlds.size());
    }

    /**
     * Stops ticking and waits for the current frame to finish.
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warn("Player loop did not stop within 5 seconds, forcing shutdown.");
                scheduler.shutdownNow();
            }
        } catch (final InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        LOGGER.info("Player loop stopped.");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    public List<World> getWorlds() {
        return new ArrayList<>(worlds);
    }

    private void tickAll() {
        for (final World world : worlds) {
            try {
                world.tick();
            } catch (final RuntimeException e) {
                LOGGER.error("Error while ticking {}", world, e);
            }
        }
    }
}
