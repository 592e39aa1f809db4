package org.opencraft.bootstrap.world;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.opencraft.bootstrap.BootstrapContext;
import org.opencraft.bootstrap.catalog.BuiltinSystem;
import org.opencraft.bootstrap.catalog.SimulationKind;
import org.opencraft.bootstrap.catalog.SystemCatalogEntry;
import org.opencraft.bootstrap.catalog.SystemOrigin;
import org.opencraft.bootstrap.net.EndpointBuilder;
import org.opencraft.bootstrap.spi.IExecutionLoop;
import org.opencraft.config.BuildTarget;
import org.opencraft.junit.extensions.logging.LogWatchExtension;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.opencraft.bootstrap.BootstrapFixtures.referenceCatalog;
import static org.opencraft.bootstrap.BootstrapFixtures.resolved;

@Tag("unit")
@ExtendWith({MockitoExtension.class, LogWatchExtension.class})
class WorldFactoryTest {

    @Mock
    private IExecutionLoop loop;

    @Test
    @DisplayName("Should build the client world without generic systems and with presentation systems")
    void createClientWorld_shouldFilterAndSortCatalog() throws Exception {
        final BootstrapContext context = context("");
        final WorldFactory factory = new WorldFactory(context, referenceCatalog(), loop);

        final World world = factory.createClientWorld(true);

        assertThat(world.getName()).isEqualTo(WorldFactory.CLIENT_WORLD_NAME);
        assertThat(world.getKind()).isEqualTo(WorldKind.GAME_CLIENT);
        assertThat(world.getSystemIds()).containsExactlyInAnyOrder(
            "entities.scene-system",
            "entities.transform-system-group",
            "graphics.entities-graphics",
            "netcode.network-stream-receive",
            "netcode.ghost-receive",
            "netcode.command-send",
            "opencraft.player-input",
            "opencraft.auto-connect");
        assertBefore(world, "netcode.command-send", "opencraft.player-input");
        assertBefore(world, "netcode.network-stream-receive", "opencraft.auto-connect");
        assertBefore(world, "entities.transform-system-group", "graphics.entities-graphics");
        assertThat(world.getEndpoint()).hasValue(context.getServerEndpoints().orElseThrow().connect());
        verify(loop).register(world);
    }

    @Test
    void createClientWorld_withoutAutoConnect_shouldOmitAutoConnect() throws Exception {
        final WorldFactory factory = new WorldFactory(context(""), referenceCatalog(), loop);

        assertThat(factory.createClientWorld(false).hasSystem(BuiltinSystem.AUTO_CONNECT)).isFalse();
    }

    @Test
    void createServerWorld_shouldListenOnWildcard() throws Exception {
        final BootstrapContext context = context("");
        final WorldFactory factory = new WorldFactory(context, referenceCatalog(), loop);

        final World world = factory.createServerWorld(false);

        assertThat(world.getName()).isEqualTo(WorldFactory.SERVER_WORLD_NAME);
        assertThat(world.getSystemIds()).contains("netcode.ghost-send", "opencraft.terrain-generation")
            .doesNotContain("netcode.configure-server-world", "graphics.entities-graphics", "opencraft.auto-connect");
        assertThat(world.getEndpoint().orElseThrow().isWildcard()).isTrue();
        assertThat(world.getEndpoint().orElseThrow().port()).isEqualTo(7979);
    }

    @Test
    void createStreamedClientWorld_shouldOnlyRunStreamingSystems() throws Exception {
        final WorldFactory factory = new WorldFactory(context(""), referenceCatalog(), loop);

        final World world = factory.createStreamedClientWorld(false);

        assertThat(world.getName()).isEqualTo(WorldFactory.STREAMED_CLIENT_WORLD_NAME);
        assertThat(world.getKind()).isEqualTo(WorldKind.GAME);
        assertThat(world.getSystemIds()).containsExactly("opencraft.multiplay-init", "opencraft.emulation-init");
        assertThat(world.getEndpoint()).isEmpty();
    }

    @Test
    void createStreamedClientWorld_withAutoConnect_shouldDialServer() throws Exception {
        final WorldFactory factory = new WorldFactory(context(""), referenceCatalog(), loop);

        final World world = factory.createStreamedClientWorld(true);

        assertThat(world.hasSystem(BuiltinSystem.AUTO_CONNECT)).isTrue();
        assertThat(world.getEndpoint()).isPresent();
    }

    @Test
    @DisplayName("Should create independent thin-client worlds sharing one system list")
    void createThinClientWorlds_shouldCreateRequestedNumber() throws Exception {
        final WorldFactory factory = new WorldFactory(context(""), referenceCatalog(), loop);

        final List<World> worlds = factory.createThinClientWorlds(3, true);

        assertThat(worlds).extracting(World::getName)
            .containsExactly("ThinClientWorld0", "ThinClientWorld1", "ThinClientWorld2");
        assertThat(worlds).extracting(World::getId).doesNotHaveDuplicates();
        assertThat(worlds).allSatisfy(world -> {
            assertThat(world.getKind()).isEqualTo(WorldKind.GAME_THIN_CLIENT);
            assertThat(world.getSystems()).isEqualTo(worlds.get(0).getSystems());
            assertThat(world.getSystemIds()).doesNotContain("netcode.configure-thin-client-world", "graphics.entities-graphics");
            assertThat(world.getSystemIds()).filteredOn("opencraft.auto-connect"::equals).hasSize(1);
        });
        verify(loop, times(3)).register(any());
    }

    @Test
    void createThinClientWorlds_zero_shouldCreateNothing() throws Exception {
        final WorldFactory factory = new WorldFactory(context(""), referenceCatalog(), loop);

        assertThat(factory.createThinClientWorlds(0, true)).isEmpty();
        verify(loop, never()).register(any());
    }

    @Test
    void planThinClientWorlds_negative_shouldFail() throws Exception {
        final WorldFactory factory = new WorldFactory(context(""), referenceCatalog(), loop);

        assertThatThrownBy(() -> factory.planThinClientWorlds(-1, false)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Only the first created world should become the default injection world")
    void createWorld_firstWorldShouldBecomeDefault() throws Exception {
        final BootstrapContext context = context("");
        final WorldFactory factory = new WorldFactory(context, referenceCatalog(), loop);

        final World first = factory.createServerWorld(false);
        final World second = factory.createClientWorld(false);

        assertThat(context.getDefaultWorld()).containsSame(first);
        assertThat(context.offerDefaultWorld(second)).isFalse();
    }

    @Test
    void createWorld_shouldCopySystemList() throws Exception {
        final WorldFactory factory = new WorldFactory(context(""), referenceCatalog(), loop);
        final SystemCatalogEntry entry = SystemCatalogEntry.of("custom", "Custom",
            EnumSet.of(SimulationKind.CLIENT_SIMULATION), SystemOrigin.APPLICATION, true, List.of());
        final List<SystemCatalogEntry> systems = new ArrayList<>(List.of(entry));

        final World world = factory.createWorld("Custom", WorldKind.GAME, systems);
        systems.clear();

        assertThat(world.getSystems()).containsExactly(entry);
        assertThatThrownBy(() -> world.getSystems().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void createWorld_rejectedByLoop_shouldPropagate() throws Exception {
        final BootstrapContext context = context("");
        final WorldFactory factory = new WorldFactory(context, referenceCatalog(), loop);
        doThrow(new IllegalStateException("already registered")).when(loop).register(any());

        assertThatThrownBy(() -> factory.createServerWorld(false)).isInstanceOf(IllegalStateException.class);
        assertThat(context.getDefaultWorld()).isEmpty();
    }

    @Test
    void serverBuild_shouldNotHostClientWorlds() throws Exception {
        final WorldFactory factory = new WorldFactory(context("bootstrap.build-target = SERVER"), referenceCatalog(), loop);

        assertThatThrownBy(() -> factory.createClientWorld(true))
            .isInstanceOf(RoleUnavailableException.class)
            .satisfies(e -> {
                assertThat(((RoleUnavailableException) e).getKind()).isEqualTo(WorldKind.GAME_CLIENT);
                assertThat(((RoleUnavailableException) e).getBuildTarget()).isEqualTo(BuildTarget.SERVER);
            });
        assertThatThrownBy(() -> factory.createThinClientWorlds(2, true)).isInstanceOf(RoleUnavailableException.class);
        assertThatThrownBy(() -> factory.createStreamedClientWorld(false)).isInstanceOf(RoleUnavailableException.class);
        assertThat(factory.createServerWorld(false).getKind()).isEqualTo(WorldKind.GAME_SERVER);
    }

    @Test
    void clientBuild_shouldNotHostServerWorld() throws Exception {
        final WorldFactory factory = new WorldFactory(context("bootstrap.build-target = CLIENT"), referenceCatalog(), loop);

        assertThatThrownBy(() -> factory.createServerWorld(false))
            .isInstanceOf(RoleUnavailableException.class)
            .hasMessage("A GAME_SERVER world cannot be created in a CLIENT build");
        verify(loop, never()).register(any());
    }

    private static BootstrapContext context(final String hocon) throws Exception {
        final BootstrapContext context = new BootstrapContext(resolved(hocon));
        context.setServerEndpoints(EndpointBuilder.build(context.getConfig().serverHost(), context.getConfig().serverPort()));
        return context;
    }

    private static void assertBefore(final World world, final String first, final String second) {
        final List<String> ids = world.getSystemIds();
        assertThat(ids.indexOf(first)).isLessThan(ids.indexOf(second));
    }
}
