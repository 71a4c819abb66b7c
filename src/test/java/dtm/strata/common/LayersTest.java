package dtm.strata.common;

import dtm.strata.core.DependencyContainer;
import dtm.strata.core.Layer;
import dtm.strata.prototypes.LayerFactory;
import dtm.strata.prototypes.Tag;
import dtm.strata.storage.containers.DependencyContainerStorage;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LayersTest {

    private final Tag<String> host = Tag.of("host");
    private final Tag<Integer> port = Tag.of("port");
    private final Tag<String> address = Tag.of("address");

    @Test
    void valueLayerProvidesTheConstant() {
        Layer layer = Layers.value(port, 5432);

        assertTrue(layer.getRequires().isEmpty());
        assertEquals(Set.of(port), layer.getProvides());
        assertEquals(5432, layer.apply(DependencyContainerStorage.create()).get(port));
    }

    @Test
    void valueLayerRejectsNullConstant() {
        assertThrows(NullPointerException.class, () -> Layers.value(host, null));
    }

    @Test
    void mergeCombinesEveryLayer() {
        Layer addressLayer = Layers.define()
                .requires(host, port)
                .provides(address)
                .register(c -> c.register(address, g -> g.get(host) + ":" + g.get(port)));

        Layer merged = Layers.merge(Layers.value(host, "localhost"), Layers.value(port, 5432), Layers.empty());
        DependencyContainer container = merged.to(addressLayer).apply(DependencyContainerStorage.create());

        assertEquals(Set.of(host, port), merged.getProvides());
        assertEquals("localhost:5432", container.get(address));
    }

    @Test
    void emptyLayerLeavesTheContainerUnchanged() {
        DependencyContainer container = DependencyContainerStorage.create();

        assertSame(container, Layers.empty().apply(container));
        assertTrue(Layers.empty().isComplete());
        assertTrue(Layers.empty().getProvides().isEmpty());
    }

    @Test
    void unnamedLayersGetGeneratedNames() {
        Layer first = Layers.define().register(c -> c);
        Layer second = Layers.define().register(c -> c);

        assertTrue(first.getName().startsWith("layer#"));
        assertNotEquals(first.getName(), second.getName());
    }

    @Test
    void layerFactoryBuildsLayersFromParameters() {
        LayerFactory<Map<String, String>> config = Layers.define()
                .named("config")
                .provides(host)
                .factory((container, env) -> container.register(host, c -> env.get("HOST")));

        Layer production = config.create(Map.of("HOST", "db.internal"));
        Layer local = config.create(Map.of("HOST", "localhost"));

        assertEquals("config", production.getName());
        assertEquals(Set.of(host), local.getProvides());
        assertEquals("db.internal", production.apply(DependencyContainerStorage.create()).get(host));
        assertEquals("localhost", local.apply(DependencyContainerStorage.create()).get(host));
    }
}
