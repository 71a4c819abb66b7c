package dtm.strata.storage.layer;

import dtm.strata.common.Layers;
import dtm.strata.common.Services;
import dtm.strata.core.Layer;
import dtm.strata.exceptions.UnsatisfiedLayerException;
import dtm.strata.prototypes.ServiceTag;
import dtm.strata.prototypes.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LayerVerifierTest {

    private final Tag<String> url = Tag.of("url");
    private final ServiceTag<StringBuilder> database = Tag.service("database", StringBuilder.class, url);
    private final ServiceTag<String> cache = Tag.service("cache", String.class);
    private final ServiceTag<Object> repository = Tag.service("repository", Object.class, database);
    private final ServiceTag<Object> userService = Tag.service("userService", Object.class, repository, cache);

    @Test
    void groupsProvidedTagsByDepth() {
        Layer layer = Layers.value(url, "jdbc")
                .to(Services.service(database, c -> new StringBuilder(c.get(url))))
                .to(Services.service(cache, c -> "cache"))
                .to(Services.service(repository, c -> c.get(database).toString()))
                .to(Services.service(userService, c -> List.of(c.get(repository), c.get(cache))));

        List<Set<Tag<?>>> layers = layer.verify();

        assertEquals(4, layers.size());
        assertEquals(Set.of(url, cache), layers.get(0));
        assertEquals(Set.of(database), layers.get(1));
        assertEquals(Set.of(repository), layers.get(2));
        assertEquals(Set.of(userService), layers.get(3));
    }

    @Test
    void requirementsAreNotPartOfTheGroups() {
        Layer layer = Services.service(repository, c -> c.get(database).toString());

        List<Set<Tag<?>>> layers = new LayerVerifier(layer).resolveLayers();

        assertEquals(List.of(Set.of(repository)), layers);
    }

    @Test
    void emptyLayerHasNoGroups() {
        assertTrue(Layers.empty().verify().isEmpty());
    }

    @Test
    void serviceDependenciesMustBeDeclared() {
        Layer undeclared = Layers.define()
                .named("undeclared")
                .provides(repository)
                .register(c -> c.register(repository, g -> g.get(database).toString()));

        UnsatisfiedLayerException exception = assertThrows(UnsatisfiedLayerException.class, undeclared::verify);

        assertEquals("undeclared", exception.getLayerName());
        assertEquals(Set.of(database), exception.getTags());
    }
}
