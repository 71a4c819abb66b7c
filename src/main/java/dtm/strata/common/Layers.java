package dtm.strata.common;

import dtm.strata.core.DependencyContainer;
import dtm.strata.core.Layer;
import dtm.strata.prototypes.AsyncFactory;
import dtm.strata.prototypes.LayerFactory;
import dtm.strata.prototypes.LayerFunction;
import dtm.strata.prototypes.Tag;
import dtm.strata.storage.layer.LayerStorage;
import lombok.NonNull;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiFunction;

/**
 * Pontos de entrada para criar e combinar {@link Layer}s.
 * <pre>{@code
 * Layer config = Layers.define()
 *         .named("config")
 *         .provides(DATABASE_URL)
 *         .register(container -> container.register(DATABASE_URL, c -> System.getenv("DATABASE_URL")));
 * }</pre>
 */
public final class Layers {

    private static final AtomicLong LAYER_SEQUENCE = new AtomicLong();

    private Layers() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static LayerDefinition define(){
        return new LayerDefinition();
    }

    /**
     * Layer sem requisitos que registra um valor já existente sob o tag.
     * O valor não pode ser {@code null}.
     */
    public static <T> Layer value(@NonNull Tag<T> tag, @NonNull T value){
        return define()
                .named("value(" + tag.getId() + ")")
                .provides(tag)
                .register(container -> container.registerAsync(tag, AsyncFactory.constant(value)));
    }

    /**
     * Combina os layers em paralelo, aplicados na ordem informada.
     */
    public static Layer merge(@NonNull Layer first, @NonNull Layer second, Layer... rest){
        Layer merged = first.and(second);
        for (Layer layer : rest){
            merged = merged.and(layer);
        }
        return merged;
    }

    /**
     * Layer neutro: não exige nem fornece nada.
     */
    public static Layer empty(){
        return new LayerStorage("empty", Set.of(), Set.of(), container -> container);
    }

    private static String nextName(){
        return "layer#" + LAYER_SEQUENCE.incrementAndGet();
    }

    /**
     * Manifesto de um layer em construção.
     */
    public static final class LayerDefinition {
        private final Set<Tag<?>> requires = new LinkedHashSet<>();
        private final Set<Tag<?>> provides = new LinkedHashSet<>();
        private String name;

        private LayerDefinition() {
        }

        public LayerDefinition requires(Tag<?>... tags){
            requires.addAll(List.of(tags));
            return this;
        }

        public LayerDefinition provides(Tag<?>... tags){
            provides.addAll(List.of(tags));
            return this;
        }

        public LayerDefinition named(@NonNull String name){
            this.name = name;
            return this;
        }

        public Layer register(@NonNull LayerFunction function){
            return new LayerStorage(resolveName(), requires, provides, function);
        }

        /**
         * Cria uma fábrica de layers parametrizados. Todos os layers criados compartilham este manifesto.
         */
        public <P> LayerFactory<P> factory(@NonNull BiFunction<DependencyContainer, P, DependencyContainer> function){
            final String layerName = resolveName();
            final Set<Tag<?>> layerRequires = new LinkedHashSet<>(requires);
            final Set<Tag<?>> layerProvides = new LinkedHashSet<>(provides);
            return params -> new LayerStorage(
                    layerName,
                    layerRequires,
                    layerProvides,
                    container -> function.apply(container, params)
            );
        }

        private String resolveName(){
            return (name != null) ? name : nextName();
        }
    }
}
