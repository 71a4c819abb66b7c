package dtm.strata.storage.layer;

import dtm.strata.core.DependencyContainer;
import dtm.strata.core.Layer;
import dtm.strata.exceptions.UnsatisfiedLayerException;
import dtm.strata.prototypes.LayerFunction;
import dtm.strata.prototypes.Tag;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.function.Predicate;

/**
 * Implementação imutável de {@link Layer}: um manifesto explícito (requisitos e tags fornecidos)
 * e a função que aplica os registros.
 */
@Slf4j
@Getter
public class LayerStorage implements Layer {

    private final String name;
    private final Set<Tag<?>> requires;
    private final Set<Tag<?>> provides;
    private final LayerFunction function;

    public LayerStorage(@NonNull String name, @NonNull Collection<? extends Tag<?>> requires,
                        @NonNull Collection<? extends Tag<?>> provides, @NonNull LayerFunction function) {
        this.name = name;
        this.requires = Collections.unmodifiableSet(new LinkedHashSet<>(requires));
        this.provides = Collections.unmodifiableSet(new LinkedHashSet<>(provides));
        this.function = function;
    }

    @Override
    public DependencyContainer apply(@NonNull DependencyContainer container) {
        Set<Tag<?>> missing = filter(requires, tag -> !container.has(tag));
        if(!missing.isEmpty()){
            throw new UnsatisfiedLayerException("Requisitos do layer não encontrados no contêiner", name, missing);
        }

        log.debug("Aplicando layer {}", name);
        DependencyContainer result = function.apply(container);
        if(result == null){
            result = container;
        }

        final DependencyContainer applied = result;
        Set<Tag<?>> notRegistered = filter(provides, tag -> !applied.has(tag));
        if(!notRegistered.isEmpty()){
            throw new UnsatisfiedLayerException("Tags declarados pelo layer não foram registrados", name, notRegistered);
        }
        return applied;
    }

    @Override
    public Layer to(@NonNull Layer target) {
        Set<Tag<?>> combinedRequires = new LinkedHashSet<>(requires);
        for (Tag<?> tag : target.getRequires()){
            if(!provides.contains(tag)) combinedRequires.add(tag);
        }

        Set<Tag<?>> combinedProvides = new LinkedHashSet<>(provides);
        combinedProvides.addAll(target.getProvides());

        return new LayerStorage(
                name + " -> " + target.getName(),
                combinedRequires,
                combinedProvides,
                container -> target.apply(this.apply(container))
        );
    }

    @Override
    public Layer and(@NonNull Layer other) {
        Set<Tag<?>> overlap = filter(provides, other.getProvides()::contains);
        if(!overlap.isEmpty()){
            log.warn("Layers {} e {} fornecem os mesmos tags {}; prevalece o registro de {}", name, other.getName(), overlap, other.getName());
        }

        Set<Tag<?>> combinedRequires = new LinkedHashSet<>(requires);
        combinedRequires.addAll(other.getRequires());

        Set<Tag<?>> combinedProvides = new LinkedHashSet<>(provides);
        combinedProvides.addAll(other.getProvides());

        return new LayerStorage(
                name + " + " + other.getName(),
                combinedRequires,
                combinedProvides,
                container -> other.apply(this.apply(container))
        );
    }

    @Override
    public List<Set<Tag<?>>> verify() {
        return new LayerVerifier(this).resolveLayers();
    }

    @Override
    public String toString() {
        return "Layer[" + name + ", requires=" + requires + ", provides=" + provides + "]";
    }

    private static Set<Tag<?>> filter(Set<Tag<?>> tags, Predicate<Tag<?>> predicate){
        Set<Tag<?>> result = new LinkedHashSet<>();
        for (Tag<?> tag : tags){
            if(predicate.test(tag)) result.add(tag);
        }
        return result;
    }
}
