package dtm.strata.storage.layer;

import dtm.strata.core.Layer;
import dtm.strata.exceptions.UnsatisfiedLayerException;
import dtm.strata.prototypes.ServiceTag;
import dtm.strata.prototypes.Tag;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Verificação estática do manifesto de um layer, sem criar nenhuma instância.
 * <p>
 * Usa as dependências declaradas nos {@link ServiceTag} fornecidos pelo layer para montar o grafo,
 * confere se cada dependência é fornecida pelo layer ou declarada como requisito, e agrupa os tags
 * em camadas de criação (camada 0 sem dependências internas, camada N dependendo apenas das anteriores).
 * <p>
 * Um {@link ServiceTag} só pode referenciar tags que já existem quando ele é criado,
 * então o grafo declarado é sempre acíclico e todo tag fornecido acaba em alguma camada.
 */
@Slf4j
public class LayerVerifier {
    private final Layer layer;
    private final Set<Tag<?>> provided;
    private final Map<Tag<?>, Set<Tag<?>>> dependencyGraph;

    public LayerVerifier(Layer layer) {
        this.layer = layer;
        this.provided = new LinkedHashSet<>(layer.getProvides());
        this.dependencyGraph = new LinkedHashMap<>();
        for (Tag<?> tag : provided) {
            dependencyGraph.put(tag, declaredDependencies(tag));
        }
    }

    public List<Set<Tag<?>>> resolveLayers() {
        validateDeclarations();

        List<Set<Tag<?>>> layers = new ArrayList<>();
        Set<Tag<?>> processed = new HashSet<>();

        if (provided.isEmpty()) {
            return layers;
        }

        Set<Tag<?>> currentLayer = findInitialLayer();

        while (!currentLayer.isEmpty()) {
            layers.add(currentLayer);
            processed.addAll(currentLayer);

            currentLayer = provided.stream()
                    .filter(tag -> !processed.contains(tag))
                    .filter(tag -> processed.containsAll(filterProvidedDependencies(dependencyGraph.get(tag))))
                    .collect(Collectors.toCollection(LinkedHashSet::new));
        }

        if (log.isDebugEnabled()) {
            for (int i = 0; i < layers.size(); i++) {
                logLayer(i, layers.get(i));
            }
        }
        return layers;
    }

    private void validateDeclarations() {
        Set<Tag<?>> undeclared = new LinkedHashSet<>();
        for (Set<Tag<?>> dependencies : dependencyGraph.values()) {
            for (Tag<?> dependency : dependencies) {
                if (!provided.contains(dependency) && !layer.getRequires().contains(dependency)) {
                    undeclared.add(dependency);
                }
            }
        }
        if (!undeclared.isEmpty()) {
            throw new UnsatisfiedLayerException(
                    "Dependências de serviço não fornecidas nem declaradas como requisito",
                    layer.getName(),
                    undeclared
            );
        }
    }

    private Set<Tag<?>> findInitialLayer() {
        return provided.stream()
                .filter(tag -> {
                    Set<Tag<?>> allDeps = dependencyGraph.get(tag);
                    boolean isLayer0 = filterProvidedDependencies(allDeps).isEmpty();

                    if (isLayer0 && log.isDebugEnabled()) {
                        if (allDeps.isEmpty()) {
                            log.debug("  ✓ {} → [SEM DEPENDÊNCIAS]", tag.getId());
                        } else {
                            log.debug("  ✓ {} → [Requisitos externos: {}]",
                                    tag.getId(),
                                    allDeps.stream().map(Tag::getId).collect(Collectors.joining(", ")));
                        }
                    }

                    return isLayer0;
                })
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private Set<Tag<?>> filterProvidedDependencies(Set<Tag<?>> dependencies) {
        return dependencies.stream()
                .filter(provided::contains)
                .collect(Collectors.toSet());
    }

    private static Set<Tag<?>> declaredDependencies(Tag<?> tag) {
        if (tag instanceof ServiceTag<?> serviceTag) {
            return new LinkedHashSet<>(serviceTag.getDependencies());
        }
        return Set.of();
    }

    private void logLayer(int layerNum, Set<Tag<?>> currentLayer) {
        StringBuilder layerLog = new StringBuilder();
        layerLog.append("\n╭─── 📦 CAMADA ").append(layerNum).append(" ───────────────────────────────────────────╮");

        for (Tag<?> tag : currentLayer) {
            layerLog.append("\n│  ✓ ").append(tag.getId());
        }

        layerLog.append("\n╰────────────────────────────────────────────────────────────╯");
        log.debug(layerLog.toString());
    }

}
