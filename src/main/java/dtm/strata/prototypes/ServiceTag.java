package dtm.strata.prototypes;

import lombok.Getter;
import lombok.NonNull;

import java.util.List;

/**
 * Tag que identifica um serviço e o seu contrato de construção.
 * <p>
 * Diferente de um {@link ValueTag}, o tag de serviço carrega a lista explícita de tags
 * que a factory do serviço vai resolver. Essa lista é o manifesto usado pelos layers
 * criados com {@code Services.service(...)} e pela verificação estática do grafo.
 *
 * @param <T> tipo do serviço
 */
@Getter
public final class ServiceTag<T> extends Tag<T> {

    private final Class<T> type;
    private final List<Tag<?>> dependencies;

    ServiceTag(String id, @NonNull Class<T> type, @NonNull List<Tag<?>> dependencies) {
        super(id);
        this.type = type;
        this.dependencies = List.copyOf(dependencies);
    }

}
