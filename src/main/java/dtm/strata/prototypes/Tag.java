package dtm.strata.prototypes;

import lombok.NonNull;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identificador opaco de uma dependência registrada no contêiner.
 * <p>
 * Em tempo de execução um tag é apenas uma identidade: dois tags criados com o mesmo
 * rótulo são tags diferentes, a menos que a mesma instância seja compartilhada.
 * O tipo {@code T} existe somente para o compilador e garante, no ponto de chamada,
 * o tipo do valor devolvido pelo contêiner.
 * <p>
 * O rótulo ({@link #getId()}) serve apenas para diagnóstico (mensagens de erro e logs).
 *
 * @param <T> tipo do valor identificado pelo tag
 */
public abstract class Tag<T> {

    private static final AtomicLong ANONYMOUS_SEQUENCE = new AtomicLong();

    private final String id;

    protected Tag(@NonNull String id) {
        this.id = id;
    }

    /**
     * Cria um tag de valor com o rótulo informado.
     *
     * @param id  rótulo usado em diagnósticos
     * @param <T> tipo do valor
     * @return novo tag, distinto de qualquer outro já criado
     */
    public static <T> ValueTag<T> of(@NonNull String id){
        return new ValueTag<>(id);
    }

    /**
     * Cria um tag de valor com um rótulo único gerado.
     */
    public static <T> ValueTag<T> anonymous(){
        return new ValueTag<>("tag#" + ANONYMOUS_SEQUENCE.incrementAndGet());
    }

    /**
     * Cria um tag de serviço, declarando explicitamente os tags dos quais o serviço depende.
     *
     * @param id           rótulo usado em diagnósticos
     * @param type         classe do serviço
     * @param dependencies tags exigidos pela construção do serviço
     * @param <T>          tipo do serviço
     * @return novo tag de serviço
     */
    public static <T> ServiceTag<T> service(@NonNull String id, @NonNull Class<T> type, Tag<?>... dependencies){
        return new ServiceTag<>(id, type, List.of(dependencies));
    }

    public static <T> ServiceTag<T> service(@NonNull Class<T> type, Tag<?>... dependencies){
        return service(type.getSimpleName(), type, dependencies);
    }

    public String getId() {
        return id;
    }

    @Override
    public final boolean equals(Object obj) {
        return this == obj;
    }

    @Override
    public final int hashCode() {
        return System.identityHashCode(this);
    }

    @Override
    public String toString() {
        return id;
    }
}
