package dtm.strata.prototypes;

/**
 * Rotina de limpeza executada sobre uma instância criada, no momento do destroy do contêiner.
 *
 * @param <T> tipo da instância
 */
@FunctionalInterface
public interface Finalizer<T> {
    void destroy(T instance) throws Exception;
}
