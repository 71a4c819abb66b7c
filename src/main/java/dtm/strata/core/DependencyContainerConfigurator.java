package dtm.strata.core;

/**
 * Interface para configuração do comportamento do contêiner de dependências.
 */
public interface DependencyContainerConfigurator {
    /**
     * Mantém em cache a falha de uma factory: chamadas seguintes ao mesmo tag recebem
     * a mesma falha, sem executar a factory novamente. Comportamento padrão.
     */
    void enableFailureCaching();

    /**
     * Remove do cache a criação que falhou, permitindo que o próximo {@code get}
     * execute a factory outra vez.
     */
    void disableFailureCaching();

    boolean isFailureCachingEnabled();
}
