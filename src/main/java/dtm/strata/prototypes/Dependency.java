package dtm.strata.prototypes;

/**
 * Representa um registro do contêiner: o tag, a factory que cria a instância
 * e o finalizer opcional executado no destroy.
 * <p>
 * Registros são imutáveis e podem ser copiados entre contêineres (ver {@code merge}),
 * o que nunca copia as instâncias já criadas, apenas a capacidade de criá-las.
 *
 * @param <T> tipo da instância registrada
 */
public abstract class Dependency<T> {
    public abstract Tag<T> getTag();
    public abstract AsyncFactory<T> getFactory();
    public abstract AsyncFinalizer<T> getFinalizer();

    public boolean hasFinalizer(){
        return getFinalizer() != null;
    }
}
