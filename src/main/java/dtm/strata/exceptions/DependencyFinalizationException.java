package dtm.strata.exceptions;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Reúne todas as falhas ocorridas durante o destroy de um contêiner (e dos seus escopos filhos).
 * <p>
 * É lançada somente depois que todos os finalizers foram executados. A primeira falha
 * também é registrada como causa e as demais como suprimidas.
 */
public class DependencyFinalizationException extends DependencyContainerException {

    private final List<Throwable> errors = new CopyOnWriteArrayList<>();

    public DependencyFinalizationException(List<? extends Throwable> errors) {
        super("Erro ao destruir o contêiner de dependências.", errors.isEmpty() ? null : errors.get(0));
        for (Throwable error : errors) {
            addError(error);
        }
    }

    private void addError(Throwable error) {
        if (error != null) {
            if (!this.errors.isEmpty()) {
                addSuppressed(error);
            }
            this.errors.add(error);
        }
    }

    public List<Throwable> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public int getErrorsSize() {
        return errors.size();
    }

    public boolean hasMultipleErrors() {
        return errors.size() > 1;
    }

    public boolean hasError(Class<? extends Throwable> type) {
        return errors.stream().anyMatch(type::isInstance);
    }

    @Override
    public String getMessage() {
        if (errors.isEmpty()) {
            return super.getMessage();
        }

        String detailedErrors = errors.stream()
                .map(e -> String.format("[%s]: %s", e.getClass().getSimpleName(), e.getMessage()))
                .collect(Collectors.joining("\n  -> "));

        return super.getMessage() + "\nErros acumulados:\n  -> " + detailedErrors;
    }

}
