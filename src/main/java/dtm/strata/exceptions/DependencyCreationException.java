package dtm.strata.exceptions;

import dtm.strata.prototypes.Tag;
import lombok.Getter;

/**
 * Falha da factory de um tag. A exceção original é preservada como causa.
 */
@Getter
public class DependencyCreationException extends DependencyContainerException{
    private final Tag<?> tag;

    public DependencyCreationException(Tag<?> tag, Throwable th){
        super("Erro ao criar a dependência: " + tag.getId() + " ==> causa: " + th.getMessage(), th);
        this.tag = tag;
    }

    public DependencyCreationException(Tag<?> tag, String message){
        super("Erro ao criar a dependência: " + tag.getId() + " ==> causa: " + message);
        this.tag = tag;
    }
}
