package dtm.strata.exceptions;

import dtm.strata.prototypes.Tag;
import lombok.Getter;

@Getter
public class UnknownDependencyException extends DependencyContainerException{
    private final Tag<?> tag;

    public UnknownDependencyException(Tag<?> tag){
        super("Nenhuma factory registrada para a dependência: " + tag.getId());
        this.tag = tag;
    }
}
