package dtm.strata.exceptions;

import dtm.strata.prototypes.Tag;
import lombok.Getter;

@Getter
public class InvalidRegistrationException extends DependencyContainerException{
    private final Tag<?> tag;

    public InvalidRegistrationException(String message, Tag<?> tag){
        super(message);
        this.tag = tag;
    }
}
