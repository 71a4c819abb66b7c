package dtm.strata.exceptions;

public class ContainerDestroyedException extends DependencyContainerException {
    public ContainerDestroyedException(String message) {
        super(message);
    }
}
