package dtm.strata.exceptions;

public class DependencyContainerException extends RuntimeException{

    public DependencyContainerException(String message){
        super(message);
    }

    public DependencyContainerException(Throwable cause) {
        super(cause);
    }

    public DependencyContainerException(String message, Throwable th){
        super(message, th);
    }

}
