package dtm.servicekit.exceptions;

public class LazyDependencyException extends ServiceContainerException {

    public LazyDependencyException(String message) {
        super(message);
    }

    public LazyDependencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
