package dtm.servicekit.exceptions;

public class ServiceContainerException extends RuntimeException{

    public ServiceContainerException(String message){
        super(message);
    }

    public ServiceContainerException(Throwable cause) {
        super(cause);
    }

    public ServiceContainerException(String message, Throwable th){
        super(message, th);
    }
}
