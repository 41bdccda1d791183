package dtm.servicekit.exceptions;

import dtm.servicekit.prototypes.ServiceType;
import lombok.Getter;

@Getter
public class ServiceResolutionException extends ServiceContainerException{
    private final ServiceType<?> contract;

    public ServiceResolutionException(String message, ServiceType<?> contract, Throwable th){
        super(message, th);
        this.contract = contract;
    }

    public ServiceResolutionException(String message, ServiceType<?> contract){
        super(message);
        this.contract = contract;
    }
}
