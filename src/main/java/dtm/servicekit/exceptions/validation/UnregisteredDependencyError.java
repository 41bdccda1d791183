package dtm.servicekit.exceptions.validation;

import dtm.servicekit.prototypes.ServiceType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public class UnregisteredDependencyError extends ValidationError {
    private final ServiceType<?> consumer;
    private final ServiceType<?> missing;

    @Override
    public String getMessage() {
        return consumer.getName() + " depende de " + missing.getName() + ", que não foi registrado.";
    }
}
