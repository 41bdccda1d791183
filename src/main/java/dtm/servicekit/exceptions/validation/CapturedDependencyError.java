package dtm.servicekit.exceptions.validation;

import dtm.servicekit.prototypes.ServiceType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@EqualsAndHashCode(callSuper = false)
@RequiredArgsConstructor
public class CapturedDependencyError extends ValidationError {
    private final ServiceType<?> singleton;
    private final ServiceType<?> scoped;

    @Override
    public String getMessage() {
        return singleton.getName() + " não pode ser singleton porque depende de " +
                scoped.getName() + ", que é scoped.";
    }
}
