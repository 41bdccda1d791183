package dtm.servicekit.exceptions.validation;

import dtm.servicekit.prototypes.ServiceType;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ciclo encontrado no grafo. O caminho é ordenado e repete o primeiro contrato no final.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class CircularDependencyError extends ValidationError {
    private final List<ServiceType<?>> path;

    public CircularDependencyError(List<ServiceType<?>> path) {
        this.path = List.copyOf(path);
    }

    @Override
    public String getMessage() {
        return "Dependência circular detectada: " + path.stream()
                .map(ServiceType::getName)
                .collect(Collectors.joining(" → "));
    }
}
