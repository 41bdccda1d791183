package dtm.servicekit.exceptions;

import dtm.servicekit.exceptions.validation.ValidationError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Agrega todas as falhas encontradas na validação do grafo de dependências.
 * <p>
 * A validação nunca interrompe no primeiro problema: uma única chamada a
 * {@code build()} ou {@code validate()} reporta toda a configuração inválida.
 */
public class ServiceValidationException extends ServiceContainerException {

    private final List<ValidationError> errors;

    public ServiceValidationException(List<? extends ValidationError> errors) {
        super("Configuração de serviços inválida.");
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public int getErrorsSize() {
        return errors.size();
    }

    public boolean hasError(Class<? extends ValidationError> type) {
        return errors.stream().anyMatch(type::isInstance);
    }

    public <E extends ValidationError> List<E> getErrors(Class<E> type) {
        return errors.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    @Override
    public String getMessage() {
        if (errors.isEmpty()) {
            return super.getMessage();
        }

        String detailedErrors = errors.stream()
                .map(e -> String.format("[%s]: %s", e.getClass().getSimpleName(), e.getMessage()))
                .collect(Collectors.joining("\n  -> "));

        return super.getMessage() + "\nErros acumulados:\n  -> " + detailedErrors;
    }
}
