package dtm.servicekit.exceptions.validation;

/**
 * Uma falha estrutural encontrada no grafo de dependências.
 */
public abstract class ValidationError {

    public abstract String getMessage();

    @Override
    public String toString() {
        return getClass().getSimpleName() + ": " + getMessage();
    }
}
