package dtm.servicekit.core;

/**
 * Contexto de resolução delimitado, com cache próprio para serviços scoped.
 * <p>
 * Fechar o escopo libera o cache; as instâncias continuam válidas para quem
 * ainda as referencia. Resolver por um escopo fechado lança {@link IllegalStateException}.
 */
public interface ServiceScope extends ServiceResolver, AutoCloseable {

    ServiceProvider getProvider();

    boolean isClosed();

    @Override
    void close();
}
