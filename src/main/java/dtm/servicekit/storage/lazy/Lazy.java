package dtm.servicekit.storage.lazy;

import dtm.servicekit.core.ServiceResolver;
import dtm.servicekit.exceptions.LazyDependencyException;
import dtm.servicekit.prototypes.LazyDependency;
import dtm.servicekit.prototypes.ServiceType;
import lombok.NonNull;

import java.util.List;
import java.util.function.Supplier;

/**
 * Fábricas de {@link LazyDependency}. Cada instância adia uma única resolução até o primeiro acesso.
 */
public final class Lazy {

    private Lazy() {}

    public static <T> LazyDependency<T> of(@NonNull Supplier<T> supplier) {
        return new MemoizedDependency<>(supplier);
    }

    public static <T> LazyDependency<T> exactlyOne(@NonNull ServiceResolver resolver, @NonNull Class<T> contract) {
        return exactlyOne(resolver, ServiceType.of(contract));
    }

    public static <T> LazyDependency<T> exactlyOne(@NonNull ServiceResolver resolver, @NonNull ServiceType<T> contract) {
        return of(() -> resolver.getRequired(contract));
    }

    public static <T> LazyDependency<T> zeroOrOne(@NonNull ServiceResolver resolver, @NonNull Class<T> contract) {
        return zeroOrOne(resolver, ServiceType.of(contract));
    }

    public static <T> LazyDependency<T> zeroOrOne(@NonNull ServiceResolver resolver, @NonNull ServiceType<T> contract) {
        return of(() -> resolver.get(contract).orElse(null));
    }

    public static <T> LazyDependency<List<T>> zeroOrMore(@NonNull ServiceResolver resolver, @NonNull Class<T> contract) {
        return zeroOrMore(resolver, ServiceType.of(contract));
    }

    public static <T> LazyDependency<List<T>> zeroOrMore(@NonNull ServiceResolver resolver, @NonNull ServiceType<T> contract) {
        return of(() -> resolver.getAll(contract));
    }

    /**
     * Dependência já resolvida e sem valor, para consumidores opcionais montados sem o container.
     */
    public static <T> LazyDependency<T> empty() {
        return init(null);
    }

    /**
     * Dependência já resolvida com o valor informado.
     */
    public static <T> LazyDependency<T> init(T value) {
        MemoizedDependency<T> dependency = new MemoizedDependency<>(() -> value);
        dependency.get();
        return dependency;
    }

    /**
     * Cria uma implementação da interface que resolve o contrato na primeira chamada de método.
     *
     * @param resolver contexto de resolução
     * @param contract interface do contrato
     * @return proxy que delega toda chamada à instância resolvida
     */
    public static <T> T proxy(@NonNull ServiceResolver resolver, @NonNull Class<T> contract) {
        return proxy(resolver, ServiceType.of(contract));
    }

    public static <T> T proxy(@NonNull ServiceResolver resolver, @NonNull ServiceType<T> contract) {
        return LazyProxyFactory.newProxy(contract, exactlyOne(resolver, contract));
    }

    private static final class MemoizedDependency<T> implements LazyDependency<T> {
        private final Supplier<T> supplier;
        private volatile boolean resolved;
        private T dependency;

        private MemoizedDependency(Supplier<T> supplier) {
            this.supplier = supplier;
        }

        @Override
        public T get() {
            if(!resolved){
                synchronized (this) {
                    if(!resolved){
                        dependency = supplier.get();
                        resolved = true;
                    }
                }
            }
            return dependency;
        }

        @Override
        public T require() {
            T value = get();
            if(value != null) return value;
            throw new LazyDependencyException("Dependência não disponível.");
        }

        @Override
        public <E extends Throwable> T require(Supplier<E> onErrorThrow) throws E {
            T value = get();
            if(value != null) return value;
            throw onErrorThrow.get();
        }

        @Override
        public boolean isPresent() {
            return get() != null;
        }

        @Override
        public boolean isResolved() {
            return resolved;
        }
    }
}
