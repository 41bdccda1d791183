package dtm.servicekit.prototypes;

import dtm.servicekit.exceptions.LazyDependencyException;

import java.util.function.Supplier;

/**
 * Representa uma dependência resolvida de forma preguiçosa (lazy): a resolução
 * acontece no primeiro acesso e o resultado é memorizado.
 * <p>
 * A memorização apenas adia o momento da chamada; o ciclo de vida da instância
 * continua sendo o do contrato resolvido.
 *
 * @param <T> o tipo da dependência gerenciada.
 */
public interface LazyDependency<T> {
    /**
     * Resolve (na primeira chamada) e retorna a dependência.
     *
     * @return a instância, ou {@code null} se a resolução não produziu valor.
     */
    T get();

    /**
     * Retorna a dependência, lançando exceção caso a resolução não tenha produzido valor.
     *
     * @return a instância da dependência
     * @throws LazyDependencyException se não houver valor
     */
    T require();

    /**
     * Retorna a dependência ou lança a exceção fornecida pelo {@link Supplier}
     * caso a resolução não tenha produzido valor.
     *
     * @param <E> o tipo da exceção lançada
     * @param onErrorThrow fornecedor da exceção, invocado somente na ausência do valor
     * @return a instância da dependência
     * @throws E se não houver valor
     */
    <E extends Throwable> T require(Supplier<E> onErrorThrow) throws E;

    /**
     * Resolve (se necessário) e indica se há valor.
     *
     * @return {@code true} se a dependência estiver presente
     */
    boolean isPresent();

    /**
     * Indica se a resolução já foi executada, sem dispará-la.
     *
     * @return {@code true} se o valor já foi memorizado
     */
    boolean isResolved();
}
