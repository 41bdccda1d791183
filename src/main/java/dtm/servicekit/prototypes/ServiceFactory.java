package dtm.servicekit.prototypes;

import dtm.servicekit.core.ServiceResolver;

/**
 * Função que constrói a instância de um serviço.
 * <p>
 * O {@link ServiceResolver} recebido é o contexto de resolução ativo e deve ser
 * usado para obter as dependências do próprio serviço.
 *
 * @param <T> tipo produzido
 */
@FunctionalInterface
public interface ServiceFactory<T> {
    T create(ServiceResolver resolver);
}
