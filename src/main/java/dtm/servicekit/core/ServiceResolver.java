package dtm.servicekit.core;

import dtm.servicekit.exceptions.MissingRequiredServiceException;
import dtm.servicekit.prototypes.ServiceType;

import java.util.List;
import java.util.Optional;

/**
 * Operações de resolução comuns ao {@link ServiceProvider} (como seu próprio escopo raiz)
 * e a cada {@link ServiceScope}.
 * <p>
 * Quando há mais de um descritor para o mesmo contrato, as buscas de cardinalidade única
 * usam o último registrado. Contratos genéricos são resolvidos pela parametrização exata
 * informada no {@link ServiceType}.
 */
public interface ServiceResolver {
    /**
     * Resolve zero ou uma instância do contrato.
     *
     * @param <T>      tipo do contrato
     * @param contract chave que identifica o contrato
     * @return a instância, ou {@link Optional#empty()} se não houver registro
     */
    <T> Optional<T> get(ServiceType<T> contract);

    /**
     * Resolve exatamente uma instância do contrato.
     *
     * @param <T>      tipo do contrato
     * @param contract chave que identifica o contrato
     * @return a instância resolvida
     * @throws MissingRequiredServiceException se não houver registro para o contrato
     */
    <T> T getRequired(ServiceType<T> contract) throws MissingRequiredServiceException;

    /**
     * Resolve todos os descritores do contrato, na ordem de registro, cada um
     * segundo o seu próprio ciclo de vida.
     *
     * @param <T>      tipo do contrato
     * @param contract chave que identifica o contrato
     * @return lista imutável, vazia se não houver registro
     */
    <T> List<T> getAll(ServiceType<T> contract);

    default <T> Optional<T> get(Class<T> contract) {
        return get(ServiceType.of(contract));
    }

    default <T> T getRequired(Class<T> contract) throws MissingRequiredServiceException {
        return getRequired(ServiceType.of(contract));
    }

    default <T> List<T> getAll(Class<T> contract) {
        return getAll(ServiceType.of(contract));
    }

    /**
     * Cria um novo escopo, independente de todos os outros e do escopo raiz do provider.
     *
     * @return o novo escopo
     */
    ServiceScope createScope();
}
