package dtm.servicekit.core;

import dtm.servicekit.exceptions.ServiceValidationException;
import dtm.servicekit.prototypes.ServiceDescriptor;
import dtm.servicekit.prototypes.ServiceType;
import lombok.NonNull;

/**
 * Registro ordenado de descritores. Nenhum serviço é instanciado durante o registro.
 */
public interface ServiceRegistry extends Iterable<ServiceDescriptor> {

    /**
     * Adiciona o descritor incondicionalmente ao final do registro.
     *
     * @param descriptor descritor a ser registrado
     * @return este registro
     */
    ServiceRegistry add(@NonNull ServiceDescriptor descriptor);

    /**
     * Adiciona o descritor somente se nenhum outro já atende ao mesmo contrato.
     *
     * @param descriptor descritor a ser registrado
     * @return este registro
     */
    ServiceRegistry tryAdd(@NonNull ServiceDescriptor descriptor);

    /**
     * Adiciona o descritor somente se nenhum outro já combina o mesmo contrato
     * com o mesmo tipo de implementação.
     *
     * @param descriptor descritor a ser registrado
     * @return este registro
     */
    ServiceRegistry tryAddToAll(@NonNull ServiceDescriptor descriptor);

    /**
     * Remove todos os descritores do contrato e adiciona o informado.
     *
     * @param descriptor descritor que passa a atender o contrato
     * @return este registro
     */
    ServiceRegistry replace(@NonNull ServiceDescriptor descriptor);

    /**
     * Remove todos os descritores do contrato.
     *
     * @param contract contrato a ser removido
     * @return este registro
     */
    ServiceRegistry remove(@NonNull ServiceType<?> contract);

    default ServiceRegistry remove(@NonNull Class<?> contract) {
        return remove(ServiceType.of(contract));
    }

    boolean contains(@NonNull ServiceType<?> contract);

    default boolean contains(@NonNull Class<?> contract) {
        return contains(ServiceType.of(contract));
    }

    int size();

    boolean isEmpty();

    /**
     * Valida o grafo de dependências sem construir um provider.
     *
     * @throws ServiceValidationException com todas as falhas encontradas
     */
    void validate() throws ServiceValidationException;

    /**
     * Valida o registro e, se não houver falhas, produz o provider.
     *
     * @return provider sobre uma cópia imutável do registro
     * @throws ServiceValidationException com todas as falhas encontradas
     */
    ServiceProvider build() throws ServiceValidationException;
}
