package dtm.servicekit.storage;

import dtm.servicekit.core.ServiceCollectionConfigurator;
import dtm.servicekit.core.ServiceProvider;
import dtm.servicekit.core.ServiceRegistry;
import dtm.servicekit.exceptions.ServiceValidationException;
import dtm.servicekit.prototypes.ConcurrencyMode;
import dtm.servicekit.prototypes.ServiceDescriptor;
import dtm.servicekit.prototypes.ServiceType;
import dtm.servicekit.storage.containers.ServiceProviderStorage;
import dtm.servicekit.storage.graph.ServiceGraphValidator;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Registro de serviços: sequência ordenada de descritores, preservando a ordem de inserção.
 * <p>
 * A ordem é significativa para {@code getAll} e para buscas de cardinalidade única,
 * onde o último registro vence.
 */
@Slf4j
public class ServiceCollection implements ServiceRegistry, ServiceCollectionConfigurator {

    private final List<ServiceDescriptor> descriptors;
    private ConcurrencyMode concurrencyMode;

    public ServiceCollection() {
        this.descriptors = new ArrayList<>();
        this.concurrencyMode = ConcurrencyMode.THREAD_SAFE;
    }

    @Override
    public ServiceCollection add(@NonNull ServiceDescriptor descriptor) {
        descriptors.add(descriptor);
        return this;
    }

    @Override
    public ServiceCollection tryAdd(@NonNull ServiceDescriptor descriptor) {
        if(contains(descriptor.getContract())){
            log.debug("Contrato {} já registrado, ignorando {}",
                    descriptor.getContract().getName(), descriptor.getImplementationType().getName());
            return this;
        }
        descriptors.add(descriptor);
        return this;
    }

    @Override
    public ServiceCollection tryAddToAll(@NonNull ServiceDescriptor descriptor) {
        boolean exists = descriptors.stream()
                .anyMatch(d -> d.getContract().equals(descriptor.getContract())
                        && d.getImplementationType().equals(descriptor.getImplementationType()));

        if(exists){
            log.debug("Implementação {} já registrada para {}, ignorando",
                    descriptor.getImplementationType().getName(), descriptor.getContract().getName());
            return this;
        }
        descriptors.add(descriptor);
        return this;
    }

    @Override
    public ServiceCollection replace(@NonNull ServiceDescriptor descriptor) {
        remove(descriptor.getContract());
        descriptors.add(descriptor);
        return this;
    }

    @Override
    public ServiceCollection remove(@NonNull ServiceType<?> contract) {
        descriptors.removeIf(d -> d.getContract().equals(contract));
        return this;
    }

    @Override
    public ServiceCollection remove(@NonNull Class<?> contract) {
        return remove(ServiceType.of(contract));
    }

    @Override
    public boolean contains(@NonNull ServiceType<?> contract) {
        return descriptors.stream().anyMatch(d -> d.getContract().equals(contract));
    }

    @Override
    public int size() {
        return descriptors.size();
    }

    @Override
    public boolean isEmpty() {
        return descriptors.isEmpty();
    }

    @Override
    public Iterator<ServiceDescriptor> iterator() {
        return Collections.unmodifiableList(descriptors).iterator();
    }

    @Override
    public void validate() throws ServiceValidationException {
        ServiceGraphValidator.validate(descriptors);
    }

    @Override
    public ServiceProvider build() throws ServiceValidationException {
        List<ServiceDescriptor> snapshot = List.copyOf(descriptors);
        ServiceGraphValidator.validate(snapshot);
        return new ServiceProviderStorage(snapshot, concurrencyMode);
    }

    @Override
    public void enableThreadSafety() {
        this.concurrencyMode = ConcurrencyMode.THREAD_SAFE;
    }

    @Override
    public void disableThreadSafety() {
        this.concurrencyMode = ConcurrencyMode.SINGLE_THREADED;
    }

    @Override
    public ConcurrencyMode getConcurrencyMode() {
        return concurrencyMode;
    }
}
