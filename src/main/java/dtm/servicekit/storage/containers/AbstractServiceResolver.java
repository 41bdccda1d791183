package dtm.servicekit.storage.containers;

import dtm.servicekit.core.ServiceResolver;
import dtm.servicekit.core.ServiceScope;
import dtm.servicekit.exceptions.MissingRequiredServiceException;
import dtm.servicekit.exceptions.ServiceResolutionException;
import dtm.servicekit.prototypes.ServiceDescriptor;
import dtm.servicekit.prototypes.ServiceLifetime;
import dtm.servicekit.prototypes.ServiceType;
import dtm.servicekit.storage.cache.ServiceCache;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolução comum ao provider e aos escopos. Cada subclasse fornece o seu cache de scoped;
 * singletons sempre passam pelo cache do provider dono.
 */
@Slf4j
@SuppressWarnings("unchecked")
abstract class AbstractServiceResolver implements ServiceResolver {

    protected abstract ServiceProviderStorage getOwner();

    protected abstract ServiceCache getScopedCache();

    protected void ensureOpen() {
    }

    @Override
    public <T> Optional<T> get(@NonNull ServiceType<T> contract) {
        ensureOpen();
        List<ServiceDescriptor> descriptors = getOwner().getDescriptors(contract);
        if(descriptors.isEmpty()){
            return Optional.empty();
        }
        return Optional.of((T) resolve(descriptors.get(descriptors.size() - 1)));
    }

    @Override
    public <T> T getRequired(@NonNull ServiceType<T> contract) throws MissingRequiredServiceException {
        ensureOpen();
        List<ServiceDescriptor> descriptors = getOwner().getDescriptors(contract);
        if(descriptors.isEmpty()){
            throw new MissingRequiredServiceException(contract);
        }
        return (T) resolve(descriptors.get(descriptors.size() - 1));
    }

    @Override
    public <T> List<T> getAll(@NonNull ServiceType<T> contract) {
        ensureOpen();
        List<ServiceDescriptor> descriptors = getOwner().getDescriptors(contract);
        List<T> instances = new ArrayList<>(descriptors.size());

        for (ServiceDescriptor descriptor : descriptors) {
            instances.add((T) resolve(descriptor));
        }

        return List.copyOf(instances);
    }

    @Override
    public ServiceScope createScope() {
        ensureOpen();
        return new ServiceScopeStorage(getOwner());
    }

    private Object resolve(ServiceDescriptor descriptor) {
        return switch (descriptor.getLifetime()) {
            case TRANSIENT -> create(descriptor, this);
            case SINGLETON -> {
                ServiceProviderStorage owner = getOwner();
                yield owner.getSingletonCache().getOrCreate(descriptor, () -> create(descriptor, owner));
            }
            case SCOPED -> getScopedCache().getOrCreate(descriptor, () -> create(descriptor, this));
        };
    }

    private Object create(ServiceDescriptor descriptor, ServiceResolver context) {
        Object instance = descriptor.getFactory().create(context);

        if(instance == null){
            throw new ServiceResolutionException(
                    "A fábrica de " + descriptor.getImplementationType().getName() + " retornou null",
                    descriptor.getContract()
            );
        }

        if(!descriptor.getContract().isInstance(instance)){
            throw new ServiceResolutionException(
                    "A fábrica de " + descriptor.getImplementationType().getName() + " retornou " +
                            instance.getClass().getName() + ", que não implementa " + descriptor.getContract().getName(),
                    descriptor.getContract()
            );
        }

        if(log.isDebugEnabled() && descriptor.getLifetime() != ServiceLifetime.TRANSIENT){
            log.debug("Instância {} criada para {} ({})",
                    instance.getClass().getSimpleName(),
                    descriptor.getContract().getSimpleName(),
                    descriptor.getLifetime());
        }

        return instance;
    }
}
