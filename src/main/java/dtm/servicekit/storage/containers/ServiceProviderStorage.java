package dtm.servicekit.storage.containers;

import dtm.servicekit.core.ServiceProvider;
import dtm.servicekit.prototypes.ConcurrencyMode;
import dtm.servicekit.prototypes.ServiceDescriptor;
import dtm.servicekit.prototypes.ServiceType;
import dtm.servicekit.storage.cache.ServiceCache;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Provider sobre um registro já validado.
 * <p>
 * O registro é somente leitura e não exige sincronização; os únicos estados mutáveis
 * são o cache de singletons e o cache do escopo raiz, cada um protegido por si.
 */
@Slf4j
public class ServiceProviderStorage extends AbstractServiceResolver implements ServiceProvider {

    private final List<ServiceDescriptor> descriptors;
    private final Map<ServiceType<?>, List<ServiceDescriptor>> descriptorsByContract;

    @Getter
    private final ConcurrencyMode concurrencyMode;

    @Getter(AccessLevel.PACKAGE)
    private final ServiceCache singletonCache;

    private final ServiceCache rootScopedCache;

    public ServiceProviderStorage(@NonNull List<ServiceDescriptor> descriptors, @NonNull ConcurrencyMode concurrencyMode) {
        this.descriptors = List.copyOf(descriptors);
        this.descriptorsByContract = indexByContract(this.descriptors);
        this.concurrencyMode = concurrencyMode;
        this.singletonCache = ServiceCache.create(concurrencyMode);
        this.rootScopedCache = ServiceCache.create(concurrencyMode);

        log.debug("Provider criado com {} descritores para {} contratos ({})",
                this.descriptors.size(), descriptorsByContract.size(), concurrencyMode);
    }

    @Override
    public List<ServiceDescriptor> getDescriptors() {
        return descriptors;
    }

    List<ServiceDescriptor> getDescriptors(ServiceType<?> contract) {
        return descriptorsByContract.getOrDefault(contract, Collections.emptyList());
    }

    @Override
    protected ServiceProviderStorage getOwner() {
        return this;
    }

    @Override
    protected ServiceCache getScopedCache() {
        return rootScopedCache;
    }

    private static Map<ServiceType<?>, List<ServiceDescriptor>> indexByContract(List<ServiceDescriptor> descriptors) {
        Map<ServiceType<?>, List<ServiceDescriptor>> index = new HashMap<>();

        for (ServiceDescriptor descriptor : descriptors) {
            index.computeIfAbsent(descriptor.getContract(), k -> new ArrayList<>()).add(descriptor);
        }

        index.replaceAll((contract, list) -> List.copyOf(list));
        return Collections.unmodifiableMap(index);
    }
}
