package dtm.servicekit.storage.cache;

import dtm.servicekit.exceptions.ServiceResolutionException;
import dtm.servicekit.prototypes.ServiceDescriptor;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Cache sem sincronização para o modo {@code SINGLE_THREADED}.
 */
public class LocalServiceCache implements ServiceCache {

    private final Map<ServiceDescriptor, Object> instances = new IdentityHashMap<>();
    private final Set<ServiceDescriptor> creating = Collections.newSetFromMap(new IdentityHashMap<>());

    @Override
    public Object getOrCreate(ServiceDescriptor descriptor, Supplier<Object> creator) {
        Object existing = instances.get(descriptor);
        if(existing != null) return existing;

        if(!creating.add(descriptor)){
            throw new ServiceResolutionException(
                    "Dependência circular durante a resolução de " + descriptor.getContract().getName(),
                    descriptor.getContract()
            );
        }

        try {
            Object created = creator.get();
            instances.put(descriptor, created);
            return created;
        } finally {
            creating.remove(descriptor);
        }
    }

    @Override
    public boolean contains(ServiceDescriptor descriptor) {
        return instances.containsKey(descriptor);
    }

    @Override
    public int size() {
        return instances.size();
    }

    @Override
    public void clear() {
        instances.clear();
    }
}
