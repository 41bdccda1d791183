package dtm.servicekit.storage.cache;

import dtm.servicekit.exceptions.ServiceResolutionException;
import dtm.servicekit.prototypes.ServiceDescriptor;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Cache para o modo {@code THREAD_SAFE}.
 * <p>
 * Cada descritor ocupa um {@link Slot}; a primeira resolução acontece sob o monitor do slot,
 * então resoluções concorrentes do mesmo descritor constroem uma única instância, enquanto
 * descritores diferentes nunca disputam o mesmo monitor.
 */
public class SynchronizedServiceCache implements ServiceCache {

    private final Map<ServiceDescriptor, Slot> slots = new ConcurrentHashMap<>();

    @Override
    public Object getOrCreate(ServiceDescriptor descriptor, Supplier<Object> creator) {
        return slots.computeIfAbsent(descriptor, Slot::new).get(creator);
    }

    @Override
    public boolean contains(ServiceDescriptor descriptor) {
        Slot slot = slots.get(descriptor);
        return slot != null && slot.instance != null;
    }

    @Override
    public int size() {
        return (int) slots.values().stream()
                .filter(slot -> slot.instance != null)
                .count();
    }

    @Override
    public void clear() {
        slots.clear();
    }

    private static final class Slot {
        private final ServiceDescriptor descriptor;
        private volatile Object instance;
        private Thread creatingThread;

        private Slot(ServiceDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        private Object get(Supplier<Object> creator) {
            Object r = instance;
            if (r != null) return r;

            synchronized (this) {
                r = instance;
                if (r == null) {
                    if (creatingThread == Thread.currentThread()) {
                        throw new ServiceResolutionException(
                                "Dependência circular durante a resolução de " + descriptor.getContract().getName(),
                                descriptor.getContract()
                        );
                    }

                    creatingThread = Thread.currentThread();
                    try {
                        instance = r = creator.get();
                    } finally {
                        creatingThread = null;
                    }
                }
            }
            return r;
        }
    }
}
