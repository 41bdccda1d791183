package dtm.servicekit.storage.containers;

import dtm.servicekit.core.ServiceProvider;
import dtm.servicekit.core.ServiceScope;
import dtm.servicekit.storage.cache.ServiceCache;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicBoolean;

@Slf4j
public class ServiceScopeStorage extends AbstractServiceResolver implements ServiceScope {

    private final ServiceProviderStorage owner;
    private final ServiceCache scopedCache;
    private final AtomicBoolean closed;

    ServiceScopeStorage(@NonNull ServiceProviderStorage owner) {
        this.owner = owner;
        this.scopedCache = ServiceCache.create(owner.getConcurrencyMode());
        this.closed = new AtomicBoolean(false);
    }

    @Override
    public ServiceProvider getProvider() {
        return owner;
    }

    @Override
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if(closed.compareAndSet(false, true)){
            log.debug("Escopo descartado, liberando {} instâncias scoped", scopedCache.size());
            scopedCache.clear();
        }
    }

    @Override
    protected ServiceProviderStorage getOwner() {
        return owner;
    }

    @Override
    protected ServiceCache getScopedCache() {
        return scopedCache;
    }

    @Override
    protected void ensureOpen() {
        if(closed.get()){
            throw new IllegalStateException("O escopo já foi descartado.");
        }
    }
}
