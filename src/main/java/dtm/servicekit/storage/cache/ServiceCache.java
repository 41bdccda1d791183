package dtm.servicekit.storage.cache;

import dtm.servicekit.prototypes.ConcurrencyMode;
import dtm.servicekit.prototypes.ServiceDescriptor;
import lombok.NonNull;

import java.util.function.Supplier;

/**
 * Cache de instâncias de um nível (singletons do provider ou scoped de um escopo).
 * Indexado pela identidade do descritor, só cresce, e guarda no máximo uma instância por descritor.
 */
public interface ServiceCache {

    /**
     * Retorna a instância já armazenada para o descritor ou cria, armazena e retorna uma nova.
     *
     * @param descriptor descritor resolvido
     * @param creator    criação da instância, chamada apenas quando não há entrada
     * @return a instância armazenada
     */
    Object getOrCreate(ServiceDescriptor descriptor, Supplier<Object> creator);

    boolean contains(ServiceDescriptor descriptor);

    int size();

    /**
     * Libera todas as referências mantidas pelo cache.
     */
    void clear();

    static ServiceCache create(@NonNull ConcurrencyMode mode){
        return (mode == ConcurrencyMode.THREAD_SAFE)
                ? new SynchronizedServiceCache()
                : new LocalServiceCache();
    }
}
