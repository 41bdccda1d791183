package dtm.servicekit.core;

import dtm.servicekit.prototypes.ConcurrencyMode;

/**
 * Configuração do provider que será produzido pelo build.
 */
public interface ServiceCollectionConfigurator {
    /**
     * Habilita o modo {@link ConcurrencyMode#THREAD_SAFE}: cada cache protege a inserção
     * de instâncias, permitindo resolver o mesmo provider a partir de várias threads.
     */
    void enableThreadSafety();

    /**
     * Seleciona o modo {@link ConcurrencyMode#SINGLE_THREADED}: caches sem sincronização,
     * para providers confinados a uma única thread.
     */
    void disableThreadSafety();

    ConcurrencyMode getConcurrencyMode();
}
