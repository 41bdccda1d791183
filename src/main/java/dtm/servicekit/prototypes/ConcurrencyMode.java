package dtm.servicekit.prototypes;

/**
 * Modo de operação dos caches de um provider, fixado no momento do build.
 */
public enum ConcurrencyMode {
    /**
     * Instâncias confinadas a uma única thread; caches sem sincronização.
     */
    SINGLE_THREADED,
    /**
     * Instâncias compartilhadas entre threads; cada cache protege a própria inserção.
     */
    THREAD_SAFE
}
