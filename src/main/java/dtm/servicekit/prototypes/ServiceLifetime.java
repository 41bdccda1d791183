package dtm.servicekit.prototypes;

/**
 * Política de cache aplicada a uma instância resolvida.
 */
public enum ServiceLifetime {
    /**
     * Nova instância a cada resolução, nunca armazenada.
     */
    TRANSIENT,
    /**
     * Uma única instância por provider, compartilhada por todos os escopos.
     */
    SINGLETON,
    /**
     * Uma instância por escopo.
     */
    SCOPED
}
