package dtm.servicekit.prototypes;

/**
 * Quantas instâncias uma declaração de dependência espera receber.
 */
public enum ServiceCardinality {
    EXACTLY_ONE,
    ZERO_OR_ONE,
    ZERO_OR_MORE;

    /**
     * Indica se a ausência de registro para o contrato é aceitável.
     *
     * @return true para {@link #ZERO_OR_ONE} e {@link #ZERO_OR_MORE}
     */
    public boolean isOptional() {
        return this != EXACTLY_ONE;
    }
}
