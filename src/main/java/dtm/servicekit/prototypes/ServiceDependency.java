package dtm.servicekit.prototypes;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;

/**
 * Declaração explícita de uma dependência: contrato e cardinalidade.
 */
@Getter
@EqualsAndHashCode
public final class ServiceDependency {
    private final ServiceType<?> contract;
    private final ServiceCardinality cardinality;

    public ServiceDependency(@NonNull ServiceType<?> contract, @NonNull ServiceCardinality cardinality) {
        this.contract = contract;
        this.cardinality = cardinality;
    }

    public static ServiceDependency exactlyOne(@NonNull Class<?> contract){
        return exactlyOne(ServiceType.of(contract));
    }

    public static ServiceDependency exactlyOne(@NonNull ServiceType<?> contract){
        return new ServiceDependency(contract, ServiceCardinality.EXACTLY_ONE);
    }

    public static ServiceDependency zeroOrOne(@NonNull Class<?> contract){
        return zeroOrOne(ServiceType.of(contract));
    }

    public static ServiceDependency zeroOrOne(@NonNull ServiceType<?> contract){
        return new ServiceDependency(contract, ServiceCardinality.ZERO_OR_ONE);
    }

    public static ServiceDependency zeroOrMore(@NonNull Class<?> contract){
        return zeroOrMore(ServiceType.of(contract));
    }

    public static ServiceDependency zeroOrMore(@NonNull ServiceType<?> contract){
        return new ServiceDependency(contract, ServiceCardinality.ZERO_OR_MORE);
    }

    @Override
    public String toString() {
        return contract.getName() + "[" + cardinality + "]";
    }
}
