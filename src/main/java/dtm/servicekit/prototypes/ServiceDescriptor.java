package dtm.servicekit.prototypes;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;

import java.util.List;

/**
 * Registro imutável de um serviço no container.
 * <p>
 * Contém o contrato resolvido pelos consumidores, o tipo da implementação,
 * o {@link ServiceLifetime}, a fábrica e as dependências declaradas.
 * Um descritor sem dependências declaradas não participa da validação do grafo.
 * <p>
 * O cache de instâncias é indexado pela identidade do descritor: registrar o mesmo
 * objeto duas vezes compartilha a mesma instância singleton/scoped.
 */
@Getter
public final class ServiceDescriptor {
    private final ServiceType<?> contract;
    private final Class<?> implementationType;
    private final ServiceLifetime lifetime;
    private final ServiceFactory<?> factory;
    private final List<ServiceDependency> dependencies;

    @Builder
    private ServiceDescriptor(
            @NonNull ServiceType<?> contract,
            Class<?> implementationType,
            @NonNull ServiceLifetime lifetime,
            @NonNull ServiceFactory<?> factory,
            @Singular List<ServiceDependency> dependencies
    ) {
        if(implementationType != null && !contract.getRawType().isAssignableFrom(implementationType)){
            throw new IllegalArgumentException(
                    implementationType.getName() + " não implementa o contrato " + contract.getName());
        }

        this.contract = contract;
        this.implementationType = implementationType != null ? implementationType : contract.getRawType();
        this.lifetime = lifetime;
        this.factory = factory;
        this.dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public boolean hasDependencies() {
        return !dependencies.isEmpty();
    }

    @Override
    public String toString() {
        return "ServiceDescriptor{" +
                "contract=" + contract.getName() +
                ", implementation=" + implementationType.getName() +
                ", lifetime=" + lifetime +
                ", dependencies=" + dependencies +
                '}';
    }

    public static class ServiceDescriptorBuilder {

        public ServiceDescriptorBuilder contract(@NonNull Class<?> contract) {
            return contract(ServiceType.of(contract));
        }

        public ServiceDescriptorBuilder contract(@NonNull ServiceType<?> contract) {
            this.contract = contract;
            return this;
        }
    }
}
