package dtm.servicekit.storage.graph;

import dtm.servicekit.prototypes.ServiceDependency;
import dtm.servicekit.prototypes.ServiceDescriptor;
import dtm.servicekit.prototypes.ServiceType;
import lombok.Getter;

import java.util.*;

/**
 * Grafo dirigido de contratos. Os nós são os contratos registrados e os declarados
 * como dependência; as arestas vão do contrato de um descritor para cada contrato
 * que ele declara.
 */
@Getter
public class ServiceGraph {

    private final Map<ServiceType<?>, List<ServiceDescriptor>> descriptorsByContract;
    private final Map<ServiceType<?>, Set<ServiceType<?>>> edges;

    private ServiceGraph(Map<ServiceType<?>, List<ServiceDescriptor>> descriptorsByContract, Map<ServiceType<?>, Set<ServiceType<?>>> edges) {
        this.descriptorsByContract = descriptorsByContract;
        this.edges = edges;
    }

    public static ServiceGraph of(Iterable<ServiceDescriptor> descriptors) {
        Map<ServiceType<?>, List<ServiceDescriptor>> byContract = new LinkedHashMap<>();
        Map<ServiceType<?>, Set<ServiceType<?>>> edges = new LinkedHashMap<>();

        for (ServiceDescriptor descriptor : descriptors) {
            byContract.computeIfAbsent(descriptor.getContract(), k -> new ArrayList<>()).add(descriptor);
            Set<ServiceType<?>> targets = edges.computeIfAbsent(descriptor.getContract(), k -> new LinkedHashSet<>());

            for (ServiceDependency dependency : descriptor.getDependencies()) {
                targets.add(dependency.getContract());
                edges.computeIfAbsent(dependency.getContract(), k -> new LinkedHashSet<>());
            }
        }

        return new ServiceGraph(byContract, edges);
    }

    public Set<ServiceType<?>> getNodes() {
        return edges.keySet();
    }

    public Set<ServiceType<?>> getDependenciesOf(ServiceType<?> contract) {
        return edges.getOrDefault(contract, Collections.emptySet());
    }

    public List<ServiceDescriptor> getDescriptors(ServiceType<?> contract) {
        return descriptorsByContract.getOrDefault(contract, Collections.emptyList());
    }

    public boolean isRegistered(ServiceType<?> contract) {
        return descriptorsByContract.containsKey(contract);
    }
}
