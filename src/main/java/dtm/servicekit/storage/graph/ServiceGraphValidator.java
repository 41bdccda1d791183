package dtm.servicekit.storage.graph;

import dtm.servicekit.exceptions.ServiceValidationException;
import dtm.servicekit.exceptions.validation.CapturedDependencyError;
import dtm.servicekit.exceptions.validation.CircularDependencyError;
import dtm.servicekit.exceptions.validation.UnregisteredDependencyError;
import dtm.servicekit.exceptions.validation.ValidationError;
import dtm.servicekit.prototypes.ServiceDependency;
import dtm.servicekit.prototypes.ServiceDescriptor;
import dtm.servicekit.prototypes.ServiceLifetime;
import dtm.servicekit.prototypes.ServiceType;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Análise estática do grafo de dependências.
 * <p>
 * Executa as três verificações (dependência não registrada, dependência circular e
 * captura de scoped por singleton) e acumula todas as falhas antes de retornar.
 */
@Slf4j
public class ServiceGraphValidator {

    private enum Color { UNVISITED, IN_PROGRESS, DONE }

    private record Frame(ServiceType<?> node, Iterator<ServiceType<?>> pending) {}

    private final ServiceGraph graph;

    public ServiceGraphValidator(@NonNull ServiceGraph graph) {
        this.graph = graph;
    }

    public static List<ValidationError> findErrors(@NonNull Iterable<ServiceDescriptor> descriptors) {
        return new ServiceGraphValidator(ServiceGraph.of(descriptors)).findErrors();
    }

    public static void validate(@NonNull Iterable<ServiceDescriptor> descriptors) throws ServiceValidationException {
        List<ValidationError> errors = findErrors(descriptors);
        if (!errors.isEmpty()) {
            throw new ServiceValidationException(errors);
        }
    }

    public List<ValidationError> findErrors() {
        Set<ValidationError> errors = new LinkedHashSet<>();

        findUnregisteredDependencies(errors);
        findCircularDependencies(errors);
        findCapturedDependencies(errors);

        if (!errors.isEmpty()) {
            logErrors(errors);
        }

        return List.copyOf(errors);
    }

    private void findUnregisteredDependencies(Set<ValidationError> errors) {
        for (List<ServiceDescriptor> descriptors : graph.getDescriptorsByContract().values()) {
            for (ServiceDescriptor descriptor : descriptors) {
                for (ServiceDependency dependency : descriptor.getDependencies()) {
                    if (dependency.getCardinality().isOptional()) continue;

                    if (!graph.isRegistered(dependency.getContract())) {
                        errors.add(new UnregisteredDependencyError(descriptor.getContract(), dependency.getContract()));
                    }
                }
            }
        }
    }

    private void findCircularDependencies(Set<ValidationError> errors) {
        Map<ServiceType<?>, Color> colors = new HashMap<>();

        for (ServiceType<?> node : graph.getNodes()) {
            if (colors.getOrDefault(node, Color.UNVISITED) == Color.UNVISITED) {
                visit(node, colors, errors);
            }
        }
    }

    // DFS com pilha explícita: cadeias longas não podem estourar a pilha de chamadas.
    private void visit(ServiceType<?> root, Map<ServiceType<?>, Color> colors, Set<ValidationError> errors) {
        Deque<Frame> stack = new ArrayDeque<>();
        Deque<ServiceType<?>> path = new ArrayDeque<>();

        enter(root, colors, path, stack);

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();

            if (!frame.pending().hasNext()) {
                stack.pop();
                path.removeLast();
                colors.put(frame.node(), Color.DONE);
                continue;
            }

            ServiceType<?> dependency = frame.pending().next();
            Color color = colors.getOrDefault(dependency, Color.UNVISITED);

            if (color == Color.IN_PROGRESS) {
                errors.add(new CircularDependencyError(cyclePath(path, dependency)));
            } else if (color == Color.UNVISITED) {
                enter(dependency, colors, path, stack);
            }
        }
    }

    private void enter(ServiceType<?> node, Map<ServiceType<?>, Color> colors, Deque<ServiceType<?>> path, Deque<Frame> stack) {
        colors.put(node, Color.IN_PROGRESS);
        path.addLast(node);
        stack.push(new Frame(node, graph.getDependenciesOf(node).iterator()));
    }

    private List<ServiceType<?>> cyclePath(Deque<ServiceType<?>> path, ServiceType<?> closing) {
        List<ServiceType<?>> cycle = new ArrayList<>();
        boolean inCycle = false;

        for (ServiceType<?> contract : path) {
            if (contract.equals(closing)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(contract);
            }
        }

        cycle.add(closing);
        return cycle;
    }

    // Desce apenas por singletons: qualquer scoped alcançado fica preso ao singleton de origem.
    private void findCapturedDependencies(Set<ValidationError> errors) {
        for (List<ServiceDescriptor> descriptors : graph.getDescriptorsByContract().values()) {
            for (ServiceDescriptor descriptor : descriptors) {
                if (descriptor.getLifetime() != ServiceLifetime.SINGLETON || !descriptor.hasDependencies()) continue;

                Set<ServiceDescriptor> visited = Collections.newSetFromMap(new IdentityHashMap<>());
                Deque<ServiceDescriptor> pending = new ArrayDeque<>();
                visited.add(descriptor);
                pending.push(descriptor);

                while (!pending.isEmpty()) {
                    ServiceDescriptor current = pending.pop();

                    for (ServiceDependency dependency : current.getDependencies()) {
                        for (ServiceDescriptor target : graph.getDescriptors(dependency.getContract())) {
                            if (target.getLifetime() == ServiceLifetime.SCOPED) {
                                errors.add(new CapturedDependencyError(descriptor.getContract(), target.getContract()));
                            } else if (target.getLifetime() == ServiceLifetime.SINGLETON && visited.add(target)) {
                                pending.push(target);
                            }
                        }
                    }
                }
            }
        }
    }

    private void logErrors(Set<ValidationError> errors) {
        for (ValidationError error : errors) {
            log.error("Falha de validação [{}]: {}", error.getClass().getSimpleName(), error.getMessage());

            if (error instanceof CircularDependencyError circular) {
                String linearCycle = circular.getPath().stream()
                        .map(ServiceType::getSimpleName)
                        .collect(Collectors.joining(" → "));
                log.error("  Caminho: {} ⟲", linearCycle);
            }
        }
    }
}
