package dtm.servicekit.fixtures;

import dtm.servicekit.prototypes.ServiceDependency;
import dtm.servicekit.prototypes.ServiceDescriptor;
import dtm.servicekit.prototypes.ServiceLifetime;

/**
 * Descritores usados pelos testes.
 */
public final class Descriptors {

    private Descriptors() {}

    public static ServiceDescriptor foo(ServiceLifetime lifetime) {
        return ServiceDescriptor.builder()
                .contract(Foo.class)
                .implementationType(FooImpl.class)
                .lifetime(lifetime)
                .factory(resolver -> new FooImpl())
                .build();
    }

    public static ServiceDescriptor bar(ServiceLifetime lifetime) {
        return ServiceDescriptor.builder()
                .contract(Bar.class)
                .implementationType(BarImpl.class)
                .lifetime(lifetime)
                .factory(resolver -> new BarImpl(resolver.getRequired(Foo.class)))
                .dependency(ServiceDependency.exactlyOne(Foo.class))
                .build();
    }

    public static ServiceDescriptor greeter(ServiceLifetime lifetime, String greeting) {
        return ServiceDescriptor.builder()
                .contract(Greeter.class)
                .implementationType(NamedGreeter.class)
                .lifetime(lifetime)
                .factory(resolver -> new NamedGreeter(greeting))
                .build();
    }

    /**
     * Descritor sem fábrica útil, apenas para montar grafos na validação.
     */
    public static ServiceDescriptor node(Class<?> contract, ServiceLifetime lifetime, ServiceDependency... dependencies) {
        ServiceDescriptor.ServiceDescriptorBuilder builder = ServiceDescriptor.builder()
                .contract(contract)
                .lifetime(lifetime)
                .factory(resolver -> new Object());

        for (ServiceDependency dependency : dependencies) {
            builder.dependency(dependency);
        }
        return builder.build();
    }
}
