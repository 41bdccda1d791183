package dtm.servicekit.storage.lazy;

import dtm.servicekit.exceptions.LazyDependencyException;
import dtm.servicekit.prototypes.LazyDependency;
import dtm.servicekit.prototypes.ServiceType;
import lombok.NonNull;
import net.bytebuddy.ByteBuddy;
import net.bytebuddy.dynamic.DynamicType;
import net.bytebuddy.dynamic.loading.ClassLoadingStrategy;
import net.bytebuddy.dynamic.loading.MultipleParentClassLoader;
import net.bytebuddy.implementation.MethodDelegation;
import net.bytebuddy.matcher.ElementMatchers;

import java.lang.reflect.Field;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gera, via ByteBuddy, implementações de interfaces de contrato que delegam para uma
 * {@link LazyDependency}. As classes geradas ficam em cache por interface.
 * <p>
 * A classe gerada é carregada por um loader que enxerga tanto o contrato quanto o
 * {@link LazyInterceptor}, o que permite interfaces do JDK (carregadas pelo bootstrap).
 */
final class LazyProxyFactory {

    private static final String INTERCEPTOR_FIELD = "___interceptor";
    private static final Map<Class<?>, Class<?>> proxyCache = new ConcurrentHashMap<>();

    private LazyProxyFactory() {}

    @SuppressWarnings("unchecked")
    static <T> T newProxy(@NonNull ServiceType<T> contract, @NonNull LazyDependency<? extends T> dependency) {
        Class<?> contractType = contract.getRawType();
        if(!contractType.isInterface()){
            throw new IllegalArgumentException("Proxy lazy exige um contrato interface: " + contract.getName());
        }

        try {
            Class<?> proxyClass = proxyCache.computeIfAbsent(contractType, LazyProxyFactory::createProxyClass);
            Object proxyInstance = proxyClass.getDeclaredConstructor().newInstance();
            Field interceptorField = proxyClass.getDeclaredField(INTERCEPTOR_FIELD);
            interceptorField.setAccessible(true);
            interceptorField.set(proxyInstance, new LazyInterceptor(dependency));
            return (T) proxyInstance;
        } catch (ReflectiveOperationException e) {
            throw new LazyDependencyException("Erro ao criar proxy lazy para " + contract.getName(), e);
        }
    }

    private static Class<?> createProxyClass(Class<?> contract) {
        ClassLoader classLoader = new MultipleParentClassLoader.Builder()
                .append(contract, LazyInterceptor.class)
                .build();

        try (DynamicType.Unloaded<?> unloaded = new ByteBuddy()
                .subclass(Object.class)
                .implement(contract)
                .defineField(INTERCEPTOR_FIELD, LazyInterceptor.class)
                .method(ElementMatchers.not(ElementMatchers.isDeclaredBy(Object.class)))
                .intercept(MethodDelegation.toField(INTERCEPTOR_FIELD))
                .make()) {

            return unloaded
                    .load(classLoader, ClassLoadingStrategy.Default.WRAPPER)
                    .getLoaded();
        } catch (Exception | LinkageError e) {
            throw new LazyDependencyException("Erro ao gerar classe de proxy para " + contract.getName(), e);
        }
    }
}
