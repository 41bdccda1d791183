package dtm.servicekit.prototypes;

import lombok.NonNull;

import java.lang.reflect.*;

/**
 * Chave de contrato. Guarda o {@link Type} completo, então cada parametrização de um
 * contrato genérico é um contrato distinto: {@code Pair<String, String>} e
 * {@code Pair<Integer, Integer>} não compartilham descritores.
 * <p>
 * Contratos simples usam {@link #of(Class)}; contratos parametrizados são capturados
 * por uma subclasse anônima:
 * <pre>{@code
 * ServiceType<Pair<String, String>> key = new ServiceType<Pair<String, String>>() {};
 * }</pre>
 *
 * @param <T> tipo do contrato
 */
public class ServiceType<T> {
    private final Type type;
    private final Class<? super T> rawType;

    @SuppressWarnings("unchecked")
    protected ServiceType() {
        Type superclass = getClass().getGenericSuperclass();
        if(!(superclass instanceof ParameterizedType parameterized)){
            throw new IllegalStateException("ServiceType sem argumento de tipo; use new ServiceType<Contrato>() {}");
        }
        this.type = parameterized.getActualTypeArguments()[0];
        this.rawType = (Class<? super T>) rawTypeOf(type);
    }

    @SuppressWarnings("unchecked")
    private ServiceType(Type type) {
        this.type = type;
        this.rawType = (Class<? super T>) rawTypeOf(type);
    }

    public static <T> ServiceType<T> of(@NonNull Class<T> contract) {
        return new ServiceType<>(contract);
    }

    public static ServiceType<?> of(@NonNull Type contract) {
        return new ServiceType<>(contract);
    }

    public Type getType() {
        return type;
    }

    public Class<? super T> getRawType() {
        return rawType;
    }

    public boolean isInstance(Object instance) {
        return rawType.isInstance(instance);
    }

    public String getName() {
        return type.getTypeName();
    }

    public String getSimpleName() {
        if(type instanceof Class<?> clazz){
            return clazz.getSimpleName();
        }
        return type.getTypeName().replaceAll("(\\w+\\.)+", "");
    }

    private static Class<?> rawTypeOf(Type type) {
        if(type instanceof Class<?> clazz){
            return clazz;
        }
        if(type instanceof ParameterizedType parameterized){
            for (Type argument : parameterized.getActualTypeArguments()) {
                if(argument instanceof TypeVariable<?>){
                    throw new IllegalArgumentException("Contrato com variável de tipo não resolvida: " + type.getTypeName());
                }
            }
            return rawTypeOf(parameterized.getRawType());
        }
        if(type instanceof GenericArrayType array){
            return Array.newInstance(rawTypeOf(array.getGenericComponentType()), 0).getClass();
        }
        throw new IllegalArgumentException("Contrato deve ser um tipo concreto: " + type.getTypeName());
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof ServiceType<?> other)) return false;
        return type.equals(other.type);
    }

    @Override
    public int hashCode() {
        return type.hashCode();
    }

    @Override
    public String toString() {
        return getName();
    }
}
