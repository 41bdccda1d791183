package dtm.servicekit.storage.lazy;

import dtm.servicekit.prototypes.LazyDependency;
import net.bytebuddy.implementation.bind.annotation.AllArguments;
import net.bytebuddy.implementation.bind.annotation.Origin;
import net.bytebuddy.implementation.bind.annotation.RuntimeType;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;

public class LazyInterceptor {
    private final LazyDependency<?> dependency;

    LazyInterceptor(LazyDependency<?> dependency){
        this.dependency = dependency;
    }

    @RuntimeType
    public Object intercept(
            @Origin Method method,
            @AllArguments Object[] args
    ) throws Throwable {
        Object target = dependency.require();
        try {
            return method.invoke(target, args);
        } catch (InvocationTargetException invocationTargetException) {
            Throwable cause = invocationTargetException.getCause();
            throw cause != null ? cause : invocationTargetException;
        }
    }
}
