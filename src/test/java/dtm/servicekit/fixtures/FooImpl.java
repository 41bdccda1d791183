package dtm.servicekit.fixtures;

import java.util.concurrent.atomic.AtomicInteger;

public class FooImpl implements Foo {
    public static final AtomicInteger CREATED = new AtomicInteger();

    public FooImpl() {
        CREATED.incrementAndGet();
    }

    @Override
    public String echo() {
        return "Foo";
    }
}
