package dtm.servicekit.storage.lazy;

import dtm.servicekit.core.ServiceProvider;
import dtm.servicekit.core.ServiceScope;
import dtm.servicekit.exceptions.LazyDependencyException;
import dtm.servicekit.exceptions.MissingRequiredServiceException;
import dtm.servicekit.fixtures.*;
import dtm.servicekit.prototypes.LazyDependency;
import dtm.servicekit.prototypes.ServiceDependency;
import dtm.servicekit.prototypes.ServiceDescriptor;
import dtm.servicekit.prototypes.ServiceType;
import dtm.servicekit.storage.ServiceCollection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static dtm.servicekit.fixtures.Descriptors.*;
import static dtm.servicekit.prototypes.ServiceLifetime.*;
import static org.junit.jupiter.api.Assertions.*;

class LazyTest {

    @Nested
    @DisplayName("Memorização")
    class MemoizationTests {

        @Test
        @DisplayName("A função não é chamada na construção e é chamada no máximo uma vez")
        void thunkRunsAtMostOnce() {
            AtomicInteger calls = new AtomicInteger();
            LazyDependency<String> lazy = Lazy.of(() -> "value-" + calls.incrementAndGet());

            assertEquals(0, calls.get());
            assertFalse(lazy.isResolved());

            assertEquals("value-1", lazy.get());
            assertEquals("value-1", lazy.get());
            assertEquals(1, calls.get());
            assertTrue(lazy.isResolved());
        }

        @Test
        @DisplayName("A ausência de valor também é memorizada")
        void absenceIsMemoized() {
            AtomicInteger calls = new AtomicInteger();
            LazyDependency<String> lazy = Lazy.of(() -> {
                calls.incrementAndGet();
                return null;
            });

            assertFalse(lazy.isPresent());
            assertNull(lazy.get());
            assertEquals(1, calls.get());
        }

        @Test
        @DisplayName("require falha quando não há valor")
        void requireFailsWithoutValue() {
            LazyDependency<String> lazy = Lazy.empty();

            assertTrue(lazy.isResolved());
            assertThrows(LazyDependencyException.class, lazy::require);
            assertThrows(IllegalArgumentException.class, () -> lazy.require(IllegalArgumentException::new));
        }

        @Test
        @DisplayName("init cria uma dependência já resolvida")
        void initIsResolved() {
            LazyDependency<String> lazy = Lazy.init("ready");

            assertTrue(lazy.isResolved());
            assertEquals("ready", lazy.require());
        }
    }

    @Nested
    @DisplayName("Resolução pelo provider")
    class ResolverTests {

        @Test
        @DisplayName("exactlyOne adia a resolução até o primeiro acesso")
        void exactlyOneDefersResolution() {
            int before = FooImpl.CREATED.get();
            ServiceProvider provider = new ServiceCollection().add(foo(TRANSIENT)).build();

            LazyDependency<Foo> lazy = Lazy.exactlyOne(provider, Foo.class);
            assertEquals(before, FooImpl.CREATED.get());

            Foo first = lazy.get();
            assertSame(first, lazy.get());
            assertEquals(before + 1, FooImpl.CREATED.get());
        }

        @Test
        @DisplayName("exactlyOne sinaliza serviço ausente no primeiro acesso")
        void exactlyOneFailsOnAccess() {
            ServiceProvider provider = new ServiceCollection().build();

            LazyDependency<Foo> lazy = Lazy.exactlyOne(provider, Foo.class);

            assertThrows(MissingRequiredServiceException.class, lazy::get);
        }

        @Test
        @DisplayName("zeroOrOne tolera ausência")
        void zeroOrOneToleratesAbsence() {
            ServiceProvider provider = new ServiceCollection().build();

            assertFalse(Lazy.zeroOrOne(provider, Foo.class).isPresent());
        }

        @Test
        @DisplayName("zeroOrMore resolve todos os registros em ordem")
        void zeroOrMoreResolvesAll() {
            ServiceProvider provider = new ServiceCollection()
                    .add(greeter(SINGLETON, "Hello"))
                    .add(greeter(SINGLETON, "Hi"))
                    .build();

            LazyDependency<List<Greeter>> lazy = Lazy.zeroOrMore(provider, Greeter.class);

            assertEquals(2, lazy.require().size());
            assertEquals("Hi, Ana", lazy.require().get(1).greet("Ana"));
        }

        @Test
        @DisplayName("A memorização não cria um novo nível de cache")
        void lifetimeStillGovernsInstances() {
            ServiceProvider provider = new ServiceCollection().add(foo(SCOPED)).build();

            try (ServiceScope scope1 = provider.createScope(); ServiceScope scope2 = provider.createScope()) {
                Foo a = Lazy.exactlyOne(scope1, Foo.class).get();
                Foo b = Lazy.exactlyOne(scope1, Foo.class).get();
                Foo c = Lazy.exactlyOne(scope2, Foo.class).get();

                assertSame(a, b);
                assertNotSame(a, c);
            }
        }

        @Test
        @DisplayName("Serviço com dependência lazy é montado sem resolvê-la")
        void consumerWithLazyDependency() {
            AtomicInteger fooCreations = new AtomicInteger();
            ServiceProvider provider = new ServiceCollection()
                    .add(ServiceDescriptor.builder()
                            .contract(Foo.class)
                            .lifetime(SINGLETON)
                            .factory(resolver -> { fooCreations.incrementAndGet(); return new FooImpl(); })
                            .build())
                    .add(ServiceDescriptor.builder()
                            .contract(Bar.class)
                            .lifetime(TRANSIENT)
                            .factory(resolver -> {
                                LazyDependency<Foo> foo = Lazy.exactlyOne(resolver, Foo.class);
                                return (Bar) foo::require;
                            })
                            .dependency(ServiceDependency.exactlyOne(Foo.class))
                            .build())
                    .build();

            Bar bar = provider.getRequired(Bar.class);
            assertEquals(0, fooCreations.get());

            assertEquals("Bar -> Foo", bar.echo());
            assertEquals(1, fooCreations.get());
        }
    }

    @Nested
    @DisplayName("Proxy lazy")
    class ProxyTests {

        @Test
        @DisplayName("O proxy resolve o contrato na primeira chamada e delega as seguintes")
        void proxyResolvesOnFirstCall() {
            AtomicInteger creations = new AtomicInteger();
            ServiceProvider provider = new ServiceCollection()
                    .add(ServiceDescriptor.builder()
                            .contract(Greeter.class)
                            .implementationType(NamedGreeter.class)
                            .lifetime(TRANSIENT)
                            .factory(resolver -> { creations.incrementAndGet(); return new NamedGreeter("Hello"); })
                            .build())
                    .build();

            Greeter greeter = Lazy.proxy(provider, Greeter.class);
            assertEquals(0, creations.get());

            assertEquals("Hello, Ana", greeter.greet("Ana"));
            assertEquals("Hello, Bia", greeter.greet("Bia"));
            assertEquals(1, creations.get());
        }

        @Test
        @DisplayName("Exceções do serviço chegam sem embrulho ao chamador")
        void proxyUnwrapsTargetExceptions() {
            ServiceProvider provider = new ServiceCollection().add(greeter(SINGLETON, "Hello")).build();

            Greeter greeter = Lazy.proxy(provider, Greeter.class);

            IllegalArgumentException exception =
                    assertThrows(IllegalArgumentException.class, () -> greeter.greet(" "));
            assertEquals("name must not be blank", exception.getMessage());
        }

        @Test
        @DisplayName("Métodos default também são delegados")
        void proxyDelegatesDefaultMethods() {
            ServiceProvider provider = new ServiceCollection()
                    .add(foo(SINGLETON))
                    .add(bar(SINGLETON))
                    .build();

            Bar bar = Lazy.proxy(provider, Bar.class);

            assertEquals("Bar -> Foo", bar.echo());
            assertSame(provider.getRequired(Foo.class), bar.foo());
        }

        @Test
        @DisplayName("Interfaces do JDK também podem ser atendidas por proxy")
        void proxyImplementsJdkInterface() {
            AtomicInteger runs = new AtomicInteger();
            ServiceProvider provider = new ServiceCollection()
                    .add(ServiceDescriptor.builder()
                            .contract(Runnable.class)
                            .lifetime(SINGLETON)
                            .factory(resolver -> (Runnable) runs::incrementAndGet)
                            .build())
                    .build();

            Runnable task = Lazy.proxy(provider, Runnable.class);
            task.run();
            task.run();

            assertEquals(2, runs.get());
        }

        @Test
        @DisplayName("O proxy resolve a parametrização exata de um contrato genérico")
        void proxyResolvesGenericContract() {
            ServiceType<Pair<String, String>> strings = new ServiceType<Pair<String, String>>() {};
            ServiceProvider provider = new ServiceCollection()
                    .add(ServiceDescriptor.builder()
                            .contract(strings)
                            .lifetime(SINGLETON)
                            .factory(resolver -> Pair.of("left", "right"))
                            .build())
                    .add(ServiceDescriptor.builder()
                            .contract(new ServiceType<Pair<Integer, Integer>>() {})
                            .lifetime(SINGLETON)
                            .factory(resolver -> Pair.of(1, 2))
                            .build())
                    .build();

            Pair<String, String> pair = Lazy.proxy(provider, strings);

            assertEquals("left", pair.key());
            assertEquals("right", pair.value());
        }

        @Test
        @DisplayName("Contrato que não é interface é rejeitado")
        void proxyRequiresInterface() {
            ServiceProvider provider = new ServiceCollection().add(foo(SINGLETON)).build();

            assertThrows(IllegalArgumentException.class, () -> Lazy.proxy(provider, FooImpl.class));
        }
    }
}
