package dtm.servicekit.fixtures;

public interface Foo {
    String echo();
}
