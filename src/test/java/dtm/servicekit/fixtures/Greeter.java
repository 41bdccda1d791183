package dtm.servicekit.fixtures;

public interface Greeter {
    String greet(String name);
}
