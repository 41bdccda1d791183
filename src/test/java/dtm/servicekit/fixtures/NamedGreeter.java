package dtm.servicekit.fixtures;

public class NamedGreeter implements Greeter {
    private final String greeting;

    public NamedGreeter(String greeting) {
        this.greeting = greeting;
    }

    @Override
    public String greet(String name) {
        if(name == null || name.isBlank()){
            throw new IllegalArgumentException("name must not be blank");
        }
        return greeting + ", " + name;
    }
}
