package dtm.servicekit.fixtures;

public record SimplePair<K, V>(K key, V value) implements Pair<K, V> {
}
