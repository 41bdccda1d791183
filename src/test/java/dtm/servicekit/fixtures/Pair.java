package dtm.servicekit.fixtures;

/**
 * Contrato genérico: cada parametrização é registrada e resolvida separadamente.
 */
public interface Pair<K, V> {

    K key();

    V value();

    static <K, V> Pair<K, V> of(K key, V value) {
        return new SimplePair<>(key, value);
    }
}
