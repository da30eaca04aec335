package dupliganger.db;

/**
 * Converts the objects of an {@link ObjectStore} to and from their stored string form.  Implementations must
 * round-trip exactly: {@code decode(encode(x))} equals {@code x}.
 *
 * @param <T> the type of object stored
 */
public interface ItemCodec<T> {
    String encode(T item);

    T decode(String stored);
}
