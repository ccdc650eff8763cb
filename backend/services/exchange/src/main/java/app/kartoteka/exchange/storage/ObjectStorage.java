package app.kartoteka.exchange.storage;

public interface ObjectStorage {
    void put(String key, String contentType, byte[] content);

    byte[] get(String key);

    void delete(String key);
}
