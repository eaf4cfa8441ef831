package app.scapin.memory.content;

public class ContentStoreException extends RuntimeException {

    public ContentStoreException(String message) {
        super(message);
    }

    public ContentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
