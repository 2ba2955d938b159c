public class LoadFailureException extends RuntimeException {

    public LoadFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
