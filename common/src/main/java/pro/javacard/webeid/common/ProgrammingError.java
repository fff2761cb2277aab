package pro.javacard.webeid.common;

// Build or version defect. Never caught and retried.
public class ProgrammingError extends RuntimeException {

    private static final long serialVersionUID = -2204860519328742811L;

    public ProgrammingError(String message) {
        super(message);
    }
}
