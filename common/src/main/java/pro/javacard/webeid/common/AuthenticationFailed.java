package pro.javacard.webeid.common;

// Terminal failure of an authentication attempt, no retry is offered.
public class AuthenticationFailed extends RuntimeException {

    private static final long serialVersionUID = 8853160940377319424L;

    public AuthenticationFailed(String message) {
        super(message);
    }
}
